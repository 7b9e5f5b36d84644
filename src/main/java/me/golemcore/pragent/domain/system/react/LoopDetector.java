package me.golemcore.pragent.domain.system.react;

/**
 * Counts consecutive identical tool-call batches.
 *
 * <p>
 * The first occurrence of a signature sets the counter to zero and each
 * identical follow-up increments it. Once it reaches the threshold, a loop is
 * reported and the detector starts over.
 */
class LoopDetector {

    private final int maxRepeatedCalls;

    private String lastSignature = "";
    private int repeatCount;

    LoopDetector(int maxRepeatedCalls) {
        this.maxRepeatedCalls = maxRepeatedCalls;
    }

    Verdict observe(String signature) {
        if (signature.equals(lastSignature)) {
            repeatCount++;
        } else {
            repeatCount = 0;
            lastSignature = signature;
        }

        if (repeatCount >= maxRepeatedCalls) {
            int occurrences = repeatCount + 1;
            repeatCount = 0;
            lastSignature = "";
            return new Verdict(true, occurrences);
        }
        return new Verdict(false, repeatCount + 1);
    }

    /**
     * @param occurrences
     *            consecutive identical batches seen, including this one
     */
    record Verdict(boolean loop, int occurrences) {
    }
}
