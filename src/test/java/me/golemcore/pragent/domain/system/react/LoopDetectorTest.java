package me.golemcore.pragent.domain.system.react;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LoopDetectorTest {

    @Test
    void shouldFlagThirdConsecutiveIdenticalBatch() {
        LoopDetector detector = new LoopDetector(2);

        assertFalse(detector.observe("read_file:{}").loop());
        assertFalse(detector.observe("read_file:{}").loop());
        LoopDetector.Verdict third = detector.observe("read_file:{}");

        assertTrue(third.loop());
        assertEquals(3, third.occurrences());
    }

    @Test
    void shouldResetAfterFlaggingLoop() {
        LoopDetector detector = new LoopDetector(2);
        detector.observe("a");
        detector.observe("a");
        detector.observe("a");

        assertFalse(detector.observe("a").loop());
        assertFalse(detector.observe("a").loop());
        assertTrue(detector.observe("a").loop());
    }

    @Test
    void shouldResetCountWhenBatchChanges() {
        LoopDetector detector = new LoopDetector(2);
        detector.observe("a");
        detector.observe("a");

        assertFalse(detector.observe("b").loop());
        assertFalse(detector.observe("a").loop());
        assertEquals(2, detector.observe("a").occurrences());
    }
}
