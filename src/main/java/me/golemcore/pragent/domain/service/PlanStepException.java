package me.golemcore.pragent.domain.service;

import me.golemcore.pragent.domain.model.PlanStep;

/**
 * A plan step failed fatally; the plan halts at this step.
 */
public class PlanStepException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final PlanStep.StepId stepId;

    public PlanStepException(PlanStep.StepId stepId, String message, Throwable cause) {
        super(message, cause);
        this.stepId = stepId;
    }

    public PlanStep.StepId getStepId() {
        return stepId;
    }
}
