package me.golemcore.pragent.domain.service;

/**
 * A single generation attempt was rejected. The message is fed back to the
 * model on the next attempt.
 */
public class ChangeSetRejectedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ChangeSetRejectedException(String message) {
        super(message);
    }
}
