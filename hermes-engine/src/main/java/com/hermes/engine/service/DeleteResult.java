package com.hermes.engine.service;

/**
 * Outcome of a delete request. A declined delete is a successful answer,
 * not an error: nothing was removed and {@link #message()} says why.
 */
public record DeleteResult(
    Outcome outcome,
    String message
) {
    public enum Outcome {
        DELETED,
        DECLINED
    }

    public static DeleteResult deleted(String message) {
        return new DeleteResult(Outcome.DELETED, message);
    }

    public static DeleteResult declined(String message) {
        return new DeleteResult(Outcome.DECLINED, message);
    }

    public boolean performed() {
        return outcome == Outcome.DELETED;
    }
}
