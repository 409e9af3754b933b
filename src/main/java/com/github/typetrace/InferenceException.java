package com.github.typetrace;

/**
 * Base of every failure an inference run can report to its caller.
 * A run stops at the first one; {@link #kind()} is the name shown to users.
 */
public abstract class InferenceException extends RuntimeException {

    protected InferenceException(String message) {
        super(message);
    }

    public abstract String kind();

    public String describe() {
        return kind() + ": " + getMessage();
    }
}
