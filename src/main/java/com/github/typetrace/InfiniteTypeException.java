package com.github.typetrace;

/** Occurs check failure: binding the variable would produce an infinite type. */
public class InfiniteTypeException extends InferenceException {

    public InfiniteTypeException(String variable, String type) {
        super(variable + " occurs in " + type);
    }

    @Override
    public String kind() {
        return "InfiniteTypeError";
    }
}
