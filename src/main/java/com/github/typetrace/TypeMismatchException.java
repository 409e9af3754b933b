package com.github.typetrace;

public class TypeMismatchException extends InferenceException {

    public TypeMismatchException(String left, String right) {
        super("cannot unify " + left + " with " + right);
    }

    @Override
    public String kind() {
        return "TypeMismatchError";
    }
}
