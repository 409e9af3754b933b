package com.github.typetrace;

import lombok.Getter;
import lombok.experimental.Accessors;

public class UndefinedVariableException extends InferenceException {

    @Accessors(fluent = true)
    @Getter
    private final String name;

    public UndefinedVariableException(String name) {
        super("variable '" + name + "' is not defined");
        this.name = name;
    }

    @Override
    public String kind() {
        return "UndefinedVariableError";
    }
}
