package com.github.typetrace;

import com.github.typetrace.Tokenizer.Token;

import lombok.Getter;
import lombok.experimental.Accessors;

public class SyntaxException extends InferenceException {

    @Accessors(fluent = true)
    @Getter
    private final String expected;
    @Accessors(fluent = true)
    @Getter
    private final Token found;

    public SyntaxException(String expected, Token found) {
        super("expected " + expected + " but found " + found.describe());
        this.expected = expected;
        this.found = found;
    }

    @Override
    public String kind() {
        return "SyntaxError";
    }
}
