package com.github.typetrace;

import lombok.Getter;
import lombok.experimental.Accessors;

public class LexException extends InferenceException {

    @Accessors(fluent = true)
    @Getter
    private final int offset;

    public LexException(char character, int offset) {
        super("unrecognized character '" + character + "' at offset " + offset);
        this.offset = offset;
    }

    @Override
    public String kind() {
        return "LexError";
    }
}
