package com.github.typetrace.parser;

import java.util.List;
import java.util.Optional;

import com.github.typetrace.parser.SyntaxTree.NodeId;
import com.github.typetrace.parser.TypeVariables.TypeBinding;

/**
 * One step of an inference run, together with the state of every type variable
 * allocated so far at the moment the step was recorded.
 */
public record TraceEvent(String message, Category category, List<TypeBinding> snapshot, Optional<NodeId> node) {

    public enum Category {
        INFO,
        SUCCESS,
        WARN,
        ERROR,
        AST
    }

    @Override
    public String toString() {
        return "[" + category + "] " + message + node.map(n -> " " + n).orElse("");
    }
}
