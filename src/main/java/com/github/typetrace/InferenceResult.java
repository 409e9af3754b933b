package com.github.typetrace;

import java.util.List;
import java.util.Optional;

import com.github.typetrace.parser.SyntaxTree;
import com.github.typetrace.parser.TraceEvent;

/**
 * Outcome of {@link TypeTracer#infer}. Exactly one of {@code type} and {@code error} is
 * present; {@code tree} is absent only when tokenizing or parsing failed.
 */
public record InferenceResult(
        Optional<SyntaxTree> tree,
        Optional<String> type,
        Optional<InferenceException> error,
        List<TraceEvent> trace) {

    public static InferenceResult success(SyntaxTree tree, String type, List<TraceEvent> trace) {
        return new InferenceResult(Optional.of(tree), Optional.of(type), Optional.empty(), trace);
    }

    public static InferenceResult failure(Optional<SyntaxTree> tree, InferenceException error, List<TraceEvent> trace) {
        return new InferenceResult(tree, Optional.empty(), Optional.of(error), trace);
    }

    public boolean succeeded() {
        return type.isPresent();
    }

    public String describe() {
        return type.orElseGet(() -> error.get().describe());
    }
}
