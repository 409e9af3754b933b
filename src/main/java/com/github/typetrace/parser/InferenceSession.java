package com.github.typetrace.parser;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Everything one inference run mutates. A session is created per run and thrown away
 * afterwards, so variable names restart at {@code T0} and no binding survives into
 * the next run.
 */
@Accessors(fluent = true)
@Getter
public class InferenceSession {

    private final TypeVariables typeVariables;
    private final Trace trace;
    private final Unifier unifier;

    public InferenceSession() {
        this(TypeVariables.DEFAULT_PLACEHOLDER);
    }

    public InferenceSession(String placeholder) {
        this.typeVariables = new TypeVariables(placeholder);
        this.trace = new Trace(typeVariables);
        this.unifier = new Unifier(typeVariables, trace);
    }

    /** Infers the type of the whole tree in an empty environment. */
    public Type analyze(SyntaxTree tree) {
        return new AstTyper(this).typeExpression(tree.root(), Environment.empty());
    }
}
