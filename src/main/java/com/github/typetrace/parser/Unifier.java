package com.github.typetrace.parser;

import com.github.typetrace.InfiniteTypeException;
import com.github.typetrace.TypeMismatchException;
import com.github.typetrace.parser.SyntaxTree.NodeId;
import com.github.typetrace.parser.TraceEvent.Category;
import com.github.typetrace.parser.Type.Arrow;
import com.github.typetrace.parser.Type.ListType;
import com.github.typetrace.parser.Type.Variable;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class Unifier {

    private final TypeVariables typeVariables;
    private final Trace trace;

    /**
     * Makes {@code a} and {@code b} equal by binding type variables, recording each binding.
     *
     * @param reason why the two types have to agree, shown next to every binding made
     * @param node   node whose analysis required the constraint
     * @throws InfiniteTypeException if a variable would have to contain itself
     * @throws TypeMismatchException if the two types have different shapes
     */
    public void unify(Type a, Type b, String reason, NodeId node) {
        var left = typeVariables.prune(a);
        var right = typeVariables.prune(b);

        if (left.equals(right)) {
            return;
        }
        if (left instanceof Variable v) {
            bind(v, right, reason, node);
        } else if (right instanceof Variable) {
            unify(right, left, reason, node);
        } else if (left instanceof Arrow la && right instanceof Arrow ra) {
            unify(la.parameter(), ra.parameter(), "function parameter", node);
            unify(la.result(), ra.result(), "function result", node);
        } else if (left instanceof ListType ll && right instanceof ListType rl) {
            unify(ll.element(), rl.element(), "list element", node);
        } else {
            // distinct primitives or distinct constructors
            throw new TypeMismatchException(typeVariables.show(left), typeVariables.show(right));
        }
    }

    private void bind(Variable variable, Type type, String reason, NodeId node) {
        if (typeVariables.occurs(variable, type)) {
            throw new InfiniteTypeException(variable.name(), typeVariables.show(type));
        }
        typeVariables.bind(variable, type);
        trace.emit("UNIFY: " + variable.name() + " := " + typeVariables.show(type) + " (" + reason + ")",
                Category.SUCCESS, node);
    }
}
