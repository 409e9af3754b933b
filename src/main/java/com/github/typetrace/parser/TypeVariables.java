package com.github.typetrace.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.github.typetrace.parser.Type.Arrow;
import com.github.typetrace.parser.Type.ListType;
import com.github.typetrace.parser.Type.Primitive;
import com.github.typetrace.parser.Type.Variable;

import lombok.RequiredArgsConstructor;

/**
 * Arena holding the type variables of a single inference run. A variable's handle indexes
 * {@link #instances}; a {@code null} slot means the variable is still unbound.
 */
@RequiredArgsConstructor
public class TypeVariables {

    public static final String DEFAULT_PLACEHOLDER = "?";

    private final List<Variable> variables = new ArrayList<>();
    private final List<Type> instances = new ArrayList<>();

    private final String placeholder;

    public TypeVariables() {
        this(DEFAULT_PLACEHOLDER);
    }

    public Variable fresh() {
        var variable = new Variable(variables.size(), "T" + variables.size());
        variables.add(variable);
        instances.add(null);
        return variable;
    }

    public List<Variable> variables() {
        return Collections.unmodifiableList(variables);
    }

    public Optional<Type> instance(Variable variable) {
        return Optional.ofNullable(instances.get(owned(variable)));
    }

    public boolean isBound(Variable variable) {
        return instances.get(owned(variable)) != null;
    }

    /** Binds an unbound variable. Bindings are never replaced. */
    public void bind(Variable variable, Type type) {
        int handle = owned(variable);
        if (instances.get(handle) != null) {
            throw new IllegalStateException(variable + " is already bound to " + show(instances.get(handle)));
        }
        instances.set(handle, type);
    }

    /**
     * Follows the chain of bound variables starting at {@code type} and returns the first type
     * that is not a bound variable. Every variable passed on the way is pointed straight at
     * that result.
     */
    public Type prune(Type type) {
        List<Variable> visited = new ArrayList<>();
        Type current = type;
        while (current instanceof Variable v && instances.get(owned(v)) != null) {
            visited.add(v);
            current = instances.get(v.handle());
        }
        for (var v : visited) {
            instances.set(v.handle(), current);
        }
        return current;
    }

    public boolean occurs(Variable variable, Type type) {
        var t = prune(type);
        if (t.equals(variable)) {
            return true;
        }
        if (t instanceof Arrow a) {
            return occurs(variable, a.parameter()) || occurs(variable, a.result());
        }
        if (t instanceof ListType l) {
            return occurs(variable, l.element());
        }
        return false;
    }

    /** Renders {@code type} with every bound variable replaced by what it stands for. */
    public String show(Type type) {
        var t = prune(type);
        if (t instanceof Primitive || t instanceof Variable) {
            return t.toString();
        }
        if (t instanceof Arrow a) {
            var parameter = prune(a.parameter());
            var left = parameter instanceof Arrow ? "(" + show(parameter) + ")" : show(parameter);
            return left + " -> " + show(a.result());
        }
        return "[" + show(((ListType) t).element()) + "]";
    }

    public List<TypeBinding> snapshot() {
        List<TypeBinding> bindings = new ArrayList<>(variables.size());
        for (var v : variables) {
            bindings.add(new TypeBinding(v.name(), isBound(v) ? show(v) : placeholder));
        }
        return List.copyOf(bindings);
    }

    private int owned(Variable variable) {
        int handle = variable.handle();
        if (handle < 0 || handle >= variables.size() || !variables.get(handle).equals(variable)) {
            throw new IllegalArgumentException(variable + " does not belong to this run");
        }
        return handle;
    }

    public record TypeBinding(String name, String value) {}

}
