package com.github.typetrace.parser;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;

/**
 * Lexical scope mapping names to types. Scopes are never modified; {@link #extend} returns
 * a child scope in which the new binding shadows any outer one of the same name.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class Environment {

    private static final Environment EMPTY = new Environment(null, null, null);

    private final Environment parentScope;
    private final String name;
    private final Type type;

    public static Environment empty() {
        return EMPTY;
    }

    public Environment extend(String name, Type type) {
        return new Environment(this, name, type);
    }

    public Optional<Type> lookup(String name) {
        for (var scope = this; scope.parentScope != null; scope = scope.parentScope) {
            if (scope.name.equals(name)) {
                return Optional.of(scope.type);
            }
        }
        return Optional.empty();
    }

    /** Visible bindings, innermost first. */
    public Map<String, Type> visible() {
        Map<String, Type> visible = new LinkedHashMap<>();
        for (var scope = this; scope.parentScope != null; scope = scope.parentScope) {
            visible.putIfAbsent(scope.name, scope.type);
        }
        return visible;
    }

    @Override
    public String toString() {
        return "Environment" + visible();
    }
}
