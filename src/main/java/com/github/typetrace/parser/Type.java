package com.github.typetrace.parser;

/**
 * Types as produced by inference. Instances are immutable; what a {@link Variable} stands for
 * is kept in the {@link TypeVariables} arena of the run that allocated it, so rendering or
 * comparing a type only makes sense against that arena.
 */
public sealed interface Type permits Type.Primitive, Type.Variable, Type.Arrow, Type.ListType {

    Primitive INT = Primitive.INT;
    Primitive BOOL = Primitive.BOOL;

    enum Primitive implements Type {
        INT("Int"),
        BOOL("Bool");

        private final String display;

        Primitive(String display) {
            this.display = display;
        }

        @Override
        public String toString() {
            return display;
        }
    }

    /** Handle into the arena; {@code name} is only a label like {@code T0}. */
    record Variable(int handle, String name) implements Type {
        @Override
        public String toString() {
            return name;
        }
    }

    record Arrow(Type parameter, Type result) implements Type {}

    record ListType(Type element) implements Type {}

}
