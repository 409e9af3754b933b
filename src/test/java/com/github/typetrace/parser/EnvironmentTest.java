package com.github.typetrace.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

public class EnvironmentTest {

    @Test
    public void emptyHasNoBindings() {
        assertTrue(Environment.empty().lookup("x").isEmpty());
        assertTrue(Environment.empty().visible().isEmpty());
    }

    @Test
    public void extendingLeavesTheParentUntouched() {
        var outer = Environment.empty().extend("x", Type.INT);
        var inner = outer.extend("y", Type.BOOL);

        assertEquals(Type.BOOL, inner.lookup("y").get());
        assertEquals(Type.INT, inner.lookup("x").get());
        assertTrue(outer.lookup("y").isEmpty());
    }

    @Test
    public void innerBindingShadowsOuter() {
        var outer = Environment.empty().extend("x", Type.INT);
        var inner = outer.extend("x", Type.BOOL);

        assertEquals(Type.BOOL, inner.lookup("x").get());
        assertEquals(Type.INT, outer.lookup("x").get());
        assertEquals(List.of("x"), List.copyOf(inner.visible().keySet()));
        assertEquals(Type.BOOL, inner.visible().get("x"));
    }

}
