package com.github.typetrace.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.github.typetrace.InfiniteTypeException;
import com.github.typetrace.TypeMismatchException;
import com.github.typetrace.parser.SyntaxTree.NodeId;
import com.github.typetrace.parser.TraceEvent.Category;
import com.github.typetrace.parser.Type.Arrow;
import com.github.typetrace.parser.Type.ListType;

public class UnifierTest {

    private static final NodeId NODE = new NodeId(7);

    private final InferenceSession session = new InferenceSession();
    private final TypeVariables typeVariables = session.typeVariables();
    private final Unifier unifier = session.unifier();

    @Test
    public void unifyingATypeWithItselfDoesNothing() {
        var v = typeVariables.fresh();
        var arrow = new Arrow(v, new ListType(Type.INT));

        unifier.unify(Type.INT, Type.INT, "test", NODE);
        unifier.unify(v, v, "test", NODE);
        unifier.unify(arrow, arrow, "test", NODE);

        assertTrue(session.trace().events().isEmpty());
        assertEquals("T0", typeVariables.show(v));
    }

    @Test
    public void variableBindsAndRecordsWhy() {
        var v = typeVariables.fresh();

        unifier.unify(v, Type.BOOL, "if condition", NODE);

        assertEquals("Bool", typeVariables.show(v));
        var event = session.trace().events().get(0);
        assertEquals("UNIFY: T0 := Bool (if condition)", event.message());
        assertEquals(Category.SUCCESS, event.category());
        assertEquals(NODE, event.node().get());
        assertEquals("Bool", event.snapshot().get(0).value());
    }

    @Test
    public void variableOnTheRightIsSwapped() {
        var v = typeVariables.fresh();

        unifier.unify(new ListType(Type.INT), v, "test", NODE);

        assertEquals("[Int]", typeVariables.show(v));
    }

    @Test
    public void arrowsUnifyParameterThenResult() {
        var p = typeVariables.fresh();
        var r = typeVariables.fresh();

        unifier.unify(new Arrow(p, r), new Arrow(Type.INT, Type.BOOL), "function application", NODE);

        var events = session.trace().events();
        assertEquals("UNIFY: T0 := Int (function parameter)", events.get(0).message());
        assertEquals("UNIFY: T1 := Bool (function result)", events.get(1).message());
    }

    @Test
    public void parameterMismatchIsReportedBeforeResult() {
        var r = typeVariables.fresh();

        var e = assertThrows(TypeMismatchException.class,
                () -> unifier.unify(new Arrow(Type.INT, r), new Arrow(Type.BOOL, Type.INT), "test", NODE));

        assertEquals("cannot unify Int with Bool", e.getMessage());
        assertEquals("?", typeVariables.snapshot().get(0).value());
    }

    @Test
    public void listsUnifyElements() {
        var v = typeVariables.fresh();

        unifier.unify(new ListType(v), new ListType(Type.INT), "test", NODE);

        assertEquals("UNIFY: T0 := Int (list element)", session.trace().events().get(0).message());
    }

    @Test
    public void differentShapesMismatch() {
        var e = assertThrows(TypeMismatchException.class,
                () -> unifier.unify(new ListType(Type.INT), new Arrow(Type.INT, Type.INT), "test", NODE));

        assertEquals("TypeMismatchError: cannot unify [Int] with Int -> Int", e.describe());
    }

    @Test
    public void occursCheckPreventsInfiniteTypes() {
        var v = typeVariables.fresh();

        var e = assertThrows(InfiniteTypeException.class,
                () -> unifier.unify(v, new ListType(v), "test", NODE));

        assertEquals("T0 occurs in [T0]", e.getMessage());
        assertEquals("InfiniteTypeError", e.kind());
    }

    @Test
    public void boundVariablesArePrunedFirst() {
        var a = typeVariables.fresh();
        var b = typeVariables.fresh();
        unifier.unify(a, Type.INT, "test", NODE);
        unifier.unify(b, Type.INT, "test", NODE);

        unifier.unify(a, b, "test", NODE);

        assertEquals(2, session.trace().size());
    }

}
