package com.github.typetrace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.DynamicContainer;
import org.junit.jupiter.api.DynamicNode;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import com.github.typetrace.parser.SyntaxTree.Expression;
import com.github.typetrace.parser.TraceEvent;
import com.github.typetrace.parser.TraceEvent.Category;
import com.github.typetrace.parser.TypeVariables.TypeBinding;

public class TypeTracerTest {

    private static final String MARKER = "// EXPECTED";

    @TestFactory
    public DynamicNode testFactory() {
        String basePathString = "src/test/resources/tracer-tests";
        Path basePath = Paths.get(basePathString);

        var testFiles = basePath.toFile().listFiles((dir, name) -> name.endsWith(".test.hm"));
        Arrays.sort(testFiles);
        var tests = Arrays.stream(testFiles)
            .map(this::createTest).toList();

        return DynamicContainer.dynamicContainer("Tracer tests", tests);
    }

    private DynamicNode createTest(File testFile) {
        var testName = testFile.getName().substring(0, testFile.getName().indexOf('.'));
        return DynamicTest.dynamicTest("infer " + testName, () -> {
            List<String> lines = Files.readAllLines(testFile.toPath());
            int marker = lines.indexOf(MARKER);
            var source = String.join("\n", lines.subList(0, marker));
            var expected = lines.get(marker + 1).substring(2).trim();

            var result = new TypeTracer().infer(source);

            assertEquals(expected, result.describe());
        });
    }

    @Test
    public void successHasTypeTreeAndNoError() {
        var result = new TypeTracer().infer("10 + 5");

        assertTrue(result.succeeded());
        assertEquals("Int", result.type().get());
        assertTrue(result.tree().isPresent());
        assertTrue(result.error().isEmpty());
        assertFalse(result.trace().stream().anyMatch(e -> e.category() == Category.ERROR));
    }

    @Test
    public void failureEndsTraceWithErrorEvent() {
        var result = new TypeTracer().infer("true + 1");

        assertFalse(result.succeeded());
        assertInstanceOf(TypeMismatchException.class, result.error().get());
        var last = result.trace().get(result.trace().size() - 1);
        assertEquals(Category.ERROR, last.category());
        assertEquals("FAILURE: TypeMismatchError: cannot unify Bool with Int", last.message());
        assertTrue(last.node().isEmpty());
        // the tree was built before analysis failed
        assertTrue(result.tree().isPresent());
    }

    @Test
    public void syntaxFailureHasNoTree() {
        var result = new TypeTracer().infer("(1 + 2");

        assertInstanceOf(SyntaxException.class, result.error().get());
        assertTrue(result.tree().isEmpty());
        assertEquals(1, result.trace().size());
    }

    @Test
    public void everyNodeEventResolvesInTheTree() {
        var result = new TypeTracer().infer("let f = fun x -> if x then [1] else [] in f true");
        var tree = result.tree().get();

        var astEvents = result.trace().stream().filter(e -> e.category() == Category.AST).toList();
        assertEquals(tree.nodes().size(), astEvents.size());
        for (var event : result.trace()) {
            event.node().ifPresent(id -> assertTrue(tree.find(id).isPresent(), "unknown node " + id));
        }
    }

    @Test
    public void nodeIdsAreUnique() {
        var tree = new TypeTracer().infer("[fun a -> a, fun b -> b + 1]").tree().get();

        var ids = tree.nodes().stream().map(Expression::id).collect(Collectors.toSet());
        assertEquals(tree.nodes().size(), ids.size());
    }

    @Test
    public void runsDoNotShareTypeVariables() {
        var tracer = new TypeTracer();
        var first = tracer.infer("fun x -> fun y -> x y");
        var second = tracer.infer("fun x -> x");

        assertEquals("T0 -> T0", second.type().get());
        List<TypeBinding> finalSnapshot = second.trace().get(second.trace().size() - 1).snapshot();
        assertEquals(List.of(new TypeBinding("T0", "?")), finalSnapshot);
        // the first result is unaffected by the second run
        assertEquals("(T1 -> T2) -> T1 -> T2", first.type().get());
    }

    @Test
    public void unboundCharactersAreSkippedUnlessStrict() {
        var lenient = new TypeTracer();
        assertEquals("Int", lenient.infer("1 + $2").describe());

        var strict = new TypeTracer();
        strict.setStrictLexing(true);
        var result = strict.infer("1 + $2");
        assertInstanceOf(LexException.class, result.error().get());
        assertEquals("LexError: unrecognized character '$' at offset 4", result.describe());
    }

    @Test
    public void placeholderIsConfigurable() {
        var tracer = new TypeTracer();
        tracer.setPlaceholder("unbound");

        List<TraceEvent> trace = tracer.infer("fun x -> x").trace();

        assertEquals(List.of(new TypeBinding("T0", "unbound")), trace.get(trace.size() - 1).snapshot());
    }

}
