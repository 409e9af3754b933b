package com.github.typetrace;

import java.util.Optional;

import com.github.typetrace.parser.InferenceSession;
import com.github.typetrace.parser.Parser;
import com.github.typetrace.parser.SyntaxTree;
import com.github.typetrace.parser.TraceEvent.Category;
import com.github.typetrace.parser.TypeVariables;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs tokenizer, parser and analyzer on one source text and packages the outcome together
 * with the trace of the run. Holds configuration only; every call to {@link #infer} works on
 * its own {@link InferenceSession}.
 */
@Slf4j
@Setter
public class TypeTracer implements ConfigReader.ConfigTarget {

    private boolean strictLexing;
    private String placeholder = TypeVariables.DEFAULT_PLACEHOLDER;

    public static void main(String[] args) {
        var tracer = new TypeTracer();
        ConfigReader.readConfig().applyConfig(tracer);
        for (var source : args) {
            var result = tracer.infer(source);
            result.trace().forEach(event -> log.info("{}", event));
            log.info("{} : {}", source, result.describe());
        }
    }

    public InferenceResult infer(String source) {
        log.debug("inferring type of '{}'", source);
        var session = new InferenceSession(placeholder);
        Optional<SyntaxTree> tree = Optional.empty();
        try {
            var tokens = new Tokenizer(strictLexing).tokenize(source);
            tree = Optional.of(new Parser().parse(tokens));
            var type = session.analyze(tree.get());
            var shown = session.typeVariables().show(type);
            log.debug("inferred {} after {} steps", shown, session.trace().size());
            return InferenceResult.success(tree.get(), shown, session.trace().events());
        } catch (InferenceException e) {
            session.trace().emit("FAILURE: " + e.describe(), Category.ERROR);
            log.debug("inference failed: {}", e.describe());
            return InferenceResult.failure(tree, e, session.trace().events());
        }
    }

}
