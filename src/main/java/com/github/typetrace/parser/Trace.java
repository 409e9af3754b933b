package com.github.typetrace.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.typetrace.parser.SyntaxTree.NodeId;
import com.github.typetrace.parser.TraceEvent.Category;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Append-only event log of one run. */
@Slf4j
@RequiredArgsConstructor
public class Trace {

    private final TypeVariables typeVariables;
    private final List<TraceEvent> events = new ArrayList<>();

    public void emit(String message, Category category, NodeId node) {
        record(message, category, Optional.of(node));
    }

    public void emit(String message, Category category) {
        record(message, category, Optional.empty());
    }

    private void record(String message, Category category, Optional<NodeId> node) {
        var event = new TraceEvent(message, category, typeVariables.snapshot(), node);
        log.debug("{}", event);
        events.add(event);
    }

    public List<TraceEvent> events() {
        return List.copyOf(events);
    }

    public int size() {
        return events.size();
    }
}
