package com.ciro.jsxt.ast;

import java.util.List;

/** Resultado de un parseo completo: nodos en orden de fuente y errores en orden de offset. */
public record ParseResult(List<JsxNode> nodes, List<ParseError> errors) {

    public ParseResult {
        nodes = List.copyOf(nodes);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /** El único nodo parseado. Falla si hubo errores o no hay exactamente un nodo. */
    public JsxNode single() {
        if (hasErrors()) {
            throw new IllegalStateException("parse failed: " + errors.get(0).message());
        }
        if (nodes.size() != 1) {
            throw new IllegalStateException("expected exactly one node, got " + nodes.size());
        }
        return nodes.get(0);
    }
}
