package com.ciro.jsxt.parser;

import com.ciro.jsxt.ast.JsxNode;
import com.ciro.jsxt.ast.ParseError;
import com.ciro.jsxt.ast.Span;

/** Resultado de un paso de {@link JsxParser#parseNextWithSpan()}. */
public sealed interface ParseStep {

    /** Construcción top-level parseada, con su rango en bytes. */
    record Parsed(JsxNode node, Span span) implements ParseStep {}

    /** Falló la construcción que empieza en {@code error.position()}. */
    record Failed(ParseError error) implements ParseStep {}
}
