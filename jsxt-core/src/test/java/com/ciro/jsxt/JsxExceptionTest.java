package com.ciro.jsxt;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class JsxExceptionTest {

    @Test
    void factoriesPrefixTheirCategory() {
        JsxException extraction = JsxException.extraction("span out of source");
        assertEquals(JsxException.Kind.EXTRACTION, extraction.kind());
        assertEquals("JSX extraction error: span out of source", extraction.getMessage());

        assertEquals("JSX parsing error: boom", JsxException.parsing("boom").getMessage());
        assertEquals("JSX transform error: Invalid element: .a", JsxException.invalidElement(".a").getMessage());
        assertEquals("JSX transform error: Unsupported syntax: x", JsxException.unsupportedSyntax("x").getMessage());
    }
}
