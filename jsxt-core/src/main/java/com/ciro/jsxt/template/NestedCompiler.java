package com.ciro.jsxt.template;

import com.ciro.jsxt.JsxException;

/** Transformación completa de una expresión hija que contiene JSX. */
@FunctionalInterface
public interface NestedCompiler {

    String compile(String expression) throws JsxException;
}
