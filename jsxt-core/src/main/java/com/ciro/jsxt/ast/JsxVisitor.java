package com.ciro.jsxt.ast;

import java.util.List;

/**
 * Hooks del recorrido en profundidad. Todos son no-op por defecto.
 * La primera excepción corta el recorrido y se propaga tal cual.
 *
 * @param <X> excepción que pueden lanzar los hooks
 */
public interface JsxVisitor<X extends Exception> {

    default void enterElement(String tag, List<JsxAttribute> attributes) throws X {}

    default void exitElement(String tag) throws X {}

    default void enterFragment() throws X {}

    default void exitFragment() throws X {}

    default void visitText(String text) throws X {}

    default void visitExpression(String expression) throws X {}
}
