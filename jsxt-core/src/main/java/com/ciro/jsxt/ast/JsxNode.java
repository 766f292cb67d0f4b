package com.ciro.jsxt.ast;

/** Nodo del árbol JSX. */
public sealed interface JsxNode permits ElementNode, FragmentNode, TextNode, ExpressionNode {
}
