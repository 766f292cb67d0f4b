package com.ciro.jsxt.ast;

import java.util.List;

/** {@code <>children</>} */
public record FragmentNode(List<JsxNode> children) implements JsxNode {

    public FragmentNode {
        children = List.copyOf(children);
    }
}
