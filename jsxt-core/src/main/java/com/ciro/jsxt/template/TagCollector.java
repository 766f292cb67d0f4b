package com.ciro.jsxt.template;

import com.ciro.jsxt.ast.JsxAttribute;
import com.ciro.jsxt.ast.JsxVisitor;
import java.util.ArrayList;
import java.util.List;

/** Junta los tags del árbol en orden de documento, con su clasificación y profundidad. */
public class TagCollector implements JsxVisitor<RuntimeException> {

    public record TagUse(String tag, TagKind kind, int depth) {}

    private final List<TagUse> tags = new ArrayList<>();
    private int depth;

    @Override
    public void enterElement(String tag, List<JsxAttribute> attributes) {
        tags.add(new TagUse(tag, TagKind.classify(tag), depth));
        depth++;
    }

    @Override
    public void exitElement(String tag) {
        depth--;
    }

    public List<TagUse> tags() {
        return List.copyOf(tags);
    }
}
