package com.ciro.jsxt.ast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class JsxWalkerTest {

    /** Registra los hooks como strings. */
    static class Recorder implements JsxVisitor<RuntimeException> {
        final List<String> events = new ArrayList<>();

        @Override
        public void enterElement(String tag, List<JsxAttribute> attributes) {
            events.add("enter " + tag + " " + attributes.size());
        }

        @Override
        public void exitElement(String tag) {
            events.add("exit " + tag);
        }

        @Override
        public void enterFragment() {
            events.add("enter <>");
        }

        @Override
        public void exitFragment() {
            events.add("exit <>");
        }

        @Override
        public void visitText(String text) {
            events.add("text " + text);
        }

        @Override
        public void visitExpression(String expression) {
            events.add("expr " + expression);
        }
    }

    private static final JsxNode TREE = new FragmentNode(List.of(
            new ElementNode("ul", List.of(JsxAttribute.flag("hidden")), List.of(
                    new ElementNode("li", List.of(), List.of(new TextNode("a"))),
                    new ExpressionNode("b"))),
            new TextNode("c")));

    @Test
    void visitsDepthFirstInSourceOrder() {
        Recorder recorder = new Recorder();
        JsxWalker.walk(TREE, recorder);
        assertEquals(List.of(
                "enter <>",
                "enter ul 1",
                "enter li 0",
                "text a",
                "exit li",
                "expr b",
                "exit ul",
                "text c",
                "exit <>"), recorder.events);
    }

    @Test
    void firstFailureStopsTheWalk() {
        List<String> seen = new ArrayList<>();
        JsxVisitor<Exception> failing = new JsxVisitor<>() {
            @Override
            public void enterElement(String tag, List<JsxAttribute> attributes) throws Exception {
                seen.add(tag);
                if (tag.equals("li")) throw new Exception("boom at " + tag);
            }

            @Override
            public void visitText(String text) {
                seen.add("text " + text);
            }
        };

        Exception e = assertThrows(Exception.class, () -> JsxWalker.walk(TREE, failing));
        assertEquals("boom at li", e.getMessage());
        assertEquals(List.of("ul", "li"), seen);
    }

    @Test
    void defaultHooksDoNothing() throws Exception {
        JsxWalker.walk(TREE, new JsxVisitor<Exception>() {});
    }
}
