package com.ciro.jsxt;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class CommentStripperTest {

    @Test
    void removesJsxCommentsWithTheirBraces() {
        assertEquals("<p>ab</p>", CommentStripper.strip("<p>a{/* <b>x</b> */}b</p>"));
    }

    @Test
    void removesBlockAndDocComments() {
        String src = "/**\n * Docs <tag>\n */\nfunction f() { /* x */ return 1; }";
        assertEquals("\nfunction f() {  return 1; }", CommentStripper.strip(src));
    }

    @Test
    void matchesShortestComment() {
        assertEquals("a  b  c", CommentStripper.strip("a /* 1 */ b /* 2 */ c"));
    }

    @Test
    void keepsLineCommentsAndUnclosedBlocks() {
        assertEquals("x // <y>\n", CommentStripper.strip("x // <y>\n"));
        assertEquals("a /* open", CommentStripper.strip("a /* open"));
    }

    @Test
    void doesNotLookInsideStrings() {
        assertEquals("const s = \"\";", CommentStripper.strip("const s = \"/* gone */\";"));
    }
}
