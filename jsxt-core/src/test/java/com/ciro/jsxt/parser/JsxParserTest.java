package com.ciro.jsxt.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.ciro.jsxt.ast.AttributeValue;
import com.ciro.jsxt.ast.ElementNode;
import com.ciro.jsxt.ast.ExpressionNode;
import com.ciro.jsxt.ast.FragmentNode;
import com.ciro.jsxt.ast.JsxAttribute;
import com.ciro.jsxt.ast.ParseError;
import com.ciro.jsxt.ast.ParseResult;
import com.ciro.jsxt.ast.Span;
import com.ciro.jsxt.ast.TextNode;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class JsxParserTest {

    private static ElementNode element(String src) {
        return assertInstanceOf(ElementNode.class, new JsxParser(src).parse().single());
    }

    private static ParseError firstError(String src) {
        ParseResult result = new JsxParser(src).parse();
        assertTrue(result.hasErrors(), "expected errors for " + src);
        return result.errors().get(0);
    }

    @Test
    void parsesElementWithTextChild() {
        ElementNode div = element("<div>Hello</div>");
        assertEquals("div", div.tag());
        assertEquals(List.of(new TextNode("Hello")), div.children());
        assertTrue(div.attributes().isEmpty());
    }

    @Test
    void parsesSelfClosingElementWithWhitespace() {
        ElementNode input = element("<input type=\"checkbox\" disabled />");
        assertTrue(input.children().isEmpty());
        assertEquals(List.of(
                new JsxAttribute("type", new AttributeValue.DoubleQuoted("checkbox")),
                JsxAttribute.flag("disabled")), input.attributes());
    }

    @Test
    void parsesAllAttributeValueKinds() {
        ElementNode a = element("<a href='x' title=\"y\" onClick={() => go({a: 1})} />");
        assertEquals(new AttributeValue.SingleQuoted("x"), a.attributes().get(0).value());
        assertEquals(new AttributeValue.DoubleQuoted("y"), a.attributes().get(1).value());
        assertEquals(new AttributeValue.Expression("() => go({a: 1})"), a.attributes().get(2).value());
    }

    @Test
    void quotedValuesHaveNoEscapes() {
        ElementNode a = element("<a title=\"a\\\" />");
        assertEquals(new AttributeValue.DoubleQuoted("a\\"), a.attributes().get(0).value());
    }

    @Test
    void parsesSpreadIdentifierAndSpreadExpression() {
        ElementNode div = element("<div {...props} {...(ok ? a : b)} id=\"x\"></div>");
        List<JsxAttribute> attrs = div.attributes();
        assertEquals(3, attrs.size());
        assertEquals("...props", attrs.get(0).name());
        assertTrue(attrs.get(0).isSpread());
        assertNull(attrs.get(0).value());
        assertEquals("(ok ? a : b)", attrs.get(1).spreadTarget());
        assertEquals("id", attrs.get(2).name());
    }

    @Test
    void spreadTargetsMayBeMemberPaths() {
        ElementNode div = element("<div {...state.props}/>");
        assertEquals("...state.props", div.attributes().get(0).name());
    }

    @Test
    void attributeNamesDoNotTakeDots() {
        // el "." se salta como carácter inválido y "b" queda como atributo aparte
        ElementNode div = element("<div a.b=\"1\"/>");
        assertEquals(List.of("a", "b"), div.attributes().stream().map(JsxAttribute::name).toList());
    }

    @Test
    void dottedAttributeSplitsIntoFlagAndValue() {
        ElementNode div = element("<div data.x=\"1\"></div>");
        assertEquals(List.of(
                JsxAttribute.flag("data"),
                new JsxAttribute("x", new AttributeValue.DoubleQuoted("1"))), div.attributes());
        assertTrue(div.children().isEmpty());
    }

    @Test
    void tagNamesTakeDotsAndDashes() {
        ElementNode el = element("<Foo.Bar-baz></Foo.Bar-baz>");
        assertEquals("Foo.Bar-baz", el.tag());
    }

    @Test
    void parsesFragmentsAndNestedChildren() {
        FragmentNode f = assertInstanceOf(FragmentNode.class,
                new JsxParser("<><b>x</b>{y}<>z</></>").parse().single());
        assertEquals(3, f.children().size());
        assertInstanceOf(ElementNode.class, f.children().get(0));
        assertEquals(new ExpressionNode("y"), f.children().get(1));
        assertEquals(new FragmentNode(List.of(new TextNode("z"))), f.children().get(2));
    }

    @Test
    void expressionKeepsInnerBracesAndWhitespace() {
        ElementNode div = element("<div>{ a ? {x: 1} : b }</div>");
        assertEquals(new ExpressionNode(" a ? {x: 1} : b "), div.children().get(0));
    }

    @Test
    void scriptBodyIsRawText() {
        ElementNode script = element("<script>if (a < b && c > d) { x = '</div>'; }</ script >");
        assertEquals(List.of(new TextNode("if (a < b && c > d) { x = '</div>'; }")), script.children());
    }

    @Test
    void scriptBodyBacktracksOnOtherClosingTags() {
        ElementNode script = element("<script>x</scripty>y</script>");
        assertEquals(List.of(new TextNode("x</scripty>y")), script.children());
    }

    @Test
    void unterminatedScriptReturnsWhatWasRead() {
        ElementNode script = element("<script>let a = 1;");
        assertEquals(List.of(new TextNode("let a = 1;")), script.children());
    }

    @Test
    void reportsMismatchedClosingTag() {
        ParseError e = firstError("<div><span>Test</div>");
        assertEquals(0, e.position());
        assertEquals("Mismatched closing tag: expected span, found div", e.message());
    }

    @Test
    void reportsUnclosedTagsAndFragments() {
        assertEquals("Unclosed tag: div", firstError("<div>text").message());
        assertEquals("Unclosed tag: fragment", firstError("<>text").message());
    }

    @Test
    void reportsMalformedTagEnds() {
        assertEquals("Expected > after /", firstError("<br / >").message());
        assertEquals("Expected >", firstError("<div></div x>").message());
        assertEquals("Expected > for fragment closing tag", firstError("<>a</b>").message());
    }

    @Test
    void reportsAttributeValueErrors() {
        assertEquals("Unterminated string literal", firstError("<div class=\"oops>Bad</div>").message());
        assertEquals("Expected string or expression", firstError("<div class=oops></div>").message());
        assertEquals("Unclosed expression", firstError("<div class={oops></div>").message());
    }

    @Test
    void reportsExpectedIdentifierAtTheAngle() {
        ParseError e = firstError("ab <1");
        assertEquals(3, e.position());
        assertEquals("Expected identifier", e.message());
    }

    @Test
    void nestedFailuresAreReportedAtTopLevelStart() {
        ParseError e = firstError("xx <ul><li>{open</li></ul>");
        assertEquals(3, e.position());
        assertEquals("Unclosed expression", e.message());
    }

    @Test
    void spansAreByteOffsets() {
        JsxParser parser = new JsxParser("é <b>ü</b> tail");
        Optional<ParseStep> step = parser.parseNextWithSpan();
        ParseStep.Parsed parsed = assertInstanceOf(ParseStep.Parsed.class, step.orElseThrow());
        // "é " ocupa 3 bytes; "<b>ü</b>" ocupa 9
        assertEquals(new Span(3, 12), parsed.span());
        assertEquals(12, parser.position());
        assertTrue(parser.parseNextWithSpan().isEmpty());
    }

    @Test
    void streamingParseCollectsNodesAndErrors() {
        ParseResult result = new JsxParser("<div><span>Test</div><div class=\"oops>Bad</div> <p>ok</p>").parse();
        assertEquals(2, result.errors().size());
        assertEquals("Mismatched closing tag: expected span, found div", result.errors().get(0).message());
        assertEquals("Unterminated string literal", result.errors().get(1).message());
        assertTrue(result.errors().get(0).position() <= result.errors().get(1).position());
        assertTrue(result.nodes().isEmpty());
    }

    @Test
    void streamingParseRecoversAfterErrors() {
        ParseResult result = new JsxParser("<1 <p>a</p> <2 <i/>").parse();
        assertEquals(2, result.nodes().size());
        assertEquals(2, result.errors().size());
        assertEquals(0, result.errors().get(0).position());
        assertEquals(12, result.errors().get(1).position());
    }

    @Test
    void emptyOrPlainInputYieldsNothing() {
        assertTrue(new JsxParser("").parseNextWithSpan().isEmpty());
        ParseResult result = new JsxParser("const a = 1;").parse();
        assertTrue(result.nodes().isEmpty());
        assertFalse(result.hasErrors());
    }

    @Test
    void parseNextThrowsOnError() throws ParseException {
        assertEquals(Optional.empty(), new JsxParser("nothing here").parseNext());
        assertInstanceOf(ElementNode.class, new JsxParser("<a/>").parseNext().orElseThrow());
        ParseException e = assertThrows(ParseException.class, () -> new JsxParser("<a>").parseNext());
        assertEquals("Unclosed tag: a", e.error().message());
    }

    @Test
    void parserCanStartInTheMiddleOfAString() {
        String src = "ignored <i>x</i>";
        JsxParser parser = new JsxParser(src, src.indexOf('<'));
        ParseStep.Parsed parsed = assertInstanceOf(ParseStep.Parsed.class, parser.parseNextWithSpan().orElseThrow());
        assertEquals(new Span(0, 8), parsed.span());
    }

    @Test
    void elementDepthUpToTheLimitParses() {
        int depth = JsxParser.MAX_DEPTH;
        ElementNode root = element("<a>".repeat(depth) + "</a>".repeat(depth));
        assertEquals("a", root.tag());
    }

    @Test
    void elementDepthPastTheLimitIsRejected() {
        int depth = JsxParser.MAX_DEPTH + 1;
        String src = "<a>".repeat(depth) + "</a>".repeat(depth);
        NestingLimitException e = assertThrows(NestingLimitException.class,
                () -> new JsxParser(src).parseNextWithSpan());
        // falla al abrir el último <a>
        assertEquals(JsxParser.MAX_DEPTH * 3, e.position());

        String fragments = "<>".repeat(depth) + "</>".repeat(depth);
        assertThrows(NestingLimitException.class, () -> new JsxParser(fragments).parse());
    }

    @Test
    void depthIsResetBetweenFragments() {
        String deep = "<a>".repeat(JsxParser.MAX_DEPTH) + "</a>".repeat(JsxParser.MAX_DEPTH);
        ParseResult result = new JsxParser(deep + " " + deep).parse();
        assertEquals(2, result.nodes().size());
        assertFalse(result.hasErrors());
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(NullPointerException.class, () -> new JsxParser(null));
        assertThrows(IllegalArgumentException.class, () -> new JsxParser("abc", 4));
        assertThrows(IllegalArgumentException.class, () -> new JsxParser("abc", -1));
    }
}
