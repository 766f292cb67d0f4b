package com.ciro.jsxt.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class TemplateBuilderTest {

    private final TemplateBuilder builder = new TemplateBuilder(HelperNames.DEFAULT);

    @Test
    void textIsKeptVerbatimAndResultIsTrimmed() {
        builder.pushText("\n   a\\tb  ");
        builder.pushText("c \n");
        assertEquals("a\\tb  c", builder.finish());
    }

    @Test
    void expressionsAreInterpolated() {
        builder.pushExpression("count");
        builder.pushExpression(" user.name ");
        assertEquals("${count}${ user.name }", builder.finish());
    }

    @Test
    void listExpressionsAreWrapped() {
        builder.pushExpression("items.map(f)");
        assertEquals("${__jsxList(items.map(f))}", builder.finish());
    }

    @Test
    void loneTemplateInterpolationIsUnwrapped() {
        builder.pushExpression(" `${value}` ");
        assertEquals("${value}", builder.finish());
    }

    @Test
    void templatesWithMoreThanOneInterpolationStayAsIs() {
        builder.pushExpression("`${a} ${b}`");
        assertEquals("${`${a} ${b}`}", builder.finish());
    }

    @Test
    void trivialNestedChildIsFlattened() {
        builder.appendChild("${`${inner}`}");
        builder.appendChild("<b>x</b>");
        assertEquals("${inner}<b>x</b>", builder.finish());
    }

    @Test
    void flatteningNeedsASingleInterpolation() {
        assertEquals("${x}", TemplateBuilder.flattenTrivialChild("  ${` ${x} `}  "));
        assertNull(TemplateBuilder.flattenTrivialChild("${`a${x}`}"));
        assertNull(TemplateBuilder.flattenTrivialChild("${`${x}${y}`}"));
        assertNull(TemplateBuilder.flattenTrivialChild("${x}"));
        assertNull(TemplateBuilder.singleInterpolation("`"));
        assertNull(TemplateBuilder.singleInterpolation("`plain`"));
        assertEquals("a.b", TemplateBuilder.singleInterpolation("`${a.b}`"));
    }

    @Test
    void usesConfiguredListHelper() {
        TemplateBuilder custom = new TemplateBuilder(new HelperNames("h", "L", "s"));
        custom.pushExpression("xs.filter(f)");
        assertEquals("${L(xs.filter(f))}", custom.finish());
    }
}
