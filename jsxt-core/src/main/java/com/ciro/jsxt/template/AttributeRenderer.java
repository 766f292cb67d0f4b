package com.ciro.jsxt.template;

import com.ciro.jsxt.JsxException;
import com.ciro.jsxt.ast.AttributeValue;
import com.ciro.jsxt.ast.JsxAttribute;
import java.util.List;
import java.util.StringJoiner;

/** Renderiza listas de atributos para elementos HTML y para llamadas a componentes. */
public final class AttributeRenderer {

    private final HelperNames helpers;

    public AttributeRenderer(HelperNames helpers) {
        this.helpers = helpers;
    }

    /** {@code [{"a":"x"},{...props}]}. Los nombres no se normalizan. */
    public String component(List<JsxAttribute> attributes) throws JsxException {
        StringJoiner parts = new StringJoiner(",", "[", "]");
        for (JsxAttribute attr : attributes) parts.add(componentPart(attr));
        return parts.toString();
    }

    String componentPart(JsxAttribute attr) throws JsxException {
        if (attr.isSpread()) {
            requireTarget(attr);
            return "{" + attr.name() + "}";
        }
        String key = "{\"" + attr.name() + "\":";
        AttributeValue value = attr.value();
        if (attr.isBoolean()) return key + "true}";
        if (value instanceof AttributeValue.Expression e) return key + e.text() + "}";
        if (value instanceof AttributeValue.SingleQuoted s) return key + "'" + s.text() + "'}";
        return key + "\"" + value.text() + "\"}";
    }

    /** Atributos de un elemento: cada uno con un espacio delante, salvo los spreads. */
    public String element(List<JsxAttribute> attributes) throws JsxException {
        StringBuilder sb = new StringBuilder();
        for (JsxAttribute attr : attributes) {
            String rendered = elementPart(attr);
            if (!attr.isSpread()) sb.append(' ');
            sb.append(rendered);
        }
        return sb.toString();
    }

    String elementPart(JsxAttribute attr) throws JsxException {
        if (attr.isSpread()) {
            requireTarget(attr);
            return "${" + helpers.spread() + "(" + attr.name().replace(JsxAttribute.SPREAD_PREFIX, "") + ")}";
        }
        if (attr.isBoolean()) return attr.name(); // nombre original, sin normalizar
        AttributeValue value = attr.value();
        String name = AttributeNames.normalize(attr.name());
        if (value instanceof AttributeValue.Expression e) return name + "=\"${" + e.text() + "}\"";
        if (value instanceof AttributeValue.SingleQuoted s) return name + "='" + s.text() + "'";
        return name + "=\"" + value.text() + "\"";
    }

    private static void requireTarget(JsxAttribute attr) throws JsxException {
        if (attr.spreadTarget().isBlank()) {
            throw JsxException.invalidAttribute("spread without a target");
        }
    }
}
