package com.ciro.jsxt;

/**
 * Error de transformación. El mensaje ya viene con el prefijo de su categoría
 * ({@code JSX parsing error: ...}).
 */
public class JsxException extends Exception {

    public enum Kind {
        EXTRACTION("JSX extraction error: "),
        PARSING("JSX parsing error: "),
        TRANSFORM("JSX transform error: ");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    private final Kind kind;

    public JsxException(Kind kind, String detail) {
        super(kind.prefix() + detail);
        this.kind = kind;
    }

    public static JsxException extraction(String detail) {
        return new JsxException(Kind.EXTRACTION, detail);
    }

    public static JsxException parsing(String detail) {
        return new JsxException(Kind.PARSING, detail);
    }

    public static JsxException invalidAttribute(String detail) {
        return new JsxException(Kind.TRANSFORM, "Invalid attribute: " + detail);
    }

    public static JsxException invalidComponent(String detail) {
        return new JsxException(Kind.TRANSFORM, "Invalid component: " + detail);
    }

    public static JsxException invalidElement(String detail) {
        return new JsxException(Kind.TRANSFORM, "Invalid element: " + detail);
    }

    public static JsxException unsupportedSyntax(String detail) {
        return new JsxException(Kind.TRANSFORM, "Unsupported syntax: " + detail);
    }

    public Kind kind() {
        return kind;
    }
}
