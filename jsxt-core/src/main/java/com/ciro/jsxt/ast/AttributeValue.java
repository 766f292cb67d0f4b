package com.ciro.jsxt.ast;

import java.util.Objects;

/** Valor de un atributo: string con comillas dobles, simples o una expresión. */
public sealed interface AttributeValue {

    String text();

    record DoubleQuoted(String text) implements AttributeValue {
        public DoubleQuoted {
            Objects.requireNonNull(text, "text");
        }
    }

    record SingleQuoted(String text) implements AttributeValue {
        public SingleQuoted {
            Objects.requireNonNull(text, "text");
        }
    }

    record Expression(String text) implements AttributeValue {
        public Expression {
            Objects.requireNonNull(text, "text");
        }
    }
}
