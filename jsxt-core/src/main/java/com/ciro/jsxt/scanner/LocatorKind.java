package com.ciro.jsxt.scanner;

import java.util.Locale;

/** Locators disponibles por nombre (configuración y CLI). */
public enum LocatorKind {

    SCANNER {
        @Override
        public CandidateLocator locator() {
            return JsxScanner.LOCATOR;
        }
    },
    FIRST_ANGLE {
        @Override
        public CandidateLocator locator() {
            return FirstAngleLocator.INSTANCE;
        }
    };

    public abstract CandidateLocator locator();

    /** Acepta {@code scanner}, {@code first-angle} o {@code FIRST_ANGLE}. */
    public static LocatorKind parse(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (LocatorKind kind : values()) {
            if (kind.name().equals(normalized)) return kind;
        }
        throw new IllegalArgumentException("Unknown locator: " + value);
    }
}
