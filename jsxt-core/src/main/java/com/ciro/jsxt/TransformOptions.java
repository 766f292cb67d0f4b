package com.ciro.jsxt;

import com.ciro.jsxt.diagnostics.DiagnosticFormatter;
import com.ciro.jsxt.scanner.LocatorKind;
import com.ciro.jsxt.template.HelperNames;
import java.util.Objects;
import java.util.Properties;

/** Opciones inmutables de {@link JsxTransformer}. */
public final class TransformOptions {

    public static final String KEY_COMPONENT_HELPER = "jsxt.helper.component";
    public static final String KEY_LIST_HELPER = "jsxt.helper.list";
    public static final String KEY_SPREAD_HELPER = "jsxt.helper.spread";
    public static final String KEY_SOURCE_NAME = "jsxt.source-name";
    public static final String KEY_LOCATOR = "jsxt.locator";
    public static final String KEY_STRIP_COMMENTS = "jsxt.strip-comments";

    private static final TransformOptions DEFAULTS = builder().build();

    private final HelperNames helpers;
    private final String sourceName;
    private final LocatorKind locator;
    private final boolean stripComments;

    private TransformOptions(Builder b) {
        this.helpers = new HelperNames(b.componentHelper, b.listHelper, b.spreadHelper);
        this.sourceName = Objects.requireNonNull(b.sourceName, "sourceName");
        this.locator = Objects.requireNonNull(b.locator, "locator");
        this.stripComments = b.stripComments;
    }

    public static TransformOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Lee las claves {@code jsxt.*}; las que falten quedan con su valor por defecto. */
    public static TransformOptions fromProperties(Properties props) {
        return builder().apply(props).build();
    }

    public HelperNames helpers() {
        return helpers;
    }

    public String componentHelper() {
        return helpers.component();
    }

    public String listHelper() {
        return helpers.list();
    }

    public String spreadHelper() {
        return helpers.spread();
    }

    public String sourceName() {
        return sourceName;
    }

    public LocatorKind locator() {
        return locator;
    }

    public boolean stripComments() {
        return stripComments;
    }

    /** Builder precargado con estas opciones. */
    public Builder toBuilder() {
        return new Builder()
                .componentHelper(helpers.component())
                .listHelper(helpers.list())
                .spreadHelper(helpers.spread())
                .sourceName(sourceName)
                .locator(locator)
                .stripComments(stripComments);
    }

    @Override
    public String toString() {
        return "TransformOptions{helpers=" + helpers + ", sourceName=" + sourceName
                + ", locator=" + locator + ", stripComments=" + stripComments + "}";
    }

    public static final class Builder {
        private String componentHelper = HelperNames.DEFAULT.component();
        private String listHelper = HelperNames.DEFAULT.list();
        private String spreadHelper = HelperNames.DEFAULT.spread();
        private String sourceName = DiagnosticFormatter.DEFAULT_SOURCE_NAME;
        private LocatorKind locator = LocatorKind.SCANNER;
        private boolean stripComments = true;

        private Builder() {}

        public Builder componentHelper(String name) {
            this.componentHelper = name;
            return this;
        }

        public Builder listHelper(String name) {
            this.listHelper = name;
            return this;
        }

        public Builder spreadHelper(String name) {
            this.spreadHelper = name;
            return this;
        }

        public Builder sourceName(String name) {
            this.sourceName = name;
            return this;
        }

        public Builder locator(LocatorKind kind) {
            this.locator = kind;
            return this;
        }

        public Builder stripComments(boolean strip) {
            this.stripComments = strip;
            return this;
        }

        /** Pisa los valores presentes en {@code props}. */
        public Builder apply(Properties props) {
            String v;
            if ((v = props.getProperty(KEY_COMPONENT_HELPER)) != null) componentHelper = v.trim();
            if ((v = props.getProperty(KEY_LIST_HELPER)) != null) listHelper = v.trim();
            if ((v = props.getProperty(KEY_SPREAD_HELPER)) != null) spreadHelper = v.trim();
            if ((v = props.getProperty(KEY_SOURCE_NAME)) != null) sourceName = v.trim();
            if ((v = props.getProperty(KEY_LOCATOR)) != null) locator = LocatorKind.parse(v);
            if ((v = props.getProperty(KEY_STRIP_COMMENTS)) != null) stripComments = parseBoolean(KEY_STRIP_COMMENTS, v);
            return this;
        }

        public TransformOptions build() {
            return new TransformOptions(this);
        }

        private static boolean parseBoolean(String key, String value) {
            String v = value.trim();
            if ("true".equalsIgnoreCase(v)) return true;
            if ("false".equalsIgnoreCase(v)) return false;
            throw new IllegalArgumentException("Invalid boolean for " + key + ": " + value);
        }
    }
}
