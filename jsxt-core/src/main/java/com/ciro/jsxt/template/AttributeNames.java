package com.ciro.jsxt.template;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Normalización de nombres de atributo JSX (estilo React) a nombres HTML/SVG.
 * Lo que no está en las tablas se pasa a minúsculas.
 */
public final class AttributeNames {

    private static final Map<String, String> NAMES = new HashMap<>();

    static {
        // renombres directos
        NAMES.put("htmlFor", "for");
        NAMES.put("className", "class");
        NAMES.put("dangerouslySetInnerHTML", "dangerouslySetInnerHTML");
        NAMES.put("panose1", "panose-1");
        NAMES.put("xlinkActuate", "xlink:actuate");
        NAMES.put("xlinkArcrole", "xlink:arcrole");
        NAMES.put("xlinkHref", "href");
        NAMES.put("xlink:href", "href");
        NAMES.put("xlinkRole", "xlink:role");
        NAMES.put("xlinkShow", "xlink:show");
        NAMES.put("xlinkTitle", "xlink:title");
        NAMES.put("xlinkType", "xlink:type");
        NAMES.put("xmlBase", "xml:base");
        NAMES.put("xmlLang", "xml:lang");
        NAMES.put("xmlSpace", "xml:space");

        // camelCase -> kebab-case (presentación SVG y similares)
        String[] kebab = {
                "accentHeight", "acceptCharset", "alignmentBaseline", "arabicForm", "baselineShift",
                "capHeight", "clipPath", "clipRule", "colorInterpolation", "colorInterpolationFilters",
                "colorProfile", "colorRendering", "contentScriptType", "contentStyleType",
                "dominantBaseline", "enableBackground", "fillOpacity", "fillRule", "floodColor",
                "floodOpacity", "fontFamily", "fontSize", "fontSizeAdjust", "fontStretch", "fontStyle",
                "fontVariant", "fontWeight", "glyphName", "glyphOrientationHorizontal",
                "glyphOrientationVertical", "horizAdvX", "horizOriginX", "horizOriginY", "httpEquiv",
                "imageRendering", "letterSpacing", "lightingColor", "markerEnd", "markerMid",
                "markerStart", "overlinePosition", "overlineThickness", "paintOrder", "pointerEvents",
                "renderingIntent", "shapeRendering", "stopColor", "stopOpacity",
                "strikethroughPosition", "strikethroughThickness", "strokeDasharray",
                "strokeDashoffset", "strokeLinecap", "strokeLinejoin", "strokeMiterlimit",
                "strokeOpacity", "strokeWidth", "textAnchor", "textDecoration", "textRendering",
                "transformOrigin", "underlinePosition", "underlineThickness", "unicodeBidi",
                "unicodeRange", "unitsPerEm", "vAlphabetic", "vectorEffect", "vertAdvY", "vertOriginX",
                "vertOriginY", "vHanging", "vMathematical", "wordSpacing", "writingMode", "xHeight"
        };
        for (String name : kebab) NAMES.put(name, toKebab(name));

        // SVG camelCase que se mantiene tal cual
        String[] verbatim = {
                "allowReorder", "attributeName", "attributeType", "baseFrequency", "baseProfile",
                "calcMode", "clipPathUnits", "diffuseConstant", "edgeMode", "filterUnits", "glyphRef",
                "gradientTransform", "gradientUnits", "kernelMatrix", "kernelUnitLength", "keyPoints",
                "keySplines", "keyTimes", "lengthAdjust", "limitingConeAngle", "markerHeight",
                "markerUnits", "markerWidth", "maskContentUnits", "maskUnits", "numOctaves",
                "pathLength", "patternContentUnits", "patternTransform", "patternUnits", "pointsAtX",
                "pointsAtY", "pointsAtZ", "preserveAlpha", "preserveAspectRatio", "primitiveUnits",
                "referrerPolicy", "refX", "refY", "repeatCount", "repeatDur", "requiredExtensions",
                "requiredFeatures", "specularConstant", "specularExponent", "spreadMethod",
                "startOffset", "stdDeviation", "stitchTiles", "surfaceScale", "systemLanguage",
                "tableValues", "targetX", "targetY", "textLength", "viewBox", "xChannelSelector",
                "yChannelSelector", "zoomAndPan"
        };
        for (String name : verbatim) NAMES.put(name, name);
    }

    private AttributeNames() {}

    public static String normalize(String name) {
        String mapped = NAMES.get(name);
        return mapped != null ? mapped : name.toLowerCase(Locale.ROOT);
    }

    /** Cada mayúscula ASCII pasa a {@code -} + minúscula. */
    static String toKebab(String name) {
        StringBuilder sb = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                sb.append('-').append((char) (c + ('a' - 'A')));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
