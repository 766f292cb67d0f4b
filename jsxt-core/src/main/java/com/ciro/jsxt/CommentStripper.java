package com.ciro.jsxt;

import java.util.regex.Pattern;

/**
 * Preproceso: quita primero los comentarios JSX (bloque envuelto en llaves) y
 * después los comentarios de bloque sueltos, incluidos los de Javadoc.
 * No distingue strings ni regex: un comentario dentro de un string también se va.
 */
public final class CommentStripper {

    private CommentStripper() {}

    // holder: los patrones se compilan en el primer uso
    private static final class Patterns {
        static final Pattern JSX_COMMENT = Pattern.compile("\\{/\\*.*?\\*/\\}", Pattern.DOTALL);
        static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    }

    public static String strip(String source) {
        String withoutJsx = Patterns.JSX_COMMENT.matcher(source).replaceAll("");
        return Patterns.BLOCK_COMMENT.matcher(withoutJsx).replaceAll("");
    }
}
