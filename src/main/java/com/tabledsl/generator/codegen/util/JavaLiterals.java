package com.tabledsl.generator.codegen.util;

import lombok.experimental.UtilityClass;

/**
 * Renders values as Java source text.
 */
@UtilityClass
public class JavaLiterals {

    /**
     * Double-quoted string literal. Control and non-ASCII characters are written as
     * unicode escapes so the generated file is plain ASCII.
     */
    public String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20 || c > 0x7e) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
        return sb.toString();
    }

    /**
     * Text safe to place after {@code //}: single line, and no unicode escape that
     * javac would translate before parsing.
     */
    public String lineComment(String text) {
        return text.replace("\r\n", " ")
                .replace('\n', ' ')
                .replace('\r', ' ')
                .replace("\\u", "\\ u");
    }
}
