package com.tabledsl.generator.codegen.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns schema names into Java identifiers for generated code.
 */
public class NamingUtil {

    /**
     * Prefix that makes an identifier start with an upper-case letter.
     */
    public static final String SENTINEL_PREFIX = "E";

    private static final Pattern NON_WORD = Pattern.compile("\\W");

    private static final Set<String> RESERVED_WORDS = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
            "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
            "volatile", "while", "true", "false", "null", "var", "yield", "record", "_");

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts an arbitrary schema name to an identifier starting with an upper-case letter.
     * <p>
     * Every run of letters and digits is a word; the first character of each word is
     * upper-cased and the rest is kept. A word equal (ignoring case) to an entry of
     * {@code forceCases} is replaced by that entry, so {@code user_id} with {@code ID}
     * becomes {@code UserID}. The sentinel {@value #SENTINEL_PREFIX} is prepended when
     * the result is empty or does not start with an upper-case letter.
     */
    public static String toExportedIdentifier(String name, Collection<String> forceCases) {
        List<StringBuilder> words = new ArrayList<>();
        boolean startsWord = true;
        int i = 0;
        while (i < name.length()) {
            int cp = name.codePointAt(i);
            if (Character.isLetterOrDigit(cp)) {
                if (startsWord) {
                    words.add(new StringBuilder().appendCodePoint(Character.toUpperCase(cp)));
                    startsWord = false;
                } else {
                    words.get(words.size() - 1).appendCodePoint(cp);
                }
            } else {
                startsWord = true;
            }
            i += Character.charCount(cp);
        }

        StringBuilder result = new StringBuilder();
        for (StringBuilder word : words) {
            result.append(applyForceCase(word.toString(), forceCases));
        }
        if (result.length() == 0 || !Character.isUpperCase(result.codePointAt(0))) {
            result.insert(0, SENTINEL_PREFIX);
        }
        return result.toString();
    }

    /**
     * Replaces every non-word character with an underscore and prefixes an underscore
     * when the result is empty or starts with a digit.
     */
    public static String ensureIdentifier(String name) {
        String result = NON_WORD.matcher(name).replaceAll("_");
        if (result.isEmpty() || (result.charAt(0) >= '0' && result.charAt(0) <= '9')) {
            result = "_" + result;
        }
        return result;
    }

    /**
     * Derives a field name from an exported identifier by lower-casing its leading
     * upper-case run: {@code Id -> id}, {@code ID -> id}, {@code HTMLBody -> htmlBody}.
     * Reserved words get a trailing underscore.
     */
    public static String toMemberName(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return identifier;
        }
        int upperRun = 0;
        while (upperRun < identifier.length() && Character.isUpperCase(identifier.charAt(upperRun))) {
            upperRun++;
        }
        int lowerUntil;
        if (upperRun <= 1 || upperRun == identifier.length()) {
            lowerUntil = Math.max(upperRun, 1);
        } else if (Character.isLowerCase(identifier.charAt(upperRun))) {
            // last capital starts the next word
            lowerUntil = upperRun - 1;
        } else {
            lowerUntil = upperRun;
        }
        String member = identifier.substring(0, lowerUntil).toLowerCase(Locale.ROOT) + identifier.substring(lowerUntil);
        return RESERVED_WORDS.contains(member) ? member + "_" : member;
    }

    /**
     * Converts an identifier to SCREAMING_SNAKE_CASE for constants.
     */
    public static String toConstantName(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return identifier;
        }
        String result = identifier.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        result = result.replaceAll("([A-Z])([A-Z][a-z])", "$1_$2");
        return result.toUpperCase(Locale.ROOT);
    }

    /**
     * Splits a comma-separated list, trimming entries and dropping blanks.
     */
    public static List<String> splitList(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static String applyForceCase(String word, Collection<String> forceCases) {
        for (String caseWord : forceCases) {
            if (word.equalsIgnoreCase(caseWord)) {
                return caseWord;
            }
        }
        return word;
    }
}
