package com.memlayout.generator.codegen.util;

import java.util.Locale;

/**
 * Utility for consistent identifier and literal naming in generated headers.
 */
public class NamingUtil {

    public static final String UNNAMED = "unnamed";

    private NamingUtil() {
        // Utility class
    }

    /**
     * Turns arbitrary user text into a valid identifier: every character that
     * is not a letter, digit or underscore becomes an underscore, and a
     * leading underscore is added when the result would start with a digit.
     */
    public static String sanitizeIdentifier(String name) {
        if (name == null || name.isEmpty()) {
            return UNNAMED;
        }
        StringBuilder out = new StringBuilder(name.length() + 1);
        name.codePoints().forEach(cp -> {
            if (Character.isLetterOrDigit(cp) || cp == '_') {
                out.appendCodePoint(cp);
            } else {
                out.append('_');
            }
        });
        int first = out.codePointAt(0);
        if (!Character.isLetter(first) && first != '_') {
            out.insert(0, '_');
        }
        return out.toString();
    }

    /**
     * Placeholder for fields without a user name, e.g. {@code field_0c}.
     */
    public static String offsetFieldName(int offset) {
        return String.format("field_%02x", offset);
    }

    /**
     * Fallback type name for a struct with neither type name nor node name.
     */
    public static String anonymousTypeName(long id) {
        return "anon_" + Long.toHexString(id);
    }

    /**
     * Synthesized padding field name, e.g. {@code _pad000a}.
     */
    public static String paddingName(int counter) {
        return String.format("_pad%04x", counter);
    }

    /**
     * Upper-case hexadecimal literal, e.g. {@code 0x1C}.
     */
    public static String hex(long value) {
        return "0x" + Long.toHexString(value).toUpperCase(Locale.ROOT);
    }
}
