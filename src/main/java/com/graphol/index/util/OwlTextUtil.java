package com.graphol.index.util;

import java.util.regex.Pattern;

/**
 * Utility for turning predicate labels into OWL compatible names.
 */
public class OwlTextUtil {

    private static final Pattern OWL_INVALID_CHAR = Pattern.compile("\\W", Pattern.UNICODE_CHARACTER_CLASS);

    private OwlTextUtil() {
        // Utility class
    }

    /**
     * Replaces every character that is not a letter, digit or underscore with '_'.
     * "has parent" and "has_parent" therefore denote the same predicate.
     */
    public static String toOwlText(String text) {
        if (text == null) {
            return "";
        }
        return OWL_INVALID_CHAR.matcher(text).replaceAll("_");
    }
}
