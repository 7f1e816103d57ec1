package com.ansible.visualizer.diagram;

import java.util.regex.Pattern;

/**
 * Utility for Mermaid node identifiers and labels.
 */
public class MermaidNamingUtil {

    private static final Pattern INVALID_ID_CHARS = Pattern.compile("[^\\p{L}\\p{N}_\\-]");
    private static final Pattern UNDERSCORE_RUNS = Pattern.compile("__+");

    /** Prefix for identifiers that would otherwise start with a digit. */
    public static final String DIGIT_PREFIX = "id_";

    private MermaidNamingUtil() {
        // Utility class
    }

    /**
     * Converts any text to a node identifier: trimmed, characters other than letters,
     * digits, hyphen and underscore replaced by underscore, underscore runs collapsed,
     * and {@value #DIGIT_PREFIX} prepended when the result starts with a digit.
     */
    public static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        String id = INVALID_ID_CHARS.matcher(text.trim()).replaceAll("_");
        id = UNDERSCORE_RUNS.matcher(id).replaceAll("_");
        if (!id.isEmpty() && Character.isDigit(id.charAt(0))) {
            id = DIGIT_PREFIX + id;
        }
        return id;
    }

    /**
     * Double quotes would end a quoted node label; they become single quotes.
     */
    public static String escapeLabel(Object text) {
        return String.valueOf(text).replace('"', '\'');
    }

    /**
     * Last path segment of a file reference, for labels and include ids.
     */
    public static String fileName(String file) {
        int slash = Math.max(file.lastIndexOf('/'), file.lastIndexOf('\\'));
        return slash >= 0 ? file.substring(slash + 1) : file;
    }
}
