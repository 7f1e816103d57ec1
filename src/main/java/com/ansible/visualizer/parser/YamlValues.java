package com.ansible.visualizer.parser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Helpers for reading loosely-typed values out of loaded YAML.
 */
public final class YamlValues {

    /** Prefix of fully-qualified builtin module names. */
    public static final String BUILTIN_PREFIX = "ansible.builtin.";

    private YamlValues() {
        // Utility class
    }

    /**
     * Scalar becomes a single-element list, a list is stringified element-wise,
     * null becomes an empty list.
     */
    public static List<String> toStringList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> values) {
            List<String> result = new ArrayList<>(values.size());
            for (Object v : values) {
                result.add(String.valueOf(v));
            }
            return List.copyOf(result);
        }
        return List.of(String.valueOf(value));
    }

    /**
     * Truthiness as a YAML author would expect it: false, 0, empty strings and
     * empty collections are false.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    public static String asString(Object value) {
        return value != null ? String.valueOf(value) : null;
    }

    /**
     * Value of a module key, accepting the short name and the
     * {@code ansible.builtin.} form. Falsy values count as absent.
     */
    public static Object moduleValue(Map<?, ?> raw, String module) {
        Object value = raw.get(module);
        if (!isTruthy(value)) {
            value = raw.get(BUILTIN_PREFIX + module);
        }
        return isTruthy(value) ? value : null;
    }

    /**
     * Name of a role entry: a bare name or a mapping with {@code role} or {@code name}.
     */
    public static String roleName(Object entry) {
        if (entry instanceof Map<?, ?> map) {
            Object name = map.get("role");
            if (!isTruthy(name)) {
                name = map.get("name");
            }
            return isTruthy(name) ? String.valueOf(name) : null;
        }
        return isTruthy(entry) ? String.valueOf(entry) : null;
    }

    public static List<?> asList(Object value) {
        return value instanceof List<?> list ? list : List.of();
    }
}
