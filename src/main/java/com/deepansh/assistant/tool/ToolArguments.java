package com.deepansh.assistant.tool;

import java.util.Map;

/**
 * Lenient readers for bound tool arguments. Models send numbers as strings
 * and integers as doubles often enough that tools should not care.
 */
public final class ToolArguments {

    private ToolArguments() {
    }

    public static String string(Map<String, Object> arguments, String key) {
        Object raw = arguments.get(key);
        return raw != null ? raw.toString() : null;
    }

    public static String string(Map<String, Object> arguments, String key, String fallback) {
        String value = string(arguments, key);
        return value != null && !value.isBlank() ? value : fallback;
    }

    public static int integer(Map<String, Object> arguments, String key, int fallback) {
        Object raw = arguments.get(key);
        if (raw instanceof Number number) {
            return number.intValue();
        }
        if (raw == null) {
            return fallback;
        }
        try {
            return (int) Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public static double decimal(Map<String, Object> arguments, String key, double fallback) {
        Object raw = arguments.get(key);
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
