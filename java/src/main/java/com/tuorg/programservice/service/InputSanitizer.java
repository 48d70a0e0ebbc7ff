package com.tuorg.programservice.service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Cleans free text before it reaches a prompt or a stored record. */
public final class InputSanitizer {

    public static final int MAX_LIMITATION_LENGTH = 100;
    public static final int MAX_LIMITATIONS = 10;
    public static final int MAX_PREFERENCES_LENGTH = 500;

    private static final Pattern CONTROL = Pattern.compile("[\\n\\r\\t\\x00-\\x1f\\x7f-\\x9f]");
    private static final Pattern SPACES = Pattern.compile(" +");

    private InputSanitizer() {
    }

    public static String sanitize(String value) {
        return sanitize(value, MAX_LIMITATION_LENGTH);
    }

    public static String sanitize(String value, int maxLength) {
        if (value == null) return "";
        String s = CONTROL.matcher(value).replaceAll(" ");
        s = SPACES.matcher(s).replaceAll(" ").trim();
        return s.length() > maxLength ? s.substring(0, maxLength) : s;
    }

    /** Sanitized, non-empty entries only. */
    public static List<String> sanitizeAll(List<String> values) {
        List<String> out = new ArrayList<>();
        if (values == null) return out;
        for (String v : values) {
            String s = sanitize(v);
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }
}
