package com.flow.x.utils.media.csv;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

public final class ValueSanitizer {

    private ValueSanitizer() {
        throw new UnsupportedOperationException("Unsupported operation");
    }

    /**
     * Strips surrounding quotes, spaces and tabs, and turns line breaks into spaces. Null becomes "".
     */
    public static String sanitize(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }

        int length = value.length();
        boolean isQuoted = length > 1 && value.charAt(0) == '"' && value.charAt(length - 1) == '"';
        int start = isQuoted ? 1 : 0;
        int end = isQuoted ? length - 1 : length;

        while (start < end && (value.charAt(start) == ' ' || value.charAt(start) == '\t')) {
            start++;
        }
        while (end > start && (value.charAt(end - 1) == ' ' || value.charAt(end - 1) == '\t')) {
            end--;
        }

        StringBuilder sanitized = new StringBuilder(end - start);
        for (int i = start; i < end; i++) {
            char c = value.charAt(i);
            sanitized.append((c == '\n' || c == '\r') ? ' ' : c);
        }
        return sanitized.toString();
    }

    /**
     * Splits a comma separated cell such as {@code "Dishes, Trash"} into its sanitized, non-blank items.
     */
    public static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : sanitize(value).split(",")) {
            String cleaned = sanitize(item);
            if (StringUtils.isNotBlank(cleaned)) {
                items.add(cleaned);
            }
        }
        return items;
    }

    /** Sanitized cell at {@code index}, or "" past the end of the row. */
    public static String cell(String[] row, int index) {
        return index < row.length ? sanitize(row[index]) : "";
    }
}
