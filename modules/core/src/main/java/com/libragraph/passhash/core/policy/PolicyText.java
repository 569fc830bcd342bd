package com.libragraph.passhash.core.policy;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads and writes the ini form of a policy: at most one {@code [section]},
 * {@code key = value} lines, {@code #} or {@code ;} comments, comma-separated lists.
 */
public final class PolicyText {

    public static final String SECTION = "passhash";

    private PolicyText() {
    }

    public static Map<String, String> parse(String text) {
        Map<String, String> values = new LinkedHashMap<>();
        String section = null;
        String[] lines = text.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                continue;
            }
            if (line.startsWith("[")) {
                if (!line.endsWith("]")) {
                    throw new IllegalArgumentException("line " + (i + 1) + ": malformed section header");
                }
                if (section != null) {
                    throw new IllegalArgumentException("line " + (i + 1) + ": policy text may contain only one section");
                }
                section = line.substring(1, line.length() - 1).trim();
                continue;
            }
            int eq = separatorIndex(line);
            if (eq <= 0) {
                throw new IllegalArgumentException("line " + (i + 1) + ": expected 'key = value'");
            }
            String key = line.substring(0, eq).trim();
            if (values.put(key, line.substring(eq + 1).trim()) != null) {
                throw new IllegalArgumentException("line " + (i + 1) + ": duplicate key '" + key + "'");
            }
        }
        return values;
    }

    public static String render(Map<String, ?> values) {
        StringBuilder sb = new StringBuilder("[").append(SECTION).append("]\n");
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            sb.append(entry.getKey()).append(" = ").append(format(entry.getValue())).append('\n');
        }
        return sb.toString();
    }

    private static String format(Object value) {
        if (value instanceof Collection<?> items) {
            return items.stream().map(String::valueOf).collect(Collectors.joining(", "));
        }
        return String.valueOf(value);
    }

    private static int separatorIndex(String line) {
        int eq = line.indexOf('=');
        int colon = line.indexOf(':');
        if (eq < 0) return colon;
        if (colon < 0) return eq;
        return Math.min(eq, colon);
    }
}
