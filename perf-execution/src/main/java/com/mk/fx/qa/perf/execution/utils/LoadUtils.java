package com.mk.fx.qa.perf.execution.utils;

import java.time.format.DateTimeFormatter;

public final class LoadUtils {

    private LoadUtils() {
        // Utility class, no instantiation
    }

    /** Joins a base URL and a path with exactly one slash between them. */
    public static String joinUrl(String baseUrl, String path) {
        String base = baseUrl == null ? "" : baseUrl;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String tail = path == null ? "" : path;
        while (tail.startsWith("/")) {
            tail = tail.substring(1);
        }
        return base + "/" + tail;
    }

    /**
     * Builds a formatter from either a {@link DateTimeFormatter} pattern or a strftime-style
     * pattern such as {@code %Y%m%d_%H%M%S}.
     *
     * @throws IllegalArgumentException if the pattern is invalid
     */
    public static DateTimeFormatter formatter(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
        }
        if (pattern.indexOf('%') < 0) {
            return DateTimeFormatter.ofPattern(pattern);
        }
        var sb = new StringBuilder();
        var literal = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '%' && i + 1 < pattern.length()) {
                flushLiteral(sb, literal);
                char directive = pattern.charAt(++i);
                sb.append(switch (directive) {
                    case 'Y' -> "yyyy";
                    case 'y' -> "yy";
                    case 'm' -> "MM";
                    case 'd' -> "dd";
                    case 'H' -> "HH";
                    case 'I' -> "hh";
                    case 'M' -> "mm";
                    case 'S' -> "ss";
                    case 'f' -> "SSSSSS";
                    case 'p' -> "a";
                    case 'b' -> "MMM";
                    case 'j' -> "DDD";
                    case '%' -> "'%'";
                    default -> throw new IllegalArgumentException(
                            "Unsupported strftime directive %" + directive + " in " + pattern);
                });
            } else {
                literal.append(c);
            }
        }
        flushLiteral(sb, literal);
        return DateTimeFormatter.ofPattern(sb.toString());
    }

    private static void flushLiteral(StringBuilder sb, StringBuilder literal) {
        if (literal.length() == 0) {
            return;
        }
        sb.append('\'').append(literal.toString().replace("'", "''")).append('\'');
        literal.setLength(0);
    }
}
