package com.spatialnote.backend.service.notebook.generate;

import java.util.List;
import java.util.stream.Collectors;

/** Python literal formatting shared by the generators and the extractors. */
public final class PyLiterals {

    private PyLiterals() {
    }

    /** Single-quoted string literal. */
    public static String str(String s) {
        if (s == null) return "''";
        StringBuilder sb = new StringBuilder(s.length() + 2).append('\'');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\'' -> sb.append("\\'");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }

    /** Inverse of {@link #str(String)} applied to the text between the quotes. */
    public static String unescape(String body) {
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char n = body.charAt(++i);
                switch (n) {
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    default -> sb.append(n);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String num(double d) {
        if (Double.isNaN(d)) return "np.nan";
        if (Double.isInfinite(d)) return d > 0 ? "np.inf" : "-np.inf";
        return Double.toString(d);
    }

    public static String numList(List<Double> values) {
        return values.stream().map(v -> num(v == null ? Double.NaN : v)).collect(Collectors.joining(", "));
    }

    /** A comment line is a single line; newlines would leak code into the cell. */
    public static String comment(String s) {
        return s == null ? "" : s.replace('\n', ' ').replace('\r', ' ');
    }
}
