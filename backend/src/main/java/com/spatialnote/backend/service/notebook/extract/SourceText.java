package com.spatialnote.backend.service.notebook.extract;

import com.spatialnote.backend.service.notebook.generate.PyLiterals;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Small text helpers for reading values back out of generated code. */
final class SourceText {

    private static final Pattern TITLE = Pattern.compile("(?m)^# (.+)$");
    private static final Pattern QUOTED = Pattern.compile("'((?:[^'\\\\]|\\\\.)*)'|\"((?:[^\"\\\\]|\\\\.)*)\"");

    private SourceText() {
    }

    /** First "# " comment line, trimmed. */
    static Optional<String> title(String source) {
        Matcher m = TITLE.matcher(source);
        return m.find() ? Optional.of(m.group(1).trim()).filter(s -> !s.isEmpty()) : Optional.empty();
    }

    static Optional<String> group(String source, String regex) {
        Matcher m = Pattern.compile(regex).matcher(source);
        if (!m.find()) return Optional.empty();
        for (int g = 1; g <= m.groupCount(); g++) {
            if (m.group(g) != null) return Optional.of(m.group(g));
        }
        return Optional.empty();
    }

    /** Value of a quoted argument, e.g. set_xlabel('Time'). */
    static Optional<String> quotedArgument(String source, String callRegex) {
        return group(source, callRegex + "\\(\\s*(?:'((?:[^'\\\\]|\\\\.)*)'|\"((?:[^\"\\\\]|\\\\.)*)\")")
                .map(PyLiterals::unescape);
    }

    static List<String> quotedStrings(String text) {
        List<String> out = new ArrayList<>();
        Matcher m = QUOTED.matcher(text);
        while (m.find()) {
            out.add(PyLiterals.unescape(m.group(1) != null ? m.group(1) : m.group(2)));
        }
        return out;
    }

    /** Comma separated numbers; tokens that are not numbers are skipped. */
    static List<Double> numbers(String text) {
        List<Double> out = new ArrayList<>();
        if (text == null) return out;
        for (String token : text.split(",")) {
            Double d = number(token);
            if (d != null) out.add(d);
        }
        return out;
    }

    static Double number(String token) {
        String t = token.trim();
        if (t.isEmpty()) return null;
        switch (t) {
            case "np.nan", "nan", "float('nan')":
                return Double.NaN;
            case "np.inf", "inf":
                return Double.POSITIVE_INFINITY;
            case "-np.inf", "-inf":
                return Double.NEGATIVE_INFINITY;
            default:
                try {
                    return Double.parseDouble(t);
                } catch (NumberFormatException e) {
                    return null;
                }
        }
    }

    /**
     * Contents of the bracketed list that starts at or after {@code from},
     * honouring nested brackets. Empty when there is no balanced list.
     */
    static Optional<String> bracketed(String source, int from) {
        int open = source.indexOf('[', from);
        if (open < 0) return Optional.empty();
        int depth = 0;
        for (int i = open; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '[') depth++;
            else if (c == ']' && --depth == 0) return Optional.of(source.substring(open + 1, i));
        }
        return Optional.empty();
    }

    /** Innermost bracketed groups, e.g. the rows of [[1, 2], [3, 4]]. */
    static List<String> innerLists(String body) {
        List<String> out = new ArrayList<>();
        Matcher m = Pattern.compile("\\[([^\\[\\]]*)\\]").matcher(body);
        while (m.find()) out.add(m.group(1));
        return out;
    }
}
