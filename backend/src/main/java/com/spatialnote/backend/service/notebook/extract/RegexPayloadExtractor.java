package com.spatialnote.backend.service.notebook.extract;

import com.spatialnote.backend.domain.WindowState;

import java.util.List;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Ordered list of textual markers, first match wins. The rule that matched
 * builds the payload from the match and the full source; a null result
 * means nothing is attached and later rules are not tried.
 */
public abstract class RegexPayloadExtractor<T> implements PayloadExtractor {

    protected record Rule<T>(Pattern marker, BiFunction<MatchResult, String, T> build) {
        static <T> Rule<T> of(String regex, BiFunction<MatchResult, String, T> build) {
            return new Rule<>(Pattern.compile(regex), build);
        }
    }

    private final List<Rule<T>> rules;

    protected RegexPayloadExtractor(List<Rule<T>> rules) {
        this.rules = List.copyOf(rules);
    }

    @Override
    public final boolean extract(String source, WindowState target) {
        if (source == null || source.isEmpty()) return false;
        for (Rule<T> rule : rules) {
            Matcher m = rule.marker().matcher(source);
            if (m.find()) {
                T payload = rule.build().apply(m.toMatchResult(), source);
                if (payload == null) return false;
                attach(payload, target);
                return true;
            }
        }
        return false;
    }

    protected abstract void attach(T payload, WindowState target);
}
