package com.spatialnote.backend.service.notebook.extract;

import com.spatialnote.backend.domain.WindowState;
import com.spatialnote.backend.domain.payload.VolumeData;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class VolumeExtractor extends RegexPayloadExtractor<VolumeData> {

    private static final String NUMBER = "(-?\\d+(?:\\.\\d+)?(?:[eE][-+]?\\d+)?|-?np\\.inf|np\\.nan)";
    private static final Pattern KEY_VALUE = Pattern.compile("['\"]([^'\",]+)['\"]\\s*:\\s*" + NUMBER);
    private static final List<Pattern> LOOSE_METRICS = List.of(
            Pattern.compile("(?m)^\\s*(\\w+)\\s*=\\s*" + NUMBER + "\\s*$"),
            Pattern.compile("(?m)^\\s*(\\w+):\\s*" + NUMBER + "\\s*$"));

    public VolumeExtractor() {
        super(List.of(
                Rule.of("metrics\\s*=\\s*\\{([^}]+)\\}", (m, src) -> fromDict(m.group(1), src)),
                Rule.of("performance\\s*=\\s*\\{([^}]+)\\}", (m, src) -> fromDict(m.group(1), src)),
                Rule.of("volume_data\\s*=\\s*\\{([^}]+)\\}", (m, src) -> fromDict(m.group(1), src)),
                Rule.of("model_metrics\\s*=\\s*\\{([^}]+)\\}", (m, src) -> fromDict(m.group(1), src)),
                Rule.of("(?m)^\\s*\\w+\\s*[=:]\\s*" + NUMBER + "\\s*$", (m, src) -> loose(src))
        ));
    }

    @Override
    protected void attach(VolumeData payload, WindowState target) {
        target.setVolumeData(payload);
    }

    private static VolumeData fromDict(String body, String source) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        Matcher m = KEY_VALUE.matcher(body);
        while (m.find()) {
            Double v = SourceText.number(m.group(2));
            if (v != null) metrics.put(m.group(1), v);
        }
        if (metrics.isEmpty()) return null;

        return new VolumeData(
                SourceText.title(source).orElse("Imported Volume Data"),
                SourceText.group(source, "(?m)^# Category: (.+?)\\s*$").orElseGet(() -> category(source)),
                metrics,
                unit(source),
                null);
    }

    // individual assignments such as "accuracy = 0.95" or "latency: 120"
    private static VolumeData loose(String source) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        for (Pattern p : LOOSE_METRICS) {
            Matcher m = p.matcher(source);
            while (m.find()) {
                Double v = SourceText.number(m.group(2));
                if (v != null) metrics.put(m.group(1), v);
            }
        }
        if (metrics.isEmpty()) return null;
        return new VolumeData("Extracted Metrics", "general", metrics, null, null);
    }

    private static String category(String source) {
        String s = source.toLowerCase(Locale.ROOT);
        if (s.contains("performance") || s.contains("metric")) return "performance";
        if (s.contains("model") || s.contains("ml")) return "model";
        if (s.contains("system") || s.contains("resource")) return "system";
        return "general";
    }

    private static String unit(String source) {
        return SourceText.group(source, "unit_str\\s*=\\s*'((?:[^'\\\\]|\\\\.)*)'")
                .or(() -> SourceText.group(source, "units?['\"]\\s*:\\s*['\"]([^'\"]+)['\"]"))
                .filter(u -> !u.isEmpty())
                .orElse(null);
    }
}
