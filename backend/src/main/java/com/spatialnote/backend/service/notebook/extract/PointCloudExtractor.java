package com.spatialnote.backend.service.notebook.extract;

import com.spatialnote.backend.domain.WindowState;
import com.spatialnote.backend.domain.payload.PointCloudData;
import com.spatialnote.backend.domain.payload.PointCloudData.Point;

import java.util.*;

/** Shared by point-cloud and spatial-editor windows. */
public class PointCloudExtractor extends RegexPayloadExtractor<PointCloudData> {

    private static final String ARRAY = "\\s*=\\s*(?:np\\.array\\()?\\[([^\\]]*)\\]";
    private static final String DICT_ARRAY = "['\"]%s['\"]\\s*:\\s*\\[([^\\]]*)\\]";

    public PointCloudExtractor() {
        super(List.of(
                Rule.of("x_points" + ARRAY, (m, src) -> build(
                        SourceText.numbers(m.group(1)),
                        axis(src, "y_points" + ARRAY),
                        axis(src, "z_points" + ARRAY),
                        axis(src, "intensities" + ARRAY),
                        src)),
                Rule.of("points_data\\s*=\\s*\\{", (m, src) -> fromDict(src)),
                Rule.of(String.format(DICT_ARRAY, "x"), (m, src) -> fromDict(src))
        ));
    }

    @Override
    protected void attach(PointCloudData payload, WindowState target) {
        target.setPointCloudData(payload);
    }

    private static List<Double> axis(String source, String regex) {
        return SourceText.group(source, regex).map(SourceText::numbers).orElse(List.of());
    }

    // dict style: {'x': [...], 'y': [...], 'z': [...]}; a bare marker yields a single origin point
    private static PointCloudData fromDict(String source) {
        List<Double> x = axis(source, String.format(DICT_ARRAY, "x"));
        List<Double> y = axis(source, String.format(DICT_ARRAY, "y"));
        List<Double> z = axis(source, String.format(DICT_ARRAY, "z"));
        List<Double> intensity = axis(source, String.format(DICT_ARRAY, "intensity"));
        if (x.isEmpty() || y.isEmpty()) {
            return build(List.of(0.0), List.of(0.0), List.of(0.0), List.of(0.5), source);
        }
        return build(x, y, z, intensity, source);
    }

    private static PointCloudData build(List<Double> x, List<Double> y, List<Double> z,
                                        List<Double> intensity, String source) {
        int n = Math.min(x.size(), y.size());
        if (!z.isEmpty()) n = Math.min(n, z.size());
        if (n == 0) return null;

        List<Point> points = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double zi = z.isEmpty() ? 0.0 : z.get(i);
            Double in = i < intensity.size() ? intensity.get(i) : null;
            points.add(new Point(x.get(i), y.get(i), zi, in, null));
        }

        int declared = SourceText.group(source, "# Point cloud data \\((\\d{1,9}) points\\)")
                .map(Integer::parseInt).orElse(0);

        return new PointCloudData(
                SourceText.title(source).orElse("Imported Point Cloud"),
                SourceText.quotedArgument(source, "ax\\.set_xlabel").orElse("X"),
                SourceText.quotedArgument(source, "ax\\.set_ylabel").orElse("Y"),
                SourceText.quotedArgument(source, "ax\\.set_zlabel").orElse("Z"),
                SourceText.group(source, "(?m)^# Demo Type: (.+?)\\s*$").orElse("imported"),
                parameters(source),
                declared,
                points);
    }

    private static Map<String, Double> parameters(String source) {
        Map<String, Double> out = new LinkedHashMap<>();
        Optional<String> line = SourceText.group(source, "(?m)^# Parameters: (.+)$");
        if (line.isEmpty()) return out;
        for (String pair : line.get().split(",\\s*")) {
            int colon = pair.lastIndexOf(':');
            if (colon <= 0) continue;
            Double v = SourceText.number(pair.substring(colon + 1));
            if (v != null) out.put(pair.substring(0, colon).trim(), v);
        }
        return out;
    }
}
