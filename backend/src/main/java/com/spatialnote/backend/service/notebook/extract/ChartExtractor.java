package com.spatialnote.backend.service.notebook.extract;

import com.spatialnote.backend.domain.WindowState;
import com.spatialnote.backend.domain.payload.ChartData;

import java.util.List;
import java.util.Optional;

public class ChartExtractor extends RegexPayloadExtractor<ChartData> {

    private static final String ARRAY = "\\s*=\\s*(?:np\\.array\\()?\\[([^\\]]*)\\]";

    public ChartExtractor() {
        super(List.of(
                Rule.of("x_data" + ARRAY, (m, src) -> build(m.group(1), SourceText.group(src, "y_data" + ARRAY), src)),
                Rule.of("(?m)^\\s*x" + ARRAY, (m, src) -> build(m.group(1), SourceText.group(src, "(?m)^\\s*y" + ARRAY), src)),
                Rule.of("(?:plt|ax\\d?)\\.plot\\(\\s*\\[([^\\]]+)\\]\\s*,\\s*\\[([^\\]]+)\\]",
                        (m, src) -> build(m.group(1), Optional.of(m.group(2)), src))
        ));
    }

    @Override
    protected void attach(ChartData payload, WindowState target) {
        target.setChartData(payload);
    }

    private static ChartData build(String xs, Optional<String> ys, String source) {
        List<Double> x = SourceText.numbers(xs);
        List<Double> y = ys.map(SourceText::numbers).orElse(List.of());
        if (x.isEmpty() || y.isEmpty()) return null;

        String title = SourceText.title(source)
                .or(() -> SourceText.quotedArgument(source, "(?:ax\\d?\\.set_title|plt\\.title)"))
                .orElse("Imported Chart");
        String xLabel = SourceText.quotedArgument(source, "(?:ax\\d?\\.set_xlabel|plt\\.xlabel)").orElse("X");
        String yLabel = SourceText.quotedArgument(source, "(?:ax\\d?\\.set_ylabel|plt\\.ylabel)").orElse("Y");
        String color = SourceText.group(source, "color='((?:[^'\\\\]|\\\\.)*)'").orElse(null);
        String style = SourceText.group(source, "linestyle='((?:[^'\\\\]|\\\\.)*)'").orElse(null);

        return new ChartData(title, chartType(source), xLabel, yLabel, x, y, color, style);
    }

    private static String chartType(String source) {
        Optional<String> declared = SourceText.group(source, "(?m)^# Chart Type: (\\S+)\\s*$");
        if (declared.isPresent()) return declared.get();
        if (source.contains("scatter")) return "scatter";
        if (source.contains(".bar(")) return "bar";
        if (source.contains("fill_between")) return "area";
        return "line";
    }
}
