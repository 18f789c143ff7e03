package com.spatialnote.backend.service.notebook.generate;

import com.spatialnote.backend.domain.payload.ChartData;

import java.util.Locale;

import static com.spatialnote.backend.service.notebook.generate.PyLiterals.comment;
import static com.spatialnote.backend.service.notebook.generate.PyLiterals.numList;
import static com.spatialnote.backend.service.notebook.generate.PyLiterals.str;

public class ChartCodeGenerator implements PayloadCodeGenerator<ChartData> {

    static final String EMPTY = "# Empty chart data\nprint('No chart data available')";

    @Override
    public String generate(ChartData chart) {
        if (chart == null || chart.isEmpty()) return EMPTY;

        return "# " + comment(chart.title()) + "\n"
                + "# Generated from Chart Window\n"
                + "# Chart Type: " + comment(chart.chartType()) + "\n"
                + "\n"
                + "import numpy as np\n"
                + "import matplotlib.pyplot as plt\n"
                + "import pandas as pd\n"
                + "\n"
                + "# Chart data\n"
                + "x_data = np.array([" + numList(chart.xData()) + "])\n"
                + "y_data = np.array([" + numList(chart.yData()) + "])\n"
                + "\n"
                + "fig, ax = plt.subplots(figsize=(10, 6))\n"
                + plotCall(chart) + "\n"
                + "ax.set_xlabel(" + str(chart.xLabel()) + ")\n"
                + "ax.set_ylabel(" + str(chart.yLabel()) + ")\n"
                + "ax.set_title(" + str(chart.title()) + ")\n"
                + "ax.grid(True, alpha=0.3)\n"
                + "plt.tight_layout()\n"
                + "plt.show()\n"
                + "\n"
                + "df = pd.DataFrame({'X': x_data, 'Y': y_data})\n"
                + "print(f\"Data points: {len(x_data)}\")\n"
                + "print(df.describe())";
    }

    private static String plotCall(ChartData chart) {
        String color = chart.color() != null ? ", color=" + str(chart.color()) : "";
        String style = chart.style() != null ? ", linestyle=" + str(chart.style()) : "";
        return switch (chart.chartType().toLowerCase(Locale.ROOT)) {
            case "scatter" -> "ax.scatter(x_data, y_data" + color + ", alpha=0.7)";
            case "bar" -> "ax.bar(x_data, y_data" + color + ")";
            case "area" -> "ax.fill_between(x_data, y_data" + color + ", alpha=0.6)";
            case "line" -> "ax.plot(x_data, y_data" + color + style + ", marker='o', markersize=4)";
            default -> "ax.plot(x_data, y_data" + color + style + ")";
        };
    }
}
