package com.spatialnote.backend.service.notebook.generate;

import com.spatialnote.backend.domain.payload.DataFrameData;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

import static com.spatialnote.backend.service.notebook.generate.PyLiterals.str;

public class DataFrameCodeGenerator implements PayloadCodeGenerator<DataFrameData> {

    static final String EMPTY = "# Empty DataFrame\ndf = pd.DataFrame()\nprint('No data available')";

    @Override
    public String generate(DataFrameData data) {
        if (data == null || data.isEmpty()) return EMPTY;

        StringBuilder sb = new StringBuilder();
        sb.append("# DataFrame Analysis\n");
        sb.append("# Generated from DataFrame Viewer\n");
        sb.append("\n");
        sb.append("import pandas as pd\n");
        sb.append("import numpy as np\n");
        sb.append("import matplotlib.pyplot as plt\n");
        sb.append("\n");
        sb.append("# DataFrame data (").append(data.shapeRows()).append(" rows, ")
                .append(data.shapeColumns()).append(" columns)\n");
        sb.append("data = {\n");
        for (int c = 0; c < data.columns().size(); c++) {
            List<String> values = new ArrayList<>(data.rows().size());
            for (int r = 0; r < data.rows().size(); r++) {
                values.add(str(data.cell(r, c)));
            }
            sb.append("    ").append(str(data.columns().get(c))).append(": [")
                    .append(String.join(", ", values)).append("],\n");
        }
        sb.append("}\n");
        sb.append("\n");
        sb.append("df = pd.DataFrame(data)\n");

        List<String> dtypeColumns = orderedDtypeColumns(data);
        if (!dtypeColumns.isEmpty()) {
            sb.append("\n# Convert data types\n");
            for (String column : dtypeColumns) {
                sb.append(conversion(column, data.dtypes().get(column))).append('\n');
            }
        }

        sb.append("\n");
        sb.append("print(f\"Shape: {df.shape}\")\n");
        sb.append("print(df.dtypes)\n");
        sb.append("print(df.head(10))\n");
        sb.append("\n");
        sb.append("numeric_cols = df.select_dtypes(include=[np.number]).columns\n");
        sb.append("if len(numeric_cols) > 0:\n");
        sb.append("    df[numeric_cols].plot(kind='bar', figsize=(10, 6))\n");
        sb.append("    plt.tight_layout()\n");
        sb.append("    plt.show()");
        return sb.toString();
    }

    // declared columns first, then any extra dtype keys in name order
    private static List<String> orderedDtypeColumns(DataFrameData data) {
        List<String> out = new ArrayList<>();
        for (String c : data.columns()) {
            if (data.dtypes().containsKey(c) && !out.contains(c)) out.add(c);
        }
        for (String c : new TreeSet<>(data.dtypes().keySet())) {
            if (!out.contains(c)) out.add(c);
        }
        return out;
    }

    static String conversion(String column, String dtype) {
        String col = "df[" + str(column) + "]";
        String t = dtype == null ? "" : dtype.toLowerCase(Locale.ROOT);
        return switch (t) {
            case "int", "integer" -> col + " = pd.to_numeric(" + col + ", errors='coerce').astype('Int64')";
            case "float", "numeric" -> col + " = pd.to_numeric(" + col + ", errors='coerce')";
            case "datetime", "date" -> col + " = pd.to_datetime(" + col + ", errors='coerce')";
            case "bool", "boolean" -> col + " = " + col + ".astype('boolean')";
            default -> "# " + PyLiterals.comment(column) + ": " + PyLiterals.comment(dtype);
        };
    }
}
