package com.spatialnote.backend.service.notebook.generate;

import com.spatialnote.backend.domain.payload.VolumeData;

import java.util.Map;
import java.util.TreeMap;

import static com.spatialnote.backend.service.notebook.generate.PyLiterals.comment;
import static com.spatialnote.backend.service.notebook.generate.PyLiterals.num;
import static com.spatialnote.backend.service.notebook.generate.PyLiterals.str;

public class VolumeCodeGenerator implements PayloadCodeGenerator<VolumeData> {

    static final String EMPTY = "# Empty volume data\nprint('No volume data available')";

    @Override
    public String generate(VolumeData volume) {
        if (volume == null || volume.isEmpty()) return EMPTY;

        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(comment(volume.title())).append('\n');
        sb.append("# Generated from Volume Window\n");
        sb.append("# Category: ").append(comment(volume.category())).append('\n');
        sb.append('\n');
        sb.append("import matplotlib.pyplot as plt\n");
        sb.append("import pandas as pd\n");
        sb.append('\n');
        sb.append("# Volume metrics data\n");
        sb.append("metrics = {\n");
        for (Map.Entry<String, Double> e : new TreeMap<>(volume.metrics()).entrySet()) {
            sb.append("    ").append(str(e.getKey())).append(": ").append(num(e.getValue())).append(",\n");
        }
        sb.append("}\n");
        sb.append("unit_str = ").append(str(volume.unit() == null ? "" : volume.unit())).append('\n');
        sb.append('\n');
        sb.append("df_metrics = pd.DataFrame(list(metrics.items()), columns=['Metric', 'Value'])\n");
        sb.append("for metric, value in metrics.items():\n");
        sb.append("    print(f\"{metric:20}: {value:10.3f} {unit_str}\")\n");
        sb.append('\n');
        sb.append("fig, ax = plt.subplots(figsize=(10, 6))\n");
        sb.append("ax.bar(df_metrics['Metric'], df_metrics['Value'])\n");
        sb.append("ax.set_title(").append(str(volume.title())).append(")\n");
        sb.append("plt.tight_layout()\n");
        sb.append("plt.show()");
        return sb.toString();
    }
}
