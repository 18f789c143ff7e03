package com.spatialnote.backend.service.notebook.generate;

import com.spatialnote.backend.domain.WindowPosition;
import com.spatialnote.backend.domain.WindowRecord;
import com.spatialnote.backend.domain.WindowState;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

import static com.spatialnote.backend.service.notebook.generate.PyLiterals.num;

/**
 * Builds the source text of one cell. A window carrying the payload that
 * matches its type gets generated code for that payload; any other window
 * gets a header describing it followed by its free-text content.
 */
@Component
public class CellContentGenerator {

    private final DataFrameCodeGenerator dataFrames = new DataFrameCodeGenerator();
    private final ChartCodeGenerator charts = new ChartCodeGenerator();
    private final PointCloudCodeGenerator pointClouds = new PointCloudCodeGenerator();
    private final VolumeCodeGenerator volumes = new VolumeCodeGenerator();
    private final Model3DCodeGenerator models = new Model3DCodeGenerator();

    public String generate(WindowRecord w) {
        WindowState s = w.getState();
        return switch (w.getWindowType()) {
            case CHARTS -> s.getChartData() != null
                    ? charts.generate(s.getChartData())
                    : codeHeader(w, "Chart Window", "import matplotlib.pyplot as plt\nimport numpy as np");
            case COLUMN -> s.getDataFrameData() != null
                    ? dataFrames.generate(s.getDataFrameData())
                    : codeHeader(w, "DataFrame Viewer Window", "import pandas as pd\nimport numpy as np");
            case VOLUME -> s.getVolumeData() != null
                    ? volumes.generate(s.getVolumeData())
                    : codeHeader(w, "Volume Metrics Window", "import matplotlib.pyplot as plt\nimport pandas as pd");
            case MODEL_3D -> s.getModel3DData() != null
                    ? models.generate(s.getModel3DData())
                    : codeHeader(w, "3D Model Window", "import numpy as np\nfrom mpl_toolkits.mplot3d.art3d import Poly3DCollection");
            case POINT_CLOUD, SPATIAL -> s.getPointCloudData() != null
                    ? pointClouds.generate(s.getPointCloudData())
                    : spatialHeader(w);
        };
    }

    private static String codeHeader(WindowRecord w, String kind, String imports) {
        WindowPosition p = w.getPosition();
        String header = "# " + kind + " #" + w.getId() + "\n"
                + "# Created: " + iso(w.getCreatedAt()) + "\n"
                + "# Position: (" + num(p.x()) + ", " + num(p.y()) + ", " + num(p.z()) + ")\n"
                + "# Window size: " + num(p.width()) + " x " + num(p.height()) + "\n"
                + "\n"
                + imports + "\n";
        String content = w.getState().getContent();
        return content.isEmpty() ? header : header + "\n" + content;
    }

    private static String spatialHeader(WindowRecord w) {
        WindowPosition p = w.getPosition();
        String header = "# Spatial Editor Window #" + w.getId() + "\n"
                + "\n"
                + "**Position:** (" + num(p.x()) + ", " + num(p.y()) + ", " + num(p.z()) + ")  \n"
                + "**Size:** " + num(p.width()) + " x " + num(p.height()) + "  \n"
                + "**Created:** " + iso(w.getCreatedAt()) + "\n"
                + "\n"
                + "## Spatial Content\n"
                + "\n";
        String content = w.getState().getContent();
        return content.isEmpty() ? header + "*No content available*" : header + content;
    }

    static String iso(Instant t) {
        return DateTimeFormatter.ISO_INSTANT.format(t.truncatedTo(ChronoUnit.SECONDS));
    }
}
