package com.spatialnote.backend.service.notebook.extract;

import com.spatialnote.backend.domain.WindowState;
import com.spatialnote.backend.domain.WindowType;
import com.spatialnote.backend.domain.payload.ChartData;
import com.spatialnote.backend.domain.payload.DataFrameData;
import com.spatialnote.backend.domain.payload.Model3DData;
import com.spatialnote.backend.domain.payload.Model3DData.Face;
import com.spatialnote.backend.domain.payload.Model3DData.Vector3;
import com.spatialnote.backend.domain.payload.PointCloudData;
import com.spatialnote.backend.domain.payload.PointCloudData.Point;
import com.spatialnote.backend.domain.payload.VolumeData;
import com.spatialnote.backend.service.notebook.generate.DataFrameCodeGenerator;
import com.spatialnote.backend.service.notebook.generate.Model3DCodeGenerator;
import com.spatialnote.backend.service.notebook.generate.PointCloudCodeGenerator;
import com.spatialnote.backend.service.notebook.generate.VolumeCodeGenerator;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class PayloadExtractorsTest {

    private final PayloadExtractors extractors = new PayloadExtractors();

    @Test
    void dataFrameWithDtypesComesBack() {
        DataFrameData df = new DataFrameData(
                List.of("city", "temp", "when"),
                List.of(List.of("O'Hare", "21.5", "2024-01-01"), List.of("Oslo", "-3", "2024-01-02")),
                Map.of("temp", "float", "when", "datetime", "city", "category"));
        WindowState state = new WindowState();

        assertTrue(extractors.extract(WindowType.COLUMN, new DataFrameCodeGenerator().generate(df), state));

        assertEquals(df, state.getDataFrameData());
    }

    @Test
    void inlineDictIsRead() {
        String source = "import pandas as pd\ndata = {'a': [1, 2], 'b': [3, 4]}\ndf = pd.DataFrame(data)";
        WindowState state = new WindowState();

        extractors.extract(WindowType.COLUMN, source, state);

        DataFrameData df = state.getDataFrameData();
        assertEquals(List.of("a", "b"), df.columns());
        assertEquals(List.of(List.of("1", "3"), List.of("2", "4")), df.rows());
    }

    @Test
    void bareDataFrameCallLeavesPlaceholder() {
        WindowState state = new WindowState();

        extractors.extract(WindowType.COLUMN, "df = pd.DataFrame(load())", state);

        assertEquals(List.of("imported_column"), state.getDataFrameData().columns());
    }

    @Test
    void chartFromPlainPlotCall() {
        String source = "import matplotlib.pyplot as plt\nplt.plot([1, 2, 3], [4, 5, 6])\nplt.title('Growth')\nplt.xlabel('t')";
        WindowState state = new WindowState();

        assertTrue(extractors.extract(WindowType.CHARTS, source, state));

        ChartData chart = state.getChartData();
        assertEquals(List.of(1.0, 2.0, 3.0), chart.xData());
        assertEquals(List.of(4.0, 5.0, 6.0), chart.yData());
        assertEquals("Growth", chart.title());
        assertEquals("t", chart.xLabel());
        assertEquals("line", chart.chartType());
    }

    @Test
    void chartWithoutArraysAttachesNothing() {
        WindowState state = new WindowState();

        assertFalse(extractors.extract(WindowType.CHARTS, "# Chart Window #1\nimport numpy as np\n", state));
        assertNull(state.getChartData());
    }

    @Test
    void pointCloudComesBack() {
        PointCloudData cloud = new PointCloudData("Sphere", "X", "Y", "Z", "sphere",
                Map.of("radius", 2.0, "density", 0.5), 0,
                List.of(new Point(1, 2, 3, 0.5, null), new Point(-1, 0.25, 4, 0.75, null)));
        WindowState state = new WindowState();

        assertTrue(extractors.extract(WindowType.POINT_CLOUD, new PointCloudCodeGenerator().generate(cloud), state));

        assertEquals(cloud, state.getPointCloudData());
    }

    @Test
    void oversizedDeclaredPointCountDoesNotLoseTheCloud() {
        String source = "# Point cloud data (99999999999 points)\n"
                + "points_data = {\n    'x': [1.0, 2.0],\n    'y': [3.0, 4.0],\n    'z': [5.0, 6.0]\n}";
        WindowState state = new WindowState();

        assertTrue(extractors.extract(WindowType.POINT_CLOUD, source, state));

        PointCloudData cloud = state.getPointCloudData();
        assertEquals(2, cloud.points().size());
        assertEquals(2, cloud.totalPoints());
    }

    @Test
    void pointsDictMarkerWithoutArraysGivesOriginPoint() {
        WindowState state = new WindowState();

        extractors.extract(WindowType.SPATIAL, "points_data = {\n    'source': load()\n}", state);

        assertEquals(List.of(new Point(0, 0, 0, 0.5, null)), state.getPointCloudData().points());
        assertEquals("imported", state.getPointCloudData().demoType());
    }

    @Test
    void volumeMetricsComeBack() {
        VolumeData volume = new VolumeData("Model Stats", "model",
                Map.of("accuracy", 0.95, "loss", 0.05), "%", null);
        WindowState state = new WindowState();

        assertTrue(extractors.extract(WindowType.VOLUME, new VolumeCodeGenerator().generate(volume), state));

        VolumeData back = state.getVolumeData();
        assertEquals("Model Stats", back.title());
        assertEquals("model", back.category());
        assertEquals(volume.metrics(), back.metrics());
        assertEquals("%", back.unit());
    }

    @Test
    void looseAssignmentsBecomeMetrics() {
        WindowState state = new WindowState();

        extractors.extract(WindowType.VOLUME, "accuracy = 0.9\nlatency: 120\nname = model", state);

        VolumeData v = state.getVolumeData();
        assertEquals("Extracted Metrics", v.title());
        assertEquals(Map.of("accuracy", 0.9, "latency", 120.0), v.metrics());
    }

    @Test
    void modelComesBack() {
        Model3DData model = new Model3DData("Pyramid", "mesh",
                List.of(new Vector3(0, 0, 0), new Vector3(1, 0, 0), new Vector3(0, 1, 0), new Vector3(0, 0, 1)),
                List.of(new Face(List.of(0, 1, 2)), new Face(List.of(0, 1, 3))),
                List.of(), 2.0, new Vector3(1, 2, 3), new Vector3(0, 0.5, 0));
        WindowState state = new WindowState();

        assertTrue(extractors.extract(WindowType.MODEL_3D, new Model3DCodeGenerator().generate(model), state));

        assertEquals(model, state.getModel3DData());
    }

    @Test
    void emptyOrUnrelatedSourceIsNotAnError() {
        WindowState state = new WindowState();

        assertFalse(extractors.extract(WindowType.MODEL_3D, "", state));
        assertFalse(extractors.extract(WindowType.VOLUME, "print('hello')", state));
        assertNull(state.getModel3DData());
        assertNull(state.getVolumeData());
    }
}
