package com.spatialnote.backend.domain;

import com.spatialnote.backend.domain.payload.ChartData;
import com.spatialnote.backend.domain.payload.DataFrameData;
import com.spatialnote.backend.domain.payload.Model3DData;
import com.spatialnote.backend.domain.payload.PointCloudData;
import com.spatialnote.backend.domain.payload.VolumeData;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable part of a window. Payloads are immutable records, so copying the
 * state only needs a fresh tag list.
 */
public class WindowState {
    private boolean minimized;
    private boolean maximized;
    private double opacity = 1.0;
    private Instant lastModified = Instant.now();
    private String content = "";
    private ExportTemplate exportTemplate = ExportTemplate.PLAIN;
    private List<String> tags = new ArrayList<>();

    private DataFrameData dataFrameData;
    private ChartData chartData;
    private PointCloudData pointCloudData;
    private VolumeData volumeData;
    private Model3DData model3DData;

    public WindowState copy() {
        WindowState s = new WindowState();
        s.minimized = minimized;
        s.maximized = maximized;
        s.opacity = opacity;
        s.lastModified = lastModified;
        s.content = content;
        s.exportTemplate = exportTemplate;
        s.tags = new ArrayList<>(tags);
        s.dataFrameData = dataFrameData;
        s.chartData = chartData;
        s.pointCloudData = pointCloudData;
        s.volumeData = volumeData;
        s.model3DData = model3DData;
        return s;
    }

    public boolean isMinimized() { return minimized; }
    public void setMinimized(boolean minimized) { this.minimized = minimized; }

    public boolean isMaximized() { return maximized; }
    public void setMaximized(boolean maximized) { this.maximized = maximized; }

    public double getOpacity() { return opacity; }
    public void setOpacity(double opacity) { this.opacity = opacity; }

    public Instant getLastModified() { return lastModified; }
    public void setLastModified(Instant lastModified) { this.lastModified = lastModified; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content == null ? "" : content; }

    public ExportTemplate getExportTemplate() { return exportTemplate; }
    public void setExportTemplate(ExportTemplate exportTemplate) {
        this.exportTemplate = exportTemplate == null ? ExportTemplate.PLAIN : exportTemplate;
    }

    public List<String> getTags() { return tags; }
    public void setTags(List<String> tags) { this.tags = tags == null ? new ArrayList<>() : new ArrayList<>(tags); }

    public DataFrameData getDataFrameData() { return dataFrameData; }
    public void setDataFrameData(DataFrameData dataFrameData) { this.dataFrameData = dataFrameData; }

    public ChartData getChartData() { return chartData; }
    public void setChartData(ChartData chartData) { this.chartData = chartData; }

    public PointCloudData getPointCloudData() { return pointCloudData; }
    public void setPointCloudData(PointCloudData pointCloudData) { this.pointCloudData = pointCloudData; }

    public VolumeData getVolumeData() { return volumeData; }
    public void setVolumeData(VolumeData volumeData) { this.volumeData = volumeData; }

    public Model3DData getModel3DData() { return model3DData; }
    public void setModel3DData(Model3DData model3DData) { this.model3DData = model3DData; }
}
