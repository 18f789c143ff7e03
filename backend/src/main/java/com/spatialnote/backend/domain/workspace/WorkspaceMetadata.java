package com.spatialnote.backend.domain.workspace;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.spatialnote.backend.domain.WindowType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Index entry for one workspace document. Name, description, category and
 * tags are user-owned; totalWindows and windowTypes are derived from the
 * document and may be recomputed at any time.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkspaceMetadata {
    public static final String CURRENT_VERSION = "1.0";

    private UUID id;
    private String name;
    private String description = "";
    private WorkspaceCategory category = WorkspaceCategory.CUSTOM;
    private boolean template;
    private Instant createdDate;
    private Instant modifiedDate;
    private int totalWindows;
    private List<WindowType> windowTypes = new ArrayList<>();
    private List<String> tags = new ArrayList<>();
    private String version = CURRENT_VERSION;
    private String filePath;

    public WorkspaceMetadata() {
    }

    public WorkspaceMetadata(UUID id, String name) {
        Instant now = Instant.now();
        this.id = id;
        this.name = name;
        this.createdDate = now;
        this.modifiedDate = now;
    }

    public WorkspaceMetadata copy() {
        WorkspaceMetadata m = new WorkspaceMetadata();
        m.id = id;
        m.name = name;
        m.description = description;
        m.category = category;
        m.template = template;
        m.createdDate = createdDate;
        m.modifiedDate = modifiedDate;
        m.totalWindows = totalWindows;
        m.windowTypes = new ArrayList<>(windowTypes);
        m.tags = new ArrayList<>(tags);
        m.version = version;
        m.filePath = filePath;
        return m;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description == null ? "" : description; }

    public WorkspaceCategory getCategory() { return category; }
    public void setCategory(WorkspaceCategory category) {
        this.category = category == null ? WorkspaceCategory.CUSTOM : category;
    }

    public boolean isTemplate() { return template; }
    public void setTemplate(boolean template) { this.template = template; }

    public Instant getCreatedDate() { return createdDate; }
    public void setCreatedDate(Instant createdDate) { this.createdDate = createdDate; }

    public Instant getModifiedDate() { return modifiedDate; }
    public void setModifiedDate(Instant modifiedDate) { this.modifiedDate = modifiedDate; }

    public int getTotalWindows() { return totalWindows; }
    public void setTotalWindows(int totalWindows) { this.totalWindows = totalWindows; }

    public List<WindowType> getWindowTypes() { return windowTypes; }
    public void setWindowTypes(List<WindowType> windowTypes) {
        this.windowTypes = windowTypes == null ? new ArrayList<>() : new ArrayList<>(windowTypes);
    }

    public List<String> getTags() { return tags; }
    public void setTags(List<String> tags) { this.tags = tags == null ? new ArrayList<>() : new ArrayList<>(tags); }

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public String getFilePath() { return filePath; }
    public void setFilePath(String filePath) { this.filePath = filePath; }
}
