package com.spatialnote.backend.service.notebook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spatialnote.backend.domain.ExportTemplate;
import com.spatialnote.backend.domain.WindowPosition;
import com.spatialnote.backend.domain.WindowRecord;
import com.spatialnote.backend.domain.WindowState;
import com.spatialnote.backend.domain.WindowType;
import com.spatialnote.backend.domain.workspace.WorkspaceCategory;
import com.spatialnote.backend.domain.workspace.WorkspaceMetadata;
import com.spatialnote.backend.service.notebook.extract.PayloadExtractors;
import com.spatialnote.backend.service.notebook.generate.CellContentGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * Reads and writes the notebook document: one cell per window, window
 * details in cell metadata, generated code in the cell source and an
 * aggregate block in the document metadata.
 *
 * <p>Export is deterministic for a given list of records except for the
 * export date. Import never touches a registry; it numbers the restored
 * records from the id it is given.
 */
@Component
public class NotebookCodec {
    private static final Logger log = LoggerFactory.getLogger(NotebookCodec.class);

    public static final String EXPORT_BLOCK = "spatial_export";
    static final String LEGACY_EXPORT_BLOCK = "visionos_export";
    public static final String WORKSPACE_BLOCK = "workspace_metadata";
    static final int NBFORMAT = 4;
    static final int NBFORMAT_MINOR = 4;

    private final ObjectMapper om;
    private final CellContentGenerator generator;
    private final PayloadExtractors extractors;

    public NotebookCodec(ObjectMapper om, CellContentGenerator generator, PayloadExtractors extractors) {
        this.om = om;
        this.generator = generator;
        this.extractors = extractors;
    }

    // =========================
    // export
    // =========================

    public byte[] export(List<WindowRecord> records, WorkspaceMetadata workspace) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsBytes(toDocument(records, workspace));
        } catch (JsonProcessingException e) {
            // a tree built from plain nodes always serializes
            throw new IllegalStateException("cannot serialize notebook", e);
        }
    }

    public ObjectNode toDocument(List<WindowRecord> records, WorkspaceMetadata workspace) {
        List<WindowRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparingInt(WindowRecord::getId));

        ObjectNode doc = om.createObjectNode();
        ArrayNode cells = doc.putArray("cells");
        for (WindowRecord w : sorted) {
            cells.add(cell(w));
        }

        ObjectNode meta = doc.putObject("metadata");
        ObjectNode kernel = meta.putObject("kernelspec");
        kernel.put("display_name", "Python 3");
        kernel.put("language", "python");
        kernel.put("name", "python3");
        ObjectNode lang = meta.putObject("language_info");
        lang.put("name", "python");
        lang.put("version", "3.8.0");
        lang.put("mimetype", "text/x-python");
        lang.put("file_extension", ".py");
        lang.put("pygments_lexer", "ipython3");
        lang.put("nbconvert_exporter", "python");

        ObjectNode agg = meta.putObject(EXPORT_BLOCK);
        agg.put("export_date", iso(Instant.now()));
        agg.put("total_windows", sorted.size());
        Set<String> types = new TreeSet<>();
        Set<String> templates = new TreeSet<>();
        Set<String> tags = new TreeSet<>();
        for (WindowRecord w : sorted) {
            types.add(w.getWindowType().label());
            templates.add(w.getState().getExportTemplate().label());
            tags.addAll(w.getState().getTags());
        }
        putStrings(agg.putArray("window_types"), types);
        putStrings(agg.putArray("export_templates"), templates);
        putStrings(agg.putArray("all_tags"), tags);

        if (workspace != null) {
            meta.set(WORKSPACE_BLOCK, workspaceBlock(workspace));
        }

        doc.put("nbformat", NBFORMAT);
        doc.put("nbformat_minor", NBFORMAT_MINOR);
        return doc;
    }

    private ObjectNode cell(WindowRecord w) {
        WindowState s = w.getState();
        boolean markdown = s.getExportTemplate() == ExportTemplate.MARKDOWN;

        ObjectNode cell = om.createObjectNode();
        cell.put("cell_type", markdown ? "markdown" : "code");

        ObjectNode meta = cell.putObject("metadata");
        meta.put("window_id", w.getId());
        meta.put("window_type", w.getWindowType().label());
        meta.put("export_template", s.getExportTemplate().label());
        putStrings(meta.putArray("tags"), s.getTags());

        WindowPosition p = w.getPosition();
        ObjectNode pos = meta.putObject("position");
        pos.put("x", p.x());
        pos.put("y", p.y());
        pos.put("z", p.z());
        pos.put("width", p.width());
        pos.put("height", p.height());
        if (p.depth() != null) pos.put("depth", p.depth());

        ObjectNode state = meta.putObject("state");
        state.put("minimized", s.isMinimized());
        state.put("maximized", s.isMaximized());
        state.put("opacity", s.getOpacity());

        ObjectNode ts = meta.putObject("timestamps");
        ts.put("created", iso(w.getCreatedAt()));
        ts.put("modified", iso(s.getLastModified()));

        ArrayNode source = cell.putArray("source");
        for (String line : generator.generate(w).split("\n", -1)) {
            source.add(line);
        }
        if (!markdown) {
            cell.putNull("execution_count");
            cell.putArray("outputs");
        }
        return cell;
    }

    /** Same document with its workspace block replaced; cells are left untouched. */
    public byte[] withWorkspaceBlock(byte[] document, WorkspaceMetadata workspace) {
        JsonNode root = parse(document);
        JsonNode meta = root.get("metadata");
        ObjectNode metaObj = meta instanceof ObjectNode ? (ObjectNode) meta : ((ObjectNode) root).putObject("metadata");
        metaObj.set(WORKSPACE_BLOCK, workspaceBlock(workspace));
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize notebook", e);
        }
    }

    private ObjectNode workspaceBlock(WorkspaceMetadata ws) {
        ObjectNode n = om.createObjectNode();
        n.put("id", ws.getId() == null ? null : ws.getId().toString());
        n.put("name", ws.getName());
        n.put("description", ws.getDescription());
        n.put("category", ws.getCategory().label());
        n.put("is_template", ws.isTemplate());
        n.put("created_date", ws.getCreatedDate() == null ? null : iso(ws.getCreatedDate()));
        n.put("modified_date", ws.getModifiedDate() == null ? null : iso(ws.getModifiedDate()));
        putStrings(n.putArray("tags"), ws.getTags());
        n.put("version", ws.getVersion());
        return n;
    }

    // =========================
    // import
    // =========================

    /**
     * Restores every window cell of the document, numbering them from
     * {@code firstId}. Only an unreadable document or a missing cells array
     * throws; everything else is reported per cell.
     */
    public ImportResult importDocument(byte[] bytes, int firstId) {
        JsonNode root = parse(bytes);
        ArrayNode cells = cells(root);

        List<WindowRecord> restored = new ArrayList<>();
        List<CellImportError> errors = new ArrayList<>();
        Map<Integer, Integer> idMapping = new LinkedHashMap<>();
        int nextId = firstId;

        for (int i = 0; i < cells.size(); i++) {
            JsonNode cell = cells.get(i);
            try {
                WindowRecord w = restoreCell(cell, i, nextId);
                if (w == null) continue;
                JsonNode oldId = cell.path("metadata").path("window_id");
                if (oldId.canConvertToInt() && oldId.isIntegralNumber()) {
                    idMapping.put(oldId.intValue(), nextId);
                }
                restored.add(w);
                nextId++;
            } catch (CellFailure e) {
                log.warn("skipping cell {}: {}", i, e.error.message());
                errors.add(e.error);
            } catch (RuntimeException e) {
                log.warn("skipping cell {}: {}", i, e.toString());
                errors.add(new CellImportError(i, CellImportError.Kind.CELL_PARSING_FAILED, String.valueOf(e.getMessage())));
            }
        }

        ImportResult result = new ImportResult(restored, errors, idMapping, exportInfo(root));
        log.info("import: {}", result.summary());
        return result;
    }

    /** Counts window cells without restoring anything. */
    public NotebookAnalysis analyze(byte[] bytes) {
        JsonNode root = parse(bytes);
        ArrayNode cells = cells(root);

        int windowCells = 0;
        Set<String> types = new TreeSet<>();
        Set<String> templates = new TreeSet<>();
        for (JsonNode cell : cells) {
            JsonNode type = cell.path("metadata").path("window_type");
            if (!type.isTextual()) continue;
            windowCells++;
            types.add(type.asText());
            JsonNode template = cell.path("metadata").path("export_template");
            if (template.isTextual()) templates.add(template.asText());
        }
        return new NotebookAnalysis(cells.size(), windowCells, new ArrayList<>(types),
                new ArrayList<>(templates), exportInfo(root));
    }

    /** True for documents this codec wrote, false for foreign notebooks and garbage. */
    public boolean isNativeDocument(byte[] bytes) {
        try {
            JsonNode root = om.readTree(bytes);
            return root != null && root.has("cells") && exportBlock(root.path("metadata")) != null;
        } catch (IOException e) {
            return false;
        }
    }

    /** The workspace block embedded by a workspace save, if any. */
    public Optional<WorkspaceMetadata> readWorkspaceMetadata(byte[] bytes) {
        JsonNode root;
        try {
            root = om.readTree(bytes);
        } catch (IOException e) {
            return Optional.empty();
        }
        if (root == null) return Optional.empty();
        JsonNode n = root.path("metadata").path(WORKSPACE_BLOCK);
        if (!n.isObject()) return Optional.empty();

        WorkspaceMetadata m = new WorkspaceMetadata();
        try {
            m.setId(n.hasNonNull("id") ? UUID.fromString(n.get("id").asText()) : null);
        } catch (IllegalArgumentException e) {
            m.setId(null);
        }
        m.setName(n.path("name").isTextual() ? n.get("name").asText() : null);
        m.setDescription(n.path("description").asText(""));
        m.setCategory(WorkspaceCategory.fromLabel(n.path("category").asText(null)));
        m.setTemplate(n.path("is_template").asBoolean(false));
        m.setCreatedDate(instant(n.path("created_date")).orElse(null));
        m.setModifiedDate(instant(n.path("modified_date")).orElse(null));
        m.setTags(strings(n.path("tags")));
        m.setVersion(n.path("version").asText(WorkspaceMetadata.CURRENT_VERSION));
        return Optional.of(m);
    }

    private JsonNode parse(byte[] bytes) {
        JsonNode root;
        try {
            root = om.readTree(bytes);
        } catch (IOException e) {
            throw new NotebookImportException(NotebookImportException.Kind.INVALID_JSON,
                    "document is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new NotebookImportException(NotebookImportException.Kind.INVALID_JSON,
                    "document is not a JSON object");
        }
        return root;
    }

    private static ArrayNode cells(JsonNode root) {
        JsonNode cells = root.get("cells");
        if (cells == null || !cells.isArray()) {
            throw new NotebookImportException(NotebookImportException.Kind.INVALID_NOTEBOOK_FORMAT,
                    "document has no cells array");
        }
        return (ArrayNode) cells;
    }

    // null: not a window cell
    private WindowRecord restoreCell(JsonNode cell, int index, int id) {
        if (!cell.isObject()) {
            throw new CellFailure(new CellImportError(index, CellImportError.Kind.CELL_PARSING_FAILED, "cell is not an object"));
        }
        JsonNode meta = cell.get("metadata");
        if (meta == null || meta.isNull()) return null;
        if (!meta.isObject()) {
            throw new CellFailure(new CellImportError(index, CellImportError.Kind.INVALID_METADATA, "metadata is not an object"));
        }
        JsonNode typeNode = meta.get("window_type");
        if (typeNode == null || typeNode.isNull()) return null;
        if (!typeNode.isTextual()) {
            throw new CellFailure(new CellImportError(index, CellImportError.Kind.INVALID_METADATA,
                    "window_type is not a string: " + typeNode));
        }
        Optional<WindowType> type = WindowType.fromLabel(typeNode.asText());
        if (type.isEmpty()) {
            log.debug("cell {} has unknown window type '{}', treated as plain cell", index, typeNode.asText());
            return null;
        }

        WindowState state = new WindowState();
        JsonNode flags = meta.path("state");
        if (flags.isObject()) {
            state.setMinimized(flags.path("minimized").asBoolean(false));
            state.setMaximized(flags.path("maximized").asBoolean(false));
            state.setOpacity(flags.path("opacity").isNumber() ? flags.get("opacity").asDouble() : 1.0);
        }
        JsonNode template = meta.path("export_template");
        if (template.isTextual()) {
            state.setExportTemplate(ExportTemplate.fromLabel(template.asText()).orElse(ExportTemplate.PLAIN));
        }
        state.setTags(strings(meta.path("tags")));

        String source = joinSource(cell.get("source"));
        state.setContent(source);

        JsonNode ts = meta.path("timestamps");
        instant(ts.path("modified")).ifPresent(state::setLastModified);
        Instant created = instant(ts.path("created")).orElse(null);

        extractors.extract(type.get(), source, state);

        return new WindowRecord(id, type.get(), position(meta.path("position")), state, created);
    }

    private static WindowPosition position(JsonNode p) {
        if (!p.isObject()) return WindowPosition.defaults();
        return new WindowPosition(
                num(p, "x", 0),
                num(p, "y", 0),
                num(p, "z", 0),
                num(p, "width", WindowPosition.DEFAULT_WIDTH),
                num(p, "height", WindowPosition.DEFAULT_HEIGHT),
                p.path("depth").isNumber() ? p.get("depth").asDouble() : null);
    }

    private static double num(JsonNode obj, String field, double fallback) {
        JsonNode n = obj.path(field);
        return n.isNumber() ? n.asDouble() : fallback;
    }

    /**
     * Joins the source lines. Lines written by notebook tools keep their
     * trailing newline, lines written here do not.
     */
    static String joinSource(JsonNode source) {
        if (source == null || source.isNull()) return "";
        if (source.isTextual()) return source.asText();
        if (!source.isArray()) return "";

        List<String> lines = new ArrayList<>(source.size());
        for (JsonNode line : source) {
            if (line.isTextual()) lines.add(line.asText());
        }
        boolean terminated = lines.size() > 1;
        for (int i = 0; i < lines.size() - 1; i++) {
            if (!lines.get(i).endsWith("\n")) {
                terminated = false;
                break;
            }
        }
        return terminated ? String.join("", lines) : String.join("\n", lines);
    }

    private ExportInfo exportInfo(JsonNode root) {
        JsonNode block = exportBlock(root.path("metadata"));
        if (block == null) return null;
        return new ExportInfo(
                block.path("export_date").asText(""),
                block.path("total_windows").asInt(0),
                strings(block.path("window_types")),
                strings(block.path("export_templates")),
                strings(block.path("all_tags")));
    }

    private static JsonNode exportBlock(JsonNode meta) {
        if (meta.path(EXPORT_BLOCK).isObject()) return meta.get(EXPORT_BLOCK);
        if (meta.path(LEGACY_EXPORT_BLOCK).isObject()) return meta.get(LEGACY_EXPORT_BLOCK);
        return null;
    }

    private static List<String> strings(JsonNode arr) {
        List<String> out = new ArrayList<>();
        if (!arr.isArray()) return out;
        for (JsonNode n : arr) {
            if (n.isTextual()) out.add(n.asText());
        }
        return out;
    }

    private static void putStrings(ArrayNode arr, Collection<String> values) {
        values.forEach(arr::add);
    }

    private static Optional<Instant> instant(JsonNode n) {
        if (!n.isTextual()) return Optional.empty();
        try {
            return Optional.of(Instant.parse(n.asText()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static String iso(Instant t) {
        return DateTimeFormatter.ISO_INSTANT.format(t.truncatedTo(ChronoUnit.SECONDS));
    }

    private static final class CellFailure extends RuntimeException {
        private final CellImportError error;

        CellFailure(CellImportError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }
    }
}
