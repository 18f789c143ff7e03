package com.spatialnote.backend.service.notebook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.spatialnote.backend.domain.ExportTemplate;
import com.spatialnote.backend.domain.WindowPosition;
import com.spatialnote.backend.domain.WindowRecord;
import com.spatialnote.backend.domain.WindowState;
import com.spatialnote.backend.domain.WindowType;
import com.spatialnote.backend.domain.payload.ChartData;
import com.spatialnote.backend.domain.payload.DataFrameData;
import com.spatialnote.backend.domain.workspace.WorkspaceCategory;
import com.spatialnote.backend.domain.workspace.WorkspaceMetadata;
import com.spatialnote.backend.repo.RecordingPresenter;
import com.spatialnote.backend.repo.WindowRegistry;
import com.spatialnote.backend.service.notebook.extract.PayloadExtractors;
import com.spatialnote.backend.service.notebook.generate.CellContentGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class NotebookCodecTest {

    private ObjectMapper om;
    private NotebookCodec codec;

    @BeforeEach
    void setUp() {
        om = new ObjectMapper();
        om.registerModule(new JavaTimeModule());
        om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        codec = new NotebookCodec(om, new CellContentGenerator(), new PayloadExtractors());
    }

    // =========================
    // export
    // =========================

    @Test
    void exportWritesOneCellPerWindowInIdOrder() throws Exception {
        WindowRecord b = window(7, WindowType.COLUMN);
        WindowRecord a = window(3, WindowType.CHARTS);
        a.getState().setTags(List.of("z", "a"));

        JsonNode doc = om.readTree(codec.export(List.of(b, a), null));

        JsonNode cells = doc.get("cells");
        assertEquals(2, cells.size());
        assertEquals(3, cells.get(0).path("metadata").path("window_id").asInt());
        assertEquals(7, cells.get(1).path("metadata").path("window_id").asInt());
        assertEquals("Charts", cells.get(0).path("metadata").path("window_type").asText());
        assertEquals("code", cells.get(0).path("cell_type").asText());
        assertTrue(cells.get(0).path("execution_count").isNull());
        assertTrue(cells.get(0).path("outputs").isArray());

        assertEquals(4, doc.path("nbformat").asInt());
        JsonNode agg = doc.path("metadata").path(NotebookCodec.EXPORT_BLOCK);
        assertEquals(2, agg.path("total_windows").asInt());
        assertEquals(List.of("a", "z"), strings(agg.path("all_tags")));
        assertEquals(List.of("Charts", "DataFrame Viewer"), strings(agg.path("window_types")));
        assertFalse(doc.path("metadata").has(NotebookCodec.WORKSPACE_BLOCK));
    }

    @Test
    void emptyRegistryExportsCompleteDocument() throws Exception {
        byte[] bytes = codec.export(List.of(), null);
        JsonNode doc = om.readTree(bytes);

        assertTrue(doc.path("cells").isArray());
        assertEquals(0, doc.path("cells").size());
        assertEquals(4, doc.path("nbformat").asInt());
        assertEquals(4, doc.path("nbformat_minor").asInt());
        JsonNode meta = doc.path("metadata");
        assertEquals("python3", meta.path("kernelspec").path("name").asText());
        assertEquals("python", meta.path("language_info").path("name").asText());
        JsonNode block = meta.path(NotebookCodec.EXPORT_BLOCK);
        assertTrue(block.isObject());
        assertEquals(0, block.path("total_windows").asInt(-1));
        assertTrue(block.path("export_date").isTextual());
        assertAll(
                () -> assertEquals(0, block.path("window_types").size()),
                () -> assertTrue(block.path("window_types").isArray()),
                () -> assertTrue(block.path("export_templates").isArray()),
                () -> assertEquals(0, block.path("export_templates").size()),
                () -> assertTrue(block.path("all_tags").isArray()),
                () -> assertEquals(0, block.path("all_tags").size())
        );

        ImportResult back = codec.importDocument(bytes, 1);
        assertTrue(back.restoredWindows().isEmpty());
        assertTrue(back.errors().isEmpty());
        assertNotNull(back.originalMetadata());
    }

    @Test
    void markdownTemplateExportsMarkdownCell() throws Exception {
        WindowRecord w = window(1, WindowType.SPATIAL);
        w.getState().setExportTemplate(ExportTemplate.MARKDOWN);

        JsonNode cell = om.readTree(codec.export(List.of(w), null)).get("cells").get(0);

        assertEquals("markdown", cell.path("cell_type").asText());
        assertFalse(cell.has("outputs"));
        assertFalse(cell.has("execution_count"));
    }

    @Test
    void workspaceBlockIsEmbeddedWhenGiven() throws Exception {
        WorkspaceMetadata ws = new WorkspaceMetadata(UUID.randomUUID(), "Demo");
        ws.setCategory(WorkspaceCategory.MODELING_3D);

        JsonNode block = om.readTree(codec.export(List.of(), ws)).path("metadata").path(NotebookCodec.WORKSPACE_BLOCK);

        assertEquals("Demo", block.path("name").asText());
        assertEquals("3D Modeling", block.path("category").asText());
        assertEquals(ws.getId().toString(), block.path("id").asText());
    }

    // =========================
    // import
    // =========================

    @Test
    void structuralFieldsSurviveRoundTrip() {
        WindowRecord w = window(4, WindowType.COLUMN);
        w.setPosition(new WindowPosition(1, 2, 3, 400, 300));
        w.getState().setTags(List.of("a", "b"));
        w.getState().setExportTemplate(ExportTemplate.PANDAS);
        w.getState().setOpacity(0.5);
        w.getState().setMaximized(true);

        ImportResult result = codec.importDocument(codec.export(List.of(w), null), 1);

        assertEquals(1, result.restoredWindows().size());
        WindowRecord back = result.restoredWindows().get(0);
        assertAll(
                () -> assertEquals(new WindowPosition(1, 2, 3, 400, 300), back.getPosition()),
                () -> assertEquals(List.of("a", "b"), back.getState().getTags()),
                () -> assertEquals(ExportTemplate.PANDAS, back.getState().getExportTemplate()),
                () -> assertEquals(WindowType.COLUMN, back.getWindowType()),
                () -> assertEquals(0.5, back.getState().getOpacity()),
                () -> assertTrue(back.getState().isMaximized()),
                () -> assertEquals(Map.of(4, 1), result.idMapping()),
                () -> assertTrue(result.isSuccessful())
        );
    }

    @Test
    void depthIsKeptForVolumetricWindows() {
        WindowRecord w = window(1, WindowType.MODEL_3D);
        w.setPosition(new WindowPosition(0, 0, -1, 500, 500, 250.0));

        WindowRecord back = codec.importDocument(codec.export(List.of(w), null), 1).restoredWindows().get(0);

        assertEquals(250.0, back.getPosition().depth());
    }

    @Test
    void payloadsAreRecoveredFromGeneratedCode() {
        WindowRecord table = window(1, WindowType.COLUMN);
        DataFrameData df = new DataFrameData(
                List.of("name", "age"),
                List.of(List.of("Alice", "30"), List.of("Bob", "25")),
                Map.of("age", "int"));
        table.getState().setDataFrameData(df);

        WindowRecord chart = window(2, WindowType.CHARTS);
        ChartData cd = new ChartData("Sales", "line", "Month", "Revenue",
                List.of(1.0, 2.0, 3.0), List.of(10.0, 20.0, 15.0), null, null);
        chart.getState().setChartData(cd);

        List<WindowRecord> back = codec.importDocument(codec.export(List.of(table, chart), null), 1).restoredWindows();

        assertEquals(df, back.get(0).getState().getDataFrameData());
        assertEquals(cd, back.get(1).getState().getChartData());
    }

    @Test
    void importNumbersFromGivenIdIgnoringEmbeddedIds() {
        byte[] doc = codec.export(List.of(window(1, WindowType.CHARTS), window(2, WindowType.VOLUME)), null);

        ImportResult result = codec.importDocument(doc, 6);

        assertEquals(List.of(6, 7), result.restoredWindows().stream().map(WindowRecord::getId).toList());
        assertEquals(Map.of(1, 6, 2, 7), result.idMapping());
    }

    @Test
    void importIntoRegistryAvoidsExistingIds() {
        WindowRegistry registry = new WindowRegistry(new RecordingPresenter());
        registry.create(WindowType.CHARTS, 1, null);
        registry.create(WindowType.CHARTS, 2, null);
        registry.create(WindowType.CHARTS, 5, null);
        NotebookService service = new NotebookService(registry, codec);

        byte[] doc = codec.export(List.of(window(1, WindowType.COLUMN), window(2, WindowType.SPATIAL)), null);
        ImportResult result = service.importInto(doc);

        assertEquals(List.of(6, 7), result.restoredWindows().stream().map(WindowRecord::getId).toList());
        assertEquals(Map.of(1, 6, 2, 7), result.idMapping());
        assertEquals(8, registry.getNextId());
        assertEquals(5, registry.size());
        assertEquals(WindowType.COLUMN, registry.find(6).orElseThrow().getWindowType());
        assertEquals(WindowType.CHARTS, registry.find(1).orElseThrow().getWindowType());
        // restored records are not open until someone opens them
        assertTrue(registry.listAll(true).isEmpty());
    }

    @Test
    void badCellDoesNotStopTheOthers() {
        String json = """
                {"cells": [
                  {"cell_type": "code", "metadata": {"window_id": 1, "window_type": "Charts"}, "source": ["a"]},
                  {"cell_type": "code", "metadata": {"window_id": 2, "window_type": 12}, "source": ["b"]},
                  {"cell_type": "code", "metadata": {"window_id": 3, "window_type": "Model Metric Viewer"}, "source": ["c"]}
                ], "metadata": {}, "nbformat": 4, "nbformat_minor": 4}
                """;

        ImportResult result = codec.importDocument(bytes(json), 1);

        assertEquals(2, result.restoredWindows().size());
        assertEquals(1, result.errors().size());
        assertEquals(1, result.errors().get(0).cellIndex());
        assertEquals(CellImportError.Kind.INVALID_METADATA, result.errors().get(0).kind());
        // the failed cell did not use up an id
        assertEquals(List.of(1, 2), result.restoredWindows().stream().map(WindowRecord::getId).toList());
        assertEquals("Restored 2 windows with 1 errors", result.summary());
    }

    @Test
    void nonWindowCellsAreSkippedQuietly() {
        String json = """
                {"cells": [
                  {"cell_type": "markdown", "metadata": {}, "source": ["# notes"]},
                  {"cell_type": "code", "metadata": {"window_type": "Hologram"}, "source": []},
                  {"cell_type": "code", "source": "print(1)"},
                  "not a cell"
                ]}
                """;

        ImportResult result = codec.importDocument(bytes(json), 1);

        assertTrue(result.restoredWindows().isEmpty());
        assertEquals(1, result.errors().size());
        assertEquals(CellImportError.Kind.CELL_PARSING_FAILED, result.errors().get(0).kind());
        assertEquals("Failed to restore windows: 1 errors", result.summary());
    }

    @Test
    void missingFieldsFallBackToDefaults() {
        String json = """
                {"cells": [
                  {"cell_type": "code", "metadata": {"window_type": "Charts", "position": {"x": 5}}, "source": "x = 1\\n"}
                ]}
                """;

        WindowRecord w = codec.importDocument(bytes(json), 1).restoredWindows().get(0);

        assertEquals(new WindowPosition(5, 0, 0, 400, 300), w.getPosition());
        assertEquals(ExportTemplate.PLAIN, w.getState().getExportTemplate());
        assertTrue(w.getState().getTags().isEmpty());
        assertEquals("x = 1\n", w.getState().getContent());
    }

    @Test
    void unreadableDocumentsAreFatal() {
        NotebookImportException notJson = assertThrows(NotebookImportException.class,
                () -> codec.importDocument(bytes("{not json"), 1));
        NotebookImportException noCells = assertThrows(NotebookImportException.class,
                () -> codec.importDocument(bytes("{\"metadata\": {}}"), 1));
        NotebookImportException array = assertThrows(NotebookImportException.class,
                () -> codec.importDocument(bytes("[1, 2]"), 1));

        assertEquals(NotebookImportException.Kind.INVALID_JSON, notJson.getKind());
        assertEquals(NotebookImportException.Kind.INVALID_NOTEBOOK_FORMAT, noCells.getKind());
        assertEquals(NotebookImportException.Kind.INVALID_JSON, array.getKind());
    }

    @Test
    void legacyAggregateBlockIsRead() {
        String json = """
                {"cells": [], "metadata": {"visionos_export": {"total_windows": 3, "window_types": ["Charts"]}}}
                """;

        ImportResult result = codec.importDocument(bytes(json), 1);

        assertNotNull(result.originalMetadata());
        assertEquals(3, result.originalMetadata().totalWindows());
        assertTrue(codec.isNativeDocument(bytes(json)));
    }

    @Test
    void sourceLinesAreJoinedEitherWay() throws Exception {
        assertEquals("a\nb\n", NotebookCodec.joinSource(om.readTree("[\"a\\n\", \"b\\n\"]")));
        assertEquals("a\nb", NotebookCodec.joinSource(om.readTree("[\"a\", \"b\"]")));
        assertEquals("single", NotebookCodec.joinSource(om.readTree("\"single\"")));
        assertEquals("", NotebookCodec.joinSource(null));
    }

    // =========================
    // analysis
    // =========================

    @Test
    void analysisCountsWithoutRestoring() {
        WindowRecord a = window(1, WindowType.CHARTS);
        WindowRecord b = window(2, WindowType.CHARTS);
        b.getState().setExportTemplate(ExportTemplate.NUMPY);
        byte[] doc = codec.export(List.of(a, b), null);

        NotebookAnalysis analysis = codec.analyze(doc);

        assertEquals(2, analysis.totalCells());
        assertEquals(2, analysis.windowCells());
        assertEquals(List.of("Charts"), analysis.windowTypes());
        assertEquals(List.of("NumPy Array", "Plain Text"), analysis.exportTemplates());
        assertTrue(analysis.isNative());
    }

    @Test
    void foreignNotebookIsNotNative() {
        String json = "{\"cells\": [{\"cell_type\": \"code\", \"metadata\": {}, \"source\": []}]}";

        assertFalse(codec.isNativeDocument(bytes(json)));
        assertFalse(codec.analyze(bytes(json)).isNative());
        assertFalse(codec.isNativeDocument(bytes("garbage")));
    }

    @Test
    void workspaceBlockCanBeReplaced() {
        WorkspaceMetadata original = new WorkspaceMetadata(UUID.randomUUID(), "First");
        WorkspaceMetadata renamed = new WorkspaceMetadata(UUID.randomUUID(), "Second");
        renamed.setTags(List.of("copy"));
        byte[] doc = codec.export(List.of(window(1, WindowType.CHARTS)), original);

        byte[] rewritten = codec.withWorkspaceBlock(doc, renamed);

        WorkspaceMetadata read = codec.readWorkspaceMetadata(rewritten).orElseThrow();
        assertEquals("Second", read.getName());
        assertEquals(renamed.getId(), read.getId());
        assertEquals(List.of("copy"), read.getTags());
        assertEquals(1, codec.analyze(rewritten).windowCells());
    }

    private static WindowRecord window(int id, WindowType type) {
        return new WindowRecord(id, type, WindowPosition.defaults(), new WindowState(), null);
    }

    private static List<String> strings(JsonNode arr) {
        List<String> out = new ArrayList<>();
        arr.forEach(n -> out.add(n.asText()));
        return out;
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
