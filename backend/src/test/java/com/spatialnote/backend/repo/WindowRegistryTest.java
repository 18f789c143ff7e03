package com.spatialnote.backend.repo;

import com.spatialnote.backend.domain.ExportTemplate;
import com.spatialnote.backend.domain.WindowPosition;
import com.spatialnote.backend.domain.WindowRecord;
import com.spatialnote.backend.domain.WindowType;
import com.spatialnote.backend.domain.payload.ChartData;
import com.spatialnote.backend.domain.payload.DataFrameData;
import com.spatialnote.backend.domain.payload.Model3DData;
import com.spatialnote.backend.domain.payload.PointCloudData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class WindowRegistryTest {

    private RecordingPresenter presenter;
    private WindowRegistry registry;

    @BeforeEach
    void setUp() {
        presenter = new RecordingPresenter();
        registry = new WindowRegistry(presenter);
    }

    @Test
    void idsIncreaseAndAreNeverReused() {
        int a = registry.create(WindowType.CHARTS).getId();
        int b = registry.create(WindowType.COLUMN).getId();
        registry.removeWindow(b);
        int c = registry.create(WindowType.VOLUME).getId();
        registry.removeWindow(a);
        registry.removeWindow(c);
        int d = registry.create(WindowType.SPATIAL).getId();

        assertAll(
                () -> assertEquals(1, a),
                () -> assertTrue(b > a),
                () -> assertTrue(c > b),
                () -> assertTrue(d > c)
        );
    }

    @Test
    void nextIdFollowsExplicitIds() {
        registry.create(WindowType.CHARTS, 10, null);
        assertEquals(11, registry.getNextId());
        assertEquals(11, registry.create(WindowType.CHARTS).getId());
    }

    @Test
    void reservedIdsAreNotHandedOutAgain() {
        registry.create(WindowType.CHARTS);

        int first = registry.reserveIds(3);

        assertEquals(2, first);
        assertEquals(5, registry.create(WindowType.COLUMN).getId());
        assertEquals(6, registry.reserveIds(0));
        assertEquals(6, registry.getNextId());
    }

    @Test
    void openStateIsIndependentOfPresence() {
        int id = registry.create(WindowType.CHARTS).getId();

        assertTrue(registry.find(id).isPresent());
        assertTrue(registry.get(id).isEmpty());
        assertEquals(1, registry.listAll(false).size());
        assertTrue(registry.listAll(true).isEmpty());

        registry.markOpened(id);
        assertTrue(registry.get(id).isPresent());
        assertEquals(List.of(id), registry.listAll(true).stream().map(WindowRecord::getId).toList());
    }

    @Test
    void removedWindowIsGone() {
        registry.create(WindowType.CHARTS, 5, null);
        registry.markOpened(5);

        assertTrue(registry.removeWindow(5));

        assertTrue(registry.get(5).isEmpty());
        assertTrue(registry.find(5).isEmpty());
        assertFalse(registry.isOpen(5));
        assertTrue(presenter.cleanedUp.contains(5));
    }

    @Test
    void unknownIdsAreIgnored() {
        assertAll(
                () -> assertFalse(registry.updatePosition(42, WindowPosition.defaults())),
                () -> assertFalse(registry.updateContent(42, "x")),
                () -> assertFalse(registry.addTag(42, "t")),
                () -> assertFalse(registry.removeTag(42, "t")),
                () -> assertFalse(registry.updateChart(42, null)),
                () -> assertFalse(registry.removeWindow(42))
        );
        assertEquals(0, registry.size());
    }

    @Test
    void readersGetCopies() {
        int id = registry.create(WindowType.CHARTS).getId();
        WindowRecord copy = registry.find(id).orElseThrow();
        copy.getState().getTags().add("leaked");
        copy.getState().setContent("leaked");

        WindowRecord stored = registry.find(id).orElseThrow();
        assertTrue(stored.getState().getTags().isEmpty());
        assertEquals("", stored.getState().getContent());
    }

    @Test
    void tagsKeepOrderAndRejectDuplicates() {
        int id = registry.create(WindowType.CHARTS).getId();
        assertTrue(registry.addTag(id, "b"));
        assertTrue(registry.addTag(id, " a "));
        assertFalse(registry.addTag(id, "b"));
        assertEquals(List.of("b", "a"), registry.find(id).orElseThrow().getState().getTags());

        assertTrue(registry.removeTag(id, "b"));
        assertFalse(registry.removeTag(id, "b"));

        registry.setTags(id, Arrays.asList("x", "", "y", "x", null));
        assertEquals(List.of("x", "y"), registry.find(id).orElseThrow().getState().getTags());
    }

    @Test
    void opacityIsClamped() {
        int id = registry.create(WindowType.CHARTS).getId();
        registry.updateState(id, true, null, 3.0);
        assertEquals(1.0, registry.find(id).orElseThrow().getState().getOpacity());
        assertTrue(registry.find(id).orElseThrow().getState().isMinimized());

        registry.updateState(id, null, null, -1.0);
        assertEquals(0.0, registry.find(id).orElseThrow().getState().getOpacity());
    }

    @Test
    void typedPayloadSelectsTemplateWhileItIsPlain() {
        int column = registry.create(WindowType.COLUMN).getId();
        int chart = registry.create(WindowType.CHARTS).getId();
        int spatial = registry.create(WindowType.SPATIAL).getId();
        int model = registry.create(WindowType.MODEL_3D).getId();

        registry.updateDataFrame(column, new DataFrameData(List.of("a"), List.of(List.of("1")), null));
        registry.updateChart(chart, new ChartData("c", "line", null, null, List.of(1.0), List.of(2.0), null, null));
        registry.updatePointCloud(spatial, new PointCloudData(null, null, null, null, null, null, 0,
                List.of(new PointCloudData.Point(1, 2, 3))));
        registry.updateModel3D(model, new Model3DData(null, null,
                List.of(Model3DData.Vector3.ZERO), null, null, 1, null, null));

        assertAll(
                () -> assertEquals(ExportTemplate.PANDAS, template(column)),
                () -> assertEquals(ExportTemplate.MATPLOTLIB, template(chart)),
                () -> assertEquals(ExportTemplate.CUSTOM, template(spatial)),
                () -> assertEquals(ExportTemplate.CUSTOM, template(model))
        );
    }

    @Test
    void chosenTemplateIsNotOverridden() {
        int id = registry.create(WindowType.CHARTS).getId();
        registry.updateTemplate(id, ExportTemplate.PLOTLY);
        registry.updateChart(id, new ChartData("c", "line", null, null, List.of(1.0), List.of(2.0), null, null));
        assertEquals(ExportTemplate.PLOTLY, template(id));

        // a manual reset to plain lets the next payload choose again
        registry.updateTemplate(id, ExportTemplate.PLAIN);
        registry.updateChart(id, new ChartData("d", "bar", null, null, List.of(1.0), List.of(2.0), null, null));
        assertEquals(ExportTemplate.MATPLOTLIB, template(id));
    }

    @Test
    void payloadOnOtherWindowTypeKeepsPlain() {
        int id = registry.create(WindowType.VOLUME).getId();
        registry.updateChart(id, new ChartData("c", "line", null, null, List.of(1.0), List.of(2.0), null, null));
        assertEquals(ExportTemplate.PLAIN, template(id));
    }

    @Test
    void closingReleasesResourcesEveryTime() {
        int id = registry.create(WindowType.CHARTS).getId();
        registry.markOpened(id);

        assertTrue(registry.markClosed(id));
        assertFalse(registry.markClosed(id));

        assertEquals(List.of(id, id), presenter.cleanedUp);
        assertTrue(registry.find(id).isPresent());
    }

    @Test
    void cleanupPurgesOnlyClosedWindows() {
        int open = registry.create(WindowType.CHARTS).getId();
        int closed = registry.create(WindowType.CHARTS).getId();
        registry.markOpened(open);

        assertEquals(List.of(closed), registry.cleanupClosedWindows());
        assertEquals(List.of(open), registry.listAll(false).stream().map(WindowRecord::getId).toList());
    }

    @Test
    void clearAllKeepsIdsMonotonic() {
        registry.create(WindowType.CHARTS);
        registry.create(WindowType.CHARTS);
        registry.clearAll();

        assertEquals(0, registry.size());
        assertEquals(1, presenter.cleanupAllCalls);
        assertEquals(3, registry.create(WindowType.CHARTS).getId());
    }

    @Test
    void listenersHearChangesAndFailuresAreContained() {
        List<Integer> seen = new ArrayList<>();
        registry.addListener(id -> {
            throw new IllegalStateException("boom");
        });
        registry.addListener(seen::add);

        int id = registry.create(WindowType.CHARTS).getId();
        registry.updateContent(id, "x");
        registry.clearAll();

        assertEquals(Arrays.asList(id, id, null), seen);
    }

    private ExportTemplate template(int id) {
        return registry.find(id).orElseThrow().getState().getExportTemplate();
    }
}
