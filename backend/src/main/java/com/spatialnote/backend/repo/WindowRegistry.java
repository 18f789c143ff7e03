package com.spatialnote.backend.repo;

import com.spatialnote.backend.domain.ExportTemplate;
import com.spatialnote.backend.domain.WindowPosition;
import com.spatialnote.backend.domain.WindowRecord;
import com.spatialnote.backend.domain.WindowState;
import com.spatialnote.backend.domain.WindowType;
import com.spatialnote.backend.domain.payload.ChartData;
import com.spatialnote.backend.domain.payload.DataFrameData;
import com.spatialnote.backend.domain.payload.Model3DData;
import com.spatialnote.backend.domain.payload.PointCloudData;
import com.spatialnote.backend.domain.payload.VolumeData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory map of window id to record, plus the set of ids that are
 * currently open on screen. Membership in the open set is independent of
 * presence in the map: a closed record stays until it is removed or purged.
 *
 * <p>Mutators never throw. An unknown id is logged and reported through the
 * boolean return value. Readers always get copies.
 */
@Component
public class WindowRegistry {
    private static final Logger log = LoggerFactory.getLogger(WindowRegistry.class);

    private final WindowPresenter presenter;
    private final List<WindowChangeListener> listeners = new CopyOnWriteArrayList<>();

    // guarded by this
    private final TreeMap<Integer, WindowRecord> windows = new TreeMap<>();
    private final Set<Integer> openIds = new HashSet<>();
    private int highestIssuedId;

    public WindowRegistry(WindowPresenter presenter) {
        this.presenter = presenter;
    }

    public void addListener(WindowChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(WindowChangeListener listener) {
        listeners.remove(listener);
    }

    // =========================
    // ids
    // =========================

    /** Next free id. Ids handed out once are never handed out again, even after removal. */
    public synchronized int getNextId() {
        int maxExisting = windows.isEmpty() ? 0 : windows.lastKey();
        return Math.max(highestIssuedId, maxExisting) + 1;
    }

    /** Claims {@code count} consecutive ids and returns the first of them. */
    public synchronized int reserveIds(int count) {
        int first = getNextId();
        if (count > 0) highestIssuedId = first + count - 1;
        return first;
    }

    // =========================
    // create / read
    // =========================

    public WindowRecord create(WindowType type) {
        return create(type, null, null);
    }

    /**
     * Inserts a new record. A given id is used as is and replaces whatever
     * was stored under it; avoiding collisions is up to the caller.
     */
    public WindowRecord create(WindowType type, Integer id, WindowPosition position) {
        WindowRecord created;
        synchronized (this) {
            int newId = id != null ? id : getNextId();
            if (windows.containsKey(newId)) {
                log.warn("window #{} already exists and is replaced", newId);
            }
            created = new WindowRecord(newId, type, position);
            windows.put(newId, created);
            highestIssuedId = Math.max(highestIssuedId, newId);
            created = created.copy();
        }
        log.debug("created window #{} ({})", created.getId(), type.label());
        fire(created.getId());
        return created;
    }

    /** Puts an already numbered record (from an import) into the registry. */
    public void insertRestored(Collection<WindowRecord> records) {
        if (records.isEmpty()) return;
        synchronized (this) {
            for (WindowRecord r : records) {
                if (windows.containsKey(r.getId())) {
                    log.warn("restored window #{} replaces an existing record", r.getId());
                }
                windows.put(r.getId(), r.copy());
                highestIssuedId = Math.max(highestIssuedId, r.getId());
            }
        }
        fire(null);
    }

    /** Returns the record only while it is open. */
    public synchronized Optional<WindowRecord> get(int id) {
        WindowRecord r = windows.get(id);
        if (r == null) {
            log.debug("window #{} is unknown", id);
            return Optional.empty();
        }
        if (!openIds.contains(id)) {
            log.debug("window #{} is known but not open", id);
            return Optional.empty();
        }
        return Optional.of(r.copy());
    }

    /** Returns the record whether or not it is open. */
    public synchronized Optional<WindowRecord> find(int id) {
        WindowRecord r = windows.get(id);
        return r == null ? Optional.empty() : Optional.of(r.copy());
    }

    public synchronized boolean contains(int id) {
        return windows.containsKey(id);
    }

    public synchronized List<WindowRecord> listAll(boolean onlyOpen) {
        List<WindowRecord> out = new ArrayList<>(windows.size());
        for (WindowRecord r : windows.values()) {
            if (!onlyOpen || openIds.contains(r.getId())) out.add(r.copy());
        }
        return out;
    }

    public synchronized int size() {
        return windows.size();
    }

    // =========================
    // mutators
    // =========================

    public boolean updatePosition(int id, WindowPosition position) {
        return mutate(id, "position", r -> r.setPosition(position));
    }

    public boolean updateContent(int id, String content) {
        return mutate(id, "content", r -> r.getState().setContent(content));
    }

    public boolean updateTemplate(int id, ExportTemplate template) {
        return mutate(id, "template", r -> r.getState().setExportTemplate(template));
    }

    public boolean updateState(int id, Boolean minimized, Boolean maximized, Double opacity) {
        return mutate(id, "state", r -> {
            WindowState s = r.getState();
            if (minimized != null) s.setMinimized(minimized);
            if (maximized != null) s.setMaximized(maximized);
            if (opacity != null) s.setOpacity(Math.max(0.0, Math.min(1.0, opacity)));
        });
    }

    /** Adds a tag unless already present. Returns false for an unknown id or a duplicate tag. */
    public boolean addTag(int id, String tag) {
        if (tag == null || tag.isBlank()) return false;
        String t = tag.trim();
        synchronized (this) {
            WindowRecord r = windows.get(id);
            if (r == null) {
                log.debug("addTag ignored, window #{} is unknown", id);
                return false;
            }
            if (r.getState().getTags().contains(t)) return false;
            r.getState().getTags().add(t);
            r.getState().setLastModified(Instant.now());
        }
        fire(id);
        return true;
    }

    public boolean removeTag(int id, String tag) {
        synchronized (this) {
            WindowRecord r = windows.get(id);
            if (r == null) {
                log.debug("removeTag ignored, window #{} is unknown", id);
                return false;
            }
            if (!r.getState().getTags().remove(tag)) return false;
            r.getState().setLastModified(Instant.now());
        }
        fire(id);
        return true;
    }

    /** Replaces all tags, dropping blanks and duplicates but keeping first-seen order. */
    public boolean setTags(int id, List<String> tags) {
        LinkedHashSet<String> clean = new LinkedHashSet<>();
        if (tags != null) {
            for (String t : tags) {
                if (t != null && !t.isBlank()) clean.add(t.trim());
            }
        }
        return mutate(id, "tags", r -> r.getState().setTags(new ArrayList<>(clean)));
    }

    public boolean updateDataFrame(int id, DataFrameData data) {
        return mutate(id, "dataframe", r -> {
            r.getState().setDataFrameData(data);
            autoSelectTemplate(r, r.getWindowType() == WindowType.COLUMN, ExportTemplate.PANDAS);
        });
    }

    public boolean updateChart(int id, ChartData data) {
        return mutate(id, "chart", r -> {
            r.getState().setChartData(data);
            autoSelectTemplate(r, r.getWindowType() == WindowType.CHARTS, ExportTemplate.MATPLOTLIB);
        });
    }

    public boolean updatePointCloud(int id, PointCloudData data) {
        return mutate(id, "pointcloud", r -> {
            r.getState().setPointCloudData(data);
            WindowType t = r.getWindowType();
            autoSelectTemplate(r, t == WindowType.SPATIAL || t == WindowType.POINT_CLOUD, ExportTemplate.CUSTOM);
        });
    }

    public boolean updateVolume(int id, VolumeData data) {
        return mutate(id, "volume", r -> r.getState().setVolumeData(data));
    }

    public boolean updateModel3D(int id, Model3DData data) {
        return mutate(id, "model3d", r -> {
            r.getState().setModel3DData(data);
            autoSelectTemplate(r, r.getWindowType() == WindowType.MODEL_3D, ExportTemplate.CUSTOM);
        });
    }

    // fires whenever the template is still PLAIN, including after a manual reset
    private static void autoSelectTemplate(WindowRecord r, boolean applies, ExportTemplate target) {
        if (applies && r.getState().getExportTemplate() == ExportTemplate.PLAIN) {
            r.getState().setExportTemplate(target);
        }
    }

    private boolean mutate(int id, String what, Consumer<WindowRecord> change) {
        synchronized (this) {
            WindowRecord r = windows.get(id);
            if (r == null) {
                log.debug("update {} ignored, window #{} is unknown", what, id);
                return false;
            }
            change.accept(r);
            r.getState().setLastModified(Instant.now());
        }
        fire(id);
        return true;
    }

    // =========================
    // open / close / removal
    // =========================

    public boolean markOpened(int id) {
        boolean added;
        synchronized (this) {
            added = openIds.add(id);
        }
        if (added) fire(id);
        return added;
    }

    /** Idempotent. Rendering resources are released on every call. */
    public boolean markClosed(int id) {
        boolean removed;
        synchronized (this) {
            removed = openIds.remove(id);
        }
        presenter.cleanup(id);
        if (removed) fire(id);
        return removed;
    }

    public synchronized boolean isOpen(int id) {
        return openIds.contains(id);
    }

    public synchronized Set<Integer> openIds() {
        return new TreeSet<>(openIds);
    }

    public boolean removeWindow(int id) {
        boolean existed;
        synchronized (this) {
            existed = windows.remove(id) != null;
            openIds.remove(id);
        }
        presenter.cleanup(id);
        if (existed) {
            log.debug("removed window #{}", id);
            fire(id);
        }
        return existed;
    }

    /** Drops every record that is not open. Returns the purged ids. */
    public List<Integer> cleanupClosedWindows() {
        List<Integer> purged = new ArrayList<>();
        synchronized (this) {
            Iterator<Integer> it = windows.keySet().iterator();
            while (it.hasNext()) {
                Integer id = it.next();
                if (!openIds.contains(id)) {
                    it.remove();
                    purged.add(id);
                }
            }
        }
        purged.forEach(presenter::cleanup);
        if (!purged.isEmpty()) {
            log.info("purged {} closed windows", purged.size());
            fire(null);
        }
        return purged;
    }

    public void clearAll() {
        synchronized (this) {
            windows.clear();
            openIds.clear();
        }
        presenter.cleanupAll();
        log.info("cleared all windows");
        fire(null);
    }

    private void fire(Integer windowId) {
        for (WindowChangeListener l : listeners) {
            try {
                l.windowChanged(windowId);
            } catch (RuntimeException e) {
                log.warn("window change listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
