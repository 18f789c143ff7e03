package com.spatialnote.backend.service.workspace;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spatialnote.backend.domain.WindowRecord;
import com.spatialnote.backend.domain.WindowType;
import com.spatialnote.backend.domain.workspace.WorkspaceCategory;
import com.spatialnote.backend.domain.workspace.WorkspaceMetadata;
import com.spatialnote.backend.repo.WindowPresenter;
import com.spatialnote.backend.repo.WindowRegistry;
import com.spatialnote.backend.service.notebook.ImportResult;
import com.spatialnote.backend.service.notebook.NotebookAnalysis;
import com.spatialnote.backend.service.notebook.NotebookCodec;
import com.spatialnote.backend.service.notebook.NotebookImportException;
import com.spatialnote.backend.service.notebook.NotebookService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Index of workspace documents. The index file is a cache over the
 * documents folder: counts and types can always be re-derived from the
 * documents, and a missing or broken index is rebuilt by scanning.
 */
@Service
public class WorkspaceMetadataStore {
    private static final Logger log = LoggerFactory.getLogger(WorkspaceMetadataStore.class);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String EXTENSION = ".ipynb";

    private final ObjectMapper om;
    private final NotebookCodec codec;
    private final NotebookService notebooks;
    private final WindowRegistry registry;
    private final WindowPresenter presenter;
    private final Path workspacesDir;
    private final Path indexFile;
    private final Duration openDelay;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    private List<WorkspaceMetadata> workspaces = new ArrayList<>();
    private volatile UUID activeWorkspaceId;

    public WorkspaceMetadataStore(
            ObjectMapper om,
            NotebookCodec codec,
            NotebookService notebooks,
            WindowRegistry registry,
            WindowPresenter presenter,
            @Value("${spatialnote.storage.root:data}") String root,
            @Value("${spatialnote.storage.workspaces-dir:Workspaces}") String workspacesDir,
            @Value("${spatialnote.storage.index-file:workspace_metadata.json}") String indexFile,
            @Value("${spatialnote.workspace.open-delay:200ms}") Duration openDelay
    ) {
        this.om = om;
        this.codec = codec;
        this.notebooks = notebooks;
        this.registry = registry;
        this.presenter = presenter;
        this.workspacesDir = Paths.get(root).resolve(workspacesDir);
        this.indexFile = Paths.get(root).resolve(indexFile);
        this.openDelay = openDelay == null ? Duration.ZERO : openDelay;
        load();
    }

    private void ensureDir() {
        try {
            Files.createDirectories(workspacesDir);
            Files.createDirectories(indexFile.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new WorkspaceException(WorkspaceException.Kind.DIRECTORY_CREATION_FAILED, workspacesDir.toString(), e);
        }
    }

    // =========================
    // index persistence
    // =========================

    /**
     * Reads the index and relinks or drops entries whose file moved. Falls
     * back to a directory scan when the index is missing or unreadable.
     */
    public void load() {
        lock.writeLock().lock();
        try {
            ensureDir();
            List<WorkspaceMetadata> loaded = readIndex();
            if (loaded == null) {
                workspaces = new ArrayList<>();
                List<WorkspaceMetadata> found = scanLocked();
                log.info("rebuilt workspace index from {} documents", found.size());
            } else {
                workspaces = loaded;
                relinkLocked();
            }
            saveLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // null: missing or unreadable
    private List<WorkspaceMetadata> readIndex() {
        if (!Files.exists(indexFile)) return null;
        try {
            byte[] raw = Files.readAllBytes(indexFile);
            if (raw.length == 0) return null;
            List<WorkspaceMetadata> list = om.readValue(raw, new TypeReference<List<WorkspaceMetadata>>() {});
            return list == null ? null : new ArrayList<>(list);
        } catch (IOException e) {
            log.warn("workspace index {} is unreadable, rescanning: {}", indexFile, e.getMessage());
            return null;
        }
    }

    private void relinkLocked() {
        Iterator<WorkspaceMetadata> it = workspaces.iterator();
        while (it.hasNext()) {
            WorkspaceMetadata m = it.next();
            if (m.getFilePath() != null && Files.exists(Paths.get(m.getFilePath()))) continue;

            Path candidate = m.getFilePath() == null ? null
                    : workspacesDir.resolve(Paths.get(m.getFilePath()).getFileName().toString());
            if (candidate != null && Files.exists(candidate)) {
                log.info("relinked workspace '{}' to {}", m.getName(), candidate);
                m.setFilePath(candidate.toAbsolutePath().toString());
            } else {
                log.info("dropping workspace '{}', document {} is gone", m.getName(), m.getFilePath());
                it.remove();
            }
        }
    }

    /** Writes the index through a temp file so an interrupted write leaves the old index intact. */
    public void save() {
        lock.writeLock().lock();
        try {
            saveLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void saveLocked() {
        ensureDir();
        try {
            byte[] out = om.writerWithDefaultPrettyPrinter().writeValueAsBytes(workspaces);
            writeAtomically(indexFile, out);
        } catch (IOException e) {
            throw new WorkspaceException(WorkspaceException.Kind.SAVE_FAILED, "index " + indexFile, e);
        }
    }

    static void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    // =========================
    // queries
    // =========================

    public List<WorkspaceMetadata> list() {
        return snapshot(m -> true, byModifiedDesc());
    }

    public List<WorkspaceMetadata> templates() {
        return snapshot(WorkspaceMetadata::isTemplate, Comparator.comparing(WorkspaceMetadata::getName));
    }

    public List<WorkspaceMetadata> byCategory(WorkspaceCategory category) {
        return snapshot(m -> m.getCategory() == category, byModifiedDesc());
    }

    /** Case-insensitive match on name, description and tags. A blank query lists everything. */
    public List<WorkspaceMetadata> search(String query) {
        if (query == null || query.isBlank()) return list();
        String q = query.trim().toLowerCase(Locale.ROOT);
        return snapshot(m -> m.getName().toLowerCase(Locale.ROOT).contains(q)
                        || m.getDescription().toLowerCase(Locale.ROOT).contains(q)
                        || m.getTags().stream().anyMatch(t -> t.toLowerCase(Locale.ROOT).contains(q)),
                byModifiedDesc());
    }

    public Optional<WorkspaceMetadata> get(UUID id) {
        lock.readLock().lock();
        try {
            return findLocked(id).map(WorkspaceMetadata::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<WorkspaceMetadata> activeWorkspace() {
        UUID id = activeWorkspaceId;
        return id == null ? Optional.empty() : get(id);
    }

    private List<WorkspaceMetadata> snapshot(java.util.function.Predicate<WorkspaceMetadata> filter,
                                             Comparator<WorkspaceMetadata> order) {
        lock.readLock().lock();
        try {
            return workspaces.stream().filter(filter).sorted(order).map(WorkspaceMetadata::copy)
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    private static Comparator<WorkspaceMetadata> byModifiedDesc() {
        return Comparator.comparing(WorkspaceMetadata::getModifiedDate,
                Comparator.nullsLast(Comparator.reverseOrder()));
    }

    private Optional<WorkspaceMetadata> findLocked(UUID id) {
        return workspaces.stream().filter(m -> m.getId().equals(id)).findFirst();
    }

    private WorkspaceMetadata requireLocked(UUID id) {
        return findLocked(id).orElseThrow(() -> new NoSuchElementException("workspace not found: " + id));
    }

    // =========================
    // create / save
    // =========================

    /** Saves the current registry as a new workspace and makes it the active one. */
    public WorkspaceMetadata create(String name, String description, WorkspaceCategory category,
                                    List<String> tags, boolean template) {
        if (name == null || name.isBlank()) {
            throw new WorkspaceException(WorkspaceException.Kind.INVALID_NAME, null);
        }
        List<WindowRecord> windows = registry.listAll(false);
        lock.writeLock().lock();
        try {
            if (workspaces.stream().anyMatch(m -> m.getName().equals(name))) {
                throw new WorkspaceException(WorkspaceException.Kind.DUPLICATE_NAME, name);
            }
            WorkspaceMetadata m = new WorkspaceMetadata(UUID.randomUUID(), name);
            m.setDescription(description);
            m.setCategory(category);
            m.setTags(tags);
            m.setTemplate(template);

            writeDocumentLocked(m, newFile(name), windows);
            workspaces.add(m);
            saveLocked();
            activeWorkspaceId = m.getId();
            log.info("created workspace '{}' with {} windows", name, m.getTotalWindows());
            return m.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Re-saves the current registry into an existing workspace. */
    public WorkspaceMetadata saveWorkspace(UUID id) {
        // registry snapshot is taken before the store lock, never under it
        List<WindowRecord> windows = registry.listAll(false);
        lock.writeLock().lock();
        try {
            WorkspaceMetadata m = requireLocked(id);
            Path file = m.getFilePath() != null ? Paths.get(m.getFilePath()) : newFile(m.getName());
            m.setModifiedDate(Instant.now());
            writeDocumentLocked(m, file, windows);
            saveLocked();
            log.info("saved workspace '{}' ({} windows)", m.getName(), m.getTotalWindows());
            return m.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Saves into the active workspace, if there is one. */
    public Optional<WorkspaceMetadata> saveActive() {
        UUID id = activeWorkspaceId;
        if (id == null) return Optional.empty();
        try {
            return Optional.of(saveWorkspace(id));
        } catch (NoSuchElementException e) {
            activeWorkspaceId = null;
            return Optional.empty();
        }
    }

    private void writeDocumentLocked(WorkspaceMetadata m, Path file, List<WindowRecord> windows) {
        m.setTotalWindows(windows.size());
        m.setWindowTypes(windows.stream().map(WindowRecord::getWindowType).distinct().sorted()
                .collect(Collectors.toList()));
        try {
            ensureDir();
            writeAtomically(file, codec.export(windows, m));
            m.setFilePath(file.toAbsolutePath().toString());
        } catch (IOException e) {
            throw new WorkspaceException(WorkspaceException.Kind.SAVE_FAILED, file.toString(), e);
        }
    }

    private Path newFile(String name) {
        String base = sanitize(name) + "_" + LocalDateTime.now().format(FILE_STAMP);
        Path p = workspacesDir.resolve(base + EXTENSION);
        for (int n = 2; Files.exists(p); n++) {
            p = workspacesDir.resolve(base + "_" + n + EXTENSION);
        }
        return p;
    }

    static String sanitize(String name) {
        String s = name.trim().toLowerCase(Locale.ROOT).replaceAll("[^\\p{Alnum}]", "_");
        return s.isEmpty() ? "workspace" : s;
    }

    // =========================
    // refresh / rescan
    // =========================

    /**
     * Recomputes window counts and types from each document. User fields
     * (id, name, description, category, tags) are not touched. Returns how
     * many entries changed.
     */
    public int refresh() {
        lock.writeLock().lock();
        try {
            int changed = 0;
            for (WorkspaceMetadata m : workspaces) {
                if (m.getFilePath() == null) continue;
                try {
                    NotebookAnalysis a = codec.analyze(Files.readAllBytes(Paths.get(m.getFilePath())));
                    List<WindowType> types = windowTypes(a.windowTypes());
                    if (a.windowCells() != m.getTotalWindows() || !types.equals(m.getWindowTypes())) {
                        m.setTotalWindows(a.windowCells());
                        m.setWindowTypes(types);
                        changed++;
                    }
                } catch (IOException | NotebookImportException e) {
                    log.warn("cannot refresh workspace '{}': {}", m.getName(), e.getMessage());
                }
            }
            saveLocked();
            log.info("refreshed {} of {} workspaces", changed, workspaces.size());
            return changed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Indexes documents that appeared in the folder without going through the store. */
    public List<WorkspaceMetadata> rescan() {
        lock.writeLock().lock();
        try {
            List<WorkspaceMetadata> found = scanLocked();
            if (!found.isEmpty()) saveLocked();
            return found.stream().map(WorkspaceMetadata::copy).collect(Collectors.toList());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<WorkspaceMetadata> scanLocked() {
        Set<Path> known = workspaces.stream()
                .map(WorkspaceMetadata::getFilePath)
                .filter(Objects::nonNull)
                .map(p -> Paths.get(p).toAbsolutePath().normalize())
                .collect(Collectors.toSet());

        List<Path> files;
        try (Stream<Path> s = Files.list(workspacesDir)) {
            files = s.filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("cannot scan {}: {}", workspacesDir, e.getMessage());
            return List.of();
        }

        List<WorkspaceMetadata> added = new ArrayList<>();
        for (Path f : files) {
            if (known.contains(f.toAbsolutePath().normalize())) continue;
            fromDocument(f).ifPresent(m -> {
                workspaces.add(m);
                added.add(m);
            });
        }
        return added;
    }

    private Optional<WorkspaceMetadata> fromDocument(Path file) {
        byte[] bytes;
        BasicFileAttributes attrs;
        NotebookAnalysis analysis;
        try {
            bytes = Files.readAllBytes(file);
            attrs = Files.readAttributes(file, BasicFileAttributes.class);
            analysis = codec.analyze(bytes);
        } catch (IOException | NotebookImportException e) {
            log.warn("skipping {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }

        String fileName = file.getFileName().toString();
        String baseName = fileName.substring(0, fileName.length() - EXTENSION.length());
        Optional<WorkspaceMetadata> embedded = codec.readWorkspaceMetadata(bytes);

        WorkspaceMetadata m = embedded.orElseGet(WorkspaceMetadata::new);
        if (embedded.isEmpty()) {
            m.setDescription(analysis.isNative() ? "Imported workspace" : "External notebook");
            m.setCategory(WorkspaceCategory.CUSTOM);
        }
        if (m.getId() == null || findLocked(m.getId()).isPresent()) m.setId(UUID.randomUUID());
        m.setName(uniqueNameLocked(m.getName() == null || m.getName().isBlank() ? baseName : m.getName()));
        m.setCreatedDate(attrs.creationTime().toInstant());
        m.setModifiedDate(attrs.lastModifiedTime().toInstant());
        m.setTotalWindows(analysis.windowCells());
        m.setWindowTypes(windowTypes(analysis.windowTypes()));
        m.setFilePath(file.toAbsolutePath().toString());
        log.info("indexed workspace '{}' from {}", m.getName(), fileName);
        return Optional.of(m);
    }

    private String uniqueNameLocked(String name) {
        String candidate = name;
        for (int n = 2; nameTakenLocked(candidate); n++) {
            candidate = name + " (" + n + ")";
        }
        return candidate;
    }

    private boolean nameTakenLocked(String name) {
        return workspaces.stream().anyMatch(m -> m.getName().equals(name));
    }

    private static List<WindowType> windowTypes(List<String> labels) {
        return labels.stream()
                .map(WindowType::fromLabel)
                .flatMap(Optional::stream)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    // =========================
    // load / delete / duplicate
    // =========================

    /**
     * Restores a workspace into the registry and opens its windows one at a
     * time in ascending id order, each marked opened before the next starts.
     */
    public RestoreResult loadWorkspace(UUID id, boolean clearExisting) {
        WorkspaceMetadata m = get(id).orElseThrow(() -> new NoSuchElementException("workspace not found: " + id));
        if (m.getFilePath() == null || !Files.exists(Paths.get(m.getFilePath()))) {
            throw new WorkspaceException(WorkspaceException.Kind.FILE_NOT_FOUND, m.getFilePath());
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(Paths.get(m.getFilePath()));
        } catch (IOException e) {
            throw new WorkspaceException(WorkspaceException.Kind.LOAD_FAILED, m.getFilePath(), e);
        }

        // fatal document errors surface here, before anything is cleared
        codec.analyze(bytes);
        activeWorkspaceId = m.getId();
        if (clearExisting) registry.clearAll();
        ImportResult imported = notebooks.importInto(bytes);

        List<WindowRecord> toOpen = new ArrayList<>(imported.restoredWindows());
        toOpen.sort(Comparator.comparingInt(WindowRecord::getId));
        List<Integer> opened = new ArrayList<>();
        List<Integer> failed = new ArrayList<>();
        for (int i = 0; i < toOpen.size(); i++) {
            int windowId = toOpen.get(i).getId();
            try {
                presenter.open(windowId);
                registry.markOpened(windowId);
                opened.add(windowId);
            } catch (RuntimeException e) {
                log.warn("could not open window #{}: {}", windowId, e.getMessage());
                failed.add(windowId);
            }
            if (i < toOpen.size() - 1 && !pause()) {
                toOpen.subList(i + 1, toOpen.size()).forEach(w -> failed.add(w.getId()));
                break;
            }
        }
        log.info("loaded workspace '{}': {}, opened {}", m.getName(), imported.summary(), opened.size());
        return new RestoreResult(imported, opened, failed);
    }

    // false when interrupted
    private boolean pause() {
        if (openDelay.isZero() || openDelay.isNegative()) return true;
        try {
            Thread.sleep(openDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void delete(UUID id) {
        lock.writeLock().lock();
        try {
            WorkspaceMetadata m = requireLocked(id);
            if (m.getFilePath() != null) {
                try {
                    Files.deleteIfExists(Paths.get(m.getFilePath()));
                } catch (IOException e) {
                    throw new WorkspaceException(WorkspaceException.Kind.SAVE_FAILED, "cannot delete " + m.getFilePath(), e);
                }
            }
            workspaces.remove(m);
            saveLocked();
            if (id.equals(activeWorkspaceId)) activeWorkspaceId = null;
            log.info("deleted workspace '{}'", m.getName());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Copy named "&lt;name&gt; Copy" in the Custom category, never a template. */
    public WorkspaceMetadata duplicate(UUID id) {
        lock.writeLock().lock();
        try {
            WorkspaceMetadata source = requireLocked(id);
            WorkspaceMetadata copy = source.copy();
            copy.setId(UUID.randomUUID());
            copy.setName(uniqueNameLocked(source.getName() + " Copy"));
            copy.setTemplate(false);
            copy.setCategory(WorkspaceCategory.CUSTOM);
            Instant now = Instant.now();
            copy.setCreatedDate(now);
            copy.setModifiedDate(now);
            copy.setFilePath(null);

            if (source.getFilePath() != null && Files.exists(Paths.get(source.getFilePath()))) {
                Path target = newFile(copy.getName());
                try {
                    byte[] original = Files.readAllBytes(Paths.get(source.getFilePath()));
                    byte[] rewritten;
                    try {
                        rewritten = codec.withWorkspaceBlock(original, copy);
                    } catch (NotebookImportException e) {
                        log.warn("copying unreadable document of '{}' as is", source.getName());
                        rewritten = original;
                    }
                    writeAtomically(target, rewritten);
                    copy.setFilePath(target.toAbsolutePath().toString());
                } catch (IOException e) {
                    throw new WorkspaceException(WorkspaceException.Kind.SAVE_FAILED, target.toString(), e);
                }
            }

            workspaces.add(copy);
            saveLocked();
            log.info("duplicated workspace '{}' as '{}'", source.getName(), copy.getName());
            return copy.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    Path workspacesDir() {
        return workspacesDir;
    }
}
