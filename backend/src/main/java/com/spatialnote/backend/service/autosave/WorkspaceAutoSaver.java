package com.spatialnote.backend.service.autosave;

import com.spatialnote.backend.domain.workspace.WorkspaceMetadata;
import com.spatialnote.backend.repo.WindowRegistry;
import com.spatialnote.backend.service.workspace.WorkspaceException;
import com.spatialnote.backend.service.workspace.WorkspaceMetadataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Re-saves the active workspace once registry changes have paused for the
 * workspace debounce delay. Every change re-arms the timer with the full
 * delay, so a busy stream defers the save and the last change is always
 * written.
 */
@Component
public class WorkspaceAutoSaver {
    private static final Logger log = LoggerFactory.getLogger(WorkspaceAutoSaver.class);

    private final WorkspaceMetadataStore store;
    private final AutoSaveSettings settings;
    private final KeyedDebouncer<UUID> debouncer;

    public WorkspaceAutoSaver(
            WindowRegistry registry,
            WorkspaceMetadataStore store,
            AutoSaveSettings settings,
            @Qualifier("autosaveScheduler") ScheduledExecutorService scheduler
    ) {
        this.store = store;
        this.settings = settings;
        this.debouncer = new KeyedDebouncer<>(scheduler);
        registry.addListener(windowId -> scheduleAutoSave());
    }

    /** Returns the workspace a save was scheduled for, if any. */
    public Optional<UUID> scheduleAutoSave() {
        if (!settings.isEnabled()) return Optional.empty();
        Optional<UUID> active = store.activeWorkspace().map(WorkspaceMetadata::getId);
        active.ifPresent(id -> debouncer.schedule(id, settings.getWorkspaceDebounce(), () -> saveIfActive(id)));
        return active;
    }

    public boolean isPending(UUID workspaceId) {
        return debouncer.isPending(workspaceId);
    }

    // skipped when another workspace became active in the meantime
    private void saveIfActive(UUID id) {
        boolean stillActive = store.activeWorkspace().map(w -> w.getId().equals(id)).orElse(false);
        if (!stillActive) {
            log.debug("workspace {} is no longer active, autosave skipped", id);
            return;
        }
        try {
            store.saveWorkspace(id);
        } catch (WorkspaceException | NoSuchElementException e) {
            log.warn("workspace autosave failed for {}: {}", id, e.getMessage());
        }
    }
}
