package com.spatialnote.backend.api;

import com.spatialnote.backend.api.dto.WorkspaceCreateRequest;
import com.spatialnote.backend.domain.workspace.WorkspaceCategory;
import com.spatialnote.backend.domain.workspace.WorkspaceMetadata;
import com.spatialnote.backend.service.workspace.RestoreResult;
import com.spatialnote.backend.service.workspace.WorkspaceMetadataStore;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

@RestController
@RequestMapping("/api/v1/workspaces")
public class WorkspaceController {

    private final WorkspaceMetadataStore store;

    public WorkspaceController(WorkspaceMetadataStore store) {
        this.store = store;
    }

    @GetMapping
    public Map<String, Object> list(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String q,
            @RequestParam(defaultValue = "false") boolean templates
    ) {
        List<WorkspaceMetadata> items;
        if (templates) {
            items = store.templates();
        } else if (category != null && !category.isBlank()) {
            items = store.byCategory(WorkspaceCategory.fromLabel(category));
        } else {
            items = store.search(q);
        }
        return Map.of("items", items);
    }

    @GetMapping("/active")
    public Map<String, Object> active() {
        WorkspaceMetadata m = store.activeWorkspace()
                .orElseThrow(() -> new NoSuchElementException("no active workspace"));
        return Map.of("item", m);
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@Valid @RequestBody WorkspaceCreateRequest req) {
        WorkspaceMetadata created = store.create(req.name, req.description, req.category, req.tags, req.template);
        return ResponseEntity.status(201).body(Map.of("item", created));
    }

    @GetMapping("/{id}")
    public Map<String, Object> get(@PathVariable UUID id) {
        return Map.of("item", store.get(id).orElseThrow(() -> new NoSuchElementException("workspace not found: " + id)));
    }

    @PutMapping("/{id}/save")
    public Map<String, Object> save(@PathVariable UUID id) {
        return Map.of("item", store.saveWorkspace(id));
    }

    @PostMapping("/{id}/load")
    public Map<String, Object> load(@PathVariable UUID id, @RequestParam(defaultValue = "true") boolean clearExisting) {
        RestoreResult r = store.loadWorkspace(id, clearExisting);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("summary", r.importResult().summary());
        body.put("opened", r.openedWindowIds());
        body.put("failed", r.failedWindowIds());
        body.put("errors", r.importResult().errors());
        body.put("idMapping", r.importResult().idMapping());
        return body;
    }

    @PostMapping("/{id}/duplicate")
    public ResponseEntity<Map<String, Object>> duplicate(@PathVariable UUID id) {
        return ResponseEntity.status(201).body(Map.of("item", store.duplicate(id)));
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@PathVariable UUID id) {
        store.delete(id);
        return Map.of("ok", true);
    }

    @PostMapping("/refresh")
    public Map<String, Object> refresh() {
        return Map.of("updated", store.refresh());
    }

    @PostMapping("/rescan")
    public Map<String, Object> rescan() {
        return Map.of("items", store.rescan());
    }
}
