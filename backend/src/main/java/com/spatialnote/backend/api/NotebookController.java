package com.spatialnote.backend.api;

import com.spatialnote.backend.domain.WindowRecord;
import com.spatialnote.backend.repo.WindowPresenter;
import com.spatialnote.backend.repo.WindowRegistry;
import com.spatialnote.backend.service.notebook.ImportResult;
import com.spatialnote.backend.service.notebook.NotebookAnalysis;
import com.spatialnote.backend.service.notebook.NotebookService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

@RestController
@RequestMapping("/api/v1/notebook")
public class NotebookController {

    private final NotebookService notebooks;
    private final WindowRegistry registry;
    private final WindowPresenter presenter;

    public NotebookController(NotebookService notebooks, WindowRegistry registry, WindowPresenter presenter) {
        this.notebooks = notebooks;
        this.registry = registry;
        this.presenter = presenter;
    }

    @GetMapping("/export")
    public ResponseEntity<byte[]> export() {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"spatial_workspace.ipynb\"")
                .body(notebooks.exportAll());
    }

    @PostMapping(value = "/import", consumes = MediaType.ALL_VALUE)
    public Map<String, Object> importDocument(
            @RequestBody byte[] document,
            @RequestParam(defaultValue = "false") boolean open
    ) {
        ImportResult result = notebooks.importInto(document);
        if (open) {
            result.restoredWindows().stream()
                    .map(WindowRecord::getId)
                    .sorted()
                    .forEach(id -> {
                        presenter.open(id);
                        registry.markOpened(id);
                    });
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("summary", result.summary());
        body.put("restored", result.restoredWindows());
        body.put("errors", result.errors());
        body.put("idMapping", result.idMapping());
        body.put("originalMetadata", result.originalMetadata());
        return body;
    }

    @PostMapping(value = "/analyze", consumes = MediaType.ALL_VALUE)
    public NotebookAnalysis analyze(@RequestBody byte[] document) {
        return notebooks.analyze(document);
    }
}
