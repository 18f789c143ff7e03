package com.spatialnote.backend.service.notebook;

import com.spatialnote.backend.domain.workspace.WorkspaceMetadata;
import com.spatialnote.backend.repo.WindowRegistry;
import org.springframework.stereotype.Service;

/** Export and import against the live registry. */
@Service
public class NotebookService {
    private final WindowRegistry registry;
    private final NotebookCodec codec;

    public NotebookService(WindowRegistry registry, NotebookCodec codec) {
        this.registry = registry;
        this.codec = codec;
    }

    public byte[] exportAll() {
        return codec.export(registry.listAll(false), null);
    }

    public byte[] exportAll(WorkspaceMetadata workspace) {
        return codec.export(registry.listAll(false), workspace);
    }

    /**
     * Restores the document into the registry under fresh ids. Opening the
     * restored windows is left to the caller.
     */
    public ImportResult importInto(byte[] document) {
        // numbered from 1, then moved onto a reserved range; no registry lock is held while listeners run
        ImportResult parsed = codec.importDocument(document, 1);
        int first = registry.reserveIds(parsed.restoredWindows().size());
        ImportResult result = parsed.shiftIds(first - 1);
        registry.insertRestored(result.restoredWindows());
        return result;
    }

    public NotebookAnalysis analyze(byte[] document) {
        return codec.analyze(document);
    }
}
