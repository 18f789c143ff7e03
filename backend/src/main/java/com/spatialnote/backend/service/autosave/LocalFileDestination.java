package com.spatialnote.backend.service.autosave;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.*;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Timestamped autosave files in a local folder, pruned to the newest few. */
@Component
public class LocalFileDestination implements SaveDestination {
    private static final Logger log = LoggerFactory.getLogger(LocalFileDestination.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    static final String PREFIX = "autosave_";
    static final String SUFFIX = ".ipynb";

    private final AutoSaveSettings settings;
    private final Path dir;

    public LocalFileDestination(
            AutoSaveSettings settings,
            @Value("${spatialnote.storage.root:data}") String root,
            @Value("${spatialnote.storage.autosave-dir:autosave}") String autosaveDir
    ) {
        this.settings = settings;
        this.dir = Paths.get(root).resolve(autosaveDir);
    }

    @Override
    public String name() {
        return "local-file";
    }

    @Override
    public boolean isEnabled() {
        return settings.isSaveToLocalFiles();
    }

    @Override
    public String write(byte[] document) throws IOException {
        Files.createDirectories(dir);
        Path target = uniqueTarget();
        Path tmp = Files.createTempFile(dir, PREFIX, ".tmp");
        try {
            Files.write(tmp, document);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        prune();
        return target.toAbsolutePath().toString();
    }

    private Path uniqueTarget() {
        String base = PREFIX + LocalDateTime.now().format(STAMP);
        Path p = dir.resolve(base + SUFFIX);
        for (int n = 2; Files.exists(p); n++) {
            p = dir.resolve(base + "_" + n + SUFFIX);
        }
        return p;
    }

    private void prune() throws IOException {
        int keep = Math.max(1, settings.getMaxLocalFiles());
        List<Path> files;
        try (Stream<Path> s = Files.list(dir)) {
            // stamp sorts chronologically
            files = s.filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                    })
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .collect(Collectors.toList());
        }
        for (Path old : files.subList(Math.min(keep, files.size()), files.size())) {
            Files.deleteIfExists(old);
            log.debug("pruned old autosave {}", old.getFileName());
        }
    }

    Path directory() {
        return dir;
    }
}
