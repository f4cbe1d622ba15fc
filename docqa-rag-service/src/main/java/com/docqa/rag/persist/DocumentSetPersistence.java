package com.docqa.rag.persist;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Imports the export file once the application is ready and writes it again
 * on shutdown. Registered only when persistence is enabled.
 */
@Slf4j
public class DocumentSetPersistence {

    private final DocumentSetExporter exporter;
    private final Path exportPath;

    public DocumentSetPersistence(DocumentSetExporter exporter, Path exportPath) {
        this.exporter = exporter;
        this.exportPath = exportPath;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void load() {
        if (!Files.exists(exportPath)) {
            log.info("No document export at {}, starting empty", exportPath);
            return;
        }
        try {
            exporter.importFrom(exportPath);
        } catch (UncheckedIOException e) {
            log.error("Could not import documents from {}, starting empty", exportPath, e);
        }
    }

    @PreDestroy
    public void save() {
        try {
            exporter.export(exportPath);
        } catch (UncheckedIOException e) {
            log.error("Could not export documents to {}", exportPath, e);
        }
    }
}
