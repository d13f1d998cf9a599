package io.ezvis.proxylog.service;

import io.ezvis.proxylog.config.ImportProperties;
import io.ezvis.proxylog.repository.RequestStore;
import io.ezvis.proxylog.service.dto.ImportSummary;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Imports every file matching ezvis.import.pattern in ezvis.import.directory at startup, one file at a time.
 * A file that fails does not stop the remaining ones.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "ezvis.import", name = "directory")
public class DirectoryImportRunner implements ApplicationRunner {

    private final LogImportService importService;
    private final RequestStore store;
    private final ImportProperties properties;

    public DirectoryImportRunner(LogImportService importService, RequestStore store, ImportProperties properties) {
        this.importService = importService;
        this.store = store;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        if (!StringUtils.hasText(properties.getDirectory())) {
            return;
        }
        importDirectory(Path.of(properties.getDirectory()));
    }

    public List<ImportSummary> importDirectory(Path directory) throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, properties.getPattern())) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        }
        files.sort(null);
        log.info("Importing {} file(s) from {} into table '{}'", files.size(), directory, store.table());

        List<ImportSummary> summaries = new ArrayList<>(files.size());
        long imported = 0;
        long failed = 0;
        int position = 0;
        for (Path file : files) {
            position++;
            ImportSummary summary = importService.importFile(file);
            summaries.add(summary);
            imported += summary.imported();
            failed += summary.failed();
            if (summary.isComplete()) {
                log.info("[{}/{}] {} imported: {} rows, {} rejected", position, files.size(), file,
                        summary.imported(), summary.failed());
            } else {
                log.warn("[{}/{}] {} failed ({}): {}", position, files.size(), file, summary.outcome(), summary.message());
            }
        }
        log.info("Directory import complete: {} file(s), {} rows imported, {} lines rejected",
                files.size(), imported, failed);
        return summaries;
    }
}
