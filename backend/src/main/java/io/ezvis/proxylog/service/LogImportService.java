package io.ezvis.proxylog.service;

import io.ezvis.proxylog.config.ImportProperties;
import io.ezvis.proxylog.parser.AccessLogParser;
import io.ezvis.proxylog.parser.AccessLogRecord;
import io.ezvis.proxylog.parser.ParseFailure;
import io.ezvis.proxylog.parser.ParseFailureReason;
import io.ezvis.proxylog.parser.ParseResult;
import io.ezvis.proxylog.repository.RequestStore;
import io.ezvis.proxylog.repository.StorageException;
import io.ezvis.proxylog.service.dto.FailedLine;
import io.ezvis.proxylog.service.dto.ImportOutcome;
import io.ezvis.proxylog.service.dto.ImportProgress;
import io.ezvis.proxylog.service.dto.ImportSummary;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Sequential import pipeline: lines are parsed in source order, valid records are buffered and flushed to the
 * {@link RequestStore} in bulk. Malformed lines, blank ones included, are counted as failed and skipped. Imports
 * are not deduplicated, so importing the same source twice stores every row twice.
 * <p>
 * Callers must not run two imports into the same store concurrently.
 */
@Slf4j
@Service
public class LogImportService {

    static final int MAX_SAMPLE_FAILURES = 20;

    private final AccessLogParser parser;
    private final RequestStore store;
    private final int defaultBatchSize;
    private final int progressInterval;

    public LogImportService(AccessLogParser parser, RequestStore store, ImportProperties properties) {
        if (properties.getBatchSize() < 1 || properties.getProgressInterval() < 1) {
            throw new IllegalStateException("ezvis.import.batch-size and ezvis.import.progress-interval must be >= 1");
        }
        this.parser = parser;
        this.store = store;
        this.defaultBatchSize = properties.getBatchSize();
        this.progressInterval = properties.getProgressInterval();
    }

    public ImportSession startSession(String source) {
        return new ImportSession(UUID.randomUUID().toString(), source);
    }

    /**
     * Imports one UTF-8 log file. An unreadable file yields a {@link ImportOutcome#SOURCE_ERROR} summary.
     */
    public ImportSummary importFile(Path path) {
        String source = path.toString();
        Utf8LineReader reader;
        try {
            reader = open(path);
        } catch (SourceReadException e) {
            log.warn("Import of {} not started: {}", source, e.getMessage());
            return startSession(source).finish(ImportOutcome.SOURCE_ERROR, e.getMessage());
        }
        return importSource(source, reader.lines().onClose(() -> close(reader, source)),
                defaultBatchSize, ImportProgressListener.NONE);
    }

    /** Imports UTF-8 text from {@code input}; the caller owns and closes the stream. */
    public ImportSummary importStream(String source, InputStream input) {
        return importSource(source, new Utf8LineReader(input).lines(), defaultBatchSize, ImportProgressListener.NONE);
    }

    public ImportSummary importLines(String source, Stream<String> lines) {
        return importLines(source, lines, defaultBatchSize, ImportProgressListener.NONE);
    }

    public ImportSummary importLines(String source, Stream<String> lines, int batchSize, ImportProgressListener listener) {
        return importSource(source, lines.map(SourceLine::decoded), batchSize, listener);
    }

    /**
     * Every line counts: it is either imported or failed, blank lines included, so that
     * {@code imported + failed} equals the number of lines read.
     */
    private ImportSummary importSource(String source, Stream<SourceLine> lines, int batchSize,
                                       ImportProgressListener listener) {
        if (batchSize < 1) {
            lines.close();
            throw new IllegalArgumentException("batchSize must be >= 1, was " + batchSize);
        }
        ImportSession session = startSession(source);
        log.info("Import {} started: source={}, batchSize={}", session.getImportId(), source, batchSize);

        List<AccessLogRecord> buffer = new ArrayList<>(Math.min(batchSize, 65_536));
        try {
            store.ensureSchema();
            Iterator<SourceLine> iterator = lines.iterator();
            while (iterator.hasNext()) {
                SourceLine line = iterator.next();
                session.lineNumber++;

                ParseResult result = line.malformed()
                        ? ParseResult.failed(line.text(), ParseFailureReason.BAD_ENCODING, "line is not valid UTF-8")
                        : parser.parse(line.text());
                if (result instanceof ParseResult.Parsed parsed) {
                    buffer.add(parsed.record());
                    if (buffer.size() >= batchSize) {
                        flush(session, buffer);
                    }
                } else if (result instanceof ParseResult.Failed failed) {
                    session.recordFailure(failed.failure());
                }

                session.processed++;
                if (session.processed % progressInterval == 0) {
                    reportProgress(session, listener);
                }
            }
            flush(session, buffer);
        } catch (StorageException e) {
            log.warn("Import {} aborted after {} rows: {}", session.getImportId(), session.imported, e.getMessage(), e);
            return session.finish(ImportOutcome.STORAGE_FAULT, e.getMessage());
        } catch (UncheckedIOException e) {
            log.warn("Import {} stopped reading {} at line {}: {}",
                    session.getImportId(), source, session.lineNumber, e.getMessage());
            return session.finish(ImportOutcome.SOURCE_ERROR, e.getMessage());
        } finally {
            lines.close();
        }

        ImportSummary summary = session.finish(ImportOutcome.COMPLETED, null);
        log.info("Import {} finished: imported={}, failed={}, batches={}, took={}",
                summary.importId(), summary.imported(), summary.failed(), summary.batches(), summary.duration());
        return summary;
    }

    private void flush(ImportSession session, List<AccessLogRecord> buffer) {
        if (buffer.isEmpty()) {
            return;
        }
        session.imported += store.appendBatch(buffer);
        session.batches++;
        buffer.clear();
    }

    private void reportProgress(ImportSession session, ImportProgressListener listener) {
        ImportProgress progress = new ImportProgress(
                session.getImportId(), session.getSource(), session.processed, session.imported, session.failed);
        log.info("Import {}: processed {} lines ({} imported, {} failed)",
                progress.importId(), progress.processed(), progress.imported(), progress.failed());
        listener.onProgress(progress);
    }

    private Utf8LineReader open(Path path) {
        try {
            return new Utf8LineReader(Files.newInputStream(path));
        } catch (IOException e) {
            throw new SourceReadException(path.toString(), e);
        }
    }

    private void close(Utf8LineReader reader, String source) {
        try {
            reader.close();
        } catch (IOException e) {
            log.warn("Failed to close {}: {}", source, e.getMessage());
        }
    }

    /**
     * Mutable counters of one running import. Confined to the importing thread.
     */
    @Getter
    public static class ImportSession {
        private final String importId;
        private final String source;
        private final long startedNanos = System.nanoTime();
        private final Map<ParseFailureReason, Long> failuresByReason = new EnumMap<>(ParseFailureReason.class);
        private final List<FailedLine> sampleFailures = new ArrayList<>();
        private long lineNumber;
        private long processed;
        private long imported;
        private long failed;
        private long batches;

        public ImportSession(String importId, String source) {
            this.importId = importId;
            this.source = source;
        }

        void recordFailure(ParseFailure failure) {
            failed++;
            failuresByReason.merge(failure.reason(), 1L, Long::sum);
            if (sampleFailures.size() < MAX_SAMPLE_FAILURES) {
                sampleFailures.add(new FailedLine(lineNumber, failure.reason().tag(), failure.detail(), failure.line()));
            }
            log.debug("Import {} line {} rejected: {}", importId, lineNumber, failure);
        }

        ImportSummary finish(ImportOutcome outcome, String message) {
            Map<String, Long> reasons = new LinkedHashMap<>();
            failuresByReason.forEach((reason, count) -> reasons.put(reason.tag(), count));
            return new ImportSummary(
                    importId,
                    source,
                    outcome,
                    imported,
                    failed,
                    batches,
                    reasons,
                    List.copyOf(sampleFailures),
                    Duration.ofNanos(System.nanoTime() - startedNanos),
                    message
            );
        }
    }
}
