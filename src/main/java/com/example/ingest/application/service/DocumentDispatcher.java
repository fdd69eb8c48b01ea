package com.example.ingest.application.service;

import com.example.ingest.config.ExtractionProperties;
import com.example.ingest.domain.exception.DocumentNotFoundException;
import com.example.ingest.domain.exception.DocumentPathRequiredException;
import com.example.ingest.domain.exception.DomainException;
import com.example.ingest.domain.exception.UnsupportedFormatException;
import com.example.ingest.domain.extraction.ExtractionStrategy;
import com.example.ingest.domain.extraction.FormatDetector;
import com.example.ingest.domain.model.DetectedFormat;
import com.example.ingest.domain.model.DocumentFormat;
import com.example.ingest.domain.model.ExtractionResult;
import com.example.ingest.domain.model.MetadataKeys;
import com.example.ingest.domain.model.ProcessedDocument;
import com.example.ingest.domain.model.ProcessingStatus;
import com.example.ingest.infrastructure.cad.CadExtractionStrategy;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Application-layer service that runs one document through detection, strategy lookup and
 * extraction, then derives the processing status consumed by classification and storage.
 */
@Service
public class DocumentDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DocumentDispatcher.class);

    private final FormatDetector formatDetector;
    private final ExtractionStrategyFactory strategyFactory;
    private final Duration timeout;
    private final ExecutorService timeoutExecutor;

    /**
     * @param formatDetector  signature based detector
     * @param strategyFactory tag to strategy registry
     * @param properties      extraction settings, including the optional timeout
     */
    public DocumentDispatcher(FormatDetector formatDetector,
                              ExtractionStrategyFactory strategyFactory,
                              ExtractionProperties properties) {
        this.formatDetector = formatDetector;
        this.strategyFactory = strategyFactory;
        this.timeout = properties.getTimeout();
        this.timeoutExecutor = isBounded()
                ? Executors.newFixedThreadPool(Math.max(1, Runtime.getRuntime().availableProcessors()), daemonThreads())
                : null;
    }

    /**
     * Detects the format of a file and extracts it.
     *
     * @param file document on disk
     * @return processed document with status and extraction result
     * @throws DocumentPathRequiredException when {@code file} is null
     * @throws DocumentNotFoundException     when the file does not exist
     * @throws UnsupportedFormatException    when no strategy serves the detected format
     */
    public ProcessedDocument process(Path file) {
        requireReadable(file);
        DetectedFormat detected = detect(file);
        return extract(file, detected.tag(), detected.mimeType());
    }

    /**
     * Extracts a file whose format tag the caller already resolved.
     *
     * @param file      document on disk
     * @param formatTag tag to use instead of detection
     * @return processed document with status and extraction result
     * @throws UnsupportedFormatException when no strategy serves the tag
     */
    public ProcessedDocument process(Path file, String formatTag) {
        requireReadable(file);
        return extract(file, formatTag, null);
    }

    /**
     * Processes documents one after another; a failing document is reported as {@code FAILED}
     * and never stops the batch.
     *
     * @param files documents to process
     * @return one processed document per input, in input order
     */
    public List<ProcessedDocument> processBatch(Collection<Path> files) {
        List<ProcessedDocument> processed = new ArrayList<>(files.size());
        for (Path file : files) {
            try {
                processed.add(process(file));
            } catch (UnsupportedFormatException ex) {
                log.warn("Skipping {}: {}", file, ex.getMessage());
                processed.add(failed(file, ex.getFormatTag(), ex.getMessage()));
            } catch (DomainException ex) {
                log.warn("Skipping {}: {}", file, ex.getMessage());
                processed.add(failed(file, DocumentFormat.UNKNOWN.tag(), ex.getMessage()));
            }
        }
        long failures = processed.stream().filter(doc -> doc.status() == ProcessingStatus.FAILED).count();
        log.info("Processed batch of {} documents ({} failed)", processed.size(), failures);
        return processed;
    }

    /**
     * Derives the processing status of a document from its extraction result.
     *
     * @param file   processed file, used to recognise the CAD placeholder text
     * @param result extraction result
     * @return {@code FAILED} when nothing usable was extracted, {@code PARTIAL} when some unit
     *         failed, otherwise {@code SUCCESS}
     */
    static ProcessingStatus statusOf(Path file, ExtractionResult result) {
        if (result.hasError()) {
            boolean placeholder = result.text().equals(CadExtractionStrategy.placeholderFor(file));
            return result.text().isBlank() || placeholder ? ProcessingStatus.FAILED : ProcessingStatus.PARTIAL;
        }
        Object pageErrors = result.metadata().get(MetadataKeys.PAGE_ERRORS);
        if (pageErrors instanceof Collection<?> errors && !errors.isEmpty()) {
            return ProcessingStatus.PARTIAL;
        }
        return ProcessingStatus.SUCCESS;
    }

    private ProcessedDocument extract(Path file, String formatTag, String mimeType) {
        ExtractionStrategy strategy = strategyFactory.getStrategy(formatTag);
        ExtractionResult result = isBounded() ? extractWithTimeout(strategy, file) : strategy.extract(file);
        ProcessingStatus status = statusOf(file, result);
        log.info("Extracted {} as {} -> {}", file.getFileName(), formatTag, status);
        result.error().ifPresent(error -> log.debug("Extraction error for {}: {}", file, error));
        return new ProcessedDocument(fileName(file), formatTag, mimeType, status, result);
    }

    /**
     * Runs the strategy on a worker thread. The time bound starts once a worker picks the task up;
     * an exceeded bound interrupts the worker and counts as a strategy failure.
     */
    private ExtractionResult extractWithTimeout(ExtractionStrategy strategy, Path file) {
        CountDownLatch started = new CountDownLatch(1);
        Future<ExtractionResult> future = timeoutExecutor.submit(() -> {
            started.countDown();
            return strategy.extract(file);
        });
        try {
            if (!started.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                future.cancel(true);
                log.warn("No extraction worker picked up {} within {}", file, timeout);
                return ExtractionResult.failure("No extraction worker available within " + timeout);
            }
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Extraction of {} exceeded {}", file, timeout);
            return ExtractionResult.failure("Extraction timed out after " + timeout);
        } catch (ExecutionException e) {
            return ExtractionResult.failure("Extraction failed: " + e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ExtractionResult.failure("Extraction interrupted");
        }
    }

    private DetectedFormat detect(Path file) {
        try {
            return formatDetector.detect(file);
        } catch (IOException e) {
            log.warn("Format detection failed for {}", file, e);
            return new DetectedFormat(DocumentFormat.UNKNOWN.tag(), null);
        }
    }

    private void requireReadable(Path file) {
        if (file == null) {
            throw new DocumentPathRequiredException();
        }
        if (!Files.isRegularFile(file)) {
            throw new DocumentNotFoundException(file.toAbsolutePath().toString());
        }
    }

    private ProcessedDocument failed(Path file, String formatTag, String message) {
        return new ProcessedDocument(fileName(file), formatTag, null, ProcessingStatus.FAILED,
                ExtractionResult.failure(message));
    }

    private boolean isBounded() {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }

    private static String fileName(Path file) {
        if (file == null) {
            return null;
        }
        Path name = file.getFileName();
        return name == null ? file.toString() : name.toString();
    }

    private static ThreadFactory daemonThreads() {
        return runnable -> {
            Thread thread = new Thread(runnable, "extraction-worker");
            thread.setDaemon(true);
            return thread;
        };
    }

    @PreDestroy
    void shutdown() {
        if (timeoutExecutor != null) {
            timeoutExecutor.shutdownNow();
        }
    }
}
