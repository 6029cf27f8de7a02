/*
 * StatisticalNERStrategy.java - Strategy using a named-entity-recognition model, one task per chunk
 */
package com.cgi.medscrub.strategy;

import com.cgi.medscrub.api.NamedEntityRecognizer;
import com.cgi.medscrub.model.Detection;
import com.cgi.medscrub.model.DetectorRun;
import com.cgi.medscrub.model.ErrorCollector;
import com.cgi.medscrub.model.RecognizedEntity;
import com.cgi.medscrub.model.ScrubConfig;
import com.cgi.medscrub.model.ScrubWarning;
import com.cgi.medscrub.model.TextChunk;
import com.cgi.medscrub.model.enums.DetectionMethod;
import com.cgi.medscrub.model.enums.EntityType;
import com.cgi.medscrub.model.enums.ScrubStage;
import com.cgi.medscrub.model.enums.WarningType;
import com.cgi.medscrub.service.TextChunker;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Strategy using an external named-entity-recognition model.
 * Each chunk is analyzed as its own task with its own timeout; a failed chunk yields no detections
 * and a warning, never an exception.
 */
@Component
public class StatisticalNERStrategy extends AbstractPIIDetectionStrategy {
    private static final long AVAILABILITY_CHECK_INTERVAL = 60000; // 1 minute
    private static final int CONTEXT_RADIUS = 30;

    private final NamedEntityRecognizer recognizer;
    private final ExecutorService executor;
    private final TextChunker chunker;

    // Cache for model availability status
    private volatile Boolean modelAvailable = null;
    private volatile long lastAvailabilityCheck = 0;

    @Autowired
    public StatisticalNERStrategy(ObjectProvider<NamedEntityRecognizer> recognizerProvider,
                                  @Qualifier("nerExecutor") ExecutorService executor,
                                  TextChunker chunker) {
        this(recognizerProvider.getIfAvailable(), executor, chunker);
    }

    /**
     * @param recognizer Entity-recognition model, or null when none is configured
     * @param executor Pool running the chunk tasks
     * @param chunker Chunker used when a whole document is passed in
     */
    public StatisticalNERStrategy(NamedEntityRecognizer recognizer, ExecutorService executor, TextChunker chunker) {
        this.recognizer = recognizer;
        this.executor = executor;
        this.chunker = chunker;
    }

    @Override
    public String getName() {
        return "StatisticalNERStrategy";
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.STATISTICAL;
    }

    @Override
    public boolean isApplicable(ScrubConfig config) {
        return config.isEnableStatisticalDetector();
    }

    @Override
    public List<DetectorRun> detect(String text, ScrubConfig config, ErrorCollector errors) {
        return detectChunks(chunker.chunk(text, config.getChunkSize()), config, errors);
    }

    /**
     * Analyzes chunks concurrently and returns one run per chunk, in chunk order.
     * Detection offsets are document offsets.
     *
     * @param chunks Chunks of the document
     * @param config Scrub configuration
     * @param errors Collector for model failures and low-confidence entities
     * @return Runs in chunk order
     */
    public List<DetectorRun> detectChunks(List<TextChunk> chunks, ScrubConfig config, ErrorCollector errors) {
        if (chunks.isEmpty()) {
            return Collections.emptyList();
        }
        if (recognizer == null) {
            log.warn("No named-entity model configured, continuing with pattern and context detection only");
            errors.add(modelWarning("none", "No named-entity model is configured",
                    "Configure medscrub.ner.service-url to enable name and location recognition"));
            return Collections.emptyList();
        }
        if (!isModelAvailable()) {
            log.warn("Named-entity model {} not available, skipping statistical pass", recognizer.getModelName());
            errors.add(modelWarning(recognizer.getModelName(), "Named-entity model is not available",
                    "Check that the entity-recognition service is running"));
            return Collections.emptyList();
        }

        List<CompletableFuture<ChunkOutcome>> futures = new ArrayList<>(chunks.size());
        for (TextChunk chunk : chunks) {
            futures.add(submit(chunk, config, errors));
        }

        // join() preserves chunk order regardless of completion order
        List<DetectorRun> runs = new ArrayList<>(chunks.size());
        for (CompletableFuture<ChunkOutcome> future : futures) {
            ChunkOutcome outcome = future.join();
            outcome.warnings.forEach(errors::add);
            runs.add(outcome.run);
        }

        int total = runs.stream().mapToInt(run -> run.getDetections().size()).sum();
        log.info("Statistical pass analyzed {} chunk(s), {} entity(ies) above threshold", chunks.size(), total);
        return runs;
    }

    /**
     * Queues one chunk on the pool. The timeout starts when a worker picks the chunk up,
     * so chunks waiting behind slower ones keep their full budget.
     */
    private CompletableFuture<ChunkOutcome> submit(TextChunk chunk, ScrubConfig config, ErrorCollector errors) {
        String label = "chunk-" + chunk.getIndex();
        if (chunk.getText().isBlank()) {
            return CompletableFuture.completedFuture(
                    new ChunkOutcome(new DetectorRun(getName(), label, Collections.emptyList(), 0), List.of()));
        }

        CompletableFuture<ChunkOutcome> result = new CompletableFuture<>();
        AtomicLong startTime = new AtomicLong();
        try {
            executor.execute(() -> {
                startTime.set(System.currentTimeMillis());
                result.orTimeout(config.getStatisticalTimeoutMs(), TimeUnit.MILLISECONDS);
                try {
                    result.complete(analyzeChunk(chunk, config, label, startTime.get()));
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result.exceptionally(e -> {
            recordChunkFailure(chunk, unwrap(e), config, errors);
            long elapsed = startTime.get() == 0 ? 0 : elapsedSince(startTime.get());
            return new ChunkOutcome(new DetectorRun(getName(), label, Collections.emptyList(), elapsed), List.of());
        });
    }

    private ChunkOutcome analyzeChunk(TextChunk chunk, ScrubConfig config, String label, long startTime) {
        List<RecognizedEntity> entities = recognizer.infer(chunk.getText());
        List<Detection> detections = new ArrayList<>();
        List<ScrubWarning> warnings = new ArrayList<>();
        String text = chunk.getText();

        for (RecognizedEntity entity : entities == null ? List.<RecognizedEntity>of() : entities) {
            EntityType type = mapLabel(entity.getLabel());
            if (type == null) {
                continue;
            }
            int start = entity.getStart();
            int end = entity.getEnd();
            if (start < 0 || end > text.length() || start >= end) {
                log.debug("Discarding entity with span [{}, {}) outside chunk {} of length {}",
                        start, end, chunk.getIndex(), text.length());
                continue;
            }
            // The model may pad spans with whitespace
            while (start < end && Character.isWhitespace(text.charAt(start))) {
                start++;
            }
            while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
                end--;
            }
            if (start >= end) {
                continue;
            }

            double score = Math.max(0.0, Math.min(1.0, entity.getScore()));
            if (score > config.getConfidenceThreshold()) {
                detections.add(createDetection(text, start, end, type, score, label).shift(chunk.getStartOffset()));
            } else if (score > config.getWarningThreshold()) {
                warnings.add(lowConfidenceWarning(text, start, end, type, score));
            }
        }
        return new ChunkOutcome(new DetectorRun(getName(), label, detections, elapsedSince(startTime)), warnings);
    }

    private void recordChunkFailure(TextChunk chunk, Throwable cause, ScrubConfig config, ErrorCollector errors) {
        String reason;
        if (cause instanceof TimeoutException) {
            reason = "timed out after " + config.getStatisticalTimeoutMs() + " ms";
        } else {
            reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        }
        log.warn("Statistical analysis of chunk {} failed: {}", chunk.getIndex(), reason);
        errors.add(modelWarning(recognizer.getModelName(),
                "Statistical analysis of chunk " + chunk.getIndex() + " failed: " + reason,
                "Names and locations in this chunk are covered by pattern and context detection only"));
    }

    private ScrubWarning modelWarning(String modelName, String message, String suggestion) {
        return ScrubWarning.builder()
                .type(WarningType.STATISTICAL_MODEL_ERROR)
                .stage(ScrubStage.STATISTICAL_PASS)
                .message(message)
                .suggestion(suggestion)
                .modelName(modelName)
                .fallbackUsed(true)
                .build();
    }

    private ScrubWarning lowConfidenceWarning(String text, int start, int end, EntityType type, double score) {
        int contextStart = Math.max(0, start - CONTEXT_RADIUS);
        int contextEnd = Math.min(text.length(), end + CONTEXT_RADIUS);
        return ScrubWarning.builder()
                .type(WarningType.LOW_CONFIDENCE)
                .stage(ScrubStage.STATISTICAL_PASS)
                .message(String.format(Locale.ROOT, "Possible %s below the redaction threshold (score %.2f)", type, score))
                .suggestion("Review manually and redact if this is personal information")
                .modelName(recognizer.getModelName())
                .entity(text.substring(start, end))
                .score(score)
                .context(text.substring(contextStart, contextEnd))
                .build();
    }

    /**
     * Maps a model label to an entity type. Only persons, locations and organizations are kept.
     *
     * @param label Model label, optionally with a B- or I- prefix
     * @return Entity type, or null if the label is not targeted
     */
    static EntityType mapLabel(String label) {
        if (label == null) {
            return null;
        }
        String type = label.toUpperCase(Locale.ROOT);
        if (type.startsWith("B-") || type.startsWith("I-")) {
            type = type.substring(2);
        }
        return switch (type) {
            case "PER", "PERSON" -> EntityType.PERSON;
            case "LOC", "LOCATION", "GPE" -> EntityType.LOCATION;
            case "ORG", "ORGANIZATION" -> EntityType.ORGANIZATION;
            default -> null;
        };
    }

    /**
     * Checks if the model is available.
     * Uses cached status to avoid frequent calls.
     *
     * @return true if the model is available
     */
    public boolean isModelAvailable() {
        long currentTime = System.currentTimeMillis();
        Boolean cached = modelAvailable;
        if (cached != null && (currentTime - lastAvailabilityCheck) < AVAILABILITY_CHECK_INTERVAL) {
            return cached;
        }
        boolean available;
        try {
            available = recognizer.isAvailable();
        } catch (RuntimeException e) {
            log.warn("Availability check of named-entity model failed: {}", e.getMessage());
            available = false;
        }
        modelAvailable = available;
        lastAvailabilityCheck = currentTime;
        return available;
    }

    // Warnings travel with the run so that a chunk finishing after its timeout reports nothing
    private static final class ChunkOutcome {
        private final DetectorRun run;
        private final List<ScrubWarning> warnings;

        private ChunkOutcome(DetectorRun run, List<ScrubWarning> warnings) {
            this.run = run;
            this.warnings = warnings;
        }
    }

    private static Throwable unwrap(Throwable e) {
        return (e instanceof CompletionException && e.getCause() != null) ? e.getCause() : e;
    }
}
