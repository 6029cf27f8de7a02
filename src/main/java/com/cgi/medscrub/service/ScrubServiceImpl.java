/*
 * ScrubServiceImpl.java - Orchestrator of the de-identification pipeline
 */
package com.cgi.medscrub.service;

import com.cgi.medscrub.api.ScrubService;
import com.cgi.medscrub.api.ScrubStageListener;
import com.cgi.medscrub.config.ScrubberProperties;
import com.cgi.medscrub.exception.InputRejectedException;
import com.cgi.medscrub.model.AuditTrail;
import com.cgi.medscrub.model.Detection;
import com.cgi.medscrub.model.DetectorRun;
import com.cgi.medscrub.model.ErrorCollector;
import com.cgi.medscrub.model.MergeOutcome;
import com.cgi.medscrub.model.PlaceholderToken;
import com.cgi.medscrub.model.ScrubConfig;
import com.cgi.medscrub.model.ScrubResult;
import com.cgi.medscrub.model.ScrubState;
import com.cgi.medscrub.model.ScrubWarning;
import com.cgi.medscrub.model.TextChunk;
import com.cgi.medscrub.model.enums.ScrubStage;
import com.cgi.medscrub.model.enums.WarningType;
import com.cgi.medscrub.strategy.ContextLabelStrategy;
import com.cgi.medscrub.strategy.StatisticalNERStrategy;
import com.cgi.medscrub.strategy.StructuralPatternStrategy;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Main implementation of the scrub engine.
 * Runs the pipeline as a state machine: validation, structural pass, context pass, optional chunking and
 * statistical pass, merging, replacement and auditing. Only validation can fail the call; every later
 * failure becomes a warning and the pipeline continues with what it has.
 */
@Service
public class ScrubServiceImpl implements ScrubService {
    private static final Logger log = LoggerFactory.getLogger(ScrubServiceImpl.class);

    private final InputValidator inputValidator;
    private final StructuralPatternStrategy structuralStrategy;
    private final ContextLabelStrategy contextStrategy;
    private final StatisticalNERStrategy statisticalStrategy;
    private final TextChunker chunker;
    private final DetectionMerger merger;
    private final SecurePlaceholderGenerator placeholderGenerator;
    private final ResidualRiskScanner residualRiskScanner;
    private final OutputValidator outputValidator;
    private final List<ScrubStageListener> listeners;
    private final Executor scrubExecutor;
    private final ScrubConfig defaultConfig;

    @Autowired
    public ScrubServiceImpl(
            InputValidator inputValidator,
            StructuralPatternStrategy structuralStrategy,
            ContextLabelStrategy contextStrategy,
            StatisticalNERStrategy statisticalStrategy,
            TextChunker chunker,
            DetectionMerger merger,
            SecurePlaceholderGenerator placeholderGenerator,
            ResidualRiskScanner residualRiskScanner,
            OutputValidator outputValidator,
            List<ScrubStageListener> listeners,
            @Qualifier("scrubExecutor") Executor scrubExecutor,
            ScrubberProperties properties) {

        this.inputValidator = inputValidator;
        this.structuralStrategy = structuralStrategy;
        this.contextStrategy = contextStrategy;
        this.statisticalStrategy = statisticalStrategy;
        this.chunker = chunker;
        this.merger = merger;
        this.placeholderGenerator = placeholderGenerator;
        this.residualRiskScanner = residualRiskScanner;
        this.outputValidator = outputValidator;
        this.listeners = listeners != null ? List.copyOf(listeners) : List.of();
        this.scrubExecutor = scrubExecutor;
        this.defaultConfig = properties.toScrubConfig();

        log.info("Scrub engine initialized with {} stage listener(s)", this.listeners.size());
    }

    @PostConstruct
    public void validateConfiguration() {
        try {
            defaultConfig.withResolvedSalt().validate();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid scrub configuration: " + e.getMessage(), e);
        }
        log.info("Scrub configuration validated: maxInputSize={}, chunkSize={}, threshold={}, statistical={}, context={}",
                defaultConfig.getMaxInputSize(), defaultConfig.getChunkSize(), defaultConfig.getConfidenceThreshold(),
                defaultConfig.isEnableStatisticalDetector(), defaultConfig.isEnableContextDetector());
    }

    @Override
    public ScrubResult scrub(String text) {
        return scrub(text, defaultConfig);
    }

    @Override
    public ScrubResult scrub(String text, ScrubConfig config) {
        ScrubConfig effective = (config != null ? config : defaultConfig).withResolvedSalt();
        effective.validate();
        return new ScrubRun(text, effective).execute();
    }

    @Override
    public CompletableFuture<ScrubResult> scrubAsync(String text, ScrubConfig config) {
        return CompletableFuture.supplyAsync(() -> scrub(text, config), scrubExecutor);
    }

    @Override
    public ScrubConfig getDefaultConfig() {
        return defaultConfig;
    }

    /**
     * State of a single invocation. Never shared between calls.
     */
    private final class ScrubRun {
        private final String text;
        private final ScrubConfig config;
        private final ErrorCollector errors = new ErrorCollector();
        private final ScrubAuditCollector audit = new ScrubAuditCollector();

        private ScrubStage stage;
        private ScrubState state;
        private List<Detection> structural = Collections.emptyList();
        private List<Detection> context = Collections.emptyList();
        private List<Detection> statistical = Collections.emptyList();
        private MergeOutcome outcome = MergeOutcome.empty();
        private Map<String, PlaceholderToken> placeholders = Collections.emptyMap();

        private ScrubRun(String text, ScrubConfig config) {
            this.text = text;
            this.config = config;
        }

        private ScrubResult execute() {
            long startTime = System.currentTimeMillis();

            transition(ScrubStage.VALIDATING);
            try {
                inputValidator.validate(text, config.getMaxInputSize());
            } catch (InputRejectedException e) {
                transition(ScrubStage.FAILED);
                log.warn("Input rejected ({}): {}", e.getErrorCode(), e.getMessage());
                throw e;
            }
            state = ScrubState.initial(text);

            transition(ScrubStage.STRUCTURAL_PASS);
            structural = runDetector(() -> structuralStrategy.detect(text, config, errors));

            transition(ScrubStage.CONTEXT_PASS);
            if (contextStrategy.isApplicable(config)) {
                context = runDetector(() -> contextStrategy.detect(text, config, errors));
            } else {
                log.debug("Context detector disabled, skipping");
            }

            if (statisticalStrategy.isApplicable(config)) {
                transition(ScrubStage.CHUNKING);
                List<TextChunk> chunks = runStage(() -> chunker.chunk(text, config.getChunkSize()),
                        Collections.<TextChunk>emptyList());
                audit.recordChunks(chunks.size());

                transition(ScrubStage.STATISTICAL_PASS);
                statistical = runDetector(() -> statisticalStrategy.detectChunks(chunks, config, errors));
                audit.recordStatisticalPass();
            }

            transition(ScrubStage.MERGING);
            outcome = runStage(() -> merger.merge(structural, context, statistical), MergeOutcome.empty());

            transition(ScrubStage.REPLACING);
            ScrubState replaced = runStage(this::replace, null);
            if (replaced != null) {
                state = replaced;
            } else {
                outcome = MergeOutcome.empty();
                placeholders = Collections.emptyMap();
            }

            transition(ScrubStage.AUDITING);
            AuditTrail auditTrail = runStage(this::auditTrail, AuditTrail.builder().build());

            Map<String, String> replacements = new LinkedHashMap<>();
            for (Map.Entry<String, PlaceholderToken> entry : placeholders.entrySet()) {
                replacements.put(entry.getKey(), entry.getValue().getValue());
            }

            ScrubResult result = ScrubResult.builder()
                    .text(state.getCurrentText())
                    .replacements(replacements)
                    .count(outcome.getCanonical().size())
                    .confidence(ScrubAuditCollector.confidence(outcome.getCanonical().values()))
                    .detections(outcome.getCanonical().values())
                    .warnings(errors.getWarnings())
                    .auditTrail(auditTrail)
                    .finalStage(ScrubStage.DONE)
                    .build();

            transition(ScrubStage.DONE);
            result = checkOutput(result);

            log.info("Scrub completed in {} ms: {} replacement(s), {} warning(s)",
                    System.currentTimeMillis() - startTime, result.getCount(), result.getWarnings().size());
            return result;
        }

        private ScrubState replace() {
            Map<String, PlaceholderToken> tokens = new LinkedHashMap<>();
            for (Detection detection : outcome.getCanonical().values()) {
                tokens.put(detection.getEntityText(), placeholderGenerator.generate(
                        detection.getEntityText(), detection.getEntityType(), config.getSessionSalt()));
            }
            ScrubState next = merger.apply(state, outcome, tokens);
            placeholders = tokens;
            return next;
        }

        private AuditTrail auditTrail() {
            Map<ResidualRiskScanner.RiskCategory, Integer> risks = residualRiskScanner.scan(state.getCurrentText());
            int riskCount = risks.values().stream().mapToInt(Integer::intValue).sum();
            audit.recordResidualRisk(riskCount);
            if (riskCount > 0) {
                errors.add(ScrubWarning.builder()
                        .type(WarningType.RESIDUAL_RISK)
                        .stage(ScrubStage.AUDITING)
                        .message(riskCount + " fragment(s) of the output still resemble personal information " + risks)
                        .suggestion("Review the scrubbed text before sharing it")
                        .build());
            }
            return audit.build(outcome.getCanonical().values(), outcome.getSpans(), this::placeholderFor,
                    text.length(), state.getCurrentText().length());
        }

        private String placeholderFor(Detection detection) {
            PlaceholderToken token = placeholders.get(detection.getEntityText());
            if (token == null) {
                token = placeholderGenerator.generate(detection.getEntityText(), detection.getEntityType(),
                        config.getSessionSalt());
            }
            return token.getValue();
        }

        private ScrubResult checkOutput(ScrubResult result) {
            List<String> violations;
            try {
                violations = outputValidator.validate(text, result, outcome);
            } catch (RuntimeException e) {
                log.error("Output validation failed: {}", e.getMessage(), e);
                violations = List.of("output validation failed: " + e.getMessage());
            }
            if (violations.isEmpty()) {
                return result;
            }
            ScrubResult.ScrubResultBuilder builder = result.toBuilder();
            for (String violation : violations) {
                log.warn("Scrub result invariant violated: {}", violation);
                builder.warning(ScrubWarning.builder()
                        .type(WarningType.OUTPUT_INVARIANT_VIOLATION)
                        .stage(ScrubStage.DONE)
                        .message(violation)
                        .suggestion("Review the scrubbed text manually")
                        .build());
            }
            return builder.build();
        }

        private List<Detection> runDetector(Supplier<List<DetectorRun>> detector) {
            List<DetectorRun> runs = runStage(detector, Collections.<DetectorRun>emptyList());
            audit.recordRuns(runs);
            List<Detection> detections = new ArrayList<>();
            for (DetectorRun run : runs) {
                detections.addAll(run.getDetections());
            }
            return detections;
        }

        private <T> T runStage(Supplier<T> action, T fallback) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                log.error("Stage {} failed: {}", stage, e.getMessage(), e);
                errors.add(ScrubWarning.builder()
                        .type(WarningType.STAGE_FAILURE)
                        .stage(stage)
                        .message("Stage " + stage + " failed: " + e.getMessage())
                        .suggestion("Results of this stage are missing; review the output manually")
                        .build());
                return fallback;
            }
        }

        private void transition(ScrubStage next) {
            ScrubStage previous = stage;
            stage = next;
            audit.recordStage(next);
            for (ScrubStageListener listener : listeners) {
                try {
                    listener.onStageChanged(previous, next);
                } catch (RuntimeException e) {
                    log.warn("Stage listener {} failed on {}: {}", listener.getClass().getSimpleName(), next,
                            e.getMessage(), e);
                }
            }
        }
    }
}
