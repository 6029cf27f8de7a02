package com.cgi.medscrub.service;

import com.cgi.medscrub.model.AuditEntry;
import com.cgi.medscrub.model.AuditSummary;
import com.cgi.medscrub.model.AuditTrail;
import com.cgi.medscrub.model.Detection;
import com.cgi.medscrub.model.DetectorRun;
import com.cgi.medscrub.model.RedactionRecord;
import com.cgi.medscrub.model.enums.ScrubStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Accumulates the audit data of one scrub and computes its confidence.
 * One instance per invocation; it only reads what the other stages produce.
 */
public class ScrubAuditCollector {
    private static final Logger log = LoggerFactory.getLogger(ScrubAuditCollector.class);

    private final Clock clock;
    private final Instant startedAt;
    private final List<DetectorRun> runs = new ArrayList<>();
    private final List<ScrubStage> stages = new ArrayList<>();
    private int chunkCount;
    private boolean statisticalPassRan;
    private int residualRiskCount;

    public ScrubAuditCollector() {
        this(Clock.systemUTC());
    }

    public ScrubAuditCollector(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public void recordStage(ScrubStage stage) {
        stages.add(stage);
    }

    public void recordRuns(Collection<DetectorRun> detectorRuns) {
        runs.addAll(detectorRuns);
    }

    public void recordChunks(int count) {
        this.chunkCount = count;
    }

    public void recordStatisticalPass() {
        this.statisticalPassRan = true;
    }

    public void recordResidualRisk(int count) {
        this.residualRiskCount = count;
    }

    /**
     * Aggregate confidence of a result: mean of the surviving detections, or 1.0 when nothing was found.
     *
     * @param detections Surviving detections
     * @return Confidence between 0.0 and 1.0
     */
    public static double confidence(Collection<Detection> detections) {
        if (detections.isEmpty()) {
            return 1.0;
        }
        return detections.stream().mapToDouble(Detection::getConfidence).average().orElse(1.0);
    }

    /**
     * Builds the audit trail.
     *
     * @param canonical Surviving detections, one per entity text
     * @param appliedSpans Spans that were replaced
     * @param placeholderFor Placeholder each detection maps to
     * @param originalLength Length of the input
     * @param scrubbedLength Length of the output
     * @return Audit trail with one entry per detector invocation
     */
    public AuditTrail build(Collection<Detection> canonical, Collection<Detection> appliedSpans,
                            Function<Detection, String> placeholderFor, int originalLength, int scrubbedLength) {
        Set<Long> applied = new HashSet<>();
        int redactedChars = 0;
        for (Detection span : appliedSpans) {
            applied.add(spanKey(span));
            redactedChars += span.length();
        }

        AuditTrail.AuditTrailBuilder trail = AuditTrail.builder();
        for (DetectorRun run : runs) {
            AuditEntry.AuditEntryBuilder entry = AuditEntry.builder()
                    .detectorName(run.getDetectorName())
                    .patternOrLabel(run.getPatternOrLabel())
                    .elapsedMs(run.getElapsedMs());
            for (Detection detection : run.getDetections()) {
                entry.replacement(new RedactionRecord(detection.getEntityText(), placeholderFor.apply(detection),
                        detection.getStartOffset(), applied.contains(spanKey(detection))));
            }
            trail.entry(entry.build());
        }

        Instant completedAt = clock.instant();
        double confidence = confidence(canonical);
        AuditSummary.AuditSummaryBuilder summary = AuditSummary.builder()
                .totalDetections(canonical.size())
                .redactedChars(redactedChars)
                .density(originalLength == 0 ? 0.0 : (double) redactedChars / originalLength)
                .confidence(confidence)
                .durationMs(Duration.between(startedAt, completedAt).toMillis())
                .originalLength(originalLength)
                .scrubbedLength(scrubbedLength)
                .chunkCount(chunkCount)
                .statisticalPassRan(statisticalPassRan)
                .residualRiskCount(residualRiskCount)
                .stagesVisited(stages)
                .startedAt(startedAt)
                .completedAt(completedAt);
        canonical.stream()
                .map(Detection::getEntityType)
                .distinct()
                .forEach(type -> summary.category(type,
                        (int) canonical.stream().filter(d -> d.getEntityType() == type).count()));

        AuditTrail result = trail.summary(summary.build()).build();
        log.info("Scrub audit: {} detection(s), {} redacted char(s), confidence {}",
                canonical.size(), redactedChars, String.format("%.2f", confidence));
        return result;
    }

    private static long spanKey(Detection detection) {
        return ((long) detection.getStartOffset() << 32) | detection.getEndOffset();
    }
}
