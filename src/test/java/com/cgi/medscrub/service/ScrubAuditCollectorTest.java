package com.cgi.medscrub.service;

import com.cgi.medscrub.model.AuditEntry;
import com.cgi.medscrub.model.AuditSummary;
import com.cgi.medscrub.model.AuditTrail;
import com.cgi.medscrub.model.Detection;
import com.cgi.medscrub.model.DetectorRun;
import com.cgi.medscrub.model.RedactionRecord;
import com.cgi.medscrub.model.enums.DetectionMethod;
import com.cgi.medscrub.model.enums.EntityType;
import com.cgi.medscrub.model.enums.ScrubStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScrubAuditCollectorTest {

    private static final String DOCUMENT = "Patient Name: John Smith, SSN: 123-45-6789";

    private static Detection detection(String value, EntityType type, DetectionMethod method, double confidence) {
        int start = DOCUMENT.indexOf(value);
        return Detection.builder()
                .entityText(value).entityType(type)
                .startOffset(start).endOffset(start + value.length())
                .confidence(confidence).method(method).source("test")
                .build();
    }

    @Test
    @DisplayName("confidence is the mean of the surviving detections, or 1.0 without any")
    void confidence() {
        assertThat(ScrubAuditCollector.confidence(List.of())).isEqualTo(1.0);
        assertThat(ScrubAuditCollector.confidence(List.of(
                detection("John Smith", EntityType.PERSON, DetectionMethod.CONTEXT, 0.90),
                detection("123-45-6789", EntityType.NATIONAL_ID, DetectionMethod.REGEX, 0.99))))
                .isCloseTo(0.945, within(1e-9));
    }

    @Test
    @DisplayName("one entry per detector run with applied and superseded matches")
    void entries_per_run() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-15T10:00:00Z"), ZoneOffset.UTC);
        ScrubAuditCollector collector = new ScrubAuditCollector(clock);

        Detection name = detection("John Smith", EntityType.PERSON, DetectionMethod.CONTEXT, 0.90);
        Detection surname = detection("Smith", EntityType.PERSON, DetectionMethod.STATISTICAL, 0.95);
        Detection ssn = detection("123-45-6789", EntityType.NATIONAL_ID, DetectionMethod.REGEX, 0.99);

        collector.recordStage(ScrubStage.VALIDATING);
        collector.recordStage(ScrubStage.STRUCTURAL_PASS);
        collector.recordRuns(List.of(
                new DetectorRun("StructuralPatternStrategy", "SSN", List.of(ssn), 3),
                new DetectorRun("StructuralPatternStrategy", "EMAIL", List.of(), 0)));
        collector.recordRuns(List.of(new DetectorRun("ContextLabelStrategy", "NAME_LABELS", List.of(name), 1)));
        collector.recordChunks(1);
        collector.recordStatisticalPass();
        collector.recordRuns(List.of(new DetectorRun("StatisticalNERStrategy", "chunk-0", List.of(surname), 7)));
        collector.recordResidualRisk(2);

        AuditTrail trail = collector.build(List.of(name, ssn), List.of(ssn, name),
                d -> "[X_" + d.getEntityText().length() + "]", DOCUMENT.length(), 30);

        assertThat(trail.getEntries()).extracting(AuditEntry::getPatternOrLabel)
                .containsExactly("SSN", "EMAIL", "NAME_LABELS", "chunk-0");
        assertThat(trail.getEntries()).extracting(AuditEntry::getMatchCount).containsExactly(1, 0, 1, 1);

        RedactionRecord superseded = trail.getEntries().get(3).getReplacements().get(0);
        assertThat(superseded.getOriginal()).isEqualTo("Smith");
        assertThat(superseded.isApplied()).isFalse();
        assertThat(trail.getEntries().get(0).getReplacements().get(0).isApplied()).isTrue();
        assertThat(trail.getEntries().get(0).getReplacements().get(0).getPlaceholder()).isEqualTo("[X_11]");

        AuditSummary summary = trail.getSummary();
        assertThat(summary.getTotalDetections()).isEqualTo(2);
        assertThat(summary.getByCategory())
                .containsEntry(EntityType.PERSON, 1)
                .containsEntry(EntityType.NATIONAL_ID, 1);
        assertThat(summary.getRedactedChars()).isEqualTo(21);
        assertThat(summary.getDensity()).isCloseTo(21.0 / DOCUMENT.length(), within(1e-9));
        assertThat(summary.getConfidence()).isCloseTo(0.945, within(1e-9));
        assertThat(summary.getOriginalLength()).isEqualTo(DOCUMENT.length());
        assertThat(summary.getScrubbedLength()).isEqualTo(30);
        assertThat(summary.getChunkCount()).isEqualTo(1);
        assertThat(summary.isStatisticalPassRan()).isTrue();
        assertThat(summary.getResidualRiskCount()).isEqualTo(2);
        assertThat(summary.getStagesVisited()).containsExactly(ScrubStage.VALIDATING, ScrubStage.STRUCTURAL_PASS);
        assertThat(summary.getDurationMs()).isZero();
        assertThat(summary.getStartedAt()).isEqualTo(Instant.parse("2024-01-15T10:00:00Z"));
    }

    @Test
    @DisplayName("empty input gives zero density")
    void empty_input() {
        AuditTrail trail = new ScrubAuditCollector().build(List.of(), List.of(), d -> "", 0, 0);

        assertThat(trail.getEntries()).isEmpty();
        assertThat(trail.getSummary().getDensity()).isZero();
        assertThat(trail.getSummary().getConfidence()).isEqualTo(1.0);
        assertThat(trail.getSummary().getByCategory()).isEmpty();
    }
}
