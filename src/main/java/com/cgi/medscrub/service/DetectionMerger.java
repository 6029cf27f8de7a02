package com.cgi.medscrub.service;

import com.cgi.medscrub.model.Detection;
import com.cgi.medscrub.model.MergeOutcome;
import com.cgi.medscrub.model.PlaceholderToken;
import com.cgi.medscrub.model.ScrubState;
import com.cgi.medscrub.model.enums.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reconciles the detections of all passes into one canonical detection per entity text,
 * then rewrites the text around the surviving spans.
 */
@Component
public class DetectionMerger {
    private static final Logger log = LoggerFactory.getLogger(DetectionMerger.class);

    // Longest span first, then method precedence, then confidence, then position
    private static final Comparator<Detection> SPAN_PRIORITY = Comparator
            .comparingInt(Detection::length).reversed()
            .thenComparing(Detection::getMethod, Comparator.reverseOrder())
            .thenComparing(Detection::getConfidence, Comparator.reverseOrder())
            .thenComparingInt(Detection::getStartOffset);

    /**
     * Merges the detections of the three passes.
     * For a given entity text, the first detection of a pass wins within that pass and a later pass
     * overrides an earlier one. Overlapping spans are then arbitrated so that no two replacements overlap.
     *
     * @param structural Detections of the structural pass
     * @param context Detections of the context pass
     * @param statistical Detections of the statistical pass
     * @return Canonical detections and the spans to replace, in descending start order
     */
    public MergeOutcome merge(List<Detection> structural, List<Detection> context, List<Detection> statistical) {
        Map<String, Detection> winners = new HashMap<>();
        winners.putAll(firstPerText(structural));
        winners.putAll(firstPerText(context));
        winners.putAll(firstPerText(statistical));

        List<Detection> candidates = new ArrayList<>(structural.size() + context.size() + statistical.size());
        candidates.addAll(structural);
        candidates.addAll(context);
        candidates.addAll(statistical);
        candidates.sort(SPAN_PRIORITY);

        // Accepted spans keyed by start offset; they never overlap each other
        TreeMap<Integer, Detection> accepted = new TreeMap<>();
        int rejected = 0;
        for (Detection candidate : candidates) {
            Map.Entry<Integer, Detection> previous = accepted.floorEntry(candidate.getEndOffset() - 1);
            if (previous != null && previous.getValue().getEndOffset() > candidate.getStartOffset()) {
                rejected++;
                continue;
            }
            accepted.put(candidate.getStartOffset(), candidate);
        }

        // Canonical set keeps only texts that are actually replaced, in order of first appearance
        Map<String, Detection> canonical = new LinkedHashMap<>();
        for (Detection span : accepted.values()) {
            canonical.putIfAbsent(span.getEntityText(), winners.get(span.getEntityText()));
        }

        List<Detection> spans = new ArrayList<>(accepted.descendingMap().values());
        log.debug("Merged {} candidate span(s) into {} replacement(s) of {} distinct value(s), {} overlapping span(s) dropped",
                candidates.size(), spans.size(), canonical.size(), rejected);
        return new MergeOutcome(canonical, spans);
    }

    /**
     * Replaces every merged span with the placeholder of its entity text.
     * Spans are applied from the end of the text backwards so earlier offsets stay valid.
     *
     * @param state Snapshot holding the text the spans refer to
     * @param outcome Merge outcome
     * @param placeholders Placeholder per canonical entity text
     * @return New snapshot with the rewritten text
     */
    public ScrubState apply(ScrubState state, MergeOutcome outcome, Map<String, PlaceholderToken> placeholders) {
        StringBuilder buffer = new StringBuilder(state.getCurrentText());
        int previousStart = Integer.MAX_VALUE;

        for (Detection span : outcome.getSpans()) {
            if (span.getEndOffset() > previousStart) {
                throw new IllegalStateException("Replacement spans must be non-overlapping and in descending order");
            }
            PlaceholderToken token = placeholders.get(span.getEntityText());
            if (token == null) {
                throw new IllegalStateException("No placeholder for a merged entity of type " + span.getEntityType());
            }
            buffer.replace(span.getStartOffset(), span.getEndOffset(), token.getValue());
            previousStart = span.getStartOffset();
        }

        Map<EntityType, Integer> counts = new EnumMap<>(EntityType.class);
        for (Detection detection : outcome.getCanonical().values()) {
            counts.merge(detection.getEntityType(), 1, Integer::sum);
        }

        return ScrubState.builder()
                .currentText(buffer.toString())
                .replacements(placeholders)
                .perTypeCounts(counts)
                .build();
    }

    private static Map<String, Detection> firstPerText(List<Detection> detections) {
        Map<String, Detection> first = new HashMap<>();
        for (Detection detection : detections) {
            first.putIfAbsent(detection.getEntityText(), detection);
        }
        return first;
    }
}
