package com.cgi.medscrub.model;

import com.cgi.medscrub.model.enums.EntityType;
import com.cgi.medscrub.model.enums.ScrubStage;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class AuditSummary {
    int totalDetections;

    @Singular("category")
    Map<EntityType, Integer> byCategory;

    int redactedChars;
    double density;
    double confidence;
    long durationMs;

    int originalLength;
    int scrubbedLength;
    int chunkCount;
    boolean statisticalPassRan;
    int residualRiskCount;

    @Singular("stage")
    List<ScrubStage> stagesVisited;

    Instant startedAt;
    Instant completedAt;
}
