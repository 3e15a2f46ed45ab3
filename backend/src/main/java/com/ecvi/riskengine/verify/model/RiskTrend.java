package com.ecvi.riskengine.verify.model;

import java.util.List;

public record RiskTrend(
    long companyId,
    int sampleSize,
    Double slope,
    String direction,
    Integer latestScore,
    Double averageScore,
    Integer minScore,
    Integer maxScore,
    List<RiskScoreChange> scoreChanges
) {
    public RiskTrend {
        scoreChanges = scoreChanges == null ? List.of() : List.copyOf(scoreChanges);
    }
}
