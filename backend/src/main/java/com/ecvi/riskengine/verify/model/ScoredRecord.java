package com.ecvi.riskengine.verify.model;

import java.time.Instant;

/** A completed record reduced to what trend analysis needs. */
public record ScoredRecord(long recordId, int riskScore, Instant createdAt) {}
