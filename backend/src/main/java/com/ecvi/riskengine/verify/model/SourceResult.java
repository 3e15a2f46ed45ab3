package com.ecvi.riskengine.verify.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evidence produced by one adapter invocation. {@code signal} is the adapter's own
 * confidence indicator; {@code confidence} is the category confidence assigned by the
 * scorer once every adapter has settled.
 */
public record SourceResult(
    SourceCategory category,
    SourceOutcome outcome,
    Map<String, String> fields,
    Map<String, Double> fieldConfidence,
    double signal,
    int corroboratingSources,
    double confidence,
    List<Discrepancy> discrepancies,
    List<String> notes
) {
    public static final String NOT_EVALUATED_NOTE = "not_evaluated: required input missing";

    public SourceResult {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        fieldConfidence = fieldConfidence == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fieldConfidence));
        discrepancies = discrepancies == null ? List.of() : List.copyOf(discrepancies);
        notes = notes == null ? List.of() : List.copyOf(notes);
        signal = clamp(signal);
        confidence = clamp(confidence);
        corroboratingSources = Math.max(0, corroboratingSources);
    }

    public static SourceResult evaluated(
        SourceCategory category,
        Map<String, String> fields,
        Map<String, Double> fieldConfidence,
        double signal,
        int corroboratingSources,
        List<Discrepancy> discrepancies,
        List<String> notes
    ) {
        return new SourceResult(
            category,
            SourceOutcome.EVALUATED,
            fields,
            fieldConfidence,
            signal,
            corroboratingSources,
            0.0,
            discrepancies,
            notes
        );
    }

    public static SourceResult notEvaluated(SourceCategory category) {
        return withoutEvidence(category, SourceOutcome.NOT_EVALUATED, NOT_EVALUATED_NOTE);
    }

    public static SourceResult timedOut(SourceCategory category, String note) {
        return withoutEvidence(category, SourceOutcome.TIMED_OUT, note);
    }

    public static SourceResult unavailable(SourceCategory category, String note) {
        return withoutEvidence(category, SourceOutcome.UNAVAILABLE, note);
    }

    private static SourceResult withoutEvidence(SourceCategory category, SourceOutcome outcome, String note) {
        return new SourceResult(
            category,
            outcome,
            Map.of(),
            Map.of(),
            0.0,
            0,
            0.0,
            List.of(),
            note == null ? List.of() : List.of(note)
        );
    }

    public boolean hasEvidence() {
        return outcome.hasEvidence();
    }

    public String field(String name) {
        return fields.get(name);
    }

    public SourceResult withAddedDiscrepancies(List<Discrepancy> added) {
        if (added == null || added.isEmpty()) {
            return this;
        }
        List<Discrepancy> merged = new ArrayList<>(discrepancies);
        merged.addAll(added);
        return new SourceResult(
            category, outcome, fields, fieldConfidence, signal, corroboratingSources, confidence, merged, notes
        );
    }

    public SourceResult withConfidence(double value) {
        return new SourceResult(
            category, outcome, fields, fieldConfidence, signal, corroboratingSources, value, discrepancies, notes
        );
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
