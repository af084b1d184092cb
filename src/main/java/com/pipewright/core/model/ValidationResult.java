package com.pipewright.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Structured validation outcome reported back for a stage (or a single work order).
 *
 * @param success      whether validation passed
 * @param failures     structured failure records; empty when successful
 * @param qualityGates gate results, when the validation came from quality gates
 * @param details      additional opaque data
 */
public record ValidationResult(
    boolean success,
    List<FailureRecord> failures,
    List<QualityGateResult> qualityGates,
    Map<String, Object> details
) implements Serializable {

    public ValidationResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
        qualityGates = qualityGates == null ? List.of() : List.copyOf(qualityGates);
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static ValidationResult passed() {
        return new ValidationResult(true, List.of(), List.of(), Map.of());
    }

    public static ValidationResult failed(List<FailureRecord> failures) {
        return new ValidationResult(false, failures, List.of(), Map.of());
    }

    public static ValidationResult failed(FailureRecord... failures) {
        return failed(List.of(failures));
    }

    /**
     * Builds a validation result from quality gate outcomes. Every failing or blocked gate
     * becomes one failure record of type {@code quality_gate:<name>}.
     */
    public static ValidationResult ofQualityGates(List<QualityGateResult> gates) {
        var failures = new ArrayList<FailureRecord>();
        for (var gate : gates) {
            if (gate.failing()) {
                failures.add(new FailureRecord("quality_gate:" + gate.gateName(),
                        gate.gateName() + " " + gate.message(), null, null,
                        Map.of("score", gate.score(), "status", gate.status().name()), null));
            }
        }
        return new ValidationResult(failures.isEmpty(), failures, gates, Map.of());
    }

    public List<FailureRecord> failuresFor(String taskId) {
        return failures.stream().filter(f -> f.appliesTo(taskId)).toList();
    }

    public List<QualityGateResult> failingGates() {
        return qualityGates.stream().filter(QualityGateResult::failing).toList();
    }

    /** Returns a copy with extra failure records appended; success becomes false if any are added. */
    public ValidationResult withAdditionalFailures(List<FailureRecord> extra) {
        if (extra.isEmpty()) return this;
        var merged = new ArrayList<>(failures);
        merged.addAll(extra);
        return new ValidationResult(false, merged, qualityGates, details);
    }
}
