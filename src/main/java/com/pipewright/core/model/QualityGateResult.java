package com.pipewright.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Result of one external quality gate. Scoring happens outside Pipewright; this record is
 * consumed only to decide pass/fail and to build gate-specific remediation text.
 *
 * @param gateName       gate identifier (e.g. "security", "coverage")
 * @param status         gate status
 * @param score          numeric score on a 0-100 scale
 * @param message        summary from the gate
 * @param violations     violation descriptions, most important first
 * @param suggestedFixes fix suggestions, most important first
 */
public record QualityGateResult(
    String gateName,
    GateStatus status,
    double score,
    String message,
    List<String> violations,
    List<String> suggestedFixes
) implements Serializable {

    public QualityGateResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
        suggestedFixes = suggestedFixes == null ? List.of() : List.copyOf(suggestedFixes);
        message = message == null ? "" : message;
    }

    public boolean failing() {
        return status != null && status.isFailing();
    }
}
