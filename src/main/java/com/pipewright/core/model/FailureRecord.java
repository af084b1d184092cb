package com.pipewright.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * One structured failure inside a {@link ValidationResult}.
 *
 * @param type        failure category reported by the validator (e.g. "assertion_error")
 * @param message     human-readable description
 * @param expected    expected value, when the validator compared values
 * @param actual      actual value, when the validator compared values
 * @param details     additional opaque data
 * @param workOrderId work order this failure belongs to; null when it applies to the whole stage
 */
public record FailureRecord(
    String type,
    String message,
    String expected,
    String actual,
    Map<String, Object> details,
    String workOrderId
) implements Serializable {

    public FailureRecord {
        type = type == null ? "unknown" : type;
        message = message == null ? "" : message;
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static FailureRecord of(String type, String message) {
        return new FailureRecord(type, message, null, null, Map.of(), null);
    }

    public static FailureRecord forWorkOrder(String workOrderId, String type, String message) {
        return new FailureRecord(type, message, null, null, Map.of(), workOrderId);
    }

    public static FailureRecord mismatch(String workOrderId, String type, String message,
                                         String expected, String actual) {
        return new FailureRecord(type, message, expected, actual, Map.of(), workOrderId);
    }

    public boolean hasExpectedActualPair() {
        return expected != null && actual != null;
    }

    public boolean appliesTo(String taskId) {
        return workOrderId == null || workOrderId.equals(taskId);
    }

    /** One-line summary used as a feedback loop's failure reason. */
    public String summary() {
        var sb = new StringBuilder(type);
        if (!message.isBlank()) {
            sb.append(": ").append(message);
        }
        if (hasExpectedActualPair()) {
            sb.append(" (expected ").append(expected).append(", actual ").append(actual).append(")");
        }
        return sb.toString();
    }
}
