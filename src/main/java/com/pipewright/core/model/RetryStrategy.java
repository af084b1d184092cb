package com.pipewright.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-stage retry configuration used by the feedback decision engine.
 *
 * @param maxAttempts         failures after which a loop is aborted
 * @param backoffFactor       growth factor of the suggested delay between attempts
 * @param timeoutMultiplier   growth factor of the executor timeout per attempt
 * @param escalationThreshold failures after which the loop is escalated to another executor
 * @param abortConditions     failure-reason keywords that abort immediately
 * @param remediationHints    failure-reason keyword to remediation guidance, in match order
 */
public record RetryStrategy(
    int maxAttempts,
    double backoffFactor,
    double timeoutMultiplier,
    int escalationThreshold,
    List<String> abortConditions,
    Map<String, String> remediationHints
) implements Serializable {

    public RetryStrategy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        abortConditions = abortConditions == null ? List.of() : List.copyOf(abortConditions);
        remediationHints = remediationHints == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(remediationHints));
    }

    public static RetryStrategy defaults() {
        return new RetryStrategy(3, 1.5, 1.2, 2, List.of(), Map.of());
    }
}
