package com.pipewright.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the feedback decision engine needs to know about one stage.
 *
 * @param stage                     stage name
 * @param retryStrategy             retry/escalation/abort thresholds
 * @param escalationTargets         failure keyword to specialist executor, in match order
 * @param defaultEscalationExecutor executor used when no escalation keyword matches
 * @param guidance                  stage-specific focus points added to retry instructions
 * @param successCriteria           checkable criteria an attempt must satisfy
 */
public record StagePolicy(
    String stage,
    RetryStrategy retryStrategy,
    Map<String, String> escalationTargets,
    String defaultEscalationExecutor,
    List<String> guidance,
    Map<String, String> successCriteria
) implements Serializable {

    /** Criteria every stage shares. */
    public static final Map<String, String> BASE_CRITERIA = baseCriteria();

    public StagePolicy {
        escalationTargets = escalationTargets == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(escalationTargets));
        guidance = guidance == null ? List.of() : List.copyOf(guidance);
        successCriteria = successCriteria == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(successCriteria));
    }

    /** Base criteria followed by the stage-specific ones. */
    public Map<String, String> allSuccessCriteria() {
        var all = new LinkedHashMap<>(BASE_CRITERIA);
        all.putAll(successCriteria);
        return Collections.unmodifiableMap(all);
    }

    private static Map<String, String> baseCriteria() {
        var base = new LinkedHashMap<String, String>();
        base.put("execution_success", "true");
        base.put("no_critical_errors", "true");
        base.put("validation_passed", "true");
        return Collections.unmodifiableMap(base);
    }
}
