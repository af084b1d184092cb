package com.pipewright.core.feedback;

import com.pipewright.config.PipelineProperties;
import com.pipewright.core.ConfigurationException;
import com.pipewright.core.model.RetryStrategy;
import com.pipewright.core.model.StagePolicy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stage name to {@link StagePolicy}. Built-in policies exist for the implementation, testing
 * and quality-gate stages; configuration can override them field by field or add new stages.
 */
public final class StagePolicyRegistry {

    public static final String IMPLEMENTATION = "implementation";
    public static final String TESTING = "testing";
    public static final String QUALITY_GATE = "quality-gate";

    static final String FALLBACK_ESCALATION_EXECUTOR = "code-reviewer";

    private final Map<String, StagePolicy> policies;

    public StagePolicyRegistry(Map<String, StagePolicy> policies) {
        this.policies = Collections.unmodifiableMap(new LinkedHashMap<>(policies));
    }

    public static StagePolicyRegistry defaults() {
        var policies = new LinkedHashMap<String, StagePolicy>();
        policies.put(IMPLEMENTATION, implementation());
        policies.put(TESTING, testing());
        policies.put(QUALITY_GATE, qualityGate());
        return new StagePolicyRegistry(policies);
    }

    /**
     * Built-in policies overlaid with {@code pipewright.stages.*}.
     */
    public static StagePolicyRegistry fromProperties(PipelineProperties properties) {
        var policies = new LinkedHashMap<>(defaults().policies);
        properties.getStages().forEach((stage, overrides) ->
                policies.put(stage, overlay(policies.getOrDefault(stage, generic(stage)), overrides)));
        return new StagePolicyRegistry(policies);
    }

    /** Copy of this registry with {@code policy} added or replaced. */
    public StagePolicyRegistry with(StagePolicy policy) {
        var copy = new LinkedHashMap<>(policies);
        copy.put(policy.stage(), policy);
        return new StagePolicyRegistry(copy);
    }

    public boolean hasPolicy(String stage) {
        return policies.containsKey(stage);
    }

    /**
     * @throws ConfigurationException if the stage has no policy
     */
    public StagePolicy policyFor(String stage) {
        StagePolicy policy = policies.get(stage);
        if (policy == null) {
            throw new ConfigurationException("No feedback policy configured for stage '" + stage + "'");
        }
        return policy;
    }

    public Set<String> stages() {
        return policies.keySet();
    }

    static StagePolicy generic(String stage) {
        return new StagePolicy(stage, RetryStrategy.defaults(), Map.of(), FALLBACK_ESCALATION_EXECUTOR,
                implementation().guidance(), Map.of());
    }

    private static StagePolicy overlay(StagePolicy base, PipelineProperties.Stage overrides) {
        RetryStrategy retry = base.retryStrategy();
        var strategy = new RetryStrategy(
                valueOr(overrides.getMaxAttempts(), retry.maxAttempts()),
                valueOr(overrides.getBackoffFactor(), retry.backoffFactor()),
                valueOr(overrides.getTimeoutMultiplier(), retry.timeoutMultiplier()),
                valueOr(overrides.getEscalationThreshold(), retry.escalationThreshold()),
                valueOr(overrides.getAbortConditions(), retry.abortConditions()),
                valueOr(overrides.getRemediationHints(), retry.remediationHints()));
        return new StagePolicy(base.stage(), strategy,
                valueOr(overrides.getEscalationTargets(), base.escalationTargets()),
                valueOr(overrides.getDefaultEscalationExecutor(), base.defaultEscalationExecutor()),
                valueOr(overrides.getGuidance(), base.guidance()),
                valueOr(overrides.getSuccessCriteria(), base.successCriteria()));
    }

    private static <T> T valueOr(T value, T fallback) {
        return value != null ? value : fallback;
    }

    private static StagePolicy implementation() {
        var hints = new LinkedHashMap<String, String>();
        hints.put("import_error", "Check import paths and that every referenced module exists");
        hints.put("syntax_error", "Re-read the code syntax, especially matching brackets and quotes");
        hints.put("type_error", "Check variable types and function signatures");

        var routes = new LinkedHashMap<String, String>();
        routes.put("syntax_error", "python-pro");
        routes.put("import_error", "backend-architect");
        routes.put("logic_error", "fullstack-engineer");
        routes.put("type_error", "typescript-pro");

        var criteria = new LinkedHashMap<String, String>();
        criteria.put("syntax_valid", "true");
        criteria.put("imports_resolved", "true");
        criteria.put("no_runtime_errors", "true");

        return new StagePolicy(IMPLEMENTATION,
                new RetryStrategy(3, 1.0, 1.5, 2,
                        List.of("syntax_error_repeated", "invalid_imports"), hints),
                routes, "code-reviewer",
                List.of("Check the code carefully for syntax and logic errors",
                        "Make sure every imported module and dependency is correct",
                        "Verify function signatures and return types",
                        "Mind variable scope and naming conventions"),
                criteria);
    }

    private static StagePolicy testing() {
        var hints = new LinkedHashMap<String, String>();
        hints.put("assertion_error", "Correct the implementation logic according to the failing assertion");
        hints.put("test_timeout", "Speed up the code under test or adjust the test timeout");
        hints.put("missing_test_case", "Add the missing test cases");

        var routes = new LinkedHashMap<String, String>();
        routes.put("test_failure", "test-engineer");
        routes.put("coverage", "e2e-test-specialist");
        routes.put("performance", "performance-tester");

        var criteria = new LinkedHashMap<String, String>();
        criteria.put("all_tests_pass", "true");
        criteria.put("coverage_threshold", ">= 80%");
        criteria.put("no_test_timeouts", "true");

        return new StagePolicy(TESTING,
                new RetryStrategy(4, 1.2, 1.3, 3,
                        List.of("test_framework_error", "dependency_missing"), hints),
                routes, "test-engineer",
                List.of("Analyse the concrete cause of each test failure",
                        "Check that the expected values in the test cases are correct",
                        "Make sure the test environment and data are fully prepared",
                        "Verify the tests cover every critical path"),
                criteria);
    }

    private static StagePolicy qualityGate() {
        var hints = new LinkedHashMap<String, String>();
        hints.put("code_quality", "Fix the reported code-style and maintainability violations");
        hints.put("coverage_low", "Add tests until coverage meets the threshold");
        hints.put("security_issue", "Fix the reported security findings before anything else");

        var routes = new LinkedHashMap<String, String>();
        routes.put("security", "security-auditor");
        routes.put("performance", "performance-engineer");
        routes.put("architecture", "backend-architect");

        var criteria = new LinkedHashMap<String, String>();
        criteria.put("quality_score", ">= 8.0");
        criteria.put("security_issues", "== 0");
        criteria.put("performance_regression", "false");

        return new StagePolicy(QUALITY_GATE,
                new RetryStrategy(2, 2.0, 1.1, 1,
                        List.of("security_vulnerability", "performance_regression"), hints),
                routes, "code-reviewer",
                List.of("Fix code-convention violations against the quality standard",
                        "Remove performance bottlenecks and wasteful resource use",
                        "Fix security vulnerabilities and risky spots",
                        "Make sure documentation and comments are complete"),
                criteria);
    }
}
