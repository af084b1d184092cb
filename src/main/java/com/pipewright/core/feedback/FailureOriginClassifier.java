package com.pipewright.core.feedback;

import com.pipewright.core.model.FailureOrigin;
import com.pipewright.core.model.FailureRecord;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Decides whether a verification failure is the produced artifact's fault or the verifier's own.
 * <p>
 * Rules are evaluated in order and the first match wins. The default table ends with an
 * unconditional rule blaming the verifier, so a failure matching neither keyword list stays
 * with the verifying stage.
 */
public final class FailureOriginClassifier {

    public record Rule(String name, Predicate<FailureRecord> predicate, FailureOrigin origin) {}

    static final List<String> ARTIFACT_INDICATORS = List.of(
            "assertion_error", "logic_error", "return_value_error", "behavior_mismatch",
            "expected_vs_actual", "function_not_working", "incorrect_result");

    static final List<String> VERIFIER_INDICATORS = List.of(
            "test_setup_error", "test_framework_error", "invalid_test_case",
            "test_configuration_error", "mock_error");

    private final List<Rule> rules;

    public FailureOriginClassifier(List<Rule> rules) {
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("At least one classification rule is required");
        }
        this.rules = List.copyOf(rules);
    }

    public static FailureOriginClassifier defaults() {
        return new FailureOriginClassifier(List.of(
                new Rule("expected-actual-pair", FailureOriginClassifier::hasExpectedActual, FailureOrigin.ARTIFACT_DEFECT),
                new Rule("artifact-keyword", f -> containsAny(f, ARTIFACT_INDICATORS), FailureOrigin.ARTIFACT_DEFECT),
                new Rule("verifier-keyword", f -> containsAny(f, VERIFIER_INDICATORS), FailureOrigin.VERIFIER_DEFECT),
                new Rule("fallback", f -> true, FailureOrigin.VERIFIER_DEFECT)
        ));
    }

    public FailureOrigin classify(FailureRecord failure) {
        return matchingRule(failure).origin();
    }

    /** The rule that decided, for logging and reasoning text. */
    public Rule matchingRule(FailureRecord failure) {
        for (Rule rule : rules) {
            if (rule.predicate().test(failure)) {
                return rule;
            }
        }
        throw new IllegalStateException("No classification rule matched failure " + failure.type());
    }

    private static boolean hasExpectedActual(FailureRecord failure) {
        if (failure.hasExpectedActualPair()) {
            return true;
        }
        if (failure.details().containsKey("expected") && failure.details().containsKey("actual")) {
            return true;
        }
        String text = text(failure);
        return text.contains("expected") && text.contains("actual");
    }

    private static boolean containsAny(FailureRecord failure, List<String> indicators) {
        String text = text(failure);
        return indicators.stream().anyMatch(text::contains);
    }

    private static String text(FailureRecord failure) {
        return (failure.type() + " " + failure.message()).toLowerCase(Locale.ROOT);
    }
}
