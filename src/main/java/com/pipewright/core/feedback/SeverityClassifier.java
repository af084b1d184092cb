package com.pipewright.core.feedback;

import com.pipewright.core.model.FeedbackContext;
import com.pipewright.core.model.FeedbackSeverity;
import com.pipewright.core.model.FailureRecord;

import java.util.List;
import java.util.Locale;

/**
 * Ordered keyword rule table mapping a failure to a {@link FeedbackSeverity}.
 * The first rule with a matching keyword wins; nothing matching is LOW.
 */
public final class SeverityClassifier {

    public record Rule(FeedbackSeverity severity, List<String> keywords) {
        public Rule {
            keywords = List.copyOf(keywords);
        }

        boolean matches(String text) {
            return keywords.stream().anyMatch(text::contains);
        }
    }

    private final List<Rule> rules;

    public SeverityClassifier(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static SeverityClassifier defaults() {
        return new SeverityClassifier(List.of(
                new Rule(FeedbackSeverity.CRITICAL, List.of("security", "vulnerability", "data_loss", "corruption")),
                new Rule(FeedbackSeverity.HIGH, List.of("crash", "exception", "error", "failure", "timeout")),
                new Rule(FeedbackSeverity.MEDIUM, List.of("warning", "deprecated", "slow", "performance"))
        ));
    }

    public FeedbackSeverity classify(FeedbackContext context) {
        var text = new StringBuilder(context.failureReason());
        if (context.validationResult() != null) {
            for (FailureRecord failure : context.validationResult().failures()) {
                text.append(' ').append(failure.type()).append(' ').append(failure.message());
            }
        }
        return classify(text.toString());
    }

    public FeedbackSeverity classify(String failureText) {
        String text = failureText == null ? "" : failureText.toLowerCase(Locale.ROOT);
        for (Rule rule : rules) {
            if (rule.matches(text)) {
                return rule.severity();
            }
        }
        return FeedbackSeverity.LOW;
    }
}
