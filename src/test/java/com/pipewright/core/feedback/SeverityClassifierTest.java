package com.pipewright.core.feedback;

import com.pipewright.core.model.FailureRecord;
import com.pipewright.core.model.FeedbackContext;
import com.pipewright.core.model.FeedbackSeverity;
import com.pipewright.core.model.ValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SeverityClassifierTest {

    private final SeverityClassifier classifier = SeverityClassifier.defaults();

    @Test
    @DisplayName("security findings are critical")
    void critical() {
        assertEquals(FeedbackSeverity.CRITICAL, classifier.classify("Security scan found an injection"));
    }

    @Test
    @DisplayName("crashes and errors are high")
    void high() {
        assertEquals(FeedbackSeverity.HIGH, classifier.classify("NullPointerException in parser"));
        assertEquals(FeedbackSeverity.HIGH, classifier.classify("request timeout"));
    }

    @Test
    @DisplayName("warnings and slowness are medium")
    void medium() {
        assertEquals(FeedbackSeverity.MEDIUM, classifier.classify("uses a deprecated API"));
    }

    @Test
    @DisplayName("nothing matching is low")
    void low() {
        assertEquals(FeedbackSeverity.LOW, classifier.classify("naming nit"));
        assertEquals(FeedbackSeverity.LOW, classifier.classify((String) null));
    }

    @Test
    @DisplayName("the most severe rule wins when several match")
    void firstRuleWins() {
        assertEquals(FeedbackSeverity.CRITICAL, classifier.classify("timeout while scanning for vulnerability"));
    }

    @Test
    @DisplayName("failure records of the last validation are classified along with the reason")
    void usesFailureRecords() {
        var context = FeedbackContext.open("L1", "R", "testing", "tester", "t-1", "run", 3,
                        Instant.parse("2026-03-01T10:00:00Z"))
                .withFailure(ValidationResult.failed(FailureRecord.of("data_loss", "rows dropped")),
                        "check failed", Instant.parse("2026-03-01T10:01:00Z"));

        assertEquals(FeedbackSeverity.CRITICAL, classifier.classify(context));
    }
}
