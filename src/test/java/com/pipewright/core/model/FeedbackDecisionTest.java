package com.pipewright.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FeedbackDecisionTest {

    @Test
    @DisplayName("decisions form a closed hierarchy with remediations nested under it")
    void closedHierarchy() {
        assertTrue(FeedbackDecision.class.isSealed());
        assertEquals(Set.of(FeedbackDecision.Remediation.class, FeedbackDecision.Abort.class,
                        FeedbackDecision.Continue.class, FeedbackDecision.Rollback.class),
                Set.of(FeedbackDecision.class.getPermittedSubclasses()));
        assertEquals(Set.of(FeedbackDecision.Retry.class, FeedbackDecision.Escalate.class),
                Set.of(FeedbackDecision.Remediation.class.getPermittedSubclasses()));
    }

    @Test
    @DisplayName("retries and escalations are remediations, rollbacks are not")
    void remediationKinds() {
        assertTrue(FeedbackDecision.Remediation.class.isAssignableFrom(FeedbackDecision.Retry.class));
        assertTrue(FeedbackDecision.Remediation.class.isAssignableFrom(FeedbackDecision.Escalate.class));
        assertFalse(FeedbackDecision.Remediation.class.isAssignableFrom(FeedbackDecision.Rollback.class));
    }
}
