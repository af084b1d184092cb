package com.pipewright.core.qualitygate;

import com.pipewright.core.model.GateStatus;
import com.pipewright.core.model.QualityGateResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QualityGateRemediationTest {

    @Test
    @DisplayName("owners are matched on the gate name")
    void owners() {
        assertEquals("security-auditor", QualityGateRemediation.ownerFor("security"));
        assertEquals("test-engineer", QualityGateRemediation.ownerFor("Line_Coverage"));
        assertEquals("performance-engineer", QualityGateRemediation.ownerFor("performance-budget"));
        assertEquals("backend-architect", QualityGateRemediation.ownerFor("architecture"));
        assertEquals("code-reviewer", QualityGateRemediation.ownerFor("code_quality"));
        assertEquals("code-reviewer", QualityGateRemediation.ownerFor("licensing"));
        assertEquals("code-reviewer", QualityGateRemediation.ownerFor(null));
    }

    @Test
    @DisplayName("fix text lists the first five violations and three fixes")
    void truncates() {
        var gate = new QualityGateResult("coverage", GateStatus.FAILED, 61.25, "Coverage below 80%",
                List.of("a.py", "b.py", "c.py", "d.py", "e.py", "f.py"),
                List.of("test a", "test b", "test c", "test d"));

        String text = QualityGateRemediation.fixText(gate);

        assertTrue(text.startsWith("### Quality gate `coverage` FAILED"));
        assertTrue(text.contains("Coverage below 80%"));
        assertTrue(text.contains("- **Score:** 61.3"));
        assertTrue(text.contains("- **Owner:** test-engineer"));
        assertTrue(text.contains("- e.py"));
        assertFalse(text.contains("- f.py"));
        assertTrue(text.contains("- ... and 1 more"));
        assertTrue(text.contains("- test c"));
        assertFalse(text.contains("- test d"));
    }

    @Test
    @DisplayName("empty lists produce no violation or fix sections")
    void emptyLists() {
        var gate = new QualityGateResult("architecture", GateStatus.BLOCKED, 0.0, null, null, null);

        String text = QualityGateRemediation.fixText(gate);

        assertFalse(text.contains("**Violations:**"));
        assertFalse(text.contains("**Suggested fixes:**"));
        assertTrue(gate.failing());
    }
}
