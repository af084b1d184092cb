package com.pipewright.core.qualitygate;

import com.pipewright.core.model.QualityGateResult;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Gate-specific remediation: which executor owns a failing gate and what it is told to fix.
 * Gate scoring happens elsewhere; this only reads reported {@link QualityGateResult}s.
 */
public final class QualityGateRemediation {

    static final int MAX_VIOLATIONS = 5;
    static final int MAX_FIXES = 3;
    static final String DEFAULT_OWNER = "code-reviewer";

    private static final Map<String, String> GATE_OWNERS = gateOwners();

    private QualityGateRemediation() {}

    /**
     * Executor responsible for fixing the given gate, matched on the gate name.
     */
    public static String ownerFor(String gateName) {
        String name = gateName == null ? "" : gateName.toLowerCase(Locale.ROOT);
        for (var entry : GATE_OWNERS.entrySet()) {
            if (name.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return DEFAULT_OWNER;
    }

    /**
     * Markdown fix request for one failing gate: message, score, the first five violations and
     * the first three suggested fixes.
     */
    public static String fixText(QualityGateResult gate) {
        var sb = new StringBuilder();
        sb.append("### Quality gate `").append(gate.gateName()).append("` ")
          .append(gate.status()).append("\n\n");
        if (!gate.message().isBlank()) {
            sb.append(gate.message()).append("\n\n");
        }
        sb.append("- **Score:** ").append(String.format(Locale.ROOT, "%.1f", gate.score())).append("\n");
        sb.append("- **Owner:** ").append(ownerFor(gate.gateName())).append("\n");

        if (!gate.violations().isEmpty()) {
            sb.append("\n**Violations:**\n");
            gate.violations().stream().limit(MAX_VIOLATIONS)
                    .forEach(v -> sb.append("- ").append(v).append("\n"));
            int hidden = gate.violations().size() - MAX_VIOLATIONS;
            if (hidden > 0) {
                sb.append("- ... and ").append(hidden).append(" more\n");
            }
        }
        if (!gate.suggestedFixes().isEmpty()) {
            sb.append("\n**Suggested fixes:**\n");
            gate.suggestedFixes().stream().limit(MAX_FIXES)
                    .forEach(f -> sb.append("- ").append(f).append("\n"));
        }
        return sb.toString();
    }

    private static Map<String, String> gateOwners() {
        var owners = new LinkedHashMap<String, String>();
        owners.put("code_quality", "code-reviewer");
        owners.put("security", "security-auditor");
        owners.put("performance", "performance-engineer");
        owners.put("architecture", "backend-architect");
        owners.put("coverage", "test-engineer");
        return owners;
    }
}
