package com.pipewright.core.scheduler;

import com.pipewright.core.model.WorkOrder;

/**
 * Converts a WorkOrder into the markdown instruction an executor reads.
 * Pure function, no Spring dependencies.
 */
public final class InstructionBuilder {

    private InstructionBuilder() {}

    public static String build(WorkOrder workOrder) {
        return build(workOrder, null);
    }

    public static String build(WorkOrder workOrder, String previousResult) {
        if (workOrder.executorId() == null || workOrder.executorId().isBlank()) {
            throw new InstructionProductionException("Work order " + workOrder.taskId() + " names no executor");
        }
        boolean hasDescription = workOrder.description() != null && !workOrder.description().isBlank();
        boolean hasSpec = workOrder.instructionText() != null && !workOrder.instructionText().isBlank();
        if (!hasDescription && !hasSpec) {
            throw new InstructionProductionException("Work order " + workOrder.taskId() + " has nothing to do");
        }

        var sb = new StringBuilder();
        sb.append("# Work Order: ").append(workOrder.taskId()).append("\n\n");

        if (hasDescription) {
            sb.append("## Objective\n\n");
            sb.append(workOrder.description()).append("\n\n");
        }

        if (hasSpec) {
            sb.append("## Task\n\n");
            sb.append(workOrder.instructionText()).append("\n\n");
        }

        if (previousResult != null && !previousResult.isBlank()) {
            sb.append("## Previous Result\n\n");
            sb.append("The preceding work order reported:\n\n");
            sb.append("```json\n").append(previousResult).append("\n```\n\n");
        }

        sb.append("## Constraints\n\n");
        sb.append("- Complete the work within ").append(workOrder.timeout().toSeconds()).append(" seconds\n");
        if (workOrder.critical()) {
            sb.append("- **CRITICAL**: failure of this work order fails the whole stage\n");
        }
        sb.append("- Only change what this work order describes\n");
        sb.append("- Report a structured result when finished, including any failures you could not resolve\n");

        return sb.toString();
    }
}
