package com.pipewright.core.scheduler;

import com.pipewright.core.model.DispatchMode;
import com.pipewright.core.model.WorkOrder;
import com.pipewright.core.model.WorkOrderStatus;

import java.time.Instant;
import java.util.List;

/**
 * Renders the instruction batch handed to whoever invokes the executors.
 * Only work orders whose instruction was produced appear, in the order given.
 */
public final class InstructionBatchWriter {

    private InstructionBatchWriter() {}

    public static String render(String runId, DispatchMode mode, List<WorkOrder> workOrders,
                                int successCount, int failureCount, Instant generatedAt) {
        var sb = new StringBuilder();

        sb.append("# Instruction Batch: ").append(runId).append("\n\n");
        sb.append("- **Mode:** ").append(mode).append("\n");
        sb.append("- **Total work orders:** ").append(workOrders.size()).append("\n");
        sb.append("- **Successful:** ").append(successCount).append("\n");
        sb.append("- **Failed:** ").append(failureCount).append("\n");
        sb.append("- **Generated:** ").append(generatedAt).append("\n\n");

        sb.append("## Execution Guidance\n\n");
        if (mode == DispatchMode.PARALLEL) {
            sb.append("- Invoke every entry below concurrently; they do not depend on each other\n");
            sb.append("- Collect all results before reporting validation\n\n");
        } else {
            sb.append("- Invoke the entries one at a time, in the order shown\n");
            sb.append("- Hand each result to the next entry before invoking it\n");
            sb.append("- Stop at the first failure and report it\n\n");
        }

        sb.append("## Invocations\n\n");
        int position = 0;
        for (WorkOrder workOrder : workOrders) {
            if (workOrder.status() != WorkOrderStatus.COMPLETED || workOrder.producedInstruction() == null) {
                continue;
            }
            position++;
            sb.append(invokeEntry(position, workOrder.taskId(), workOrder.executorId(),
                    workOrder.producedInstruction()));
        }
        if (position == 0) {
            sb.append("_No instructions were produced._\n");
        }
        return sb.toString();
    }

    /**
     * One invocation entry naming the executor and carrying the opaque task specification.
     */
    public static String invokeEntry(int position, String taskId, String executorId, String taskSpec) {
        var sb = new StringBuilder();
        sb.append("### ").append(position).append(". ").append(taskId).append("\n\n");
        sb.append("invoke executor=\"").append(executorId).append("\" task=\"").append(taskId).append("\"\n\n");
        sb.append("```text\n").append(taskSpec.strip()).append("\n```\n\n");
        return sb.toString();
    }
}
