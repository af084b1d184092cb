package com.pipewright.core.orchestrator;

import com.pipewright.core.model.DispatchMode;
import com.pipewright.core.model.WorkOrder;

import java.util.List;

/**
 * One stage of a pipeline.
 *
 * @param name          stage name; also selects the stage's feedback policy
 * @param kind          production, verification or quality gate
 * @param mode          how the stage's work orders are dispatched
 * @param workOrders    the stage's work orders
 * @param dependsOn     stages that must be COMPLETED before this one starts
 * @param producerStage for verification stages, the stage whose artifacts are verified (nullable)
 */
public record StageDefinition(
    String name,
    StageKind kind,
    DispatchMode mode,
    List<WorkOrder> workOrders,
    List<String> dependsOn,
    String producerStage
) {

    public StageDefinition {
        mode = mode == null ? DispatchMode.PARALLEL : mode;
        workOrders = workOrders == null ? List.of() : List.copyOf(workOrders);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public static StageDefinition production(String name, DispatchMode mode, List<WorkOrder> workOrders,
                                             String... dependsOn) {
        return new StageDefinition(name, StageKind.PRODUCTION, mode, workOrders, List.of(dependsOn), null);
    }

    /** A verification stage that depends on, and verifies, {@code producerStage}. */
    public static StageDefinition verification(String name, DispatchMode mode, List<WorkOrder> workOrders,
                                               String producerStage) {
        return new StageDefinition(name, StageKind.VERIFICATION, mode, workOrders, List.of(producerStage),
                producerStage);
    }

    public static StageDefinition qualityGate(String name, List<WorkOrder> workOrders, String... dependsOn) {
        return new StageDefinition(name, StageKind.QUALITY_GATE, DispatchMode.PARALLEL, workOrders,
                List.of(dependsOn), null);
    }
}
