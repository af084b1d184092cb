package com.pipewright.core.model;

/**
 * Lifecycle status of a {@link WorkOrder}.
 * <p>
 * Transitions only move forward: PENDING → DISPATCHED → {COMPLETED, FAILED}.
 * PENDING may also go straight to FAILED or CANCELLED, and DISPATCHED may be
 * CANCELLED. Terminal states never change.
 */
public enum WorkOrderStatus {
    PENDING,
    DISPATCHED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(WorkOrderStatus next) {
        if (next == null || next == this) return false;
        return switch (this) {
            case PENDING -> true;
            case DISPATCHED -> next == COMPLETED || next == FAILED || next == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
