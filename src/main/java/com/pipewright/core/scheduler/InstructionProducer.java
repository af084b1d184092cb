package com.pipewright.core.scheduler;

import com.pipewright.core.model.WorkOrder;

/**
 * Produces the instruction text an executor receives for one work order.
 */
@FunctionalInterface
public interface InstructionProducer {

    /**
     * @param workOrder      the work order being dispatched
     * @param previousResult JSON of the preceding work order's result in sequential dispatch,
     *                       null otherwise
     * @return the instruction text; must not be blank
     */
    String produce(WorkOrder workOrder, String previousResult);
}
