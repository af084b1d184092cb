package com.pipewright.core.scheduler;

/**
 * Thrown when instruction text cannot be produced for a work order. The failure is recorded on
 * that work order only.
 */
public class InstructionProductionException extends RuntimeException {

    public InstructionProductionException(String message) {
        super(message);
    }

    public InstructionProductionException(String message, Throwable cause) {
        super(message, cause);
    }
}
