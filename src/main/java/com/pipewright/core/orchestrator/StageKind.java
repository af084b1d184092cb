package com.pipewright.core.orchestrator;

/**
 * What a stage does with respect to artifacts.
 */
public enum StageKind {
    /** Produces artifacts (e.g. implementation). */
    PRODUCTION,
    /** Checks another stage's artifacts (e.g. testing); its failures may be rerouted. */
    VERIFICATION,
    /** Scores artifacts against quality gates. */
    QUALITY_GATE
}
