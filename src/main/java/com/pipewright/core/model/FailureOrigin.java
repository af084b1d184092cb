package com.pipewright.core.model;

/**
 * Which side of a producer/verifier pair a verification failure is blamed on.
 */
public enum FailureOrigin {
    /** The produced artifact is wrong; the producing stage must fix it. */
    ARTIFACT_DEFECT,
    /** The verifier itself (its tests, setup or tooling) is wrong. */
    VERIFIER_DEFECT
}
