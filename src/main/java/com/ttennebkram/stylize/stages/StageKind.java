package com.ttennebkram.stylize.stages;

/**
 * Capability a stage provides in the pipeline sequence.
 */
public enum StageKind {
    ANALYZE,
    GENERATE,
    SIMULATE,
    EFFECT,
    COMPOSE,
    RECONCILE,
    REFINE
}
