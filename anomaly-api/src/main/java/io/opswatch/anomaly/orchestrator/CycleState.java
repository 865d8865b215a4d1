package io.opswatch.anomaly.orchestrator;

/**
 * Phases of a detection cycle. A cycle always returns to {@link #IDLE}.
 */
public enum CycleState {
    IDLE,
    COLLECTING,
    DETECTING,
    REPORTING
}
