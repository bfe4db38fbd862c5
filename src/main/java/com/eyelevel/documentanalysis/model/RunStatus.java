package com.eyelevel.documentanalysis.model;

/**
 * Defines the lifecycle states of an {@link AnalysisRun}.
 * <p>
 * The allowed transitions between these states are enforced by
 * {@link com.eyelevel.documentanalysis.service.run.RunStateMachine}.
 */
public enum RunStatus {
    /**
     * The run has been registered against an uploaded document and is waiting for extraction.
     */
    UPLOADED,
    /**
     * A coordinator has claimed the run and the fast OCR path is running.
     */
    EXTRACTING,
    /**
     * Text has been extracted and persisted. The run is ready for analysis.
     */
    EXTRACTED,
    /**
     * The LLM analysis is running within the synchronous budget.
     */
    ANALYZING,
    /**
     * Work has been handed off out-of-band. See {@link AsyncStage} for which operation is pending.
     */
    PROCESSING_ASYNC,
    /**
     * The analysis result has been persisted. Terminal.
     */
    COMPLETED,
    /**
     * An unrecoverable error occurred. Terminal.
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
