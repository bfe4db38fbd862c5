package com.eyelevel.documentanalysis.model;

/**
 * Identifies the operation a {@link RunStatus#PROCESSING_ASYNC} run is waiting on.
 */
public enum AsyncStage {
    EXTRACTION,
    ANALYSIS
}
