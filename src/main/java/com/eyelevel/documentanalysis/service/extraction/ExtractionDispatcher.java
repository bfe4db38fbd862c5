package com.eyelevel.documentanalysis.service.extraction;

/**
 * Hands a run waiting in {@code PROCESSING_ASYNC/EXTRACTION} to whatever completes its fallback extraction.
 * Implementations return once the work is scheduled, never after it ran.
 */
public interface ExtractionDispatcher {

    void dispatch(String userId, String runId);
}
