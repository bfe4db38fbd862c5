package com.eyelevel.documentanalysis.dto.run;

import com.eyelevel.documentanalysis.model.AnalysisRun;
import com.eyelevel.documentanalysis.model.AsyncStage;
import com.eyelevel.documentanalysis.model.ExtractionMethod;
import com.eyelevel.documentanalysis.model.ModelVariant;
import com.eyelevel.documentanalysis.model.RunStatus;

/**
 * The state of a single run as reported to clients.
 *
 * @param stage    What a {@code PROCESSING_ASYNC} run is waiting on; null otherwise.
 * @param analysis The analysis result once the run is {@code COMPLETED}.
 */
public record RunStatusView(String runId, RunStatus status, AsyncStage stage, ModelVariant modelVariant,
                            String analysis, boolean analysisTruncated, String errorMessage,
                            Integer extractedTextLength, boolean extractedTextTruncated,
                            String extractedTextReference, ExtractionMethod extractionMethod) {

    public static RunStatusView of(final AnalysisRun run) {
        return new RunStatusView(run.getRunId(), run.getStatus(), run.getAsyncStage(), run.getModelVariant(),
                                 run.getAnalysisResult(), run.isAnalysisResultTruncated(), run.getErrorMessage(),
                                 run.getExtractedTextLength(), run.isExtractedTextTruncated(),
                                 run.getExtractedTextReference(), run.getExtractionMethod());
    }
}
