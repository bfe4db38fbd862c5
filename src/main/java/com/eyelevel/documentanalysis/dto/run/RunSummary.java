package com.eyelevel.documentanalysis.dto.run;

import com.eyelevel.documentanalysis.model.AnalysisRun;
import com.eyelevel.documentanalysis.model.ModelVariant;
import com.eyelevel.documentanalysis.model.RunStatus;

import java.time.Instant;

/**
 * One entry of a user's run history.
 *
 * @param processedAt When the run was created.
 */
public record RunSummary(String runId, RunStatus status, ModelVariant modelVariant, String fileName,
                         Integer extractedTextLength, Instant processedAt, Instant completedAt, String errorMessage,
                         String analysis) {

    public static RunSummary of(final AnalysisRun run) {
        return new RunSummary(run.getRunId(), run.getStatus(), run.getModelVariant(), run.getSourceFileName(),
                              run.getExtractedTextLength(), run.getCreatedAt(), run.getCompletedAt(),
                              run.getErrorMessage(), run.getAnalysisResult());
    }
}
