package com.eyelevel.documentanalysis.store;

import com.eyelevel.documentanalysis.model.AsyncStage;
import com.eyelevel.documentanalysis.model.ExtractionMethod;
import com.eyelevel.documentanalysis.model.ModelVariant;
import com.eyelevel.documentanalysis.model.RunStatus;

import java.time.Instant;

/**
 * The mutations the coordinators apply to runs. Text handed to these factories must already be capped.
 */
public final class RunMutations {

    /**
     * Error messages are stored in full up to this length.
     */
    public static final int MAX_ERROR_MESSAGE_LENGTH = 500;

    private RunMutations() {
    }

    public static RunMutation claimExtraction() {
        return run -> run.setStatus(RunStatus.EXTRACTING);
    }

    public static RunMutation deferTo(final AsyncStage stage) {
        return run -> {
            run.setStatus(RunStatus.PROCESSING_ASYNC);
            run.setAsyncStage(stage);
        };
    }

    public static RunMutation extracted(final CappedText text, final String textReference,
                                        final ExtractionMethod method, final Instant at) {
        return run -> {
            run.setStatus(RunStatus.EXTRACTED);
            run.setExtractedText(text.value());
            run.setExtractedTextLength(text.value().length());
            run.setExtractedTextTruncated(text.truncated());
            run.setExtractedTextReference(textReference);
            run.setExtractionMethod(method);
            run.setExtractedAt(at);
        };
    }

    public static RunMutation claimAnalysis(final ModelVariant variant) {
        return run -> {
            run.setStatus(RunStatus.ANALYZING);
            run.setModelVariant(variant);
        };
    }

    public static RunMutation completed(final CappedText result, final Instant at) {
        return run -> {
            run.setStatus(RunStatus.COMPLETED);
            run.setAnalysisResult(result.value());
            run.setAnalysisResultTruncated(result.truncated());
            run.setCompletedAt(at);
        };
    }

    public static RunMutation failed(final String errorMessage, final Instant at) {
        return run -> {
            run.setStatus(RunStatus.FAILED);
            run.setErrorMessage(boundErrorMessage(errorMessage));
            run.setCompletedAt(at);
        };
    }

    static String boundErrorMessage(final String errorMessage) {
        final String message = errorMessage == null || errorMessage.isBlank() ? "Unknown error" : errorMessage;
        return message.length() > MAX_ERROR_MESSAGE_LENGTH ? message.substring(0, MAX_ERROR_MESSAGE_LENGTH) : message;
    }
}
