package com.eyelevel.documentanalysis.service.extraction;

import com.eyelevel.documentanalysis.config.DocumentAnalysisConfig;
import com.eyelevel.documentanalysis.exception.ExtractionFailedException;
import com.eyelevel.documentanalysis.exception.StatusConflictException;
import com.eyelevel.documentanalysis.model.AnalysisRun;
import com.eyelevel.documentanalysis.model.AsyncStage;
import com.eyelevel.documentanalysis.model.ExtractionMethod;
import com.eyelevel.documentanalysis.model.RunStatus;
import com.eyelevel.documentanalysis.service.s3.S3StorageService;
import com.eyelevel.documentanalysis.store.CappedText;
import com.eyelevel.documentanalysis.store.RunMutations;
import com.eyelevel.documentanalysis.store.RunStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;

import java.time.Clock;

/**
 * Completes extractions that the fast path deferred, out of band of the request that started them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FallbackExtractionService {

    private final RunStore runStore;
    private final S3StorageService s3StorageService;
    private final VisionExtractionService visionExtractionService;
    private final ExtractedTextArchiver extractedTextArchiver;
    private final DocumentAnalysisConfig analysisConfig;
    private final Clock clock;

    /**
     * Runs the vision-model extraction for a run waiting on it and records the outcome.
     * Runs in any other state are left untouched, which makes redelivered work harmless.
     *
     * @return The run as stored after this call.
     */
    public AnalysisRun completeFallback(final String userId, final String runId) {
        final AnalysisRun run = runStore.getRun(userId, runId);
        if (run.getStatus() != RunStatus.PROCESSING_ASYNC || run.getAsyncStage() != AsyncStage.EXTRACTION) {
            log.info("Run {}/{} is {} and not waiting on fallback extraction. Skipping.", userId, runId,
                     run.getStatus());
            return run;
        }

        final String contextInfo = "Run " + userId + "/" + runId;
        try {
            final byte[] document = s3StorageService.downloadBytes(run.getSourceFileReference());
            final String text = visionExtractionService.extractText(document, run.getSourceFileName(), contextInfo);

            final CappedText capped = CappedText.of(text, analysisConfig.getInputCap());
            final String textReference = extractedTextArchiver.archive(userId, runId, capped.value());
            final AnalysisRun extracted = runStore.updateRun(userId, runId, RunMutations.extracted(
                    capped, textReference, ExtractionMethod.BEDROCK_VISION, clock.instant()), RunStatus.PROCESSING_ASYNC);
            log.info("{}: fallback extraction stored {} characters (truncated: {}).", contextInfo,
                     extracted.getExtractedTextLength(), capped.truncated());
            return extracted;
        } catch (ExtractionFailedException | SdkException e) {
            return fail(userId, runId, e.getMessage());
        } catch (StatusConflictException e) {
            log.warn("{}: fallback result discarded, the run changed meanwhile: {}", contextInfo, e.getMessage());
            return runStore.getRun(userId, runId);
        }
    }

    private AnalysisRun fail(final String userId, final String runId, final String errorMessage) {
        log.error("Run {}/{}: fallback extraction failed: {}", userId, runId, errorMessage);
        try {
            return runStore.updateRun(userId, runId, RunMutations.failed(errorMessage, clock.instant()),
                                      RunStatus.PROCESSING_ASYNC);
        } catch (StatusConflictException e) {
            log.warn("Run {}/{}: could not record the failure, the run changed meanwhile: {}", userId, runId,
                     e.getMessage());
            return runStore.getRun(userId, runId);
        }
    }
}
