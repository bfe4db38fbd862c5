package com.eyelevel.documentanalysis.service.extraction;

import com.eyelevel.documentanalysis.config.DocumentAnalysisConfig;
import com.eyelevel.documentanalysis.exception.StatusConflictException;
import com.eyelevel.documentanalysis.model.AnalysisRun;
import com.eyelevel.documentanalysis.model.AsyncStage;
import com.eyelevel.documentanalysis.model.ExtractionMethod;
import com.eyelevel.documentanalysis.model.RunStatus;
import com.eyelevel.documentanalysis.service.ocr.TextractOcrService;
import com.eyelevel.documentanalysis.service.run.RunRegistrationService;
import com.eyelevel.documentanalysis.store.CappedText;
import com.eyelevel.documentanalysis.store.RunMutations;
import com.eyelevel.documentanalysis.store.RunStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Drives a run from {@code UPLOADED} to {@code EXTRACTED}.
 * <p>
 * The fast OCR path answers synchronously. When it cannot, the run is parked in
 * {@code PROCESSING_ASYNC/EXTRACTION} and handed to the {@link ExtractionDispatcher}; the
 * {@link FallbackExtractionService} finishes it. Only the trigger that wins the {@code UPLOADED -> EXTRACTING}
 * claim does any work, so concurrent triggers for one run start at most one extraction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExtractionCoordinator {

    private final RunStore runStore;
    private final RunRegistrationService runRegistrationService;
    private final TextractOcrService textractOcrService;
    private final ExtractedTextArchiver extractedTextArchiver;
    private final ExtractionDispatcher extractionDispatcher;
    private final DocumentAnalysisConfig analysisConfig;
    private final Clock clock;

    /**
     * Starts extraction for an uploaded document, registering the run first when needed.
     *
     * @param runId May be null, in which case a new run is created.
     * @return The run after this trigger: {@code EXTRACTED}, {@code PROCESSING_ASYNC}, {@code FAILED}, or whatever
     * state another trigger already moved it to.
     */
    public AnalysisRun startExtraction(final String userId, final String runId, final String sourceFileReference) {
        final AnalysisRun run = runRegistrationService.findOrRegister(userId, runId, sourceFileReference);
        return extract(userId, run.getRunId());
    }

    /**
     * Extracts the text of a registered run.
     */
    public AnalysisRun extract(final String userId, final String runId) {
        final AnalysisRun current = runStore.getRun(userId, runId);
        if (current.getStatus() != RunStatus.UPLOADED) {
            log.info("Run {}/{} is already {}. Extraction not started.", userId, runId, current.getStatus());
            return current;
        }

        final AnalysisRun claimed;
        try {
            claimed = runStore.updateRun(userId, runId, RunMutations.claimExtraction(), RunStatus.UPLOADED);
        } catch (StatusConflictException e) {
            log.info("Run {}/{}: another trigger claimed the extraction first.", userId, runId);
            return runStore.getRun(userId, runId);
        }
        log.info("Run {}/{}: extraction claimed for '{}'.", userId, runId, claimed.getSourceFileReference());

        final ExtractionOutcome outcome;
        try {
            outcome = textractOcrService.detectText(claimed.getSourceFileReference());
        } catch (RuntimeException e) {
            log.error("Run {}/{}: OCR attempt ended with an unexpected error.", userId, runId, e);
            return failInFlight(userId, runId, "Text extraction failed: " + e.getMessage());
        }
        try {
            if (outcome instanceof ExtractionOutcome.Immediate immediate) {
                return completeImmediately(userId, runId, immediate.text());
            }
            if (outcome instanceof ExtractionOutcome.Deferred deferred) {
                return deferToFallback(userId, runId, deferred.reason());
            }
            final ExtractionOutcome.Failed failed = (ExtractionOutcome.Failed) outcome;
            log.error("Run {}/{}: extraction failed: {}", userId, runId, failed.reason());
            return runStore.updateRun(userId, runId, RunMutations.failed(failed.reason(), clock.instant()),
                                      RunStatus.EXTRACTING);
        } catch (StatusConflictException e) {
            log.warn("Run {}/{}: extraction result discarded, the run changed meanwhile: {}", userId, runId,
                     e.getMessage());
            return runStore.getRun(userId, runId);
        } catch (RuntimeException e) {
            log.error("Run {}/{}: storing the extraction result failed.", userId, runId, e);
            return failInFlight(userId, runId, "Text extraction failed: " + e.getMessage());
        }
    }

    /**
     * Fails a run this trigger claimed, from whatever in-flight status it reached.
     */
    private AnalysisRun failInFlight(final String userId, final String runId, final String errorMessage) {
        try {
            final AnalysisRun current = runStore.getRun(userId, runId);
            if (current.getStatus().isTerminal()) {
                return current;
            }
            return runStore.updateRun(userId, runId, RunMutations.failed(errorMessage, clock.instant()),
                                      current.getStatus());
        } catch (StatusConflictException e) {
            log.warn("Run {}/{}: could not record the failure, the run changed meanwhile: {}", userId, runId,
                     e.getMessage());
            return runStore.getRun(userId, runId);
        }
    }

    private AnalysisRun completeImmediately(final String userId, final String runId, final String text) {
        final CappedText capped = CappedText.of(text, analysisConfig.getInputCap());
        final String textReference = extractedTextArchiver.archive(userId, runId, capped.value());
        final AnalysisRun extracted = runStore.updateRun(userId, runId, RunMutations.extracted(
                capped, textReference, ExtractionMethod.TEXTRACT, clock.instant()), RunStatus.EXTRACTING);
        log.info("Run {}/{}: OCR extracted {} characters (truncated: {}).", userId, runId,
                 extracted.getExtractedTextLength(), capped.truncated());
        return extracted;
    }

    private AnalysisRun deferToFallback(final String userId, final String runId, final String reason) {
        final AnalysisRun deferred = runStore.updateRun(userId, runId, RunMutations.deferTo(AsyncStage.EXTRACTION),
                                                        RunStatus.EXTRACTING);
        log.info("Run {}/{}: {}. Switching to fallback extraction.", userId, runId, reason);
        try {
            extractionDispatcher.dispatch(userId, runId);
        } catch (RuntimeException e) {
            log.error("Run {}/{}: fallback extraction could not be scheduled.", userId, runId, e);
            return runStore.updateRun(userId, runId, RunMutations.failed(
                    "Fallback extraction could not be scheduled: " + e.getMessage(), clock.instant()),
                                      RunStatus.PROCESSING_ASYNC);
        }
        return deferred;
    }
}
