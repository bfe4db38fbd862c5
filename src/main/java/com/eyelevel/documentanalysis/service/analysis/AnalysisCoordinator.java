package com.eyelevel.documentanalysis.service.analysis;

import com.eyelevel.documentanalysis.config.DocumentAnalysisConfig;
import com.eyelevel.documentanalysis.exception.AnalysisFailedException;
import com.eyelevel.documentanalysis.exception.ModelInvocationException;
import com.eyelevel.documentanalysis.exception.StatusConflictException;
import com.eyelevel.documentanalysis.model.AnalysisRun;
import com.eyelevel.documentanalysis.model.AsyncStage;
import com.eyelevel.documentanalysis.model.ModelVariant;
import com.eyelevel.documentanalysis.model.RunStatus;
import com.eyelevel.documentanalysis.service.llm.BedrockModelClient;
import com.eyelevel.documentanalysis.store.CappedText;
import com.eyelevel.documentanalysis.store.RunMutations;
import com.eyelevel.documentanalysis.store.RunStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives a run from {@code EXTRACTED} to {@code COMPLETED}.
 * <p>
 * The model is called exactly once per run, on the task executor. The trigger waits for it up to the synchronous
 * budget; past that the run moves to {@code PROCESSING_ASYNC/ANALYSIS} and the same call completes it when it
 * returns.
 * <p>
 * Unlike the extraction fallback, which goes through the queue, that background continuation lives only in this
 * process. A restart while a run is {@code PROCESSING_ASYNC/ANALYSIS} loses the call, and the run stays there until
 * {@link com.eyelevel.documentanalysis.scheduler.StaleRunCleanupScheduler} fails it.
 */
@Slf4j
@Service
public class AnalysisCoordinator {

    private final RunStore runStore;
    private final PromptTemplateRegistry promptTemplateRegistry;
    private final BedrockModelClient bedrockModelClient;
    private final AsyncTaskExecutor taskExecutor;
    private final DocumentAnalysisConfig analysisConfig;
    private final Clock clock;

    public AnalysisCoordinator(final RunStore runStore, final PromptTemplateRegistry promptTemplateRegistry,
                               final BedrockModelClient bedrockModelClient,
                               @Qualifier("applicationTaskExecutor") final AsyncTaskExecutor taskExecutor,
                               final DocumentAnalysisConfig analysisConfig, final Clock clock) {
        this.runStore = runStore;
        this.promptTemplateRegistry = promptTemplateRegistry;
        this.bedrockModelClient = bedrockModelClient;
        this.taskExecutor = taskExecutor;
        this.analysisConfig = analysisConfig;
        this.clock = clock;
    }

    /**
     * Analyzes the extracted text of a run with the prompt of the given variant.
     *
     * @param variantCode            "A" or "B".
     * @param extractedTextReference The text reference the client received from extraction. Optional; the stored
     *                               text is always the one analyzed.
     * @return The run after this trigger. Triggers for runs already being analyzed, or already finished, return the
     * stored run unchanged.
     * @throws com.eyelevel.documentanalysis.exception.InvalidModelException if the variant is not supported.
     * @throws StatusConflictException                                        if extraction has not completed.
     */
    public AnalysisRun analyze(final String userId, final String runId, final String variantCode,
                               final String extractedTextReference) {
        final ModelVariant variant = ModelVariant.fromCode(variantCode);

        final AnalysisRun current = runStore.getRun(userId, runId);
        if (isAnalysisStartedOrFinished(current)) {
            log.info("Run {}/{} is already {}. Analysis not started.", userId, runId, current.getStatus());
            return current;
        }
        if (current.getStatus() != RunStatus.EXTRACTED) {
            throw new StatusConflictException(
                    String.format("Run %s is %s: extraction has not completed.", runId, current.getStatus()),
                    current.getStatus());
        }
        if (extractedTextReference != null && !extractedTextReference.equals(current.getExtractedTextReference())) {
            log.warn("Run {}/{}: requested text reference '{}' differs from the stored '{}'. Using the stored text.",
                     userId, runId, extractedTextReference, current.getExtractedTextReference());
        }

        final String prompt = promptTemplateRegistry.buildPrompt(variant, current.getExtractedText());

        try {
            runStore.updateRun(userId, runId, RunMutations.claimAnalysis(variant), RunStatus.EXTRACTED);
        } catch (StatusConflictException e) {
            log.info("Run {}/{}: another trigger claimed the analysis first.", userId, runId);
            return runStore.getRun(userId, runId);
        }
        log.info("Run {}/{}: analysis claimed with model variant {} ({} characters of input).", userId, runId,
                 variant, prompt.length());

        final CompletableFuture<String> invocation;
        try {
            invocation = CompletableFuture.supplyAsync(() -> invokeModel(prompt), taskExecutor);
        } catch (RuntimeException e) {
            log.error("Run {}/{}: the model call could not be scheduled.", userId, runId, e);
            return record(userId, runId, null,
                          new AnalysisFailedException("Analysis could not be scheduled: " + e.getMessage(), e),
                          RunStatus.ANALYZING);
        }
        try {
            final String result = invocation.get(analysisConfig.getAnalysis().getSyncBudgetSeconds(),
                                                 TimeUnit.SECONDS);
            return record(userId, runId, result, null, RunStatus.ANALYZING);
        } catch (ExecutionException e) {
            return record(userId, runId, null, e.getCause(), RunStatus.ANALYZING);
        } catch (TimeoutException e) {
            return continueAsynchronously(userId, runId, invocation);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return continueAsynchronously(userId, runId, invocation);
        }
    }

    private static boolean isAnalysisStartedOrFinished(final AnalysisRun run) {
        return switch (run.getStatus()) {
            case ANALYZING, COMPLETED, FAILED -> true;
            case PROCESSING_ASYNC -> run.getAsyncStage() == AsyncStage.ANALYSIS;
            default -> false;
        };
    }

    private AnalysisRun continueAsynchronously(final String userId, final String runId,
                                               final CompletableFuture<String> invocation) {
        final AnalysisRun deferred;
        try {
            deferred = runStore.updateRun(userId, runId, RunMutations.deferTo(AsyncStage.ANALYSIS),
                                          RunStatus.ANALYZING);
        } catch (StatusConflictException e) {
            log.warn("Run {}/{}: could not hand the analysis off, the run changed meanwhile: {}", userId, runId,
                     e.getMessage());
            return runStore.getRun(userId, runId);
        }
        log.info("Run {}/{}: analysis exceeded the {} s budget and continues in the background.", userId, runId,
                 analysisConfig.getAnalysis().getSyncBudgetSeconds());

        invocation.whenComplete((result, error) -> {
            try {
                record(userId, runId, result, error, RunStatus.PROCESSING_ASYNC);
            } catch (RuntimeException e) {
                log.error("Run {}/{}: could not record the background analysis outcome.", userId, runId, e);
            }
        });
        return deferred;
    }

    /**
     * Stores the outcome of the single model call: the capped result on success, the error otherwise.
     */
    private AnalysisRun record(final String userId, final String runId, final String result, final Throwable error,
                               final RunStatus expectedStatus) {
        try {
            if (error != null) {
                final Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause()
                        : error;
                log.error("Run {}/{}: analysis failed: {}", userId, runId, cause.getMessage());
                return runStore.updateRun(userId, runId, RunMutations.failed(cause.getMessage(), clock.instant()),
                                          expectedStatus);
            }
            final CappedText capped = CappedText.of(result, analysisConfig.getOutputCap());
            final AnalysisRun completed = runStore.updateRun(userId, runId,
                                                             RunMutations.completed(capped, clock.instant()),
                                                             expectedStatus);
            log.info("Run {}/{}: analysis completed with {} characters (truncated: {}).", userId, runId,
                     capped.value().length(), capped.truncated());
            return completed;
        } catch (StatusConflictException e) {
            log.warn("Run {}/{}: analysis outcome discarded, the run changed meanwhile: {}", userId, runId,
                     e.getMessage());
            return runStore.getRun(userId, runId);
        }
    }

    private String invokeModel(final String prompt) {
        final DocumentAnalysisConfig.Analysis analysis = analysisConfig.getAnalysis();
        try {
            return bedrockModelClient.complete(prompt, analysis.getMaxTokens(), analysis.getTemperature());
        } catch (ModelInvocationException e) {
            throw new AnalysisFailedException("Analysis failed: " + e.getMessage(), e);
        }
    }
}
