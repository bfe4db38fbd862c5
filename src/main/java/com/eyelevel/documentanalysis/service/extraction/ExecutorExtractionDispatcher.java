package com.eyelevel.documentanalysis.service.extraction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs fallback extraction on the in-process task executor. Work still pending when the process stops is lost
 * and later failed by the stale run sweeper.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.dispatch.mode", havingValue = "executor")
public class ExecutorExtractionDispatcher implements ExtractionDispatcher {

    private final AsyncTaskExecutor taskExecutor;
    private final FallbackExtractionService fallbackExtractionService;

    public ExecutorExtractionDispatcher(@Qualifier("applicationTaskExecutor") final AsyncTaskExecutor taskExecutor,
                                        final FallbackExtractionService fallbackExtractionService) {
        this.taskExecutor = taskExecutor;
        this.fallbackExtractionService = fallbackExtractionService;
    }

    @Override
    public void dispatch(final String userId, final String runId) {
        taskExecutor.execute(() -> {
            try {
                fallbackExtractionService.completeFallback(userId, runId);
            } catch (Exception e) {
                log.error("Fallback extraction for run {}/{} ended with an unexpected error.", userId, runId, e);
            }
        });
        log.info("Run {}/{} scheduled for in-process fallback extraction.", userId, runId);
    }
}
