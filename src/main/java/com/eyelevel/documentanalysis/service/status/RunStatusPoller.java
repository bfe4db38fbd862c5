package com.eyelevel.documentanalysis.service.status;

import com.eyelevel.documentanalysis.config.DocumentAnalysisConfig;
import com.eyelevel.documentanalysis.dto.run.RunStatusView;
import com.eyelevel.documentanalysis.exception.PollingTimeoutException;
import com.eyelevel.documentanalysis.model.RunStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Waits for a run to reach a terminal state by polling its status at a fixed interval.
 * <p>
 * This is the polling protocol clients follow, available to in-process callers. Giving up does not affect
 * the run, which keeps progressing.
 */
@Slf4j
@Component
public class RunStatusPoller {

    private final RunStatusService runStatusService;
    private final Duration interval;
    private final Duration maxWait;

    @Autowired
    public RunStatusPoller(final RunStatusService runStatusService, final DocumentAnalysisConfig analysisConfig) {
        this(runStatusService, Duration.ofSeconds(analysisConfig.getPolling().getIntervalSeconds()),
             Duration.ofSeconds(analysisConfig.getPolling().getMaxWaitSeconds()));
    }

    RunStatusPoller(final RunStatusService runStatusService, final Duration interval, final Duration maxWait) {
        this.runStatusService = runStatusService;
        this.interval = interval;
        this.maxWait = maxWait;
    }

    /**
     * Polls until the run is {@code COMPLETED} or {@code FAILED}.
     *
     * @return The terminal status view.
     * @throws PollingTimeoutException if the run is still in flight after the maximum wait.
     */
    public RunStatusView awaitTerminal(final String userId, final String runId) {
        final long deadline = System.nanoTime() + maxWait.toNanos();
        RunStatusView view = runStatusService.getStatus(userId, runId);
        while (!view.status().isTerminal()) {
            if (System.nanoTime() - deadline >= 0) {
                throw timeout(runId, view.status());
            }
            log.debug("Run {}/{} is {}. Polling again in {} ms.", userId, runId, view.status(), interval.toMillis());
            try {
                Thread.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw timeout(runId, view.status());
            }
            view = runStatusService.getStatus(userId, runId);
        }
        return view;
    }

    private PollingTimeoutException timeout(final String runId, final RunStatus lastStatus) {
        return new PollingTimeoutException(
                String.format("Run %s did not finish within %d s; last status was %s.", runId, maxWait.toSeconds(),
                              lastStatus), lastStatus);
    }
}
