package com.eyelevel.documentanalysis.scheduler;

import com.eyelevel.documentanalysis.exception.StatusConflictException;
import com.eyelevel.documentanalysis.model.AnalysisRun;
import com.eyelevel.documentanalysis.model.RunStatus;
import com.eyelevel.documentanalysis.store.RunMutations;
import com.eyelevel.documentanalysis.store.RunStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A scheduler that fails runs left in flight by work that will never finish, such as an in-process model call
 * lost to a restart.
 */
@Slf4j
@Component
public class StaleRunCleanupScheduler {

    static final Set<RunStatus> IN_FLIGHT = EnumSet.of(RunStatus.EXTRACTING, RunStatus.ANALYZING,
                                                        RunStatus.PROCESSING_ASYNC);

    private final RunStore runStore;
    private final Clock clock;
    private final long staleThresholdMinutes;

    public StaleRunCleanupScheduler(final RunStore runStore, final Clock clock,
                                    @Value("${app.scheduler.stale-run-minutes}") final long staleThresholdMinutes) {
        this.runStore = runStore;
        this.clock = clock;
        this.staleThresholdMinutes = staleThresholdMinutes;
    }

    /**
     * Marks runs as FAILED if they have not changed for longer than the threshold while in flight.
     * Each run is failed through a conditional update, so a run that finishes meanwhile keeps its result.
     */
    @Scheduled(cron = "${app.scheduler.stale-run}")
    public void markStaleRunsAsFailed() {
        sweep();
    }

    /**
     * @return The number of runs marked as failed.
     */
    int sweep() {
        final Instant now = clock.instant();
        final Instant threshold = now.minus(Duration.ofMinutes(staleThresholdMinutes));
        log.info("Running stale run cleanup. Finding runs in {} not updated since {}.", IN_FLIGHT, threshold);

        final List<AnalysisRun> staleRuns = runStore.findStaleRuns(IN_FLIGHT, threshold);
        if (CollectionUtils.isEmpty(staleRuns)) {
            log.info("No stale runs found.");
            return 0;
        }

        log.warn("Found {} stale runs to mark as FAILED.", staleRuns.size());
        int failed = 0;
        for (final AnalysisRun run : staleRuns) {
            try {
                runStore.updateRun(run.getUserId(), run.getRunId(), RunMutations.failed(
                        String.format("Processing did not finish within %d minutes.", staleThresholdMinutes), now),
                                   run.getStatus());
                failed++;
            } catch (StatusConflictException e) {
                log.info("Run {}/{} moved on while being cleaned up; leaving it as is.", run.getUserId(),
                         run.getRunId());
            }
        }
        log.info("Finished stale run cleanup. Marked {} runs as FAILED.", failed);
        return failed;
    }
}
