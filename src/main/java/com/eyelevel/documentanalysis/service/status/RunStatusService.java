package com.eyelevel.documentanalysis.service.status;

import com.eyelevel.documentanalysis.config.DocumentAnalysisConfig;
import com.eyelevel.documentanalysis.dto.run.RunStatusView;
import com.eyelevel.documentanalysis.dto.run.RunSummary;
import com.eyelevel.documentanalysis.store.RunStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side of runs: single-run status and per-user history.
 */
@Service
@RequiredArgsConstructor
public class RunStatusService {

    private final RunStore runStore;
    private final DocumentAnalysisConfig analysisConfig;

    /**
     * @throws com.eyelevel.documentanalysis.exception.RunNotFoundException if the run does not exist.
     */
    public RunStatusView getStatus(final String userId, final String runId) {
        return RunStatusView.of(runStore.getRun(userId, runId));
    }

    /**
     * Lists a user's runs newest first. A missing limit uses the default, and limits are clamped to
     * {@code [1, maxLimit]}.
     */
    public List<RunSummary> getHistory(final String userId, final Integer limit) {
        final DocumentAnalysisConfig.History history = analysisConfig.getHistory();
        final int requested = limit == null ? history.getDefaultLimit() : limit;
        final int effective = Math.max(1, Math.min(requested, history.getMaxLimit()));
        return runStore.listRuns(userId, effective).stream().map(RunSummary::of).toList();
    }
}
