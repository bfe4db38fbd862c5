package com.eyelevel.documentanalysis.store;

import com.eyelevel.documentanalysis.model.AnalysisRun;
import com.eyelevel.documentanalysis.model.ModelVariant;
import com.eyelevel.documentanalysis.model.RunStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Persistence contract for {@link AnalysisRun} records. The store is the single source of truth for run state:
 * callers never cache runs and all coordination between concurrent writers happens through
 * {@link #updateRun(String, String, RunMutation, RunStatus)}.
 */
public interface RunStore {

    /**
     * Registers a new run in {@link RunStatus#UPLOADED}.
     *
     * @param userId              The owning user.
     * @param runId               The run identifier, unique per user.
     * @param modelVariant        The analysis variant, if already known. May be null.
     * @param sourceFileReference The object-store key of the uploaded document.
     * @return The persisted run.
     * @throws com.eyelevel.documentanalysis.exception.RunAlreadyExistsException if the run identifier is taken.
     */
    AnalysisRun createRun(String userId, String runId, ModelVariant modelVariant, String sourceFileReference);

    /**
     * @throws com.eyelevel.documentanalysis.exception.RunNotFoundException if the run does not exist.
     */
    AnalysisRun getRun(String userId, String runId);

    /**
     * Applies a mutation only if the stored status still equals {@code expectedStatus} when the write happens.
     *
     * @return The run as persisted after the mutation.
     * @throws com.eyelevel.documentanalysis.exception.RunNotFoundException    if the run does not exist.
     * @throws com.eyelevel.documentanalysis.exception.StatusConflictException if the stored status differs, a
     *                                                                          concurrent write won, or the
     *                                                                          resulting transition is not allowed.
     */
    AnalysisRun updateRun(String userId, String runId, RunMutation mutation, RunStatus expectedStatus);

    /**
     * Lists a user's runs, newest first.
     *
     * @param limit The maximum number of runs to return; the result is always a prefix of the full ordering.
     */
    List<AnalysisRun> listRuns(String userId, int limit);

    /**
     * Finds runs in any of the given statuses whose last change happened before {@code olderThan}.
     */
    List<AnalysisRun> findStaleRuns(Collection<RunStatus> statuses, Instant olderThan);
}
