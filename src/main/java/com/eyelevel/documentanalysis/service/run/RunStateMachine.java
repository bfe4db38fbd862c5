package com.eyelevel.documentanalysis.service.run;

import com.eyelevel.documentanalysis.exception.StatusConflictException;
import com.eyelevel.documentanalysis.model.AnalysisRun;
import com.eyelevel.documentanalysis.model.AsyncStage;
import com.eyelevel.documentanalysis.model.RunStatus;

import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The transition contract shared by every writer of an {@link AnalysisRun}.
 * <p>
 * A run moves through the phases below, only forward. {@link RunStatus#PROCESSING_ASYNC} is split by
 * {@link AsyncStage} so that a run waiting on its extraction fallback can never be completed by an
 * analysis callback and vice versa.
 * <pre>
 * UPLOADED -> EXTRACTING -> ASYNC_EXTRACTION -> EXTRACTED -> ANALYZING -> ASYNC_ANALYSIS -> COMPLETED
 *      (any non-terminal phase) -> FAILED
 * </pre>
 */
public final class RunStateMachine {

    /**
     * A status and, for asynchronous processing, the stage it belongs to.
     */
    enum Phase {
        UPLOADED, EXTRACTING, ASYNC_EXTRACTION, EXTRACTED, ANALYZING, ASYNC_ANALYSIS, COMPLETED, FAILED
    }

    private static final Map<Phase, Set<Phase>> ALLOWED_TRANSITIONS = Map.of(
            Phase.UPLOADED, EnumSet.of(Phase.EXTRACTING, Phase.ASYNC_EXTRACTION, Phase.EXTRACTED, Phase.FAILED),
            Phase.EXTRACTING, EnumSet.of(Phase.ASYNC_EXTRACTION, Phase.EXTRACTED, Phase.FAILED),
            Phase.ASYNC_EXTRACTION, EnumSet.of(Phase.EXTRACTED, Phase.FAILED),
            Phase.EXTRACTED, EnumSet.of(Phase.ANALYZING, Phase.ASYNC_ANALYSIS, Phase.FAILED),
            Phase.ANALYZING, EnumSet.of(Phase.ASYNC_ANALYSIS, Phase.COMPLETED, Phase.FAILED),
            Phase.ASYNC_ANALYSIS, EnumSet.of(Phase.COMPLETED, Phase.FAILED),
            Phase.COMPLETED, EnumSet.noneOf(Phase.class),
            Phase.FAILED, EnumSet.noneOf(Phase.class));

    private RunStateMachine() {
    }

    /**
     * Captures the fields of a run that a mutation must not break.
     */
    public record Snapshot(String userId, String runId, RunStatus status, AsyncStage asyncStage,
                           String analysisResult) {

        public static Snapshot of(final AnalysisRun run) {
            return new Snapshot(run.getUserId(), run.getRunId(), run.getStatus(), run.getAsyncStage(),
                                run.getAnalysisResult());
        }
    }

    /**
     * Checks whether moving from one status/stage pair to another is allowed.
     * Staying in the same non-terminal phase is allowed.
     */
    public static boolean canTransition(final RunStatus fromStatus, final AsyncStage fromStage,
                                        final RunStatus toStatus, final AsyncStage toStage) {
        final Phase from = phaseOf(fromStatus, fromStage);
        final Phase to = phaseOf(toStatus, toStage);
        if (from == to) {
            return !fromStatus.isTerminal();
        }
        return ALLOWED_TRANSITIONS.get(from).contains(to);
    }

    /**
     * Validates a mutated run against the state it had before the mutation was applied.
     *
     * @param before The snapshot taken before the mutation.
     * @param after  The run after the mutation.
     * @throws StatusConflictException if the run was terminal, the transition is not allowed, the identity changed
     *                                 or the analysis result was overwritten.
     */
    public static void validate(final Snapshot before, final AnalysisRun after) {
        if (before.status().isTerminal()) {
            throw new StatusConflictException(
                    String.format("Run %s is %s and accepts no further changes.", before.runId(), before.status()),
                    before.status());
        }
        if (!Objects.equals(before.userId(), after.getUserId()) || !Objects.equals(before.runId(), after.getRunId())) {
            throw new IllegalStateException("A run mutation must not change the run identity of " + before.runId());
        }
        if (after.getStatus() == null) {
            throw new IllegalStateException("A run mutation must not clear the status of " + before.runId());
        }
        if (after.getStatus() == RunStatus.PROCESSING_ASYNC && after.getAsyncStage() == null) {
            throw new IllegalStateException("PROCESSING_ASYNC requires an async stage for run " + before.runId());
        }
        if (after.getStatus() != RunStatus.PROCESSING_ASYNC && after.getAsyncStage() != null) {
            after.setAsyncStage(null);
        }
        if (before.analysisResult() != null && !before.analysisResult().equals(after.getAnalysisResult())) {
            throw new StatusConflictException(
                    String.format("The analysis result of run %s has already been recorded.", before.runId()),
                    before.status());
        }
        if (!canTransition(before.status(), before.asyncStage(), after.getStatus(), after.getAsyncStage())) {
            throw new StatusConflictException(
                    String.format("Run %s cannot move from %s to %s.", before.runId(),
                                  describe(before.status(), before.asyncStage()),
                                  describe(after.getStatus(), after.getAsyncStage())),
                    before.status());
        }
    }

    static Phase phaseOf(final RunStatus status, final AsyncStage stage) {
        return switch (status) {
            case UPLOADED -> Phase.UPLOADED;
            case EXTRACTING -> Phase.EXTRACTING;
            case EXTRACTED -> Phase.EXTRACTED;
            case ANALYZING -> Phase.ANALYZING;
            case PROCESSING_ASYNC -> stage == AsyncStage.ANALYSIS ? Phase.ASYNC_ANALYSIS : Phase.ASYNC_EXTRACTION;
            case COMPLETED -> Phase.COMPLETED;
            case FAILED -> Phase.FAILED;
        };
    }

    private static String describe(final RunStatus status, final AsyncStage stage) {
        return status == RunStatus.PROCESSING_ASYNC && stage != null ? status + "(" + stage + ")" : String.valueOf(status);
    }
}
