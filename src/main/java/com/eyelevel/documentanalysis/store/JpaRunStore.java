package com.eyelevel.documentanalysis.store;

import com.eyelevel.documentanalysis.exception.RunAlreadyExistsException;
import com.eyelevel.documentanalysis.exception.RunNotFoundException;
import com.eyelevel.documentanalysis.exception.StatusConflictException;
import com.eyelevel.documentanalysis.model.AnalysisRun;
import com.eyelevel.documentanalysis.model.ModelVariant;
import com.eyelevel.documentanalysis.model.RunStatus;
import com.eyelevel.documentanalysis.repository.AnalysisRunRepository;
import com.eyelevel.documentanalysis.service.run.RunStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * {@link RunStore} backed by the relational database through Spring Data JPA.
 * <p>
 * Every operation runs in its own {@code REQUIRES_NEW} transaction so that its outcome is committed before the
 * caller continues, whatever transaction the caller may hold. Conditional updates combine the expected-status
 * check with the entity's {@code @Version} column: two writers that both observed the expected status cannot both
 * commit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaRunStore implements RunStore {

    private final AnalysisRunRepository analysisRunRepository;
    private final Clock clock;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AnalysisRun createRun(final String userId, final String runId, final ModelVariant modelVariant,
                                 final String sourceFileReference) {
        if (analysisRunRepository.existsByUserIdAndRunId(userId, runId)) {
            throw new RunAlreadyExistsException(String.format("Run %s already exists for user %s.", runId, userId));
        }
        final Instant now = clock.instant();
        final AnalysisRun run = AnalysisRun.builder()
                                           .userId(userId)
                                           .runId(runId)
                                           .status(RunStatus.UPLOADED)
                                           .modelVariant(modelVariant)
                                           .sourceFileReference(sourceFileReference)
                                           .sourceFileName(FilenameUtils.getName(sourceFileReference))
                                           .createdAt(now)
                                           .updatedAt(now)
                                           .build();
        try {
            final AnalysisRun saved = analysisRunRepository.saveAndFlush(run);
            log.info("Run {}/{} created for source '{}'.", userId, runId, sourceFileReference);
            return saved;
        } catch (DataIntegrityViolationException e) {
            // A concurrent request registered the same run between the existence check and the insert.
            throw new RunAlreadyExistsException(
                    String.format("Run %s already exists for user %s.", runId, userId), e);
        }
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public AnalysisRun getRun(final String userId, final String runId) {
        return findRun(userId, runId);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AnalysisRun updateRun(final String userId, final String runId, final RunMutation mutation,
                                 final RunStatus expectedStatus) {
        final AnalysisRun run = findRun(userId, runId);
        if (run.getStatus() != expectedStatus) {
            throw new StatusConflictException(
                    String.format("Run %s is %s, expected %s.", runId, run.getStatus(), expectedStatus),
                    run.getStatus());
        }

        final RunStateMachine.Snapshot before = RunStateMachine.Snapshot.of(run);
        mutation.apply(run);
        RunStateMachine.validate(before, run);
        run.setUpdatedAt(clock.instant());

        try {
            final AnalysisRun saved = analysisRunRepository.saveAndFlush(run);
            log.debug("Run {}/{} moved from {} to {}.", userId, runId, before.status(), saved.getStatus());
            return saved;
        } catch (ConcurrencyFailureException e) {
            throw new StatusConflictException(
                    String.format("Run %s was modified concurrently while %s.", runId, expectedStatus),
                    null, e);
        }
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public List<AnalysisRun> listRuns(final String userId, final int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("History limit must be positive but was " + limit);
        }
        return analysisRunRepository.findByUserIdOrderByCreatedAtDescIdDesc(userId, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public List<AnalysisRun> findStaleRuns(final Collection<RunStatus> statuses, final Instant olderThan) {
        return analysisRunRepository.findByStatusInAndUpdatedAtBefore(statuses, olderThan);
    }

    private AnalysisRun findRun(final String userId, final String runId) {
        return analysisRunRepository.findByUserIdAndRunId(userId, runId).orElseThrow(
                () -> new RunNotFoundException(String.format("Run %s not found for user %s.", runId, userId)));
    }
}
