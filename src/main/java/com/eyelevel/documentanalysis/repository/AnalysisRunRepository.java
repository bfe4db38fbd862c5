package com.eyelevel.documentanalysis.repository;

import com.eyelevel.documentanalysis.model.AnalysisRun;
import com.eyelevel.documentanalysis.model.RunStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for the {@link AnalysisRun} entity.
 */
@Repository
public interface AnalysisRunRepository extends JpaRepository<AnalysisRun, Long> {

    Optional<AnalysisRun> findByUserIdAndRunId(String userId, String runId);

    boolean existsByUserIdAndRunId(String userId, String runId);

    /**
     * Lists a user's runs newest first. Runs created in the same instant fall back to insertion order.
     *
     * @param userId   The partition to read.
     * @param pageable The page to read; ordering is fixed by the method name.
     * @return A prefix of the user's full run history.
     */
    List<AnalysisRun> findByUserIdOrderByCreatedAtDescIdDesc(String userId, Pageable pageable);

    /**
     * Finds in-flight runs that have not moved since the given threshold.
     * This is used by the {@link com.eyelevel.documentanalysis.scheduler.StaleRunCleanupScheduler}.
     */
    List<AnalysisRun> findByStatusInAndUpdatedAtBefore(Collection<RunStatus> statuses, Instant threshold);
}
