package com.eyelevel.documentanalysis.service.run;

import com.eyelevel.documentanalysis.exception.RunAlreadyExistsException;
import com.eyelevel.documentanalysis.exception.RunNotFoundException;
import com.eyelevel.documentanalysis.model.AnalysisRun;
import com.eyelevel.documentanalysis.model.ModelVariant;
import com.eyelevel.documentanalysis.store.RunStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.UUID;

/**
 * Creates runs for uploaded documents.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunRegistrationService {

    private final RunStore runStore;

    /**
     * Registers a new run. A run identifier is generated when the client does not supply one.
     *
     * @param variantCode The analysis variant, if the client already chose one. May be null.
     * @throws com.eyelevel.documentanalysis.exception.InvalidModelException     if the variant is not supported.
     * @throws com.eyelevel.documentanalysis.exception.RunAlreadyExistsException if the run identifier is taken.
     */
    public AnalysisRun register(final String userId, final String runId, final String variantCode,
                                final String sourceFileReference) {
        final ModelVariant variant = StringUtils.hasText(variantCode) ? ModelVariant.fromCode(variantCode) : null;
        final String effectiveRunId = StringUtils.hasText(runId) ? runId : UUID.randomUUID().toString();
        return runStore.createRun(userId, effectiveRunId, variant, sourceFileReference);
    }

    /**
     * Returns the identified run, creating it first when it does not exist yet. Used by triggers that may or may not
     * have been preceded by an explicit registration.
     */
    public AnalysisRun findOrRegister(final String userId, final String runId, final String sourceFileReference) {
        if (!StringUtils.hasText(runId)) {
            return register(userId, null, null, sourceFileReference);
        }
        try {
            final AnalysisRun existing = runStore.getRun(userId, runId);
            if (!existing.getSourceFileReference().equals(sourceFileReference)) {
                log.warn("Run {}/{} was registered for '{}'; ignoring the differing reference '{}'.", userId, runId,
                         existing.getSourceFileReference(), sourceFileReference);
            }
            return existing;
        } catch (RunNotFoundException e) {
            try {
                return runStore.createRun(userId, runId, null, sourceFileReference);
            } catch (RunAlreadyExistsException raced) {
                return runStore.getRun(userId, runId);
            }
        }
    }
}
