package com.eyelevel.documentanalysis.store;

import com.eyelevel.documentanalysis.model.AnalysisRun;

/**
 * A change applied to the authoritative copy of a run inside a conditional update.
 * Implementations only set fields; the store decides whether the result may be persisted.
 */
@FunctionalInterface
public interface RunMutation {

    void apply(AnalysisRun run);
}
