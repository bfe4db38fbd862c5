package com.eyelevel.documentanalysis.service.extraction;

/**
 * The result of a fast-path extraction attempt.
 */
public interface ExtractionOutcome {

    /**
     * Text was extracted within the budget.
     */
    record Immediate(String text) implements ExtractionOutcome {
    }

    /**
     * The fast path could not produce usable text in time; the vision-model fallback should take over.
     */
    record Deferred(String reason) implements ExtractionOutcome {
    }

    /**
     * The document cannot be processed at all, so a fallback would fail as well.
     */
    record Failed(String reason) implements ExtractionOutcome {
    }
}
