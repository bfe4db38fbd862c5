package com.eyelevel.documentanalysis.service.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.support.TaskExecutorAdapter;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("ExecutorExtractionDispatcher Tests")
class ExecutorExtractionDispatcherTest {

    private final FallbackExtractionService fallbackExtractionService = mock(FallbackExtractionService.class);
    private final ExecutorExtractionDispatcher dispatcher = new ExecutorExtractionDispatcher(
            new TaskExecutorAdapter(Runnable::run), fallbackExtractionService);

    @Test
    @DisplayName("Should run the fallback on the task executor")
    void testDispatch() {
        dispatcher.dispatch("u1", "r1");

        verify(fallbackExtractionService).completeFallback("u1", "r1");
    }

    @Test
    @DisplayName("Should contain errors raised by the fallback")
    void testErrorsContained() {
        when(fallbackExtractionService.completeFallback("u1", "r1")).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> dispatcher.dispatch("u1", "r1"));
    }
}
