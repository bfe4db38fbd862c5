package com.eyelevel.documentanalysis.consumer;

import com.eyelevel.documentanalysis.exception.MessageProcessingFailedException;
import com.eyelevel.documentanalysis.exception.RunNotFoundException;
import com.eyelevel.documentanalysis.service.extraction.FallbackExtractionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.exception.SdkClientException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("FallbackExtractionConsumer Tests")
class FallbackExtractionConsumerTest {

    private final FallbackExtractionService fallbackExtractionService = mock(FallbackExtractionService.class);
    private final FallbackExtractionConsumer consumer = new FallbackExtractionConsumer(fallbackExtractionService);

    @Test
    @DisplayName("Should complete the fallback for a well-formed message")
    void testProcessMessage() {
        consumer.processFallbackMessage(Map.of("userId", "u1", "runId", "r1"));

        verify(fallbackExtractionService).completeFallback("u1", "r1");
    }

    @Test
    @DisplayName("Should drop messages without identifiers")
    void testMalformedMessage() {
        consumer.processFallbackMessage(Map.of("userId", "u1"));

        verifyNoInteractions(fallbackExtractionService);
    }

    @Test
    @DisplayName("Should drop messages for runs that no longer exist")
    void testUnknownRun() {
        when(fallbackExtractionService.completeFallback("u1", "gone"))
                .thenThrow(new RunNotFoundException("Run gone not found for user u1"));

        assertDoesNotThrow(() -> consumer.processFallbackMessage(Map.of("userId", "u1", "runId", "gone")));
    }

    @Test
    @DisplayName("Should rethrow unexpected errors so the message is redelivered")
    void testUnexpectedError() {
        when(fallbackExtractionService.completeFallback(anyString(), anyString()))
                .thenThrow(SdkClientException.create("Unable to reach the database"));

        assertThrows(MessageProcessingFailedException.class,
                     () -> consumer.processFallbackMessage(Map.of("userId", "u1", "runId", "r1")));
    }
}
