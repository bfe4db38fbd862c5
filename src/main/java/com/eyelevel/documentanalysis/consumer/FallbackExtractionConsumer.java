package com.eyelevel.documentanalysis.consumer;

import com.eyelevel.documentanalysis.exception.MessageProcessingFailedException;
import com.eyelevel.documentanalysis.exception.RunNotFoundException;
import com.eyelevel.documentanalysis.service.extraction.FallbackExtractionService;
import io.awspring.cloud.sqs.annotation.SqsListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * An SQS message consumer that completes extractions the fast OCR path deferred.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.dispatch.mode", havingValue = "sqs", matchIfMissing = true)
public class FallbackExtractionConsumer {

    private final FallbackExtractionService fallbackExtractionService;

    /**
     * Handles one fallback message. The run itself records success or failure; only errors that left the run
     * untouched are rethrown so that SQS redelivers the message.
     *
     * @param message The SQS message payload, expected to contain "userId" and "runId".
     */
    @SqsListener(value = "${aws.sqs.extraction-fallback-queue-name}", factory = "extractionFallbackContainerFactory")
    public void processFallbackMessage(@Payload final Map<String, Object> message) {
        log.debug("Received new message on extraction fallback queue: {}", message);

        if (!(message.get("userId") instanceof String userId) || !(message.get("runId") instanceof String runId)) {
            log.error("[FATAL] SQS message is missing 'userId' or 'runId'. Message will be dropped. Payload: {}",
                      message);
            return;
        }

        try {
            fallbackExtractionService.completeFallback(userId, runId);
        } catch (RunNotFoundException e) {
            log.error("Run {}/{} no longer exists. Message will be dropped.", userId, runId);
        } catch (final Exception e) {
            log.error("Fallback extraction failed for run {}/{}. Re-throwing to trigger SQS retry.", userId, runId, e);
            throw new MessageProcessingFailedException("Fallback extraction failed for run " + runId, e);
        }
    }
}
