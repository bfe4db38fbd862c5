package com.eyelevel.documentanalysis.service.extraction;

import io.awspring.cloud.sqs.operations.SqsTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Publishes fallback extraction work to SQS so that any replica can pick it up.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.dispatch.mode", havingValue = "sqs", matchIfMissing = true)
public class SqsExtractionDispatcher implements ExtractionDispatcher {

    private static final String SQS_MESSAGE_GROUP_ID_HEADER = "message-group-id";
    private static final String SQS_MESSAGE_DEDUPLICATION_ID_HEADER = "message-deduplication-id";

    private final SqsTemplate sqsTemplate;
    private final String fallbackQueueName;

    public SqsExtractionDispatcher(final SqsTemplate sqsTemplate,
                                   @Value("${aws.sqs.extraction-fallback-queue-name}") final String fallbackQueueName) {
        this.sqsTemplate = sqsTemplate;
        this.fallbackQueueName = fallbackQueueName;
    }

    @Override
    public void dispatch(final String userId, final String runId) {
        // One run is claimed for fallback only once, so the run key doubles as the deduplication id.
        sqsTemplate.send(fallbackQueueName, MessageBuilder.withPayload(Map.of("userId", userId, "runId", runId))
                                                          .setHeader(SQS_MESSAGE_GROUP_ID_HEADER, userId)
                                                          .setHeader(SQS_MESSAGE_DEDUPLICATION_ID_HEADER,
                                                                     "extraction-fallback-" + userId + "-" + runId)
                                                          .build());
        log.info("Run {}/{} queued for fallback extraction on '{}'.", userId, runId, fallbackQueueName);
    }
}
