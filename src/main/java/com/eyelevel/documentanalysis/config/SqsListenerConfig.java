package com.eyelevel.documentanalysis.config;

import io.awspring.cloud.sqs.config.SqsMessageListenerContainerFactory;
import io.awspring.cloud.sqs.listener.acknowledgement.handler.AcknowledgementMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import java.time.Duration;

@Configuration
@ConditionalOnProperty(name = "app.dispatch.mode", havingValue = "sqs", matchIfMissing = true)
public class SqsListenerConfig {

    /**
     * Creates the container factory for the extraction fallback listener.
     * Fallback work is slow and model-bound, so concurrency is kept low and messages are acknowledged only after
     * the run has reached a settled state.
     */
    @Bean("extractionFallbackContainerFactory")
    public SqsMessageListenerContainerFactory<Object> extractionFallbackContainerFactory(SqsAsyncClient sqsAsyncClient,
                                                                                         @Value("${app.sqs.listener.extraction-fallback-queue.concurrency-limit}")
                                                                                         int concurrency,
                                                                                         @Value("${app.sqs.listener.extraction-fallback-queue.max-messages-per-poll}")
                                                                                         int maxMessagesPerPoll,
                                                                                         @Value("${app.sqs.listener.extraction-fallback-queue.poll-timeout-seconds}")
                                                                                         int pollTimeoutSeconds) {

        SqsMessageListenerContainerFactory<Object> factory = new SqsMessageListenerContainerFactory<>();
        factory.setSqsAsyncClient(sqsAsyncClient);
        factory.configure(options -> options.acknowledgementMode(AcknowledgementMode.ON_SUCCESS)
                                            .maxConcurrentMessages(concurrency).maxMessagesPerPoll(maxMessagesPerPoll)
                                            .pollTimeout(Duration.ofSeconds(pollTimeoutSeconds)));
        return factory;
    }
}
