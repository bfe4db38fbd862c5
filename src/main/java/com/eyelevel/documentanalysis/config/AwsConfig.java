package com.eyelevel.documentanalysis.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.textract.TextractClient;

import java.time.Duration;

/**
 * Configures and provides AWS SDK client beans for S3, Textract, Bedrock and SQS.
 * This configuration dynamically selects the credential strategy based on the active Spring profile.
 */
@Slf4j
@Configuration
public class AwsConfig {

    @Value("${aws.region}")
    private String awsRegion;

    @Value("${aws.bedrock.region:${aws.region}}")
    private String bedrockRegion;

    @Value("${aws.access-key:}")
    private String accessKey;

    @Value("${aws.secret-key:}")
    private String secretKey;

    @Value("${aws.s3.retry-count}")
    private int s3RetryCount;

    /**
     * Determines which credentials provider to use based on the active Spring profile.
     */
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider(Environment environment) {
        if (environment.acceptsProfiles(Profiles.of("local"))) {
            log.info("Local profile active. Using StaticCredentialsProvider.");
            if (!StringUtils.hasText(accessKey) || !StringUtils.hasText(secretKey)) {
                throw new IllegalArgumentException(
                        "aws.access-key and aws.secret-key must be set for the 'local' profile.");
            }
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
        } else {
            log.info("Non-local profile active. Using DefaultCredentialsProvider (for IAM role).");
            return DefaultCredentialsProvider.create();
        }
    }

    /**
     * Shared override configuration with an adaptive retry policy, used by the S3 client.
     */
    @Bean
    public ClientOverrideConfiguration clientOverrideConfiguration() {
        RetryPolicy adaptiveRetryPolicy = RetryPolicy.forRetryMode(RetryMode.ADAPTIVE).toBuilder()
                                                     .numRetries(s3RetryCount).build();

        return ClientOverrideConfiguration.builder().retryPolicy(adaptiveRetryPolicy).build();
    }

    @Bean
    public S3Client s3Client(AwsCredentialsProvider credentialsProvider,
                             ClientOverrideConfiguration clientOverrideConfig) {
        log.info("Configuring AWS S3Client for region: {}", awsRegion);
        return S3Client.builder().credentialsProvider(credentialsProvider)
                       .region(Region.of(awsRegion)).overrideConfiguration(clientOverrideConfig).build();
    }

    /**
     * Creates the Textract client used by the fast extraction path. Each call is bounded by the OCR budget and
     * is never retried by the SDK: a slow or failing attempt goes to the fallback path instead.
     */
    @Bean
    public TextractClient textractClient(AwsCredentialsProvider credentialsProvider,
                                         DocumentAnalysisConfig analysisConfig) {
        final long ocrTimeoutMs = analysisConfig.getExtraction().getOcrTimeoutMs();
        log.info("Configuring AWS TextractClient for region: {} with a {} ms call budget", awsRegion, ocrTimeoutMs);
        return TextractClient.builder().credentialsProvider(credentialsProvider).region(Region.of(awsRegion))
                             .overrideConfiguration(ClientOverrideConfiguration.builder()
                                                                               .apiCallTimeout(Duration.ofMillis(ocrTimeoutMs))
                                                                               .retryPolicy(RetryPolicy.none())
                                                                               .build())
                             .build();
    }

    /**
     * Creates the Bedrock runtime client used both for fallback extraction and analysis.
     * Retries are handled by the callers, so SDK retries are disabled.
     */
    @Bean
    public BedrockRuntimeClient bedrockRuntimeClient(AwsCredentialsProvider credentialsProvider,
                                                     DocumentAnalysisConfig analysisConfig) {
        final long readTimeoutSeconds = analysisConfig.getBedrock().getReadTimeoutSeconds();
        log.info("Configuring AWS BedrockRuntimeClient for region: {} with a {} s call timeout", bedrockRegion,
                 readTimeoutSeconds);
        return BedrockRuntimeClient.builder().credentialsProvider(credentialsProvider).region(Region.of(bedrockRegion))
                                   .overrideConfiguration(ClientOverrideConfiguration.builder()
                                                                                     .apiCallTimeout(Duration.ofSeconds(readTimeoutSeconds))
                                                                                     .retryPolicy(RetryPolicy.none())
                                                                                     .build())
                                   .build();
    }

    @Bean
    public SqsAsyncClient sqsAsyncClient(AwsCredentialsProvider credentialsProvider) {
        log.info("Configuring AWS SqsAsyncClient for region: {}", awsRegion);
        return SqsAsyncClient.builder().region(Region.of(awsRegion)).credentialsProvider(credentialsProvider).build();
    }
}
