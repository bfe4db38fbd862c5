package com.eyelevel.documentanalysis;

import com.eyelevel.documentanalysis.config.DocumentAnalysisConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Document Analysis Spring Boot application.
 * <p>
 * Besides auto-configuration this enables:
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: binds the "app.analysis" properties to
 *     {@link DocumentAnalysisConfig}.</li>
 *     <li>{@link EnableScheduling}: runs the stale run sweeper.</li>
 *     <li>{@link EnableRetry}: retries of the vision-model extraction fallback.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(value = DocumentAnalysisConfig.class)
@EnableRetry
public class DocumentAnalysisApplication {

    public static void main(final String[] args) {
        log.info("🚀 Starting DocumentAnalysisApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(DocumentAnalysisApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "DocumentAnalysis"));
        log.info("  - Local:         http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Dispatch mode: {}", env.getProperty("app.dispatch.mode", "sqs"));
        log.info("  - Profile(s):    {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
