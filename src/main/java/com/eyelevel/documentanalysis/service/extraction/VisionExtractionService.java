package com.eyelevel.documentanalysis.service.extraction;

import com.eyelevel.documentanalysis.config.DocumentAnalysisConfig;
import com.eyelevel.documentanalysis.exception.ExtractionFailedException;
import com.eyelevel.documentanalysis.exception.ModelInvocationException;
import com.eyelevel.documentanalysis.service.llm.BedrockModelClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * The extraction fallback: the whole document is sent to the vision-capable model with a fixed instruction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VisionExtractionService {

    private final BedrockModelClient bedrockModelClient;
    private final DocumentAnalysisConfig analysisConfig;

    @Retryable(retryFor = ModelInvocationException.class,
               maxAttemptsExpression = "#{${app.analysis.extraction.fallback.retry.attempts} + 1}",
               backoff = @Backoff(delayExpression = "#{${app.analysis.extraction.fallback.retry.delay-ms}}"),
               listeners = {"visionExtractionRetryListener"})
    public String extractText(final byte[] document, final String fileName, final String contextInfo) {
        final DocumentAnalysisConfig.Extraction.Fallback fallback = analysisConfig.getExtraction().getFallback();
        final String mediaType = mediaTypeOf(fileName);
        log.info("[{}] Sending '{}' ({} bytes, {}) to the vision model.", contextInfo, fileName, document.length,
                 mediaType);

        final String text = bedrockModelClient.completeWithDocument(fallback.getInstruction(), document, mediaType,
                                                                    fallback.getMaxTokens(), 0.0);
        log.info("[{}] Vision model extracted {} characters from '{}'.", contextInfo, text.length(), fileName);
        return text;
    }

    @Recover
    public String recover(final Exception e, final byte[] document, final String fileName, final String contextInfo) {
        final String errorMessage = String.format("Text extraction failed for '%s' after all retry attempts: %s",
                                                  fileName, e.getMessage());
        log.error("[{}] {}", contextInfo, errorMessage, e);
        throw new ExtractionFailedException(errorMessage, e);
    }

    static String mediaTypeOf(final String fileName) {
        return switch (FilenameUtils.getExtension(fileName).toLowerCase(Locale.ROOT)) {
            case "pdf" -> "application/pdf";
            case "jpg", "jpeg" -> "image/jpeg";
            case "png" -> "image/png";
            default -> "application/octet-stream";
        };
    }
}
