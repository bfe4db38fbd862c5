package com.eyelevel.documentanalysis.service.extraction;

import com.eyelevel.documentanalysis.config.DocumentAnalysisConfig;
import com.eyelevel.documentanalysis.service.s3.S3StorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Keeps a copy of each run's extracted text next to the uploaded documents.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractedTextArchiver {

    private final S3StorageService s3StorageService;
    private final DocumentAnalysisConfig analysisConfig;

    /**
     * Writes the text to {@code <prefix><runId>.txt}. The copy is best effort: the run record is the source of truth.
     *
     * @return The key of the copy, or null if it could not be written.
     */
    public String archive(final String userId, final String runId, final String text) {
        final String key = analysisConfig.getExtraction().getExtractedTextPrefix() + runId + ".txt";
        try {
            s3StorageService.uploadText(key, text);
            return key;
        } catch (SdkException e) {
            log.warn("Run {}/{}: could not store the extracted text copy at '{}': {}", userId, runId, key,
                     e.getMessage());
            return null;
        }
    }
}
