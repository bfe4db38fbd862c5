package com.eyelevel.documentanalysis.service.ocr;

import com.eyelevel.documentanalysis.config.DocumentAnalysisConfig;
import com.eyelevel.documentanalysis.service.extraction.ExtractionOutcome;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.BlockType;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextRequest;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextResponse;
import software.amazon.awssdk.services.textract.model.Document;
import software.amazon.awssdk.services.textract.model.InvalidS3ObjectException;
import software.amazon.awssdk.services.textract.model.S3Object;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The fast extraction path: one synchronous Textract text detection on the uploaded object.
 * <p>
 * The call is bounded by the client's API-call timeout. Anything short of usable text defers to the fallback,
 * except a source object Textract cannot read at all.
 */
@Slf4j
@Service
public class TextractOcrService {

    static final Set<String> SUPPORTED_EXTENSIONS = Set.of("pdf", "png", "jpg", "jpeg");

    private final TextractClient textractClient;
    private final String bucketName;
    private final int minTextLength;

    public TextractOcrService(final TextractClient textractClient, @Value("${aws.s3.bucket}") final String bucketName,
                              final DocumentAnalysisConfig analysisConfig) {
        this.textractClient = textractClient;
        this.bucketName = bucketName;
        this.minTextLength = analysisConfig.getExtraction().getMinTextLength();
    }

    /**
     * Attempts to read the text of a document stored under the given key.
     *
     * @param sourceFileReference The S3 key of the uploaded document.
     * @return {@code Immediate} with the detected lines joined by newlines, {@code Deferred} when the fallback
     * should be used, or {@code Failed} when the object itself is missing or unreadable.
     */
    public ExtractionOutcome detectText(final String sourceFileReference) {
        final String extension = FilenameUtils.getExtension(sourceFileReference).toLowerCase(Locale.ROOT);
        if (!SUPPORTED_EXTENSIONS.contains(extension)) {
            log.info("Skipping Textract for '{}': '{}' files go straight to the fallback.", sourceFileReference,
                     extension);
            return new ExtractionOutcome.Deferred("Unsupported document type for OCR: " + extension);
        }

        final long start = System.currentTimeMillis();
        try {
            final DetectDocumentTextRequest request = DetectDocumentTextRequest.builder().document(
                    Document.builder().s3Object(S3Object.builder().bucket(bucketName).name(sourceFileReference)
                                                        .build()).build()).build();
            final DetectDocumentTextResponse response = textractClient.detectDocumentText(request);
            log.info("Textract responded in {} ms for '{}'.", System.currentTimeMillis() - start, sourceFileReference);

            final String text = joinLines(response);
            if (text.strip().length() <= minTextLength) {
                log.info("Textract returned too little text ({} characters) for '{}'.", text.strip().length(),
                         sourceFileReference);
                return new ExtractionOutcome.Deferred("OCR returned too little text");
            }
            return new ExtractionOutcome.Immediate(text);
        } catch (InvalidS3ObjectException e) {
            log.error("Textract could not read source object '{}': {}", sourceFileReference, e.getMessage());
            return new ExtractionOutcome.Failed("Source document is missing or unreadable: " + sourceFileReference);
        } catch (ApiCallTimeoutException e) {
            log.warn("Textract did not answer within the budget for '{}'.", sourceFileReference);
            return new ExtractionOutcome.Deferred("OCR timed out");
        } catch (SdkException e) {
            log.warn("Textract attempt failed for '{}': {}", sourceFileReference, e.getMessage());
            return new ExtractionOutcome.Deferred("OCR unavailable: " + e.getMessage());
        }
    }

    static String joinLines(final DetectDocumentTextResponse response) {
        return response.blocks().stream().filter(block -> block.blockType() == BlockType.LINE).map(Block::text)
                       .map(line -> line == null ? "" : line).collect(Collectors.joining("\n"));
    }
}
