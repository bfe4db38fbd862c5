package com.eyelevel.documentanalysis.service.s3;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.charset.StandardCharsets;

/**
 * A service for reading uploaded documents from, and writing extracted text to, the document bucket.
 */
@Slf4j
@Service
public class S3StorageService {

    private final S3Client s3Client;
    private final String bucketName;

    public S3StorageService(final S3Client s3Client, @Value("${aws.s3.bucket}") final String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        log.info("S3StorageService initialized for bucket '{}'.", bucketName);
    }

    /**
     * Downloads a whole object into memory. Documents handed to the vision model have to be base64-encoded in one
     * piece, so streaming would not save anything.
     *
     * @param s3Key The S3 key of the object to download.
     * @return The object's content.
     */
    public byte[] downloadBytes(final String s3Key) {
        log.debug("Downloading object from S3 key: {}", s3Key);
        final GetObjectRequest getObjectRequest = GetObjectRequest.builder().bucket(bucketName).key(s3Key).build();
        final ResponseBytes<GetObjectResponse> objectBytes = s3Client.getObjectAsBytes(getObjectRequest);
        log.debug("Downloaded {} bytes from S3 key: {}", objectBytes.asByteArray().length, s3Key);
        return objectBytes.asByteArray();
    }

    /**
     * Stores a text as a UTF-8 {@code text/plain} object.
     *
     * @param s3Key The destination S3 key.
     * @param text  The content to store.
     */
    public void uploadText(final String s3Key, final String text) {
        final PutObjectRequest putObjectRequest = PutObjectRequest.builder().bucket(bucketName).key(s3Key)
                                                                  .contentType("text/plain; charset=utf-8").build();
        s3Client.putObject(putObjectRequest, RequestBody.fromString(text, StandardCharsets.UTF_8));
        log.info("Successfully uploaded {} characters to S3 key: {}", text.length(), s3Key);
    }
}
