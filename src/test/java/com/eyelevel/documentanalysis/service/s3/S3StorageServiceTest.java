package com.eyelevel.documentanalysis.service.s3;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("S3StorageService Tests")
class S3StorageServiceTest {

    private final S3Client s3Client = mock(S3Client.class);
    private final S3StorageService service = new S3StorageService(s3Client, "documents-bucket");

    @Test
    @DisplayName("Should read the source document from the configured bucket")
    void testDownloadBytes() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class))).thenReturn(
                ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), new byte[]{7, 8}));

        assertArrayEquals(new byte[]{7, 8}, service.downloadBytes("uploads/escaneo.png"));

        ArgumentCaptor<GetObjectRequest> captor = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3Client).getObjectAsBytes(captor.capture());
        assertEquals("documents-bucket", captor.getValue().bucket());
        assertEquals("uploads/escaneo.png", captor.getValue().key());
    }

    @Test
    @DisplayName("Should write extracted text as UTF-8 plain text into the configured bucket")
    void testUploadText() {
        service.uploadText("extracted/r1.txt", "contragarantía");

        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(captor.capture(), any(RequestBody.class));
        assertEquals("documents-bucket", captor.getValue().bucket());
        assertEquals("extracted/r1.txt", captor.getValue().key());
        assertTrue(captor.getValue().contentType().startsWith("text/plain"));
    }
}
