package com.backupcenter.server.service.storage;

import com.backupcenter.server.exception.TransportException;
import com.backupcenter.server.model.storage.StorageObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.paginators.ListObjectsV2Iterable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ObjectStorageBackendTest {

    @TempDir
    Path tempDir;

    private S3Client s3Client;

    private ObjectStorageBackend backend;

    @BeforeEach
    void setUp() {
        this.s3Client = mock(S3Client.class);
        this.backend = new ObjectStorageBackend(this.s3Client, "backups", "us-east-1");
    }

    @Test
    void ShouldCreateBucketAndReturnObjectUriWhenBucketMissing() throws IOException {
        Path artifact = Files.writeString(this.tempDir.resolve("a.dump"), "PGDMP");
        when(this.s3Client.headBucket(any(HeadBucketRequest.class)))
                .thenThrow(NoSuchBucketException.builder().message("missing").build());

        String uri = this.backend.upload(artifact, "backups/orders/a.dump");

        assertEquals("object://backups/backups/orders/a.dump", uri);
        verify(this.s3Client).createBucket(any(CreateBucketRequest.class));
        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(this.s3Client).putObject(captor.capture(), any(RequestBody.class));
        assertEquals("backups", captor.getValue().bucket());
        assertEquals("backups/orders/a.dump", captor.getValue().key());
    }

    @Test
    void ShouldSkipDirectoryMarkersWhenListing() {
        Instant modified = Instant.parse("2024-01-01T00:00:00Z");
        when(this.s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(
                ListObjectsV2Response.builder()
                        .isTruncated(false)
                        .contents(
                                S3Object.builder().key("backups/orders/").size(0L).lastModified(modified).build(),
                                S3Object.builder().key("backups/orders/a.dump").size(10L).lastModified(modified).build())
                        .build());
        when(this.s3Client.listObjectsV2Paginator(any(ListObjectsV2Request.class))).thenAnswer(invocation ->
                new ListObjectsV2Iterable(this.s3Client, invocation.getArgument(0)));

        List<StorageObject> objects = this.backend.listObjects("backups/orders/");

        assertEquals(List.of(new StorageObject("backups/orders/a.dump", modified, 10L)), objects);
        ArgumentCaptor<ListObjectsV2Request> captor = ArgumentCaptor.forClass(ListObjectsV2Request.class);
        verify(this.s3Client).listObjectsV2Paginator(captor.capture());
        assertEquals("backups/orders/", captor.getValue().prefix());
    }

    @Test
    void ShouldReturnEmptyWhenListingMissingBucket() {
        when(this.s3Client.listObjectsV2Paginator(any(ListObjectsV2Request.class)))
                .thenThrow(NoSuchBucketException.builder().message("missing").build());

        assertTrue(this.backend.listObjects("").isEmpty());
    }

    @Test
    void ShouldBeNoOpWhenDeletingMissingKey() {
        when(this.s3Client.headObject(any(HeadObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("missing").build());

        this.backend.delete("object://backups/backups/orders/a.dump");

        verify(this.s3Client, never()).deleteObject(any(DeleteObjectRequest.class));
    }

    @Test
    void ShouldDeleteByKeyWhenGivenLegacyUri() {
        this.backend.delete("s3://backups/backups/orders/a.dump");

        ArgumentCaptor<DeleteObjectRequest> captor = ArgumentCaptor.forClass(DeleteObjectRequest.class);
        verify(this.s3Client).deleteObject(captor.capture());
        assertEquals("backups/orders/a.dump", captor.getValue().key());
    }

    @Test
    void ShouldWrapSdkErrorWhenUploadFails() throws IOException {
        Path artifact = Files.writeString(this.tempDir.resolve("a.dump"), "PGDMP");
        when(this.s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenThrow(S3Exception.builder().statusCode(403).message("denied").build());

        assertThrows(TransportException.class, () -> this.backend.upload(artifact, "a.dump"));
    }

    @Test
    void ShouldReportFailureWhenBucketInaccessible() {
        when(this.s3Client.headBucket(any(HeadBucketRequest.class)))
                .thenThrow(S3Exception.builder().statusCode(403).message("denied").build());

        assertFalse(this.backend.testConnection().ok());
    }

    @Test
    void ShouldPrefixSchemeWhenEndpointBare() {
        assertEquals("https://minio.internal:9000", ObjectStorageBackend.normalizeEndpoint("minio.internal:9000", true));
        assertEquals("http://minio.internal:9000", ObjectStorageBackend.normalizeEndpoint("http://minio.internal:9000/", true));
    }
}
