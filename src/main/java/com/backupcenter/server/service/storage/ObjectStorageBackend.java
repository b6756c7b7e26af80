package com.backupcenter.server.service.storage;

import com.backupcenter.server.enums.StorageTypeEnum;
import com.backupcenter.server.exception.TransportException;
import com.backupcenter.server.model.storage.ConnectionCheckResult;
import com.backupcenter.server.model.storage.SpaceInfo;
import com.backupcenter.server.model.storage.StorageObject;
import com.backupcenter.server.util.FilesystemUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * S3 compatible bucket (AWS, MinIO, Ceph ...). Path style addressing is always used so that self hosted
 * endpoints work without wildcard DNS. Uris look like {@code object://bucket/key}; {@code s3://bucket/key}
 * is read as well.
 * <p>
 * Object storage has no quota api, so {@link #spaceInfo()} only reports the summed object size.
 */
@Slf4j
public class ObjectStorageBackend implements StorageBackend {

    public static final String SCHEME = "object://";

    public static final String LEGACY_SCHEME = "s3://";

    private final S3Client s3Client;

    private final String bucket;

    private final String region;

    public ObjectStorageBackend(
            String endpoint,
            String accessKey,
            String secretKey,
            String bucket,
            String region,
            boolean useSsl) {
        this(createClient(endpoint, accessKey, secretKey, region, useSsl), bucket, region);
    }

    ObjectStorageBackend(S3Client s3Client, String bucket, String region) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.region = region;
    }

    static S3Client createClient(
            String endpoint, String accessKey, String secretKey, String region, boolean useSsl) {
        return S3Client.builder()
                .region(Region.of(region))
                .endpointOverride(URI.create(normalizeEndpoint(endpoint, useSsl)))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(accessKey, secretKey)))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(true)
                        .checksumValidationEnabled(false)
                        .build())
                .build();
    }

    // endpoint 可以不带 scheme, 由 useSsl 决定 http 或 https
    static String normalizeEndpoint(String endpoint, boolean useSsl) {
        String trimmed = StringUtils.removeEnd(endpoint.trim(), "/");
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return trimmed;
        }
        return (useSsl ? "https://" : "http://") + trimmed;
    }

    @Override
    public StorageTypeEnum getStorageType() {
        return StorageTypeEnum.OBJECT;
    }

    @Override
    public String upload(Path localFile, String remotePath) throws TransportException {
        String key = this.toRelativePath(remotePath);
        try {
            this.ensureBucket();
            this.s3Client.putObject(
                    PutObjectRequest.builder().bucket(this.bucket).key(key).build(),
                    RequestBody.fromFile(localFile));
        } catch (SdkException e) {
            throw new TransportException("upload %s to bucket %s failed".formatted(key, this.bucket), e);
        }
        log.info("uploaded {} to bucket {} key {}", localFile.getFileName(), this.bucket, key);
        return SCHEME + this.bucket + "/" + key;
    }

    @Override
    public void download(String remotePathOrUri, Path localFile) throws TransportException {
        String key = this.toRelativePath(remotePathOrUri);
        try {
            Path parent = localFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            // toFile 要求目标文件不存在
            Path tmp = Files.createTempFile(parent, ".download-", ".part");
            Files.delete(tmp);
            this.s3Client.getObject(
                    GetObjectRequest.builder().bucket(this.bucket).key(key).build(),
                    ResponseTransformer.toFile(tmp));
            Files.move(tmp, localFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (SdkException | IOException e) {
            throw new TransportException("download %s from bucket %s failed".formatted(key, this.bucket), e);
        }
    }

    @Override
    public List<StorageObject> listObjects(String prefix) throws TransportException {
        String normalizedPrefix = this.toRelativePath(prefix);
        // 以 / 结尾的 prefix 只匹配该目录下的 key
        if (prefix != null && prefix.endsWith("/") && !normalizedPrefix.isEmpty()) {
            normalizedPrefix = normalizedPrefix + "/";
        }
        List<StorageObject> result = new ArrayList<>();
        try {
            ListObjectsV2Request.Builder request = ListObjectsV2Request.builder().bucket(this.bucket);
            if (!normalizedPrefix.isEmpty()) {
                request.prefix(normalizedPrefix);
            }
            for (S3Object s3Object : this.s3Client.listObjectsV2Paginator(request.build()).contents()) {
                // 跳过目录占位对象
                if (s3Object.key().endsWith("/")) {
                    continue;
                }
                result.add(new StorageObject(s3Object.key(), s3Object.lastModified(), s3Object.size()));
            }
        } catch (NoSuchBucketException e) {
            log.info("listObjects on missing bucket {}. nothing to list", this.bucket);
            return result;
        } catch (SdkException e) {
            throw new TransportException("list bucket %s prefix %s failed"
                    .formatted(this.bucket, normalizedPrefix), e);
        }
        return result;
    }

    @Override
    public void delete(String remotePathOrUri) throws TransportException {
        String key = this.toRelativePath(remotePathOrUri);
        try {
            if (!this.objectExists(key)) {
                log.info("delete skipped. key {} does not exist in bucket {}", key, this.bucket);
                return;
            }
            this.s3Client.deleteObject(DeleteObjectRequest.builder().bucket(this.bucket).key(key).build());
        } catch (SdkException e) {
            throw new TransportException("delete %s from bucket %s failed".formatted(key, this.bucket), e);
        }
    }

    @Override
    public SpaceInfo spaceInfo() throws TransportException {
        long total = 0L;
        for (StorageObject storageObject : this.listObjects("")) {
            total += storageObject.sizeBytes();
        }
        return new SpaceInfo(FilesystemUtil.bytesToGb(total), null, null);
    }

    @Override
    public ConnectionCheckResult testConnection() {
        try {
            this.ensureBucket();
            return ConnectionCheckResult.success();
        } catch (SdkException e) {
            log.warn("testConnection failed. bucket is {}", this.bucket, e);
            return ConnectionCheckResult.failed("cannot access or create bucket %s. %s"
                    .formatted(this.bucket, e.getMessage()));
        }
    }

    @Override
    public String toRelativePath(String remotePathOrUri) {
        if (remotePathOrUri == null) {
            return "";
        }
        String path = remotePathOrUri;
        for (String scheme : List.of(SCHEME, LEGACY_SCHEME)) {
            String bucketPrefix = scheme + this.bucket + "/";
            if (path.startsWith(bucketPrefix)) {
                path = path.substring(bucketPrefix.length());
                break;
            }
        }
        return FilesystemUtil.normalizeRelativePath(path);
    }

    @Override
    public void close() {
        this.s3Client.close();
    }

    private void ensureBucket() {
        try {
            this.s3Client.headBucket(HeadBucketRequest.builder().bucket(this.bucket).build());
        } catch (NoSuchBucketException e) {
            log.info("bucket {} does not exist. creating it in region {}", this.bucket, this.region);
            this.s3Client.createBucket(CreateBucketRequest.builder().bucket(this.bucket).build());
        } catch (S3Exception e) {
            if (e.statusCode() != 404) {
                throw e;
            }
            log.info("bucket {} does not exist. creating it in region {}", this.bucket, this.region);
            this.s3Client.createBucket(CreateBucketRequest.builder().bucket(this.bucket).build());
        }
    }

    private boolean objectExists(String key) {
        try {
            this.s3Client.headObject(HeadObjectRequest.builder().bucket(this.bucket).key(key).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw e;
        }
    }
}
