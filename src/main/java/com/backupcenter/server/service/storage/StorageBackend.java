package com.backupcenter.server.service.storage;

import com.backupcenter.server.enums.StorageTypeEnum;
import com.backupcenter.server.exception.TransportException;
import com.backupcenter.server.model.storage.ConnectionCheckResult;
import com.backupcenter.server.model.storage.SpaceInfo;
import com.backupcenter.server.model.storage.StorageObject;

import java.nio.file.Path;
import java.util.List;

/**
 * Uniform view over object storage, SFTP, NFS and local directories.
 * <p>
 * Remote paths are relative to the backend root and use forward slashes. Every method that takes a
 * remote path also accepts the scheme qualified uri returned by {@link #upload}.
 * <p>
 * Deleting a path that does not exist is a logged no-op on every backend. Any other failure is a
 * {@link TransportException}.
 */
public interface StorageBackend extends AutoCloseable {

    StorageTypeEnum getStorageType();

    /**
     * Copies a local file to {@code remotePath}, creating parent directories, prefixes or the bucket
     * as needed.
     *
     * @return uri that identifies the artifact for later download or delete
     */
    String upload(Path localFile, String remotePath) throws TransportException;

    void download(String remotePathOrUri, Path localFile) throws TransportException;

    /**
     * Recursive listing under {@code prefix}. Each call lists again from scratch.
     */
    List<StorageObject> listObjects(String prefix) throws TransportException;

    default List<String> list(String prefix) throws TransportException {
        return this.listObjects(prefix).stream().map(StorageObject::path).toList();
    }

    void delete(String remotePathOrUri) throws TransportException;

    SpaceInfo spaceInfo() throws TransportException;

    /**
     * Light probe. Object storage may create the bucket; filesystem backends create the base
     * directory and write a throwaway file.
     */
    ConnectionCheckResult testConnection();

    /**
     * Strips this backend's own scheme, host, bucket or base directory from a uri and returns the
     * backend relative path. A bare relative path is only normalized.
     */
    String toRelativePath(String remotePathOrUri);

    @Override
    default void close() {
        // nothing to release by default
    }
}
