package com.backupcenter.server.service.storage;

import com.backupcenter.server.enums.StorageTypeEnum;
import com.backupcenter.server.exception.TransportException;
import com.backupcenter.server.model.storage.ConnectionCheckResult;
import com.backupcenter.server.model.storage.SpaceInfo;
import com.backupcenter.server.model.storage.StorageObject;
import com.backupcenter.server.util.FilesystemUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Directory on the server's own filesystem. Uris look like {@code local:///var/backups/orders/a.dump}.
 */
@Slf4j
public class LocalStorageBackend implements StorageBackend {

    public static final String SCHEME = "local://";

    private final FilesystemStore store;

    public LocalStorageBackend(Path basePath) {
        this.store = new FilesystemStore(basePath);
    }

    @Override
    public StorageTypeEnum getStorageType() {
        return StorageTypeEnum.LOCAL;
    }

    @Override
    public String upload(Path localFile, String remotePath) throws TransportException {
        Path target = this.store.copyIn(localFile, this.toRelativePath(remotePath));
        log.info("uploaded {} to {}", localFile.getFileName(), target);
        return SCHEME + target;
    }

    @Override
    public void download(String remotePathOrUri, Path localFile) throws TransportException {
        this.store.copyOut(this.toRelativePath(remotePathOrUri), localFile);
    }

    @Override
    public List<StorageObject> listObjects(String prefix) throws TransportException {
        return this.store.list(this.toRelativePath(prefix));
    }

    @Override
    public void delete(String remotePathOrUri) throws TransportException {
        this.store.delete(this.toRelativePath(remotePathOrUri));
    }

    @Override
    public SpaceInfo spaceInfo() throws TransportException {
        return this.store.spaceInfo();
    }

    @Override
    public ConnectionCheckResult testConnection() {
        try {
            this.store.probeWrite();
            return ConnectionCheckResult.success();
        } catch (IOException e) {
            log.warn("testConnection failed. basePath is {}", this.store.getRoot(), e);
            return ConnectionCheckResult.failed("basePath %s is not writable. %s"
                    .formatted(this.store.getRoot(), e.getMessage()));
        }
    }

    @Override
    public String toRelativePath(String remotePathOrUri) {
        if (remotePathOrUri == null) {
            return "";
        }
        String path = remotePathOrUri.startsWith(SCHEME)
                ? remotePathOrUri.substring(SCHEME.length())
                : remotePathOrUri;
        Path candidate = Path.of(path);
        if (candidate.isAbsolute()) {
            Path normalized = candidate.normalize();
            if (normalized.startsWith(this.store.getRoot())) {
                return this.store.relativize(normalized);
            }
        }
        return FilesystemUtil.normalizeRelativePath(path);
    }
}
