package com.backupcenter.server.service.storage;

import com.backupcenter.server.enums.StorageTypeEnum;
import com.backupcenter.server.exception.ExternalToolException;
import com.backupcenter.server.exception.TransportException;
import com.backupcenter.server.model.dump.CommandExecResult;
import com.backupcenter.server.model.storage.ConnectionCheckResult;
import com.backupcenter.server.model.storage.SpaceInfo;
import com.backupcenter.server.model.storage.StorageObject;
import com.backupcenter.server.service.command.ExternalCommandRunner;
import com.backupcenter.server.util.FilesystemUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.exec.CommandLine;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * NFS export mounted at {@code mountPoint}. When {@code premounted} is true the mount is managed
 * outside this process and no mount command is run. Uris look like
 * {@code nfs://server/export/basePath/relative}.
 */
@Slf4j
public class NfsStorageBackend implements StorageBackend {

    public static final String SCHEME = "nfs://";

    private static final Duration MOUNT_TIMEOUT = Duration.ofSeconds(60);

    private final String server;

    private final String exportPath;

    private final Path mountPoint;

    private final String basePath;

    private final String mountOptions;

    private final boolean premounted;

    private final ExternalCommandRunner commandRunner;

    private final FilesystemStore store;

    private volatile boolean mounted;

    public NfsStorageBackend(
            String server,
            String exportPath,
            Path mountPoint,
            String basePath,
            String mountOptions,
            boolean premounted,
            ExternalCommandRunner commandRunner) {
        this.server = server;
        this.exportPath = "/" + FilesystemUtil.normalizeRelativePath(exportPath);
        this.mountPoint = mountPoint.toAbsolutePath().normalize();
        this.basePath = FilesystemUtil.normalizeRelativePath(basePath);
        this.mountOptions = mountOptions;
        this.premounted = premounted;
        this.commandRunner = commandRunner;
        this.store = new FilesystemStore(this.basePath.isEmpty()
                ? this.mountPoint
                : this.mountPoint.resolve(this.basePath));
    }

    @Override
    public StorageTypeEnum getStorageType() {
        return StorageTypeEnum.NFS;
    }

    @Override
    public String upload(Path localFile, String remotePath) throws TransportException {
        this.ensureMounted();
        String relative = this.toRelativePath(remotePath);
        this.store.copyIn(localFile, relative);
        log.info("uploaded {} to nfs {}:{}", localFile.getFileName(), this.server, relative);
        return this.toUri(relative);
    }

    @Override
    public void download(String remotePathOrUri, Path localFile) throws TransportException {
        this.ensureMounted();
        this.store.copyOut(this.toRelativePath(remotePathOrUri), localFile);
    }

    @Override
    public List<StorageObject> listObjects(String prefix) throws TransportException {
        this.ensureMounted();
        return this.store.list(this.toRelativePath(prefix));
    }

    @Override
    public void delete(String remotePathOrUri) throws TransportException {
        this.ensureMounted();
        this.store.delete(this.toRelativePath(remotePathOrUri));
    }

    @Override
    public SpaceInfo spaceInfo() throws TransportException {
        this.ensureMounted();
        return this.store.spaceInfo();
    }

    @Override
    public ConnectionCheckResult testConnection() {
        try {
            this.ensureMounted();
            this.store.probeWrite();
            return ConnectionCheckResult.success();
        } catch (TransportException e) {
            log.warn("testConnection failed. nfs {}:{}", this.server, this.exportPath, e);
            return ConnectionCheckResult.failed(e.getBackupCenterMessage());
        } catch (IOException e) {
            log.warn("testConnection failed. nfs {}:{}", this.server, this.exportPath, e);
            return ConnectionCheckResult.failed("nfs path %s is not writable. %s"
                    .formatted(this.store.getRoot(), e.getMessage()));
        }
    }

    @Override
    public String toRelativePath(String remotePathOrUri) {
        if (remotePathOrUri == null) {
            return "";
        }
        String prefix = this.toUri("");
        String path = remotePathOrUri;
        if (path.startsWith(prefix)) {
            path = path.substring(prefix.length());
        } else if (path.startsWith(SCHEME)) {
            // 同一 server 不同 basePath 的 uri
            String serverPrefix = SCHEME + this.server + this.exportPath;
            path = path.startsWith(serverPrefix) ? path.substring(serverPrefix.length()) : path;
        }
        return FilesystemUtil.normalizeRelativePath(path);
    }

    private String toUri(String relative) {
        String joined = FilesystemUtil.joinPath(this.basePath, relative);
        return SCHEME + this.server + this.exportPath + (joined.isEmpty() ? "/" : "/" + joined);
    }

    private synchronized void ensureMounted() throws TransportException {
        if (this.mounted) {
            return;
        }
        if (this.premounted) {
            if (!Files.isDirectory(this.mountPoint)) {
                throw new TransportException("premounted nfs mount point %s does not exist"
                        .formatted(this.mountPoint));
            }
            this.mounted = true;
            return;
        }
        try {
            Files.createDirectories(this.mountPoint);
        } catch (IOException e) {
            throw new TransportException("create mount point %s failed".formatted(this.mountPoint), e);
        }
        // 1. 已经挂载则跳过
        CommandLine check = new CommandLine("mountpoint");
        check.addArgument("-q");
        check.addArgument(this.mountPoint.toString(), false);
        CommandExecResult checkResult = this.commandRunner.execute(check, Map.of(), MOUNT_TIMEOUT);
        if (checkResult.isSuccess()) {
            this.mounted = true;
            return;
        }
        // 2. 挂载
        CommandLine mount = new CommandLine("mount");
        mount.addArgument("-t");
        mount.addArgument("nfs");
        if (StringUtils.isNotBlank(this.mountOptions)) {
            mount.addArgument("-o");
            mount.addArgument(this.mountOptions, false);
        }
        mount.addArgument(this.server + ":" + this.exportPath, false);
        mount.addArgument(this.mountPoint.toString(), false);
        CommandExecResult mountResult = this.commandRunner.execute(mount, Map.of(), MOUNT_TIMEOUT);
        if (!mountResult.isSuccess()) {
            ExternalToolException cause = mountResult.getExternalToolException("mount");
            throw new TransportException("mount %s:%s at %s failed"
                    .formatted(this.server, this.exportPath, this.mountPoint), cause);
        }
        log.info("mounted nfs {}:{} at {}", this.server, this.exportPath, this.mountPoint);
        this.mounted = true;
    }
}
