package com.backupcenter.server.service.storage;

import com.backupcenter.server.enums.StorageTypeEnum;
import com.backupcenter.server.exception.TransportException;
import com.backupcenter.server.model.storage.ConnectionCheckResult;
import com.backupcenter.server.model.storage.SpaceInfo;
import com.backupcenter.server.model.storage.StorageObject;
import com.backupcenter.server.util.FilesystemUtil;
import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpATTRS;
import com.jcraft.jsch.SftpException;
import com.jcraft.jsch.SftpStatVFS;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Directory on an SSH server, reached over SFTP with either a password or a private key file. One
 * session is opened lazily and kept until {@link #close()}. Uris look like
 * {@code sftp://host/basePath/relative}.
 */
@Slf4j
@ToString(onlyExplicitlyIncluded = true)
public class SftpStorageBackend implements StorageBackend {

    public static final String SCHEME = "sftp://";

    private static final int CONNECT_TIMEOUT_MILLIS = 30_000;

    @ToString.Include
    private final String host;

    @ToString.Include
    private final int port;

    @ToString.Include
    private final String username;

    private final String password;

    private final String privateKeyPath;

    @ToString.Include
    private final String basePath;

    private final boolean strictHostKeyChecking;

    private Session session;

    private ChannelSftp channel;

    public SftpStorageBackend(
            String host,
            int port,
            String username,
            String password,
            String privateKeyPath,
            String basePath,
            boolean strictHostKeyChecking) {
        this.host = host;
        this.port = port;
        this.username = username;
        this.password = password;
        this.privateKeyPath = privateKeyPath;
        this.basePath = "/" + FilesystemUtil.normalizeRelativePath(basePath);
        this.strictHostKeyChecking = strictHostKeyChecking;
    }

    @Override
    public StorageTypeEnum getStorageType() {
        return StorageTypeEnum.SFTP;
    }

    @Override
    public synchronized String upload(Path localFile, String remotePath) throws TransportException {
        String relative = this.toRelativePath(remotePath);
        String fullPath = this.fullPath(relative);
        try {
            ChannelSftp sftp = this.connect();
            this.mkdirs(sftp, parentOf(fullPath));
            sftp.put(localFile.toString(), fullPath);
        } catch (JSchException | SftpException e) {
            throw new TransportException("upload %s to %s:%s failed".formatted(localFile, this.host, fullPath), e);
        }
        log.info("uploaded {} to sftp {}:{}", localFile.getFileName(), this.host, fullPath);
        return SCHEME + this.host + fullPath;
    }

    @Override
    public synchronized void download(String remotePathOrUri, Path localFile) throws TransportException {
        String fullPath = this.fullPath(this.toRelativePath(remotePathOrUri));
        try {
            Path parent = localFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.connect().get(fullPath, localFile.toString());
        } catch (JSchException | SftpException | IOException e) {
            throw new TransportException("download %s:%s failed".formatted(this.host, fullPath), e);
        }
    }

    @Override
    public synchronized List<StorageObject> listObjects(String prefix) throws TransportException {
        String normalizedPrefix = this.toRelativePath(prefix);
        int slash = normalizedPrefix.lastIndexOf('/');
        String startDir = slash < 0 ? "" : normalizedPrefix.substring(0, slash);
        List<StorageObject> result = new ArrayList<>();
        try {
            ChannelSftp sftp = this.connect();
            SftpATTRS prefixAttrs = this.statOrNull(sftp, this.fullPath(normalizedPrefix));
            if (prefixAttrs != null && prefixAttrs.isDir()) {
                startDir = normalizedPrefix;
            }
            if (this.statOrNull(sftp, this.fullPath(startDir)) == null) {
                return result;
            }
            // 以 / 结尾的 prefix 只匹配该目录下的文件
            String matchPrefix = prefix != null && prefix.endsWith("/") && !normalizedPrefix.isEmpty()
                    ? normalizedPrefix + "/"
                    : normalizedPrefix;
            this.walk(sftp, startDir, matchPrefix, result);
        } catch (JSchException | SftpException e) {
            throw new TransportException("list %s:%s failed".formatted(this.host, this.fullPath(startDir)), e);
        }
        return result;
    }

    @Override
    public synchronized void delete(String remotePathOrUri) throws TransportException {
        String fullPath = this.fullPath(this.toRelativePath(remotePathOrUri));
        try {
            ChannelSftp sftp = this.connect();
            if (this.statOrNull(sftp, fullPath) == null) {
                log.info("delete skipped. {}:{} does not exist", this.host, fullPath);
                return;
            }
            sftp.rm(fullPath);
        } catch (JSchException | SftpException e) {
            throw new TransportException("delete %s:%s failed".formatted(this.host, fullPath), e);
        }
    }

    @Override
    public synchronized SpaceInfo spaceInfo() throws TransportException {
        try {
            SftpStatVFS statVFS = this.connect().statVFS(this.basePath);
            long fragment = statVFS.getFragmentSize();
            long total = statVFS.getBlocks() * fragment;
            long free = statVFS.getAvailBlocks() * fragment;
            long used = (statVFS.getBlocks() - statVFS.getFreeBlocks()) * fragment;
            return new SpaceInfo(
                    FilesystemUtil.bytesToGb(used),
                    FilesystemUtil.bytesToGb(free),
                    FilesystemUtil.bytesToGb(total));
        } catch (JSchException | SftpException e) {
            throw new TransportException("statvfs %s:%s failed".formatted(this.host, this.basePath), e);
        }
    }

    @Override
    public synchronized ConnectionCheckResult testConnection() {
        try {
            ChannelSftp sftp = this.connect();
            this.mkdirs(sftp, this.basePath);
            String probe = this.fullPath(".probe-" + System.currentTimeMillis() + ".tmp");
            sftp.put(new ByteArrayInputStream(new byte[0]), probe);
            sftp.rm(probe);
            return ConnectionCheckResult.success();
        } catch (JSchException | SftpException e) {
            log.warn("testConnection failed. sftp {}:{}", this.host, this.basePath, e);
            return ConnectionCheckResult.failed("sftp %s@%s:%s failed. %s"
                    .formatted(this.username, this.host, this.basePath, e.getMessage()));
        }
    }

    @Override
    public String toRelativePath(String remotePathOrUri) {
        if (remotePathOrUri == null) {
            return "";
        }
        String path = remotePathOrUri;
        String hostPrefix = SCHEME + this.host;
        if (path.startsWith(hostPrefix + "/")) {
            path = path.substring(hostPrefix.length());
        }
        if (path.startsWith(this.basePath + "/")) {
            path = path.substring(this.basePath.length());
        }
        return FilesystemUtil.normalizeRelativePath(path);
    }

    @Override
    public synchronized void close() {
        if (this.channel != null) {
            this.channel.disconnect();
            this.channel = null;
        }
        if (this.session != null) {
            this.session.disconnect();
            this.session = null;
        }
    }

    private ChannelSftp connect() throws JSchException {
        if (this.channel != null && this.channel.isConnected()) {
            return this.channel;
        }
        this.close();
        JSch jsch = new JSch();
        if (StringUtils.isNotBlank(this.privateKeyPath)) {
            jsch.addIdentity(this.privateKeyPath);
        }
        Session newSession = jsch.getSession(this.username, this.host, this.port);
        if (StringUtils.isNotBlank(this.password)) {
            newSession.setPassword(this.password);
        }
        newSession.setConfig("StrictHostKeyChecking", this.strictHostKeyChecking ? "yes" : "no");
        newSession.connect(CONNECT_TIMEOUT_MILLIS);
        ChannelSftp newChannel = (ChannelSftp) newSession.openChannel("sftp");
        newChannel.connect(CONNECT_TIMEOUT_MILLIS);
        this.session = newSession;
        this.channel = newChannel;
        log.debug("sftp session opened. {}", this);
        return newChannel;
    }

    private void walk(ChannelSftp sftp, String relativeDir, String prefix, List<StorageObject> result)
            throws SftpException {
        for (ChannelSftp.LsEntry entry : sftp.ls(this.fullPath(relativeDir))) {
            String name = entry.getFilename();
            if (".".equals(name) || "..".equals(name)) {
                continue;
            }
            String relative = FilesystemUtil.joinPath(relativeDir, name);
            SftpATTRS attrs = entry.getAttrs();
            if (attrs.isDir()) {
                this.walk(sftp, relative, prefix, result);
            } else if (relative.startsWith(prefix)) {
                result.add(new StorageObject(
                        relative, Instant.ofEpochSecond(attrs.getMTime()), attrs.getSize()));
            }
        }
    }

    private void mkdirs(ChannelSftp sftp, String absoluteDir) throws SftpException {
        StringBuilder current = new StringBuilder();
        for (String segment : StringUtils.split(absoluteDir, '/')) {
            current.append('/').append(segment);
            String dir = current.toString();
            if (this.statOrNull(sftp, dir) == null) {
                sftp.mkdir(dir);
            }
        }
    }

    private SftpATTRS statOrNull(ChannelSftp sftp, String absolutePath) throws SftpException {
        try {
            return sftp.stat(absolutePath);
        } catch (SftpException e) {
            if (e.id == ChannelSftp.SSH_FX_NO_SUCH_FILE) {
                return null;
            }
            throw e;
        }
    }

    private String fullPath(String relative) {
        String normalized = FilesystemUtil.normalizeRelativePath(relative);
        if (normalized.isEmpty()) {
            return this.basePath;
        }
        return "/".equals(this.basePath) ? "/" + normalized : this.basePath + "/" + normalized;
    }

    private static String parentOf(String absolutePath) {
        int index = absolutePath.lastIndexOf('/');
        return index <= 0 ? "/" : absolutePath.substring(0, index);
    }
}
