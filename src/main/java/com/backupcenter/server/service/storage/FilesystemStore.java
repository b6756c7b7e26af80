package com.backupcenter.server.service.storage;

import com.backupcenter.server.exception.TransportException;
import com.backupcenter.server.model.storage.SpaceInfo;
import com.backupcenter.server.model.storage.StorageObject;
import com.backupcenter.server.util.FilesystemUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

// 本地目录和 NFS 挂载点共用的文件操作, 根目录之外的路径一律拒绝
@Slf4j
class FilesystemStore {

    private final Path root;

    FilesystemStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    Path getRoot() {
        return this.root;
    }

    Path resolve(String relativePath) throws TransportException {
        Path resolved = this.root.resolve(FilesystemUtil.normalizeRelativePath(relativePath)).normalize();
        if (!resolved.startsWith(this.root)) {
            throw new TransportException("path %s escapes storage root %s".formatted(relativePath, this.root));
        }
        return resolved;
    }

    String relativize(Path absolutePath) {
        return this.root.relativize(absolutePath.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    Path copyIn(Path localFile, String relativePath) throws TransportException {
        Path target = this.resolve(relativePath);
        try {
            Files.createDirectories(target.getParent());
            Files.copy(localFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            return target;
        } catch (IOException e) {
            throw new TransportException("copy %s to %s failed".formatted(localFile, target), e);
        }
    }

    void copyOut(String relativePath, Path localFile) throws TransportException {
        Path source = this.resolve(relativePath);
        try {
            Path parent = localFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.copy(source, localFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new TransportException("copy %s to %s failed".formatted(source, localFile), e);
        }
    }

    List<StorageObject> list(String prefix) throws TransportException {
        String normalizedPrefix = FilesystemUtil.normalizeRelativePath(prefix);
        // 以 / 结尾的 prefix 只匹配该目录下的文件
        String matchPrefix = prefix != null && prefix.endsWith("/") && !normalizedPrefix.isEmpty()
                ? normalizedPrefix + "/"
                : normalizedPrefix;
        // prefix 可能是目录, 也可能是文件名前缀, 从最近的目录开始遍历
        int slash = normalizedPrefix.lastIndexOf('/');
        Path start = this.resolve(slash < 0 ? "" : normalizedPrefix.substring(0, slash));
        if (Files.isDirectory(this.resolve(normalizedPrefix))) {
            start = this.resolve(normalizedPrefix);
        }
        List<StorageObject> result = new ArrayList<>();
        if (!Files.isDirectory(start)) {
            return result;
        }
        try (Stream<Path> stream = Files.walk(start)) {
            for (Path file : (Iterable<Path>) stream.filter(Files::isRegularFile)::iterator) {
                String relative = this.relativize(file);
                if (!relative.startsWith(matchPrefix)) {
                    continue;
                }
                BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
                result.add(new StorageObject(
                        relative, attributes.lastModifiedTime().toInstant(), attributes.size()));
            }
        } catch (IOException e) {
            throw new TransportException("list %s failed".formatted(start), e);
        }
        return result;
    }

    void delete(String relativePath) throws TransportException {
        Path target = this.resolve(relativePath);
        try {
            Files.delete(target);
        } catch (NoSuchFileException e) {
            log.info("delete skipped. {} does not exist", target);
        } catch (IOException e) {
            throw new TransportException("delete %s failed".formatted(target), e);
        }
    }

    SpaceInfo spaceInfo() throws TransportException {
        try {
            FileStore fileStore = Files.getFileStore(this.root);
            long total = fileStore.getTotalSpace();
            long free = fileStore.getUsableSpace();
            return new SpaceInfo(
                    FilesystemUtil.bytesToGb(total - free),
                    FilesystemUtil.bytesToGb(free),
                    FilesystemUtil.bytesToGb(total));
        } catch (IOException e) {
            throw new TransportException("spaceInfo of %s failed".formatted(this.root), e);
        }
    }

    void probeWrite() throws IOException {
        Files.createDirectories(this.root);
        Path probe = Files.createTempFile(this.root, ".probe-", ".tmp");
        Files.delete(probe);
    }
}
