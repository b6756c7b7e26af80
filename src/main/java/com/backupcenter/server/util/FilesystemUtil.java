package com.backupcenter.server.util;

import com.backupcenter.server.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.file.Path;

@Slf4j
public class FilesystemUtil {

    private static final double BYTES_PER_MB = 1024d * 1024d;

    private static final double BYTES_PER_GB = 1024d * 1024d * 1024d;

    public static double bytesToMb(long bytes) {
        return round2(bytes / BYTES_PER_MB);
    }

    public static double bytesToGb(long bytes) {
        return round2(bytes / BYTES_PER_GB);
    }

    // 数据库名中的路径分隔符替换为 _
    public static String sanitizeName(String name) throws ValidationException {
        if (StringUtils.isBlank(name)) {
            throw new ValidationException("sanitizeName failed. name is blank");
        }
        return name.trim().replace('/', '_').replace('\\', '_');
    }

    /**
     * Normalizes a backend relative path: backslashes become slashes, leading and trailing slashes
     * are removed and empty segments are collapsed. A blank input yields "".
     */
    public static String normalizeRelativePath(String path) {
        if (StringUtils.isBlank(path)) {
            return "";
        }
        String[] segments = StringUtils.split(path.replace('\\', '/'), '/');
        return String.join("/", segments);
    }

    public static String joinPath(String first, String... more) {
        StringBuilder sb = new StringBuilder(normalizeRelativePath(first));
        for (String part : more) {
            String normalized = normalizeRelativePath(part);
            if (normalized.isEmpty()) {
                continue;
            }
            if (!sb.isEmpty()) {
                sb.append('/');
            }
            sb.append(normalized);
        }
        return sb.toString();
    }

    public static String fileName(String path) {
        return FilenameUtils.getName(normalizeRelativePath(path));
    }

    // best effort, 失败只记录日志
    public static boolean deleteDirectoryQuietly(Path dir) {
        if (dir == null) {
            return true;
        }
        try {
            FileUtils.deleteDirectory(dir.toFile());
            return true;
        } catch (IOException e) {
            log.warn("deleteDirectoryQuietly failed. dir is {}", dir, e);
            return false;
        }
    }

    private static double round2(double value) {
        return Math.round(value * 100d) / 100d;
    }
}
