package com.backupcenter.server.service.storage;

import com.backupcenter.server.exception.ValidationException;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * Typed read access over a storage config's {@code configData} map. Snake case keys written by older
 * clients (access_key, bucket_name, base_path ...) are read under their camel case names.
 */
public class StorageConfigData {

    private static final Map<String, String> LEGACY_KEYS = Map.of(
            "access_key", "accessKey",
            "secret_key", "secretKey",
            "bucket_name", "bucket",
            "use_ssl", "useSsl",
            "base_path", "basePath",
            "private_key", "privateKeyPath",
            "export_path", "exportPath",
            "mount_point", "mountPoint",
            "strict_host_key_checking", "strictHostKeyChecking"
    );

    private final Map<String, Object> data;

    public StorageConfigData(Map<String, Object> configData) {
        this.data = new HashMap<>();
        if (configData == null) {
            return;
        }
        configData.forEach((key, value) -> this.data.put(LEGACY_KEYS.getOrDefault(key, key), value));
    }

    public boolean has(String key) {
        Object value = this.data.get(key);
        return ObjectUtils.isNotEmpty(value) && StringUtils.isNotBlank(value.toString());
    }

    public String getString(String key) {
        Object value = this.data.get(key);
        return value == null ? null : value.toString().trim();
    }

    public String getString(String key, String defaultValue) {
        return this.has(key) ? this.getString(key) : defaultValue;
    }

    public String requireString(String key) throws ValidationException {
        if (!this.has(key)) {
            throw new ValidationException("storage config key %s is required".formatted(key));
        }
        return this.getString(key);
    }

    public int getInt(String key, int defaultValue) throws ValidationException {
        if (!this.has(key)) {
            return defaultValue;
        }
        Object value = this.data.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("storage config key %s is not a number".formatted(key), e);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        if (!this.has(key)) {
            return defaultValue;
        }
        Object value = this.data.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }
}
