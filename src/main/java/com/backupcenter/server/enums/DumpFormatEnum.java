package com.backupcenter.server.enums;

import com.backupcenter.server.exception.ValidationException;
import lombok.Getter;

@Getter
public enum DumpFormatEnum {

    CUSTOM("custom", "dump"),

    PLAIN("plain", "sql"),

    TAR("tar", "tar")
    ;

    private final String name;

    private final String extension;

    DumpFormatEnum(String name, String extension) {
        this.name = name;
        this.extension = extension;
    }

    public static DumpFormatEnum fromName(String name) throws ValidationException {
        for (DumpFormatEnum value : values()) {
            if (value.name.equalsIgnoreCase(name)) {
                return value;
            }
        }
        throw new ValidationException("unsupported dump format %s".formatted(name));
    }

    // dump 和 tar 走 pg_restore, 其余当作纯 SQL 交给 psql
    public static boolean isArchiveFile(String filename) {
        if (filename == null) {
            return false;
        }
        String lower = filename.toLowerCase();
        return lower.endsWith("." + CUSTOM.extension) || lower.endsWith("." + TAR.extension);
    }
}
