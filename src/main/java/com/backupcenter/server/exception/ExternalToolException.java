package com.backupcenter.server.exception;

import lombok.EqualsAndHashCode;
import lombok.Getter;


// non-zero exit of pg_dump / pg_restore / psql / mount
@Getter
@EqualsAndHashCode(callSuper = false)
public class ExternalToolException extends BackupCenterException {

    private final Integer exitCode;

    public ExternalToolException(String message) {
        super(message);
        this.exitCode = null;
    }

    public ExternalToolException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = null;
    }

    public ExternalToolException(int exitCode, String message) {
        super(message);
        this.exitCode = exitCode;
    }
}
