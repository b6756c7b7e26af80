package com.backupcenter.server.exception;

import lombok.EqualsAndHashCode;


@EqualsAndHashCode(callSuper = false)
public class BackupCenterException extends RuntimeException {

    public BackupCenterException(String message) {
        super(message);
    }

    public BackupCenterException(Throwable cause) {
        super(cause);
    }

    public BackupCenterException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getBackupCenterMessage() {
        StringBuilder sb = new StringBuilder();
        buildMessageChain(this, sb, 0);
        return sb.toString();
    }

    // 递归构建完整的异常消息链
    private static void buildMessageChain(Throwable throwable, StringBuilder sb, int depth) {
        if (throwable == null || depth > 20) return;
        // <exception name> : <exception message> -> <next>
        sb.append("%s : %s -> ".formatted(
                throwable.getClass().getSimpleName(),
                throwable instanceof BackupCenterException ? throwable.getMessage() : throwable.toString()));
        buildMessageChain(throwable.getCause(), sb, depth + 1);
    }

    @Override
    public String toString() {
        return getBackupCenterMessage();
    }
}
