package com.backupcenter.server.model.storage;

public record ConnectionCheckResult(boolean ok, String error) {

    public static ConnectionCheckResult success() {
        return new ConnectionCheckResult(true, null);
    }

    public static ConnectionCheckResult failed(String error) {
        return new ConnectionCheckResult(false, error);
    }
}
