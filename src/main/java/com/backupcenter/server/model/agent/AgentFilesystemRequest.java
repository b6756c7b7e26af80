package com.backupcenter.server.model.agent;

public record AgentFilesystemRequest(String path) {
}
