package com.backupcenter.server.model.storage;

// object storage 没有配额接口, freeGb 和 totalGb 可能为 null
public record SpaceInfo(Double usedGb, Double freeGb, Double totalGb) {
}
