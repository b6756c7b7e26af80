package com.backupcenter.server.model.dump;

/**
 * Outcome of a dump that reached the storage backend.
 *
 * @param artifactFilename file name only, e.g. orders_20240101020000.dump
 * @param storagePath      backend relative path, e.g. backups/orders/orders_20240101020000.dump
 * @param storageUri       scheme qualified uri returned by the backend
 * @param sizeMb           artifact size in MB
 */
public record DumpResult(String artifactFilename, String storagePath, String storageUri, double sizeMb) {
}
