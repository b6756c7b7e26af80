package com.backupcenter.server.service.storage;

import com.backupcenter.server.exception.TransportException;
import com.backupcenter.server.model.storage.ConnectionCheckResult;
import com.backupcenter.server.model.storage.SpaceInfo;
import com.backupcenter.server.model.storage.StorageObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageBackendTest {

    @TempDir
    Path tempDir;

    private Path root;

    private LocalStorageBackend backend;

    private Path artifact;

    @BeforeEach
    void setUp() throws IOException {
        this.root = this.tempDir.resolve("storage");
        this.backend = new LocalStorageBackend(this.root);
        this.artifact = Files.writeString(this.tempDir.resolve("orders.dump"), "dump-content");
    }

    @Test
    void ShouldReturnLocalUriWhenUploaded() {
        String uri = this.backend.upload(this.artifact, "backups/orders/orders_20240101000000.dump");

        Path stored = this.root.toAbsolutePath().normalize().resolve("backups/orders/orders_20240101000000.dump");
        assertEquals(LocalStorageBackend.SCHEME + stored, uri);
        assertTrue(Files.exists(stored));
        assertEquals("backups/orders/orders_20240101000000.dump", this.backend.toRelativePath(uri));
    }

    @Test
    void ShouldDownloadContentWhenGivenUri() throws IOException {
        String uri = this.backend.upload(this.artifact, "backups/orders/a.dump");
        Path target = this.tempDir.resolve("restore/a.dump");

        this.backend.download(uri, target);

        assertEquals("dump-content", Files.readString(target));
    }

    @Test
    void ShouldListOnlyUnderPrefixWhenSiblingsShareName() {
        this.backend.upload(this.artifact, "backups/orders/a.dump");
        this.backend.upload(this.artifact, "backups/orders/nested/b.dump");
        this.backend.upload(this.artifact, "backups/orders_archive/c.dump");

        List<StorageObject> objects = this.backend.listObjects("backups/orders/");

        assertEquals(2, objects.size());
        assertTrue(this.backend.list("backups/orders/").contains("backups/orders/nested/b.dump"));
        objects.forEach(object -> {
            assertNotNull(object.lastModified());
            assertEquals(12, object.sizeBytes());
        });
        assertTrue(this.backend.listObjects("missing/").isEmpty());
    }

    @Test
    void ShouldBeNoOpWhenDeletingMissingObject() {
        String uri = this.backend.upload(this.artifact, "backups/orders/a.dump");
        this.backend.delete(uri);
        assertTrue(this.backend.listObjects("backups/").isEmpty());
        assertDoesNotThrow(() -> this.backend.delete("backups/orders/a.dump"));
    }

    @Test
    void ShouldRejectPathWhenEscapingRoot() {
        assertThrows(TransportException.class, () -> this.backend.upload(this.artifact, "../outside.dump"));
    }

    @Test
    void ShouldReportSpaceAndConnectionWhenDirectoryWritable() {
        ConnectionCheckResult result = this.backend.testConnection();
        assertTrue(result.ok());
        assertNull(result.error());

        SpaceInfo spaceInfo = this.backend.spaceInfo();
        assertNotNull(spaceInfo.totalGb());
        assertNotNull(spaceInfo.freeGb());
    }
}
