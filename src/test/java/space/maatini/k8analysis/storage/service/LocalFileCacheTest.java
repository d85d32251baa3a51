package space.maatini.k8analysis.storage.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import space.maatini.k8analysis.common.exception.BatchTransferException;
import space.maatini.k8analysis.common.exception.InvalidPathException;
import space.maatini.k8analysis.common.exception.LocalFileMissingException;
import space.maatini.k8analysis.common.exception.NotFoundException;
import space.maatini.k8analysis.common.exception.RemoteAlreadyExistsException;
import space.maatini.k8analysis.storage.client.ObjectStoreClient;
import space.maatini.k8analysis.storage.model.BucketPath;
import space.maatini.k8analysis.storage.model.TransferStatus;
import space.maatini.k8analysis.testutil.FsObjectStoreClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for LocalFileCache.
 */
class LocalFileCacheTest {

    private static final BucketPath FIRST = BucketPath.parse("gs://bucket/in/a.fastq.gz");
    private static final BucketPath SECOND = BucketPath.parse("gs://bucket/in/b.fastq.gz");
    private static final BucketPath THIRD = BucketPath.parse("gs://bucket/in/c.fastq.gz");

    @TempDir
    Path tempDir;

    private FsObjectStoreClient store;
    private LocalFileCache cache;

    @BeforeEach
    void setUp() {
        store = new FsObjectStoreClient(tempDir.resolve("remote"));
        cache = new LocalFileCache(tempDir.resolve("cache"), store);
    }

    // ==================== localPathFor ====================

    @Test
    void testLocalPathFor_MirrorsBucketLayout() {
        assertEquals(tempDir.resolve("cache/bucket/in/a.fastq.gz"), cache.localPathFor(FIRST));
        assertEquals(tempDir.resolve("cache/bucket"), cache.localPathFor(BucketPath.parse("gs://bucket")));
        assertFalse(Files.exists(cache.localPathFor(FIRST)));
    }

    @Test
    void testLocalPathFor_RejectsAliasingSegments() {
        store.put(BucketPath.parse("gs://bucket/x/y"), "content of x/y");
        cache.downloadOne(BucketPath.parse("gs://bucket/x/y"));

        for (String key : List.of("x//y", "./x/y", "x/./y", "../bucket/x/y", "x/..", "x//")) {
            BucketPath aliased = new BucketPath("bucket", key);
            InvalidPathException exception = assertThrows(InvalidPathException.class,
                    () -> cache.downloadOne(aliased));
            assertEquals(aliased.toString(), exception.getPath());
        }
        assertEquals(List.of(BucketPath.parse("gs://bucket/x/y")), store.getDownloads());
    }

    @Test
    void testLocalPathFor_TrailingSlashIsDirectory() {
        assertEquals(tempDir.resolve("cache/bucket/ref"), cache.localPathFor(BucketPath.parse("gs://bucket/ref/")));
    }

    // ==================== downloadOne ====================

    @Test
    void testDownloadOne_ThenSkip() throws IOException {
        store.put(FIRST, "@read1\nACGT\n");

        assertEquals(TransferStatus.SUCCESS, cache.downloadOne(FIRST));
        assertEquals(TransferStatus.SKIP, cache.downloadOne(FIRST));

        assertEquals("@read1\nACGT\n", Files.readString(cache.localPathFor(FIRST)));
        assertEquals(List.of(FIRST), store.getDownloads());
    }

    @Test
    void testDownloadOne_Missing() {
        assertThrows(NotFoundException.class, () -> cache.downloadOne(FIRST));
        assertFalse(Files.exists(cache.localPathFor(FIRST)));
    }

    // ==================== uploadOne ====================

    @Test
    void testUploadOne_Success() throws IOException {
        BucketPath output = BucketPath.parse("gs://bucket/out/x.bam");
        Path local = cache.localPathFor(output);
        Files.createDirectories(local.getParent());
        Files.writeString(local, "bam");

        assertEquals(TransferStatus.SUCCESS, cache.uploadOne(output));
        assertEquals("bam", store.read(output));
    }

    @Test
    void testUploadOne_RemoteExistsIsNeverOverwritten() {
        ObjectStoreClient client = mock(ObjectStoreClient.class);
        when(client.exists(FIRST)).thenReturn(true);
        LocalFileCache mockedCache = new LocalFileCache(tempDir.resolve("cache"), client);

        RemoteAlreadyExistsException exception = assertThrows(RemoteAlreadyExistsException.class,
                () -> mockedCache.uploadOne(FIRST));

        assertEquals(FIRST, exception.getPath());
        verify(client, never()).upload(any(), any());
    }

    @Test
    void testUploadOne_LocalMissing() {
        assertThrows(LocalFileMissingException.class, () -> cache.uploadOne(FIRST));
    }

    // ==================== Batches ====================

    @Test
    void testDownloadMany_Empty() {
        ObjectStoreClient client = mock(ObjectStoreClient.class);

        new LocalFileCache(tempDir.resolve("cache"), client).downloadMany(List.of());

        verifyNoInteractions(client);
    }

    @Test
    void testDownloadMany_AllFiles() {
        store.put(FIRST, "1");
        store.put(SECOND, "2");

        cache.downloadMany(List.of(SECOND, FIRST, SECOND));

        assertTrue(Files.exists(cache.localPathFor(FIRST)));
        assertTrue(Files.exists(cache.localPathFor(SECOND)));
        assertEquals(2, store.getDownloads().size());
    }

    @Test
    void testDownloadMany_OneMissing_OthersStillArrive() {
        store.put(FIRST, "1");
        store.put(THIRD, "3");

        BatchTransferException exception = assertThrows(BatchTransferException.class,
                () -> cache.downloadMany(List.of(FIRST, SECOND, THIRD)));

        assertEquals(1, exception.getFailures().size());
        assertInstanceOf(NotFoundException.class, exception.getFailures().get(0));
        assertEquals(3, store.getDownloads().size());
        assertTrue(Files.exists(cache.localPathFor(FIRST)));
        assertFalse(Files.exists(cache.localPathFor(SECOND)));
        assertTrue(Files.exists(cache.localPathFor(THIRD)));
    }

    @Test
    void testDownloadMany_SeveralMissing_AllReported() {
        store.put(FIRST, "1");

        BatchTransferException exception = assertThrows(BatchTransferException.class,
                () -> cache.downloadMany(List.of(FIRST, SECOND, THIRD)));

        assertEquals(2, exception.getFailures().size());
        assertTrue(Files.exists(cache.localPathFor(FIRST)));
    }

    @Test
    void testUploadMany() throws IOException {
        BucketPath bam = BucketPath.parse("gs://bucket/out/x.bam");
        BucketPath index = bam.withSuffix(".bai");
        for (BucketPath path : List.of(bam, index)) {
            Path local = cache.localPathFor(path);
            Files.createDirectories(local.getParent());
            Files.writeString(local, path.getFileName());
        }

        cache.uploadMany(List.of(bam, index));

        assertEquals("x.bam", store.read(bam));
        assertEquals("x.bam.bai", store.read(index));
    }

    @Test
    void testUploadMany_ExistingRemoteFailsBatch() throws IOException {
        BucketPath bam = BucketPath.parse("gs://bucket/out/x.bam");
        BucketPath index = bam.withSuffix(".bai");
        store.put(index, "old index");
        for (BucketPath path : List.of(bam, index)) {
            Path local = cache.localPathFor(path);
            Files.createDirectories(local.getParent());
            Files.writeString(local, "new");
        }

        BatchTransferException exception = assertThrows(BatchTransferException.class,
                () -> cache.uploadMany(List.of(bam, index)));

        assertInstanceOf(RemoteAlreadyExistsException.class, exception.getFailures().get(0));
        assertEquals("new", store.read(bam));
        assertEquals("old index", store.read(index));
    }
}
