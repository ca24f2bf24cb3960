package xyz.vvrf.reactor.build.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.vvrf.reactor.build.core.CacheMissException;
import xyz.vvrf.reactor.build.core.CasIntegrityException;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.Digests;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class DiskCacheStoreTest {

    @TempDir
    Path dir;

    private DiskCacheStore store;

    @BeforeEach
    void setUp() {
        store = new DiskCacheStore(dir);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void blobsAreShardedByDigestPrefix() {
        Digest digest = Digests.ofString("hello");
        CacheEntry entry = store.writeBlob(digest, bytes("hello"));
        String hex = digest.hex();
        assertEquals(dir.toAbsolutePath().resolve("cas").resolve(hex.substring(0, 2)).resolve(hex.substring(2, 4)).resolve(hex),
                entry.getLocation());
        assertEquals(5, entry.getSize());
        assertTrue(store.containsBlob(digest));
        assertArrayEquals(bytes("hello"), store.readBlob(digest).orElseThrow(IllegalStateException::new));
    }

    @Test
    void mismatchingUploadIsRejectedAndInvisible() {
        Digest claimed = Digests.ofString("expected");
        CasIntegrityException e = assertThrows(CasIntegrityException.class, () -> store.writeBlob(claimed, bytes("tampered")));
        assertEquals(claimed, e.getExpected());
        assertEquals(Digests.ofString("tampered"), e.getActual());
        assertTrue(e.isIntegrityViolation());
        assertFalse(store.containsBlob(claimed));
        assertFalse(store.readBlob(claimed).isPresent());
    }

    @Test
    void existingBlobMakesWriteNoOp() throws IOException {
        Digest digest = Digests.ofString("same");
        store.writeBlob(digest, bytes("same"));
        FileTime before = Files.getLastModifiedTime(store.blobPath(digest));
        store.writeBlob(digest, bytes("same"));
        assertEquals(before, Files.getLastModifiedTime(store.blobPath(digest)));
    }

    @Test
    void corruptBlobIsDetectedAndDeleted() throws IOException {
        Digest digest = Digests.ofString("original");
        store.writeBlob(digest, bytes("original"));
        Files.write(store.blobPath(digest), bytes("bit rot"));

        assertThrows(CasIntegrityException.class, () -> store.readBlob(digest));
        assertFalse(store.containsBlob(digest));
    }

    @Test
    void actionRequiresStoredBlob() {
        Digest node = Digests.ofString("node");
        Digest content = Digests.ofString("content");
        assertThrows(CacheMissException.class, () -> store.writeAction(node, content));

        store.writeBlob(content, bytes("content"));
        store.writeAction(node, content);
        assertEquals(content, store.readAction(node).orElseThrow(IllegalStateException::new));
        assertArrayEquals(bytes("content"), store.readArtifact(node).orElseThrow(IllegalStateException::new));
    }

    @Test
    void firstActionWriterWins() {
        Digest node = Digests.ofString("node");
        Digest first = Digests.ofString("first");
        Digest second = Digests.ofString("second");
        store.writeBlob(first, bytes("first"));
        store.writeBlob(second, bytes("second"));
        store.writeAction(node, first);
        store.writeAction(node, second);
        assertEquals(first, store.readAction(node).orElseThrow(IllegalStateException::new));
    }

    @Test
    void concurrentWritersProduceOneIntactBlob() throws Exception {
        byte[] payload = new byte[256 * 1024];
        for (int i = 0; i < payload.length; i++) {
            payload[i] = (byte) (i * 31);
        }
        Digest digest = Digests.ofContent(payload);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<CacheEntry>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return store.writeBlob(digest, payload);
                }));
            }
            start.countDown();
            for (Future<CacheEntry> future : futures) {
                assertEquals(payload.length, future.get(10, TimeUnit.SECONDS).getSize());
            }
        } finally {
            pool.shutdownNow();
        }
        assertArrayEquals(payload, store.readBlob(digest).orElseThrow(IllegalStateException::new));
        try (Stream<Path> tmp = Files.list(dir.resolve("tmp"))) {
            assertEquals(0, tmp.count());
        }
    }

    @Test
    void garbageCollectionByAgeAndSize() throws IOException {
        Digest old = Digests.ofString("old");
        Digest mid = Digests.ofString("middle");
        Digest fresh = Digests.ofString("fresh!");
        store.writeBlob(old, bytes("old"));
        store.writeBlob(mid, bytes("middle"));
        store.writeBlob(fresh, bytes("fresh!"));
        Digest node = Digests.ofString("node");
        store.writeAction(node, old);

        Instant now = Instant.now();
        Files.setLastModifiedTime(store.blobPath(old), FileTime.from(now.minus(Duration.ofDays(30))));
        Files.setLastModifiedTime(store.blobPath(mid), FileTime.from(now.minus(Duration.ofHours(2))));

        GcStats byAge = store.collectGarbage(Duration.ofDays(7), 0);
        assertEquals(3, byAge.getScanned());
        assertEquals(1, byAge.getDeletedBlobs());
        assertEquals(1, byAge.getDeletedActions());
        assertFalse(store.containsBlob(old));
        assertFalse(store.readAction(node).isPresent());

        GcStats bySize = store.collectGarbage(null, 6);
        assertEquals(1, bySize.getDeletedBlobs());
        assertFalse(store.containsBlob(mid));
        assertTrue(store.containsBlob(fresh));
        assertEquals(6, bySize.getRemainingBytes());
        assertEquals(6, store.totalSize());
    }
}
