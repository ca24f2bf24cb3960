package xyz.vvrf.reactor.build.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.build.core.Artifact;
import xyz.vvrf.reactor.build.core.CacheMissException;
import xyz.vvrf.reactor.build.core.CasIntegrityException;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.Digests;
import xyz.vvrf.reactor.build.test.util.InMemoryRemoteCacheClient;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TieredCacheTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @TempDir
    Path dir;

    private MemoryCacheTier memory;
    private DiskCacheTier disk;
    private InMemoryRemoteCacheClient remoteClient;
    private TieredCache cache;

    @BeforeEach
    void setUp() {
        memory = new MemoryCacheTier(1024 * 1024);
        disk = new DiskCacheTier(new DiskCacheStore(dir));
        remoteClient = new InMemoryRemoteCacheClient();
        RemoteCacheTier remote = new RemoteCacheTier(remoteClient, fastPolicy(false));
        cache = new TieredCache(Arrays.asList(memory, disk), remote);
    }

    static RemoteCacheTier.Policy fastPolicy(boolean required) {
        return new RemoteCacheTier.Policy(Duration.ofSeconds(1), 3, Duration.ofMillis(1), Duration.ofMillis(5), 0.0, required);
    }

    private static Digest node(String name) {
        return Digests.composer("test-node").putString(name).build();
    }

    @Test
    void putWritesAllLocalTiersAndUploads() {
        Digest key = node("a");
        Artifact artifact = Artifact.ofString("payload");

        cache.put(key, artifact).block(TIMEOUT);
        cache.drainUploads().block(TIMEOUT);

        assertEquals(Boolean.TRUE, memory.has(key).block(TIMEOUT));
        assertEquals(Boolean.TRUE, disk.has(key).block(TIMEOUT));
        assertTrue(remoteClient.containsAction(key));
        assertEquals(0, cache.getPendingUploadCount());
    }

    @Test
    void getShortCircuitsOnFirstHit() {
        Digest key = node("a");
        cache.put(key, Artifact.ofString("payload")).block(TIMEOUT);
        cache.drainUploads().block(TIMEOUT);
        int remoteCalls = remoteClient.getCalls();

        StepVerifier.create(cache.get(key))
                .assertNext(a -> assertEquals("payload", a.asString()))
                .verifyComplete();
        assertEquals(1, cache.getHits(MemoryCacheTier.NAME));
        assertEquals(remoteCalls, remoteClient.getCalls());
    }

    @Test
    void diskHitIsPromotedToMemory() {
        Digest key = node("a");
        disk.put(key, Artifact.ofString("from disk")).block(TIMEOUT);

        StepVerifier.create(cache.get(key))
                .assertNext(a -> assertEquals("from disk", a.asString()))
                .verifyComplete();
        assertEquals(1, cache.getHits(DiskCacheTier.NAME));
        assertEquals(Boolean.TRUE, memory.has(key).block(TIMEOUT));
    }

    @Test
    void remoteHitIsPromotedToEveryLocalTier() {
        Artifact artifact = Artifact.ofString("from remote");
        Digest key = node("a");
        remoteClient.putBlob(artifact.getContentDigest(), artifact.getBytes()).block(TIMEOUT);
        remoteClient.putAction(key, artifact.getContentDigest()).block(TIMEOUT);

        StepVerifier.create(cache.get(key))
                .assertNext(a -> assertEquals(artifact, a))
                .verifyComplete();
        assertEquals(1, cache.getHits(RemoteCacheTier.NAME));
        assertEquals(Boolean.TRUE, memory.has(key).block(TIMEOUT));
        assertEquals(Boolean.TRUE, disk.has(key).block(TIMEOUT));
    }

    @Test
    void hasPromotesRemoteEntries() {
        Artifact artifact = Artifact.ofString("remote only");
        Digest key = node("a");
        remoteClient.putBlob(artifact.getContentDigest(), artifact.getBytes()).block(TIMEOUT);
        remoteClient.putAction(key, artifact.getContentDigest()).block(TIMEOUT);

        StepVerifier.create(cache.has(key)).expectNext(true).verifyComplete();
        assertEquals(Boolean.TRUE, disk.has(key).block(TIMEOUT));
    }

    @Test
    void missInEveryTierRaisesCacheMiss() {
        StepVerifier.create(cache.get(node("missing")))
                .expectError(CacheMissException.class)
                .verify(TIMEOUT);
        assertEquals(1, cache.getMisses());
        StepVerifier.create(cache.has(node("missing"))).expectNext(false).verifyComplete();
    }

    @Test
    void tamperedRemoteContentIsRejectedAndNeverPromoted() {
        Artifact artifact = Artifact.ofString("genuine");
        Digest key = node("a");
        remoteClient.seedUnchecked(key, artifact.getContentDigest(), "forged".getBytes());

        StepVerifier.create(cache.get(key))
                .expectErrorSatisfies(e -> {
                    assertTrue(e instanceof CasIntegrityException);
                    assertEquals(artifact.getContentDigest(), ((CasIntegrityException) e).getExpected());
                })
                .verify(TIMEOUT);
        assertEquals(Boolean.FALSE, memory.has(key).block(TIMEOUT));
        assertEquals(Boolean.FALSE, disk.has(key).block(TIMEOUT));
    }

    @Test
    void corruptDiskBlobFailsReadAndIsRemoved() throws Exception {
        Digest key = node("a");
        Artifact artifact = Artifact.ofString("on disk");
        disk.put(key, artifact).block(TIMEOUT);
        Files.write(disk.getStore().blobPath(artifact.getContentDigest()), "rotten".getBytes());

        StepVerifier.create(cache.get(key))
                .expectError(CasIntegrityException.class)
                .verify(TIMEOUT);
        assertFalse(disk.getStore().containsBlob(artifact.getContentDigest()));
    }

    @Test
    void unavailableRemoteDegradesToMiss() {
        remoteClient.setUnavailable(true);

        StepVerifier.create(cache.get(node("a")))
                .expectError(CacheMissException.class)
                .verify(TIMEOUT);

        Digest key = node("b");
        AtomicReference<Throwable> failure = new AtomicReference<>();
        StepVerifier.create(cache.put(key, Artifact.ofString("local"), failure::set)).verifyComplete();
        cache.drainUploads().block(TIMEOUT);

        assertEquals(1, cache.getUploadFailures());
        assertNotNull(failure.get());
        assertEquals(Boolean.TRUE, memory.has(key).block(TIMEOUT));
        assertEquals(Boolean.TRUE, disk.has(key).block(TIMEOUT));
    }

    @Test
    void requiredRemoteSurfacesNetworkErrors() {
        remoteClient.setUnavailable(true);
        TieredCache strict = new TieredCache(Arrays.asList(memory, disk), new RemoteCacheTier(remoteClient, fastPolicy(true)));

        StepVerifier.create(strict.get(node("a")))
                .expectErrorMatches(e -> !(e instanceof CacheMissException))
                .verify(TIMEOUT);
    }

    @Test
    void artifactWithWrongDeclaredDigestIsNotStored() {
        Digest key = node("a");
        Artifact forged = Artifact.declared(Digests.ofString("something else"), "content".getBytes());

        StepVerifier.create(cache.put(key, forged))
                .expectError(CasIntegrityException.class)
                .verify(TIMEOUT);
        assertEquals(Boolean.FALSE, memory.has(key).block(TIMEOUT));
        assertEquals(0, remoteClient.blobCount());
    }

    @Test
    void prefetchCopiesRemoteEntriesToSlowestLocalTier() {
        Artifact first = Artifact.ofString("one");
        Artifact second = Artifact.ofString("two");
        List<Digest> keys = Arrays.asList(node("one"), node("two"), node("absent"));
        remoteClient.putBlob(first.getContentDigest(), first.getBytes())
                .then(remoteClient.putAction(keys.get(0), first.getContentDigest()))
                .then(remoteClient.putBlob(second.getContentDigest(), second.getBytes()))
                .then(remoteClient.putAction(keys.get(1), second.getContentDigest()))
                .block(TIMEOUT);

        StepVerifier.create(cache.prefetch(keys)).expectNext(2L).verifyComplete();
        assertEquals(Boolean.TRUE, disk.has(keys.get(0)).block(TIMEOUT));
        assertEquals(Boolean.FALSE, memory.has(keys.get(0)).block(TIMEOUT));
    }

    @Test
    void localOnlyCacheHasNoRemoteTier() {
        TieredCache local = new TieredCache(Arrays.asList(memory, disk), null);
        assertFalse(local.hasRemoteTier());
        StepVerifier.create(local.prefetch(Arrays.asList(node("a")))).expectNext(0L).verifyComplete();
        StepVerifier.create(local.drainUploads()).verifyComplete();
    }
}
