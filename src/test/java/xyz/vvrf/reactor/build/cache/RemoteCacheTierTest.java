package xyz.vvrf.reactor.build.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.build.cache.remote.RemoteCacheClient;
import xyz.vvrf.reactor.build.core.Artifact;
import xyz.vvrf.reactor.build.core.CasIntegrityException;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.Digests;
import xyz.vvrf.reactor.build.core.NetworkException;
import xyz.vvrf.reactor.build.test.util.InMemoryRemoteCacheClient;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RemoteCacheTierTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private InMemoryRemoteCacheClient client;
    private RemoteCacheTier tier;

    @BeforeEach
    void setUp() {
        client = new InMemoryRemoteCacheClient();
        tier = new RemoteCacheTier(client, TieredCacheTest.fastPolicy(false));
    }

    private static Digest node(String name) {
        return Digests.composer("test-node").putString(name).build();
    }

    @Test
    void putThenGetRoundTrips() {
        Artifact artifact = Artifact.ofString("remote payload");
        Digest key = node("a");

        StepVerifier.create(tier.put(key, artifact)).verifyComplete();
        StepVerifier.create(tier.has(key)).expectNext(true).verifyComplete();
        StepVerifier.create(tier.get(key)).expectNext(artifact).verifyComplete();
    }

    @Test
    void transientFailuresAreRetried() {
        Artifact artifact = Artifact.ofString("eventually");
        Digest key = node("a");
        client.failNext(2);

        StepVerifier.create(tier.put(key, artifact)).verifyComplete();
        assertTrue(client.containsAction(key));
    }

    @Test
    void exhaustedRetriesDegradeReadsToMiss() {
        client.setUnavailable(true);

        StepVerifier.create(tier.get(node("a"))).verifyComplete();
        StepVerifier.create(tier.has(node("a"))).expectNext(false).verifyComplete();
        // 3 次尝试
        assertEquals(6, client.getCalls());
    }

    @Test
    void uploadsNeverDegrade() {
        client.setUnavailable(true);

        StepVerifier.create(tier.put(node("a"), Artifact.ofString("x")))
                .expectError(NetworkException.class)
                .verify(TIMEOUT);
    }

    @Test
    void requiredRemotePropagatesReadFailures() {
        client.setUnavailable(true);
        RemoteCacheTier strict = new RemoteCacheTier(client, TieredCacheTest.fastPolicy(true));

        StepVerifier.create(strict.get(node("a")))
                .expectError(NetworkException.class)
                .verify(TIMEOUT);
    }

    @Test
    void integrityFailuresAreNeverRetriedOrDegraded() {
        Artifact artifact = Artifact.ofString("genuine");
        Digest key = node("a");
        client.seedUnchecked(key, artifact.getContentDigest(), artifact.getBytes());
        client.setCorruptReads(true);

        StepVerifier.create(tier.get(key))
                .expectError(CasIntegrityException.class)
                .verify(TIMEOUT);
        // GET action + GET blob，无重试
        assertEquals(2, client.getCalls());
    }

    @Test
    void slowRemoteTimesOutPerAttempt() {
        RemoteCacheClient slow = new InMemoryRemoteCacheClient() {
            @Override
            public Mono<Digest> getAction(Digest nodeDigest) {
                return Mono.never();
            }
        };
        RemoteCacheTier.Policy policy = new RemoteCacheTier.Policy(Duration.ofMillis(50), 2, Duration.ofMillis(1),
                Duration.ofMillis(5), 0.0, false);
        RemoteCacheTier slowTier = new RemoteCacheTier(slow, policy);

        StepVerifier.create(slowTier.get(node("a")))
                .verifyComplete();
    }

    @Test
    void invalidPolicyIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new RemoteCacheTier.Policy(Duration.ofSeconds(1), 0, Duration.ofMillis(1), Duration.ofMillis(1), 0.5, false));
        assertThrows(IllegalArgumentException.class,
                () -> new RemoteCacheTier.Policy(Duration.ofSeconds(1), 1, Duration.ofMillis(1), Duration.ofMillis(1), 1.5, false));
    }
}
