package xyz.vvrf.reactor.build.cache.remote;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.web.server.LocalServerPort;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.build.cache.RemoteCacheTier;
import xyz.vvrf.reactor.build.core.Artifact;
import xyz.vvrf.reactor.build.core.CasIntegrityException;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.Digests;
import xyz.vvrf.reactor.build.core.NetworkException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 通过真实 HTTP 与内置的远程缓存服务端交互。
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        classes = HttpRemoteCacheClientTest.TestApplication.class,
        properties = {"build.server.enabled=true", "build.history.file="})
class HttpRemoteCacheClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @TempDir
    static Path dir;

    @LocalServerPort
    int port;

    private HttpRemoteCacheClient client;

    @SpringBootConfiguration
    @EnableAutoConfiguration
    static class TestApplication {
    }

    @DynamicPropertySource
    static void directories(DynamicPropertyRegistry registry) {
        registry.add("build.server.storage-directory", () -> dir.resolve("server").toString());
        registry.add("build.cache.disk.directory", () -> dir.resolve("local").toString());
    }

    @BeforeEach
    void setUp() {
        client = new HttpRemoteCacheClient("http://localhost:" + port);
    }

    private static Digest node(String name) {
        return Digests.composer("test-node").putString(name).build();
    }

    @Test
    void blobAndActionRoundTrip() {
        byte[] bytes = "over the wire".getBytes(StandardCharsets.UTF_8);
        Digest content = Digests.ofContent(bytes);
        Digest key = node("round-trip");

        StepVerifier.create(client.hasBlob(content)).expectNext(false).verifyComplete();
        StepVerifier.create(client.putBlob(content, bytes)).verifyComplete();
        StepVerifier.create(client.hasBlob(content)).expectNext(true).verifyComplete();
        StepVerifier.create(client.getBlob(content))
                .assertNext(received -> assertArrayEquals(bytes, received))
                .verifyComplete();

        StepVerifier.create(client.putAction(key, content)).verifyComplete();
        StepVerifier.create(client.getAction(key)).expectNext(content).verifyComplete();
    }

    @Test
    void missingEntriesAreEmpty() {
        StepVerifier.create(client.getBlob(Digests.ofString("nothing"))).verifyComplete();
        StepVerifier.create(client.getAction(node("nothing"))).verifyComplete();
    }

    @Test
    void integrityRejectionIsReportedAsCasFailure() {
        Digest claimed = Digests.ofString("claimed");

        StepVerifier.create(client.putBlob(claimed, "different".getBytes(StandardCharsets.UTF_8)))
                .expectErrorSatisfies(e -> {
                    assertTrue(e instanceof CasIntegrityException);
                    assertEquals(claimed, ((CasIntegrityException) e).getExpected());
                })
                .verify(TIMEOUT);
        StepVerifier.create(client.hasBlob(claimed)).expectNext(false).verifyComplete();
    }

    @Test
    void actionWithoutBlobIsNotRetryable() {
        StepVerifier.create(client.putAction(node("orphan"), Digests.ofString("never uploaded")))
                .expectErrorSatisfies(e -> {
                    assertTrue(e instanceof NetworkException);
                    assertFalse(NetworkException.isRetryable(e));
                    assertEquals(400, ((NetworkException) e).getStatus());
                })
                .verify(TIMEOUT);
    }

    @Test
    void unreachableServerIsRetryable() {
        HttpRemoteCacheClient offline = new HttpRemoteCacheClient("http://localhost:1");

        StepVerifier.create(offline.getAction(node("a")))
                .expectErrorMatches(NetworkException::isRetryable)
                .verify(TIMEOUT);
    }

    @Test
    void remoteTierWorksAgainstServer() {
        RemoteCacheTier tier = new RemoteCacheTier(client, RemoteCacheTier.Policy.defaults());
        Artifact artifact = Artifact.ofString("shared between machines");
        Digest key = node("tier");

        StepVerifier.create(tier.put(key, artifact)).verifyComplete();
        StepVerifier.create(tier.get(key)).expectNext(artifact).verifyComplete();
    }
}
