package xyz.vvrf.reactor.build.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import xyz.vvrf.reactor.build.cache.DiskCacheStore;
import xyz.vvrf.reactor.build.cache.remote.CacheProtocol;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.Digests;
import xyz.vvrf.reactor.build.server.controller.RemoteCacheController;
import xyz.vvrf.reactor.build.server.filter.CacheProtocolVersionFilter;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RemoteCacheControllerTest {

    @TempDir
    Path dir;

    private DiskCacheStore store;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        store = new DiskCacheStore(dir);
        client = WebTestClient.bindToController(new RemoteCacheController(store))
                .webFilter(new CacheProtocolVersionFilter(new ObjectMapper()))
                .configureClient()
                .defaultHeader(CacheProtocol.VERSION_HEADER, CacheProtocol.VERSION)
                .build();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void uploadedBlobIsServed() {
        Digest digest = Digests.ofString("hello");

        client.put().uri("/cache/{d}", digest.hex())
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .bodyValue(bytes("hello"))
                .exchange()
                .expectStatus().isCreated()
                .expectHeader().valueEquals(CacheProtocol.VERSION_HEADER, CacheProtocol.VERSION);

        client.head().uri("/cache/{d}", digest.hex()).exchange().expectStatus().isOk();
        client.get().uri("/cache/{d}", digest.hex())
                .exchange()
                .expectStatus().isOk()
                .expectBody(byte[].class).isEqualTo(bytes("hello"));
    }

    @Test
    void mismatchingUploadIsRejectedAndInvisible() {
        Digest claimed = Digests.ofString("expected");

        client.put().uri("/cache/{d}", claimed.hex())
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .bodyValue(bytes("tampered"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo(CacheProtocol.ERROR_CAS_INTEGRITY)
                .jsonPath("$.expected").isEqualTo(claimed.hex())
                .jsonPath("$.actual").isEqualTo(Digests.ofString("tampered").hex());

        client.head().uri("/cache/{d}", claimed.hex()).exchange().expectStatus().isNotFound();
        client.get().uri("/cache/{d}", claimed.hex()).exchange().expectStatus().isNotFound();
        assertFalse(store.containsBlob(claimed));
    }

    @Test
    void missingOrWrongVersionIsRejected() {
        Digest digest = Digests.ofString("x");
        WebTestClient unversioned = WebTestClient.bindToController(new RemoteCacheController(store))
                .webFilter(new CacheProtocolVersionFilter(new ObjectMapper()))
                .build();

        unversioned.get().uri("/cache/{d}", digest.hex())
                .exchange()
                .expectStatus().isBadRequest()
                .expectHeader().valueEquals(CacheProtocol.VERSION_HEADER, CacheProtocol.VERSION)
                .expectBody()
                .jsonPath("$.error").isEqualTo(CacheProtocol.ERROR_UNSUPPORTED_VERSION)
                .jsonPath("$.expected").isEqualTo(CacheProtocol.VERSION);

        unversioned.get().uri("/ac/{d}", digest.hex())
                .header(CacheProtocol.VERSION_HEADER, "99")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.actual").isEqualTo("99");
    }

    @Test
    void invalidDigestInPathIsRejected() {
        client.get().uri("/cache/{d}", "not-a-digest")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo(CacheProtocol.ERROR_INVALID_DIGEST);
    }

    @Test
    void actionEntriesReferenceStoredBlobs() {
        Digest node = Digests.composer("node").putString("a").build();
        Digest content = Digests.ofString("content");

        client.put().uri("/ac/{d}", node.hex())
                .contentType(MediaType.TEXT_PLAIN)
                .bodyValue(content.hex())
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo(CacheProtocol.ERROR_MISSING_BLOB);

        store.writeBlob(content, bytes("content"));
        client.put().uri("/ac/{d}", node.hex())
                .contentType(MediaType.TEXT_PLAIN)
                .bodyValue(content.hex())
                .exchange()
                .expectStatus().isCreated();

        client.head().uri("/ac/{d}", node.hex()).exchange().expectStatus().isOk();
        client.get().uri("/ac/{d}", node.hex())
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class).isEqualTo(content.hex());
    }

    @Test
    void malformedActionBodyIsRejected() {
        Digest node = Digests.composer("node").putString("a").build();
        client.put().uri("/ac/{d}", node.hex())
                .contentType(MediaType.TEXT_PLAIN)
                .bodyValue("garbage")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo(CacheProtocol.ERROR_INVALID_DIGEST);
    }

    @Test
    void unknownEntriesAreNotFound() {
        Digest digest = Digests.ofString("absent");
        client.head().uri("/ac/{d}", digest.hex()).exchange().expectStatus().isNotFound();
        client.get().uri("/ac/{d}", digest.hex()).exchange().expectStatus().isNotFound();
    }

    @Test
    void garbageCollectionReportsStats() {
        store.writeBlob(Digests.ofString("aaaa"), bytes("aaaa"));
        store.writeBlob(Digests.ofString("bbbb"), bytes("bbbb"));

        client.post().uri(uri -> uri.path("/gc").queryParam("maxSizeBytes", 4).build())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.scanned").isEqualTo(2)
                .jsonPath("$.deletedBlobs").isEqualTo(1)
                .jsonPath("$.remainingBytes").isEqualTo(4);
    }
}
