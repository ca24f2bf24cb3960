package xyz.vvrf.reactor.build.server.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.build.cache.DiskCacheStore;
import xyz.vvrf.reactor.build.cache.GcStats;
import xyz.vvrf.reactor.build.cache.remote.CacheProtocol;
import xyz.vvrf.reactor.build.core.CacheMissException;
import xyz.vvrf.reactor.build.core.CasIntegrityException;
import xyz.vvrf.reactor.build.core.Digest;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * 远程缓存 HTTP 接口，存储落在 {@link DiskCacheStore} 上。
 * <p>
 * 上传的 blob 会重新计算摘要，与路径中的摘要不一致时返回 400 CASIntegrityFailure 且不写入；
 * 被拒绝的内容对后续 GET/HEAD 不可见。
 *
 * @author ruifeng.wen
 */
@Slf4j
@RestController
public class RemoteCacheController {

    private final DiskCacheStore store;
    private final Scheduler scheduler;

    public RemoteCacheController(DiskCacheStore store, Scheduler scheduler) {
        this.store = Objects.requireNonNull(store, "DiskCacheStore 不能为空");
        this.scheduler = Objects.requireNonNull(scheduler, "调度器不能为空");
        log.info("RemoteCacheController initialized. Storage root: {}", store.getRoot());
    }

    public RemoteCacheController(DiskCacheStore store) {
        this(store, Schedulers.boundedElastic());
    }

    // --- CAS blob ---

    @RequestMapping(method = RequestMethod.HEAD, path = CacheProtocol.BLOB_PATH)
    public Mono<ResponseEntity<Void>> headBlob(@PathVariable("digest") String digest) {
        return withDigest(digest, d -> blocking(() -> store.containsBlob(d))
                .map(found -> found ? ResponseEntity.ok().<Void>build() : ResponseEntity.notFound().<Void>build()));
    }

    @GetMapping(path = CacheProtocol.BLOB_PATH, produces = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public Mono<ResponseEntity<byte[]>> getBlob(@PathVariable("digest") String digest) {
        return withDigest(digest, d -> blocking(() -> store.readBlob(d))
                .map(bytes -> bytes.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build()))
                .onErrorResume(CasIntegrityException.class, e -> {
                    // 存储中的文件已损坏并被删除，对客户端表现为未命中
                    log.error("Serving GET {}: stored blob was corrupt and has been removed.", d.shortHex());
                    return Mono.just(ResponseEntity.notFound().build());
                }));
    }

    @PutMapping(path = CacheProtocol.BLOB_PATH, consumes = MediaType.ALL_VALUE)
    public Mono<ResponseEntity<Object>> putBlob(@PathVariable("digest") String digest,
                                                @RequestBody(required = false) byte[] body) {
        byte[] bytes = body != null ? body : new byte[0];
        return withDigest(digest, d -> blocking(() -> store.writeBlob(d, bytes))
                .map(entry -> {
                    log.debug("Stored blob {} ({} bytes).", d.shortHex(), entry.getSize());
                    return ResponseEntity.status(HttpStatus.CREATED).build();
                })
                .onErrorResume(CasIntegrityException.class, e -> {
                    log.warn("Rejected upload of {}: {}", d.shortHex(), e.getMessage());
                    Map<String, Object> error = errorBody(CacheProtocol.ERROR_CAS_INTEGRITY, e.getMessage());
                    error.put("expected", d.hex());
                    if (e.getActual() != null) {
                        error.put("actual", e.getActual().hex());
                    }
                    return Mono.just(ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON).body(error));
                }));
    }

    // --- 动作记录 ---

    @RequestMapping(method = RequestMethod.HEAD, path = CacheProtocol.ACTION_PATH)
    public Mono<ResponseEntity<Void>> headAction(@PathVariable("digest") String digest) {
        return withDigest(digest, d -> blocking(() -> store.readAction(d).map(store::containsBlob).orElse(false))
                .map(found -> found ? ResponseEntity.ok().<Void>build() : ResponseEntity.notFound().<Void>build()));
    }

    @GetMapping(path = CacheProtocol.ACTION_PATH, produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<ResponseEntity<String>> getAction(@PathVariable("digest") String digest) {
        return withDigest(digest, d -> blocking(() -> store.readAction(d))
                .map(content -> content.map(c -> ResponseEntity.ok(c.hex())).orElseGet(() -> ResponseEntity.notFound().build())));
    }

    @PutMapping(path = CacheProtocol.ACTION_PATH, consumes = MediaType.ALL_VALUE)
    public Mono<ResponseEntity<Object>> putAction(@PathVariable("digest") String digest,
                                                  @RequestBody(required = false) byte[] body) {
        String hex = body != null ? new String(body, StandardCharsets.UTF_8).trim() : "";
        if (!Digest.isValidHex(hex)) {
            return Mono.just(badRequest(CacheProtocol.ERROR_INVALID_DIGEST, "Action body is not a digest: '" + hex + "'"));
        }
        Digest content = Digest.fromHex(hex);
        return withDigest(digest, d -> blocking(() -> {
                    store.writeAction(d, content);
                    return d;
                })
                .map(ignored -> ResponseEntity.status(HttpStatus.CREATED).build())
                .onErrorResume(CacheMissException.class, e ->
                        Mono.just(badRequest(CacheProtocol.ERROR_MISSING_BLOB, "Referenced blob " + content.hex() + " is not stored"))));
    }

    // --- 垃圾回收 ---

    @PostMapping(path = CacheProtocol.GC_PATH, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<GcStats> collectGarbage(@RequestParam(name = "maxAgeDays", required = false) Integer maxAgeDays,
                                        @RequestParam(name = "maxSizeBytes", required = false) Long maxSizeBytes) {
        Duration maxAge = maxAgeDays != null && maxAgeDays > 0 ? Duration.ofDays(maxAgeDays) : null;
        long maxSize = maxSizeBytes != null && maxSizeBytes > 0 ? maxSizeBytes : 0L;
        return blocking(() -> store.collectGarbage(maxAge, maxSize))
                .doOnNext(stats -> log.info("Garbage collection finished: {}", stats));
    }

    private <T> Mono<ResponseEntity<T>> withDigest(String hex, Function<Digest, Mono<ResponseEntity<T>>> handler) {
        if (!Digest.isValidHex(hex)) {
            @SuppressWarnings("unchecked")
            ResponseEntity<T> response = (ResponseEntity<T>) (ResponseEntity<?>) badRequest(
                    CacheProtocol.ERROR_INVALID_DIGEST, "Not a digest: '" + hex + "'");
            return Mono.just(response);
        }
        return handler.apply(Digest.fromHex(hex));
    }

    private <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(scheduler);
    }

    private static ResponseEntity<Object> badRequest(String error, String message) {
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON).body(errorBody(error, message));
    }

    private static Map<String, Object> errorBody(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(CacheProtocol.ERROR_FIELD, error);
        body.put("message", message);
        return body;
    }
}
