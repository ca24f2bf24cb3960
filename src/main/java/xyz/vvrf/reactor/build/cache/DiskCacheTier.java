package xyz.vvrf.reactor.build.cache;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.build.core.Artifact;
import xyz.vvrf.reactor.build.core.Digest;

import java.util.Objects;
import java.util.Optional;

/**
 * L2 磁盘缓存层：将阻塞的 {@link DiskCacheStore} 操作放到调度器上执行。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class DiskCacheTier implements CacheTier {

    public static final String NAME = "L2";

    private final DiskCacheStore store;
    private final Scheduler scheduler;

    public DiskCacheTier(DiskCacheStore store, Scheduler scheduler) {
        this.store = Objects.requireNonNull(store, "DiskCacheStore 不能为空");
        this.scheduler = Objects.requireNonNull(scheduler, "磁盘 I/O 调度器不能为空");
    }

    public DiskCacheTier(DiskCacheStore store) {
        this(store, Schedulers.boundedElastic());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<Boolean> has(Digest nodeDigest) {
        return Mono.fromCallable(() -> store.readAction(nodeDigest)
                        .map(store::containsBlob)
                        .orElse(false))
                .subscribeOn(scheduler);
    }

    @Override
    public Mono<Artifact> get(Digest nodeDigest) {
        return Mono.fromCallable(() -> {
                    Optional<Digest> content = store.readAction(nodeDigest);
                    if (!content.isPresent()) {
                        return null;
                    }
                    // readBlob 已校验内容摘要
                    return store.readBlob(content.get())
                            .map(bytes -> Artifact.declared(content.get(), bytes))
                            .orElse(null);
                })
                .subscribeOn(scheduler);
    }

    @Override
    public Mono<Void> put(Digest nodeDigest, Artifact artifact) {
        return Mono.<Void>fromRunnable(() -> {
                    store.writeBlob(artifact.getContentDigest(), artifact.getBytes());
                    store.writeAction(nodeDigest, artifact.getContentDigest());
                    log.trace("L2 stored {} -> {}", nodeDigest.shortHex(), artifact.getContentDigest().shortHex());
                })
                .subscribeOn(scheduler);
    }

    public DiskCacheStore getStore() {
        return store;
    }
}
