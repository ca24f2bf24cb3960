package xyz.vvrf.reactor.build.cache;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.build.core.Artifact;
import xyz.vvrf.reactor.build.core.CacheMissException;
import xyz.vvrf.reactor.build.core.CasIntegrityException;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.monitor.BuildMonitorListener;
import xyz.vvrf.reactor.build.monitor.CompositeBuildMonitorListener;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 分层缓存：本地层（L1 内存、L2 磁盘）按顺序查询，最后查询可选的远程层 (L3)。
 * <ul>
 *     <li>读取时在第一个命中的层短路；较慢层的命中会提升到所有较快的层，从不向下写。</li>
 *     <li>写入时先校验产物，同步写入本地层；远程上传异步进行，失败只记录不影响构建。</li>
 * </ul>
 *
 * @author ruifeng.wen
 */
@Slf4j
public class TieredCache {

    private static final Consumer<Throwable> NO_OP = e -> { };

    private final List<CacheTier> localTiers;
    private final CacheTier remoteTier;
    private final BuildMonitorListener listener;

    private final Map<Digest, Mono<Void>> pendingUploads = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> hits = new ConcurrentHashMap<>();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong uploadFailures = new AtomicLong();

    /**
     * @param localTiers 按速度从快到慢排列的本地层，至少一个
     * @param remoteTier 远程层，可为空
     * @param listener   监控监听器，可为空
     */
    public TieredCache(List<CacheTier> localTiers, CacheTier remoteTier, BuildMonitorListener listener) {
        Objects.requireNonNull(localTiers, "本地缓存层不能为空");
        if (localTiers.isEmpty()) {
            throw new IllegalArgumentException("At least one local cache tier is required.");
        }
        this.localTiers = Collections.unmodifiableList(new ArrayList<>(localTiers));
        this.remoteTier = remoteTier;
        this.listener = listener != null ? listener : CompositeBuildMonitorListener.none();
        log.info("TieredCache initialized. Local tiers: {}, Remote tier: {}",
                this.localTiers.stream().map(CacheTier::name).toArray(), remoteTier != null ? remoteTier.name() : "none");
    }

    public TieredCache(List<CacheTier> localTiers, CacheTier remoteTier) {
        this(localTiers, remoteTier, null);
    }

    /**
     * 是否有任一层持有该节点的产物。远程命中会被提升到本地层（需要下载并校验 blob）。
     */
    public Mono<Boolean> has(Digest nodeDigest) {
        return Flux.fromIterable(localTiers)
                .concatMap(tier -> tier.has(nodeDigest).filter(Boolean::booleanValue).map(found -> tier.name()))
                .next()
                .map(tierName -> {
                    log.trace("has({}) hit in {}", nodeDigest.shortHex(), tierName);
                    return true;
                })
                .switchIfEmpty(Mono.defer(() -> remoteHas(nodeDigest)));
    }

    /**
     * 产物所在的第一层名称，不做提升也不下载 blob。用于只读的执行计划。
     */
    public Mono<String> locate(Digest nodeDigest) {
        return Flux.fromIterable(allTiers())
                .concatMap(tier -> tier.has(nodeDigest).filter(Boolean::booleanValue).map(found -> tier.name()))
                .next();
    }

    private Mono<Boolean> remoteHas(Digest nodeDigest) {
        if (remoteTier == null) {
            return Mono.just(false);
        }
        return remoteTier.has(nodeDigest)
                .flatMap(found -> {
                    if (!found) {
                        return Mono.just(false);
                    }
                    return remoteTier.get(nodeDigest)
                            .flatMap(artifact -> promote(nodeDigest, artifact, localTiers.size()).thenReturn(true))
                            .defaultIfEmpty(false);
                });
    }

    /**
     * 按层顺序读取产物，命中后提升到所有更快的层。
     *
     * @return 产物；所有层都未命中时以 {@link CacheMissException} 结束
     */
    public Mono<Artifact> get(Digest nodeDigest) {
        List<CacheTier> tiers = allTiers();
        return Flux.range(0, tiers.size())
                .concatMap(index -> tiers.get(index).get(nodeDigest)
                        .map(artifact -> new AbstractMap.SimpleImmutableEntry<>(index, artifact)))
                .next()
                .flatMap(hit -> {
                    CacheTier tier = tiers.get(hit.getKey());
                    recordHit(tier.name(), nodeDigest);
                    return promote(nodeDigest, hit.getValue(), hit.getKey()).thenReturn(hit.getValue());
                })
                .switchIfEmpty(Mono.defer(() -> {
                    misses.incrementAndGet();
                    listener.onCacheMiss(nodeDigest);
                    log.trace("get({}) missed all tiers", nodeDigest.shortHex());
                    return Mono.error(new CacheMissException(nodeDigest));
                }));
    }

    /**
     * 写入产物：校验后同步写入本地层，并异步上传到远程层。
     */
    public Mono<Void> put(Digest nodeDigest, Artifact artifact) {
        return put(nodeDigest, artifact, NO_OP);
    }

    /**
     * 写入产物。
     *
     * @param uploadFailureHandler 远程上传最终失败时回调（在上传线程上调用）
     */
    public Mono<Void> put(Digest nodeDigest, Artifact artifact, Consumer<Throwable> uploadFailureHandler) {
        return Mono.fromCallable(artifact::verify)
                .flatMap(verified -> Flux.fromIterable(localTiers)
                        .concatMap(tier -> tier.put(nodeDigest, verified))
                        .then())
                .doOnSuccess(v -> scheduleUpload(nodeDigest, artifact, uploadFailureHandler));
    }

    private Mono<Void> promote(Digest nodeDigest, Artifact artifact, int hitIndex) {
        int upto = Math.min(hitIndex, localTiers.size());
        if (upto == 0) {
            return Mono.empty();
        }
        return Flux.fromIterable(localTiers.subList(0, upto))
                .concatMap(tier -> tier.put(nodeDigest, artifact))
                .then()
                .doOnSuccess(v -> log.trace("Promoted {} into {} faster tier(s)", nodeDigest.shortHex(), upto));
    }

    private void scheduleUpload(Digest nodeDigest, Artifact artifact, Consumer<Throwable> uploadFailureHandler) {
        if (remoteTier == null) {
            return;
        }
        Mono<Void> upload = remoteTier.put(nodeDigest, artifact)
                .doOnSuccess(v -> log.debug("Uploaded {} to remote cache", nodeDigest.shortHex()))
                .onErrorResume(e -> {
                    uploadFailures.incrementAndGet();
                    if (e instanceof CasIntegrityException) {
                        log.error("Remote cache rejected upload of {} with integrity failure: {}", nodeDigest.shortHex(), e.getMessage());
                    } else {
                        log.warn("Upload of {} to remote cache failed: {}", nodeDigest.shortHex(), e.getMessage());
                    }
                    listener.onUploadFailure(nodeDigest, e);
                    uploadFailureHandler.accept(e);
                    return Mono.empty();
                })
                .doFinally(signal -> pendingUploads.remove(nodeDigest))
                .cache();
        if (pendingUploads.putIfAbsent(nodeDigest, upload) == null) {
            upload.subscribe();
        } else {
            log.trace("Upload of {} already in progress", nodeDigest.shortHex());
        }
    }

    /**
     * 等待所有进行中的上传完成。
     */
    public Mono<Void> drainUploads() {
        return Mono.when(new ArrayList<>(pendingUploads.values()));
    }

    public Mono<Void> drainUploads(Duration timeout) {
        return drainUploads()
                .timeout(timeout)
                .onErrorResume(e -> {
                    log.warn("Timed out after {} waiting for {} pending uploads.", timeout, pendingUploads.size());
                    return Mono.empty();
                });
    }

    /**
     * 在后台把远程层的产物预取到最慢的本地层。可选功能，失败只记录日志。
     *
     * @return 实际预取的条目数
     */
    public Mono<Long> prefetch(Collection<Digest> nodeDigests) {
        if (remoteTier == null || nodeDigests.isEmpty()) {
            return Mono.just(0L);
        }
        CacheTier target = localTiers.get(localTiers.size() - 1);
        return Flux.fromIterable(new ArrayList<>(nodeDigests))
                .flatMap(digest -> target.has(digest)
                        .flatMap(present -> present
                                ? Mono.just(false)
                                : remoteTier.get(digest).flatMap(a -> target.put(digest, a).thenReturn(true)).defaultIfEmpty(false))
                        .onErrorResume(e -> {
                            log.warn("Prefetch of {} failed: {}", digest.shortHex(), e.getMessage());
                            return Mono.just(false);
                        }), 4)
                .filter(Boolean::booleanValue)
                .count()
                .doOnNext(count -> log.debug("Prefetched {} of {} artifacts into {}", count, nodeDigests.size(), target.name()));
    }

    private List<CacheTier> allTiers() {
        if (remoteTier == null) {
            return localTiers;
        }
        List<CacheTier> tiers = new ArrayList<>(localTiers);
        tiers.add(remoteTier);
        return tiers;
    }

    private void recordHit(String tier, Digest nodeDigest) {
        hits.computeIfAbsent(tier, k -> new AtomicLong()).incrementAndGet();
        listener.onCacheHit(tier, nodeDigest);
    }

    public long getHits(String tier) {
        AtomicLong counter = hits.get(tier);
        return counter != null ? counter.get() : 0L;
    }

    public long getMisses() {
        return misses.get();
    }

    public long getUploadFailures() {
        return uploadFailures.get();
    }

    public int getPendingUploadCount() {
        return pendingUploads.size();
    }

    public boolean hasRemoteTier() {
        return remoteTier != null;
    }
}
