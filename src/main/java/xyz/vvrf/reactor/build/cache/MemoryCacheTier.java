package xyz.vvrf.reactor.build.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.build.core.Artifact;
import xyz.vvrf.reactor.build.core.Digest;

/**
 * L1 进程内缓存：基于 Caffeine，按产物字节总量限制容量。
 * 进程内的产物在写入前已经过校验，读取时不再重复校验。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class MemoryCacheTier implements CacheTier {

    public static final String NAME = "L1";

    private final Cache<Digest, Artifact> cache;

    public MemoryCacheTier(long maxWeightBytes) {
        if (maxWeightBytes <= 0) {
            throw new IllegalArgumentException("L1 max weight must be positive.");
        }
        this.cache = Caffeine.newBuilder()
                .maximumWeight(maxWeightBytes)
                .weigher((Digest key, Artifact value) -> Math.max(1, value.size()))
                .build();
        log.info("MemoryCacheTier initialized. Max weight: {} bytes", maxWeightBytes);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<Boolean> has(Digest nodeDigest) {
        return Mono.fromSupplier(() -> cache.getIfPresent(nodeDigest) != null);
    }

    @Override
    public Mono<Artifact> get(Digest nodeDigest) {
        return Mono.fromSupplier(() -> cache.getIfPresent(nodeDigest));
    }

    @Override
    public Mono<Void> put(Digest nodeDigest, Artifact artifact) {
        // 已存在时保持原值
        return Mono.fromRunnable(() -> cache.asMap().putIfAbsent(nodeDigest, artifact));
    }

    public void invalidate(Digest nodeDigest) {
        cache.invalidate(nodeDigest);
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }
}
