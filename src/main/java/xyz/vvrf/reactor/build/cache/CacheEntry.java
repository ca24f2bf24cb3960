package xyz.vvrf.reactor.build.cache;

import lombok.Getter;
import xyz.vvrf.reactor.build.core.Digest;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * 磁盘缓存中的一条 blob 记录（不可变）。
 *
 * @author ruifeng.wen
 */
@Getter
public final class CacheEntry {

    private final Digest digest;
    private final Path location;
    private final long size;
    private final Instant createdAt;

    public CacheEntry(Digest digest, Path location, long size, Instant createdAt) {
        this.digest = Objects.requireNonNull(digest, "摘要不能为空");
        this.location = Objects.requireNonNull(location, "存储位置不能为空");
        this.size = size;
        this.createdAt = Objects.requireNonNull(createdAt, "创建时间不能为空");
    }

    @Override
    public String toString() {
        return "CacheEntry{" + digest.shortHex() + ", size=" + size + ", createdAt=" + createdAt + '}';
    }
}
