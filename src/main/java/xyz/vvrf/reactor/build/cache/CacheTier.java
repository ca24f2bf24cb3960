package xyz.vvrf.reactor.build.cache;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.build.core.Artifact;
import xyz.vvrf.reactor.build.core.Digest;

/**
 * 单个缓存层。所有操作以节点摘要为键。
 * 每层内部保存两类记录：动作记录（节点摘要 → 内容摘要）与内容寻址 blob（内容摘要 → 字节）。
 *
 * @author ruifeng.wen
 */
public interface CacheTier {

    /**
     * 层名称，用于日志和指标 (L1 / L2 / L3)。
     */
    String name();

    /**
     * 动作记录与其引用的 blob 是否都存在。
     */
    Mono<Boolean> has(Digest nodeDigest);

    /**
     * 读取产物。未命中时返回空 Mono；内容校验失败时以 CasIntegrityException 结束。
     */
    Mono<Artifact> get(Digest nodeDigest);

    /**
     * 写入产物。调用方保证产物已经过校验。
     */
    Mono<Void> put(Digest nodeDigest, Artifact artifact);
}
