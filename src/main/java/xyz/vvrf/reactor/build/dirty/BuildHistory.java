package xyz.vvrf.reactor.build.dirty;

import xyz.vvrf.reactor.build.core.Digest;

import java.util.Map;
import java.util.Optional;

/**
 * 构建历史：记录每个节点（按逻辑名称）上一次成功构建时的摘要。
 * 实现必须是线程安全的。
 *
 * @author ruifeng.wen
 */
public interface BuildHistory {

    /**
     * 节点上一次成功构建的摘要。
     */
    Optional<Digest> lastDigest(String nodeName);

    /**
     * 记录节点成功构建后的摘要。
     */
    void record(String nodeName, Digest digest);

    /**
     * 批量记录，默认逐个调用 {@link #record}。
     */
    default void recordAll(Map<String, Digest> digests) {
        digests.forEach(this::record);
    }

    /**
     * 删除节点的记录，使其下次构建时变脏。
     */
    void forget(String nodeName);

    /**
     * 将记录持久化。内存实现为空操作。
     */
    default void flush() {
    }
}
