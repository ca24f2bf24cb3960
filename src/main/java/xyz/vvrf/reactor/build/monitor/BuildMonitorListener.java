package xyz.vvrf.reactor.build.monitor;

import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.NodeResult;
import xyz.vvrf.reactor.build.execution.BuildReport;
import xyz.vvrf.reactor.build.graph.BuildNode;

import java.time.Duration;

/**
 * 用于监控构建执行事件的监听器接口。
 * 包括构建级别、节点级别以及缓存事件。实现者抛出的异常会被记录并忽略。
 *
 * @author ruifeng.wen
 */
public interface BuildMonitorListener {

    /**
     * 构建开始执行时调用（脏标记之后）。
     *
     * @param buildId    构建 ID
     * @param graphName  构建图名称
     * @param totalNodes 节点总数
     * @param dirtyNodes 脏节点数量
     */
    void onBuildStart(String buildId, String graphName, int totalNodes, int dirtyNodes);

    /**
     * 构建结束时调用（无论成功、失败或取消）。
     */
    void onBuildComplete(String buildId, String graphName, BuildReport report);

    /**
     * 节点开始解析时调用。
     */
    void onNodeStart(String buildId, String graphName, BuildNode node);

    /**
     * 节点成功解析时调用。
     *
     * @param result   节点结果，{@link NodeResult#getOrigin()} 标明产物来源
     * @param duration 解析耗时（含缓存查询与执行）
     */
    void onNodeSuccess(String buildId, String graphName, BuildNode node, Duration duration, NodeResult result);

    /**
     * 节点失败时调用。
     */
    void onNodeFailure(String buildId, String graphName, BuildNode node, Duration duration, Throwable error);

    /**
     * 节点被跳过时调用。
     */
    void onNodeSkipped(String buildId, String graphName, BuildNode node);

    /**
     * 节点执行超时。这是 onNodeFailure 的一种特定情况，单独列出便于监控。
     */
    default void onNodeTimeout(String buildId, String graphName, BuildNode node, Duration timeout) {
    }

    /**
     * 某一缓存层命中。
     *
     * @param tier 缓存层名称 (L1 / L2 / L3)
     */
    default void onCacheHit(String tier, Digest nodeDigest) {
    }

    /**
     * 所有缓存层均未命中。
     */
    default void onCacheMiss(Digest nodeDigest) {
    }

    /**
     * 向远程缓存上传失败（含完整性拒绝）。
     */
    default void onUploadFailure(Digest nodeDigest, Throwable error) {
    }
}
