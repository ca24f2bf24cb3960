package xyz.vvrf.reactor.build.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.NodeResult;
import xyz.vvrf.reactor.build.execution.BuildReport;
import xyz.vvrf.reactor.build.graph.BuildNode;

import java.time.Duration;

/**
 * 将构建事件输出到日志的监听器。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class LoggingBuildMonitorListener implements BuildMonitorListener {

    @Override
    public void onBuildStart(String buildId, String graphName, int totalNodes, int dirtyNodes) {
        log.info("[MONITOR] 构建:[{}] 图:[{}] 开始。 节点总数:[{}], 脏节点:[{}]", buildId, graphName, totalNodes, dirtyNodes);
    }

    @Override
    public void onBuildComplete(String buildId, String graphName, BuildReport report) {
        log.info("[MONITOR] 构建:[{}] 图:[{}] 结束。 状态:[{}], 耗时:[{}ms]",
                buildId, graphName, report.getState(), report.getDuration().toMillis());
    }

    @Override
    public void onNodeStart(String buildId, String graphName, BuildNode node) {
        log.debug("[MONITOR] 构建:[{}] 图:[{}] 节点:[{}] 开始。 类别:[{}]", buildId, graphName, node.getName(), node.getKind());
    }

    @Override
    public void onNodeSuccess(String buildId, String graphName, BuildNode node, Duration duration, NodeResult result) {
        log.info("[MONITOR] 构建:[{}] 图:[{}] 节点:[{}] 成功。 来源:[{}], 耗时:[{}ms]",
                buildId, graphName, node.getName(), result.getOrigin(), duration.toMillis());
    }

    @Override
    public void onNodeFailure(String buildId, String graphName, BuildNode node, Duration duration, Throwable error) {
        log.error("[MONITOR] 构建:[{}] 图:[{}] 节点:[{}] 失败。 耗时:[{}ms], 错误:[{}]",
                buildId, graphName, node.getName(), duration.toMillis(), error.getMessage());
    }

    @Override
    public void onNodeSkipped(String buildId, String graphName, BuildNode node) {
        log.info("[MONITOR] 构建:[{}] 图:[{}] 节点:[{}] 跳过。", buildId, graphName, node.getName());
    }

    @Override
    public void onNodeTimeout(String buildId, String graphName, BuildNode node, Duration timeout) {
        log.warn("[MONITOR] 构建:[{}] 图:[{}] 节点:[{}] 超时。 配置:[{}ms]", buildId, graphName, node.getName(), timeout.toMillis());
    }

    @Override
    public void onUploadFailure(Digest nodeDigest, Throwable error) {
        log.warn("[MONITOR] 远程缓存上传失败。 摘要:[{}], 错误:[{}]", nodeDigest.shortHex(), error.getMessage());
    }
}
