package xyz.vvrf.reactor.build.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.ErrorKind;
import xyz.vvrf.reactor.build.core.NodeResult;
import xyz.vvrf.reactor.build.execution.BuildReport;
import xyz.vvrf.reactor.build.graph.BuildNode;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 将构建事件记录为 Micrometer 指标的监听器。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class MicrometerBuildMonitorListener implements BuildMonitorListener {

    private final MeterRegistry meterRegistry;

    // 指标名称
    static final String METRIC_NODE_EXECUTION_TIME = "build.node.execution.time";
    static final String METRIC_NODE_EXECUTION_TOTAL = "build.node.execution.total";
    static final String METRIC_NODE_TIMEOUT_TOTAL = "build.node.timeout.total";
    static final String METRIC_BUILD_TIME = "build.execution.time";
    static final String METRIC_CACHE_HIT = "build.cache.hit";
    static final String METRIC_CACHE_MISS = "build.cache.miss";
    static final String METRIC_CACHE_UPLOAD_FAILURE = "build.cache.upload.failure";

    // 标签键
    private static final String TAG_GRAPH_NAME = "graph.name";
    private static final String TAG_NODE_KIND = "node.kind";
    private static final String TAG_STATUS = "status";
    private static final String TAG_ORIGIN = "origin";
    private static final String TAG_ERROR = "error";
    private static final String TAG_TIER = "tier";

    public MicrometerBuildMonitorListener(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry 不能为空");
    }

    @Override
    public void onBuildStart(String buildId, String graphName, int totalNodes, int dirtyNodes) {
        // 构建级指标在结束时记录
    }

    @Override
    public void onBuildComplete(String buildId, String graphName, BuildReport report) {
        Tags tags = Tags.of(Tag.of(TAG_GRAPH_NAME, graphName), Tag.of(TAG_STATUS, report.getState().name()));
        recordTimer(METRIC_BUILD_TIME, tags, report.getDuration());
    }

    @Override
    public void onNodeStart(String buildId, String graphName, BuildNode node) {
    }

    @Override
    public void onNodeSuccess(String buildId, String graphName, BuildNode node, Duration duration, NodeResult result) {
        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_NODE_KIND, node.getKind().name()),
                Tag.of(TAG_STATUS, NodeResult.NodeStatus.SUCCESS.name()),
                Tag.of(TAG_ORIGIN, result.getOrigin().name())
        );
        recordTimer(METRIC_NODE_EXECUTION_TIME, tags, duration);
        incrementCounter(METRIC_NODE_EXECUTION_TOTAL, tags);
    }

    @Override
    public void onNodeFailure(String buildId, String graphName, BuildNode node, Duration duration, Throwable error) {
        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_NODE_KIND, node.getKind().name()),
                Tag.of(TAG_STATUS, NodeResult.NodeStatus.FAILURE.name()),
                Tag.of(TAG_ERROR, ErrorKind.of(error).name())
        );
        recordTimer(METRIC_NODE_EXECUTION_TIME, tags, duration);
        incrementCounter(METRIC_NODE_EXECUTION_TOTAL, tags);
    }

    @Override
    public void onNodeSkipped(String buildId, String graphName, BuildNode node) {
        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_NODE_KIND, node.getKind().name()),
                Tag.of(TAG_STATUS, NodeResult.NodeStatus.SKIPPED.name())
        );
        incrementCounter(METRIC_NODE_EXECUTION_TOTAL, tags);
    }

    @Override
    public void onNodeTimeout(String buildId, String graphName, BuildNode node, Duration timeout) {
        incrementCounter(METRIC_NODE_TIMEOUT_TOTAL, Tags.of(Tag.of(TAG_GRAPH_NAME, graphName)));
        log.debug("Micrometer 监听器捕获到节点 {} 的超时事件", node.getName());
    }

    @Override
    public void onCacheHit(String tier, Digest nodeDigest) {
        incrementCounter(METRIC_CACHE_HIT, Tags.of(TAG_TIER, tier));
    }

    @Override
    public void onCacheMiss(Digest nodeDigest) {
        incrementCounter(METRIC_CACHE_MISS, Tags.empty());
    }

    @Override
    public void onUploadFailure(Digest nodeDigest, Throwable error) {
        incrementCounter(METRIC_CACHE_UPLOAD_FAILURE, Tags.of(TAG_ERROR, ErrorKind.of(error).name()));
    }

    private void recordTimer(String name, Tags tags, Duration duration) {
        try {
            Timer timer = Timer.builder(name)
                    .tags(tags)
                    .register(meterRegistry);
            timer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标失败: {}", e.getMessage(), e);
        }
    }

    private void incrementCounter(String name, Tags tags) {
        try {
            Counter.builder(name)
                    .tags(tags)
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            log.error("增加计数器指标失败: {}", e.getMessage(), e);
        }
    }
}
