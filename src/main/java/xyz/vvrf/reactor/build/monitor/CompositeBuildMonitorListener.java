package xyz.vvrf.reactor.build.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.NodeResult;
import xyz.vvrf.reactor.build.execution.BuildReport;
import xyz.vvrf.reactor.build.graph.BuildNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * 将事件分发给多个监听器；单个监听器抛出的异常只记录日志，不影响构建。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class CompositeBuildMonitorListener implements BuildMonitorListener {

    private static final CompositeBuildMonitorListener NONE = new CompositeBuildMonitorListener(Collections.emptyList());

    private final List<BuildMonitorListener> listeners;

    public CompositeBuildMonitorListener(List<BuildMonitorListener> listeners) {
        this.listeners = listeners != null ? new ArrayList<>(listeners) : Collections.emptyList();
    }

    public static CompositeBuildMonitorListener none() {
        return NONE;
    }

    public int size() {
        return listeners.size();
    }

    @Override
    public void onBuildStart(String buildId, String graphName, int totalNodes, int dirtyNodes) {
        safeNotifyListeners(l -> l.onBuildStart(buildId, graphName, totalNodes, dirtyNodes));
    }

    @Override
    public void onBuildComplete(String buildId, String graphName, BuildReport report) {
        safeNotifyListeners(l -> l.onBuildComplete(buildId, graphName, report));
    }

    @Override
    public void onNodeStart(String buildId, String graphName, BuildNode node) {
        safeNotifyListeners(l -> l.onNodeStart(buildId, graphName, node));
    }

    @Override
    public void onNodeSuccess(String buildId, String graphName, BuildNode node, Duration duration, NodeResult result) {
        safeNotifyListeners(l -> l.onNodeSuccess(buildId, graphName, node, duration, result));
    }

    @Override
    public void onNodeFailure(String buildId, String graphName, BuildNode node, Duration duration, Throwable error) {
        safeNotifyListeners(l -> l.onNodeFailure(buildId, graphName, node, duration, error));
    }

    @Override
    public void onNodeSkipped(String buildId, String graphName, BuildNode node) {
        safeNotifyListeners(l -> l.onNodeSkipped(buildId, graphName, node));
    }

    @Override
    public void onNodeTimeout(String buildId, String graphName, BuildNode node, Duration timeout) {
        safeNotifyListeners(l -> l.onNodeTimeout(buildId, graphName, node, timeout));
    }

    @Override
    public void onCacheHit(String tier, Digest nodeDigest) {
        safeNotifyListeners(l -> l.onCacheHit(tier, nodeDigest));
    }

    @Override
    public void onCacheMiss(Digest nodeDigest) {
        safeNotifyListeners(l -> l.onCacheMiss(nodeDigest));
    }

    @Override
    public void onUploadFailure(Digest nodeDigest, Throwable error) {
        safeNotifyListeners(l -> l.onUploadFailure(nodeDigest, error));
    }

    private void safeNotifyListeners(Consumer<BuildMonitorListener> notification) {
        if (listeners.isEmpty()) {
            return;
        }
        for (BuildMonitorListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("Build Monitor Listener {} threw exception: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
