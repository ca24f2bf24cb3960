package xyz.vvrf.reactor.build.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.build.cache.SingleFlight;
import xyz.vvrf.reactor.build.cache.TieredCache;
import xyz.vvrf.reactor.build.core.Artifact;
import xyz.vvrf.reactor.build.core.BuildCancelledException;
import xyz.vvrf.reactor.build.core.CacheMissException;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.Digests;
import xyz.vvrf.reactor.build.core.NodeResult;
import xyz.vvrf.reactor.build.core.RunnerException;
import xyz.vvrf.reactor.build.graph.BuildNode;
import xyz.vvrf.reactor.build.monitor.BuildMonitorListener;
import xyz.vvrf.reactor.build.monitor.CompositeBuildMonitorListener;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * 标准节点执行器。
 * <p>
 * 干净节点直接从分层缓存读取；缓存中已不存在时按脏节点处理。
 * 脏节点以节点摘要做 single-flight：先查询缓存，未命中再产生产物。
 * 产物在写入缓存前重新计算内容摘要并与声明值比对。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class StandardNodeExecutor implements NodeExecutor {

    private final TieredCache cache;
    private final Runner runner;
    private final Duration nodeTimeout;
    private final Scheduler scheduler;
    private final BuildMonitorListener listener;
    private final SingleFlight<Digest, Resolution> singleFlight = new SingleFlight<>();

    public StandardNodeExecutor(TieredCache cache, Runner runner, Duration nodeTimeout, Scheduler scheduler,
                                BuildMonitorListener listener) {
        this.cache = Objects.requireNonNull(cache, "分层缓存不能为空");
        this.runner = Objects.requireNonNull(runner, "Runner 不能为空");
        this.nodeTimeout = Objects.requireNonNull(nodeTimeout, "节点超时时间不能为空");
        this.scheduler = Objects.requireNonNull(scheduler, "调度器不能为空");
        this.listener = listener != null ? listener : CompositeBuildMonitorListener.none();
        if (nodeTimeout.isNegative() || nodeTimeout.isZero()) {
            throw new IllegalArgumentException("节点超时时间必须为正数");
        }
        log.info("StandardNodeExecutor initialized. Node timeout: {}, Runner: {}, Scheduler: {}",
                nodeTimeout, runner.getClass().getSimpleName(), scheduler);
    }

    @Override
    public Mono<NodeResult> executeNode(BuildSession session, BuildNode node, Digest nodeDigest, boolean dirty, List<Artifact> inputs) {
        final String buildId = session.getBuildId();
        final String graphName = session.getGraph().getName();

        return Mono.defer(() -> {
            if (session.isCancelled()) {
                log.debug("[Build: {}][Node: '{}'] Build cancelled, skipping.", buildId, node.getName());
                listener.onNodeSkipped(buildId, graphName, node);
                return Mono.just(NodeResult.skipped(node.getId(), nodeDigest));
            }

            final Instant start = Instant.now();
            listener.onNodeStart(buildId, graphName, node);
            log.debug("[Build: {}][Node: '{}'] Resolving ({}, digest {}).", buildId, node.getName(),
                    dirty ? "dirty" : "clean", nodeDigest.shortHex());

            Mono<Resolution> resolution = dirty
                    ? resolveDirty(session, node, nodeDigest, inputs)
                    : resolveClean(session, node, nodeDigest, inputs);

            return resolution
                    .map(r -> {
                        NodeResult result = NodeResult.success(node.getId(), nodeDigest, r.getArtifact(), r.getOrigin());
                        Duration duration = Duration.between(start, Instant.now());
                        log.debug("[Build: {}][Node: '{}'] Resolved via {} in {}ms (content {}).", buildId, node.getName(),
                                r.getOrigin(), duration.toMillis(), r.getArtifact().getContentDigest().shortHex());
                        listener.onNodeSuccess(buildId, graphName, node, duration, result);
                        return result;
                    })
                    .onErrorResume(error -> {
                        Duration duration = Duration.between(start, Instant.now());
                        if (error instanceof BuildCancelledException) {
                            log.debug("[Build: {}][Node: '{}'] Cancelled while resolving.", buildId, node.getName());
                            listener.onNodeSkipped(buildId, graphName, node);
                            return Mono.just(NodeResult.skipped(node.getId(), nodeDigest));
                        }
                        log.error("[Build: {}][Node: '{}'] Failed after {}ms: {}", buildId, node.getName(),
                                duration.toMillis(), error.getMessage());
                        listener.onNodeFailure(buildId, graphName, node, duration, error);
                        return Mono.just(NodeResult.failure(node.getId(), nodeDigest, error));
                    });
        });
    }

    private Mono<Resolution> resolveClean(BuildSession session, BuildNode node, Digest nodeDigest, List<Artifact> inputs) {
        return cache.get(nodeDigest)
                .map(artifact -> new Resolution(artifact, NodeResult.Origin.CLEAN))
                .onErrorResume(CacheMissException.class, miss -> {
                    log.info("[Build: {}][Node: '{}'] Clean node missing from every cache tier, re-executing.",
                            session.getBuildId(), node.getName());
                    return resolveDirty(session, node, nodeDigest, inputs);
                });
    }

    private Mono<Resolution> resolveDirty(BuildSession session, BuildNode node, Digest nodeDigest, List<Artifact> inputs) {
        // 共享的工作不随单个订阅者取消，Runner 调用只响应发起会话的取消信号
        return singleFlight.execute(nodeDigest, () -> cache.has(nodeDigest)
                .flatMap(hit -> {
                    if (!hit) {
                        return produce(session, node, nodeDigest, inputs);
                    }
                    return cache.get(nodeDigest)
                            .map(artifact -> new Resolution(artifact, NodeResult.Origin.CACHE_HIT))
                            .onErrorResume(CacheMissException.class, raced -> produce(session, node, nodeDigest, inputs));
                }))
                .onErrorResume(BuildCancelledException.class, e -> {
                    if (session.isCancelled()) {
                        return Mono.error(e);
                    }
                    // 加入的是另一个已取消构建的计算，重新发起
                    log.debug("[Build: {}][Node: '{}'] Shared computation was cancelled by another build, retrying.",
                            session.getBuildId(), node.getName());
                    return resolveDirty(session, node, nodeDigest, inputs);
                });
    }

    private Mono<Resolution> produce(BuildSession session, BuildNode node, Digest nodeDigest, List<Artifact> inputs) {
        return produceArtifact(session, node, nodeDigest, inputs)
                .map(Artifact::verify)
                .flatMap(artifact -> {
                    if (session.isCancelled()) {
                        return Mono.error(new BuildCancelledException("Build " + session.getBuildId()
                                + " cancelled before committing node '" + node.getName() + "'"));
                    }
                    return cache.put(nodeDigest, artifact, error -> session.onUploadFailure(nodeDigest, error))
                            .thenReturn(new Resolution(artifact, NodeResult.Origin.EXECUTED));
                });
    }

    private Mono<Artifact> produceArtifact(BuildSession session, BuildNode node, Digest nodeDigest, List<Artifact> inputs) {
        if (node.isSource()) {
            Digest context = node.getContextFingerprint();
            return Mono.just(Artifact.ofString(context != null ? context.hex() : ""));
        }
        if (!node.hasInstruction()) {
            return Mono.just(aggregate(inputs));
        }

        final String buildId = session.getBuildId();
        final String graphName = session.getGraph().getName();
        RunRequest request = new RunRequest(buildId, node.getName(), node.getKind(), nodeDigest,
                node.getInstruction(), inputs, node.getEnvironment());
        log.debug("[Build: {}][Node: '{}'] Invoking runner: {}", buildId, node.getName(), request);

        return Mono.defer(() -> runner.run(request))
                .subscribeOn(scheduler)
                .timeout(nodeTimeout)
                .takeUntilOther(session.cancelSignal())
                .switchIfEmpty(Mono.defer(() -> Mono.error(session.isCancelled()
                        ? new BuildCancelledException("Build " + buildId + " cancelled while running node '" + node.getName() + "'")
                        : new RunnerException("Runner produced no artifact for node '" + node.getName() + "'", -1, ""))))
                .onErrorMap(TimeoutException.class, e -> {
                    log.warn("[Build: {}][Node: '{}'] Runner timed out after {}.", buildId, node.getName(), nodeTimeout);
                    listener.onNodeTimeout(buildId, graphName, node, nodeTimeout);
                    return new RunnerException("Node '" + node.getName() + "' timed out after " + nodeTimeout, e);
                });
    }

    /**
     * 无指令的非源节点：产物为输入内容摘要的组合。
     */
    private static Artifact aggregate(List<Artifact> inputs) {
        Digests.Composer composer = Digests.composer("aggregate").putInt(inputs.size());
        for (Artifact input : inputs) {
            composer.putDigest(input.getContentDigest());
        }
        return Artifact.ofString(composer.build().hex());
    }

    int inFlightCount() {
        return singleFlight.inFlightCount();
    }
}
