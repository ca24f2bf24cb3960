package xyz.vvrf.reactor.build.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.build.cache.TieredCache;
import xyz.vvrf.reactor.build.core.Artifact;
import xyz.vvrf.reactor.build.core.BuildState;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.ErrorHandlingStrategy;
import xyz.vvrf.reactor.build.core.NodeResult;
import xyz.vvrf.reactor.build.dirty.DirtyPropagator;
import xyz.vvrf.reactor.build.dirty.DirtySet;
import xyz.vvrf.reactor.build.fingerprint.EnvironmentFingerprint;
import xyz.vvrf.reactor.build.graph.BuildGraph;
import xyz.vvrf.reactor.build.graph.BuildNode;
import xyz.vvrf.reactor.build.monitor.BuildMonitorListener;
import xyz.vvrf.reactor.build.monitor.CompositeBuildMonitorListener;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 标准构建引擎。
 * <p>
 * 层级之间严格顺序执行（concatMap 形成层级屏障），同一层级内的节点按配置的并发度并行解析。
 * 失败处理遵循 {@link ErrorHandlingStrategy}：FAIL_FAST 在首个失败后跳过所有尚未开始的节点，
 * ISOLATE_FAILURES 只跳过失败节点的下游。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class StandardBuildEngine implements BuildEngine {

    private final NodeExecutor nodeExecutor;
    private final DirtyPropagator dirtyPropagator;
    private final TieredCache cache;
    private final EnvironmentFingerprint environment;
    private final int parallelism;
    private final ErrorHandlingStrategy errorStrategy;
    private final BuildMonitorListener listener;

    private volatile boolean drainUploadsOnCompletion = true;
    private volatile Duration drainTimeout = Duration.ofMinutes(1);
    private volatile boolean prefetchEnabled = false;
    private volatile boolean dryRun = false;

    public StandardBuildEngine(NodeExecutor nodeExecutor, DirtyPropagator dirtyPropagator, TieredCache cache,
                               EnvironmentFingerprint environment, int parallelism,
                               ErrorHandlingStrategy errorStrategy, BuildMonitorListener listener) {
        this.nodeExecutor = Objects.requireNonNull(nodeExecutor, "NodeExecutor 不能为空");
        this.dirtyPropagator = Objects.requireNonNull(dirtyPropagator, "DirtyPropagator 不能为空");
        this.cache = Objects.requireNonNull(cache, "分层缓存不能为空");
        this.environment = Objects.requireNonNull(environment, "环境指纹不能为空");
        this.errorStrategy = Objects.requireNonNull(errorStrategy, "错误处理策略不能为空");
        this.listener = listener != null ? listener : CompositeBuildMonitorListener.none();
        if (parallelism <= 0) {
            throw new IllegalArgumentException("Parallelism must be positive.");
        }
        this.parallelism = parallelism;
        log.info("StandardBuildEngine initialized. Parallelism: {}, Error strategy: {}, Environment: {}",
                parallelism, errorStrategy, environment.getDigest().shortHex());
    }

    public StandardBuildEngine(NodeExecutor nodeExecutor, DirtyPropagator dirtyPropagator, TieredCache cache,
                               EnvironmentFingerprint environment) {
        this(nodeExecutor, dirtyPropagator, cache, environment,
                Math.max(1, Runtime.getRuntime().availableProcessors()), ErrorHandlingStrategy.FAIL_FAST, null);
    }

    /**
     * 构建结束时是否等待远程上传完成。
     */
    public StandardBuildEngine drainUploadsOnCompletion(boolean drain, Duration timeout) {
        this.drainUploadsOnCompletion = drain;
        this.drainTimeout = Objects.requireNonNull(timeout, "等待超时时间不能为空");
        return this;
    }

    /**
     * 开始执行前是否在后台把干净节点的远程产物预取到本地。
     */
    public StandardBuildEngine prefetch(boolean enabled) {
        this.prefetchEnabled = enabled;
        return this;
    }

    /**
     * dry-run 模式只计算执行计划：不调用 Runner，不写缓存和构建历史。
     */
    public StandardBuildEngine dryRun(boolean enabled) {
        this.dryRun = enabled;
        return this;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    @Override
    public BuildSession newSession(BuildGraph graph, String buildId) {
        String actualBuildId = (buildId != null && !buildId.trim().isEmpty()) ? buildId : generateBuildId();
        return new BuildSession(actualBuildId, graph, environment);
    }

    @Override
    public Mono<BuildReport> build(BuildSession session) {
        Objects.requireNonNull(session, "构建会话不能为空");
        final BuildGraph graph = session.getGraph();
        final String buildId = session.getBuildId();

        return Mono.defer(() -> {
            final Instant start = Instant.now();
            log.info("[Build: {}] Starting build of graph '{}' ({} nodes, Strategy: {}, Parallelism: {})",
                    buildId, graph.getName(), graph.size(), errorStrategy, parallelism);

            // 图在加边时已保证无环
            if (!session.transition(BuildState.GRAPH_BUILT)) {
                return Mono.just(finish(session, start, 0));
            }
            final List<List<Integer>> levels = graph.topologicalLevels();

            DirtySet dirtySet = dirtyPropagator.markDirty(graph, session.getEnvironment());
            session.setDirtySet(dirtySet);
            if (!session.transition(BuildState.DIRTY_MARKED)) {
                return Mono.just(finish(session, start, levels.size()));
            }
            listener.onBuildStart(buildId, graph.getName(), graph.size(), dirtySet.dirtyCount());
            log.info("[Build: {}] {} of {} nodes dirty across {} levels.", buildId, dirtySet.dirtyCount(), graph.size(), levels.size());

            if (dryRun) {
                return plan(session, dirtySet, levels, start);
            }

            startPrefetch(session, dirtySet);

            if (!session.transition(BuildState.EXECUTING)) {
                return Mono.just(finish(session, start, levels.size()));
            }

            return Flux.fromIterable(levels)
                    .concatMap(level -> Flux.fromIterable(level)
                            .flatMap(id -> processNode(session, dirtySet, id), parallelism)
                            .then())
                    .takeUntilOther(session.cancelSignal())
                    .then(Mono.defer(() -> commit(session, dirtySet)))
                    .then(Mono.fromCallable(() -> finish(session, start, levels.size())))
                    .doOnCancel(() -> {
                        log.warn("[Build: {}] Build subscription cancelled.", buildId);
                        session.cancel();
                    });
        });
    }

    /**
     * 生成执行计划。缓存只做存在性查询，不提升、不下载、不写入。
     */
    private Mono<BuildReport> plan(BuildSession session, DirtySet dirtySet, List<List<Integer>> levels, Instant start) {
        String buildId = session.getBuildId();
        log.info("[Build: {}] Dry-run: planning {} nodes without executing.", buildId, session.getGraph().size());
        if (!session.transition(BuildState.EXECUTING)) {
            return Mono.just(finishPlan(session, start, levels.size(), new ArrayList<>()));
        }
        return Flux.range(0, levels.size())
                .concatMap(level -> Flux.fromIterable(levels.get(level))
                        .flatMapSequential(id -> planNode(session, dirtySet, level, id), parallelism))
                .takeUntilOther(session.cancelSignal())
                .collectList()
                .map(plan -> finishPlan(session, start, levels.size(), plan))
                .doOnCancel(session::cancel);
    }

    private Mono<BuildReport.PlannedNode> planNode(BuildSession session, DirtySet dirtySet, int level, int id) {
        BuildNode node = session.getGraph().getNode(id);
        Digest digest = dirtySet.digestOf(id);
        boolean dirty = dirtySet.isDirty(id);
        return cache.locate(digest)
                .onErrorResume(e -> {
                    log.warn("[Build: {}][Node: '{}'] Cache lookup failed during dry-run: {}", session.getBuildId(), node.getName(), e.getMessage());
                    return Mono.empty();
                })
                .map(tier -> new BuildReport.PlannedNode(id, node.getName(), level, digest, dirtySet.reasonOf(id),
                        dirty ? BuildReport.PlannedAction.FROM_CACHE : BuildReport.PlannedAction.CLEAN, tier))
                .defaultIfEmpty(new BuildReport.PlannedNode(id, node.getName(), level, digest, dirtySet.reasonOf(id),
                        BuildReport.PlannedAction.EXECUTE, null))
                .doOnNext(planned -> log.debug("[Build: {}] Plan: {}", session.getBuildId(), planned));
    }

    private BuildReport finishPlan(BuildSession session, Instant start, int levels, List<BuildReport.PlannedNode> plan) {
        session.transition(session.isCancelled() ? BuildState.CANCELLED : BuildState.DONE);
        BuildReport report = BuildReport.planned(session, session.getState(), Duration.between(start, Instant.now()), levels, plan);
        log.info("[Build: {}] Dry-run of graph '{}' planned in {}ms: {} to execute, {} from cache, {} clean. Would execute: {}",
                report.getBuildId(), report.getGraphName(), report.getDuration().toMillis(), report.getStats().getExecuted(),
                report.getStats().getCacheHits(), report.getStats().getClean(), report.plannedExecutions());
        listener.onBuildComplete(session.getBuildId(), session.getGraph().getName(), report);
        return report;
    }

    private Mono<NodeResult> processNode(BuildSession session, DirtySet dirtySet, int id) {
        return Mono.defer(() -> {
            BuildNode node = session.getGraph().getNode(id);
            Digest digest = dirtySet.digestOf(id);
            String buildId = session.getBuildId();

            if (session.isCancelled()) {
                return skip(session, node, digest, "build cancelled");
            }
            if (errorStrategy == ErrorHandlingStrategy.FAIL_FAST && session.isFailFastTriggered()) {
                return skip(session, node, digest, "FAIL_FAST active");
            }
            List<Artifact> inputs = new ArrayList<>(node.getInputs().size());
            for (Integer inputId : node.getInputs()) {
                Optional<Artifact> artifact = session.getResult(inputId).flatMap(NodeResult::getArtifact);
                if (!artifact.isPresent()) {
                    return skip(session, node, digest, "input " + inputId + " did not resolve");
                }
                inputs.add(artifact.get());
            }

            return nodeExecutor.executeNode(session, node, digest, dirtySet.isDirty(id), inputs)
                    .doOnNext(result -> {
                        session.recordResult(result);
                        if (result.isFailure() && errorStrategy == ErrorHandlingStrategy.FAIL_FAST && session.triggerFailFast()) {
                            log.warn("[Build: {}] Node '{}' failed. Activating FAIL_FAST.", buildId, node.getName());
                        }
                    });
        });
    }

    private Mono<NodeResult> skip(BuildSession session, BuildNode node, Digest digest, String reason) {
        log.debug("[Build: {}][Node: '{}'] Skipped: {}.", session.getBuildId(), node.getName(), reason);
        NodeResult result = NodeResult.skipped(node.getId(), digest);
        session.recordResult(result);
        listener.onNodeSkipped(session.getBuildId(), session.getGraph().getName(), node);
        return Mono.just(result);
    }

    /**
     * 写入构建历史并等待远程上传。历史写入失败只记录日志：下一次构建会重新判定为脏，但产物仍可从缓存获得。
     */
    private Mono<Void> commit(BuildSession session, DirtySet dirtySet) {
        List<Integer> resolved = session.getResults().values().stream()
                .filter(NodeResult::isSuccess)
                .map(NodeResult::getNodeId)
                .sorted()
                .collect(Collectors.toList());
        try {
            dirtyPropagator.recordResolved(session.getGraph(), dirtySet, resolved);
        } catch (RuntimeException e) {
            log.error("[Build: {}] Failed to persist build history: {}", session.getBuildId(), e.getMessage(), e);
        }
        if (!drainUploadsOnCompletion || !cache.hasRemoteTier()) {
            return Mono.empty();
        }
        return cache.drainUploads(drainTimeout)
                .onErrorResume(e -> {
                    log.warn("[Build: {}] Pending uploads did not finish within {}: {}", session.getBuildId(), drainTimeout, e.getMessage());
                    return Mono.empty();
                });
    }

    private BuildReport finish(BuildSession session, Instant start, int levels) {
        BuildGraph graph = session.getGraph();
        // 被取消打断而没有结果的节点补记为跳过
        for (BuildNode node : graph.getNodes()) {
            if (!session.getResult(node.getId()).isPresent()) {
                Digest digest = session.getDirtySet().map(d -> d.digestOf(node.getId())).orElse(null);
                session.recordResult(NodeResult.skipped(node.getId(), digest));
            }
        }
        boolean anyFailure = session.getResults().values().stream().anyMatch(NodeResult::isFailure);
        BuildState target = session.isCancelled() ? BuildState.CANCELLED : (anyFailure ? BuildState.FAILED : BuildState.DONE);
        session.transition(target);

        BuildReport report = BuildReport.from(session, session.getState(), Duration.between(start, Instant.now()), levels);
        logCompletion(report);
        listener.onBuildComplete(session.getBuildId(), graph.getName(), report);
        return report;
    }

    private void startPrefetch(BuildSession session, DirtySet dirtySet) {
        if (!prefetchEnabled || !cache.hasRemoteTier()) {
            return;
        }
        List<Digest> clean = session.getGraph().getNodes().stream()
                .filter(node -> !dirtySet.isDirty(node.getId()))
                .map(node -> dirtySet.digestOf(node.getId()))
                .collect(Collectors.toList());
        cache.prefetch(clean)
                .takeUntilOther(session.cancelSignal())
                .subscribe(
                        count -> log.debug("[Build: {}] Prefetched {} of {} clean artifacts.", session.getBuildId(), count, clean.size()),
                        e -> log.warn("[Build: {}] Prefetch failed: {}", session.getBuildId(), e.getMessage()));
    }

    private void logCompletion(BuildReport report) {
        BuildReport.Stats stats = report.getStats();
        String summary = String.format("total=%d, executed=%d, cacheHits=%d, clean=%d, skipped=%d, failed=%d, levels=%d, hitRate=%.1f%%",
                stats.getTotal(), stats.getExecuted(), stats.getCacheHits(), stats.getClean(), stats.getSkipped(),
                stats.getFailed(), stats.getLevels(), stats.getHitRate() * 100);
        switch (report.getState()) {
            case DONE:
                log.info("[Build: {}] Graph '{}' completed successfully in {}ms ({}).",
                        report.getBuildId(), report.getGraphName(), report.getDuration().toMillis(), summary);
                break;
            case CANCELLED:
                log.warn("[Build: {}] Graph '{}' cancelled after {}ms ({}).",
                        report.getBuildId(), report.getGraphName(), report.getDuration().toMillis(), summary);
                break;
            default:
                log.error("[Build: {}] Graph '{}' failed after {}ms ({}). Failures: {}",
                        report.getBuildId(), report.getGraphName(), report.getDuration().toMillis(), summary, report.getFailures());
                break;
        }
        if (!report.getIntegrityViolations().isEmpty()) {
            log.error("[Build: {}] Remote cache rejected {} uploads for integrity: {}",
                    report.getBuildId(), report.getIntegrityViolations().size(), report.getIntegrityViolations());
        }
    }

    private String generateBuildId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
