package xyz.vvrf.reactor.build.execution;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import xyz.vvrf.reactor.build.core.BuildState;
import xyz.vvrf.reactor.build.core.CasIntegrityException;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.NodeResult;
import xyz.vvrf.reactor.build.dirty.DirtySet;
import xyz.vvrf.reactor.build.fingerprint.EnvironmentFingerprint;
import xyz.vvrf.reactor.build.graph.BuildGraph;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 单次构建调用的上下文，持有该次构建的全部可变状态。
 * <p>
 * 会话之间不共享计数器和结果；同一进程内并发的多次构建只通过缓存与 single-flight 交互。
 * {@link #cancel()} 可以在任意线程调用。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class BuildSession {

    private static final Map<BuildState, Set<BuildState>> TRANSITIONS = new EnumMap<>(BuildState.class);

    static {
        TRANSITIONS.put(BuildState.INIT, EnumSet.of(BuildState.GRAPH_BUILT, BuildState.FAILED, BuildState.CANCELLED));
        TRANSITIONS.put(BuildState.GRAPH_BUILT, EnumSet.of(BuildState.DIRTY_MARKED, BuildState.FAILED, BuildState.CANCELLED));
        TRANSITIONS.put(BuildState.DIRTY_MARKED, EnumSet.of(BuildState.EXECUTING, BuildState.FAILED, BuildState.CANCELLED));
        TRANSITIONS.put(BuildState.EXECUTING, EnumSet.of(BuildState.DONE, BuildState.FAILED, BuildState.CANCELLED));
        TRANSITIONS.put(BuildState.DONE, EnumSet.noneOf(BuildState.class));
        TRANSITIONS.put(BuildState.FAILED, EnumSet.noneOf(BuildState.class));
        TRANSITIONS.put(BuildState.CANCELLED, EnumSet.noneOf(BuildState.class));
    }

    @Getter private final String buildId;
    @Getter private final BuildGraph graph;
    @Getter private final EnvironmentFingerprint environment;
    @Getter private final Instant createdAt = Instant.now();

    private final AtomicReference<BuildState> state = new AtomicReference<>(BuildState.INIT);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean failFastTriggered = new AtomicBoolean(false);
    private final Sinks.Empty<Void> cancelSink = Sinks.empty();
    private final Map<Integer, NodeResult> results = new ConcurrentHashMap<>();
    private final List<IntegrityViolation> integrityViolations = Collections.synchronizedList(new ArrayList<>());

    private volatile DirtySet dirtySet;

    public BuildSession(String buildId, BuildGraph graph, EnvironmentFingerprint environment) {
        this.buildId = Objects.requireNonNull(buildId, "构建 ID 不能为空");
        this.graph = Objects.requireNonNull(graph, "构建图不能为空");
        this.environment = Objects.requireNonNull(environment, "环境指纹不能为空");
    }

    public BuildState getState() {
        return state.get();
    }

    /**
     * 按状态机推进。非法迁移抛出 {@link IllegalStateException}；
     * 已处于终态时返回 false（例如取消与完成竞争时）。
     */
    public boolean transition(BuildState next) {
        while (true) {
            BuildState current = state.get();
            if (current.isTerminal()) {
                return false;
            }
            if (!TRANSITIONS.get(current).contains(next)) {
                throw new IllegalStateException(String.format("[Build: %s] Illegal state transition %s -> %s", buildId, current, next));
            }
            if (state.compareAndSet(current, next)) {
                log.debug("[Build: {}] State {} -> {}", buildId, current, next);
                return true;
            }
        }
    }

    /**
     * 请求取消构建。正在执行的 Runner 订阅会被取消，尚未开始的节点被跳过。
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("[Build: {}] Cancellation requested.", buildId);
            cancelSink.tryEmitEmpty();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * 取消信号：取消时完成，供 {@code takeUntilOther} 使用。
     */
    public Mono<Void> cancelSignal() {
        return cancelSink.asMono();
    }

    boolean triggerFailFast() {
        return failFastTriggered.compareAndSet(false, true);
    }

    boolean isFailFastTriggered() {
        return failFastTriggered.get();
    }

    void recordResult(NodeResult result) {
        results.put(result.getNodeId(), result);
    }

    public Optional<NodeResult> getResult(int nodeId) {
        return Optional.ofNullable(results.get(nodeId));
    }

    public Map<Integer, NodeResult> getResults() {
        return Collections.unmodifiableMap(results);
    }

    void setDirtySet(DirtySet dirtySet) {
        this.dirtySet = dirtySet;
    }

    public Optional<DirtySet> getDirtySet() {
        return Optional.ofNullable(dirtySet);
    }

    /**
     * 远程上传失败的回调。只有完整性错误会进入报告，其它上传失败已由缓存记录日志和计数。
     */
    void onUploadFailure(Digest nodeDigest, Throwable error) {
        if (error instanceof CasIntegrityException) {
            integrityViolations.add(new IntegrityViolation(nodeDigest, error.getMessage()));
        }
    }

    List<IntegrityViolation> getIntegrityViolations() {
        synchronized (integrityViolations) {
            return new ArrayList<>(integrityViolations);
        }
    }

    /**
     * 远程缓存拒绝上传（内容与声明摘要不符）的记录。
     */
    @Getter
    public static final class IntegrityViolation {
        private final Digest nodeDigest;
        private final String message;

        public IntegrityViolation(Digest nodeDigest, String message) {
            this.nodeDigest = nodeDigest;
            this.message = message;
        }

        @Override
        public String toString() {
            return "IntegrityViolation{" + nodeDigest.shortHex() + ": " + message + '}';
        }
    }
}
