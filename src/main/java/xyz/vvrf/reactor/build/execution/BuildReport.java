package xyz.vvrf.reactor.build.execution;

import lombok.Getter;
import xyz.vvrf.reactor.build.core.Artifact;
import xyz.vvrf.reactor.build.core.BuildException;
import xyz.vvrf.reactor.build.core.BuildState;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.ErrorKind;
import xyz.vvrf.reactor.build.core.NodeKind;
import xyz.vvrf.reactor.build.core.NodeResult;
import xyz.vvrf.reactor.build.dirty.DirtySet;
import xyz.vvrf.reactor.build.graph.BuildGraph;
import xyz.vvrf.reactor.build.graph.BuildNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 一次构建的最终报告：终态、耗时、统计、失败节点、产物以及远程完整性违规。
 *
 * @author ruifeng.wen
 */
@Getter
public final class BuildReport {

    private final String buildId;
    private final String graphName;
    private final BuildState state;
    private final Duration duration;
    private final Stats stats;
    private final List<Failure> failures;
    /** 节点 id → 已解析产物，按 id 排序。*/
    private final Map<Integer, ResolvedArtifact> artifacts;
    private final List<BuildSession.IntegrityViolation> integrityViolations;
    private final Map<Integer, NodeResult> results;
    /** 是否为只生成执行计划的构建。*/
    private final boolean dryRun;
    /** 执行计划，按层级和 id 排序；只有 dry-run 构建才非空。*/
    private final List<PlannedNode> plan;

    BuildReport(String buildId, String graphName, BuildState state, Duration duration, Stats stats,
                List<Failure> failures, Map<Integer, ResolvedArtifact> artifacts,
                List<BuildSession.IntegrityViolation> integrityViolations, Map<Integer, NodeResult> results,
                boolean dryRun, List<PlannedNode> plan) {
        this.buildId = buildId;
        this.graphName = graphName;
        this.state = state;
        this.duration = duration;
        this.stats = stats;
        this.failures = Collections.unmodifiableList(failures);
        this.artifacts = Collections.unmodifiableMap(artifacts);
        this.integrityViolations = Collections.unmodifiableList(integrityViolations);
        this.results = Collections.unmodifiableMap(results);
        this.dryRun = dryRun;
        this.plan = Collections.unmodifiableList(plan);
    }

    static BuildReport from(BuildSession session, BuildState state, Duration duration, int levels) {
        BuildGraph graph = session.getGraph();
        Map<Integer, NodeResult> results = new TreeMap<>(session.getResults());
        Map<Integer, ResolvedArtifact> artifacts = new TreeMap<>();
        List<Failure> failures = new ArrayList<>();
        int executed = 0;
        int cacheHits = 0;
        int clean = 0;
        int skipped = 0;

        for (NodeResult result : results.values()) {
            BuildNode node = graph.getNode(result.getNodeId());
            if (result.isSuccess()) {
                artifacts.put(node.getId(), new ResolvedArtifact(node.getName(), result.getNodeDigest(),
                        result.getArtifact().orElseThrow(IllegalStateException::new)));
                switch (result.getOrigin()) {
                    case EXECUTED:
                        executed++;
                        break;
                    case CACHE_HIT:
                        cacheHits++;
                        break;
                    case CLEAN:
                        clean++;
                        break;
                    default:
                        break;
                }
            } else if (result.isFailure()) {
                Throwable error = result.getError().orElseThrow(IllegalStateException::new);
                boolean integrity = error instanceof BuildException && ((BuildException) error).isIntegrityViolation();
                failures.add(new Failure(node.getId(), node.getName(), node.getKind(), result.getErrorKind(),
                        String.valueOf(error.getMessage()), integrity));
            } else {
                skipped++;
            }
        }

        Stats stats = new Stats(graph.size(), session.getDirtySet().map(d -> d.dirtyCount()).orElse(0),
                executed, cacheHits, clean, skipped, failures.size(), levels);
        return new BuildReport(session.getBuildId(), graph.getName(), state, duration, stats, failures, artifacts,
                session.getIntegrityViolations(), results, false, Collections.emptyList());
    }

    static BuildReport planned(BuildSession session, BuildState state, Duration duration, int levels, List<PlannedNode> plan) {
        BuildGraph graph = session.getGraph();
        int executed = 0;
        int cacheHits = 0;
        int clean = 0;
        for (PlannedNode planned : plan) {
            switch (planned.getAction()) {
                case EXECUTE:
                    executed++;
                    break;
                case FROM_CACHE:
                    cacheHits++;
                    break;
                default:
                    clean++;
                    break;
            }
        }
        Stats stats = new Stats(graph.size(), session.getDirtySet().map(d -> d.dirtyCount()).orElse(0),
                executed, cacheHits, clean, graph.size() - plan.size(), 0, levels);
        return new BuildReport(session.getBuildId(), graph.getName(), state, duration, stats, Collections.emptyList(),
                Collections.emptyMap(), Collections.emptyList(), Collections.emptyMap(), true, plan);
    }

    /**
     * 计划中将要执行的节点名称，按执行顺序。
     */
    public List<String> plannedExecutions() {
        List<String> names = new ArrayList<>();
        for (PlannedNode planned : plan) {
            if (planned.getAction() == PlannedAction.EXECUTE) {
                names.add(planned.getNodeName());
            }
        }
        return names;
    }

    public boolean isSuccessful() {
        return state == BuildState.DONE;
    }

    public Optional<ResolvedArtifact> getArtifact(int nodeId) {
        return Optional.ofNullable(artifacts.get(nodeId));
    }

    public Optional<NodeResult> getResult(int nodeId) {
        return Optional.ofNullable(results.get(nodeId));
    }

    @Override
    public String toString() {
        return "BuildReport{build=" + buildId + ", graph='" + graphName + "', state=" + state
                + ", duration=" + duration.toMillis() + "ms, " + stats + ", failures=" + failures.size()
                + ", integrityViolations=" + integrityViolations.size() + (dryRun ? ", dryRun" : "") + '}';
    }

    /**
     * 构建统计。
     */
    @Getter
    public static final class Stats {
        private final int total;
        private final int dirty;
        /** 本地计算产生产物的节点数（包括源节点和聚合节点）。*/
        private final int executed;
        /** 脏节点缓存命中数。*/
        private final int cacheHits;
        /** 干净节点直接从缓存解析的数量。*/
        private final int clean;
        private final int skipped;
        private final int failed;
        private final int levels;

        Stats(int total, int dirty, int executed, int cacheHits, int clean, int skipped, int failed, int levels) {
            this.total = total;
            this.dirty = dirty;
            this.executed = executed;
            this.cacheHits = cacheHits;
            this.clean = clean;
            this.skipped = skipped;
            this.failed = failed;
            this.levels = levels;
        }

        /**
         * 成功节点中由缓存提供产物的比例。没有成功节点时为 0。
         */
        public double getHitRate() {
            int resolved = executed + cacheHits + clean;
            return resolved == 0 ? 0.0 : (double) (cacheHits + clean) / resolved;
        }

        @Override
        public String toString() {
            return String.format("Stats{total=%d, dirty=%d, executed=%d, cacheHits=%d, clean=%d, skipped=%d, failed=%d, levels=%d, hitRate=%.2f}",
                    total, dirty, executed, cacheHits, clean, skipped, failed, levels, getHitRate());
        }
    }

    /**
     * 失败节点条目。
     */
    @Getter
    public static final class Failure {
        private final int nodeId;
        private final String nodeName;
        private final NodeKind kind;
        private final ErrorKind errorKind;
        private final String message;
        private final boolean integrityViolation;

        Failure(int nodeId, String nodeName, NodeKind kind, ErrorKind errorKind, String message, boolean integrityViolation) {
            this.nodeId = nodeId;
            this.nodeName = nodeName;
            this.kind = kind;
            this.errorKind = errorKind;
            this.message = message;
            this.integrityViolation = integrityViolation;
        }

        @Override
        public String toString() {
            return "Failure{" + nodeId + ":'" + nodeName + "', " + errorKind + ", " + message + '}';
        }
    }

    /**
     * 执行计划中节点的预期处理方式。
     */
    public enum PlannedAction {
        /** 干净且缓存中存在。*/
        CLEAN,
        /** 脏，但缓存中已有相同摘要的产物。*/
        FROM_CACHE,
        /** 需要调用 Runner 或本地计算。*/
        EXECUTE
    }

    @Getter
    public static final class PlannedNode {
        private final int nodeId;
        private final String nodeName;
        private final int level;
        private final Digest nodeDigest;
        private final DirtySet.Reason reason;
        private final PlannedAction action;
        /** 缓存命中的层名称，未命中为 null。*/
        private final String tier;

        PlannedNode(int nodeId, String nodeName, int level, Digest nodeDigest, DirtySet.Reason reason,
                    PlannedAction action, String tier) {
            this.nodeId = nodeId;
            this.nodeName = nodeName;
            this.level = level;
            this.nodeDigest = nodeDigest;
            this.reason = reason;
            this.action = action;
            this.tier = tier;
        }

        @Override
        public String toString() {
            return "PlannedNode{" + nodeId + ":'" + nodeName + "', level=" + level + ", " + reason + " -> " + action
                    + (tier != null ? " (" + tier + ")" : "") + '}';
        }
    }

    /**
     * 交给导出阶段的产物。
     */
    @Getter
    public static final class ResolvedArtifact {
        private final String nodeName;
        private final Digest nodeDigest;
        private final Artifact artifact;

        ResolvedArtifact(String nodeName, Digest nodeDigest, Artifact artifact) {
            this.nodeName = nodeName;
            this.nodeDigest = nodeDigest;
            this.artifact = artifact;
        }
    }
}
