package xyz.vvrf.reactor.build.dirty;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.fingerprint.EnvironmentFingerprint;
import xyz.vvrf.reactor.build.graph.BuildGraph;
import xyz.vvrf.reactor.build.graph.BuildNode;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 脏标记传播器。
 * <p>
 * 按拓扑层级顺序计算节点摘要并与构建历史比较：没有记录、摘要变化、或任一输入为脏的节点标记为脏。
 * 输入变化会通过摘要重算自然向下传播；显式检查输入还能覆盖历史文件被外部修改的情况。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class DirtyPropagator {

    private final BuildHistory history;

    public DirtyPropagator(BuildHistory history) {
        this.history = Objects.requireNonNull(history, "构建历史不能为空");
    }

    public DirtySet markDirty(BuildGraph graph, EnvironmentFingerprint environment) {
        Map<Integer, Digest> digests = new HashMap<>();
        Map<Integer, DirtySet.Reason> reasons = new HashMap<>();

        for (List<Integer> level : graph.topologicalLevels()) {
            for (Integer id : level) {
                BuildNode node = graph.getNode(id);
                Digest digest = graph.computeDigest(id, environment);
                digests.put(id, digest);

                DirtySet.Reason reason;
                Optional<Digest> last = history.lastDigest(node.getName());
                if (!last.isPresent()) {
                    reason = DirtySet.Reason.NO_RECORD;
                } else if (!last.get().equals(digest)) {
                    reason = DirtySet.Reason.DIGEST_CHANGED;
                } else if (node.getInputs().stream().anyMatch(input -> reasons.get(input) != DirtySet.Reason.CLEAN)) {
                    reason = DirtySet.Reason.INPUT_DIRTY;
                } else {
                    reason = DirtySet.Reason.CLEAN;
                }
                reasons.put(id, reason);
                log.trace("[Build: {}][Node: '{}'] digest {} -> {}", graph.getName(), node.getName(), digest.shortHex(), reason);
            }
        }

        DirtySet dirtySet = new DirtySet(digests, reasons);
        log.debug("[Build: {}] Dirty marking finished: {} of {} nodes dirty.", graph.getName(), dirtySet.dirtyCount(), dirtySet.size());
        return dirtySet;
    }

    /**
     * 为成功解析的节点写入构建历史并持久化。失败或跳过的节点不记录，保持为脏。
     */
    public void recordResolved(BuildGraph graph, DirtySet dirtySet, Collection<Integer> resolvedIds) {
        for (Integer id : resolvedIds) {
            history.record(graph.getNode(id).getName(), dirtySet.digestOf(id));
        }
        history.flush();
        log.debug("[Build: {}] Recorded {} resolved nodes in build history.", graph.getName(), resolvedIds.size());
    }

    public BuildHistory getHistory() {
        return history;
    }
}
