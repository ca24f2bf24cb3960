package xyz.vvrf.reactor.build.graph;

import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 提供构建图的循环检测、分层拓扑排序和可达性查询的工具方法。
 * 基于节点 id 的邻接关系操作。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {}

    /**
     * 判断从 {@code from} 沿输入边向上是否能到达 {@code target}。
     * 新增边 parent → node 时，如果 node 能从 parent 向上到达，则会形成循环。
     */
    static boolean reachesUpstream(List<BuildNode> nodes, int from, int target) {
        Deque<Integer> stack = new ArrayDeque<>();
        Set<Integer> visited = new HashSet<>();
        stack.push(from);
        while (!stack.isEmpty()) {
            int current = stack.pop();
            if (current == target) {
                return true;
            }
            if (visited.add(current)) {
                for (Integer input : nodes.get(current).getInputs()) {
                    stack.push(input);
                }
            }
        }
        return false;
    }

    /**
     * 检测图中是否存在循环。使用显式栈的深度优先搜索，长依赖链不会耗尽线程栈。
     * <p>
     * 通过 {@link BuildGraph} 构造的图在加边时已拒绝循环，这里用于校验外部组装的节点列表。
     *
     * @return 循环中的一条边 [node, input]，无循环时为空
     */
    public static Optional<int[]> findCycle(List<BuildNode> nodes) {
        int size = nodes.size();
        int[] state = new int[size]; // 0 未访问, 1 访问中, 2 已完成
        int[] cursor = new int[size]; // 下一个待检查的输入下标
        Deque<Integer> stack = new ArrayDeque<>();
        for (BuildNode root : nodes) {
            if (state[root.getId()] != 0) {
                continue;
            }
            state[root.getId()] = 1;
            stack.push(root.getId());
            while (!stack.isEmpty()) {
                int id = stack.peek();
                List<Integer> inputs = nodes.get(id).getInputs();
                if (cursor[id] == inputs.size()) {
                    state[id] = 2;
                    stack.pop();
                    continue;
                }
                int input = inputs.get(cursor[id]++);
                if (state[input] == 1) {
                    return Optional.of(new int[]{id, input});
                }
                if (state[input] == 0) {
                    state[input] = 1;
                    stack.push(input);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * 使用 Kahn 算法计算分层拓扑排序。
     * 第 0 层为没有输入的节点，第 k 层为输入最大层级 + 1 的节点；层内按 id 升序。
     *
     * @throws IllegalStateException 如果图包含循环
     */
    public static List<List<Integer>> topologicalLevels(List<BuildNode> nodes) {
        int size = nodes.size();
        int[] inDegree = new int[size];
        Map<Integer, List<Integer>> dependents = buildDependentsList(nodes);
        for (BuildNode node : nodes) {
            // 重复输入只算一次依赖
            inDegree[node.getId()] = new HashSet<>(node.getInputs()).size();
        }

        List<Integer> current = new ArrayList<>();
        for (int id = 0; id < size; id++) {
            if (inDegree[id] == 0) {
                current.add(id);
            }
        }

        List<List<Integer>> levels = new ArrayList<>();
        int sorted = 0;
        while (!current.isEmpty()) {
            levels.add(Collections.unmodifiableList(current));
            sorted += current.size();
            List<Integer> next = new ArrayList<>();
            for (Integer u : current) {
                for (Integer v : dependents.getOrDefault(u, Collections.emptyList())) {
                    if (--inDegree[v] == 0) {
                        next.add(v);
                    }
                }
            }
            Collections.sort(next);
            current = next;
        }

        if (sorted != size) {
            List<Integer> remaining = new ArrayList<>();
            for (int id = 0; id < size; id++) {
                if (inDegree[id] > 0) {
                    remaining.add(id);
                }
            }
            throw new IllegalStateException("Topological sort failed. Graph contains a cycle. Unsorted nodes: " + remaining);
        }
        log.trace("Computed {} topological levels for {} nodes.", levels.size(), size);
        return Collections.unmodifiableList(levels);
    }

    /**
     * 节点 id → 直接下游 id 列表（去重）。
     */
    public static Map<Integer, List<Integer>> buildDependentsList(List<BuildNode> nodes) {
        Map<Integer, List<Integer>> dependents = new HashMap<>();
        for (BuildNode node : nodes) {
            for (Integer input : new LinkedHashSet<>(node.getInputs())) {
                dependents.computeIfAbsent(input, k -> new ArrayList<>()).add(node.getId());
            }
        }
        return dependents;
    }

    /**
     * 生成 DOT 图形描述，便于排查构建图结构。
     */
    public static String toDot(BuildGraph graph) {
        StringBuilder dot = new StringBuilder();
        String safeName = escapeDotString(graph.getName());
        dot.append(String.format("digraph \"%s\" {\n", safeName));
        dot.append("  rankdir=LR;\n");
        dot.append(String.format("  label=\"%s\";\n", safeName));
        dot.append("  node [shape=box, style=rounded];\n");

        for (BuildNode node : graph.getNodes()) {
            String label = String.format("%s\\n(%s)", escapeDotString(node.getName()), node.getKind());
            dot.append(String.format("  n%d [label=\"%s\"%s];\n", node.getId(), label,
                    node.isSource() ? ", style=\"rounded,dashed\"" : ""));
        }
        for (BuildNode node : graph.getNodes()) {
            String edges = node.getInputs().stream()
                    .distinct()
                    .map(input -> String.format("  n%d -> n%d;\n", input, node.getId()))
                    .collect(Collectors.joining());
            dot.append(edges);
        }
        dot.append("}\n");
        return dot.toString();
    }

    private static String escapeDotString(String input) {
        if (input == null) {
            return "";
        }
        return input.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
