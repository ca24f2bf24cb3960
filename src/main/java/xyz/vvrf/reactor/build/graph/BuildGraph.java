package xyz.vvrf.reactor.build.graph;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.build.core.CyclicDependencyException;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.Digests;
import xyz.vvrf.reactor.build.core.NodeKind;
import xyz.vvrf.reactor.build.core.UnknownInputException;
import xyz.vvrf.reactor.build.fingerprint.EnvironmentFingerprint;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 构建图：以 int id 为下标的扁平节点存储区，保证无环。
 * <p>
 * 每次 {@link #addNode} 都会校验：输入必须已存在，因此新节点不可能闭合循环；
 * 后加边 {@link #addInputs} 只从新的父节点向上做可达性检查。
 * 拓扑分层与节点摘要都被缓存，任何结构变化都会使其失效。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class BuildGraph {

    private static final String NODE_DOMAIN = "node";

    private final String name;
    private final List<BuildNode> nodes = new ArrayList<>();
    private final Map<String, Integer> nameIndex = new HashMap<>();
    private final Map<String, Integer> signatureCounts = new HashMap<>();

    private volatile List<List<Integer>> cachedLevels;
    private final Map<Integer, Digest> digests = new ConcurrentHashMap<>();
    private volatile Digest digestEnvironment;

    public BuildGraph(String name) {
        this.name = Objects.requireNonNull(name, "构建图名称不能为空");
    }

    public BuildGraph() {
        this("build");
    }

    public String getName() {
        return name;
    }

    /**
     * 添加节点（名称自动派生，无环境变量）。
     */
    public int addNode(NodeKind kind, List<Integer> inputs, String instruction, Digest contextFingerprint) {
        return addNode(null, kind, inputs, instruction, contextFingerprint, Collections.emptyMap());
    }

    /**
     * 添加节点。
     *
     * @param name               稳定的逻辑名称；为空时派生为 kind:instruction:输入名称，重复时追加序号
     * @param inputs             有序的输入节点 id，必须已存在
     * @param contextFingerprint 外部文件系统状态的摘要，可为空
     * @return 新节点的 id
     * @throws UnknownInputException 输入 id 不存在
     */
    public synchronized int addNode(String name, NodeKind kind, List<Integer> inputs, String instruction,
                                    Digest contextFingerprint, Map<String, String> environment) {
        Objects.requireNonNull(kind, "节点类别不能为空");
        List<Integer> inputList = inputs != null ? inputs : Collections.emptyList();
        for (Integer input : inputList) {
            if (input == null || input < 0 || input >= nodes.size()) {
                throw new UnknownInputException(String.valueOf(input));
            }
        }

        String nodeName = name != null ? name : deriveName(kind, inputList, instruction);
        if (nameIndex.containsKey(nodeName)) {
            throw new IllegalArgumentException(String.format("节点名称 '%s' 在构建图 '%s' 中已存在。", nodeName, this.name));
        }

        int id = nodes.size();
        SortedMap<String, String> env = environment != null ? new TreeMap<>(environment) : new TreeMap<>();
        BuildNode node = new BuildNode(id, nodeName, kind, inputList, instruction, contextFingerprint, env);
        nodes.add(node);
        nameIndex.put(nodeName, id);
        invalidateLevels();
        log.debug("[Build: {}] Added node {} '{}' ({}), inputs: {}", this.name, id, nodeName, kind, inputList);
        return id;
    }

    /**
     * 为已有节点追加输入边。
     *
     * @throws CyclicDependencyException 新边会形成循环
     */
    public synchronized void addInputs(int id, List<Integer> extraInputs) {
        BuildNode node = getNode(id);
        for (Integer input : extraInputs) {
            if (input == null || input < 0 || input >= nodes.size()) {
                throw new UnknownInputException(String.valueOf(input));
            }
            if (GraphUtils.reachesUpstream(nodes, input, id)) {
                log.error("[Build: {}] Rejecting edge {} -> {}: cycle detected.", name, input, id);
                throw new CyclicDependencyException(id, input);
            }
        }
        node.appendInputs(extraInputs);
        invalidateLevels();
        digests.clear();
        log.debug("[Build: {}] Appended inputs {} to node {} '{}'", name, extraInputs, id, node.getName());
    }

    private String deriveName(NodeKind kind, List<Integer> inputs, String instruction) {
        String signature = kind.name().toLowerCase(Locale.ROOT) + ":" + (instruction != null ? instruction : "") + ":"
                + inputs.stream().map(i -> nodes.get(i).getName()).collect(Collectors.joining(","));
        int ordinal = signatureCounts.merge(signature, 1, Integer::sum);
        return ordinal == 1 ? signature : signature + "#" + ordinal;
    }

    public BuildNode getNode(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new NoSuchElementException("No node with id " + id + " in graph '" + name + "'");
        }
        return nodes.get(id);
    }

    public Optional<BuildNode> findNode(String nodeName) {
        Integer id = nameIndex.get(nodeName);
        return id == null ? Optional.empty() : Optional.of(nodes.get(id));
    }

    public List<BuildNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * 节点的直接下游 id。
     */
    public List<Integer> getDependents(int id) {
        return GraphUtils.buildDependentsList(nodes).getOrDefault(id, Collections.emptyList());
    }

    /**
     * 分层拓扑排序，计算一次后缓存。
     */
    public List<List<Integer>> topologicalLevels() {
        List<List<Integer>> levels = cachedLevels;
        if (levels == null) {
            synchronized (this) {
                if (cachedLevels == null) {
                    cachedLevels = GraphUtils.topologicalLevels(nodes);
                }
                levels = cachedLevels;
            }
        }
        return levels;
    }

    private void invalidateLevels() {
        cachedLevels = null;
    }

    /**
     * 计算节点摘要（纯函数，带缓存）。所有输入节点的摘要必须已经计算完成。
     *
     * @throws IllegalStateException 存在尚未计算摘要的输入
     */
    public Digest computeDigest(int id, EnvironmentFingerprint environment) {
        Objects.requireNonNull(environment, "环境指纹不能为空");
        resetDigestsIfEnvironmentChanged(environment);
        Digest cached = digests.get(id);
        if (cached != null) {
            return cached;
        }
        BuildNode node = getNode(id);
        Digests.Composer composer = Digests.composer(NODE_DOMAIN).putInt(node.getInputs().size());
        for (Integer input : node.getInputs()) {
            Digest inputDigest = digests.get(input);
            if (inputDigest == null) {
                throw new IllegalStateException(String.format(
                        "Cannot compute digest of node %d '%s': input %d has no digest yet.", id, node.getName(), input));
            }
            composer.putDigest(inputDigest);
        }
        composer.putString(node.getInstruction())
                .putDigest(node.getContextFingerprint())
                .putDigest(environment.getDigest())
                .putInt(node.getEnvironment().size());
        node.getEnvironment().forEach((k, v) -> composer.putString(k).putString(v));
        Digest digest = composer.build();
        digests.put(id, digest);
        log.trace("[Build: {}][Node: '{}'] digest = {}", name, node.getName(), digest.shortHex());
        return digest;
    }

    /**
     * 按拓扑层级顺序计算全部节点摘要。
     */
    public Map<Integer, Digest> computeAllDigests(EnvironmentFingerprint environment) {
        for (List<Integer> level : topologicalLevels()) {
            for (Integer id : level) {
                computeDigest(id, environment);
            }
        }
        return Collections.unmodifiableMap(new TreeMap<>(digests));
    }

    public Optional<Digest> getDigest(int id) {
        return Optional.ofNullable(digests.get(id));
    }

    private synchronized void resetDigestsIfEnvironmentChanged(EnvironmentFingerprint environment) {
        if (!environment.getDigest().equals(digestEnvironment)) {
            if (digestEnvironment != null) {
                log.debug("[Build: {}] Environment fingerprint changed, discarding memoized digests.", name);
            }
            digests.clear();
            digestEnvironment = environment.getDigest();
        }
    }

    @Override
    public String toString() {
        return "BuildGraph{'" + name + "', nodes=" + nodes.size() + '}';
    }
}
