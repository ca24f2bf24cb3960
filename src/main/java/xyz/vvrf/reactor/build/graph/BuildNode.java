package xyz.vvrf.reactor.build.graph;

import lombok.Getter;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 构建图中的单个节点。只能由 {@link BuildGraph} 创建，id 是图内存储区的下标。
 * 除了后加的输入边之外，节点定义不可变。
 *
 * @author ruifeng.wen
 */
@Getter
public final class BuildNode {

    private final int id;
    /** 稳定的逻辑身份，用于构建历史。*/
    private final String name;
    private final NodeKind kind;
    private final String instruction;
    /** 节点直接读取的外部文件系统状态的摘要，可为空。*/
    private final Digest contextFingerprint;
    /** 传递给 Runner 的环境变量（按键排序）。*/
    private final SortedMap<String, String> environment;

    private final List<Integer> inputs;

    BuildNode(int id, String name, NodeKind kind, List<Integer> inputs, String instruction,
              Digest contextFingerprint, SortedMap<String, String> environment) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "节点名称不能为空");
        this.kind = Objects.requireNonNull(kind, "节点类别不能为空");
        this.inputs = new ArrayList<>(Objects.requireNonNull(inputs, "输入列表不能为空"));
        this.instruction = instruction != null ? instruction : "";
        this.contextFingerprint = contextFingerprint;
        this.environment = Collections.unmodifiableSortedMap(
                environment != null ? new TreeMap<>(environment) : new TreeMap<>());
    }

    /**
     * 有序的输入节点 id 列表。顺序参与摘要计算。
     */
    public List<Integer> getInputs() {
        return Collections.unmodifiableList(inputs);
    }

    void appendInputs(List<Integer> extra) {
        inputs.addAll(extra);
    }

    public boolean isSource() {
        return kind == NodeKind.SOURCE;
    }

    public boolean hasInstruction() {
        return !instruction.isEmpty();
    }

    @Override
    public String toString() {
        return "BuildNode{" + id + ":'" + name + "', " + kind + ", inputs=" + inputs + '}';
    }
}
