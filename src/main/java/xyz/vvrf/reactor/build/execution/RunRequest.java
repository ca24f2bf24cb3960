package xyz.vvrf.reactor.build.execution;

import lombok.Getter;
import xyz.vvrf.reactor.build.core.Artifact;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.NodeKind;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 一次 Runner 调用的输入（不可变）。
 *
 * @author ruifeng.wen
 */
@Getter
public final class RunRequest {

    private final String buildId;
    private final String nodeName;
    private final NodeKind kind;
    private final Digest nodeDigest;
    private final String instruction;
    /** 按节点输入顺序排列的已解析产物。*/
    private final List<Artifact> inputs;
    private final SortedMap<String, String> environment;

    public RunRequest(String buildId, String nodeName, NodeKind kind, Digest nodeDigest, String instruction,
                      List<Artifact> inputs, Map<String, String> environment) {
        this.buildId = Objects.requireNonNull(buildId, "构建 ID 不能为空");
        this.nodeName = Objects.requireNonNull(nodeName, "节点名称不能为空");
        this.kind = Objects.requireNonNull(kind, "节点类别不能为空");
        this.nodeDigest = Objects.requireNonNull(nodeDigest, "节点摘要不能为空");
        this.instruction = Objects.requireNonNull(instruction, "指令不能为空");
        this.inputs = Collections.unmodifiableList(Objects.requireNonNull(inputs, "输入产物不能为空"));
        this.environment = Collections.unmodifiableSortedMap(
                new TreeMap<>(environment != null ? environment : Collections.emptyMap()));
    }

    @Override
    public String toString() {
        return "RunRequest{node='" + nodeName + "', digest=" + nodeDigest.shortHex() + ", inputs=" + inputs.size() + '}';
    }
}
