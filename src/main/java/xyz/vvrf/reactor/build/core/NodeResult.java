package xyz.vvrf.reactor.build.core;

import lombok.Getter;

import java.util.Objects;
import java.util.Optional;

/**
 * 单个构建节点处理完成后的结果（不可变数据类）。
 * 包含执行状态、产物来源、可选的产物以及可能的错误信息。
 *
 * @author ruifeng.wen
 */
public final class NodeResult {

    /**
     * 节点执行状态枚举。
     */
    public enum NodeStatus {
        /** 节点成功完成，必须包含产物。*/
        SUCCESS,
        /** 节点执行失败，必须包含错误信息。*/
        FAILURE,
        /** 节点被跳过：上游失败、FAIL_FAST 生效或构建被取消。*/
        SKIPPED
    }

    /**
     * 成功结果的产物来源。
     */
    public enum Origin {
        /** 干净节点，直接从缓存解析。*/
        CLEAN,
        /** 脏节点，缓存命中。*/
        CACHE_HIT,
        /** 由 Runner 执行产生（或源节点 / 聚合节点本地计算）。*/
        EXECUTED,
        /** 非成功结果。*/
        NONE
    }

    @Getter private final int nodeId;
    @Getter private final NodeStatus status;
    @Getter private final Origin origin;
    @Getter private final Digest nodeDigest;
    private final Artifact artifact;
    private final Throwable error;

    private NodeResult(int nodeId, NodeStatus status, Origin origin, Digest nodeDigest, Artifact artifact, Throwable error) {
        this.nodeId = nodeId;
        this.status = Objects.requireNonNull(status, "节点状态不能为空");
        this.origin = Objects.requireNonNull(origin, "产物来源不能为空");
        this.nodeDigest = nodeDigest;
        this.artifact = artifact;
        this.error = error;

        // 内部一致性校验
        if (status == NodeStatus.SUCCESS && artifact == null) {
            throw new IllegalArgumentException("SUCCESS 状态的结果必须包含产物。");
        }
        if (status == NodeStatus.FAILURE && error == null) {
            throw new IllegalArgumentException("FAILURE 状态的结果必须包含一个非空的错误信息。");
        }
        if (status != NodeStatus.FAILURE && error != null) {
            throw new IllegalArgumentException("非 FAILURE 状态的结果不能包含错误信息。");
        }
    }

    public static NodeResult success(int nodeId, Digest nodeDigest, Artifact artifact, Origin origin) {
        Objects.requireNonNull(nodeDigest, "节点摘要不能为空");
        if (origin == Origin.NONE) {
            throw new IllegalArgumentException("成功结果必须标明产物来源。");
        }
        return new NodeResult(nodeId, NodeStatus.SUCCESS, origin, nodeDigest, artifact, null);
    }

    public static NodeResult failure(int nodeId, Digest nodeDigest, Throwable error) {
        Objects.requireNonNull(error, "错误对象不能为空");
        return new NodeResult(nodeId, NodeStatus.FAILURE, Origin.NONE, nodeDigest, null, error);
    }

    public static NodeResult skipped(int nodeId, Digest nodeDigest) {
        return new NodeResult(nodeId, NodeStatus.SKIPPED, Origin.NONE, nodeDigest, null, null);
    }

    public Optional<Artifact> getArtifact() {
        return Optional.ofNullable(artifact);
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    public ErrorKind getErrorKind() {
        return error == null ? null : ErrorKind.of(error);
    }

    public boolean isSuccess() { return this.status == NodeStatus.SUCCESS; }
    public boolean isFailure() { return this.status == NodeStatus.FAILURE; }
    public boolean isSkipped() { return this.status == NodeStatus.SKIPPED; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeResult that = (NodeResult) o;
        return nodeId == that.nodeId &&
                status == that.status &&
                origin == that.origin &&
                Objects.equals(nodeDigest, that.nodeDigest) &&
                Objects.equals(artifact, that.artifact) &&
                Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId, status, origin, nodeDigest, artifact, error);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("NodeResult{");
        sb.append("node=").append(nodeId).append(", status=").append(status);
        if (origin != Origin.NONE) {
            sb.append(", origin=").append(origin);
        }
        getArtifact().ifPresent(a -> sb.append(", artifact=").append(a.getContentDigest().shortHex()));
        getError().ifPresent(e -> sb.append(", error=").append(e.getClass().getSimpleName()));
        sb.append('}');
        return sb.toString();
    }
}
