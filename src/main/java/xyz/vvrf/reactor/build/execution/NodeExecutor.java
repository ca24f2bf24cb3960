package xyz.vvrf.reactor.build.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.build.core.Artifact;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.NodeResult;
import xyz.vvrf.reactor.build.graph.BuildNode;

import java.util.List;

/**
 * 节点执行器接口
 * 负责解析单个构建节点的产物：从缓存读取，或在必要时调用 Runner。
 *
 * @author ruifeng.wen
 */
public interface NodeExecutor {

    /**
     * 解析节点产物。
     * <p>
     * 实现不应以错误信号结束返回的 Mono；执行失败以 {@link NodeResult#failure} 表示。
     *
     * @param session    当前构建会话
     * @param node       要解析的节点
     * @param nodeDigest 节点摘要
     * @param dirty      节点是否为脏
     * @param inputs     按输入顺序排列的已解析输入产物
     * @return 包含节点结果的 Mono
     */
    Mono<NodeResult> executeNode(BuildSession session, BuildNode node, Digest nodeDigest, boolean dirty, List<Artifact> inputs);
}
