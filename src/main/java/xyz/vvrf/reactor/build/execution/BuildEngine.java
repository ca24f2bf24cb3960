package xyz.vvrf.reactor.build.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.build.graph.BuildGraph;

import java.util.UUID;

/**
 * 构建引擎接口。
 * 负责对构建图做脏标记，按层级并行解析节点产物并生成构建报告。
 *
 * @author ruifeng.wen
 */
public interface BuildEngine {

    /**
     * 为指定构建图创建会话。会话可在构建开始前后任意时刻被取消。
     *
     * @param graph   已构建完成的构建图 (不能为空)
     * @param buildId 可选的构建 ID，用于日志和监控。如果为 null 或空，将自动生成。
     */
    BuildSession newSession(BuildGraph graph, String buildId);

    /**
     * 执行会话对应的构建。
     *
     * @param session 由 {@link #newSession} 创建的会话
     * @return 构建报告。节点失败不会让 Mono 以错误结束，而是体现在报告的状态与失败列表中；
     *         只有图本身无效（例如存在环）时才以错误结束。
     */
    Mono<BuildReport> build(BuildSession session);

    /**
     * 执行构建，自动生成构建 ID。
     */
    default Mono<BuildReport> build(BuildGraph graph) {
        String defaultBuildId = "build-" + UUID.randomUUID().toString().substring(0, 8);
        return build(newSession(graph, defaultBuildId));
    }
}
