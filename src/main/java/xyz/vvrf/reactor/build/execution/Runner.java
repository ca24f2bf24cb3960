package xyz.vvrf.reactor.build.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.build.core.Artifact;

/**
 * 外部执行器：执行节点指令并返回产物。
 * <p>
 * 返回的产物携带声明的内容摘要，引擎在写入缓存前会重新计算并比对。
 * 实现应当响应取消：订阅被取消时停止正在进行的工作（例如销毁子进程）。
 * 执行失败以 {@link xyz.vvrf.reactor.build.core.RunnerException} 结束。
 *
 * @author ruifeng.wen
 */
@FunctionalInterface
public interface Runner {

    Mono<Artifact> run(RunRequest request);
}
