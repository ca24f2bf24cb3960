package xyz.vvrf.reactor.build.core;

/**
 * 定义构建过程中的错误处理策略。
 *
 * @author ruifeng.wen
 */
public enum ErrorHandlingStrategy {
    /**
     * 快速失败：任何节点失败后，尚未开始的节点全部跳过，构建结果为失败。
     * 这是默认策略。
     */
    FAIL_FAST,

    /**
     * 隔离失败：只跳过失败节点的下游，与之无关的子图继续执行。
     * 构建结果仍为失败，但会尽可能多地产出其他分支的产物。
     */
    ISOLATE_FAILURES
}
