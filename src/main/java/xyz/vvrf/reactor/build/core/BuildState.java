package xyz.vvrf.reactor.build.core;

/**
 * 单次构建调用的状态机。
 * INIT → GRAPH_BUILT → DIRTY_MARKED → EXECUTING → DONE / FAILED / CANCELLED
 *
 * @author ruifeng.wen
 */
public enum BuildState {
    INIT,
    GRAPH_BUILT,
    DIRTY_MARKED,
    EXECUTING,
    DONE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }
}
