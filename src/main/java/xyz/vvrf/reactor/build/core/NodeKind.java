package xyz.vvrf.reactor.build.core;

/**
 * 构建节点的类别标记，描述节点如何产生 / 被消费。
 *
 * @author ruifeng.wen
 */
public enum NodeKind {
    /** 源节点：内容来自文件系统或字面量，不执行指令。*/
    SOURCE,
    /** 外部依赖：例如拉取第三方包，由 Runner 执行。*/
    DEPENDENCY,
    /** 普通构建步骤，由 Runner 执行。*/
    BUILD,
    /** 对外产物节点，导出阶段从这里拉取结果。*/
    ARTIFACT
}
