package xyz.vvrf.reactor.build.core;

/**
 * 构建过程中错误的分类。
 * 报告失败节点时使用，完整性错误需要与普通执行失败区分展示。
 *
 * @author ruifeng.wen
 */
public enum ErrorKind {
    /** 指纹计算时的 I/O 错误，对该节点子树是致命的。*/
    FILESYSTEM,
    /** 图构建时发现循环依赖。*/
    CYCLIC_DEPENDENCY,
    /** 图构建时引用了不存在的输入节点。*/
    UNKNOWN_INPUT,
    /** 缓存未命中：正常的控制流信号，不是错误。*/
    CACHE_MISS,
    /** 内容寻址存储完整性校验失败，可能意味着缓存损坏或被篡改。*/
    CAS_INTEGRITY,
    /** 远程缓存网络错误，分为可重试与不可重试。*/
    NETWORK,
    /** Runner 执行失败。*/
    RUNNER,
    /** 构建被取消。*/
    CANCELLED,
    /** 未分类的内部错误。*/
    INTERNAL;

    public static ErrorKind of(Throwable error) {
        if (error instanceof BuildException) {
            return ((BuildException) error).getKind();
        }
        return INTERNAL;
    }
}
