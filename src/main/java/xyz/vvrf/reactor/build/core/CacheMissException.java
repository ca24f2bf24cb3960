package xyz.vvrf.reactor.build.core;

import lombok.Getter;

/**
 * 所有缓存层都不存在该摘要。属于正常控制流信号。
 *
 * @author ruifeng.wen
 */
@Getter
public class CacheMissException extends BuildException {

    private final Digest digest;

    public CacheMissException(Digest digest) {
        super(ErrorKind.CACHE_MISS, "Cache miss for " + digest.shortHex());
        this.digest = digest;
    }
}
