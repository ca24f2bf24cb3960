package xyz.vvrf.reactor.build.core;

import lombok.Getter;

/**
 * 内容的实际摘要与声明的键不一致。永远不会被降级为警告。
 *
 * @author ruifeng.wen
 */
@Getter
public class CasIntegrityException extends BuildException {

    private final Digest expected;
    private final Digest actual;
    private final long size;

    public CasIntegrityException(Digest expected, Digest actual, long size) {
        super(ErrorKind.CAS_INTEGRITY, String.format("CAS integrity failure: expected %s, got %s (size: %d bytes)",
                expected.shortHex(), actual.shortHex(), size));
        this.expected = expected;
        this.actual = actual;
        this.size = size;
    }

    /**
     * 服务端拒绝了上传，但未返回实际摘要时使用。
     */
    public CasIntegrityException(Digest expected, String reason) {
        super(ErrorKind.CAS_INTEGRITY, String.format("CAS integrity failure for %s: %s", expected.shortHex(), reason));
        this.expected = expected;
        this.actual = null;
        this.size = -1;
    }
}
