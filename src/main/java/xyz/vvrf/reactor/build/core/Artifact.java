package xyz.vvrf.reactor.build.core;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * 构建产物：内容字节及其内容摘要（不可变）。
 * 内容摘要必须等于 {@link Digests#ofContent(byte[])} 的结果，由 {@link #verify()} 校验。
 *
 * @author ruifeng.wen
 */
public final class Artifact {

    private final Digest contentDigest;
    private final byte[] bytes;

    private Artifact(Digest contentDigest, byte[] bytes) {
        this.contentDigest = Objects.requireNonNull(contentDigest, "内容摘要不能为空");
        this.bytes = Objects.requireNonNull(bytes, "产物内容不能为空");
    }

    /**
     * 根据内容计算摘要并创建产物。
     */
    public static Artifact of(byte[] bytes) {
        byte[] copy = bytes.clone();
        return new Artifact(Digests.ofContent(copy), copy);
    }

    public static Artifact ofString(String content) {
        return of(content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 使用调用方声明的摘要创建产物，不做校验。
     * 来自 Runner 或远程缓存的数据走这个入口，之后必须调用 {@link #verify()}。
     */
    public static Artifact declared(Digest contentDigest, byte[] bytes) {
        return new Artifact(contentDigest, bytes.clone());
    }

    public Digest getContentDigest() {
        return contentDigest;
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }

    public String asString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * 重新计算内容摘要并与声明的摘要比较。
     *
     * @return this
     * @throws CasIntegrityException 摘要不一致
     */
    public Artifact verify() {
        return verify(contentDigest);
    }

    /**
     * 校验内容摘要是否等于期望值。
     */
    public Artifact verify(Digest expected) {
        Digest actual = Digests.ofContent(bytes);
        if (!actual.equals(expected) || !actual.equals(contentDigest)) {
            throw new CasIntegrityException(expected, actual, bytes.length);
        }
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return contentDigest.equals(((Artifact) o).contentDigest);
    }

    @Override
    public int hashCode() {
        return contentDigest.hashCode();
    }

    @Override
    public String toString() {
        return "Artifact{" + contentDigest.shortHex() + ", size=" + bytes.length + '}';
    }
}
