package xyz.vvrf.reactor.build.core;

import com.google.common.hash.HashCode;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 256 位摘要值（不可变）。
 * 既用作节点身份，也用作各级缓存的键。文本形式固定为 64 位小写十六进制。
 *
 * @author ruifeng.wen
 */
public final class Digest implements Comparable<Digest> {

    /** 摘要字节长度 (SHA-256)。 */
    public static final int SIZE_BYTES = 32;

    private static final Pattern HEX_PATTERN = Pattern.compile("[0-9a-f]{64}");

    private final HashCode hashCode;

    private Digest(HashCode hashCode) {
        this.hashCode = Objects.requireNonNull(hashCode, "HashCode 不能为空");
        if (hashCode.bits() != SIZE_BYTES * 8) {
            throw new IllegalArgumentException("Digest must be 256 bits, got " + hashCode.bits());
        }
    }

    public static Digest of(HashCode hashCode) {
        return new Digest(hashCode);
    }

    public static Digest fromBytes(byte[] bytes) {
        return new Digest(HashCode.fromBytes(bytes));
    }

    /**
     * 解析十六进制文本形式的摘要。
     *
     * @throws IllegalArgumentException 如果文本不是 64 位小写十六进制
     */
    public static Digest fromHex(String hex) {
        Objects.requireNonNull(hex, "摘要文本不能为空");
        String trimmed = hex.trim();
        if (!isValidHex(trimmed)) {
            throw new IllegalArgumentException("Not a valid digest: '" + hex + "'");
        }
        return new Digest(HashCode.fromString(trimmed));
    }

    public static boolean isValidHex(String hex) {
        return hex != null && HEX_PATTERN.matcher(hex).matches();
    }

    public String hex() {
        return hashCode.toString();
    }

    /** 日志中使用的短形式（前 12 位）。 */
    public String shortHex() {
        return hex().substring(0, 12);
    }

    public byte[] toBytes() {
        return hashCode.asBytes();
    }

    @Override
    public int compareTo(Digest other) {
        return hex().compareTo(other.hex());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return hashCode.equals(((Digest) o).hashCode);
    }

    @Override
    public int hashCode() {
        return hashCode.hashCode();
    }

    @Override
    public String toString() {
        return hex();
    }
}
