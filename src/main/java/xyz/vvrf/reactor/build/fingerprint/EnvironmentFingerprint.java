package xyz.vvrf.reactor.build.fingerprint;

import lombok.Getter;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.Digests;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 构建环境指纹：引擎协议版本、操作系统、CPU 架构以及额外配置的键值对。
 * 折叠进每个节点的摘要，环境变化会使全部节点变脏。
 *
 * @author ruifeng.wen
 */
@Getter
public final class EnvironmentFingerprint {

    /** 引擎协议版本。变更摘要规则时递增。*/
    public static final String PROTOCOL_VERSION = "1";

    public static final String KEY_PROTOCOL = "engine.protocol";
    public static final String KEY_OS = "os.name";
    public static final String KEY_ARCH = "os.arch";

    private final SortedMap<String, String> entries;
    private final Digest digest;

    private EnvironmentFingerprint(SortedMap<String, String> entries) {
        this.entries = Collections.unmodifiableSortedMap(entries);
        Digests.Composer composer = Digests.composer("environment").putInt(entries.size());
        entries.forEach((k, v) -> composer.putString(k).putString(v));
        this.digest = composer.build();
    }

    /**
     * 由当前 JVM 的系统属性加上额外键值创建。
     */
    public static EnvironmentFingerprint current(Map<String, String> extra) {
        SortedMap<String, String> entries = new TreeMap<>();
        entries.put(KEY_PROTOCOL, PROTOCOL_VERSION);
        entries.put(KEY_OS, System.getProperty("os.name", "unknown"));
        entries.put(KEY_ARCH, System.getProperty("os.arch", "unknown"));
        if (extra != null) {
            entries.putAll(extra);
        }
        return new EnvironmentFingerprint(entries);
    }

    public static EnvironmentFingerprint current() {
        return current(Collections.emptyMap());
    }

    /**
     * 使用给定键值创建（不读取系统属性），协议版本总会被加入。
     */
    public static EnvironmentFingerprint of(Map<String, String> entries) {
        SortedMap<String, String> sorted = new TreeMap<>(Objects.requireNonNull(entries, "环境键值不能为空"));
        sorted.putIfAbsent(KEY_PROTOCOL, PROTOCOL_VERSION);
        return new EnvironmentFingerprint(sorted);
    }

    public EnvironmentFingerprint with(String key, String value) {
        SortedMap<String, String> copy = new TreeMap<>(entries);
        copy.put(key, value);
        return new EnvironmentFingerprint(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return digest.equals(((EnvironmentFingerprint) o).digest);
    }

    @Override
    public int hashCode() {
        return digest.hashCode();
    }

    @Override
    public String toString() {
        return "EnvironmentFingerprint{" + entries + ", digest=" + digest.shortHex() + '}';
    }
}
