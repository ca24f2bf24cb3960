package xyz.vvrf.reactor.build.core;

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 摘要计算工具。
 * <p>
 * 内容摘要规则（文件、字节数组、CAS 校验共用同一规则）：
 * <ul>
 *     <li>长度不超过 {@link #CHUNK_SIZE} 的内容：SHA-256(bytes)</li>
 *     <li>更大的内容：按 64 KiB 切块，依次计算每块的 SHA-256，
 *     结果为 SHA-256("chunked" ‖ 块数(int, little-endian) ‖ chunk_0 ‖ … ‖ chunk_n)</li>
 * </ul>
 *
 * @author ruifeng.wen
 */
public final class Digests {

    public static final int CHUNK_SIZE = 64 * 1024;

    private static final HashFunction SHA_256 = Hashing.sha256();

    private Digests() {}

    public static Digest ofContent(byte[] bytes) {
        if (bytes.length <= CHUNK_SIZE) {
            return Digest.of(SHA_256.hashBytes(bytes));
        }
        List<HashCode> chunks = new ArrayList<>(bytes.length / CHUNK_SIZE + 1);
        for (int offset = 0; offset < bytes.length; offset += CHUNK_SIZE) {
            int length = Math.min(CHUNK_SIZE, bytes.length - offset);
            chunks.add(SHA_256.hashBytes(bytes, offset, length));
        }
        return combineChunks(chunks);
    }

    public static Digest ofString(String content) {
        return ofContent(content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 以流的方式计算内容摘要，内存占用不超过两个块。
     */
    public static Digest ofStream(InputStream in) throws IOException {
        byte[] first = in.readNBytes(CHUNK_SIZE);
        byte[] next = in.readNBytes(CHUNK_SIZE);
        if (next.length == 0) {
            return Digest.of(SHA_256.hashBytes(first));
        }
        List<HashCode> chunks = new ArrayList<>();
        chunks.add(SHA_256.hashBytes(first));
        while (next.length > 0) {
            chunks.add(SHA_256.hashBytes(next));
            next = in.readNBytes(CHUNK_SIZE);
        }
        return combineChunks(chunks);
    }

    public static Digest ofFile(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return ofStream(in);
        }
    }

    private static Digest combineChunks(List<HashCode> chunks) {
        Hasher hasher = SHA_256.newHasher()
                .putString("chunked", StandardCharsets.UTF_8)
                .putInt(chunks.size());
        for (HashCode chunk : chunks) {
            hasher.putBytes(chunk.asBytes());
        }
        return Digest.of(hasher.hash());
    }

    /**
     * 创建一个字段组合器。每个字段带类型标记和长度前缀，拼接结果无歧义。
     *
     * @param domain 区分不同用途摘要的域名前缀
     */
    public static Composer composer(String domain) {
        return new Composer(domain);
    }

    /**
     * 有序字段组合器。字段顺序参与摘要计算。
     */
    public static final class Composer {
        private static final byte TAG_DIGEST = 1;
        private static final byte TAG_STRING = 2;
        private static final byte TAG_ABSENT = 3;

        private final Hasher hasher = SHA_256.newHasher();

        private Composer(String domain) {
            putString(domain);
        }

        public Composer putDigest(Digest digest) {
            if (digest == null) {
                hasher.putByte(TAG_ABSENT);
                return this;
            }
            hasher.putByte(TAG_DIGEST).putBytes(digest.toBytes());
            return this;
        }

        public Composer putString(String value) {
            if (value == null) {
                hasher.putByte(TAG_ABSENT);
                return this;
            }
            byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
            hasher.putByte(TAG_STRING).putInt(bytes.length).putBytes(bytes);
            return this;
        }

        public Composer putInt(int value) {
            hasher.putInt(value);
            return this;
        }

        public Digest build() {
            return Digest.of(hasher.hash());
        }
    }
}
