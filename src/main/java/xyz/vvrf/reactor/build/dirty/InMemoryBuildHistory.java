package xyz.vvrf.reactor.build.dirty;

import xyz.vvrf.reactor.build.core.Digest;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于内存的构建历史，用于测试和嵌入式场景。
 *
 * @author ruifeng.wen
 */
public class InMemoryBuildHistory implements BuildHistory {

    private final Map<String, Digest> records = new ConcurrentHashMap<>();

    @Override
    public Optional<Digest> lastDigest(String nodeName) {
        return Optional.ofNullable(records.get(nodeName));
    }

    @Override
    public void record(String nodeName, Digest digest) {
        records.put(Objects.requireNonNull(nodeName, "节点名称不能为空"), Objects.requireNonNull(digest, "摘要不能为空"));
    }

    @Override
    public void forget(String nodeName) {
        records.remove(nodeName);
    }

    public Map<String, Digest> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(records));
    }

    public int size() {
        return records.size();
    }
}
