package xyz.vvrf.reactor.build.dirty;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.FilesystemException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 以 JSON 文件持久化的构建历史（节点名称 → 摘要十六进制）。
 * 启动时加载；{@link #flush()} 先写临时文件，再原子替换目标文件。
 * 文件内容损坏时丢弃全部记录（所有节点变脏），不会导致构建失败。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class FileBuildHistory implements BuildHistory {

    private static final TypeReference<TreeMap<String, String>> RECORDS_TYPE = new TypeReference<TreeMap<String, String>>() {};

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, Digest> records = new ConcurrentHashMap<>();

    public FileBuildHistory(Path file, ObjectMapper objectMapper) {
        this.file = Objects.requireNonNull(file, "历史文件路径不能为空");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper 不能为空")
                .copy()
                .enable(SerializationFeature.INDENT_OUTPUT);
        load();
    }

    public FileBuildHistory(Path file) {
        this(file, new ObjectMapper());
    }

    private void load() {
        if (!Files.isRegularFile(file)) {
            log.info("Build history file {} not found, starting with empty history.", file);
            return;
        }
        try {
            Map<String, String> raw = objectMapper.readValue(file.toFile(), RECORDS_TYPE);
            raw.forEach((name, hex) -> {
                if (Digest.isValidHex(hex)) {
                    records.put(name, Digest.fromHex(hex));
                } else {
                    log.warn("Discarding invalid history entry for node '{}': '{}'", name, hex);
                }
            });
            log.info("Loaded {} build history records from {}", records.size(), file);
        } catch (IOException e) {
            log.warn("Build history file {} is unreadable, all nodes will be rebuilt: {}", file, e.getMessage());
            records.clear();
        }
    }

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

    @Override
    public synchronized void flush() {
        Map<String, String> raw = new TreeMap<>();
        records.forEach((name, digest) -> raw.put(name, digest.hex()));
        Path tmp = null;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), raw);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Flushed {} build history records to {}", raw.size(), file);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new FilesystemException(file, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Failed to delete temporary history file {}: {}", tmp, e.getMessage());
        }
    }

    public Path getFile() {
        return file;
    }
}
