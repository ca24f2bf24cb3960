package xyz.vvrf.reactor.build.cache;

import com.google.common.util.concurrent.Striped;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.build.core.CacheMissException;
import xyz.vvrf.reactor.build.core.CasIntegrityException;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.Digests;
import xyz.vvrf.reactor.build.core.FilesystemException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 磁盘内容寻址存储（阻塞 API）。
 * <p>
 * 目录布局：
 * <pre>
 * root/cas/ab/cd/&lt;digest&gt;   blob，按摘要前两级分片
 * root/ac/ab/&lt;digest&gt;      动作记录，内容为 blob 摘要十六进制
 * root/tmp/                   写入中的临时文件
 * </pre>
 * 写入先落临时文件再原子移动；已存在的 blob 不会被覆盖（校验后直接返回）。
 * 同一摘要的读写通过分段读写锁互斥：并发读，串行写。
 * 读取时重新计算摘要，不一致的 blob 会被删除并抛出 {@link CasIntegrityException}。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class DiskCacheStore {

    private static final String CAS_DIR = "cas";
    private static final String AC_DIR = "ac";
    private static final String TMP_DIR = "tmp";
    private static final String TMP_EXTENSION = ".tmp";

    private final Path root;
    private final Striped<ReadWriteLock> locks = Striped.readWriteLock(64);

    public DiskCacheStore(Path root) {
        this.root = Objects.requireNonNull(root, "缓存目录不能为空").toAbsolutePath();
        try {
            Files.createDirectories(this.root.resolve(CAS_DIR));
            Files.createDirectories(this.root.resolve(AC_DIR));
            Files.createDirectories(this.root.resolve(TMP_DIR));
        } catch (IOException e) {
            throw new FilesystemException(this.root, e);
        }
        log.info("DiskCacheStore initialized at {}", this.root);
    }

    public Path getRoot() {
        return root;
    }

    Path blobPath(Digest digest) {
        String hex = digest.hex();
        return root.resolve(CAS_DIR).resolve(hex.substring(0, 2)).resolve(hex.substring(2, 4)).resolve(hex);
    }

    Path actionPath(Digest nodeDigest) {
        String hex = nodeDigest.hex();
        return root.resolve(AC_DIR).resolve(hex.substring(0, 2)).resolve(hex);
    }

    // --- blob ---

    public boolean containsBlob(Digest digest) {
        Lock lock = locks.get(digest).readLock();
        lock.lock();
        try {
            return Files.isRegularFile(blobPath(digest));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 读取并校验 blob。
     *
     * @throws CasIntegrityException 磁盘内容与摘要不一致（损坏的文件已被删除）
     */
    public Optional<byte[]> readBlob(Digest digest) {
        Path path = blobPath(digest);
        byte[] bytes;
        Lock readLock = locks.get(digest).readLock();
        readLock.lock();
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new FilesystemException(path, e);
        } finally {
            readLock.unlock();
        }

        Digest actual = Digests.ofContent(bytes);
        if (!actual.equals(digest)) {
            log.error("Corrupt blob detected at {}: expected {}, got {}. Deleting.", path, digest.shortHex(), actual.shortHex());
            deleteBlob(digest);
            throw new CasIntegrityException(digest, actual, bytes.length);
        }
        touch(path);
        return Optional.of(bytes);
    }

    /**
     * 写入 blob。内容必须与摘要一致；已存在时为经过校验的空操作。
     *
     * @throws CasIntegrityException 内容与摘要不一致，不会写入
     */
    public CacheEntry writeBlob(Digest digest, byte[] bytes) {
        Digest actual = Digests.ofContent(bytes);
        if (!actual.equals(digest)) {
            throw new CasIntegrityException(digest, actual, bytes.length);
        }
        Path path = blobPath(digest);
        Lock writeLock = locks.get(digest).writeLock();
        writeLock.lock();
        try {
            if (!Files.isRegularFile(path)) {
                writeAtomically(path, bytes);
                log.trace("Stored blob {} ({} bytes)", digest.shortHex(), bytes.length);
            }
        } finally {
            writeLock.unlock();
        }
        return entry(digest).orElseThrow(() -> new IllegalStateException("Blob vanished right after write: " + digest));
    }

    public boolean deleteBlob(Digest digest) {
        Lock writeLock = locks.get(digest).writeLock();
        writeLock.lock();
        try {
            return Files.deleteIfExists(blobPath(digest));
        } catch (IOException e) {
            throw new FilesystemException(blobPath(digest), e);
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<CacheEntry> entry(Digest digest) {
        Path path = blobPath(digest);
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
            return Optional.of(new CacheEntry(digest, path, attrs.size(), attrs.creationTime().toInstant()));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new FilesystemException(path, e);
        }
    }

    // --- 动作记录 ---

    public Optional<Digest> readAction(Digest nodeDigest) {
        Path path = actionPath(nodeDigest);
        Lock readLock = locks.get(nodeDigest).readLock();
        readLock.lock();
        try {
            String hex = new String(Files.readAllBytes(path), StandardCharsets.UTF_8).trim();
            if (!Digest.isValidHex(hex)) {
                log.warn("Ignoring malformed action entry {}", path);
                return Optional.empty();
            }
            return Optional.of(Digest.fromHex(hex));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new FilesystemException(path, e);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * 写入动作记录。引用的 blob 必须已存在；已有记录且其 blob 仍然存在时保持不变。
     *
     * @throws CacheMissException 引用的 blob 不存在
     */
    public void writeAction(Digest nodeDigest, Digest contentDigest) {
        if (!containsBlob(contentDigest)) {
            throw new CacheMissException(contentDigest);
        }
        Path path = actionPath(nodeDigest);
        Lock writeLock = locks.get(nodeDigest).writeLock();
        writeLock.lock();
        try {
            Optional<Digest> existing = readActionUnlocked(path);
            if (existing.isPresent() && Files.isRegularFile(blobPath(existing.get()))) {
                if (!existing.get().equals(contentDigest)) {
                    log.debug("Action {} already maps to {}, keeping it (new content {}).",
                            nodeDigest.shortHex(), existing.get().shortHex(), contentDigest.shortHex());
                }
                return;
            }
            writeAtomically(path, contentDigest.hex().getBytes(StandardCharsets.UTF_8));
        } finally {
            writeLock.unlock();
        }
    }

    private Optional<Digest> readActionUnlocked(Path path) {
        try {
            String hex = new String(Files.readAllBytes(path), StandardCharsets.UTF_8).trim();
            return Digest.isValidHex(hex) ? Optional.of(Digest.fromHex(hex)) : Optional.empty();
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new FilesystemException(path, e);
        }
    }

    /**
     * 读取节点摘要对应的产物内容（动作记录 + blob）。
     */
    public Optional<byte[]> readArtifact(Digest nodeDigest) {
        Optional<Digest> content = readAction(nodeDigest);
        if (!content.isPresent()) {
            return Optional.empty();
        }
        return readBlob(content.get());
    }

    // --- 写入 / 维护 ---

    private void writeAtomically(Path target, byte[] bytes) {
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(root.resolve(TMP_DIR), target.getFileName().toString(), TMP_EXTENSION);
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            tmp = null;
        } catch (FileAlreadyExistsException e) {
            log.trace("Concurrent writer already stored {}", target);
        } catch (IOException e) {
            throw new FilesystemException(target, e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Failed to delete temporary file {}: {}", tmp, e.getMessage());
                }
            }
        }
    }

    private static void touch(Path path) {
        try {
            Files.setLastModifiedTime(path, FileTime.from(Instant.now()));
        } catch (IOException e) {
            log.trace("Unable to update access time of {}: {}", path, e.getMessage());
        }
    }

    public long totalSize() {
        return listBlobs().stream().mapToLong(BlobFile::getSize).sum();
    }

    /**
     * 垃圾回收：先删除最近使用时间早于 maxAge 的 blob，
     * 然后按最近使用时间从旧到新删除，直到总大小不超过 maxSizeBytes；
     * 最后清理引用已不存在 blob 的动作记录。
     *
     * @param maxAge       为空表示不按时间回收
     * @param maxSizeBytes 小于等于 0 表示不按大小回收
     */
    public GcStats collectGarbage(Duration maxAge, long maxSizeBytes) {
        List<BlobFile> blobs = listBlobs();
        int scanned = blobs.size();
        int deletedBlobs = 0;
        long freed = 0;
        Instant cutoff = maxAge != null ? Instant.now().minus(maxAge) : null;

        blobs.sort(Comparator.comparing(BlobFile::getLastUsed));
        long total = blobs.stream().mapToLong(BlobFile::getSize).sum();
        for (BlobFile blob : blobs) {
            boolean expired = cutoff != null && blob.getLastUsed().isBefore(cutoff);
            boolean oversize = maxSizeBytes > 0 && total > maxSizeBytes;
            if (!expired && !oversize) {
                continue;
            }
            if (deleteBlob(blob.getDigest())) {
                deletedBlobs++;
                freed += blob.getSize();
                total -= blob.getSize();
            }
        }

        int deletedActions = pruneDanglingActions();
        GcStats stats = new GcStats(scanned, deletedBlobs, deletedActions, freed, total);
        log.info("Disk cache GC at {} finished: {}", root, stats);
        return stats;
    }

    private int pruneDanglingActions() {
        int deleted = 0;
        try (Stream<Path> files = Files.walk(root.resolve(AC_DIR))) {
            List<Path> actions = files.filter(Files::isRegularFile).collect(Collectors.toList());
            for (Path action : actions) {
                String name = action.getFileName().toString();
                if (!Digest.isValidHex(name)) {
                    continue;
                }
                Digest nodeDigest = Digest.fromHex(name);
                Optional<Digest> content = readAction(nodeDigest);
                if (!content.isPresent() || !containsBlob(content.get())) {
                    Lock writeLock = locks.get(nodeDigest).writeLock();
                    writeLock.lock();
                    try {
                        if (Files.deleteIfExists(action)) {
                            deleted++;
                        }
                    } finally {
                        writeLock.unlock();
                    }
                }
            }
        } catch (IOException e) {
            throw new FilesystemException(root.resolve(AC_DIR), e);
        }
        return deleted;
    }

    private List<BlobFile> listBlobs() {
        try (Stream<Path> files = Files.walk(root.resolve(CAS_DIR))) {
            List<BlobFile> result = new ArrayList<>();
            for (Path path : files.filter(Files::isRegularFile).collect(Collectors.toList())) {
                String name = path.getFileName().toString();
                if (!Digest.isValidHex(name)) {
                    continue;
                }
                try {
                    BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
                    result.add(new BlobFile(Digest.fromHex(name), attrs.size(), attrs.lastModifiedTime().toInstant()));
                } catch (NoSuchFileException e) {
                    log.trace("Blob {} disappeared during listing", path);
                }
            }
            return result;
        } catch (IOException e) {
            throw new FilesystemException(root.resolve(CAS_DIR), e);
        }
    }

    private static final class BlobFile {
        private final Digest digest;
        private final long size;
        private final Instant lastUsed;

        BlobFile(Digest digest, long size, Instant lastUsed) {
            this.digest = digest;
            this.size = size;
            this.lastUsed = lastUsed;
        }

        Digest getDigest() { return digest; }
        long getSize() { return size; }
        Instant getLastUsed() { return lastUsed; }
    }
}
