package xyz.vvrf.reactor.build.fingerprint;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.Digests;
import xyz.vvrf.reactor.build.core.FilesystemException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 指纹引擎：计算文件、目录树和字节内容的摘要。
 * <p>
 * 目录指纹：递归遍历（不跟随符号链接），使用 '/' 分隔的相对路径按 {@link String#compareTo} 排序，
 * 被忽略的目录不会进入；结果为 H("tree" ‖ 每个文件的 len‖path ‖ digest)。
 * 文件摘要在调度器上并发计算，通过 flatMapSequential 保证组合顺序与工作线程时序无关。
 * 任何 I/O 错误都会导致 {@link FilesystemException}，不会返回部分摘要。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class Fingerprinter {

    private static final String TREE_DOMAIN = "tree";
    private static final String SYMLINK_DOMAIN = "symlink";

    private final Scheduler scheduler;
    private final int concurrency;

    public Fingerprinter(Scheduler scheduler, int concurrency) {
        this.scheduler = Objects.requireNonNull(scheduler, "指纹计算调度器不能为空");
        if (concurrency <= 0) {
            throw new IllegalArgumentException("Fingerprint concurrency must be positive.");
        }
        this.concurrency = concurrency;
    }

    public Fingerprinter() {
        this(Schedulers.boundedElastic(), Runtime.getRuntime().availableProcessors());
    }

    /**
     * 字节内容的摘要。
     */
    public Digest fingerprint(byte[] content) {
        return Digests.ofContent(content);
    }

    /**
     * 计算路径的指纹。普通文件返回内容摘要，目录返回树摘要。
     */
    public Mono<Digest> fingerprint(Path root, IgnoreRules ignoreRules) {
        Objects.requireNonNull(root, "路径不能为空");
        IgnoreRules rules = ignoreRules != null ? ignoreRules : IgnoreRules.empty();
        return Mono.defer(() -> {
            if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
                return Mono.error(new FilesystemException(root, new NoSuchFileException(root.toString())));
            }
            if (!Files.isDirectory(root, LinkOption.NOFOLLOW_LINKS)) {
                return Mono.fromCallable(() -> digestEntry(root)).subscribeOn(scheduler);
            }
            return Mono.fromCallable(() -> collectFiles(root, rules))
                    .subscribeOn(scheduler)
                    .flatMap(files -> fingerprintTree(root, files));
        });
    }

    /**
     * 同步版本，供图构建阶段直接调用。
     */
    public Digest fingerprintBlocking(Path root, IgnoreRules ignoreRules) {
        return fingerprint(root, ignoreRules).block();
    }

    /**
     * 以构建上下文目录自带的 .dockerignore / .gitignore 计算指纹。
     */
    public Mono<Digest> fingerprintContext(Path contextDir) {
        return Mono.fromCallable(() -> IgnoreRules.load(contextDir))
                .flatMap(rules -> fingerprint(contextDir, rules));
    }

    private Mono<Digest> fingerprintTree(Path root, List<String> relativePaths) {
        log.debug("Fingerprinting {} files under {}", relativePaths.size(), root);
        return Flux.fromIterable(relativePaths)
                .flatMapSequential(rel -> Mono.fromCallable(() -> digestEntry(root.resolve(rel)))
                        .subscribeOn(scheduler), concurrency)
                .index()
                .reduceWith(() -> Digests.composer(TREE_DOMAIN), (composer, indexed) -> composer
                        .putString(relativePaths.get(indexed.getT1().intValue()))
                        .putDigest(indexed.getT2()))
                .map(Digests.Composer::build)
                .doOnNext(digest -> log.trace("Tree digest of {}: {}", root, digest.shortHex()));
    }

    /**
     * 遍历目录，返回排序后的相对路径（'/' 分隔）。
     */
    private List<String> collectFiles(Path root, IgnoreRules rules) {
        List<String> files = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(root)) {
                        return FileVisitResult.CONTINUE;
                    }
                    String rel = relativize(root, dir);
                    if (rules.isIgnored(rel) && !rules.mayReincludeUnder(rel)) {
                        log.trace("Skipping ignored directory {}", dir);
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    String rel = relativize(root, file);
                    if (!rules.isIgnored(rel)) {
                        files.add(rel);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                    throw exc;
                }
            });
        } catch (IOException e) {
            throw new FilesystemException(root, e);
        }
        files.sort(Comparator.naturalOrder());
        return files;
    }

    private static Digest digestEntry(Path path) {
        try {
            if (Files.isSymbolicLink(path)) {
                // 符号链接按链接目标文本计算，不跟随
                return Digests.composer(SYMLINK_DOMAIN)
                        .putString(Files.readSymbolicLink(path).toString().replace('\\', '/'))
                        .build();
            }
            return Digests.ofFile(path);
        } catch (IOException e) {
            throw new FilesystemException(path, e);
        }
    }

    private static String relativize(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    /**
     * 字符串内容的摘要，供字面量源节点使用。
     */
    public Digest fingerprint(String literal) {
        return Digests.ofContent(literal.getBytes(StandardCharsets.UTF_8));
    }
}
