package xyz.vvrf.reactor.build.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.build.core.Artifact;
import xyz.vvrf.reactor.build.core.RunnerException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * 在本地子进程中执行指令的 Runner：{@code <shell> -c <instruction>}。
 * <p>
 * 输入产物写入临时目录，路径通过环境变量 {@code BUILD_INPUT_0..n} 传递，数量为 {@code BUILD_INPUT_COUNT}。
 * 标准输出即为产物内容；非零退出码视为失败，错误信息附带标准错误的末尾片段。
 * 订阅被取消时子进程会被强制销毁。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class LocalProcessRunner implements Runner {

    public static final String ENV_INPUT_PREFIX = "BUILD_INPUT_";
    public static final String ENV_INPUT_COUNT = "BUILD_INPUT_COUNT";
    public static final String ENV_NODE_NAME = "BUILD_NODE_NAME";

    private static final int STDERR_EXCERPT_CHARS = 2000;

    private final String shell;
    private final Path workingDirectory;
    private final Scheduler scheduler;

    public LocalProcessRunner(String shell, Path workingDirectory, Scheduler scheduler) {
        this.shell = Objects.requireNonNull(shell, "shell 不能为空");
        this.workingDirectory = workingDirectory;
        this.scheduler = Objects.requireNonNull(scheduler, "进程调度器不能为空");
        log.info("LocalProcessRunner initialized. Shell: {}, Working directory: {}", shell,
                workingDirectory != null ? workingDirectory : "(inherited)");
    }

    public LocalProcessRunner() {
        this("/bin/sh", null, Schedulers.boundedElastic());
    }

    @Override
    public Mono<Artifact> run(RunRequest request) {
        return Mono.<Artifact>create(sink -> {
            Path scratch = null;
            Process process = null;
            try {
                scratch = Files.createTempDirectory("reactor-build-" + request.getNodeDigest().shortHex());
                ProcessBuilder builder = new ProcessBuilder(shell, "-c", request.getInstruction());
                if (workingDirectory != null) {
                    builder.directory(workingDirectory.toFile());
                }
                builder.environment().putAll(request.getEnvironment());
                builder.environment().put(ENV_NODE_NAME, request.getNodeName());
                List<Artifact> inputs = request.getInputs();
                builder.environment().put(ENV_INPUT_COUNT, String.valueOf(inputs.size()));
                for (int i = 0; i < inputs.size(); i++) {
                    Path inputFile = scratch.resolve("input-" + i);
                    Files.write(inputFile, inputs.get(i).getBytes());
                    builder.environment().put(ENV_INPUT_PREFIX + i, inputFile.toString());
                }
                Path stdout = scratch.resolve("stdout");
                Path stderr = scratch.resolve("stderr");
                builder.redirectOutput(stdout.toFile());
                builder.redirectError(stderr.toFile());

                log.debug("[Build: {}][Node: '{}'] Starting process: {}", request.getBuildId(), request.getNodeName(), request.getInstruction());
                Process started = builder.start();
                process = started;
                sink.onDispose(() -> {
                    if (started.isAlive()) {
                        log.debug("[Build: {}][Node: '{}'] Destroying process after cancellation.", request.getBuildId(), request.getNodeName());
                        started.destroyForcibly();
                    }
                });

                int exitCode = started.waitFor();
                if (exitCode != 0) {
                    String excerpt = tail(new String(Files.readAllBytes(stderr), StandardCharsets.UTF_8));
                    sink.error(new RunnerException(String.format("Instruction of node '%s' exited with code %d",
                            request.getNodeName(), exitCode), exitCode, excerpt));
                    return;
                }
                sink.success(Artifact.of(Files.readAllBytes(stdout)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                if (process != null) {
                    process.destroyForcibly();
                }
                sink.error(new RunnerException("Interrupted while running node '" + request.getNodeName() + "'", e));
            } catch (IOException e) {
                sink.error(new RunnerException("Failed to run node '" + request.getNodeName() + "': " + e.getMessage(), e));
            } finally {
                deleteRecursively(scratch);
            }
        }).subscribeOn(scheduler);
    }

    private static String tail(String stderr) {
        return stderr.length() <= STDERR_EXCERPT_CHARS ? stderr : stderr.substring(stderr.length() - STDERR_EXCERPT_CHARS);
    }

    private static void deleteRecursively(Path dir) {
        if (dir == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            List<Path> all = new ArrayList<>();
            paths.sorted(Comparator.reverseOrder()).forEach(all::add);
            for (Path path : all) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("Failed to clean up scratch directory {}: {}", dir, e.getMessage());
        }
    }
}
