package xyz.vvrf.reactor.build.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.build.core.ErrorHandlingStrategy;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 构建引擎的配置属性类
 * 绑定 'build' 前缀下的属性。
 *
 * @author ruifeng.wen
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "build")
@Validated
public class BuildEngineProperties {

    @Valid
    private final Engine engine = new Engine();
    @Valid
    private final SchedulerProps scheduler = new SchedulerProps();
    @Valid
    private final Cache cache = new Cache();
    @Valid
    private final History history = new History();
    @Valid
    private final RunnerProps runner = new RunnerProps();
    @Valid
    private final Server server = new Server();

    @Getter
    @Setter
    public static class Engine {
        /**
         * 同一层级内并行解析的节点数。默认为可用处理器的数量。
         */
        @Min(1)
        private int parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());

        @NotNull
        private ErrorHandlingStrategy errorStrategy = ErrorHandlingStrategy.FAIL_FAST;

        /**
         * 单次 Runner 调用的超时时间。
         */
        @NotNull
        private Duration nodeTimeout = Duration.ofMinutes(10);

        /**
         * 折叠进环境指纹的额外键值，例如工具链版本。
         */
        private Map<String, String> environment = new LinkedHashMap<>();

        /**
         * 只计算执行计划：不调用 Runner，不写缓存和构建历史。
         */
        private boolean dryRun = false;
    }

    @Getter
    @Setter
    public static class SchedulerProps {
        private SchedulerType type = SchedulerType.BOUNDED_ELASTIC;

        private String namePrefix = "build-exec";

        @Valid
        private final BoundedElasticProps boundedElastic = new BoundedElasticProps();

        @Valid
        private final ParallelProps parallel = new ParallelProps();

        /**
         * 当 type 为 CUSTOM 时，自定义 Scheduler Bean 的名称。
         */
        private String customBeanName;
    }

    public enum SchedulerType {
        BOUNDED_ELASTIC, PARALLEL, CUSTOM
    }

    @Getter
    @Setter
    public static class BoundedElasticProps {
        @Min(1)
        private int threadCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE;
        @Min(1)
        private int queuedTaskCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE;
        @Min(0)
        private int ttlSeconds = 60;
    }

    @Getter
    @Setter
    public static class ParallelProps {
        @Min(1)
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    @Getter
    @Setter
    public static class Cache {
        @Valid
        private final Memory memory = new Memory();
        @Valid
        private final Disk disk = new Disk();
        @Valid
        private final Remote remote = new Remote();
    }

    @Getter
    @Setter
    public static class Memory {
        /**
         * L1 中产物字节总数上限。
         */
        @Min(0)
        private long maxWeightBytes = 256L * 1024 * 1024;
    }

    @Getter
    @Setter
    public static class Disk {
        @NotBlank
        private String directory = ".reactor-build/cache";

        /**
         * 启动时按大小回收的上限，0 表示不限制。
         */
        @Min(0)
        private long maxSizeBytes = 0;

        /**
         * 启动时按最近使用时间回收的阈值，为空表示不按时间回收。
         */
        private Duration maxAge;
    }

    @Getter
    @Setter
    public static class Remote {
        private boolean enabled = false;

        private String baseUrl;

        /**
         * 单次远程请求的超时时间。
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        /**
         * 为 true 时远程错误在重试耗尽后使节点失败，而不是降级为未命中。
         */
        private boolean required = false;

        /**
         * 构建结束时等待未完成的上传。
         */
        private boolean drainOnCompletion = true;

        @NotNull
        private Duration drainTimeout = Duration.ofMinutes(1);

        /**
         * 构建开始时把干净节点的产物从远程预取到本地。
         */
        private boolean prefetch = false;

        @Valid
        private final RetryProps retry = new RetryProps();
    }

    @Getter
    @Setter
    public static class RetryProps {
        /**
         * 最大总尝试次数 (1 表示不重试)。
         */
        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration firstBackoff = Duration.ofMillis(100);

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(2);

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitterFactor = 0.5;
    }

    @Getter
    @Setter
    public static class History {
        /**
         * 构建历史文件。为空时使用内存历史（进程退出即丢失）。
         */
        private String file = ".reactor-build/history.json";
    }

    @Getter
    @Setter
    public static class RunnerProps {
        private RunnerType type = RunnerType.LOCAL_PROCESS;

        /**
         * 当 type 为 CUSTOM 时，自定义 Runner Bean 的名称。
         */
        private String customBeanName;

        @NotBlank
        private String shell = "/bin/sh";

        /**
         * 子进程工作目录，为空时继承当前进程。
         */
        private String workingDirectory;
    }

    public enum RunnerType {
        LOCAL_PROCESS, CUSTOM
    }

    @Getter
    @Setter
    public static class Server {
        /**
         * 是否暴露远程缓存 HTTP 接口（需要响应式 Web 应用）。
         */
        private boolean enabled = false;

        @NotBlank
        private String storageDirectory = ".reactor-build/server";
    }

    @Override
    public String toString() {
        return "BuildEngineProperties{" +
                "engine={parallelism=" + engine.parallelism +
                ", errorStrategy=" + engine.errorStrategy +
                ", nodeTimeout=" + engine.nodeTimeout +
                "}, scheduler={type=" + scheduler.type +
                ", namePrefix='" + scheduler.namePrefix + '\'' +
                "}, cache={memory=" + cache.memory.maxWeightBytes +
                ", disk='" + cache.disk.directory + '\'' +
                ", remote={enabled=" + cache.remote.enabled +
                ", baseUrl='" + cache.remote.baseUrl + '\'' +
                ", required=" + cache.remote.required +
                "}}, history='" + history.file + '\'' +
                ", runner={type=" + runner.type +
                "}, server={enabled=" + server.enabled +
                "}}";
    }
}
