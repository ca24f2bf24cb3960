package xyz.vvrf.reactor.build.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.build.cache.CacheTier;
import xyz.vvrf.reactor.build.cache.DiskCacheStore;
import xyz.vvrf.reactor.build.cache.DiskCacheTier;
import xyz.vvrf.reactor.build.cache.MemoryCacheTier;
import xyz.vvrf.reactor.build.cache.RemoteCacheTier;
import xyz.vvrf.reactor.build.cache.TieredCache;
import xyz.vvrf.reactor.build.cache.remote.HttpRemoteCacheClient;
import xyz.vvrf.reactor.build.dirty.BuildHistory;
import xyz.vvrf.reactor.build.dirty.DirtyPropagator;
import xyz.vvrf.reactor.build.dirty.FileBuildHistory;
import xyz.vvrf.reactor.build.dirty.InMemoryBuildHistory;
import xyz.vvrf.reactor.build.execution.BuildEngine;
import xyz.vvrf.reactor.build.execution.LocalProcessRunner;
import xyz.vvrf.reactor.build.execution.NodeExecutor;
import xyz.vvrf.reactor.build.execution.Runner;
import xyz.vvrf.reactor.build.execution.StandardBuildEngine;
import xyz.vvrf.reactor.build.execution.StandardNodeExecutor;
import xyz.vvrf.reactor.build.fingerprint.EnvironmentFingerprint;
import xyz.vvrf.reactor.build.fingerprint.Fingerprinter;
import xyz.vvrf.reactor.build.monitor.BuildMonitorListener;
import xyz.vvrf.reactor.build.monitor.CompositeBuildMonitorListener;
import xyz.vvrf.reactor.build.monitor.LoggingBuildMonitorListener;
import xyz.vvrf.reactor.build.monitor.MicrometerBuildMonitorListener;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 构建引擎的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link BuildEngineProperties}。
 * 2. 提供节点执行与文件 I/O 使用的 {@link Scheduler} Bean。
 * 3. 组装分层缓存：L1 内存、L2 磁盘，以及按配置启用的 L3 远程缓存。
 * 4. 按 {@code build.runner.type} 选择 {@link Runner}。
 * 5. 收集所有 {@link BuildMonitorListener} Bean 并提供 {@link BuildEngine}。
 * <p>
 * 所有 Bean 都可以由用户定义同类型（或同名）Bean 覆盖。
 *
 * @author ruifeng.wen
 */
@Configuration
@EnableConfigurationProperties(BuildEngineProperties.class)
@Slf4j
public class BuildEngineAutoConfiguration {

    private final ApplicationContext applicationContext;

    public BuildEngineAutoConfiguration(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
        log.info("构建引擎自动配置 (BuildEngineAutoConfiguration) 已加载。");
    }

    /**
     * 节点执行调度器。类型和参数由 {@link BuildEngineProperties.SchedulerProps} 配置。
     */
    @Bean(name = "buildNodeExecutionScheduler")
    @ConditionalOnMissingBean(name = "buildNodeExecutionScheduler")
    public Scheduler buildNodeExecutionScheduler(BuildEngineProperties properties) {
        BuildEngineProperties.SchedulerProps schedulerProps = properties.getScheduler();
        String namePrefix = schedulerProps.getNamePrefix();
        BuildEngineProperties.BoundedElasticProps beProps = schedulerProps.getBoundedElastic();

        switch (schedulerProps.getType()) {
            case PARALLEL:
                log.info("正在创建 'buildNodeExecutionScheduler' (Parallel): prefix={}, parallelism={}",
                        namePrefix, schedulerProps.getParallel().getParallelism());
                return Schedulers.newParallel(namePrefix, schedulerProps.getParallel().getParallelism(), true);
            case CUSTOM:
                String customBeanName = schedulerProps.getCustomBeanName();
                if (customBeanName == null || customBeanName.trim().isEmpty()) {
                    log.error("'build.scheduler.type=CUSTOM' 但 'build.scheduler.custom-bean-name' 未配置。回退到默认 BoundedElastic。");
                    return Schedulers.newBoundedElastic(beProps.getThreadCap(), beProps.getQueuedTaskCap(),
                            namePrefix + "-fallback", beProps.getTtlSeconds(), true);
                }
                log.info("正在从 Spring 上下文获取自定义 Scheduler Bean，名称: {}", customBeanName);
                return applicationContext.getBean(customBeanName, Scheduler.class);
            case BOUNDED_ELASTIC:
            default:
                log.info("正在创建 'buildNodeExecutionScheduler' (BoundedElastic): prefix={}, cap={}, queue={}, ttl={}s",
                        namePrefix, beProps.getThreadCap(), beProps.getQueuedTaskCap(), beProps.getTtlSeconds());
                return Schedulers.newBoundedElastic(beProps.getThreadCap(), beProps.getQueuedTaskCap(),
                        namePrefix, beProps.getTtlSeconds(), true);
        }
    }

    /**
     * 文件 I/O（指纹计算、磁盘缓存）使用的调度器。
     */
    @Bean(name = "buildIoScheduler")
    @ConditionalOnMissingBean(name = "buildIoScheduler")
    public Scheduler buildIoScheduler() {
        return Schedulers.boundedElastic();
    }

    @Bean
    @ConditionalOnMissingBean
    public Fingerprinter fingerprinter(@Qualifier("buildIoScheduler") Scheduler ioScheduler) {
        return new Fingerprinter(ioScheduler, Math.max(1, Runtime.getRuntime().availableProcessors()));
    }

    @Bean
    @ConditionalOnMissingBean
    public EnvironmentFingerprint environmentFingerprint(BuildEngineProperties properties) {
        EnvironmentFingerprint environment = EnvironmentFingerprint.current(properties.getEngine().getEnvironment());
        log.info("环境指纹: {}", environment);
        return environment;
    }

    @Bean
    @ConditionalOnMissingBean
    public BuildHistory buildHistory(BuildEngineProperties properties) {
        String file = properties.getHistory().getFile();
        if (file == null || file.trim().isEmpty()) {
            log.warn("'build.history.file' 未配置，使用内存构建历史。进程重启后所有节点都会被判定为脏。");
            return new InMemoryBuildHistory();
        }
        return new FileBuildHistory(Paths.get(file));
    }

    @Bean
    @ConditionalOnMissingBean
    public DirtyPropagator dirtyPropagator(BuildHistory buildHistory) {
        return new DirtyPropagator(buildHistory);
    }

    // --- 缓存 ---

    @Bean
    @ConditionalOnMissingBean
    public MemoryCacheTier memoryCacheTier(BuildEngineProperties properties) {
        return new MemoryCacheTier(properties.getCache().getMemory().getMaxWeightBytes());
    }

    @Bean(name = "diskCacheStore")
    @ConditionalOnMissingBean(name = "diskCacheStore")
    public DiskCacheStore diskCacheStore(BuildEngineProperties properties) {
        BuildEngineProperties.Disk disk = properties.getCache().getDisk();
        DiskCacheStore store = new DiskCacheStore(Paths.get(disk.getDirectory()));
        if (disk.getMaxAge() != null || disk.getMaxSizeBytes() > 0) {
            log.info("启动时回收磁盘缓存: maxAge={}, maxSizeBytes={}", disk.getMaxAge(), disk.getMaxSizeBytes());
            store.collectGarbage(disk.getMaxAge(), disk.getMaxSizeBytes());
        }
        return store;
    }

    @Bean
    @ConditionalOnMissingBean
    public DiskCacheTier diskCacheTier(@Qualifier("diskCacheStore") DiskCacheStore diskCacheStore, @Qualifier("buildIoScheduler") Scheduler ioScheduler) {
        return new DiskCacheTier(diskCacheStore, ioScheduler);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "build.cache.remote", name = "enabled", havingValue = "true")
    public RemoteCacheTier remoteCacheTier(BuildEngineProperties properties, ObjectProvider<WebClient.Builder> webClientBuilder) {
        BuildEngineProperties.Remote remote = properties.getCache().getRemote();
        if (remote.getBaseUrl() == null || remote.getBaseUrl().trim().isEmpty()) {
            throw new IllegalStateException("'build.cache.remote.enabled=true' 但 'build.cache.remote.base-url' 未配置。");
        }
        BuildEngineProperties.RetryProps retry = remote.getRetry();
        RemoteCacheTier.Policy policy = new RemoteCacheTier.Policy(remote.getTimeout(), retry.getMaxAttempts(),
                retry.getFirstBackoff(), retry.getMaxBackoff(), retry.getJitterFactor(), remote.isRequired());
        log.info("正在创建远程缓存层: baseUrl={}, timeout={}, maxAttempts={}, required={}",
                remote.getBaseUrl(), remote.getTimeout(), retry.getMaxAttempts(), remote.isRequired());
        HttpRemoteCacheClient client = new HttpRemoteCacheClient(
                webClientBuilder.getIfAvailable(WebClient::builder), remote.getBaseUrl());
        return new RemoteCacheTier(client, policy);
    }

    @Bean
    @ConditionalOnMissingBean
    public TieredCache tieredCache(MemoryCacheTier memoryCacheTier, DiskCacheTier diskCacheTier,
                                   ObjectProvider<RemoteCacheTier> remoteCacheTier,
                                   @Qualifier("buildMonitorListeners") List<BuildMonitorListener> listeners) {
        List<CacheTier> localTiers = new ArrayList<>();
        localTiers.add(memoryCacheTier);
        localTiers.add(diskCacheTier);
        return new TieredCache(localTiers, remoteCacheTier.getIfAvailable(), new CompositeBuildMonitorListener(listeners));
    }

    // --- 执行 ---

    /**
     * 按 {@code build.runner.type} 选择 Runner。CUSTOM 类型从上下文中按名称获取。
     */
    @Bean
    @ConditionalOnMissingBean
    public Runner buildRunner(BuildEngineProperties properties, @Qualifier("buildIoScheduler") Scheduler ioScheduler) {
        BuildEngineProperties.RunnerProps runnerProps = properties.getRunner();
        if (runnerProps.getType() == BuildEngineProperties.RunnerType.CUSTOM) {
            String beanName = runnerProps.getCustomBeanName();
            if (beanName == null || beanName.trim().isEmpty()) {
                throw new IllegalStateException("'build.runner.type=CUSTOM' 但 'build.runner.custom-bean-name' 未配置。");
            }
            log.info("使用自定义 Runner Bean: {}", beanName);
            return applicationContext.getBean(beanName, Runner.class);
        }
        String workingDirectory = runnerProps.getWorkingDirectory();
        return new LocalProcessRunner(runnerProps.getShell(),
                workingDirectory != null && !workingDirectory.trim().isEmpty() ? Paths.get(workingDirectory) : null,
                ioScheduler);
    }

    @Bean
    @ConditionalOnMissingBean
    public NodeExecutor nodeExecutor(BuildEngineProperties properties, TieredCache tieredCache, Runner buildRunner,
                                     @Qualifier("buildNodeExecutionScheduler") Scheduler scheduler,
                                     @Qualifier("buildMonitorListeners") List<BuildMonitorListener> listeners) {
        return new StandardNodeExecutor(tieredCache, buildRunner, properties.getEngine().getNodeTimeout(), scheduler,
                new CompositeBuildMonitorListener(listeners));
    }

    @Bean
    @ConditionalOnMissingBean
    public BuildEngine buildEngine(BuildEngineProperties properties, NodeExecutor nodeExecutor,
                                   DirtyPropagator dirtyPropagator, TieredCache tieredCache,
                                   EnvironmentFingerprint environmentFingerprint,
                                   @Qualifier("buildMonitorListeners") List<BuildMonitorListener> listeners) {
        log.info("正在创建 BuildEngine Bean，配置: {}", properties);
        BuildEngineProperties.Remote remote = properties.getCache().getRemote();
        return new StandardBuildEngine(nodeExecutor, dirtyPropagator, tieredCache, environmentFingerprint,
                properties.getEngine().getParallelism(), properties.getEngine().getErrorStrategy(),
                new CompositeBuildMonitorListener(listeners))
                .drainUploadsOnCompletion(remote.isDrainOnCompletion(), remote.getDrainTimeout())
                .prefetch(remote.isPrefetch())
                .dryRun(properties.getEngine().isDryRun());
    }

    // --- 监控 ---

    @Bean
    @ConditionalOnMissingBean
    public LoggingBuildMonitorListener loggingBuildMonitorListener() {
        return new LoggingBuildMonitorListener();
    }

    /**
     * 上下文中没有 MeterRegistry 时记录到 Micrometer 全局注册表。
     */
    @Bean
    @ConditionalOnMissingBean
    public MicrometerBuildMonitorListener micrometerBuildMonitorListener(ObjectProvider<MeterRegistry> meterRegistry) {
        return new MicrometerBuildMonitorListener(meterRegistry.getIfAvailable(() -> Metrics.globalRegistry));
    }

    /**
     * 收集在应用上下文中定义的所有 BuildMonitorListener Bean，作为名为 "buildMonitorListeners" 的列表提供。
     */
    @Bean(name = "buildMonitorListeners")
    @ConditionalOnMissingBean(name = "buildMonitorListeners")
    public List<BuildMonitorListener> buildMonitorListeners(ObjectProvider<BuildMonitorListener> listenersProvider) {
        List<BuildMonitorListener> listeners = listenersProvider.orderedStream()
                .filter(l -> !(l instanceof CompositeBuildMonitorListener))
                .collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 BuildMonitorListener Bean。");
        } else {
            log.info("收集到 {} 个 BuildMonitorListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        return listeners;
    }
}
