package xyz.vvrf.reactor.build.cache;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import xyz.vvrf.reactor.build.cache.remote.RemoteCacheClient;
import xyz.vvrf.reactor.build.core.Artifact;
import xyz.vvrf.reactor.build.core.CasIntegrityException;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.Digests;
import xyz.vvrf.reactor.build.core.NetworkException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * L3 远程缓存层。
 * <p>
 * 每次尝试单独超时，可重试的网络错误按指数退避加抖动重试。
 * 重试耗尽或遇到不可重试的网络错误时，读操作降级为未命中（除非配置为必须使用远程缓存）。
 * 完整性错误从不重试也不降级：收到的内容会重新计算摘要，与请求的键不一致时直接丢弃并报错。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class RemoteCacheTier implements CacheTier {

    public static final String NAME = "L3";

    private final RemoteCacheClient client;
    private final Policy policy;
    private final Retry retrySpec;

    public RemoteCacheTier(RemoteCacheClient client, Policy policy) {
        this.client = Objects.requireNonNull(client, "RemoteCacheClient 不能为空");
        this.policy = Objects.requireNonNull(policy, "远程缓存策略不能为空");
        this.retrySpec = policy.getMaxAttempts() <= 1
                ? Retry.max(0)
                : Retry.backoff(policy.getMaxAttempts() - 1L, policy.getFirstBackoff())
                .maxBackoff(policy.getMaxBackoff())
                .jitter(policy.getJitterFactor())
                .filter(NetworkException::isRetryable)
                .doBeforeRetry(signal -> log.debug("Retrying remote cache operation (attempt {}): {}",
                        signal.totalRetries() + 2, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
        log.info("RemoteCacheTier initialized. Timeout: {}, Max attempts: {}, Required: {}",
                policy.getTimeout(), policy.getMaxAttempts(), policy.isRequired());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Mono<Boolean> has(Digest nodeDigest) {
        return degrade("has", nodeDigest,
                withPolicy("GET action", () -> client.getAction(nodeDigest))
                        .flatMap(content -> withPolicy("HEAD blob", () -> client.hasBlob(content)))
                        .defaultIfEmpty(false))
                .defaultIfEmpty(false);
    }

    @Override
    public Mono<Artifact> get(Digest nodeDigest) {
        return degrade("get", nodeDigest,
                withPolicy("GET action", () -> client.getAction(nodeDigest))
                        .flatMap(content -> withPolicy("GET blob", () -> client.getBlob(content))
                                .map(bytes -> verified(content, bytes))));
    }

    /**
     * 上传产物（blob 后写动作记录）。失败不降级，由调用方记录。
     */
    @Override
    public Mono<Void> put(Digest nodeDigest, Artifact artifact) {
        Digest content = artifact.getContentDigest();
        return withPolicy("PUT blob", () -> client.putBlob(content, artifact.getBytes()))
                .then(withPolicy("PUT action", () -> client.putAction(nodeDigest, content)));
    }

    private static Artifact verified(Digest expected, byte[] bytes) {
        Digest actual = Digests.ofContent(bytes);
        if (!actual.equals(expected)) {
            log.error("CAS integrity failure on remote fetch: requested {}, received content hashing to {} ({} bytes). Discarding.",
                    expected.shortHex(), actual.shortHex(), bytes.length);
            throw new CasIntegrityException(expected, actual, bytes.length);
        }
        return Artifact.declared(expected, bytes);
    }

    private <T> Mono<T> withPolicy(String operation, Supplier<Mono<T>> call) {
        return Mono.defer(call)
                .timeout(policy.getTimeout())
                .onErrorMap(TimeoutException.class,
                        e -> new NetworkException(operation + " timed out after " + policy.getTimeout(), true, e))
                .retryWhen(retrySpec);
    }

    private <T> Mono<T> degrade(String operation, Digest nodeDigest, Mono<T> source) {
        return source.onErrorResume(NetworkException.class, e -> {
            if (policy.isRequired()) {
                log.error("Remote cache {} for {} failed and remote cache is required: {}", operation, nodeDigest.shortHex(), e.getMessage());
                return Mono.error(e);
            }
            log.warn("Remote cache {} for {} failed, treating as miss: {}", operation, nodeDigest.shortHex(), e.getMessage());
            return Mono.empty();
        });
    }

    public Policy getPolicy() {
        return policy;
    }

    /**
     * 远程调用策略（不可变）。
     */
    @Getter
    public static final class Policy {
        private final Duration timeout;
        private final int maxAttempts;
        private final Duration firstBackoff;
        private final Duration maxBackoff;
        private final double jitterFactor;
        private final boolean required;

        public Policy(Duration timeout, int maxAttempts, Duration firstBackoff, Duration maxBackoff,
                      double jitterFactor, boolean required) {
            this.timeout = Objects.requireNonNull(timeout, "远程调用超时不能为空");
            this.firstBackoff = Objects.requireNonNull(firstBackoff, "首次退避时间不能为空");
            this.maxBackoff = Objects.requireNonNull(maxBackoff, "最大退避时间不能为空");
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            if (jitterFactor < 0 || jitterFactor > 1) {
                throw new IllegalArgumentException("jitterFactor must be between 0 and 1");
            }
            this.maxAttempts = maxAttempts;
            this.jitterFactor = jitterFactor;
            this.required = required;
        }

        public static Policy defaults() {
            return new Policy(Duration.ofSeconds(10), 3, Duration.ofMillis(100), Duration.ofSeconds(2), 0.5, false);
        }
    }
}
