package xyz.vvrf.reactor.build.cache;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 按键合并并发请求：同一键同一时刻只有一个进行中的计算，其余调用方订阅同一个被缓存的 Mono。
 * 计算结束（成功、失败或空）后条目被移除，之后的调用会重新计算。
 *
 * @param <K> 键类型
 * @param <T> 结果类型
 * @author ruifeng.wen
 */
@Slf4j
public class SingleFlight<K, T> {

    private final Map<K, Mono<T>> inFlight = new ConcurrentHashMap<>();

    public Mono<T> execute(K key, Supplier<Mono<T>> work) {
        return Mono.defer(() -> {
            AtomicReference<Mono<T>> self = new AtomicReference<>();
            Mono<T> shared = inFlight.computeIfAbsent(key, k -> {
                Mono<T> created = Mono.defer(work)
                        .doOnTerminate(() -> {
                            inFlight.remove(k, self.get());
                            log.trace("Single-flight entry {} released", k);
                        })
                        .cache();
                self.set(created);
                return created;
            });
            if (shared != self.get()) {
                log.trace("Joining in-flight computation for {}", key);
            }
            return shared;
        });
    }

    public int inFlightCount() {
        return inFlight.size();
    }
}
