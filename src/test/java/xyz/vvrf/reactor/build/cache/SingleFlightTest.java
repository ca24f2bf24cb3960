package xyz.vvrf.reactor.build.cache;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SingleFlightTest {

    @Test
    void concurrentCallersShareOneExecution() {
        SingleFlight<String, String> flight = new SingleFlight<>();
        AtomicInteger executions = new AtomicInteger();

        List<String> results = Flux.range(0, 20)
                .flatMap(i -> flight.execute("key", () -> Mono.fromCallable(() -> "value-" + executions.incrementAndGet())
                                .delayElement(Duration.ofMillis(100)))
                        .subscribeOn(Schedulers.parallel()), 20)
                .collectList()
                .block(Duration.ofSeconds(5));

        assertNotNull(results);
        assertEquals(20, results.size());
        assertTrue(results.stream().allMatch("value-1"::equals));
        assertEquals(1, executions.get());
        assertEquals(0, flight.inFlightCount());
    }

    @Test
    void differentKeysRunIndependently() {
        SingleFlight<String, Integer> flight = new SingleFlight<>();
        AtomicInteger executions = new AtomicInteger();

        StepVerifier.create(Flux.just("a", "b", "c")
                        .flatMap(k -> flight.execute(k, () -> Mono.fromCallable(executions::incrementAndGet)))
                        .count())
                .expectNext(3L)
                .verifyComplete();
        assertEquals(3, executions.get());
    }

    @Test
    void failureIsSharedThenForgotten() {
        SingleFlight<String, String> flight = new SingleFlight<>();
        AtomicInteger executions = new AtomicInteger();

        StepVerifier.create(flight.execute("key", () -> Mono.defer(() -> {
                    executions.incrementAndGet();
                    return Mono.<String>error(new IllegalStateException("boom"));
                })))
                .expectError(IllegalStateException.class)
                .verify(Duration.ofSeconds(1));
        assertEquals(0, flight.inFlightCount());

        StepVerifier.create(flight.execute("key", () -> Mono.fromCallable(() -> "retry-" + executions.incrementAndGet())))
                .expectNext("retry-2")
                .verifyComplete();
    }

    @Test
    void completedEntryIsRecomputedOnNextCall() {
        SingleFlight<String, Integer> flight = new SingleFlight<>();
        AtomicInteger executions = new AtomicInteger();

        flight.execute("key", () -> Mono.fromCallable(executions::incrementAndGet)).block();
        flight.execute("key", () -> Mono.fromCallable(executions::incrementAndGet)).block();

        assertEquals(2, executions.get());
    }
}
