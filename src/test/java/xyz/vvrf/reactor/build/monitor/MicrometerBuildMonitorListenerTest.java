package xyz.vvrf.reactor.build.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.build.cache.DiskCacheStore;
import xyz.vvrf.reactor.build.cache.DiskCacheTier;
import xyz.vvrf.reactor.build.cache.MemoryCacheTier;
import xyz.vvrf.reactor.build.cache.TieredCache;
import xyz.vvrf.reactor.build.core.BuildState;
import xyz.vvrf.reactor.build.core.Digests;
import xyz.vvrf.reactor.build.core.ErrorHandlingStrategy;
import xyz.vvrf.reactor.build.core.NodeKind;
import xyz.vvrf.reactor.build.dirty.DirtyPropagator;
import xyz.vvrf.reactor.build.dirty.InMemoryBuildHistory;
import xyz.vvrf.reactor.build.execution.BuildReport;
import xyz.vvrf.reactor.build.execution.StandardBuildEngine;
import xyz.vvrf.reactor.build.execution.StandardNodeExecutor;
import xyz.vvrf.reactor.build.fingerprint.EnvironmentFingerprint;
import xyz.vvrf.reactor.build.graph.BuildGraph;
import xyz.vvrf.reactor.build.graph.GraphBuilder;
import xyz.vvrf.reactor.build.graph.BuildNode;
import xyz.vvrf.reactor.build.test.util.RecordingRunner;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerBuildMonitorListenerTest {

    @TempDir
    Path dir;

    @Test
    void buildEventsAreRecordedAndFaultyListenersIgnored() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        BuildMonitorListener faulty = new LoggingBuildMonitorListener() {
            @Override
            public void onNodeStart(String buildId, String graphName, BuildNode node) {
                throw new IllegalStateException("listener bug");
            }
        };
        CompositeBuildMonitorListener listener = new CompositeBuildMonitorListener(
                Arrays.asList(faulty, new MicrometerBuildMonitorListener(registry)));

        TieredCache cache = new TieredCache(Arrays.asList(new MemoryCacheTier(1024 * 1024),
                new DiskCacheTier(new DiskCacheStore(dir))), null, listener);
        RecordingRunner runner = RecordingRunner.builder().failing("broken").build();
        StandardNodeExecutor executor = new StandardNodeExecutor(cache, runner, Duration.ofSeconds(5),
                Schedulers.boundedElastic(), listener);
        StandardBuildEngine engine = new StandardBuildEngine(executor, new DirtyPropagator(new InMemoryBuildHistory()), cache,
                EnvironmentFingerprint.of(Collections.emptyMap()), 2, ErrorHandlingStrategy.ISOLATE_FAILURES, listener);
        BuildGraph graph = GraphBuilder.named("metrics")
                .source("src", Digests.ofString("src"))
                .node("compile", NodeKind.BUILD, "cc", "src")
                .node("broken", NodeKind.BUILD, "explode", "src")
                .node("after-broken", NodeKind.ARTIFACT, "zip", "broken")
                .build();

        BuildReport report = engine.build(graph).block(Duration.ofSeconds(10));

        assertNotNull(report);
        assertEquals(BuildState.FAILED, report.getState());
        assertEquals(2, registry.find(MicrometerBuildMonitorListener.METRIC_NODE_EXECUTION_TOTAL)
                .tag("status", "SUCCESS").counters().stream().mapToDouble(Counter::count).sum());
        assertEquals(1, registry.find(MicrometerBuildMonitorListener.METRIC_NODE_EXECUTION_TOTAL)
                .tags("status", "FAILURE", "error", "RUNNER").counter().count());
        assertEquals(1, registry.find(MicrometerBuildMonitorListener.METRIC_NODE_EXECUTION_TOTAL)
                .tag("status", "SKIPPED").counter().count());
        assertEquals(1, registry.find(MicrometerBuildMonitorListener.METRIC_BUILD_TIME)
                .tag("status", "FAILED").timer().count());
    }
}
