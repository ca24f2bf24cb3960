package xyz.vvrf.reactor.build.dirty;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.build.core.Digest;
import xyz.vvrf.reactor.build.core.Digests;
import xyz.vvrf.reactor.build.core.NodeKind;
import xyz.vvrf.reactor.build.fingerprint.EnvironmentFingerprint;
import xyz.vvrf.reactor.build.graph.BuildGraph;
import xyz.vvrf.reactor.build.graph.GraphBuilder;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class DirtyPropagatorTest {

    private static final EnvironmentFingerprint ENV = EnvironmentFingerprint.of(Collections.emptyMap());

    private InMemoryBuildHistory history;
    private DirtyPropagator propagator;

    @BeforeEach
    void setUp() {
        history = new InMemoryBuildHistory();
        propagator = new DirtyPropagator(history);
    }

    /**
     * src → compile → package，另有独立的 docs。
     */
    private static BuildGraph graph(String srcContent, String docsContent) {
        return GraphBuilder.named("app")
                .source("src", Digests.ofString(srcContent))
                .node("compile", NodeKind.BUILD, "cc", "src")
                .node("package", NodeKind.ARTIFACT, "tar", "compile")
                .source("docs", Digests.ofString(docsContent))
                .build();
    }

    private void recordAll(BuildGraph graph, DirtySet dirtySet) {
        propagator.recordResolved(graph, dirtySet, dirtySet.getDigests().keySet());
    }

    @Test
    void everythingDirtyWithoutHistory() {
        BuildGraph graph = graph("v1", "d1");
        DirtySet dirty = propagator.markDirty(graph, ENV);
        assertEquals(4, dirty.dirtyCount());
        assertEquals(DirtySet.Reason.NO_RECORD, dirty.reasonOf(0));
    }

    @Test
    void unchangedGraphIsClean() {
        BuildGraph first = graph("v1", "d1");
        recordAll(first, propagator.markDirty(first, ENV));

        DirtySet second = propagator.markDirty(graph("v1", "d1"), ENV);
        assertEquals(0, second.dirtyCount());
        assertTrue(second.dirtyIds().isEmpty());
        assertEquals(DirtySet.Reason.CLEAN, second.reasonOf(2));
    }

    @Test
    void sourceChangeDirtiesExactlyItsDownstream() {
        BuildGraph first = graph("v1", "d1");
        recordAll(first, propagator.markDirty(first, ENV));

        BuildGraph changed = graph("v2", "d1");
        DirtySet dirty = propagator.markDirty(changed, ENV);
        assertEquals(Arrays.asList(0, 1, 2), Arrays.asList(dirty.dirtyIds().toArray(new Integer[0])));
        assertFalse(dirty.isDirty(3));
        assertEquals(DirtySet.Reason.DIGEST_CHANGED, dirty.reasonOf(1));
    }

    @Test
    void dirtyInputPropagatesEvenWhenDigestRecordMatches() {
        BuildGraph first = graph("v1", "d1");
        DirtySet initial = propagator.markDirty(first, ENV);
        recordAll(first, initial);
        // 只删除源节点的记录：源节点没有记录，其下游摘要虽然相同也必须为脏
        history.forget("src");

        DirtySet dirty = propagator.markDirty(graph("v1", "d1"), ENV);
        assertEquals(DirtySet.Reason.NO_RECORD, dirty.reasonOf(0));
        assertEquals(DirtySet.Reason.INPUT_DIRTY, dirty.reasonOf(1));
        assertEquals(DirtySet.Reason.INPUT_DIRTY, dirty.reasonOf(2));
        assertFalse(dirty.isDirty(3));
    }

    @Test
    void unresolvedNodesStayDirty() {
        BuildGraph first = graph("v1", "d1");
        DirtySet initial = propagator.markDirty(first, ENV);
        propagator.recordResolved(first, initial, Arrays.asList(0, 3));

        DirtySet next = propagator.markDirty(graph("v1", "d1"), ENV);
        assertFalse(next.isDirty(0));
        assertTrue(next.isDirty(1));
        assertTrue(next.isDirty(2));
        assertFalse(next.isDirty(3));
    }

    @Test
    void environmentChangeDirtiesEverything() {
        BuildGraph first = graph("v1", "d1");
        recordAll(first, propagator.markDirty(first, ENV));
        assertEquals(4, propagator.markDirty(graph("v1", "d1"), ENV.with("compiler", "clang")).dirtyCount());
    }

    @Test
    void recordedDigestsMatchGraphDigests() {
        BuildGraph first = graph("v1", "d1");
        DirtySet dirty = propagator.markDirty(first, ENV);
        recordAll(first, dirty);
        Digest compile = first.getDigest(1).orElseThrow(IllegalStateException::new);
        assertEquals(compile, history.lastDigest("compile").orElseThrow(IllegalStateException::new));
        assertEquals(4, history.size());
    }
}
