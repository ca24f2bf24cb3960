package xyz.vvrf.reactor.build.graph;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.build.core.Digests;
import xyz.vvrf.reactor.build.core.NodeKind;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class GraphUtilsTest {

    @Test
    void acyclicGraphHasNoCycle() {
        BuildGraph graph = GraphBuilder.named("dag")
                .source("a", Digests.ofString("a"))
                .node("b", NodeKind.BUILD, "b", "a")
                .node("c", NodeKind.BUILD, "c", "a", "b")
                .build();
        assertFalse(GraphUtils.findCycle(graph.getNodes()).isPresent());
    }

    @Test
    void longChainIsCheckedWithoutDeepRecursion() {
        BuildGraph graph = new BuildGraph("chain");
        int previous = graph.addNode(NodeKind.SOURCE, Collections.emptyList(), "", Digests.ofString("root"));
        for (int i = 1; i < 50_000; i++) {
            previous = graph.addNode("step" + i, NodeKind.BUILD, Collections.singletonList(previous), "step", null, null);
        }
        assertFalse(GraphUtils.findCycle(graph.getNodes()).isPresent());
        assertEquals(50_000, graph.topologicalLevels().size());
    }

    @Test
    void cycleInAssembledNodesIsReported() {
        List<BuildNode> nodes = Arrays.asList(
                new BuildNode(0, "a", NodeKind.BUILD, Collections.singletonList(2), "a", null, new TreeMap<>()),
                new BuildNode(1, "b", NodeKind.BUILD, Collections.singletonList(0), "b", null, new TreeMap<>()),
                new BuildNode(2, "c", NodeKind.BUILD, Collections.singletonList(1), "c", null, new TreeMap<>()));
        Optional<int[]> edge = GraphUtils.findCycle(nodes);
        assertTrue(edge.isPresent());
        assertEquals(1, edge.get()[0]);
        assertEquals(0, edge.get()[1]);
    }

    @Test
    void duplicateInputsCountOnce() {
        BuildGraph graph = new BuildGraph("dup");
        int a = graph.addNode(NodeKind.SOURCE, Collections.emptyList(), "", Digests.ofString("a"));
        int b = graph.addNode(NodeKind.BUILD, Arrays.asList(a, a), "twice", null);
        assertEquals(Arrays.asList(Collections.singletonList(a), Collections.singletonList(b)), graph.topologicalLevels());
        assertEquals(Collections.singletonList(b), GraphUtils.buildDependentsList(graph.getNodes()).get(a));
    }

    @Test
    void dotContainsNodesAndEdges() {
        BuildGraph graph = GraphBuilder.named("dot")
                .source("src", Digests.ofString("s"))
                .node("compile", NodeKind.BUILD, "make", "src")
                .build();
        String dot = GraphUtils.toDot(graph);
        assertTrue(dot.startsWith("digraph"));
        assertTrue(dot.contains("compile"));
        assertTrue(dot.contains("->"));
    }
}
