package io.github.eutro.bin2ast.test;

import io.github.eutro.bin2ast.core.cfg.CfgStructureException;
import io.github.eutro.bin2ast.core.ext.GraphExts;
import io.github.eutro.bin2ast.core.ext.MetadataState;
import io.github.eutro.bin2ast.core.graph.*;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import java.util.*;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static io.github.eutro.bin2ast.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class FlowGraphTest {
    static final int[][] DIAMOND = {row(0, 1, 2), row(1, 3), row(2, 3), row(3)};
    static final int[][] NESTED_LOOPS = {
            row(0, 1),
            row(1, 2, 5),
            row(2, 3),
            row(3, 2, 4),
            row(4, 1),
            row(5),
    };

    static Stream<int[][]> samples() {
        Random random = new Random(1234);
        return Stream.concat(
                Stream.of(DIAMOND, NESTED_LOOPS),
                IntStream.range(0, 40).mapToObj($ -> randomRows(random, 2 + random.nextInt(9))));
    }

    @TestFactory
    Stream<DynamicTest> testRpoIgnoresSuccessorOrder() {
        Random random = new Random(42);
        return samples().map(rows -> DynamicTest.dynamicTest(Arrays.deepToString(rows), () -> {
            FlowGraph graph = graph(rows);

            Map<NodeId, List<NodeId>> shuffled = new HashMap<>();
            for (Map.Entry<NodeId, List<NodeId>> entry : graph.edges().entrySet()) {
                List<NodeId> succs = new ArrayList<>(entry.getValue());
                Collections.shuffle(succs, random);
                shuffled.put(entry.getKey(), succs);
            }
            List<NodeId> nodes = new ArrayList<>(graph.nodes());
            FlowGraph other = new FlowGraph(nodes, shuffled, graph.startNode());

            assertEquals(graph.rpoSorted(), other.rpoSorted());
            assertEquals(graph.idoms(), other.idoms());
            for (NodeId src : graph.rpoSorted()) {
                for (NodeId tgt : graph.post(src)) {
                    assertEquals(graph.edgeFlavor(src, tgt), other.edgeFlavor(src, tgt), src + "->" + tgt);
                }
            }
        }));
    }

    @TestFactory
    Stream<DynamicTest> testDominance() {
        return samples().map(rows -> DynamicTest.dynamicTest(Arrays.deepToString(rows), () -> {
            FlowGraph graph = graph(rows);
            NodeId start = graph.startNode();
            assertEquals(start, graph.idom(start));
            for (NodeId d : graph.rpoSorted()) {
                for (NodeId node : graph.rpoSorted()) {
                    assertEquals(dominatesByRemoval(graph, d, node), graph.dominates(d, node), d + " dom " + node);
                }
                if (!d.equals(start)) {
                    NodeId idom = graph.idom(d);
                    assertNotEquals(d, idom);
                    assertTrue(graph.rpoIndex(idom) < graph.rpoIndex(d));
                }
            }
        }));
    }

    // d dominates n iff n is d, or n is unreachable once d is removed
    static boolean dominatesByRemoval(FlowGraph graph, NodeId d, NodeId node) {
        if (d.equals(node)) return true;
        if (d.equals(graph.startNode())) return true;
        Set<NodeId> seen = new HashSet<>();
        Deque<NodeId> stack = new ArrayDeque<>();
        stack.push(graph.startNode());
        while (!stack.isEmpty()) {
            NodeId next = stack.pop();
            if (next.equals(d) || !seen.add(next)) continue;
            for (NodeId succ : graph.post(next)) {
                stack.push(succ);
            }
        }
        return !seen.contains(node);
    }

    @TestFactory
    Stream<DynamicTest> testTreeEdgesSpanReachableNodes() {
        return samples().map(rows -> DynamicTest.dynamicTest(Arrays.deepToString(rows), () -> {
            FlowGraph graph = graph(rows);
            Map<NodeId, Integer> treeIn = new HashMap<>();
            for (NodeId src : graph.rpoSorted()) {
                for (NodeId tgt : graph.post(src)) {
                    EdgeFlavor flavor = graph.edgeFlavor(src, tgt);
                    if (flavor == EdgeFlavor.TREE) {
                        treeIn.merge(tgt, 1, Integer::sum);
                        assertTrue(graph.rpoIndex(src) < graph.rpoIndex(tgt));
                    } else if (flavor == EdgeFlavor.BACK) {
                        assertTrue(graph.dominates(tgt, src) || graph.rpoIndex(tgt) <= graph.rpoIndex(src));
                    } else {
                        assertTrue(graph.rpoIndex(src) < graph.rpoIndex(tgt) || flavor == EdgeFlavor.CROSS);
                    }
                }
            }
            for (NodeId node : graph.rpoSorted()) {
                int expected = node.equals(graph.startNode()) ? 0 : 1;
                assertEquals(expected, treeIn.getOrDefault(node, 0).intValue(), "tree in-degree of " + node);
            }
            Map<Edge, EdgeFlavor> flavors = graph.getExtOrThrow(GraphExts.EDGE_FLAVORS);
            int reachableEdges = 0;
            for (NodeId src : graph.rpoSorted()) {
                reachableEdges += graph.post(src).size();
            }
            assertEquals(reachableEdges, flavors.size());
        }));
    }

    @TestFactory
    Stream<DynamicTest> testMergeNodesAgreeWithEdges() {
        return samples().map(rows -> DynamicTest.dynamicTest(Arrays.deepToString(rows), () -> {
            FlowGraph graph = graph(rows);
            Map<NodeId, Set<NodeId>> preds = new HashMap<>();
            for (NodeId src : graph.nodes()) {
                for (NodeId tgt : graph.post(src)) {
                    preds.computeIfAbsent(tgt, $ -> new HashSet<>()).add(src);
                }
            }
            for (NodeId node : graph.nodes()) {
                Set<NodeId> expected = preds.getOrDefault(node, Collections.emptySet());
                assertEquals(expected, new HashSet<>(graph.pre(node)));
                assertEquals(expected.size() >= 2, graph.isMergeNode(node));
            }
        }));
    }

    @Test
    void testDiamond() {
        FlowGraph graph = graph(DIAMOND);
        assertEquals(ns(0, 1, 2, 3), graph.rpoSorted());
        assertEquals(EdgeFlavor.TREE, graph.edgeFlavor(n(0), n(1)));
        assertEquals(EdgeFlavor.TREE, graph.edgeFlavor(n(2), n(3)));
        assertEquals(EdgeFlavor.CROSS, graph.edgeFlavor(n(1), n(3)));
        assertTrue(graph.isMergeNode(n(3)));
        assertEquals(n(0), graph.idom(n(3)));
        assertEquals(ns(3, 2, 1), graph.dominatorTree().children(n(0)));
        assertFalse(graph.isLoopHeader(n(0)));
    }

    @Test
    void testLoops() {
        FlowGraph graph = graph(NESTED_LOOPS);
        assertTrue(graph.isBackEdge(n(4), n(1)));
        assertTrue(graph.isBackEdge(n(3), n(2)));
        assertTrue(graph.isLoopHeader(n(1)));
        assertTrue(graph.isLoopHeader(n(2)));
        assertEquals(new TreeSet<>(ns(1, 2, 3, 4)), graph.naturalLoop(n(1)));
        assertEquals(new TreeSet<>(ns(2, 3)), graph.naturalLoop(n(2)));
        assertThrows(CfgStructureException.class, () -> graph.naturalLoop(n(3)));
    }

    @Test
    void testInnermostLoopHeader() {
        FlowGraph graph = graph(NESTED_LOOPS);
        assertNull(graph.innermostLoopHeader(n(0)));
        assertEquals(n(1), graph.innermostLoopHeader(n(1)));
        assertEquals(n(2), graph.innermostLoopHeader(n(2)));
        assertEquals(n(2), graph.innermostLoopHeader(n(3)));
        assertEquals(n(1), graph.innermostLoopHeader(n(4)));
        assertNull(graph.innermostLoopHeader(n(5)));
    }

    @Test
    void testUnknownNodes() {
        FlowGraph graph = graph(DIAMOND);
        assertThrows(CfgStructureException.class, () -> graph.post(n(9)));
        assertThrows(CfgStructureException.class, () -> graph.pre(n(9)));
        assertThrows(CfgStructureException.class, () -> graph.dominatorTree().children(n(9)));
        assertThrows(IllegalArgumentException.class,
                () -> new FlowGraph(ns(0, 1), edges(row(0, 9)), n(0)));
        assertThrows(IllegalArgumentException.class,
                () -> new FlowGraph(ns(0, 1), edges(row(0, 1)), n(2)));
    }

    @Test
    void testUnreachableNodes() {
        FlowGraph graph = graph(row(0, 1), row(1), row(2, 1), row(3, 2));
        assertEquals(ns(0, 1), graph.rpoSorted());
        assertEquals(ns(2, 3), graph.unreachableNodes());
        assertFalse(graph.isReachable(n(2)));
        assertFalse(graph.isMergeNode(n(0)));
        assertTrue(graph.isMergeNode(n(1)));
        assertFalse(graph.isBackEdge(n(2), n(1)));
        assertThrows(CfgStructureException.class, () -> graph.rpoIndex(n(3)));
        assertThrows(CfgStructureException.class, () -> graph.idom(n(3)));
        assertFalse(graph.dominatorTree().contains(n(2)));
    }

    @Test
    void testPostDominators() {
        FlowGraph graph = graph(row(0, 1, 2), row(1, 3), row(2, 3, 4), row(3), row(4));
        FlowGraph inverse = graph.inverseWithPhantomExitNode();
        NodeId exit = inverse.startNode();
        assertTrue(exit.isPhantom());
        assertFalse(graph.hasNode(exit));
        assertEquals(new HashSet<>(ns(3, 4)), new HashSet<>(inverse.post(exit)));
        assertEquals(n(3), inverse.idom(n(1)));
        assertEquals(exit, inverse.idom(n(2)));
        assertEquals(exit, inverse.idom(n(0)));
        assertTrue(inverse.dominates(n(3), n(1)));
    }

    @Test
    void testModifyEdgesInvalidates() {
        FlowGraph graph = graph(DIAMOND);
        MetadataState ms = graph.getExtOrThrow(GraphExts.METADATA_STATE);
        assertEquals(n(0), graph.idom(n(3)));
        assertTrue(graph.isMergeNode(n(3)));
        assertTrue(ms.isValid(MetadataState.DOMS));

        graph.modifyEdges(edges(row(0, 1), row(1, 2), row(2, 3), row(3, 1)));
        assertFalse(ms.isValid(MetadataState.PREDS));
        assertFalse(ms.isValid(MetadataState.RPO));
        assertFalse(ms.isValid(MetadataState.DOMS));
        assertFalse(ms.isValid(MetadataState.DOM_TREE));
        assertFalse(ms.isValid(MetadataState.LOOPS));

        assertEquals(n(2), graph.idom(n(3)));
        assertFalse(graph.isMergeNode(n(3)));
        assertTrue(graph.isMergeNode(n(1)));
        assertTrue(graph.isLoopHeader(n(1)));
        assertEquals(ns(2), graph.dominatorTree().children(n(1)));
    }

    @Test
    void testNodeIds() {
        assertEquals("0x1c4", NodeId.real(0x1c4).toString());
        assertEquals("F_0x10_0x20", NodeId.inlined(0x10, 0x20).toString());
        assertEquals("__3", NodeId.phantom(3).toString());
        for (NodeId id : Arrays.asList(NodeId.real(0x1c4), NodeId.inlined(0x10, 0x20), NodeId.phantom(3))) {
            assertEquals(id, NodeId.parse(id.toString()));
        }
        assertTrue(NodeId.real(Long.MAX_VALUE).compareTo(NodeId.inlined(0, 0)) < 0);
        assertTrue(NodeId.inlined(0, 0).compareTo(NodeId.phantom(0)) < 0);
        assertThrows(UnsupportedOperationException.class, () -> NodeId.phantom(0).address());
        assertThrows(IllegalArgumentException.class, () -> NodeId.parse("zz"));
    }
}
