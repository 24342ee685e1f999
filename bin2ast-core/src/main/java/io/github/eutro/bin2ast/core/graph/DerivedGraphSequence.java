package io.github.eutro.bin2ast.core.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * The sequence of successively coarsened interval graphs of a {@link FlowGraph}.
 * <p>
 * Frances E. Allen, Control Flow Analysis, SIGPLAN Notices, 1970.
 * <p>
 * Each graph in the sequence has one node per interval of the previous graph. The sequence
 * stops when a graph has a single node, or stops shrinking. The flow graph is reducible
 * exactly when the last graph has a single node.
 */
public final class DerivedGraphSequence {
    private static final Logger LOGGER = LoggerFactory.getLogger(DerivedGraphSequence.class);

    private final List<NodeId> nodes;
    private final Map<NodeId, List<NodeId>> edges;
    private List<IntervalGraph> graphs;

    /**
     * Construct the derived graph sequence of a flow graph.
     * <p>
     * The graphs are computed on first use.
     *
     * @param graph The flow graph.
     */
    public DerivedGraphSequence(FlowGraph graph) {
        List<NodeId> nodes = new ArrayList<>(graph.nodes());
        nodes.remove(graph.startNode());
        nodes.add(0, graph.startNode());
        this.nodes = Collections.unmodifiableList(nodes);
        this.edges = graph.edges();
    }

    /**
     * Get the nodes of the original graph, with the start node first.
     *
     * @return The nodes.
     */
    public List<NodeId> nodes() {
        return nodes;
    }

    /**
     * Get the edges of the original graph.
     *
     * @return The edges.
     */
    public Map<NodeId, List<NodeId>> edges() {
        return edges;
    }

    /**
     * Get the derived graphs, starting from the original graph.
     *
     * @return The graphs.
     */
    public List<IntervalGraph> graphs() {
        if (graphs == null) {
            graphs = Collections.unmodifiableList(construct());
        }
        return graphs;
    }

    /**
     * Get the last derived graph.
     *
     * @return The last graph.
     */
    public IntervalGraph last() {
        List<IntervalGraph> graphs = graphs();
        return graphs.get(graphs.size() - 1);
    }

    private List<IntervalGraph> construct() {
        List<IntervalGraph> graphs = new ArrayList<>();
        IntervalGraph g = new IntervalGraph(nodes, edges);
        graphs.add(g);
        while (g.size() > 1) {
            IntervalGraph next = g.derive();
            if (next.size() >= g.size()) break;
            graphs.add(next);
            g = next;
        }
        LOGGER.debug("derived graph sequence from {}: sizes {}", nodes.get(0), sizes(graphs));
        return graphs;
    }

    private static List<Integer> sizes(List<IntervalGraph> graphs) {
        List<Integer> sizes = new ArrayList<>();
        for (IntervalGraph graph : graphs) {
            sizes.add(graph.size());
        }
        return sizes;
    }

    /**
     * Get whether the original graph is reducible.
     *
     * @return Whether the last derived graph has a single node.
     */
    public boolean isReducible() {
        return last().size() == 1;
    }

    /**
     * Get the hierarchical reverse postorder of the reachable nodes of a reducible graph.
     * <p>
     * A node's index is the list of the reverse postorder indices of the intervals containing it,
     * from the coarsest graph to the original.
     *
     * @return The index of each node, or an empty map if the graph is irreducible.
     */
    public Map<NodeId, List<Integer>> hrpo() {
        if (!isReducible()) return Collections.emptyMap();
        Map<NodeId, List<Integer>> prevRpo = new LinkedHashMap<>();
        prevRpo.put(last().nodes().get(0), Collections.singletonList(0));
        List<IntervalGraph> graphs = graphs();
        for (int i = graphs.size() - 2; i >= 0; i--) {
            prevRpo = graphs.get(i).hrpo(prevRpo);
        }
        return prevRpo;
    }

    /**
     * Get the reachable nodes of a reducible graph, sorted by their {@link #hrpo() hierarchical reverse postorder}.
     *
     * @return The sorted nodes, or an empty list if the graph is irreducible.
     */
    public List<NodeId> rpoSortedNodes() {
        Map<NodeId, List<Integer>> hrpo = hrpo();
        List<NodeId> sorted = new ArrayList<>(hrpo.keySet());
        sorted.sort((a, b) -> compareIndices(hrpo.get(a), hrpo.get(b)));
        return sorted;
    }

    private static int compareIndices(List<Integer> a, List<Integer> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int c = Integer.compare(a.get(i), b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }
}
