package io.github.eutro.bin2ast.core.graph;

import io.github.eutro.bin2ast.core.cfg.CfgStructureException;
import io.github.eutro.bin2ast.core.ext.ExtHolder;
import io.github.eutro.bin2ast.core.ext.GraphExts;
import io.github.eutro.bin2ast.core.ext.MetadataState;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A directed graph over {@link NodeId}s with a designated start node.
 * <p>
 * The graph itself only holds its nodes, edges and start node. Everything derived from
 * them (predecessors, reverse postorder, edge classification, dominators, the dominator
 * tree and natural loops) is computed on demand by the passes in
 * {@link io.github.eutro.bin2ast.core.passes.meta}, attached as exts, and tracked by the
 * graph's {@link MetadataState}. {@link #modifyEdges(Map)} invalidates all of it together.
 * <p>
 * Flow graphs are not thread-safe.
 */
public class FlowGraph extends ExtHolder {
    private final List<NodeId> nodes;
    private final NodeId startNode;
    private Map<NodeId, List<NodeId>> edges;

    /**
     * Construct a flow graph.
     * <p>
     * Nodes that do not appear as keys of {@code edges} have no successors.
     *
     * @param nodes     The nodes of the graph, in order, without duplicates.
     * @param edges     The successors of each node, in order, without duplicates.
     * @param startNode The entry node, which must be one of {@code nodes}.
     * @throws IllegalArgumentException If any of the above is violated, or an edge mentions an unknown node.
     */
    public FlowGraph(
            Collection<NodeId> nodes,
            Map<NodeId, ? extends Collection<NodeId>> edges,
            NodeId startNode
    ) {
        LinkedHashSet<NodeId> nodeSet = new LinkedHashSet<>(nodes);
        if (nodeSet.size() != nodes.size()) {
            throw new IllegalArgumentException("Duplicate nodes in " + nodes);
        }
        if (!nodeSet.contains(startNode)) {
            throw new IllegalArgumentException("Start node " + startNode + " is not a node of the graph");
        }
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodeSet));
        this.startNode = startNode;
        this.edges = copyEdges(nodeSet, edges);
        attachExt(GraphExts.METADATA_STATE, new MetadataState());
    }

    private Map<NodeId, List<NodeId>> copyEdges(Set<NodeId> nodeSet, Map<NodeId, ? extends Collection<NodeId>> edges) {
        for (NodeId src : edges.keySet()) {
            if (!nodeSet.contains(src)) {
                throw new IllegalArgumentException("Edge source " + src + " is not a node of the graph");
            }
        }
        Map<NodeId, List<NodeId>> copy = new LinkedHashMap<>();
        for (NodeId node : nodes) {
            Collection<NodeId> succs = edges.get(node);
            if (succs == null) {
                copy.put(node, Collections.emptyList());
                continue;
            }
            LinkedHashSet<NodeId> succSet = new LinkedHashSet<>(succs);
            if (succSet.size() != succs.size()) {
                throw new IllegalArgumentException("Parallel edges from " + node + ": " + succs);
            }
            for (NodeId succ : succSet) {
                if (!nodeSet.contains(succ)) {
                    throw new IllegalArgumentException("Edge target " + succ + " of " + node + " is not a node of the graph");
                }
            }
            copy.put(node, Collections.unmodifiableList(new ArrayList<>(succSet)));
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Get the nodes of this graph, in the order they were given.
     *
     * @return The nodes.
     */
    public List<NodeId> nodes() {
        return nodes;
    }

    /**
     * Get the start node of this graph.
     *
     * @return The start node.
     */
    public NodeId startNode() {
        return startNode;
    }

    /**
     * Get the successors of every node, in node order.
     *
     * @return The edges.
     */
    public Map<NodeId, List<NodeId>> edges() {
        return edges;
    }

    /**
     * Get whether the node is in this graph.
     *
     * @param node The node.
     * @return Whether it is in the graph.
     */
    public boolean hasNode(NodeId node) {
        return edges.containsKey(node);
    }

    /**
     * Replace the edges of this graph, invalidating everything derived from them.
     *
     * @param newEdges The new successors of each node.
     * @throws IllegalArgumentException If the edges mention an unknown node, or have parallel edges.
     */
    public void modifyEdges(Map<NodeId, ? extends Collection<NodeId>> newEdges) {
        edges = copyEdges(new HashSet<>(nodes), newEdges);
        meta().graphChanged();
    }

    private MetadataState meta() {
        return getExtOrThrow(GraphExts.METADATA_STATE);
    }

    private void checkNode(NodeId node) {
        if (!hasNode(node)) {
            throw new CfgStructureException("Node " + node + " is not in the graph");
        }
    }

    /**
     * Get the successors of a node.
     *
     * @param node The node.
     * @return Its successors, in order.
     */
    public List<NodeId> post(NodeId node) {
        checkNode(node);
        return edges.get(node);
    }

    /**
     * Get the predecessors of a node, in node order.
     *
     * @param node The node.
     * @return Its predecessors.
     */
    public List<NodeId> pre(NodeId node) {
        checkNode(node);
        meta().ensureValid(this, MetadataState.PREDS);
        return getExtOrThrow(GraphExts.PREDS).get(node);
    }

    /**
     * Get whether the node is a merge (join) point, that is, whether it has at least two distinct predecessors.
     *
     * @param node The node.
     * @return Whether it is a merge node.
     */
    public boolean isMergeNode(NodeId node) {
        return pre(node).size() >= 2;
    }

    /**
     * Get the nodes reachable from the start node, in reverse postorder.
     * <p>
     * The order is deterministic: it depends only on the nodes, edges and start node,
     * and not on the order successors were listed in.
     *
     * @return The reachable nodes, in reverse postorder.
     */
    public List<NodeId> rpoSorted() {
        meta().ensureValid(this, MetadataState.RPO);
        return getExtOrThrow(GraphExts.RPO);
    }

    /**
     * Get whether the node can be reached from the start node.
     *
     * @param node The node.
     * @return Whether it is reachable.
     */
    public boolean isReachable(NodeId node) {
        checkNode(node);
        return rpoIndices().containsKey(node);
    }

    /**
     * Get the nodes that cannot be reached from the start node, in node order.
     *
     * @return The unreachable nodes.
     */
    public List<NodeId> unreachableNodes() {
        Map<NodeId, Integer> indices = rpoIndices();
        List<NodeId> unreachable = new ArrayList<>();
        for (NodeId node : nodes) {
            if (!indices.containsKey(node)) unreachable.add(node);
        }
        return unreachable;
    }

    private Map<NodeId, Integer> rpoIndices() {
        meta().ensureValid(this, MetadataState.RPO);
        return getExtOrThrow(GraphExts.RPO_INDEX);
    }

    /**
     * Get the index of a reachable node in {@link #rpoSorted()}.
     *
     * @param node The node.
     * @return Its index.
     * @throws CfgStructureException If the node is not reachable.
     */
    public int rpoIndex(NodeId node) {
        Integer index = rpoIndices().get(node);
        if (index == null) {
            checkNode(node);
            throw new CfgStructureException("Node " + node + " is not reachable, and has no reverse postorder index");
        }
        return index;
    }

    /**
     * Get the classification of an edge leaving a reachable node.
     *
     * @param src The source of the edge.
     * @param tgt The target of the edge.
     * @return The flavor of the edge.
     * @throws CfgStructureException If there is no such edge, or its source is not reachable.
     */
    public EdgeFlavor edgeFlavor(NodeId src, NodeId tgt) {
        meta().ensureValid(this, MetadataState.RPO);
        EdgeFlavor flavor = getExtOrThrow(GraphExts.EDGE_FLAVORS).get(Edge.of(src, tgt));
        if (flavor == null) {
            throw new CfgStructureException("Edge " + src + "->" + tgt + " was not classified");
        }
        return flavor;
    }

    /**
     * Get whether the edge was classified as a {@link EdgeFlavor#BACK back} edge.
     * <p>
     * Edges leaving unreachable nodes are never back edges.
     *
     * @param src The source of the edge.
     * @param tgt The target of the edge.
     * @return Whether it is a back edge.
     */
    public boolean isBackEdge(NodeId src, NodeId tgt) {
        meta().ensureValid(this, MetadataState.RPO);
        return getExtOrThrow(GraphExts.EDGE_FLAVORS).get(Edge.of(src, tgt)) == EdgeFlavor.BACK;
    }

    /**
     * Get whether the node is the target of a back edge.
     *
     * @param node The node.
     * @return Whether it is a loop header.
     */
    public boolean isLoopHeader(NodeId node) {
        for (NodeId pred : pre(node)) {
            if (isBackEdge(pred, node)) return true;
        }
        return false;
    }

    /**
     * Get the natural loop of a loop header: the header together with every node that can
     * reach the source of one of its back edges without passing through the header.
     *
     * @param header The loop header.
     * @return The nodes of the loop, sorted.
     * @throws CfgStructureException If the node is not a loop header.
     */
    public SortedSet<NodeId> naturalLoop(NodeId header) {
        checkNode(header);
        meta().ensureValid(this, MetadataState.LOOPS);
        SortedSet<NodeId> loop = getExtOrThrow(GraphExts.LOOPS).get(header);
        if (loop == null) {
            throw new CfgStructureException("Node " + header + " is not a loop header");
        }
        return loop;
    }

    /**
     * Get the header of the innermost natural loop that contains a node.
     * <p>
     * Of two loops that both contain the node, the inner one's header comes later in reverse postorder.
     *
     * @param node The node.
     * @return The loop header, or null if no loop contains the node.
     */
    public @Nullable NodeId innermostLoopHeader(NodeId node) {
        checkNode(node);
        meta().ensureValid(this, MetadataState.LOOPS);
        NodeId innermost = null;
        for (Map.Entry<NodeId, SortedSet<NodeId>> entry : getExtOrThrow(GraphExts.LOOPS).entrySet()) {
            NodeId header = entry.getKey();
            if (entry.getValue().contains(node)
                    && (innermost == null || rpoIndex(header) > rpoIndex(innermost))) {
                innermost = header;
            }
        }
        return innermost;
    }

    /**
     * Get the immediate dominator of a reachable node. The start node is its own immediate dominator.
     *
     * @param node The node.
     * @return Its immediate dominator.
     * @throws CfgStructureException If the node is not reachable.
     */
    public NodeId idom(NodeId node) {
        meta().ensureValid(this, MetadataState.DOMS);
        NodeId idom = getExtOrThrow(GraphExts.IDOM).get(node);
        if (idom == null) {
            checkNode(node);
            throw new CfgStructureException("Node " + node + " has no immediate dominator");
        }
        return idom;
    }

    /**
     * Get the immediate dominator of every reachable node.
     *
     * @return The immediate dominators, in reverse postorder of the dominated node.
     */
    public Map<NodeId, NodeId> idoms() {
        meta().ensureValid(this, MetadataState.DOMS);
        return getExtOrThrow(GraphExts.IDOM);
    }

    /**
     * Get whether {@code a} dominates {@code b}, that is, whether every path from the start node
     * to {@code b} passes through {@code a}. Every node dominates itself.
     *
     * @param a The candidate dominator.
     * @param b The node.
     * @return Whether {@code a} dominates {@code b}.
     */
    public boolean dominates(NodeId a, NodeId b) {
        NodeId runner = b;
        while (true) {
            if (runner.equals(a)) return true;
            NodeId next = idom(runner);
            if (next.equals(runner)) return false;
            runner = next;
        }
    }

    /**
     * Get the dominator tree of this graph.
     *
     * @return The dominator tree.
     */
    public DominatorTree dominatorTree() {
        meta().ensureValid(this, MetadataState.DOM_TREE);
        return getExtOrThrow(GraphExts.DOM_TREE);
    }

    /**
     * Build the inverse of this graph, with a single synthetic exit node as its start node.
     * <p>
     * Every edge is reversed, and the synthetic node gets an edge to each node of this graph that
     * has no successors. The dominators of the result are the postdominators of this graph.
     *
     * @return The inverse graph.
     */
    @Contract(" -> new")
    public @NotNull FlowGraph inverseWithPhantomExitNode() {
        NodeId exit = freshPhantom();
        List<NodeId> invNodes = new ArrayList<>(nodes);
        invNodes.add(exit);
        Map<NodeId, List<NodeId>> invEdges = new LinkedHashMap<>();
        List<NodeId> sinks = new ArrayList<>();
        for (NodeId node : nodes) {
            List<NodeId> succs = edges.get(node);
            if (succs.isEmpty()) sinks.add(node);
            for (NodeId succ : succs) {
                invEdges.computeIfAbsent(succ, $ -> new ArrayList<>()).add(node);
            }
        }
        invEdges.put(exit, sinks);
        return new FlowGraph(invNodes, invEdges, exit);
    }

    private NodeId freshPhantom() {
        int index = nodes.size();
        while (hasNode(NodeId.phantom(index))) index++;
        return NodeId.phantom(index);
    }

    @Override
    public String toString() {
        return "FlowGraph(start=" + startNode + ", edges=" + edges + ")";
    }
}
