package io.github.eutro.bin2ast.core.ext;

import io.github.eutro.bin2ast.core.cfg.BasicBlockFragment;
import io.github.eutro.bin2ast.core.cfg.CfgBlock;
import io.github.eutro.bin2ast.core.graph.DominatorTree;
import io.github.eutro.bin2ast.core.graph.Edge;
import io.github.eutro.bin2ast.core.graph.EdgeFlavor;
import io.github.eutro.bin2ast.core.graph.FlowGraph;
import io.github.eutro.bin2ast.core.graph.NodeId;
import io.github.eutro.bin2ast.core.passes.meta.*;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * The {@link Ext}s attached to {@link FlowGraph}s and {@link CfgBlock}s by the analysis passes.
 */
public class GraphExts {
    /**
     * Attached to a {@link FlowGraph}. Tracks which of the derived analyses are up to date.
     *
     * @see MetadataState
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * Attached to a {@link FlowGraph}. The predecessors of every node, in node order.
     * <p>
     * Computed by {@link ComputePreds}.
     */
    public static final Ext<Map<NodeId, List<NodeId>>> PREDS = Ext.create(Map.class, "PREDS");

    /**
     * Attached to a {@link FlowGraph}. The reachable nodes in reverse postorder.
     * <p>
     * Computed by {@link ComputeRpo}.
     */
    public static final Ext<List<NodeId>> RPO = Ext.create(List.class, "RPO");
    /**
     * Attached to a {@link FlowGraph}. The index of every reachable node in {@link #RPO}.
     * <p>
     * Computed by {@link ComputeRpo}.
     */
    public static final Ext<Map<NodeId, Integer>> RPO_INDEX = Ext.create(Map.class, "RPO_INDEX");
    /**
     * Attached to a {@link FlowGraph}. The classification of every edge leaving a reachable node.
     * <p>
     * Computed by {@link ComputeRpo}, during its second depth-first traversal.
     */
    public static final Ext<Map<Edge, EdgeFlavor>> EDGE_FLAVORS = Ext.create(Map.class, "EDGE_FLAVORS");

    /**
     * Attached to a {@link FlowGraph}.
     * The <a href="https://en.wikipedia.org/wiki/Dominator_(graph_theory)">immediate dominator</a> of every reachable node.
     * The start node is its own immediate dominator.
     * <p>
     * Computed by {@link ComputeDoms}.
     */
    public static final Ext<Map<NodeId, NodeId>> IDOM = Ext.create(Map.class, "IDOM");
    /**
     * Attached to a {@link FlowGraph}. The dominator tree.
     * <p>
     * Computed by {@link ComputeDomTree}.
     */
    public static final Ext<DominatorTree> DOM_TREE = Ext.create(DominatorTree.class, "DOM_TREE");
    /**
     * Attached to a {@link FlowGraph}. The natural loop body of every loop header.
     * <p>
     * Computed by {@link ComputeLoops}.
     */
    public static final Ext<Map<NodeId, SortedSet<NodeId>>> LOOPS = Ext.create(Map.class, "LOOPS");

    /**
     * Attached to a {@link CfgBlock}. The fragments of a predicated block.
     */
    public static final Ext<List<BasicBlockFragment>> FRAGMENTS = Ext.create(List.class, "FRAGMENTS");
}
