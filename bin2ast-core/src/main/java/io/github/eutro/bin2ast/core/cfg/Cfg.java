package io.github.eutro.bin2ast.core.cfg;

import io.github.eutro.bin2ast.core.ext.ExtHolder;
import io.github.eutro.bin2ast.core.graph.DerivedGraphSequence;
import io.github.eutro.bin2ast.core.graph.FlowGraph;
import io.github.eutro.bin2ast.core.graph.NodeId;
import io.github.eutro.bin2ast.core.util.Lazy;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The control flow graph of one function: its blocks, the edges between them, the jump tables of
 * its multi-way branches, and the patch events describing its trampolines.
 * <p>
 * Trampolines are {@link TrampolineComposer composed} the first time the blocks or edges are read,
 * so everything after that sees each trampoline as a single block.
 * <p>
 * A cfg is not thread-safe.
 */
public class Cfg extends ExtHolder {
    private final NodeId faddr;
    private final Map<NodeId, JumpTable> jumpTables;
    private final Map<NodeId, PatchEvent> patchEvents;
    private final Lazy<TrampolineComposer.Composition> composition;
    private final Lazy<FlowGraph> flowGraph;
    private Lazy<DerivedGraphSequence> derivedGraphSequence;

    private Cfg(
            NodeId faddr,
            Map<NodeId, CfgBlock> blocks,
            Map<NodeId, List<NodeId>> edges,
            Map<NodeId, JumpTable> jumpTables,
            Map<NodeId, PatchEvent> patchEvents
    ) {
        if (!blocks.containsKey(faddr)) {
            throw new IllegalArgumentException("Function entry " + faddr + " is not a block");
        }
        this.faddr = faddr;
        this.jumpTables = Collections.unmodifiableMap(new LinkedHashMap<>(jumpTables));
        this.patchEvents = Collections.unmodifiableMap(new LinkedHashMap<>(patchEvents));
        composition = Lazy.lazy(() -> TrampolineComposer.compose(blocks, edges, this.patchEvents));
        flowGraph = Lazy.lazy(() -> new FlowGraph(blocks().keySet(), composition.get().edges, faddr));
        derivedGraphSequence = Lazy.lazy(() -> new DerivedGraphSequence(flowGraph()));
    }

    /**
     * Create a builder for the cfg of the function at the given address.
     *
     * @param faddr The entry block of the function.
     * @return The builder.
     */
    public static Builder builder(NodeId faddr) {
        return new Builder(faddr);
    }

    /**
     * Get the entry block of the function.
     *
     * @return The entry node.
     */
    public NodeId faddr() {
        return faddr;
    }

    /**
     * Get the blocks of the function, in order, after trampoline composition.
     *
     * @return The blocks.
     */
    public Map<NodeId, CfgBlock> blocks() {
        return composition.get().blocks;
    }

    /**
     * Get the successors of every block, after trampoline composition.
     *
     * @return The edges.
     */
    public Map<NodeId, List<NodeId>> edges() {
        if (flowGraph.isForced()) return flowGraph.get().edges();
        return composition.get().edges;
    }

    /**
     * Get a block.
     *
     * @param node The node of the block.
     * @return The block.
     * @throws CfgStructureException If there is no such block.
     */
    public CfgBlock block(NodeId node) {
        CfgBlock block = blocks().get(node);
        if (block == null) throw new CfgStructureException("No block at " + node + " in function " + faddr);
        return block;
    }

    /**
     * Get the successors of a block.
     *
     * @param node The node of the block.
     * @return Its successors, in order.
     */
    public List<NodeId> successors(NodeId node) {
        return flowGraph().post(node);
    }

    /**
     * Get the jump table of a multi-way branch.
     *
     * @param node The block ending with the branch.
     * @return The jump table, or null if there is none.
     */
    public @Nullable JumpTable jumpTable(NodeId node) {
        return jumpTables.get(node);
    }

    public Map<NodeId, PatchEvent> patchEvents() {
        return patchEvents;
    }

    /**
     * Get the trampolines of this function.
     *
     * @return The composed trampoline blocks, in block order.
     */
    public List<TrampolineBlock> trampolines() {
        List<TrampolineBlock> trampolines = new ArrayList<>();
        for (CfgBlock block : blocks().values()) {
            if (block.isTrampoline()) trampolines.add((TrampolineBlock) block);
        }
        return trampolines;
    }

    /**
     * Get the flow graph of the composed blocks, starting at the function entry.
     *
     * @return The flow graph.
     */
    public FlowGraph flowGraph() {
        return flowGraph.get();
    }

    public DerivedGraphSequence derivedGraphSequence() {
        return derivedGraphSequence.get();
    }

    /**
     * Get whether the composed control flow graph is reducible.
     *
     * @return Whether the derived graph sequence ends with a single node.
     */
    public boolean isReducible() {
        return derivedGraphSequence().isReducible();
    }

    /**
     * Replace the edges of this graph, invalidating everything derived from them.
     *
     * @param newEdges The new successors of each block.
     */
    public void modifyEdges(Map<NodeId, ? extends Collection<NodeId>> newEdges) {
        flowGraph().modifyEdges(newEdges);
        derivedGraphSequence = Lazy.lazy(() -> new DerivedGraphSequence(flowGraph()));
    }

    @Override
    public String toString() {
        return "Cfg(" + faddr + ", " + blocks().size() + " blocks)";
    }

    /**
     * A builder for {@link Cfg}s.
     */
    public static class Builder {
        private final NodeId faddr;
        private final Map<NodeId, CfgBlock> blocks = new LinkedHashMap<>();
        private final Map<NodeId, List<NodeId>> edges = new LinkedHashMap<>();
        private final Map<NodeId, JumpTable> jumpTables = new LinkedHashMap<>();
        private final Map<NodeId, PatchEvent> patchEvents = new LinkedHashMap<>();

        Builder(NodeId faddr) {
            this.faddr = faddr;
        }

        /**
         * Add a block.
         *
         * @param block The block.
         * @return This builder, for convenience.
         * @throws IllegalArgumentException If there is already a block with its id.
         */
        public Builder block(CfgBlock block) {
            if (blocks.put(block.id(), block) != null) {
                throw new IllegalArgumentException("Duplicate block " + block.id());
            }
            return this;
        }

        /**
         * Add an edge. Edges from the same block are kept in the order they are added.
         *
         * @param src The source block.
         * @param tgt The target block.
         * @return This builder, for convenience.
         */
        public Builder edge(NodeId src, NodeId tgt) {
            edges.computeIfAbsent(src, $ -> new ArrayList<>()).add(tgt);
            return this;
        }

        /**
         * Set the successors of a block, replacing any added before.
         *
         * @param src   The source block.
         * @param succs The successors, in order.
         * @return This builder, for convenience.
         */
        public Builder edges(NodeId src, List<NodeId> succs) {
            edges.put(src, new ArrayList<>(succs));
            return this;
        }

        /**
         * Set the jump table of the multi-way branch ending a block.
         *
         * @param node  The block.
         * @param table The jump table.
         * @return This builder, for convenience.
         */
        public Builder jumpTable(NodeId node, JumpTable table) {
            jumpTables.put(node, table);
            return this;
        }

        /**
         * Add the patch event of a trampoline.
         *
         * @param event The patch event.
         * @return This builder, for convenience.
         */
        public Builder patchEvent(PatchEvent event) {
            patchEvents.put(event.setupBlock(), event);
            return this;
        }

        /**
         * Build the cfg.
         *
         * @return The cfg.
         * @throws IllegalArgumentException If the entry is not a block.
         */
        public Cfg build() {
            Map<NodeId, List<NodeId>> edgesCopy = new LinkedHashMap<>();
            for (Map.Entry<NodeId, List<NodeId>> entry : edges.entrySet()) {
                edgesCopy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
            }
            return new Cfg(faddr, new LinkedHashMap<>(blocks), edgesCopy, jumpTables, patchEvents);
        }
    }
}
