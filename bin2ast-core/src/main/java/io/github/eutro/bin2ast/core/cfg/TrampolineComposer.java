package io.github.eutro.bin2ast.core.cfg;

import io.github.eutro.bin2ast.core.graph.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Composes the blocks of each trampoline into a single {@link TrampolineBlock}.
 * <p>
 * A trampoline is found from its {@link PatchEvent}, and its blocks are given roles by following
 * edges from the setup block:
 * <ul>
 *     <li>{@code {FALLTHROUGH}}: setup, then a payload, then a takedown, each the only successor of the one before;</li>
 *     <li>{@code {BREAK, FALLTHROUGH}}: setup, then a payload, then a two-way decision block whose
 *     true (second) successor is the breakout and whose false (first) successor is the takedown.
 *     If the decision block's false successor is itself a two-way block with the same true successor,
 *     the blocks form a compound condition, {@code payload-0} to {@code payload-N}, and the last of them
 *     decides.</li>
 * </ul>
 * Any other shape is an error.
 * <p>
 * Edges between the blocks of a trampoline are dropped, and edges into and out of it are attached
 * to the trampoline node. The successors of a trampoline node are the exit of its breakout, then the
 * exit of its takedown.
 */
public final class TrampolineComposer {
    private static final Logger LOGGER = LoggerFactory.getLogger(TrampolineComposer.class);

    /**
     * The longest compound condition that is recognised.
     */
    public static final int MAX_COMPOUND_BLOCKS = 4;

    private final Map<NodeId, CfgBlock> blocks;
    private final Map<NodeId, List<NodeId>> edges;
    private final Map<NodeId, NodeId> owner = new HashMap<>();

    private TrampolineComposer(Map<NodeId, CfgBlock> blocks, Map<NodeId, List<NodeId>> edges) {
        this.blocks = blocks;
        this.edges = edges;
    }

    /**
     * The blocks and edges of a control flow graph after composition.
     */
    public static final class Composition {
        /**
         * The blocks, in their original order, with each trampoline in place of its setup block.
         */
        public final Map<NodeId, CfgBlock> blocks;
        /**
         * The successors of every block.
         */
        public final Map<NodeId, List<NodeId>> edges;

        Composition(Map<NodeId, CfgBlock> blocks, Map<NodeId, List<NodeId>> edges) {
            this.blocks = Collections.unmodifiableMap(blocks);
            this.edges = Collections.unmodifiableMap(edges);
        }
    }

    /**
     * Compose every trampoline of a control flow graph.
     *
     * @param blocks      The blocks of the graph, in order.
     * @param edges       The successors of every block.
     * @param patchEvents The patch events, keyed by the setup block of their trampoline.
     * @return The composed graph.
     * @throws CfgStructureException If a trampoline does not have a recognised shape.
     */
    public static Composition compose(
            Map<NodeId, CfgBlock> blocks,
            Map<NodeId, List<NodeId>> edges,
            Map<NodeId, PatchEvent> patchEvents
    ) {
        return new TrampolineComposer(blocks, edges).compose(patchEvents);
    }

    private List<NodeId> succs(NodeId node) {
        List<NodeId> succs = edges.get(node);
        return succs == null ? Collections.<NodeId>emptyList() : succs;
    }

    private CfgBlock block(NodeId node) {
        CfgBlock block = blocks.get(node);
        if (block == null) throw new CfgStructureException("Trampoline block " + node + " is not in the graph");
        return block;
    }

    private NodeId single(NodeId node, String role) {
        List<NodeId> succs = succs(node);
        if (succs.size() != 1) {
            throw new CfgStructureException("Trampoline " + role + " " + node
                    + " must have exactly one successor, but has " + succs.size() + ": " + succs);
        }
        return succs.get(0);
    }

    private Composition compose(Map<NodeId, PatchEvent> patchEvents) {
        Map<NodeId, TrampolineBlock> trampolines = new LinkedHashMap<>();
        for (NodeId setup : blocks.keySet()) {
            PatchEvent event = patchEvents.get(setup);
            if (event == null) continue;
            if (!event.setupBlock().equals(setup)) {
                throw new CfgStructureException("Patch event " + event + " is keyed by " + setup);
            }
            Map<String, NodeId> roles = classify(event);
            Map<String, CfgBlock> roleBlocks = new LinkedHashMap<>();
            for (Map.Entry<String, NodeId> role : roles.entrySet()) {
                if (role.getKey().equals(TrampolineBlock.FALLTHROUGH)) continue;
                NodeId node = role.getValue();
                NodeId prev = owner.put(node, setup);
                if (prev != null && !prev.equals(setup)) {
                    throw new CfgStructureException("Block " + node + " belongs to trampolines at " + prev + " and " + setup);
                }
                roleBlocks.put(role.getKey(), block(node));
            }
            trampolines.put(setup, new TrampolineBlock(event, roles, roleBlocks));
            LOGGER.debug("composed trampoline {}", roles);
        }
        for (NodeId setup : patchEvents.keySet()) {
            if (!blocks.containsKey(setup)) {
                throw new CfgStructureException("Patch event for " + setup + " has no setup block");
            }
        }

        Map<NodeId, CfgBlock> newBlocks = new LinkedHashMap<>();
        Map<NodeId, List<NodeId>> newEdges = new LinkedHashMap<>();
        for (CfgBlock block : blocks.values()) {
            NodeId node = block.id();
            TrampolineBlock trampoline = trampolines.get(node);
            if (trampoline != null) {
                newBlocks.put(node, trampoline);
                newEdges.put(node, exits(trampoline));
            } else if (owner.containsKey(node)) {
                checkInternal(node, trampolines.get(owner.get(node)));
            } else {
                if (block.hasTrampolineRole()) {
                    LOGGER.warn("Block {} has trampoline role {} but no patch event", node, block.role());
                }
                newBlocks.put(node, block);
                List<NodeId> succs = succs(node);
                for (NodeId succ : succs) {
                    NodeId succOwner = owner.get(succ);
                    if (succOwner != null && !succOwner.equals(succ)) {
                        throw new CfgStructureException("Edge " + node + "->" + succ
                                + " enters trampoline " + succOwner + " other than through its setup block");
                    }
                }
                newEdges.put(node, succs);
            }
        }
        return new Composition(newBlocks, newEdges);
    }

    private void checkInternal(NodeId node, TrampolineBlock trampoline) {
        Map<String, NodeId> roles = trampoline.roles();
        if (node.equals(roles.get(TrampolineBlock.BREAKOUT)) || node.equals(roles.get(TrampolineBlock.TAKEDOWN))) {
            return;
        }
        for (NodeId succ : succs(node)) {
            if (leaves(trampoline.id(), succ)) {
                throw new CfgStructureException("Trampoline block " + node + " of " + trampoline.id()
                        + " leaves the trampoline to " + succ);
            }
        }
    }

    private boolean leaves(NodeId setup, NodeId succ) {
        return succ.equals(setup) || !setup.equals(owner.get(succ));
    }

    private List<NodeId> exits(TrampolineBlock trampoline) {
        NodeId setup = trampoline.id();
        Set<NodeId> exits = new LinkedHashSet<>();
        for (String role : new String[]{TrampolineBlock.BREAKOUT, TrampolineBlock.TAKEDOWN}) {
            NodeId node = trampoline.roles().get(role);
            if (node == null) continue;
            List<NodeId> outside = new ArrayList<>();
            for (NodeId succ : succs(node)) {
                if (leaves(setup, succ)) outside.add(succ);
            }
            if (outside.size() > 1) {
                throw new CfgStructureException("Trampoline " + role + " " + node
                        + " must have at most one exit, but has " + outside);
            }
            exits.addAll(outside);
        }
        return new ArrayList<>(exits);
    }

    private Map<String, NodeId> classify(PatchEvent event) {
        NodeId setup = event.setupBlock();
        Set<PatchEvent.Case> cases = event.cases();
        Map<String, NodeId> roles = new LinkedHashMap<>();
        roles.put(TrampolineBlock.SETUP, setup);
        NodeId payload = single(setup, TrampolineBlock.SETUP);
        roles.put(TrampolineBlock.PAYLOAD, payload);

        NodeId takedown;
        if (cases.equals(EnumSet.of(PatchEvent.Case.FALLTHROUGH))) {
            takedown = single(payload, TrampolineBlock.PAYLOAD);
        } else if (cases.equals(EnumSet.of(PatchEvent.Case.BREAK, PatchEvent.Case.FALLTHROUGH))) {
            NodeId first = single(payload, TrampolineBlock.PAYLOAD);
            List<NodeId> firstSuccs = succs(first);
            if (firstSuccs.size() != 2) {
                throw new CfgStructureException("Trampoline " + TrampolineBlock.DECISION + " " + first
                        + " must have exactly two successors, but has " + firstSuccs.size() + ": " + firstSuccs);
            }
            List<NodeId> chain = new ArrayList<>();
            chain.add(first);
            while (chain.size() < MAX_COMPOUND_BLOCKS) {
                List<NodeId> lastSuccs = succs(chain.get(chain.size() - 1));
                NodeId falseSucc = lastSuccs.get(0);
                List<NodeId> nextSuccs = succs(falseSucc);
                if (nextSuccs.size() == 2
                        && nextSuccs.get(1).equals(lastSuccs.get(1))
                        && !chain.contains(falseSucc)
                        && !falseSucc.equals(setup)
                        && !falseSucc.equals(payload)) {
                    chain.add(falseSucc);
                } else {
                    break;
                }
            }
            if (chain.size() > 1) {
                for (int i = 0; i < chain.size(); i++) {
                    roles.put(TrampolineBlock.payloadRole(i), chain.get(i));
                }
            }
            NodeId decision = chain.get(chain.size() - 1);
            roles.put(TrampolineBlock.DECISION, decision);
            roles.put(TrampolineBlock.BREAKOUT, succs(decision).get(1));
            takedown = succs(decision).get(0);
        } else {
            throw new CfgStructureException("Unrecognised trampoline at " + setup + " with cases " + cases);
        }
        roles.put(TrampolineBlock.TAKEDOWN, takedown);
        List<NodeId> takedownSuccs = succs(takedown);
        if (takedownSuccs.size() == 1) {
            roles.put(TrampolineBlock.FALLTHROUGH, takedownSuccs.get(0));
        }
        return roles;
    }
}
