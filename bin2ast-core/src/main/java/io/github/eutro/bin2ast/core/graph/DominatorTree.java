package io.github.eutro.bin2ast.core.graph;

import io.github.eutro.bin2ast.core.cfg.CfgStructureException;

import java.util.*;

/**
 * The dominator tree of a {@link FlowGraph}, as an adjacency from each reachable node to the
 * nodes it immediately dominates.
 * <p>
 * Children are sorted by descending reverse postorder index, so the structurally latest
 * child comes first.
 */
public final class DominatorTree {
    private final NodeId root;
    private final Map<NodeId, List<NodeId>> children;

    /**
     * Construct a dominator tree from an immediate dominator map.
     *
     * @param root     The root of the tree, which must be its own immediate dominator.
     * @param idoms    The immediate dominator of every node in the tree.
     * @param rpoIndex The reverse postorder index of every node in the tree.
     */
    public DominatorTree(NodeId root, Map<NodeId, NodeId> idoms, Map<NodeId, Integer> rpoIndex) {
        this.root = root;
        Map<NodeId, List<NodeId>> children = new LinkedHashMap<>();
        for (NodeId node : idoms.keySet()) {
            children.put(node, new ArrayList<>());
        }
        for (Map.Entry<NodeId, NodeId> entry : idoms.entrySet()) {
            NodeId node = entry.getKey();
            if (node.equals(root)) continue;
            List<NodeId> siblings = children.get(entry.getValue());
            if (siblings == null) {
                throw new CfgStructureException("Immediate dominator " + entry.getValue() + " of " + node + " is not in the tree");
            }
            siblings.add(node);
        }
        Comparator<NodeId> byRpo = Comparator.comparing(rpoIndex::get);
        for (Map.Entry<NodeId, List<NodeId>> entry : children.entrySet()) {
            List<NodeId> list = entry.getValue();
            list.sort(byRpo.reversed());
            entry.setValue(Collections.unmodifiableList(list));
        }
        this.children = Collections.unmodifiableMap(children);
    }

    /**
     * Get the root of the tree.
     *
     * @return The root.
     */
    public NodeId root() {
        return root;
    }

    /**
     * Get the nodes immediately dominated by a node, by descending reverse postorder index.
     *
     * @param node The node.
     * @return Its children.
     * @throws CfgStructureException If the node is not in the tree.
     */
    public List<NodeId> children(NodeId node) {
        List<NodeId> list = children.get(node);
        if (list == null) {
            throw new CfgStructureException("Node " + node + " is not in the dominator tree");
        }
        return list;
    }

    /**
     * Get whether the node is in the tree.
     *
     * @param node The node.
     * @return Whether the node is in the tree.
     */
    public boolean contains(NodeId node) {
        return children.containsKey(node);
    }

    /**
     * Get the tree as an adjacency map.
     *
     * @return The children of every node in the tree.
     */
    public Map<NodeId, List<NodeId>> asMap() {
        return children;
    }

    @Override
    public String toString() {
        return "DominatorTree" + children;
    }
}
