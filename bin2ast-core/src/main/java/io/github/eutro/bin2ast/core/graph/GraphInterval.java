package io.github.eutro.bin2ast.core.graph;

import java.util.*;

/**
 * A maximal single-entry subgraph in which the header appears on every closed path.
 * <p>
 * Apart from edges back to the header, an interval is acyclic.
 */
public final class GraphInterval {
    private final NodeId header;
    private final Set<NodeId> nodes = new LinkedHashSet<>();
    private final Map<NodeId, List<NodeId>> edges = new LinkedHashMap<>();
    private Map<NodeId, Integer> rpo;

    GraphInterval(NodeId header) {
        this.header = header;
        nodes.add(header);
    }

    void addNode(NodeId node) {
        nodes.add(node);
    }

    void addEdge(NodeId src, NodeId tgt) {
        edges.computeIfAbsent(src, $ -> new ArrayList<>()).add(tgt);
    }

    /**
     * Get the header of this interval.
     *
     * @return The header.
     */
    public NodeId header() {
        return header;
    }

    /**
     * Get the nodes of this interval, in the order they were added.
     *
     * @return The nodes.
     */
    public Set<NodeId> nodes() {
        return Collections.unmodifiableSet(nodes);
    }

    /**
     * Get whether a node is in this interval.
     *
     * @param node The node.
     * @return Whether it is in this interval.
     */
    public boolean hasNode(NodeId node) {
        return nodes.contains(node);
    }

    /**
     * Get the edges between nodes of this interval.
     *
     * @return The edges.
     */
    public Map<NodeId, List<NodeId>> edges() {
        return Collections.unmodifiableMap(edges);
    }

    /**
     * Get the reverse postorder index of every node within this interval, ignoring edges back to the header.
     *
     * @return The indices.
     */
    public Map<NodeId, Integer> rpo() {
        if (rpo == null) {
            List<NodeId> postOrder = new ArrayList<>();
            Set<NodeId> seen = new HashSet<>();
            Deque<Map.Entry<NodeId, Iterator<NodeId>>> stack = new ArrayDeque<>();
            seen.add(header);
            stack.push(new AbstractMap.SimpleEntry<>(header, successors(header)));
            while (!stack.isEmpty()) {
                Map.Entry<NodeId, Iterator<NodeId>> top = stack.peek();
                if (top.getValue().hasNext()) {
                    NodeId next = top.getValue().next();
                    if (!next.equals(header) && seen.add(next)) {
                        stack.push(new AbstractMap.SimpleEntry<>(next, successors(next)));
                    }
                } else {
                    stack.pop();
                    postOrder.add(top.getKey());
                }
            }
            Collections.reverse(postOrder);
            Map<NodeId, Integer> rpo = new LinkedHashMap<>();
            for (int i = 0; i < postOrder.size(); i++) {
                rpo.put(postOrder.get(i), i);
            }
            this.rpo = Collections.unmodifiableMap(rpo);
        }
        return rpo;
    }

    private Iterator<NodeId> successors(NodeId node) {
        List<NodeId> succs = new ArrayList<>(edges.getOrDefault(node, Collections.emptyList()));
        Collections.sort(succs);
        return succs.iterator();
    }

    @Override
    public String toString() {
        return header + " (" + nodes.size() + "): " + new TreeSet<>(nodes);
    }
}
