package io.github.eutro.bin2ast.core.graph;

import java.util.*;

/**
 * A graph partitioned into {@link GraphInterval intervals}, after Allen.
 * <p>
 * The first node is the unique entry node. Nodes not reachable from it belong to no interval.
 */
public final class IntervalGraph {
    private final List<NodeId> nodes;
    private final Map<NodeId, List<NodeId>> edges;
    private Map<NodeId, List<NodeId>> preds;
    private Map<NodeId, GraphInterval> intervals;

    IntervalGraph(List<NodeId> nodes, Map<NodeId, List<NodeId>> edges) {
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(edges));
    }

    /**
     * Get the nodes of this graph. The first is the entry.
     *
     * @return The nodes.
     */
    public List<NodeId> nodes() {
        return nodes;
    }

    /**
     * Get the edges of this graph.
     *
     * @return The successors of each node with any.
     */
    public Map<NodeId, List<NodeId>> edges() {
        return edges;
    }

    /**
     * Get the number of nodes in this graph.
     *
     * @return The size.
     */
    public int size() {
        return nodes.size();
    }

    private List<NodeId> post(NodeId node) {
        return edges.getOrDefault(node, Collections.emptyList());
    }

    private List<NodeId> pre(NodeId node) {
        if (preds == null) {
            preds = new HashMap<>();
            for (Map.Entry<NodeId, List<NodeId>> entry : edges.entrySet()) {
                for (NodeId tgt : entry.getValue()) {
                    preds.computeIfAbsent(tgt, $ -> new ArrayList<>()).add(entry.getKey());
                }
            }
        }
        return preds.getOrDefault(node, Collections.emptyList());
    }

    /**
     * Get the intervals of this graph, keyed by header, in the order they were found.
     *
     * @return The intervals.
     */
    public Map<NodeId, GraphInterval> intervals() {
        if (intervals == null) {
            intervals = Collections.unmodifiableMap(constructIntervals());
        }
        return intervals;
    }

    private Map<NodeId, GraphInterval> constructIntervals() {
        Map<NodeId, GraphInterval> intervals = new LinkedHashMap<>();
        Deque<NodeId> headers = new ArrayDeque<>();
        Set<NodeId> covered = new HashSet<>();
        headers.add(nodes.get(0));
        covered.add(nodes.get(0));
        while (!headers.isEmpty()) {
            NodeId h = headers.removeFirst();
            GraphInterval interval = new GraphInterval(h);
            Deque<NodeId> worklist = new ArrayDeque<>();
            worklist.add(h);
            while (!worklist.isEmpty()) {
                NodeId c = worklist.removeFirst();
                for (NodeId tgt : post(c)) {
                    if (interval.hasNode(tgt) || covered.contains(tgt)) continue;
                    if (interval.nodes().containsAll(pre(tgt))) {
                        interval.addNode(tgt);
                        covered.add(tgt);
                        worklist.add(tgt);
                    }
                }
            }

            for (NodeId src : interval.nodes()) {
                for (NodeId tgt : post(src)) {
                    if (interval.hasNode(tgt)) {
                        interval.addEdge(src, tgt);
                    } else if (!covered.contains(tgt)) {
                        covered.add(tgt);
                        headers.add(tgt);
                    }
                }
            }
            intervals.put(h, interval);
        }
        return intervals;
    }

    /**
     * Build the graph whose nodes are the intervals of this one, identified by their headers.
     *
     * @return The derived graph.
     */
    IntervalGraph derive() {
        Map<NodeId, GraphInterval> intervals = intervals();
        List<NodeId> inodes = new ArrayList<>(intervals.keySet());
        Map<NodeId, List<NodeId>> iedges = new LinkedHashMap<>();
        for (GraphInterval interval : intervals.values()) {
            Set<NodeId> targets = new LinkedHashSet<>();
            for (NodeId n : interval.nodes()) {
                for (NodeId tgt : post(n)) {
                    if (!interval.hasNode(tgt) && intervals.containsKey(tgt)) {
                        targets.add(tgt);
                    }
                }
            }
            if (!targets.isEmpty()) {
                iedges.put(interval.header(), new ArrayList<>(targets));
            }
        }
        return new IntervalGraph(inodes, iedges);
    }

    /**
     * Extend a hierarchical reverse postorder of the derived graph down to the nodes of this one.
     *
     * @param prevRpo The hierarchical reverse postorder of the interval headers.
     * @return The hierarchical reverse postorder of the nodes in this graph's intervals.
     */
    Map<NodeId, List<Integer>> hrpo(Map<NodeId, List<Integer>> prevRpo) {
        Map<NodeId, List<Integer>> result = new LinkedHashMap<>();
        for (Map.Entry<NodeId, List<Integer>> entry : prevRpo.entrySet()) {
            GraphInterval interval = intervals().get(entry.getKey());
            if (interval == null) continue;
            for (Map.Entry<NodeId, Integer> irpo : interval.rpo().entrySet()) {
                List<Integer> index = new ArrayList<>(entry.getValue());
                index.add(irpo.getValue());
                result.put(irpo.getKey(), index);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Intervals (").append(intervals().size()).append(")");
        for (GraphInterval interval : intervals().values()) {
            sb.append("\n").append(interval);
        }
        return sb.toString();
    }
}
