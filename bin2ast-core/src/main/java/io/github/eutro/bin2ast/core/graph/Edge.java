package io.github.eutro.bin2ast.core.graph;

/**
 * A directed edge between two nodes of a {@link FlowGraph}.
 */
public final class Edge {
    /**
     * The source of the edge.
     */
    public final NodeId src;
    /**
     * The target of the edge.
     */
    public final NodeId tgt;

    private Edge(NodeId src, NodeId tgt) {
        this.src = src;
        this.tgt = tgt;
    }

    /**
     * Create an edge.
     *
     * @param src The source.
     * @param tgt The target.
     * @return The edge.
     */
    public static Edge of(NodeId src, NodeId tgt) {
        return new Edge(src, tgt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge)) return false;
        Edge edge = (Edge) o;
        return src.equals(edge.src) && tgt.equals(edge.tgt);
    }

    @Override
    public int hashCode() {
        return 31 * src.hashCode() + tgt.hashCode();
    }

    @Override
    public String toString() {
        return src + "->" + tgt;
    }
}
