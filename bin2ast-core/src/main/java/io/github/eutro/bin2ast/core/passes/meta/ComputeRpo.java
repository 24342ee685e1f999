package io.github.eutro.bin2ast.core.passes.meta;

import io.github.eutro.bin2ast.core.ext.GraphExts;
import io.github.eutro.bin2ast.core.ext.MetadataState;
import io.github.eutro.bin2ast.core.graph.Edge;
import io.github.eutro.bin2ast.core.graph.EdgeFlavor;
import io.github.eutro.bin2ast.core.graph.FlowGraph;
import io.github.eutro.bin2ast.core.graph.NodeId;
import io.github.eutro.bin2ast.core.passes.InPlaceIRPass;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Computes {@link GraphExts#RPO}, {@link GraphExts#RPO_INDEX} and {@link GraphExts#EDGE_FLAVORS} for a graph.
 * <p>
 * Two depth-first traversals are made from the start node. The first visits successors in
 * {@link NodeId} order; the second visits them in the reverse postorder found by the first,
 * which keeps spurious cross edges to a minimum. The reverse postorder and edge flavors of
 * the second traversal are the result, so neither depends on the order successors were listed in.
 * <p>
 * Both traversals keep an explicit stack, so their depth is not bounded by the Java stack.
 */
public class ComputeRpo implements InPlaceIRPass<FlowGraph> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeRpo INSTANCE = new ComputeRpo();

    @Override
    public void runInPlace(FlowGraph graph) {
        MetadataState ms = graph.getExtOrThrow(GraphExts.METADATA_STATE);

        List<NodeId> firstRpo = new Traversal(graph, Comparator.naturalOrder(), false).run();
        Map<NodeId, Integer> firstIndex = indices(firstRpo);
        Traversal second = new Traversal(graph, Comparator.comparing(firstIndex::get), true);
        List<NodeId> rpo = second.run();

        graph.attachExt(GraphExts.RPO, Collections.unmodifiableList(rpo));
        graph.attachExt(GraphExts.RPO_INDEX, Collections.unmodifiableMap(indices(rpo)));
        graph.attachExt(GraphExts.EDGE_FLAVORS, Collections.unmodifiableMap(second.flavors));

        ms.validate(MetadataState.RPO);
    }

    private static Map<NodeId, Integer> indices(List<NodeId> order) {
        Map<NodeId, Integer> indices = new LinkedHashMap<>();
        for (int i = 0; i < order.size(); i++) {
            indices.put(order.get(i), i);
        }
        return indices;
    }

    private static class Traversal {
        final FlowGraph graph;
        final Comparator<NodeId> successorOrder;
        final Map<NodeId, Integer> start = new HashMap<>();
        final Set<NodeId> finished = new HashSet<>();
        final @Nullable Map<Edge, EdgeFlavor> flavors;
        int clock = 0;

        Traversal(FlowGraph graph, Comparator<NodeId> successorOrder, boolean classify) {
            this.graph = graph;
            this.successorOrder = successorOrder;
            this.flavors = classify ? new LinkedHashMap<>() : null;
        }

        class Frame {
            final NodeId node;
            final Iterator<NodeId> succs;

            Frame(NodeId node) {
                this.node = node;
                List<NodeId> sorted = new ArrayList<>(graph.edges().get(node));
                sorted.sort(successorOrder);
                succs = sorted.iterator();
                start.put(node, clock++);
            }
        }

        List<NodeId> run() {
            List<NodeId> postOrder = new ArrayList<>();
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(graph.startNode()));
            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (top.succs.hasNext()) {
                    NodeId succ = top.succs.next();
                    Integer succStart = start.get(succ);
                    if (succStart == null) {
                        classify(top.node, succ, EdgeFlavor.TREE);
                        stack.push(new Frame(succ));
                    } else if (!finished.contains(succ)) {
                        classify(top.node, succ, EdgeFlavor.BACK);
                    } else if (succStart > start.get(top.node)) {
                        classify(top.node, succ, EdgeFlavor.FORWARD);
                    } else {
                        classify(top.node, succ, EdgeFlavor.CROSS);
                    }
                } else {
                    stack.pop();
                    finished.add(top.node);
                    clock++;
                    postOrder.add(top.node);
                }
            }
            Collections.reverse(postOrder);
            return postOrder;
        }

        void classify(NodeId src, NodeId tgt, EdgeFlavor flavor) {
            if (flavors != null) {
                flavors.put(Edge.of(src, tgt), flavor);
            }
        }
    }
}
