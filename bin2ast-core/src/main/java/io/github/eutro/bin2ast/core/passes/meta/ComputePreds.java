package io.github.eutro.bin2ast.core.passes.meta;

import io.github.eutro.bin2ast.core.ext.GraphExts;
import io.github.eutro.bin2ast.core.ext.MetadataState;
import io.github.eutro.bin2ast.core.graph.FlowGraph;
import io.github.eutro.bin2ast.core.graph.NodeId;
import io.github.eutro.bin2ast.core.passes.InPlaceIRPass;

import java.util.*;

/**
 * Computes {@link GraphExts#PREDS} for a graph.
 * <p>
 * Predecessors of every node are listed in node order, including predecessors
 * that are not reachable from the start node.
 */
public class ComputePreds implements InPlaceIRPass<FlowGraph> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(FlowGraph graph) {
        MetadataState ms = graph.getExtOrThrow(GraphExts.METADATA_STATE);

        Map<NodeId, List<NodeId>> preds = new LinkedHashMap<>();
        for (NodeId node : graph.nodes()) {
            preds.put(node, new ArrayList<>());
        }
        for (Map.Entry<NodeId, List<NodeId>> entry : graph.edges().entrySet()) {
            for (NodeId target : entry.getValue()) {
                preds.get(target).add(entry.getKey());
            }
        }
        for (Map.Entry<NodeId, List<NodeId>> entry : preds.entrySet()) {
            entry.setValue(Collections.unmodifiableList(entry.getValue()));
        }
        graph.attachExt(GraphExts.PREDS, Collections.unmodifiableMap(preds));

        ms.validate(MetadataState.PREDS);
    }
}
