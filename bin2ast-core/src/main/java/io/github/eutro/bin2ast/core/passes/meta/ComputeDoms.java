package io.github.eutro.bin2ast.core.passes.meta;

import io.github.eutro.bin2ast.core.cfg.CfgStructureException;
import io.github.eutro.bin2ast.core.ext.GraphExts;
import io.github.eutro.bin2ast.core.ext.MetadataState;
import io.github.eutro.bin2ast.core.graph.FlowGraph;
import io.github.eutro.bin2ast.core.graph.NodeId;
import io.github.eutro.bin2ast.core.passes.InPlaceIRPass;

import java.util.*;

/**
 * Computes {@link GraphExts#IDOM} for every reachable node of a graph.
 */
public class ComputeDoms implements InPlaceIRPass<FlowGraph> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeDoms INSTANCE = new ComputeDoms();

    @Override
    public void runInPlace(FlowGraph graph) {
        MetadataState ms = graph.getExtOrThrow(GraphExts.METADATA_STATE);
        ms.ensureValid(graph, MetadataState.RPO, MetadataState.PREDS);

        // Cooper, Keith D.; Harvey, Timothy J.; Kennedy, Ken (2001). "A Simple, Fast Dominance Algorithm"
        List<NodeId> rpo = graph.getExtOrThrow(GraphExts.RPO);
        Map<NodeId, Integer> rpoIndex = graph.getExtOrThrow(GraphExts.RPO_INDEX);
        Map<NodeId, List<NodeId>> preds = graph.getExtOrThrow(GraphExts.PREDS);

        class Runner {
            final int n = rpo.size();
            final int[] doms = new int[n];
            final int[][] predIndices = new int[n][];

            int intersect(int b1, int b2) {
                while (b1 != b2) {
                    while (b1 > b2) b1 = doms[b1];
                    while (b2 > b1) b2 = doms[b2];
                }
                return b1;
            }

            void run() {
                for (int i = 0; i < n; i++) {
                    List<Integer> ps = new ArrayList<>();
                    for (NodeId pred : preds.get(rpo.get(i))) {
                        Integer pi = rpoIndex.get(pred);
                        if (pi != null) ps.add(pi);
                    }
                    predIndices[i] = new int[ps.size()];
                    for (int j = 0; j < ps.size(); j++) {
                        predIndices[i][j] = ps.get(j);
                    }
                }

                Arrays.fill(doms, -1);
                doms[0] = 0;
                boolean changed = true;
                while (changed) {
                    changed = false;
                    for (int b = 1; b < n; b++) {
                        int newIdom = -1;
                        for (int p : predIndices[b]) {
                            if (doms[p] == -1) continue;
                            newIdom = newIdom == -1 ? p : intersect(p, newIdom);
                        }
                        if (newIdom == -1) {
                            throw new CfgStructureException("Node " + rpo.get(b)
                                    + " has no processed predecessor; it is not reachable from "
                                    + graph.startNode());
                        }
                        if (doms[b] != newIdom) {
                            doms[b] = newIdom;
                            changed = true;
                        }
                    }
                }

                Map<NodeId, NodeId> idoms = new LinkedHashMap<>();
                for (int b = 0; b < n; b++) {
                    idoms.put(rpo.get(b), rpo.get(doms[b]));
                }
                graph.attachExt(GraphExts.IDOM, Collections.unmodifiableMap(idoms));
            }
        }
        new Runner().run();

        ms.validate(MetadataState.DOMS);
    }
}
