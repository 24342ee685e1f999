package io.github.eutro.bin2ast.core.passes.convert;

import io.github.eutro.bin2ast.core.ast.AstSpan;
import io.github.eutro.bin2ast.core.ast.BlockStmt;
import io.github.eutro.bin2ast.core.ast.AstPrinter;
import io.github.eutro.bin2ast.core.graph.NodeId;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The statements a function was lowered to.
 */
public final class LoweredFunction {
    private final NodeId faddr;
    private final BlockStmt body;
    private final LoweringStrategy strategy;
    private final Set<NodeId> labels;
    private final Map<Integer, List<AstSpan>> spans;

    LoweredFunction(
            NodeId faddr,
            BlockStmt body,
            LoweringStrategy strategy,
            Set<NodeId> labels,
            Map<Integer, List<AstSpan>> spans
    ) {
        this.faddr = faddr;
        this.body = body;
        this.strategy = strategy;
        this.labels = labels;
        this.spans = spans;
    }

    public NodeId faddr() {
        return faddr;
    }

    public BlockStmt body() {
        return body;
    }

    /**
     * Get the strategy the function was actually lowered with. This is never
     * {@link LoweringStrategy#REDUCIBLE_ONLY}, and may be {@link LoweringStrategy#LEGACY}
     * even if structuring was asked for.
     *
     * @return The strategy.
     */
    public LoweringStrategy strategy() {
        return strategy;
    }

    /**
     * Get the nodes whose blocks are labelled in the body.
     *
     * @return The labelled nodes.
     */
    public Set<NodeId> labels() {
        return labels;
    }

    /**
     * Get the instructions each statement was built from.
     *
     * @return The spans, keyed by statement id.
     */
    public Map<Integer, List<AstSpan>> spans() {
        return spans;
    }

    @Override
    public String toString() {
        return "function " + faddr + " (" + strategy + ")\n" + AstPrinter.print(body);
    }
}
