package io.github.eutro.bin2ast.core.passes.convert;

import io.github.eutro.bin2ast.core.cfg.CfgStructureException;
import io.github.eutro.bin2ast.core.graph.NodeId;

/**
 * Thrown when the case values of a multi-way branch target cannot be found,
 * neither in a jump table nor from the branch instruction.
 */
public class UnresolvedSwitchException extends CfgStructureException {
    private final NodeId switchNode;
    private final NodeId target;

    public UnresolvedSwitchException(NodeId switchNode, NodeId target) {
        super("Cannot resolve the case values of the switch at " + switchNode + " for target " + target);
        this.switchNode = switchNode;
        this.target = target;
    }

    public NodeId switchNode() {
        return switchNode;
    }

    public NodeId target() {
        return target;
    }
}
