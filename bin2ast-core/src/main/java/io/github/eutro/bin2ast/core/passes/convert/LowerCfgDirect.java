package io.github.eutro.bin2ast.core.passes.convert;

import io.github.eutro.bin2ast.core.ast.*;
import io.github.eutro.bin2ast.core.cfg.Cfg;
import io.github.eutro.bin2ast.core.cfg.CfgBlock;
import io.github.eutro.bin2ast.core.cfg.Instruction;
import io.github.eutro.bin2ast.core.cfg.JumpTable;
import io.github.eutro.bin2ast.core.graph.FlowGraph;
import io.github.eutro.bin2ast.core.graph.NodeId;

import java.util.*;

/**
 * Lowers a control flow graph without recovering its structure: every block becomes a labelled
 * block that ends by jumping to its successors with gotos.
 * <p>
 * Reachable blocks come first, in reverse postorder, then unreachable blocks in address order.
 */
public final class LowerCfgDirect {
    private LowerCfgDirect() {
    }

    /**
     * Lower a control flow graph.
     *
     * @param cfg The control flow graph.
     * @param b   The builder to build statements with.
     * @return The body of the function.
     */
    public static BlockStmt lower(Cfg cfg, AstBuilder b) {
        FlowGraph graph = cfg.flowGraph();
        List<NodeId> order = new ArrayList<>(graph.rpoSorted());
        order.addAll(graph.unreachableNodes());

        List<Stmt> out = new ArrayList<>();
        for (NodeId node : order) {
            CfgBlock block = cfg.block(node);
            List<Stmt> stmts = BlockLowering.lower(block, b, graph,
                    target -> Collections.<Stmt>singletonList(jump(b, target)));
            List<NodeId> succs = graph.post(node);
            switch (succs.size()) {
                case 0:
                    if (!block.endsWithReturn()) stmts.add(b.returnStmt(null, null));
                    break;
                case 1:
                    stmts.add(jump(b, succs.get(0)));
                    break;
                case 2:
                    if (BlockLowering.alwaysTakesSecond(block)) {
                        stmts.add(jump(b, succs.get(1)));
                    } else {
                        Instruction insn = BlockLowering.branchInstruction(block);
                        stmts.add(b.branch(
                                insn.condition(false),
                                b.block(Collections.singletonList(jump(b, succs.get(1)))),
                                b.block(Collections.singletonList(jump(b, succs.get(0)))),
                                insn,
                                null));
                    }
                    break;
                default:
                    stmts.add(switchOf(cfg, node, block, succs, b));
            }
            out.add(b.block(stmts, Collections.singletonList(b.label(node))));
        }
        return b.block(out);
    }

    private static GotoStmt jump(AstBuilder b, NodeId target) {
        return b.gotoStmt(b.label(target), true);
    }

    private static SwitchStmt switchOf(Cfg cfg, NodeId node, CfgBlock block, List<NodeId> succs, AstBuilder b) {
        Instruction insn = BlockLowering.branchInstruction(block);
        JumpTable table = cfg.jumpTable(node);
        List<SwitchCase> cases = new ArrayList<>();
        for (int i = 1; i < succs.size(); i++) {
            NodeId target = succs.get(i);
            List<Label> labels = new ArrayList<>();
            SortedSet<Long> values = insn.caseValues(target);
            if (table != null && table.hasTarget(target)) {
                for (int index : table.getTarget(target)) {
                    labels.add(b.caseLabel(index));
                }
            } else if (values != null && !values.isEmpty()) {
                for (long value : values) {
                    labels.add(b.caseLabel(value));
                }
            } else {
                // computed jump: the target address is the selector value
                labels.add(b.caseLabel(target.address()));
            }
            cases.add(b.switchCase(labels, b.block(Collections.singletonList(jump(b, target)))));
        }
        cases.add(b.switchCase(Collections.<Label>singletonList(b.defaultLabel()),
                b.block(Collections.singletonList(jump(b, succs.get(0))))));
        return b.switchStmt(insn.condition(false), cases, insn, null);
    }
}
