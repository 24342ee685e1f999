package io.github.eutro.bin2ast.core.passes.convert;

import io.github.eutro.bin2ast.core.ast.AstBuilder;
import io.github.eutro.bin2ast.core.ast.Stmt;
import io.github.eutro.bin2ast.core.cfg.*;
import io.github.eutro.bin2ast.core.graph.FlowGraph;
import io.github.eutro.bin2ast.core.graph.NodeId;
import io.github.eutro.bin2ast.core.util.F;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lowers the instructions of one block, leaving out the branch that ends it.
 * <p>
 * Predicated instructions are lowered {@link CfgBlock#fragments() fragment} by fragment into
 * if/else statements. A trailing conditional return becomes {@code if (c) return v;} and
 * a trailing return becomes {@code return v;}.
 * <p>
 * Trampolines may jump out of their block. How is up to the caller, through the {@code jump} function.
 */
final class BlockLowering {
    private BlockLowering() {
    }

    static List<Stmt> lower(CfgBlock block, AstBuilder b, FlowGraph graph, F<NodeId, List<Stmt>> jump) {
        List<Stmt> out = new ArrayList<>();
        if (block instanceof TrampolineBlock) {
            // the breakout exit comes first
            List<NodeId> succs = graph.post(block.id());
            out.addAll(TrampolinePayloads.lower(
                    (TrampolineBlock) block,
                    b,
                    succs.isEmpty() ? null : succs.get(0),
                    graph.innermostLoopHeader(block.id()),
                    jump));
        } else if (block.hasControlFlow()) {
            for (BasicBlockFragment fragment : block.fragments()) {
                if (fragment.isPredicated()) {
                    out.add(b.branch(
                            fragment.condition(),
                            b.block(sequence(b, fragment.thenBranch())),
                            b.block(sequence(b, fragment.elseBranch())),
                            fragment.conditionInstruction(),
                            null));
                } else {
                    out.addAll(sequence(b, fragment.linear()));
                }
            }
        } else {
            out.addAll(sequence(b, block.bodyInstructions()));
        }

        Instruction terminator = block.terminator();
        if (terminator != null && terminator.isConditionalReturnInstruction()) {
            out.add(b.branch(
                    terminator.condition(false),
                    b.block(Collections.singletonList(b.returnStmt(terminator.returnValue(), terminator))),
                    b.block(Collections.<Stmt>emptyList()),
                    terminator,
                    null));
        } else if (terminator != null && terminator.isReturnInstruction()) {
            out.add(b.returnStmt(terminator.returnValue(), terminator));
        }
        return out;
    }

    static List<Stmt> sequence(AstBuilder b, List<Instruction> insns) {
        if (insns.isEmpty()) return Collections.emptyList();
        return Collections.<Stmt>singletonList(b.instrSequence(insns));
    }

    /**
     * Get whether a two-way block always takes its second successor, either because it is a
     * trampoline, whose first successor is reached through its payload, or because its branch
     * condition always holds.
     */
    static boolean alwaysTakesSecond(CfgBlock block) {
        if (block.isTrampoline()) return true;
        Instruction last = block.lastInstruction();
        return last != null && last.hasStaticallyTrueCondition();
    }

    static Instruction branchInstruction(CfgBlock block) {
        Instruction last = block.lastInstruction();
        if (last == null) {
            throw new CfgStructureException("Block " + block.id() + " branches but has no instructions");
        }
        return last;
    }
}
