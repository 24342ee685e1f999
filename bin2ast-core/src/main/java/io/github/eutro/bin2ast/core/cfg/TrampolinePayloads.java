package io.github.eutro.bin2ast.core.cfg;

import io.github.eutro.bin2ast.core.ast.*;
import io.github.eutro.bin2ast.core.graph.NodeId;
import io.github.eutro.bin2ast.core.util.F;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lowers the instructions of a {@link TrampolineBlock} to statements, recognising what its payload does.
 * <p>
 * The setup instructions come first and the takedown instructions last. In between, the payload
 * is lowered by the first of these that matches:
 * <ol>
 *     <li>the payload ends with a conditional return: {@code if (c) return v;}</li>
 *     <li>the payload ends with a branch after a shift left by one, inside a loop: {@code if (c) continue;}</li>
 *     <li>two or more compound condition blocks each end with a branch: {@code if (c0 || c1 || ...) { ...; break; }},
 *     the body being the breakout instructions</li>
 *     <li>the decision block ends with a branch: {@code if (c) { ...; break; }}</li>
 * </ol>
 * The {@code continue} and {@code break} above stand for jumps to the innermost loop header and to
 * the breakout exit. The caller decides what those jumps are, since that depends on where the trampoline
 * is emitted.
 * <p>
 * A payload with no decision block and no predicated instructions is lowered as it is.
 * Anything else is logged with the {@code CRITICAL} marker, and all the instructions of the trampoline
 * are emitted as they are.
 */
public final class TrampolinePayloads {
    private static final Logger LOGGER = LoggerFactory.getLogger(TrampolinePayloads.class);
    /**
     * The marker on the log record of an unrecognised payload.
     */
    public static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");

    private TrampolinePayloads() {
    }

    /**
     * Lower a trampoline, without its final {@link CfgBlock#terminator() terminator}.
     *
     * @param trampoline   The trampoline.
     * @param b            The builder to build statements with.
     * @param breakoutExit Where the breakout leads, or null if the trampoline has no successors.
     * @param loopHeader   The header of the innermost loop around the trampoline, or null if there is none.
     * @param jump         Builds the statements that jump from the trampoline to a node.
     * @return The statements.
     */
    public static List<Stmt> lower(
            TrampolineBlock trampoline,
            AstBuilder b,
            @Nullable NodeId breakoutExit,
            @Nullable NodeId loopHeader,
            F<NodeId, List<Stmt>> jump
    ) {
        List<Stmt> payload = lowerPayload(trampoline, b, breakoutExit, loopHeader, jump);
        if (payload == null) {
            LOGGER.error(CRITICAL, "Unrecognised payload in trampoline {} with cases {}; emitting it unstructured",
                    trampoline.roles(), trampoline.patchEvent().cases());
            return sequence(b, trampoline.bodyInstructions());
        }
        List<Stmt> out = new ArrayList<>();
        CfgBlock setup = trampoline.roleBlock(TrampolineBlock.SETUP);
        if (setup != null) out.addAll(sequence(b, setup.bodyInstructions()));
        out.addAll(payload);
        CfgBlock takedown = trampoline.roleBlock(TrampolineBlock.TAKEDOWN);
        if (takedown != null) out.addAll(sequence(b, takedown.bodyInstructions()));
        return out;
    }

    private static @Nullable List<Stmt> lowerPayload(
            TrampolineBlock trampoline,
            AstBuilder b,
            @Nullable NodeId breakoutExit,
            @Nullable NodeId loopHeader,
            F<NodeId, List<Stmt>> jump
    ) {
        CfgBlock payload = trampoline.roleBlock(TrampolineBlock.PAYLOAD);
        if (payload == null) return null;
        List<Instruction> body = payload.bodyInstructions();
        if (anyPredicated(body)) return null;

        List<Stmt> out = new ArrayList<>(sequence(b, body));
        Instruction last = payload.lastInstruction();
        if (last != null && last.isConditionalReturnInstruction()) {
            out.add(b.branch(last.condition(false),
                    b.block(Collections.singletonList(b.returnStmt(last.returnValue(), last))),
                    b.block(Collections.<Stmt>emptyList()),
                    last,
                    null));
        } else if (last != null && last.isBranchInstruction()
                && !body.isEmpty() && body.get(body.size() - 1).isShiftLeftByOne()) {
            if (loopHeader == null) return null;
            out.add(b.branch(last.condition(false),
                    b.block(jump.apply(loopHeader)),
                    b.block(Collections.<Stmt>emptyList()),
                    last,
                    null));
        } else if (last != null && last.isReturnInstruction()) {
            return null;
        }

        CfgBlock decision = trampoline.roleBlock(TrampolineBlock.DECISION);
        if (decision == null) return out;
        if (breakoutExit == null) return null;

        List<CfgBlock> compound = trampoline.compoundBlocks();
        Expr condition = null;
        Instruction origin = null;
        if (compound.size() >= 2) {
            for (CfgBlock block : compound) {
                Instruction branch = block.lastInstruction();
                if (branch == null || !branch.isBranchInstruction() || anyPredicated(block.bodyInstructions())) {
                    return null;
                }
                out.addAll(sequence(b, block.bodyInstructions()));
                Expr c = branch.condition(false);
                condition = condition == null ? c : new BinaryExpr(BinaryExpr.OR, condition, c);
                origin = branch;
            }
        } else {
            Instruction branch = decision.lastInstruction();
            if (branch == null || !branch.isBranchInstruction() || anyPredicated(decision.bodyInstructions())) {
                return null;
            }
            out.addAll(sequence(b, decision.bodyInstructions()));
            condition = branch.condition(false);
            origin = branch;
        }

        List<Stmt> breakout = new ArrayList<>();
        CfgBlock breakoutBlock = trampoline.roleBlock(TrampolineBlock.BREAKOUT);
        if (breakoutBlock != null) breakout.addAll(sequence(b, breakoutBlock.bodyInstructions()));
        breakout.addAll(jump.apply(breakoutExit));
        out.add(b.branch(condition, b.block(breakout), b.block(Collections.<Stmt>emptyList()), origin, null));
        return out;
    }

    private static boolean anyPredicated(List<Instruction> insns) {
        for (Instruction insn : insns) {
            if (insn.hasControlFlow()) return true;
        }
        return false;
    }

    private static List<Stmt> sequence(AstBuilder b, List<Instruction> insns) {
        if (insns.isEmpty()) return Collections.emptyList();
        return Collections.<Stmt>singletonList(b.instrSequence(insns));
    }
}
