package io.github.eutro.bin2ast.core.cfg;

import io.github.eutro.bin2ast.core.ext.ExtHolder;
import io.github.eutro.bin2ast.core.ext.GraphExts;
import io.github.eutro.bin2ast.core.graph.NodeId;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A basic block of a {@link Cfg}.
 */
public class CfgBlock extends ExtHolder {
    /**
     * The prefix of the {@link #role()} of blocks that belong to a trampoline.
     */
    public static final String TRAMPOLINE_ROLE_PREFIX = "trampoline";

    private final NodeId id;
    private final List<Instruction> instructions;
    private final @Nullable String role;
    private final boolean inLoop;

    /**
     * Construct a block.
     *
     * @param id           The node of the block.
     * @param instructions The instructions of the block, in address order.
     * @param role         A free-text annotation from the ingestion step, if any.
     * @param inLoop       Whether the ingestion step found the block inside a loop.
     */
    public CfgBlock(NodeId id, List<Instruction> instructions, @Nullable String role, boolean inLoop) {
        this.id = id;
        this.instructions = Collections.unmodifiableList(new ArrayList<>(instructions));
        this.role = role;
        this.inLoop = inLoop;
    }

    /**
     * Construct a block with no role, outside any loop.
     *
     * @param id           The node of the block.
     * @param instructions The instructions of the block, in address order.
     */
    public CfgBlock(NodeId id, List<Instruction> instructions) {
        this(id, instructions, null, false);
    }

    public NodeId id() {
        return id;
    }

    public long firstAddr() {
        return id.address();
    }

    /**
     * Get the address of the last instruction of this block.
     *
     * @return The address, or {@link #firstAddr()} if the block is empty.
     */
    public long lastAddr() {
        Instruction last = lastInstruction();
        return last == null ? firstAddr() : last.address();
    }

    public List<Instruction> instructions() {
        return instructions;
    }

    public @Nullable Instruction lastInstruction() {
        return instructions.isEmpty() ? null : instructions.get(instructions.size() - 1);
    }

    public @Nullable String role() {
        return role;
    }

    public boolean inLoop() {
        return inLoop;
    }

    public boolean isTrampoline() {
        return false;
    }

    /**
     * Get whether the ingestion step marked this block as part of a trampoline.
     *
     * @return Whether the role has the trampoline prefix.
     */
    public boolean hasTrampolineRole() {
        return role != null && role.startsWith(TRAMPOLINE_ROLE_PREFIX);
    }

    /**
     * Get the instruction that transfers control out of this block, if the block ends with
     * a branch or a return.
     *
     * @return The terminator, or null.
     */
    public @Nullable Instruction terminator() {
        Instruction last = lastInstruction();
        if (last != null && (last.isBranchInstruction() || last.isReturnInstruction())) {
            return last;
        }
        return null;
    }

    /**
     * Get the instructions of this block without its {@link #terminator()}.
     *
     * @return The body instructions.
     */
    public List<Instruction> bodyInstructions() {
        return terminator() == null ? instructions : instructions.subList(0, instructions.size() - 1);
    }

    /**
     * Get whether the block ends with a conditional return.
     *
     * @return Whether the terminator is a conditional return.
     */
    public boolean endsWithConditionalReturn() {
        Instruction terminator = terminator();
        return terminator != null && terminator.isConditionalReturnInstruction();
    }

    /**
     * Get whether the block ends with an unconditional return.
     *
     * @return Whether the terminator is a return, and not a conditional one.
     */
    public boolean endsWithReturn() {
        Instruction terminator = terminator();
        return terminator != null
                && terminator.isReturnInstruction()
                && !terminator.isConditionalReturnInstruction();
    }

    /**
     * Get whether the block has predicated instructions, which need to be
     * {@link #fragments() partitioned} before they can be lowered.
     * <p>
     * The terminator does not count: a trailing conditional return is lowered on its own,
     * and a trailing conditional branch is an edge of the graph.
     *
     * @return Whether the block has predicated instructions.
     */
    public boolean hasControlFlow() {
        for (Instruction insn : bodyInstructions()) {
            if (insn.hasControlFlow()) return true;
        }
        return false;
    }

    /**
     * Get the fragments of this block's {@link #bodyInstructions() body}.
     *
     * @return The fragments.
     * @see BlockFragments#partition(List)
     */
    public List<BasicBlockFragment> fragments() {
        List<BasicBlockFragment> fragments = getNullable(GraphExts.FRAGMENTS);
        if (fragments == null) {
            fragments = BlockFragments.partition(bodyInstructions());
            attachExt(GraphExts.FRAGMENTS, fragments);
        }
        return fragments;
    }

    @Override
    public String toString() {
        return "block " + id + " (" + instructions.size() + " instructions)";
    }
}
