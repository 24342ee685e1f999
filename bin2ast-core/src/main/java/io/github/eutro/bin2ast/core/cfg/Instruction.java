package io.github.eutro.bin2ast.core.cfg;

import io.github.eutro.bin2ast.core.ast.Expr;
import io.github.eutro.bin2ast.core.graph.NodeId;
import org.jetbrains.annotations.Nullable;

import java.util.SortedSet;

/**
 * The view of a machine instruction that control-flow structuring needs.
 * <p>
 * Decoding and per-opcode semantics live with the architecture that implements this;
 * structuring only asks these questions.
 */
public interface Instruction {
    /**
     * Get the address of the instruction, which orders the instructions of a block.
     *
     * @return The address.
     */
    long address();

    /**
     * Get the encoded size of the instruction.
     *
     * @return The size, in bytes.
     */
    int byteSize();

    String mnemonic();

    String operandString();

    /**
     * Get whether the instruction is architecturally predicated, that is, whether it only
     * takes effect when its condition holds.
     * <p>
     * A conditional branch or return that ends its block is accounted for by the edges of
     * the control flow graph; whether it also answers true here does not matter.
     *
     * @return Whether the instruction is predicated.
     */
    boolean hasControlFlow();

    /**
     * Get the identity of the instruction that set the flags this instruction's predicate reads.
     * Predicated instructions with equal setters test the same flags.
     *
     * @return The setter, or null if the instruction is not predicated.
     */
    @Nullable Object conditionSetter();

    /**
     * Get the condition this instruction's predicate tests, such as {@code "EQ"}.
     *
     * @return The condition code, or null if the instruction is not predicated.
     */
    @Nullable String conditionCode();

    boolean isBranchInstruction();

    boolean isCallInstruction();

    /**
     * Get whether this instruction returns from the function, conditionally or not.
     *
     * @return Whether this is a return.
     */
    boolean isReturnInstruction();

    boolean isConditionalReturnInstruction();

    /**
     * Get whether this is a conditional branch whose condition is known to always hold.
     *
     * @return Whether the condition is statically true.
     */
    default boolean hasStaticallyTrueCondition() {
        return false;
    }

    /**
     * Get whether this instruction shifts a value left by one bit.
     *
     * @return Whether this is a shift left by one.
     */
    default boolean isShiftLeftByOne() {
        return false;
    }

    /**
     * Get the condition under which this instruction takes effect or branches.
     * <p>
     * For a multi-way branch, this is the value the branch selects on.
     *
     * @param reverse Whether to produce the negated condition.
     * @return The condition.
     */
    Expr condition(boolean reverse);

    /**
     * Get the value this return instruction returns.
     *
     * @return The value, or null if there is none or it is unknown.
     */
    default @Nullable Expr returnValue() {
        return null;
    }

    /**
     * Get the case values under which this multi-way branch reaches the given target,
     * for branches that are not described by a {@link JumpTable}.
     *
     * @param target The target of the branch.
     * @return The case values, or null if they cannot be derived.
     */
    default @Nullable SortedSet<Long> caseValues(NodeId target) {
        return null;
    }
}
