package io.github.eutro.bin2ast.core.cfg;

import io.github.eutro.bin2ast.core.ast.Expr;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A run of instructions within one block that is either all unpredicated ({@link #isLinear() linear}),
 * or all predicated on the flags of the same setter.
 * <p>
 * Predicated instructions testing the first predicated instruction's condition go in the then-branch;
 * the others go in the else-branch.
 */
public final class BasicBlockFragment {
    private final List<Instruction> linear = new ArrayList<>();
    private final List<Instruction> thenBranch = new ArrayList<>();
    private final List<Instruction> elseBranch = new ArrayList<>();
    private @Nullable Instruction conditionInstruction;
    private @Nullable Object setter;
    private @Nullable String thenCode;
    private @Nullable String elseCode;

    public boolean isLinear() {
        return !linear.isEmpty();
    }

    public boolean isPredicated() {
        return conditionInstruction != null;
    }

    /**
     * Add an unpredicated instruction.
     *
     * @param insn The instruction.
     * @throws CfgStructureException If this fragment is predicated.
     */
    public void addLinear(Instruction insn) {
        if (isPredicated()) {
            throw new CfgStructureException("Cannot add linear instruction at 0x" + Long.toHexString(insn.address())
                    + " to a predicated fragment");
        }
        linear.add(insn);
    }

    /**
     * Get whether a predicated instruction belongs in this fragment.
     * <p>
     * It does if this fragment is predicated on the same setter, and the instruction either
     * tests the then-condition while the else-branch is still empty, or tests the else-condition.
     *
     * @param insn The predicated instruction.
     * @return Whether {@link #addPredicated(Instruction)} would keep it in order.
     */
    public boolean accepts(Instruction insn) {
        if (!isPredicated() || !Objects.equals(setter, insn.conditionSetter())) return false;
        String code = insn.conditionCode();
        if (Objects.equals(code, thenCode)) return elseBranch.isEmpty();
        return elseCode == null || Objects.equals(code, elseCode);
    }

    /**
     * Add a predicated instruction.
     *
     * @param insn The instruction.
     * @throws CfgStructureException If this fragment is linear, or the instruction has another setter.
     */
    public void addPredicated(Instruction insn) {
        if (isLinear()) {
            throw new CfgStructureException("Cannot add predicated instruction at 0x" + Long.toHexString(insn.address())
                    + " to a linear fragment");
        }
        if (conditionInstruction == null) {
            conditionInstruction = insn;
            setter = insn.conditionSetter();
            thenCode = insn.conditionCode();
            thenBranch.add(insn);
            return;
        }
        if (!Objects.equals(setter, insn.conditionSetter())) {
            throw new CfgStructureException("Instruction at 0x" + Long.toHexString(insn.address())
                    + " has a different condition setter from its fragment");
        }
        if (Objects.equals(insn.conditionCode(), thenCode) && elseBranch.isEmpty()) {
            thenBranch.add(insn);
        } else {
            elseCode = insn.conditionCode();
            elseBranch.add(insn);
        }
    }

    public List<Instruction> linear() {
        return Collections.unmodifiableList(linear);
    }

    public List<Instruction> thenBranch() {
        return Collections.unmodifiableList(thenBranch);
    }

    public List<Instruction> elseBranch() {
        return Collections.unmodifiableList(elseBranch);
    }

    public @Nullable Object setter() {
        return setter;
    }

    public @Nullable Instruction conditionInstruction() {
        return conditionInstruction;
    }

    /**
     * Get the condition of the then-branch.
     *
     * @return The condition.
     * @throws IllegalStateException If this fragment is not predicated.
     */
    public Expr condition() {
        if (conditionInstruction == null) throw new IllegalStateException("fragment is not predicated");
        return conditionInstruction.condition(false);
    }

    @Override
    public String toString() {
        if (!isPredicated()) return "linear" + addresses(linear);
        return "predicated(" + setter + ", then=" + addresses(thenBranch) + ", else=" + addresses(elseBranch) + ")";
    }

    private static List<String> addresses(List<Instruction> insns) {
        List<String> out = new ArrayList<>();
        for (Instruction insn : insns) {
            out.add("0x" + Long.toHexString(insn.address()));
        }
        return out;
    }
}
