package io.github.eutro.bin2ast.core.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Partitions the instructions of a block into {@link BasicBlockFragment}s.
 */
public final class BlockFragments {
    private BlockFragments() {
    }

    /**
     * Partition a run of instructions into fragments, keeping their order.
     * <p>
     * Unpredicated instructions accumulate in a linear fragment. A predicated instruction
     * starts a new fragment unless the current one {@link BasicBlockFragment#accepts(Instruction) accepts} it.
     *
     * @param instructions The instructions.
     * @return The fragments.
     */
    public static List<BasicBlockFragment> partition(List<Instruction> instructions) {
        List<BasicBlockFragment> fragments = new ArrayList<>();
        BasicBlockFragment current = null;
        for (Instruction insn : instructions) {
            if (insn.hasControlFlow()) {
                if (current == null || !current.accepts(insn)) {
                    current = new BasicBlockFragment();
                    fragments.add(current);
                }
                current.addPredicated(insn);
            } else {
                if (current == null || current.isPredicated()) {
                    current = new BasicBlockFragment();
                    fragments.add(current);
                }
                current.addLinear(insn);
            }
        }
        return Collections.unmodifiableList(fragments);
    }
}
