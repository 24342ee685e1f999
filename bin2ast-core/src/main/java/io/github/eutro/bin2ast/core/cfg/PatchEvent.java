package io.github.eutro.bin2ast.core.cfg;

import io.github.eutro.bin2ast.core.graph.NodeId;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Describes a trampoline inserted into the function by a binary patch.
 * <p>
 * The trampoline starts at its setup block, and the cases say how control can leave its payload.
 */
public final class PatchEvent {
    /**
     * A way control can leave a trampoline payload.
     */
    public enum Case {
        FALLTHROUGH,
        BREAK,
        CONTINUE,
        RETURN,
    }

    private final NodeId setupBlock;
    private final Set<Case> cases;

    /**
     * Construct a patch event.
     *
     * @param setupBlock The first block of the trampoline.
     * @param cases      The ways control can leave the payload.
     */
    public PatchEvent(NodeId setupBlock, Set<Case> cases) {
        this.setupBlock = setupBlock;
        this.cases = cases.isEmpty()
                ? Collections.<Case>emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(cases));
    }

    public NodeId setupBlock() {
        return setupBlock;
    }

    public Set<Case> cases() {
        return cases;
    }

    @Override
    public String toString() {
        return "PatchEvent(" + setupBlock + ", " + cases + ")";
    }
}
