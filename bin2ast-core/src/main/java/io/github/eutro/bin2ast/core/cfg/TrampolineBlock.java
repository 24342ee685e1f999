package io.github.eutro.bin2ast.core.cfg;

import io.github.eutro.bin2ast.core.graph.NodeId;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The single node that the blocks of a trampoline are composed into.
 * <p>
 * It takes the id of the trampoline's setup block, and keeps the blocks it was composed from
 * by role, so that the payload can be lowered by {@link TrampolinePayloads}.
 */
public final class TrampolineBlock extends CfgBlock {
    /**
     * Role of the first block, through which the trampoline is entered.
     */
    public static final String SETUP = "setupblock";
    /**
     * Role of the block following the setup block.
     */
    public static final String PAYLOAD = "payload";
    /**
     * Role of the two-way block that decides between breakout and takedown.
     */
    public static final String DECISION = "decisionblock";
    /**
     * Role of the block reached when the decision holds.
     */
    public static final String BREAKOUT = "breakout";
    /**
     * Role of the block control leaves the trampoline through normally.
     */
    public static final String TAKEDOWN = "takedown";
    /**
     * Role of the block after the takedown, outside the trampoline.
     */
    public static final String FALLTHROUGH = "fallthrough";

    private final PatchEvent patchEvent;
    private final Map<String, NodeId> roles;
    private final Map<String, CfgBlock> roleBlocks;

    TrampolineBlock(PatchEvent patchEvent, Map<String, NodeId> roles, Map<String, CfgBlock> roleBlocks) {
        super(patchEvent.setupBlock(), concatInstructions(roleBlocks), TRAMPOLINE_ROLE_PREFIX, false);
        this.patchEvent = patchEvent;
        this.roles = Collections.unmodifiableMap(new LinkedHashMap<>(roles));
        this.roleBlocks = Collections.unmodifiableMap(new LinkedHashMap<>(roleBlocks));
    }

    private static List<Instruction> concatInstructions(Map<String, CfgBlock> roleBlocks) {
        List<Instruction> insns = new ArrayList<>();
        for (CfgBlock block : new LinkedHashSet<>(roleBlocks.values())) {
            insns.addAll(block.instructions());
        }
        return insns;
    }

    /**
     * The name of the role of the {@code i}th block of a compound condition.
     *
     * @param i The index of the block.
     * @return The role.
     */
    public static String payloadRole(int i) {
        return PAYLOAD + "-" + i;
    }

    @Override
    public boolean isTrampoline() {
        return true;
    }

    public PatchEvent patchEvent() {
        return patchEvent;
    }

    /**
     * Get the address of the block in every role, including the {@link #FALLTHROUGH} role
     * if the trampoline has one.
     *
     * @return The roles.
     */
    public Map<String, NodeId> roles() {
        return roles;
    }

    /**
     * Get the blocks composed into this trampoline, by role.
     *
     * @return The blocks.
     */
    public Map<String, CfgBlock> roleBlocks() {
        return roleBlocks;
    }

    public @Nullable CfgBlock roleBlock(String role) {
        return roleBlocks.get(role);
    }

    /**
     * Get the blocks of the compound condition, {@code payload-0} to {@code payload-N}.
     *
     * @return The blocks, which are empty if the condition is not compound.
     */
    public List<CfgBlock> compoundBlocks() {
        List<CfgBlock> blocks = new ArrayList<>();
        for (int i = 0; ; i++) {
            CfgBlock block = roleBlocks.get(payloadRole(i));
            if (block == null) return blocks;
            blocks.add(block);
        }
    }

    @Override
    public String toString() {
        return "trampoline " + id() + " " + roles;
    }
}
