package io.github.eutro.bin2ast.core.passes.convert;

/**
 * How {@link LowerCfg} turns a control flow graph into statements.
 */
public enum LoweringStrategy {
    /**
     * Recover structured control flow with {@link StructureCfg}.
     */
    STRUCTURED,
    /**
     * Emit one labelled block per basic block, connected by gotos, with {@link LowerCfgDirect}.
     */
    LEGACY,
    /**
     * {@link #STRUCTURED} if the graph is reducible, {@link #LEGACY} otherwise.
     */
    REDUCIBLE_ONLY,
}
