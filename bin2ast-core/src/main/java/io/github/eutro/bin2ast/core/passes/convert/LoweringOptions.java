package io.github.eutro.bin2ast.core.passes.convert;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Options for {@link LowerCfg}.
 * <p>
 * Create these with {@link #builder()}.
 */
public final class LoweringOptions {
    /**
     * The environment variable that selects the default {@link LoweringStrategy}, by name.
     */
    public static final String STRATEGY_ENV = "BIN2AST_STRATEGY";

    private static final Logger LOGGER = LoggerFactory.getLogger(LoweringOptions.class);

    private final LoweringStrategy strategy;
    private final boolean normalizeBranches;
    private final String labelPrefix;
    private final boolean fallBackOnUnresolvedSwitch;

    private LoweringOptions(Builder builder) {
        this.strategy = builder.strategy;
        this.normalizeBranches = builder.normalizeBranches;
        this.labelPrefix = builder.labelPrefix;
        this.fallBackOnUnresolvedSwitch = builder.fallBackOnUnresolvedSwitch;
    }

    /**
     * Start a {@link Builder} with the default options.
     *
     * @return The new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the default options.
     *
     * @return The options.
     */
    public static LoweringOptions defaults() {
        return builder().build();
    }

    public LoweringStrategy strategy() {
        return strategy;
    }

    /**
     * Get whether a two-way branch with an empty then-arm is flipped, so that its else-arm
     * becomes the then-arm under the negated condition.
     *
     * @return Whether branches are normalized.
     */
    public boolean normalizeBranches() {
        return normalizeBranches;
    }

    /**
     * Get the prefix of the labels of goto targets.
     *
     * @return The prefix.
     */
    public String labelPrefix() {
        return labelPrefix;
    }

    /**
     * Get whether a function with a switch whose cases cannot be resolved is lowered
     * with {@link LoweringStrategy#LEGACY} instead of failing.
     *
     * @return Whether to fall back.
     */
    public boolean fallBackOnUnresolvedSwitch() {
        return fallBackOnUnresolvedSwitch;
    }

    /**
     * Start a builder with these options.
     *
     * @return The new builder.
     */
    public Builder toBuilder() {
        return new Builder()
                .setStrategy(strategy)
                .setNormalizeBranches(normalizeBranches)
                .setLabelPrefix(labelPrefix)
                .setFallBackOnUnresolvedSwitch(fallBackOnUnresolvedSwitch);
    }

    @Override
    public String toString() {
        return "LoweringOptions(strategy=" + strategy
                + ", normalizeBranches=" + normalizeBranches
                + ", labelPrefix=" + labelPrefix
                + ", fallBackOnUnresolvedSwitch=" + fallBackOnUnresolvedSwitch + ")";
    }

    static LoweringStrategy strategyFromEnv(@Nullable String value) {
        if (value == null || value.trim().isEmpty()) return LoweringStrategy.STRUCTURED;
        try {
            return LoweringStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOGGER.warn("Ignoring unknown {}={}, using {}", STRATEGY_ENV, value, LoweringStrategy.STRUCTURED);
            return LoweringStrategy.STRUCTURED;
        }
    }

    /**
     * A builder for {@link LoweringOptions}.
     */
    public static class Builder {
        private LoweringStrategy strategy = strategyFromEnv(System.getenv(STRATEGY_ENV));
        private boolean normalizeBranches = true;
        private String labelPrefix = "L";
        private boolean fallBackOnUnresolvedSwitch = true;

        /**
         * Set the lowering strategy.
         *
         * @param strategy The strategy.
         * @return This builder, for convenience.
         */
        public Builder setStrategy(@NotNull LoweringStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        /**
         * Set whether to normalize two-way branches.
         *
         * @param normalizeBranches Whether to normalize branches.
         * @return This builder, for convenience.
         * @see LoweringOptions#normalizeBranches()
         */
        public Builder setNormalizeBranches(boolean normalizeBranches) {
            this.normalizeBranches = normalizeBranches;
            return this;
        }

        /**
         * Set the prefix of goto labels.
         *
         * @param labelPrefix The prefix.
         * @return This builder, for convenience.
         */
        public Builder setLabelPrefix(@NotNull String labelPrefix) {
            this.labelPrefix = labelPrefix;
            return this;
        }

        /**
         * Set whether to fall back to legacy lowering on unresolved switches.
         *
         * @param fallBackOnUnresolvedSwitch Whether to fall back.
         * @return This builder, for convenience.
         * @see LoweringOptions#fallBackOnUnresolvedSwitch()
         */
        public Builder setFallBackOnUnresolvedSwitch(boolean fallBackOnUnresolvedSwitch) {
            this.fallBackOnUnresolvedSwitch = fallBackOnUnresolvedSwitch;
            return this;
        }

        /**
         * Build the options.
         *
         * @return The options.
         */
        public LoweringOptions build() {
            return new LoweringOptions(this);
        }
    }
}
