package io.github.eutro.bin2ast.core.passes.convert;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LoweringOptionsTest {
    @Test
    void testStrategyFromEnv() {
        assertEquals(LoweringStrategy.STRUCTURED, LoweringOptions.strategyFromEnv(null));
        assertEquals(LoweringStrategy.STRUCTURED, LoweringOptions.strategyFromEnv("  "));
        assertEquals(LoweringStrategy.LEGACY, LoweringOptions.strategyFromEnv("legacy"));
        assertEquals(LoweringStrategy.REDUCIBLE_ONLY, LoweringOptions.strategyFromEnv(" Reducible_Only "));
        assertEquals(LoweringStrategy.STRUCTURED, LoweringOptions.strategyFromEnv("relooper"));
    }

    @Test
    void testBuilder() {
        LoweringOptions options = LoweringOptions.builder()
                .setStrategy(LoweringStrategy.LEGACY)
                .setNormalizeBranches(false)
                .setLabelPrefix("BB")
                .setFallBackOnUnresolvedSwitch(false)
                .build();
        assertEquals(LoweringStrategy.LEGACY, options.strategy());
        assertFalse(options.normalizeBranches());
        assertEquals("BB", options.labelPrefix());
        assertFalse(options.fallBackOnUnresolvedSwitch());

        LoweringOptions copy = options.toBuilder().setLabelPrefix("L").build();
        assertEquals(LoweringStrategy.LEGACY, copy.strategy());
        assertFalse(copy.normalizeBranches());
        assertEquals("L", copy.labelPrefix());

        LoweringOptions defaults = LoweringOptions.defaults();
        assertTrue(defaults.normalizeBranches());
        assertTrue(defaults.fallBackOnUnresolvedSwitch());
        assertEquals("L", defaults.labelPrefix());
        assertEquals(LoweringOptions.strategyFromEnv(System.getenv(LoweringOptions.STRATEGY_ENV)), defaults.strategy());
    }
}
