package io.github.eutro.bin2ast.test;

import io.github.eutro.bin2ast.core.ast.BlockStmt;
import io.github.eutro.bin2ast.core.cfg.Cfg;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static io.github.eutro.bin2ast.test.TestInsn.*;
import static io.github.eutro.bin2ast.test.Utils.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Checks that structured and direct lowering execute the same instructions, for the same branch outcomes.
 */
public class EquivalenceTest {
    static final int LIMIT = 200;
    static final int RUNS = 8;

    static void assertEquivalent(int[][] rows) {
        assertEquivalent(cfg(rows));
    }

    static void assertEquivalent(Cfg cfg) {
        BlockStmt structured = structure(cfg);
        BlockStmt legacy = legacy(cfg);
        for (int seed = 0; seed < RUNS; seed++) {
            List<Long> expected = AstTracer.trace(legacy, seed, LIMIT);
            List<Long> actual = AstTracer.trace(structured, seed, LIMIT);
            assertEquals(expected, actual, () -> "structured:\n" + print(structured) + "\nlegacy:\n" + print(legacy));
        }
    }

    @Test
    void testFixedGraphs() {
        assertEquivalent(FlowGraphTest.DIAMOND);
        assertEquivalent(FlowGraphTest.NESTED_LOOPS);
        assertEquivalent(StructureCfgTest.CROSSING_JOINS);
        assertEquivalent(new int[][]{row(0, 0, 1), row(1)});
        assertEquivalent(new int[][]{row(0, 1, 2), row(1, 2, 3), row(2, 1), row(3)});
        assertEquivalent(new int[][]{row(0, 4, 1, 2, 3), row(1, 4), row(2, 3), row(3, 0), row(4)});
    }

    @Test
    void testTrampolines() {
        assertEquivalent(TrampolineTest.breakout(false).build());
        assertEquivalent(TrampolineTest.breakout(true).build());
        assertEquivalent(TrampolineTest.breakout(false, false).build());
        assertEquivalent(TrampolineTest.breakout(true, false).build());
        assertEquivalent(TrampolineTest.elsewhere().build());
        assertEquivalent(TrampolineTest.looping(op(0x20), shl1(0x24), jump(0x28)).build());
        assertEquivalent(TrampolineTest.fallthrough(op(0x20), condRet(0x24)).build());
    }

    @TestFactory
    Stream<DynamicTest> testRandomGraphs() {
        Random random = new Random(2024);
        return IntStream.range(0, 200).mapToObj($ -> randomRows(random, 1 + random.nextInt(12)))
                .map(rows -> DynamicTest.dynamicTest(Arrays.deepToString(rows), () -> assertEquivalent(rows)));
    }

    @TestFactory
    Stream<DynamicTest> testStructuredPrograms() {
        Random random = new Random(2025);
        return IntStream.range(0, 50).mapToObj($ -> StructuredPrograms.generate(random, 1 + random.nextInt(5)))
                .map(rows -> DynamicTest.dynamicTest(Arrays.deepToString(rows), () -> assertEquivalent(rows)));
    }
}
