package io.github.eutro.bin2ast.test;

import io.github.eutro.bin2ast.core.cfg.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.github.eutro.bin2ast.test.TestInsn.*;
import static io.github.eutro.bin2ast.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class BlockFragmentsTest {
    static final Object S = "S";
    static final Object T = "T";

    static List<String> describe(List<BasicBlockFragment> fragments) {
        List<String> out = new ArrayList<>();
        for (BasicBlockFragment fragment : fragments) {
            out.add(fragment.toString());
        }
        return out;
    }

    @Test
    void testPartition() {
        List<Instruction> insns = Arrays.<Instruction>asList(
                op(1),
                predicated(2, S, "EQ"),
                predicated(3, S, "EQ"),
                op(4),
                predicated(5, T, "NE"),
                op(6));
        List<BasicBlockFragment> fragments = BlockFragments.partition(insns);
        assertEquals(Arrays.asList(
                "linear[0x1]",
                "predicated(S, then=[0x2, 0x3], else=[])",
                "linear[0x4]",
                "predicated(T, then=[0x5], else=[])",
                "linear[0x6]"
        ), describe(fragments));
        assertTrue(fragments.get(0).isLinear());
        assertFalse(fragments.get(0).isPredicated());
        assertEquals(S, fragments.get(1).setter());
        assertEquals("S_EQ", fragments.get(1).condition().toString());
    }

    @Test
    void testThenElse() {
        List<BasicBlockFragment> fragments = BlockFragments.partition(Arrays.<Instruction>asList(
                predicated(1, S, "EQ"),
                predicated(2, S, "NE"),
                predicated(3, S, "NE"),
                predicated(4, S, "EQ"),
                predicated(5, T, "EQ")));
        assertEquals(Arrays.asList(
                "predicated(S, then=[0x1], else=[0x2, 0x3])",
                "predicated(S, then=[0x4], else=[])",
                "predicated(T, then=[0x5], else=[])"
        ), describe(fragments));
    }

    @Test
    void testNoPredicatedInstructions() {
        List<BasicBlockFragment> fragments = BlockFragments.partition(Arrays.<Instruction>asList(op(1), op(2)));
        assertEquals(Collections.singletonList("linear[0x1, 0x2]"), describe(fragments));
        assertTrue(BlockFragments.partition(Collections.<Instruction>emptyList()).isEmpty());
    }

    @Test
    void testMixingThrows() {
        BasicBlockFragment linear = new BasicBlockFragment();
        linear.addLinear(op(1));
        assertThrows(CfgStructureException.class, () -> linear.addPredicated(predicated(2, S, "EQ")));

        BasicBlockFragment predicated = new BasicBlockFragment();
        predicated.addPredicated(predicated(1, S, "EQ"));
        assertThrows(CfgStructureException.class, () -> predicated.addLinear(op(2)));
        assertThrows(CfgStructureException.class, () -> predicated.addPredicated(predicated(3, T, "EQ")));
        assertFalse(predicated.accepts(predicated(3, T, "EQ")));

        assertThrows(IllegalStateException.class, () -> linear.condition());
    }

    @Test
    void testConditionalReturnIsNotControlFlow() {
        CfgBlock block = new CfgBlock(n(0), Arrays.<Instruction>asList(op(0), condRet(4).on(S, "EQ")));
        assertFalse(block.hasControlFlow());
        assertTrue(block.endsWithConditionalReturn());
        assertFalse(block.endsWithReturn());
        assertEquals(Collections.singletonList("linear[0x0]"), describe(block.fragments()));
    }

    @Test
    void testConditionalReturnWithPredicatedBody() {
        CfgBlock block = new CfgBlock(n(0), Arrays.<Instruction>asList(
                op(0), predicated(4, S, "EQ"), condRet(8).on(S, "EQ")));
        assertTrue(block.hasControlFlow());
        assertEquals(Arrays.asList(
                "linear[0x0]",
                "predicated(S, then=[0x4], else=[])"
        ), describe(block.fragments()));
        assertSame(block.fragments(), block.fragments());

        Cfg cfg = Cfg.builder(n(0)).block(block).build();
        assertEquals(lines(
                "op 0x0;",
                "if (S_EQ) {",
                "  opeq 0x4;",
                "}",
                "if (S_EQ) {",
                "  return;",
                "}",
                "return;"
        ), print(structure(cfg)));
    }
}
