package io.github.eutro.bin2ast.core.passes.convert;

import io.github.eutro.bin2ast.core.graph.NodeId;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ControlFlowContextTest {
    static final NodeId H = NodeId.real(0x10);
    static final NodeId EXIT = NodeId.real(0x20);
    static final NodeId NEXT = NodeId.real(0x30);

    @Test
    void testRoot() {
        assertNull(ControlFlowContext.ROOT.breakTo());
        assertNull(ControlFlowContext.ROOT.continueTo());
        assertNull(ControlFlowContext.ROOT.fallthrough());
    }

    @Test
    void testLoop() {
        ControlFlowContext loop = ControlFlowContext.ROOT.inLoop(H, EXIT);
        assertEquals(EXIT, loop.breakTo());
        assertEquals(H, loop.continueTo());
        assertEquals(H, loop.fallthrough());

        // code followed by the loop exit is last in the loop body
        assertEquals(H, loop.withFallthrough(EXIT).fallthrough());
        assertEquals(NEXT, loop.withFallthrough(NEXT).fallthrough());
        assertEquals(loop, loop.withFallthrough(EXIT));
    }

    @Test
    void testSwitch() {
        ControlFlowContext loop = ControlFlowContext.ROOT.inLoop(H, null);
        ControlFlowContext section = loop.inSwitch(EXIT, NEXT);
        assertEquals(EXIT, section.breakTo());
        assertEquals(H, section.continueTo());
        assertEquals(NEXT, section.fallthrough());
        assertNotEquals(loop, section);
        assertEquals(section.hashCode(), loop.inSwitch(EXIT, NEXT).hashCode());
    }
}
