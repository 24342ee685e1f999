package io.github.eutro.bin2ast.api;

import io.github.eutro.bin2ast.api.events.*;
import io.github.eutro.bin2ast.core.cfg.Cfg;
import io.github.eutro.bin2ast.core.cfg.CfgBlock;
import io.github.eutro.bin2ast.core.cfg.Instruction;
import io.github.eutro.bin2ast.core.graph.NodeId;
import io.github.eutro.bin2ast.core.passes.convert.LoweredFunction;
import io.github.eutro.bin2ast.core.passes.convert.LoweringOptions;
import io.github.eutro.bin2ast.core.passes.convert.LoweringStrategy;
import io.github.eutro.bin2ast.core.passes.convert.UnresolvedSwitchException;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.BlockingQueue;

import static org.junit.jupiter.api.Assertions.*;

public class DecompilerTest {
    static final LoweringOptions STRICT = LoweringOptions.builder()
            .setStrategy(LoweringStrategy.STRUCTURED)
            .setFallBackOnUnresolvedSwitch(false)
            .build();

    static NodeId at(long base, int i) {
        return NodeId.real(base + i * 0x10L);
    }

    static CfgBlock block(NodeId node, String terminator) {
        return new CfgBlock(node, Arrays.<Instruction>asList(
                new Insn(node.address(), "op"),
                new Insn(node.address() + 4, terminator)));
    }

    static Cfg diamond(long base) {
        return Cfg.builder(at(base, 0))
                .block(block(at(base, 0), "bcc")).edges(at(base, 0), Arrays.asList(at(base, 1), at(base, 2)))
                .block(block(at(base, 1), "b")).edges(at(base, 1), Collections.singletonList(at(base, 3)))
                .block(block(at(base, 2), "b")).edges(at(base, 2), Collections.singletonList(at(base, 3)))
                .block(block(at(base, 3), "ret"))
                .build();
    }

    // a switch whose case values nothing records
    static Cfg unresolvedSwitch(long base) {
        return Cfg.builder(at(base, 0))
                .block(block(at(base, 0), "br"))
                .edges(at(base, 0), Arrays.asList(at(base, 3), at(base, 1), at(base, 2)))
                .block(block(at(base, 1), "b")).edges(at(base, 1), Collections.singletonList(at(base, 3)))
                .block(block(at(base, 2), "b")).edges(at(base, 2), Collections.singletonList(at(base, 3)))
                .block(block(at(base, 3), "ret"))
                .build();
    }

    @Test
    void testDecompileAllCarriesOn() {
        Decompiler dc = new Decompiler().setOptions(STRICT);
        List<LoweredFunction> functions = dc.decompileAll(Arrays.asList(
                diamond(0x0), unresolvedSwitch(0x100), diamond(0x200)));

        assertEquals(2, functions.size());
        assertEquals(NodeId.real(0x0), functions.get(0).faddr());
        assertEquals(NodeId.real(0x200), functions.get(1).faddr());
        for (LoweredFunction function : functions) {
            assertEquals(LoweringStrategy.STRUCTURED, function.strategy());
            assertTrue(function.labels().isEmpty());
        }

        assertEquals(1, dc.diagnostics().size());
        FunctionDiagnostic diagnostic = dc.diagnostics().get(0);
        assertEquals(NodeId.real(0x100), diagnostic.faddr());
        assertTrue(diagnostic.isStructural());
        assertInstanceOf(UnresolvedSwitchException.class, diagnostic.cause());
        assertTrue(diagnostic.toString().startsWith("function " + NodeId.real(0x100) + ": "));
    }

    @Test
    void testThrowingListenerFailsOnlyItsFunction() {
        Decompiler dc = new Decompiler().setOptions(STRICT);
        dc.listen(RunFunctionDecompilationEvent.class, evt -> {
            if (evt.decompilation.cfg.faddr().equals(NodeId.real(0x100))) {
                throw new IllegalStateException("listener failed");
            }
        });
        List<LoweredFunction> functions = dc.decompileAll(Arrays.asList(
                diamond(0x0), diamond(0x100), diamond(0x200)));

        assertEquals(2, functions.size());
        assertEquals(NodeId.real(0x200), functions.get(1).faddr());
        assertEquals(1, dc.diagnostics().size());
        FunctionDiagnostic diagnostic = dc.diagnostics().get(0);
        assertEquals(NodeId.real(0x100), diagnostic.faddr());
        assertFalse(diagnostic.isStructural());
        assertEquals("listener failed", diagnostic.message());
    }

    @Test
    void testFailureFallsBackByDefault() {
        Decompiler dc = new Decompiler().setOptions(STRICT.toBuilder().setFallBackOnUnresolvedSwitch(true).build());
        LoweredFunction function = dc.submit(unresolvedSwitch(0x0)).run();
        assertNotNull(function);
        assertEquals(LoweringStrategy.LEGACY, function.strategy());
        assertTrue(dc.diagnostics().isEmpty());
    }

    @Test
    void testFailedEvent() {
        Decompiler dc = new Decompiler().setOptions(STRICT);
        List<FunctionDiagnostic> seen = new ArrayList<>();
        dc.lift().listen(DecompilationFailedEvent.class, evt -> seen.add(evt.diagnostic));
        assertNull(dc.submit(unresolvedSwitch(0x40)).run());
        assertEquals(dc.diagnostics(), seen);
    }

    @Test
    void testModifyOptions() {
        Decompiler dc = new Decompiler().setOptions(STRICT);
        dc.lift().listen(ModifyOptionsEvent.class, evt -> evt.optionsBuilder.setStrategy(LoweringStrategy.LEGACY));
        LoweredFunction function = dc.submit(diamond(0x0)).run();
        assertNotNull(function);
        assertEquals(LoweringStrategy.LEGACY, function.strategy());
        assertEquals(4, function.labels().size());
        assertEquals(LoweringStrategy.STRUCTURED, dc.getOptions().strategy());
    }

    @Test
    void testSetStrategy() {
        Decompiler dc = new Decompiler().setOptions(STRICT);
        LoweredFunction legacy = dc.submit(diamond(0x0)).setStrategy(LoweringStrategy.LEGACY).run();
        LoweredFunction structured = dc.submit(diamond(0x0)).run();
        assertNotNull(legacy);
        assertNotNull(structured);
        assertEquals(LoweringStrategy.LEGACY, legacy.strategy());
        assertEquals(LoweringStrategy.STRUCTURED, structured.strategy());
    }

    @Test
    void testCfgPassesEventSeesAnalysedGraph() {
        Decompiler dc = new Decompiler().setOptions(STRICT);
        List<Boolean> reducible = new ArrayList<>();
        dc.lift().listen(CfgPassesEvent.class, evt -> reducible.add(evt.cfg.isReducible()));
        dc.submit(diamond(0x0)).run();
        assertEquals(Collections.singletonList(true), reducible);
    }

    @Test
    void testOutputsAsQueue() {
        Decompiler dc = new Decompiler().setOptions(STRICT);
        BlockingQueue<LoweredFunction> queue = dc.outputsAsQueue();
        dc.decompileAll(Arrays.asList(diamond(0x0), unresolvedSwitch(0x100), diamond(0x200)));
        assertEquals(2, queue.size());
        assertEquals(NodeId.real(0x0), queue.poll().faddr());
        assertEquals(NodeId.real(0x200), queue.poll().faddr());
    }

    @Test
    void testCancelEmit() {
        Decompiler dc = new Decompiler().setOptions(STRICT);
        dc.lift().listen(EmitAstEvent.class, EmitAstEvent::cancel);
        BlockingQueue<LoweredFunction> queue = dc.outputsAsQueue();
        assertNotNull(dc.submit(diamond(0x0)).run());
        assertTrue(queue.isEmpty());
    }

    @Test
    void testListenersRunInOrder() {
        EventSupplier<DecompilerEvent> supplier = new EventSupplier<>();
        List<String> order = new ArrayList<>();
        supplier.listen(RunFunctionDecompilationEvent.class, evt -> order.add("first"));
        supplier.listen(RunFunctionDecompilationEvent.class, evt -> order.add("second"));
        supplier.dispatch(RunFunctionDecompilationEvent.class, new RunFunctionDecompilationEvent(
                new Decompiler().submit(diamond(0x0))));
        assertEquals(Arrays.asList("first", "second"), order);
    }
}
