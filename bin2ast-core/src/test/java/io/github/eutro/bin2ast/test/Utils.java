package io.github.eutro.bin2ast.test;

import io.github.eutro.bin2ast.core.ast.AstBuilder;
import io.github.eutro.bin2ast.core.ast.AstPrinter;
import io.github.eutro.bin2ast.core.ast.BlockStmt;
import io.github.eutro.bin2ast.core.ast.Stmt;
import io.github.eutro.bin2ast.core.cfg.Cfg;
import io.github.eutro.bin2ast.core.cfg.CfgBlock;
import io.github.eutro.bin2ast.core.cfg.IndexedJumpTable;
import io.github.eutro.bin2ast.core.cfg.Instruction;
import io.github.eutro.bin2ast.core.graph.FlowGraph;
import io.github.eutro.bin2ast.core.graph.NodeId;
import io.github.eutro.bin2ast.core.passes.convert.LowerCfgDirect;
import io.github.eutro.bin2ast.core.passes.convert.LoweringOptions;
import io.github.eutro.bin2ast.core.passes.convert.LoweringStrategy;
import io.github.eutro.bin2ast.core.passes.convert.StructureCfg;

import java.util.*;

public class Utils {
    public static final LoweringOptions OPTIONS = LoweringOptions.builder()
            .setStrategy(LoweringStrategy.STRUCTURED)
            .build();

    public static NodeId n(int i) {
        return NodeId.real(i * 0x10L);
    }

    public static List<NodeId> ns(int... is) {
        List<NodeId> nodes = new ArrayList<>();
        for (int i : is) {
            nodes.add(n(i));
        }
        return nodes;
    }

    /**
     * Read rows of {@code {src, succ...}}. The first row's source is the start node.
     */
    public static Map<NodeId, List<NodeId>> edges(int[]... rows) {
        Map<NodeId, List<NodeId>> edges = new LinkedHashMap<>();
        for (int[] row : rows) {
            List<NodeId> succs = new ArrayList<>();
            for (int i = 1; i < row.length; i++) {
                succs.add(n(row[i]));
            }
            edges.put(n(row[0]), succs);
        }
        return edges;
    }

    public static FlowGraph graph(int[]... rows) {
        Map<NodeId, List<NodeId>> edges = edges(rows);
        return new FlowGraph(edges.keySet(), edges, n(rows[0][0]));
    }

    public static int[] row(int... row) {
        return row;
    }

    /**
     * A block with one plain instruction, then a terminator suited to its successor count.
     * Multi-way blocks get a jump table whose entry {@code i} is successor {@code i + 1}.
     */
    public static Cfg cfg(int[]... rows) {
        Map<NodeId, List<NodeId>> edges = edges(rows);
        NodeId start = n(rows[0][0]);
        Cfg.Builder builder = Cfg.builder(start);
        for (Map.Entry<NodeId, List<NodeId>> entry : edges.entrySet()) {
            NodeId node = entry.getKey();
            List<NodeId> succs = entry.getValue();
            builder.block(block(node, succs.size()));
            builder.edges(node, succs);
            if (succs.size() > 2) {
                builder.jumpTable(node, new IndexedJumpTable(succs.subList(1, succs.size())));
            }
        }
        return builder.build();
    }

    public static CfgBlock block(NodeId node, int succCount) {
        long addr = node.address();
        return new CfgBlock(node, Arrays.<Instruction>asList(TestInsn.op(addr), terminator(addr + 4, succCount)));
    }

    public static TestInsn terminator(long addr, int succCount) {
        switch (succCount) {
            case 0:
                return TestInsn.ret(addr);
            case 1:
                return TestInsn.jump(addr);
            case 2:
                return TestInsn.branch(addr);
            default:
                return TestInsn.switchOn(addr);
        }
    }

    /**
     * A random graph on {@code size} nodes, which may be irreducible and may have unreachable nodes.
     */
    public static int[][] randomRows(Random random, int size) {
        int[][] rows = new int[size][];
        for (int i = 0; i < size; i++) {
            int roll = random.nextInt(10);
            int count = roll == 0 ? 0 : roll < 5 ? 1 : roll < 9 ? 2 : 3;
            count = Math.min(count, size);
            List<Integer> targets = new ArrayList<>();
            for (int j = 0; j < size; j++) {
                targets.add(j);
            }
            Collections.shuffle(targets, random);
            rows[i] = new int[count + 1];
            rows[i][0] = i;
            for (int j = 0; j < count; j++) {
                rows[i][j + 1] = targets.get(j);
            }
        }
        return rows;
    }

    public static BlockStmt structure(Cfg cfg) {
        return structure(cfg, OPTIONS);
    }

    public static BlockStmt structure(Cfg cfg, LoweringOptions options) {
        Set<NodeId> labels = StructureCfg.collectLabels(cfg, options);
        return StructureCfg.structure(cfg, labels, new AstBuilder(options.labelPrefix()), options);
    }

    public static BlockStmt legacy(Cfg cfg) {
        return LowerCfgDirect.lower(cfg, new AstBuilder(OPTIONS.labelPrefix()));
    }

    public static String print(Stmt stmt) {
        return AstPrinter.print(stmt);
    }

    public static String lines(String... lines) {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }
}
