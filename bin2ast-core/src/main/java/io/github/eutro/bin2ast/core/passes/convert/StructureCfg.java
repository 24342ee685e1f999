package io.github.eutro.bin2ast.core.passes.convert;

import io.github.eutro.bin2ast.core.ast.*;
import io.github.eutro.bin2ast.core.cfg.*;
import io.github.eutro.bin2ast.core.graph.DominatorTree;
import io.github.eutro.bin2ast.core.graph.FlowGraph;
import io.github.eutro.bin2ast.core.graph.NodeId;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Recovers structured control flow from a control flow graph, by mapping its dominator tree
 * onto nested statements.
 * <p>
 * This follows Norman Ramsey's "Beyond Relooper" (2022). Every node is emitted where its immediate
 * dominator is emitted. A node with one forward predecessor is emitted in place of the branch to it;
 * a join, which has several predecessors or is the exit of the loop of its only predecessor,
 * is emitted after the code of its immediate dominator, which the code before it then falls into.
 * A loop header wraps its body in a {@link LoopStmt}. Branches to joins become {@code break},
 * {@code continue}, nothing at all if control falls there anyway, and {@code goto} otherwise.
 * The jumps out of a trampoline's payload are branches too, except that control never falls
 * from the payload into their target.
 * <p>
 * Structuring runs twice. The {@link #collectLabels(Cfg, LoweringOptions) first time} only finds
 * the nodes that are the target of some {@code goto}, and the {@link #structure(Cfg, Set, AstBuilder, LoweringOptions)
 * second time} builds the statements, labelling those nodes.
 * <p>
 * Blocks unreachable from the entry are not emitted.
 */
public final class StructureCfg {
    private static final Logger LOGGER = LoggerFactory.getLogger(StructureCfg.class);

    private StructureCfg() {
    }

    /**
     * Find the nodes that structuring will have to label, because it branches to them with a {@code goto}.
     *
     * @param cfg     The control flow graph.
     * @param options The lowering options.
     * @return The nodes to label.
     * @throws UnresolvedSwitchException If a switch target's case values cannot be found.
     * @throws CfgStructureException     If the graph is malformed.
     */
    public static Set<NodeId> collectLabels(Cfg cfg, LoweringOptions options) {
        Runner runner = new Runner(cfg, options, new AstBuilder(options.labelPrefix()), new TreeSet<>(), true);
        runner.run();
        LOGGER.debug("function {} needs {} labels: {}", cfg.faddr(), runner.labels.size(), runner.labels);
        return Collections.unmodifiableSet(runner.labels);
    }

    /**
     * Build the statements of a function.
     *
     * @param cfg     The control flow graph.
     * @param labels  The nodes to label, from {@link #collectLabels(Cfg, LoweringOptions)}.
     * @param b       The builder to build statements with.
     * @param options The lowering options.
     * @return The body of the function.
     * @throws IllegalStateException     If a {@code goto} targets a node that is not in {@code labels}.
     * @throws UnresolvedSwitchException If a switch target's case values cannot be found.
     * @throws CfgStructureException     If the graph is malformed.
     */
    public static BlockStmt structure(Cfg cfg, Set<NodeId> labels, AstBuilder b, LoweringOptions options) {
        BlockStmt body = new Runner(cfg, options, b, labels, false).run();
        List<NodeId> unreachable = cfg.flowGraph().unreachableNodes();
        if (!unreachable.isEmpty()) {
            LOGGER.warn("Function {}: dropping {} unreachable blocks: {}", cfg.faddr(), unreachable.size(), unreachable);
        }
        return body;
    }

    private static class Runner {
        final Cfg cfg;
        final FlowGraph graph;
        final DominatorTree tree;
        final LoweringOptions options;
        final AstBuilder b;
        final Set<NodeId> labels;
        final boolean collecting;

        Runner(Cfg cfg, LoweringOptions options, AstBuilder b, Set<NodeId> labels, boolean collecting) {
            this.cfg = cfg;
            this.graph = cfg.flowGraph();
            this.tree = graph.dominatorTree();
            this.options = options;
            this.b = b;
            this.labels = labels;
            this.collecting = collecting;
        }

        BlockStmt run() {
            NodeId start = cfg.derivedGraphSequence().last().nodes().get(0);
            if (!start.equals(graph.startNode())) {
                throw new CfgStructureException("Derived graph sequence starts at " + start
                        + ", not at the entry " + graph.startNode());
            }
            return b.block(doTree(start, ControlFlowContext.ROOT));
        }

        boolean isJoin(NodeId node) {
            List<NodeId> preds = graph.pre(node);
            if (preds.size() >= 2) return true;
            if (preds.size() != 1) return false;
            NodeId pred = preds.get(0);
            return graph.isReachable(pred)
                    && graph.isLoopHeader(pred)
                    && !graph.naturalLoop(pred).contains(node);
        }

        List<Stmt> doTree(NodeId x, ControlFlowContext ctx) {
            List<NodeId> joins = new ArrayList<>();
            for (NodeId child : tree.children(x)) {
                if (isJoin(child)) joins.add(child);
            }

            List<Stmt> out = new ArrayList<>();
            if (graph.isLoopHeader(x)) {
                SortedSet<NodeId> loop = graph.naturalLoop(x);
                List<NodeId> exits = new ArrayList<>();
                List<NodeId> inner = new ArrayList<>();
                for (NodeId join : joins) {
                    (loop.contains(join) ? inner : exits).add(join);
                }
                if (exits.size() == 1) {
                    NodeId exit = exits.get(0);
                    out.add(b.loop(b.block(nodeWithin(x, inner, ctx.inLoop(x, exit))), exit, x));
                    out.addAll(doTree(exit, ctx));
                } else {
                    out.add(b.loop(b.block(nodeWithin(x, joins, ctx.inLoop(x, ctx.fallthrough()))), null, x));
                }
            } else {
                out.addAll(nodeWithin(x, joins, ctx));
            }

            if (!collecting && labels.contains(x)) {
                return Collections.singletonList(b.block(out, Collections.singletonList(b.label(x))));
            }
            return out;
        }

        List<Stmt> nodeWithin(NodeId x, List<NodeId> ys, ControlFlowContext ctx) {
            if (!ys.isEmpty()) {
                NodeId y = ys.get(0);
                List<Stmt> out = new ArrayList<>(nodeWithin(x, ys.subList(1, ys.size()), ctx.withFallthrough(y)));
                out.addAll(doTree(y, ctx));
                return out;
            }

            CfgBlock block = cfg.block(x);
            Set<NodeId> jumpedTo = new HashSet<>();
            List<Stmt> out = BlockLowering.lower(block, b, graph, target -> {
                jumpedTo.add(target);
                return trampolineJump(x, target, ctx);
            });
            List<NodeId> succs = graph.post(x);
            switch (succs.size()) {
                case 0:
                    if (!block.endsWithReturn()) out.add(b.returnStmt(null, null));
                    break;
                case 1:
                    out.addAll(doBranch(x, succs.get(0), ctx));
                    break;
                case 2:
                    if (BlockLowering.alwaysTakesSecond(block)) {
                        if (!collecting && block.isTrampoline()
                                && !jumpedTo.contains(succs.get(0)) && !isJoin(succs.get(0))) {
                            LOGGER.warn("Function {}: breakout exit {} of trampoline {} is only reached through"
                                    + " its unrecognised payload, and will not be emitted", cfg.faddr(), succs.get(0), x);
                        }
                        out.addAll(doBranch(x, succs.get(1), ctx));
                    } else {
                        out.addAll(twoWay(x, block, succs, ctx));
                    }
                    break;
                default:
                    out.add(multiWay(x, block, succs, ctx));
            }
            return out;
        }

        List<Stmt> twoWay(NodeId x, CfgBlock block, List<NodeId> succs, ControlFlowContext ctx) {
            Instruction insn = BlockLowering.branchInstruction(block);
            List<Stmt> elseStmts = doBranch(x, succs.get(0), ctx);
            List<Stmt> thenStmts = doBranch(x, succs.get(1), ctx);
            if (thenStmts.isEmpty() && elseStmts.isEmpty()) return Collections.emptyList();

            Expr condition;
            if (options.normalizeBranches() && thenStmts.isEmpty()) {
                condition = insn.condition(true);
                thenStmts = elseStmts;
                elseStmts = Collections.emptyList();
            } else {
                condition = insn.condition(false);
            }
            return Collections.singletonList(b.branch(
                    condition,
                    b.block(thenStmts),
                    b.block(elseStmts),
                    insn,
                    ctx.fallthrough()));
        }

        // successor 0 is the default target
        Stmt multiWay(NodeId x, CfgBlock block, List<NodeId> succs, ControlFlowContext ctx) {
            Instruction insn = BlockLowering.branchInstruction(block);
            JumpTable table = cfg.jumpTable(x);
            NodeId defaultTarget = succs.get(0);
            NodeId breakTo = ctx.fallthrough();

            List<SwitchCase> cases = new ArrayList<>();
            for (int i = 1; i < succs.size(); i++) {
                NodeId target = succs.get(i);
                NodeId next = i + 1 < succs.size() ? succs.get(i + 1) : defaultTarget;
                List<Label> caseLabels = caseLabels(x, insn, table, target);
                List<Stmt> body = doBranch(x, target, ctx.inSwitch(breakTo, next));
                cases.add(b.switchCase(caseLabels, b.block(body)));
            }

            List<Stmt> defaultBody = doBranch(x, defaultTarget, ctx.inSwitch(breakTo, breakTo));
            if (!defaultBody.isEmpty()) {
                cases.add(b.switchCase(Collections.<Label>singletonList(b.defaultLabel()), b.block(defaultBody)));
            } else if (!cases.isEmpty()) {
                SwitchCase last = cases.get(cases.size() - 1);
                if (last.body().stmts().isEmpty()) {
                    cases.set(cases.size() - 1, b.switchCase(last.labels(),
                            b.block(Collections.singletonList(b.breakStmt()))));
                }
            }
            return b.switchStmt(insn.condition(false), cases, insn, breakTo);
        }

        List<Label> caseLabels(NodeId x, Instruction insn, @Nullable JumpTable table, NodeId target) {
            List<Label> caseLabels = new ArrayList<>();
            if (table != null && table.hasTarget(target)) {
                for (int index : table.getTarget(target)) {
                    caseLabels.add(b.caseLabel(index));
                }
                return caseLabels;
            }
            SortedSet<Long> values = insn.caseValues(target);
            if (values == null || values.isEmpty()) {
                throw new UnresolvedSwitchException(x, target);
            }
            for (long value : values) {
                caseLabels.add(b.caseLabel(value));
            }
            return caseLabels;
        }

        // a jump out of the middle of a trampoline, which nothing falls through from
        List<Stmt> trampolineJump(NodeId x, NodeId tgt, ControlFlowContext ctx) {
            ControlFlowContext inner = ctx.withFallthrough(null);
            if (graph.post(x).contains(tgt)) return doBranch(x, tgt, inner);
            return jumpTo(x, tgt, inner);
        }

        List<Stmt> doBranch(NodeId src, NodeId tgt, ControlFlowContext ctx) {
            if (!graph.isBackEdge(src, tgt) && !isJoin(tgt)) {
                return doTree(tgt, ctx);
            }
            return jumpTo(src, tgt, ctx);
        }

        List<Stmt> jumpTo(NodeId src, NodeId tgt, ControlFlowContext ctx) {
            if (tgt.equals(ctx.fallthrough())) return Collections.emptyList();
            if (tgt.equals(ctx.continueTo())) return Collections.singletonList(b.continueStmt());
            if (tgt.equals(ctx.breakTo())) return Collections.singletonList(b.breakStmt());
            if (collecting) {
                labels.add(tgt);
            } else if (!labels.contains(tgt)) {
                throw new IllegalStateException("No label was collected for goto target " + tgt
                        + " from " + src + " in function " + cfg.faddr());
            }
            return Collections.singletonList(b.gotoStmt(b.label(tgt), false));
        }
    }
}
