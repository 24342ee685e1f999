package io.github.eutro.bin2ast.test;

import io.github.eutro.bin2ast.core.ast.*;
import io.github.eutro.bin2ast.core.cfg.Instruction;
import io.github.eutro.bin2ast.core.graph.NodeId;

import java.util.*;

/**
 * Runs lowered statements against random branch outcomes, recording the address of every
 * instruction executed and {@link #RETURN} for every return.
 * <p>
 * Outcomes are keyed by condition name and by how many times that condition was evaluated before,
 * so two lowerings of the same graph that evaluate conditions in the same order see the same outcomes.
 */
public class AstTracer {
    public static final long RETURN = -1;
    public static final long FELL_OFF = -2;

    private static final int SELECTOR_RANGE = 4;
    private static final int MAX_STEPS = 1_000_000;

    private final Stmt root;
    private final long seed;
    private final int limit;
    private final List<Long> trace = new ArrayList<>();
    private final Map<String, Integer> evaluations = new HashMap<>();
    private final Map<Stmt, Set<NodeId>> labelCache = new IdentityHashMap<>();
    private NodeId seeking;
    private int steps;

    private AstTracer(Stmt root, long seed, int limit) {
        this.root = root;
        this.seed = seed;
        this.limit = limit;
    }

    /**
     * Run a function body until it returns or has executed {@code limit} instructions.
     */
    public static List<Long> trace(Stmt root, long seed, int limit) {
        AstTracer tracer = new AstTracer(root, seed, limit);
        tracer.run();
        return tracer.trace;
    }

    private void run() {
        while (true) {
            try {
                exec(root);
                trace.add(FELL_OFF);
                return;
            } catch (Goto g) {
                seeking = g.target;
            } catch (Return r) {
                trace.add(RETURN);
                return;
            } catch (Stop s) {
                return;
            }
        }
    }

    private void step() {
        if (++steps > MAX_STEPS) {
            throw new IllegalStateException("no instruction executed in " + MAX_STEPS + " steps");
        }
    }

    private boolean contains(Stmt stmt, NodeId target) {
        Set<NodeId> labels = labelCache.get(stmt);
        if (labels == null) {
            labels = new HashSet<>();
            for (StmtLabel label : AstUtil.labels(stmt)) {
                labels.add(label.target());
            }
            labelCache.put(stmt, labels);
        }
        return labels.contains(target);
    }

    private boolean holds(Expr expr) {
        if (expr instanceof NotExpr) return !holds(((NotExpr) expr).operand());
        if (expr instanceof BinaryExpr) {
            BinaryExpr binary = (BinaryExpr) expr;
            if (BinaryExpr.OR.equals(binary.op())) return holds(binary.left()) || holds(binary.right());
            if (BinaryExpr.AND.equals(binary.op())) return holds(binary.left()) && holds(binary.right());
        }
        return random(expr).nextBoolean();
    }

    private long select(Expr expr) {
        return random(expr).nextInt(SELECTOR_RANGE);
    }

    private Random random(Expr expr) {
        if (!(expr instanceof NamedExpr)) {
            throw new IllegalArgumentException("cannot evaluate " + expr);
        }
        String name = ((NamedExpr) expr).name();
        int count = evaluations.merge(name, 1, Integer::sum);
        return new Random(Objects.hash(seed, name, count));
    }

    private void exec(Stmt stmt) {
        step();
        stmt.accept(visitor);
    }

    private void execBlock(BlockStmt block) {
        if (seeking != null) {
            for (StmtLabel label : block.labels()) {
                if (label.target().equals(seeking)) seeking = null;
            }
        }
        for (Stmt stmt : block.stmts()) {
            if (seeking != null && !contains(stmt, seeking)) continue;
            exec(stmt);
        }
    }

    private void execCases(List<SwitchCase> cases, int from) {
        try {
            for (int i = from; i < cases.size(); i++) {
                execBlock(cases.get(i).body());
            }
        } catch (Break b) {
            // leaves the switch
        }
    }

    private int findCase(SwitchStmt stmt, long value) {
        List<SwitchCase> cases = stmt.cases();
        int fallback = -1;
        for (int i = 0; i < cases.size(); i++) {
            for (Label label : cases.get(i).labels()) {
                if (label instanceof DefaultLabel) {
                    fallback = i;
                } else if (label instanceof CaseLabel && ((CaseLabel) label).value().value() == value) {
                    return i;
                }
            }
        }
        return fallback;
    }

    private final StmtVisitor<Void> visitor = new StmtVisitor<Void>() {
        @Override
        public Void visitBlock(BlockStmt stmt) {
            execBlock(stmt);
            return null;
        }

        @Override
        public Void visitInstrSequence(InstrSequenceStmt stmt) {
            for (Instruction insn : stmt.instructions()) {
                trace.add(insn.address());
                if (trace.size() >= limit) throw new Stop();
            }
            return null;
        }

        @Override
        public Void visitBranch(BranchStmt stmt) {
            if (seeking != null) {
                execBlock(contains(stmt.thenBranch(), seeking) ? stmt.thenBranch() : stmt.elseBranch());
            } else {
                execBlock(holds(stmt.condition()) ? stmt.thenBranch() : stmt.elseBranch());
            }
            return null;
        }

        @Override
        public Void visitLoop(LoopStmt stmt) {
            while (true) {
                try {
                    execBlock(stmt.body());
                } catch (Break b) {
                    return null;
                } catch (Continue c) {
                    // next iteration
                }
                step();
            }
        }

        @Override
        public Void visitSwitch(SwitchStmt stmt) {
            List<SwitchCase> cases = stmt.cases();
            if (seeking != null) {
                for (int i = 0; i < cases.size(); i++) {
                    if (contains(cases.get(i).body(), seeking)) {
                        execCases(cases, i);
                        return null;
                    }
                }
                throw new IllegalStateException("switch does not contain " + seeking);
            }
            int index = findCase(stmt, select(stmt.selector()));
            if (index >= 0) execCases(cases, index);
            return null;
        }

        @Override
        public Void visitGoto(GotoStmt stmt) {
            throw new Goto(stmt.target());
        }

        @Override
        public Void visitBreak(BreakStmt stmt) {
            throw new Break();
        }

        @Override
        public Void visitContinue(ContinueStmt stmt) {
            throw new Continue();
        }

        @Override
        public Void visitReturn(ReturnStmt stmt) {
            throw new Return();
        }
    };

    private static class Signal extends RuntimeException {
        Signal() {
            super(null, null, false, false);
        }
    }

    private static class Break extends Signal {
    }

    private static class Continue extends Signal {
    }

    private static class Return extends Signal {
    }

    private static class Stop extends Signal {
    }

    private static class Goto extends Signal {
        final NodeId target;

        Goto(NodeId target) {
            this.target = target;
        }
    }
}
