package io.github.eutro.bin2ast.core.ast;

import io.github.eutro.bin2ast.core.cfg.Instruction;
import io.github.eutro.bin2ast.core.graph.NodeId;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Creates statements, numbering them and recording which bytes of the binary each came from.
 * <p>
 * One builder is used per lowered function.
 */
public class AstBuilder {
    private final String labelPrefix;
    private final Map<Integer, List<AstSpan>> spans = new LinkedHashMap<>();
    private final Map<NodeId, StmtLabel> labels = new HashMap<>();
    private int nextId = 0;

    /**
     * Construct a builder whose labels are named after the given prefix.
     *
     * @param labelPrefix The prefix of every {@link StmtLabel} name.
     */
    public AstBuilder(String labelPrefix) {
        this.labelPrefix = labelPrefix;
    }

    private int newId(@Nullable Instruction origin) {
        int id = nextId++;
        if (origin != null) {
            spans.put(id, Collections.singletonList(AstSpan.of(origin)));
        }
        return id;
    }

    /**
     * Get the spans recorded for every statement built from instructions.
     *
     * @return The spans, keyed by statement id.
     */
    public Map<Integer, List<AstSpan>> spans() {
        return Collections.unmodifiableMap(spans);
    }

    /**
     * Get the number of statements built so far.
     *
     * @return The statement count.
     */
    public int stmtCount() {
        return nextId;
    }

    public InstrSequenceStmt instrSequence(List<Instruction> instructions) {
        int id = newId(null);
        List<AstSpan> insnSpans = new ArrayList<>();
        for (Instruction insn : instructions) {
            insnSpans.add(AstSpan.of(insn));
        }
        spans.put(id, Collections.unmodifiableList(insnSpans));
        return new InstrSequenceStmt(id, new ArrayList<>(instructions));
    }

    public BlockStmt block(List<? extends Stmt> stmts) {
        return block(stmts, Collections.emptyList());
    }

    public BlockStmt block(List<? extends Stmt> stmts, List<StmtLabel> labels) {
        return new BlockStmt(newId(null), new ArrayList<>(labels), new ArrayList<>(stmts));
    }

    /**
     * Build an if/else statement.
     *
     * @param condition  The condition.
     * @param thenBranch The statements run when the condition holds.
     * @param elseBranch The statements run otherwise.
     * @param origin     The instruction that decides the branch, if any.
     * @param mergeNode  The node both arms continue to, if known.
     * @return The statement.
     */
    public BranchStmt branch(
            Expr condition,
            BlockStmt thenBranch,
            BlockStmt elseBranch,
            @Nullable Instruction origin,
            @Nullable NodeId mergeNode
    ) {
        return new BranchStmt(newId(origin), condition, thenBranch, elseBranch, mergeNode);
    }

    public LoopStmt loop(BlockStmt body, @Nullable NodeId mergeNode, @Nullable NodeId continueNode) {
        return new LoopStmt(newId(null), body, mergeNode, continueNode);
    }

    public SwitchStmt switchStmt(
            Expr selector,
            List<SwitchCase> cases,
            @Nullable Instruction origin,
            @Nullable NodeId mergeNode
    ) {
        return new SwitchStmt(newId(origin), selector, new ArrayList<>(cases), mergeNode);
    }

    public SwitchCase switchCase(List<Label> labels, BlockStmt body) {
        return new SwitchCase(new ArrayList<>(labels), body);
    }

    /**
     * Get the label of a node. Every call with the same node gives an equal label.
     *
     * @param node The node.
     * @return The label.
     */
    public StmtLabel label(NodeId node) {
        return labels.computeIfAbsent(node, $ -> new StmtLabel(labelPrefix + "_" + node, node));
    }

    public CaseLabel caseLabel(long value) {
        return new CaseLabel(new ConstantExpr(value));
    }

    public DefaultLabel defaultLabel() {
        return DefaultLabel.INSTANCE;
    }

    public GotoStmt gotoStmt(StmtLabel label, boolean wrapped) {
        return new GotoStmt(newId(null), label, wrapped);
    }

    public BreakStmt breakStmt() {
        return new BreakStmt(newId(null));
    }

    public ContinueStmt continueStmt() {
        return new ContinueStmt(newId(null));
    }

    public ReturnStmt returnStmt(@Nullable Expr value, @Nullable Instruction origin) {
        return new ReturnStmt(newId(origin), value);
    }
}
