package io.github.eutro.bin2ast.test;

import io.github.eutro.bin2ast.core.ast.Expr;
import io.github.eutro.bin2ast.core.ast.NamedExpr;
import io.github.eutro.bin2ast.core.cfg.Instruction;
import io.github.eutro.bin2ast.core.graph.NodeId;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;

public class TestInsn implements Instruction {
    enum Kind {
        OP,
        JUMP,
        BRANCH,
        SWITCH,
        RETURN,
        COND_RETURN,
        SHL1,
    }

    final long address;
    final Kind kind;
    final String mnemonic;
    String condition;
    @Nullable Object setter;
    @Nullable String code;
    boolean staticallyTrue;
    @Nullable Expr returnValue;
    final Map<NodeId, SortedSet<Long>> caseValues = new HashMap<>();

    TestInsn(long address, Kind kind, String mnemonic) {
        this.address = address;
        this.kind = kind;
        this.mnemonic = mnemonic;
        this.condition = "c" + Long.toHexString(address);
    }

    public static TestInsn op(long address) {
        return new TestInsn(address, Kind.OP, "op");
    }

    public static TestInsn jump(long address) {
        return new TestInsn(address, Kind.JUMP, "b");
    }

    public static TestInsn branch(long address) {
        return new TestInsn(address, Kind.BRANCH, "bcc");
    }

    public static TestInsn switchOn(long address) {
        TestInsn insn = new TestInsn(address, Kind.SWITCH, "br");
        insn.condition = "s" + Long.toHexString(address);
        return insn;
    }

    public static TestInsn ret(long address) {
        return new TestInsn(address, Kind.RETURN, "ret");
    }

    public static TestInsn condRet(long address) {
        return new TestInsn(address, Kind.COND_RETURN, "retcc");
    }

    public static TestInsn shl1(long address) {
        return new TestInsn(address, Kind.SHL1, "lsl");
    }

    /**
     * A plain instruction that only takes effect when the flags set by {@code setter} satisfy {@code code}.
     */
    public static TestInsn predicated(long address, Object setter, String code) {
        return op(address).on(setter, code);
    }

    /**
     * Predicate this instruction on the flags set by {@code setter}, under {@code code}.
     */
    public TestInsn on(Object setter, String code) {
        this.setter = setter;
        this.code = code;
        this.condition = setter + "_" + code;
        return this;
    }

    public TestInsn named(String condition) {
        this.condition = condition;
        return this;
    }

    public TestInsn alwaysTrue() {
        staticallyTrue = true;
        return this;
    }

    public TestInsn returning(Expr value) {
        returnValue = value;
        return this;
    }

    public TestInsn cases(NodeId target, SortedSet<Long> values) {
        caseValues.put(target, values);
        return this;
    }

    @Override
    public long address() {
        return address;
    }

    @Override
    public int byteSize() {
        return 4;
    }

    @Override
    public String mnemonic() {
        return code == null ? mnemonic : mnemonic + code.toLowerCase();
    }

    @Override
    public String operandString() {
        return "0x" + Long.toHexString(address);
    }

    @Override
    public boolean hasControlFlow() {
        return setter != null;
    }

    @Override
    public @Nullable Object conditionSetter() {
        return setter;
    }

    @Override
    public @Nullable String conditionCode() {
        return code;
    }

    @Override
    public boolean isBranchInstruction() {
        return kind == Kind.JUMP || kind == Kind.BRANCH || kind == Kind.SWITCH;
    }

    @Override
    public boolean isCallInstruction() {
        return false;
    }

    @Override
    public boolean isReturnInstruction() {
        return kind == Kind.RETURN || kind == Kind.COND_RETURN;
    }

    @Override
    public boolean isConditionalReturnInstruction() {
        return kind == Kind.COND_RETURN;
    }

    @Override
    public boolean hasStaticallyTrueCondition() {
        return staticallyTrue;
    }

    @Override
    public boolean isShiftLeftByOne() {
        return kind == Kind.SHL1;
    }

    @Override
    public Expr condition(boolean reverse) {
        Expr expr = new NamedExpr(condition);
        return reverse ? expr.negate() : expr;
    }

    @Override
    public @Nullable Expr returnValue() {
        return returnValue;
    }

    @Override
    public @Nullable SortedSet<Long> caseValues(NodeId target) {
        return caseValues.get(target);
    }

    @Override
    public String toString() {
        return mnemonic() + " " + operandString();
    }
}
