package org.ovsm.generator;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.ovsm.ast.SourceSpan;
import org.ovsm.core.SourceLocation;
import org.ovsm.core.VCCategory;
import org.ovsm.core.VerificationCondition;
import org.ovsm.expressions.Formula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.*;

/**
 * 一次生成过程的可变状态，只在 {@link VCGenerator#generate} 的调用链内传递，不共享。
 * 包括假设栈、路径上的账户事实、CPI 嵌套深度、调用栈、lamport 变化和覆盖计数。
 * @author Ayalyt
 */
public final class AnalysisContext {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisContext.class);

    @Getter
    private final String sourceFile;
    private final List<VerificationCondition> vcs;
    private int vcCounter;

    // 假设栈。被后续赋值作废的假设替换为 TRUE，栈深度保持不变
    private final List<Formula> assumptions;
    @Getter
    private PathFacts facts;
    private SourceSpan currentSpan;

    @Getter
    private int cpiDepth;
    private final Deque<String> callStack;
    @Getter
    private final List<Pair<BigInteger, Formula>> lamportDeltas;
    @Getter
    private int tokenFlowCount;

    @Getter
    private int totalNodes;
    @Getter
    private int nodesWithVcs;
    @Getter
    private final List<Pair<String, String>> uncovered;

    public AnalysisContext(String sourceFile) {
        this.sourceFile = Objects.requireNonNull(sourceFile, "Source file cannot be null");
        this.vcs = new ArrayList<>();
        this.vcCounter = 0;
        this.assumptions = new ArrayList<>();
        this.facts = new PathFacts();
        this.currentSpan = null;
        this.cpiDepth = 0;
        this.callStack = new ArrayDeque<>();
        this.lamportDeltas = new ArrayList<>();
        this.tokenFlowCount = 0;
        this.totalNodes = 0;
        this.nodesWithVcs = 0;
        this.uncovered = new ArrayList<>();
    }

    // --- 验证条件 ---

    String nextId(String categoryName) {
        vcCounter++;
        return "vc_" + categoryName + "_" + vcCounter;
    }

    /**
     * 以当前假设快照和当前位置生成一条验证条件。
     */
    public VerificationCondition emit(VCCategory category, String description, Formula property, String tactic) {
        VerificationCondition vc = VerificationCondition.of(nextId(category.getDisplayName()), category,
                description, location(), property, snapshot(), tactic);
        vcs.add(vc);
        logger.debug("生成验证条件 {}: {}", vc.getId(), vc.getPropertyText());
        return vc;
    }

    public VerificationCondition emitCustom(String name, String description, Formula property, String tactic) {
        VerificationCondition vc = VerificationCondition.custom(
                nextId(VerificationCondition.displayName(VCCategory.CUSTOM, name)), name,
                description, location(), property, snapshot(), tactic);
        vcs.add(vc);
        logger.debug("生成验证条件 {}: {}", vc.getId(), vc.getPropertyText());
        return vc;
    }

    public List<VerificationCondition> getVcs() {
        return Collections.unmodifiableList(vcs);
    }

    public int vcCount() {
        return vcs.size();
    }

    // --- 假设栈 ---

    public void pushAssumption(Formula assumption) {
        assumptions.add(Objects.requireNonNull(assumption, "Assumption cannot be null"));
    }

    public void popAssumption() {
        if (assumptions.isEmpty()) {
            logger.error("假设栈为空，无法弹出");
            throw new IllegalStateException("Assumption stack is empty");
        }
        assumptions.remove(assumptions.size() - 1);
    }

    /**
     * 当前假设栈深度，配合 {@link #restore(int)} 实现块作用域。
     */
    public int mark() {
        return assumptions.size();
    }

    /**
     * 丢弃 mark 之后压入的所有假设 (guard、assume 留下的事实在块结束时失效)。
     */
    public void restore(int mark) {
        if (mark > assumptions.size()) {
            logger.error("假设栈深度 {} 小于恢复点 {}", assumptions.size(), mark);
            throw new IllegalStateException("Assumption stack shrank below mark " + mark);
        }
        while (assumptions.size() > mark) {
            assumptions.remove(assumptions.size() - 1);
        }
    }

    /**
     * 变量被重新赋值后，提及它的假设不再成立。
     */
    public void invalidate(String variable) {
        for (int i = 0; i < assumptions.size(); i++) {
            if (assumptions.get(i).mentionsVariable(variable)) {
                logger.debug("赋值 {} 使假设 {} 失效", variable, assumptions.get(i));
                assumptions.set(i, Formula.TRUE);
            }
        }
    }

    public List<Formula> snapshot() {
        return assumptions.stream().filter(a -> !a.isTriviallyTrue()).toList();
    }

    // --- 路径事实 ---

    /**
     * 进入分支：返回分支开始前的事实，分支内在副本上修改。
     */
    public PathFacts forkFacts() {
        PathFacts saved = facts;
        facts = facts.copy();
        return saved;
    }

    public void setFacts(PathFacts facts) {
        this.facts = Objects.requireNonNull(facts, "Path facts cannot be null");
    }

    // --- 位置 ---

    public SourceSpan enterSpan(SourceSpan span) {
        SourceSpan previous = currentSpan;
        if (span != null) {
            currentSpan = span;
        }
        return previous;
    }

    public void leaveSpan(SourceSpan previous) {
        currentSpan = previous;
    }

    public SourceLocation location() {
        SourceSpan span = currentSpan == null ? SourceSpan.START : currentSpan;
        return SourceLocation.of(sourceFile, span.getLine(), span.getColumn());
    }

    // --- CPI、调用栈、资金流 ---

    public int enterCpi() {
        return ++cpiDepth;
    }

    public void exitCpi() {
        cpiDepth--;
    }

    public boolean isOnCallStack(String function) {
        return callStack.contains(function);
    }

    public void pushCall(String function) {
        callStack.push(function);
    }

    public void popCall() {
        callStack.pop();
    }

    public void recordLamportDelta(BigInteger account, Formula newBalance) {
        lamportDeltas.add(Pair.of(account, newBalance));
    }

    public int recordTokenFlow() {
        return ++tokenFlowCount;
    }

    // --- 覆盖计数 ---

    public void countNode() {
        totalNodes++;
    }

    public void countCovered() {
        nodesWithVcs++;
    }

    public void recordUncovered(String operation, String reason) {
        uncovered.add(Pair.of(operation, reason));
    }
}
