package org.ovsm.prover;

import org.ovsm.expressions.Formula;
import org.ovsm.expressions.RelationType;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 假设中确定成立的事实，供协议类别的证据匹配使用。
 * 只收集正面事实 (展开合取、消去双重否定)，否定、析取和蕴含中的内容不算证据：
 * 例如假设 ¬(account-is-signer 0) 不能证明账户 0 是签名者。
 * 与布尔字面量比较得出为假的检查 (例如 (is-some v) = false) 同样是否定：
 * 它只能原样匹配目标，不能作为关键字或检查调用的证据。
 */
final class AssumptionEvidence {

    private final List<Formula> facts;
    private final List<Formula> checks;

    AssumptionEvidence(List<Formula> assumptions) {
        List<Formula> collected = new ArrayList<>();
        List<Formula> passed = new ArrayList<>();
        for (Formula assumption : assumptions) {
            for (Formula fact : assumption.positiveConjuncts()) {
                collected.add(fact);
                if (!fact.isFalseComparison()) {
                    passed.add(fact);
                }
            }
        }
        this.facts = List.copyOf(collected);
        this.checks = List.copyOf(passed);
    }

    /**
     * 加入额外前提 (例如循环不变式蕴含式的前件) 后的新证据集。
     */
    AssumptionEvidence with(List<Formula> premises) {
        List<Formula> all = new ArrayList<>(facts);
        all.addAll(premises);
        return new AssumptionEvidence(all);
    }

    List<Formula> getFacts() {
        return facts;
    }

    boolean isEmpty() {
        return facts.isEmpty();
    }

    /**
     * goal 本身 (或交换左右后的等价比较) 是否是已知事实。
     */
    boolean holds(Formula goal) {
        for (Formula fact : facts) {
            if (fact.equals(goal)) {
                return true;
            }
            if (goal.getKind() == Formula.Kind.CMP && fact.getKind() == Formula.Kind.CMP
                    && fact.getRelation() == goal.getRelation().flip()
                    && fact.left().equals(goal.right()) && fact.right().equals(goal.left())) {
                return true;
            }
        }
        return false;
    }

    /**
     * 是否有事实中的标识符包含任一关键字。
     */
    boolean mentionsAny(String... keywords) {
        for (Formula fact : checks) {
            for (String keyword : keywords) {
                if (fact.mentions(keyword)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * 是否有事实是对账户 account 的某个检查调用，例如 (account-is-signer 0)。
     */
    boolean callsOn(BigInteger account, Set<String> calls) {
        for (Formula fact : checks) {
            if (isCallOn(fact, account, calls)) {
                return true;
            }
            // (= (account-is-signer 0) true)
            if (fact.getKind() == Formula.Kind.CMP && fact.getRelation() == RelationType.EQ
                    && ((isCallOn(fact.left(), account, calls) && fact.right().isTriviallyTrue())
                    || (isCallOn(fact.right(), account, calls) && fact.left().isTriviallyTrue()))) {
                return true;
            }
        }
        return false;
    }

    /**
     * 是否有事实是以 subject 为首个参数的检查调用或谓词，例如 (is-some x)。
     */
    boolean callsWith(Formula subject, Set<String> calls) {
        for (Formula fact : checks) {
            if ((fact.getKind() == Formula.Kind.APP || fact.getKind() == Formula.Kind.PRED)
                    && calls.contains(fact.getName())
                    && !fact.getArgs().isEmpty() && fact.getArgs().get(0).equals(subject)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 是否有事实给出 table[account] = value。
     */
    boolean tableEntry(String table, BigInteger account, Formula value) {
        Formula entry = Formula.index(Formula.var(table), Formula.constant(account));
        return holds(Formula.compare(entry, RelationType.EQ, value));
    }

    /**
     * 是否有事实给出 (call account) = value，例如 (account-owner 0) = program_id。
     */
    boolean queryEquals(String call, BigInteger account, Formula value) {
        Formula query = Formula.app(call, Formula.constant(account));
        return holds(Formula.compare(query, RelationType.EQ, value));
    }

    private static boolean isCallOn(Formula term, BigInteger account, Set<String> calls) {
        if (term.getKind() != Formula.Kind.APP || !calls.contains(term.getName()) || term.getArgs().isEmpty()) {
            return false;
        }
        return term.getArgs().get(0).asInteger().map(account::equals).orElse(false);
    }

    @Override
    public String toString() {
        return "AssumptionEvidence" + facts;
    }
}
