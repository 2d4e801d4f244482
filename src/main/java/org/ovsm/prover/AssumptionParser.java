package org.ovsm.prover;

import org.ovsm.expressions.Formula;
import org.ovsm.expressions.RelationType;
import org.ovsm.symbolic.PathCondition;
import org.ovsm.symbolic.PathConstraint;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 把验证条件携带的假设解析成路径条件，压入证明器环境的私有副本。
 * 只识别 "项 比较 常量" 与 "项 比较 项" 两种形状，其余假设留给证据匹配和 SMT 复核。
 */
final class AssumptionParser {

    private AssumptionParser() {
    }

    static List<PathCondition> parse(Formula assumption) {
        List<PathCondition> result = new ArrayList<>();
        collect(assumption, false, result);
        return result;
    }

    static List<PathCondition> parseAll(List<Formula> assumptions) {
        List<PathCondition> result = new ArrayList<>();
        for (Formula assumption : assumptions) {
            collect(assumption, false, result);
        }
        return result;
    }

    /**
     * 路径条件中使用的键：变量用变量名，其余非字面量项用其渲染文本，字面量没有键。
     */
    static String key(Formula term) {
        if (term.isVariable()) {
            return term.getName();
        }
        if (term.isLiteral()) {
            return null;
        }
        return term.render();
    }

    private static void collect(Formula formula, boolean negated, List<PathCondition> out) {
        switch (formula.getKind()) {
            case AND -> {
                // ¬(a ∧ b) 不给出任何单独成立的事实
                if (!negated) {
                    formula.getArgs().forEach(arg -> collect(arg, false, out));
                }
            }
            case OR -> {
                // ¬(a ∨ b) ≡ ¬a ∧ ¬b
                if (negated) {
                    formula.getArgs().forEach(arg -> collect(arg, true, out));
                }
            }
            case NOT -> collect(formula.getArgs().get(0), !negated, out);
            case CMP -> comparison(formula.left(),
                    negated ? formula.getRelation().negate() : formula.getRelation(),
                    formula.right(), out);
            default -> {
            }
        }
    }

    private static void comparison(Formula left, RelationType relation, Formula right, List<PathCondition> out) {
        Optional<BigInteger> leftValue = left.asInteger();
        Optional<BigInteger> rightValue = right.asInteger();
        if (leftValue.isPresent() && rightValue.isPresent()) {
            return;
        }
        if (leftValue.isPresent()) {
            comparison(right, relation.flip(), left, out);
            return;
        }
        String leftKey = key(left);
        if (leftKey == null) {
            return;
        }
        if (rightValue.isPresent()) {
            againstConstant(leftKey, relation, rightValue.get(), out);
            return;
        }
        String rightKey = key(right);
        if (rightKey == null) {
            return;
        }
        switch (relation) {
            case GE -> out.add(PathCondition.of(leftKey, PathConstraint.geqVar(rightKey)));
            case GT -> {
                out.add(PathCondition.of(leftKey, PathConstraint.geqVar(rightKey)));
                out.add(PathCondition.of(rightKey, PathConstraint.ltVar(leftKey)));
            }
            case LT -> {
                out.add(PathCondition.of(leftKey, PathConstraint.ltVar(rightKey)));
                out.add(PathCondition.of(rightKey, PathConstraint.geqVar(leftKey)));
            }
            case LE -> out.add(PathCondition.of(rightKey, PathConstraint.geqVar(leftKey)));
            case EQ -> {
                out.add(PathCondition.of(leftKey, PathConstraint.geqVar(rightKey)));
                out.add(PathCondition.of(rightKey, PathConstraint.geqVar(leftKey)));
            }
            case NE -> {
            }
        }
    }

    private static void againstConstant(String key, RelationType relation, BigInteger k, List<PathCondition> out) {
        PathConstraint constraint = switch (relation) {
            case LT -> PathConstraint.lt(k);
            case LE -> PathConstraint.lt(k.add(BigInteger.ONE));
            case GT -> PathConstraint.geq(k.add(BigInteger.ONE));
            case GE -> PathConstraint.geq(k);
            case EQ -> PathConstraint.eq(k);
            case NE -> k.signum() == 0 ? PathConstraint.isNonZero() : PathConstraint.neq(k);
        };
        out.add(PathCondition.of(key, constraint));
    }
}
