package org.ovsm.generator;

import org.ovsm.ast.Expression;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 按名字判断一个操作数是否与余额相关。命中时即使未开启严格算术检查，也生成溢出/下溢验证条件。
 */
public final class BalanceHeuristics {

    private static final List<String> BALANCE_NAME_PARTS = List.of(
            "bal", "lamport", "amount", "token", "fee", "stake", "reward",
            "price", "supply", "total", "sum", "volume", "earned", "spent", "count");

    private static final Set<String> BALANCE_CALLS = Set.of(
            "account-lamports", "get-balance", "mem-load", "spl-token-amount");

    private static final List<String> BALANCE_FIELD_PARTS = List.of(
            "lamport", "balance", "amount", "supply");

    private BalanceHeuristics() {
    }

    public static boolean isBalanceName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return BALANCE_NAME_PARTS.stream().anyMatch(lower::contains);
    }

    /**
     * 表达式是否 (递归地) 含有余额相关的变量、调用或字段。
     */
    public static boolean isBalanceExpression(Expression expr) {
        if (expr instanceof Expression.Variable v) {
            return isBalanceName(v.getName());
        }
        if (expr instanceof Expression.ToolCall call) {
            return BALANCE_CALLS.contains(call.getName());
        }
        if (expr instanceof Expression.FieldAccess access) {
            String field = access.getField().toLowerCase(Locale.ROOT);
            return BALANCE_FIELD_PARTS.stream().anyMatch(field::contains);
        }
        if (expr instanceof Expression.Binary bin) {
            return isBalanceExpression(bin.getLeft()) || isBalanceExpression(bin.getRight());
        }
        if (expr instanceof Expression.Grouping g) {
            return isBalanceExpression(g.getInner());
        }
        return false;
    }

    public static boolean isBalanceOperation(Expression left, Expression right) {
        return isBalanceExpression(left) || isBalanceExpression(right);
    }
}
