package org.ovsm.expressions;

import org.ovsm.ast.BinaryOp;
import org.ovsm.ast.Expression;
import org.ovsm.ast.UnaryOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * 将源语言表达式翻译为 {@link Formula}。无法表示的节点翻译为 {@link Formula#OPAQUE}。
 */
public final class ExpressionTranslator {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionTranslator.class);

    /**
     * 在一次交易内取值固定的无参查询，翻译为同名变量 (连字符换成下划线)。
     */
    private static final Set<String> STABLE_QUERIES = Set.of(
            "instruction-data-len", "num-accounts", "program-id");

    private ExpressionTranslator() {
    }

    public static Formula translate(Expression expr) {
        if (expr instanceof Expression.IntLiteral lit) {
            return Formula.constant(lit.getValue());
        }
        if (expr instanceof Expression.BoolLiteral lit) {
            return Formula.bool(lit.isValue());
        }
        if (expr instanceof Expression.StringLiteral lit) {
            return Formula.str(lit.getValue());
        }
        if (expr instanceof Expression.NullLiteral) {
            return Formula.NONE;
        }
        if (expr instanceof Expression.Variable v) {
            return Formula.var(v.getName());
        }
        if (expr instanceof Expression.Grouping g) {
            return translate(g.getInner());
        }
        if (expr instanceof Expression.TypeAnnotation ann) {
            return translate(ann.getExpr());
        }
        if (expr instanceof Expression.Binary bin) {
            return translateBinary(bin.getOp(), translate(bin.getLeft()), translate(bin.getRight()));
        }
        if (expr instanceof Expression.Unary un) {
            Formula operand = translate(un.getOperand());
            if (un.getOp() == UnaryOp.NOT) {
                return Formula.not(operand);
            }
            return operand.getKind() == Formula.Kind.INT
                    ? Formula.constant(operand.getValue().negate())
                    : Formula.neg(operand);
        }
        if (expr instanceof Expression.ToolCall call) {
            return translateCall(call);
        }
        if (expr instanceof Expression.IndexAccess access) {
            return Formula.index(translate(access.getArray()), translate(access.getIndex()));
        }
        if (expr instanceof Expression.FieldAccess access) {
            return Formula.field(translate(access.getObject()), access.getField());
        }
        logger.debug("ExpressionTranslator: {} 无法表示为公式，使用占位符", expr.getClass().getSimpleName());
        return Formula.OPAQUE;
    }

    /**
     * 把条件表达式翻译为布尔公式。
     */
    public static Formula translateCondition(Expression expr) {
        return translate(expr);
    }

    private static Formula translateBinary(BinaryOp op, Formula left, Formula right) {
        if (op.isArithmetic()) {
            return Formula.arith(op.toArithOp(), left, right);
        }
        if (op.isComparison()) {
            return Formula.compare(left, op.toRelation(), right);
        }
        return switch (op) {
            case AND -> Formula.and(left, right);
            case OR -> Formula.or(left, right);
            case IN -> Formula.pred("mem", left, right);
            default -> throw new IllegalStateException("Unhandled binary operator: " + op);
        };
    }

    /**
     * 运算符形式的工具调用 (例如 (>= a b)) 与 Binary 节点等价处理。
     */
    private static Formula translateCall(Expression.ToolCall call) {
        String name = call.getName();
        if (call.arity() == 0 && STABLE_QUERIES.contains(name)) {
            return Formula.var(name.replace('-', '_'));
        }
        List<Formula> args = call.getArgs().stream().map(a -> translate(a.getValue())).toList();
        if (args.size() == 2) {
            BinaryOp op = operatorFor(name);
            if (op != null) {
                return translateBinary(op, args.get(0), args.get(1));
            }
        }
        if (args.size() == 1 && "not".equals(name)) {
            return Formula.not(args.get(0));
        }
        return Formula.app(name, args);
    }

    private static BinaryOp operatorFor(String name) {
        return switch (name) {
            case "+" -> BinaryOp.ADD;
            case "-" -> BinaryOp.SUB;
            case "*" -> BinaryOp.MUL;
            case "/" -> BinaryOp.DIV;
            case "%", "mod" -> BinaryOp.MOD;
            case "<" -> BinaryOp.LT;
            case ">" -> BinaryOp.GT;
            case "<=" -> BinaryOp.LT_EQ;
            case ">=" -> BinaryOp.GT_EQ;
            case "=", "==" -> BinaryOp.EQ;
            case "!=", "/=" -> BinaryOp.NOT_EQ;
            case "and" -> BinaryOp.AND;
            case "or" -> BinaryOp.OR;
            default -> null;
        };
    }
}
