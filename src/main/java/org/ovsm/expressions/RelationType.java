package org.ovsm.expressions;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

public enum RelationType {

    /**
     * 比较运算符枚举。symbol 为源语言写法，leanSymbol 为导出证明脚本时的写法。
     */
    LT("<", "<"),    // Less Than
    LE("<=", "≤"),   // Less Equal
    GT(">", ">"),    // Greater Than
    GE(">=", "≥"),   // Greater Equal
    EQ("=", "="),    // Equal
    NE("!=", "≠");   // Not Equal

    private final String symbol;
    private final String leanSymbol;

    RelationType(String symbol, String leanSymbol) {
        this.symbol = symbol;
        this.leanSymbol = leanSymbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getLeanSymbol() {
        return leanSymbol;
    }

    private static final Logger logger = LoggerFactory.getLogger(RelationType.class);

    /**
     * 返回此关系类型的否定关系。
     * 例如：LT 的否定是 GE。
     */
    public RelationType negate() {
        return switch (this) {
            case LT -> GE;
            case LE -> GT;
            case GT -> LE;
            case GE -> LT;
            case EQ -> NE;
            case NE -> EQ;
        };
    }

    /**
     * 返回交换左右操作数后的等价关系。
     * 例如：(a < b) -> (b > a)。
     */
    public RelationType flip() {
        return switch (this) {
            case LT -> GT;
            case LE -> GE;
            case GT -> LT;
            case GE -> LE;
            case EQ -> EQ;
            case NE -> NE;
        };
    }

    /**
     * 在两个确定整数上求值此关系。
     */
    public boolean test(BigInteger left, BigInteger right) {
        int cmp = left.compareTo(right);
        return switch (this) {
            case LT -> cmp < 0;
            case LE -> cmp <= 0;
            case GT -> cmp > 0;
            case GE -> cmp >= 0;
            case EQ -> cmp == 0;
            case NE -> cmp != 0;
        };
    }

    /**
     * 构造对应的 Z3 比较表达式。
     */
    public BoolExpr toZ3(Context ctx, ArithExpr left, ArithExpr right) {
        return switch (this) {
            case LT -> ctx.mkLt(left, right);
            case LE -> ctx.mkLe(left, right);
            case GT -> ctx.mkGt(left, right);
            case GE -> ctx.mkGe(left, right);
            case EQ -> ctx.mkEq(left, right);
            case NE -> ctx.mkNot(ctx.mkEq(left, right));
        };
    }

    /**
     * 从源语言或导出写法解析关系类型，支持 "==", "≠", "≤", "≥" 等变体。
     * @param text 运算符文本。
     * @return 对应的关系类型。
     * @throws IllegalArgumentException 如果不是比较运算符。
     */
    public static RelationType fromSymbol(String text) {
        return switch (text) {
            case "<" -> LT;
            case "<=", "≤" -> LE;
            case ">" -> GT;
            case ">=", "≥" -> GE;
            case "=", "==" -> EQ;
            case "!=", "≠", "/=" -> NE;
            default -> {
                logger.error("RelationType.fromSymbol: 未知比较运算符 {}", text);
                throw new IllegalArgumentException("Unknown relation symbol: " + text);
            }
        };
    }
}
