package org.ovsm.ast;

import lombok.Getter;
import org.ovsm.expressions.ArithOp;
import org.ovsm.expressions.RelationType;

/**
 * 源语言中的二元运算符。
 */
@Getter
public enum BinaryOp {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    POW("^"),
    EQ("="),
    NOT_EQ("≠"),
    LT("<"),
    GT(">"),
    LT_EQ("≤"),
    GT_EQ("≥"),
    AND("∧"),
    OR("∨"),
    IN("∈");

    private final String symbol;

    BinaryOp(String symbol) {
        this.symbol = symbol;
    }

    public boolean isArithmetic() {
        return toArithOp() != null;
    }

    public boolean isComparison() {
        return toRelation() != null;
    }

    /**
     * @return 对应的算术运算，非算术运算符返回 null
     */
    public ArithOp toArithOp() {
        return switch (this) {
            case ADD -> ArithOp.ADD;
            case SUB -> ArithOp.SUB;
            case MUL -> ArithOp.MUL;
            case DIV -> ArithOp.DIV;
            case MOD -> ArithOp.MOD;
            case POW -> ArithOp.POW;
            default -> null;
        };
    }

    /**
     * @return 对应的比较关系，非比较运算符返回 null
     */
    public RelationType toRelation() {
        return switch (this) {
            case EQ -> RelationType.EQ;
            case NOT_EQ -> RelationType.NE;
            case LT -> RelationType.LT;
            case GT -> RelationType.GT;
            case LT_EQ -> RelationType.LE;
            case GT_EQ -> RelationType.GE;
            default -> null;
        };
    }
}
