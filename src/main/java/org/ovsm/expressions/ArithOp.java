package org.ovsm.expressions;

import java.math.BigInteger;
import java.util.Optional;

/**
 * 算术运算符。所有求值都在任意精度整数上进行，推理过程本身不会溢出。
 */
public enum ArithOp {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    POW("^");

    private final String symbol;

    ArithOp(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 对两个常量求值。除数为零或指数不合法时返回空。
     */
    public Optional<BigInteger> apply(BigInteger left, BigInteger right) {
        return switch (this) {
            case ADD -> Optional.of(left.add(right));
            case SUB -> Optional.of(left.subtract(right));
            case MUL -> Optional.of(left.multiply(right));
            case DIV -> right.signum() == 0 ? Optional.empty() : Optional.of(left.divide(right));
            case MOD -> right.signum() == 0 ? Optional.empty() : Optional.of(left.mod(right.abs()));
            case POW -> right.signum() < 0 || right.bitLength() > 31
                    ? Optional.empty()
                    : Optional.of(left.pow(right.intValue()));
        };
    }
}
