package org.ovsm.symbolic;

import lombok.Getter;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 附加在符号值上的约束。
 */
@Getter
public final class Constraint {

    public enum Kind {
        NON_ZERO,
        // x >= bound
        LOWER_BOUND,
        // x <= bound
        UPPER_BOUND,
        // x >= other
        GEQ_VAR,
        // x < other
        LT_VAR
    }

    private final Kind kind;
    private final BigInteger bound;
    private final String other;

    private final int hashCode;

    private Constraint(Kind kind, BigInteger bound, String other) {
        this.kind = kind;
        this.bound = bound;
        this.other = other;
        this.hashCode = Objects.hash(kind, bound, other);
    }

    public static Constraint nonZero() {
        return new Constraint(Kind.NON_ZERO, null, null);
    }

    public static Constraint lowerBound(BigInteger bound) {
        return new Constraint(Kind.LOWER_BOUND, Objects.requireNonNull(bound, "Bound cannot be null"), null);
    }

    public static Constraint upperBound(BigInteger bound) {
        return new Constraint(Kind.UPPER_BOUND, Objects.requireNonNull(bound, "Bound cannot be null"), null);
    }

    public static Constraint geqVar(String other) {
        return new Constraint(Kind.GEQ_VAR, null, Objects.requireNonNull(other, "Variable cannot be null"));
    }

    public static Constraint ltVar(String other) {
        return new Constraint(Kind.LT_VAR, null, Objects.requireNonNull(other, "Variable cannot be null"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Constraint that)) {
            return false;
        }
        return kind == that.kind && Objects.equals(bound, that.bound) && Objects.equals(other, that.other);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NON_ZERO -> "≠ 0";
            case LOWER_BOUND -> "≥ " + bound;
            case UPPER_BOUND -> "≤ " + bound;
            case GEQ_VAR -> "≥ " + other;
            case LT_VAR -> "< " + other;
        };
    }
}
