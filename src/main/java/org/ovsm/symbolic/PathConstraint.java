package org.ovsm.symbolic;

import lombok.Getter;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 路径条件中对单个变量的约束。
 */
@Getter
public final class PathConstraint {

    public enum Kind {
        IS_NON_ZERO,
        GEQ,
        LT,
        EQ,
        NEQ,
        GEQ_VAR,
        LT_VAR
    }

    private final Kind kind;
    private final BigInteger value;
    private final String other;

    private final int hashCode;

    private PathConstraint(Kind kind, BigInteger value, String other) {
        this.kind = kind;
        this.value = value;
        this.other = other;
        this.hashCode = Objects.hash(kind, value, other);
    }

    public static PathConstraint isNonZero() {
        return new PathConstraint(Kind.IS_NON_ZERO, null, null);
    }

    public static PathConstraint geq(BigInteger k) {
        return new PathConstraint(Kind.GEQ, Objects.requireNonNull(k, "Bound cannot be null"), null);
    }

    public static PathConstraint geq(long k) {
        return geq(BigInteger.valueOf(k));
    }

    public static PathConstraint lt(BigInteger k) {
        return new PathConstraint(Kind.LT, Objects.requireNonNull(k, "Bound cannot be null"), null);
    }

    public static PathConstraint lt(long k) {
        return lt(BigInteger.valueOf(k));
    }

    public static PathConstraint eq(BigInteger k) {
        return new PathConstraint(Kind.EQ, Objects.requireNonNull(k, "Value cannot be null"), null);
    }

    public static PathConstraint neq(BigInteger k) {
        return new PathConstraint(Kind.NEQ, Objects.requireNonNull(k, "Value cannot be null"), null);
    }

    public static PathConstraint geqVar(String other) {
        return new PathConstraint(Kind.GEQ_VAR, null, Objects.requireNonNull(other, "Variable cannot be null"));
    }

    public static PathConstraint ltVar(String other) {
        return new PathConstraint(Kind.LT_VAR, null, Objects.requireNonNull(other, "Variable cannot be null"));
    }

    /**
     * 此约束是否蕴含变量不为零。
     */
    public boolean impliesNonZero() {
        return switch (kind) {
            case IS_NON_ZERO -> true;
            case GEQ -> value.signum() > 0;
            case LT -> value.signum() <= 0;
            case EQ -> value.signum() != 0;
            case NEQ -> value.signum() == 0;
            default -> false;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PathConstraint that)) {
            return false;
        }
        return kind == that.kind && Objects.equals(value, that.value) && Objects.equals(other, that.other);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case IS_NON_ZERO -> "≠ 0";
            case GEQ -> "≥ " + value;
            case LT -> "< " + value;
            case EQ -> "= " + value;
            case NEQ -> "≠ " + value;
            case GEQ_VAR -> "≥ " + other;
            case LT_VAR -> "< " + other;
        };
    }
}
