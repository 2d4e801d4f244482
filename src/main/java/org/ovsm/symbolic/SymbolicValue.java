package org.ovsm.symbolic;

import lombok.Getter;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 证明器环境中变量的抽象值：常量、闭区间、带约束的符号或未知。
 * 数值一律使用 BigInteger，推理过程本身不会溢出。
 * @author Ayalyt
 */
@Getter
public final class SymbolicValue {

    public enum Kind {
        CONSTANT,
        RANGE,
        SYMBOL,
        UNKNOWN
    }

    public static final SymbolicValue UNKNOWN = new SymbolicValue(Kind.UNKNOWN, null, null, null, List.of());

    private final Kind kind;
    // CONSTANT 时 lo == hi；RANGE 时为 null 表示无界
    private final BigInteger lo;
    private final BigInteger hi;
    private final String name;
    private final List<Constraint> constraints;

    private final int hashCode;

    private SymbolicValue(Kind kind, BigInteger lo, BigInteger hi, String name, List<Constraint> constraints) {
        this.kind = kind;
        this.lo = lo;
        this.hi = hi;
        this.name = name;
        this.constraints = List.copyOf(constraints);
        this.hashCode = Objects.hash(kind, lo, hi, name, this.constraints);
    }

    public static SymbolicValue constant(BigInteger value) {
        Objects.requireNonNull(value, "Constant cannot be null");
        return new SymbolicValue(Kind.CONSTANT, value, value, null, List.of());
    }

    public static SymbolicValue constant(long value) {
        return constant(BigInteger.valueOf(value));
    }

    /**
     * 工厂方法：闭区间 [lo, hi]，任一端为 null 表示该方向无界。
     * 上下界重合时退化为常量。
     */
    public static SymbolicValue range(BigInteger lo, BigInteger hi) {
        if (lo != null && hi != null) {
            if (lo.compareTo(hi) > 0) {
                throw new IllegalArgumentException("Empty range [" + lo + ", " + hi + "]");
            }
            if (lo.equals(hi)) {
                return constant(lo);
            }
        }
        return new SymbolicValue(Kind.RANGE, lo, hi, null, List.of());
    }

    public static SymbolicValue range(long lo, long hi) {
        return range(BigInteger.valueOf(lo), BigInteger.valueOf(hi));
    }

    public static SymbolicValue symbol(String name, List<Constraint> constraints) {
        Objects.requireNonNull(name, "Symbol name cannot be null");
        return new SymbolicValue(Kind.SYMBOL, null, null, name, constraints);
    }

    public static SymbolicValue symbol(String name) {
        return symbol(name, List.of());
    }

    public boolean isConstant() {
        return kind == Kind.CONSTANT;
    }

    public Optional<BigInteger> asConstant() {
        return kind == Kind.CONSTANT ? Optional.of(lo) : Optional.empty();
    }

    /**
     * 已知的下界 (含)。
     */
    public Optional<BigInteger> lowerBound() {
        return switch (kind) {
            case CONSTANT, RANGE -> Optional.ofNullable(lo);
            case SYMBOL -> constraints.stream()
                    .filter(c -> c.getKind() == Constraint.Kind.LOWER_BOUND)
                    .map(Constraint::getBound)
                    .max(BigInteger::compareTo);
            case UNKNOWN -> Optional.empty();
        };
    }

    /**
     * 已知的上界 (含)。
     */
    public Optional<BigInteger> upperBound() {
        return switch (kind) {
            case CONSTANT, RANGE -> Optional.ofNullable(hi);
            case SYMBOL -> constraints.stream()
                    .filter(c -> c.getKind() == Constraint.Kind.UPPER_BOUND)
                    .map(Constraint::getBound)
                    .min(BigInteger::compareTo);
            case UNKNOWN -> Optional.empty();
        };
    }

    /**
     * 值是否一定不为零。
     */
    public boolean excludesZero() {
        if (kind == Kind.SYMBOL && constraints.stream().anyMatch(c -> c.getKind() == Constraint.Kind.NON_ZERO)) {
            return true;
        }
        Optional<BigInteger> low = lowerBound();
        if (low.isPresent() && low.get().signum() > 0) {
            return true;
        }
        Optional<BigInteger> high = upperBound();
        return high.isPresent() && high.get().signum() < 0;
    }

    public boolean isNonNegative() {
        return lowerBound().map(v -> v.signum() >= 0).orElse(false);
    }

    /**
     * 值是否一定 ≥ other。
     */
    public boolean isDefinitelyGeq(SymbolicValue other) {
        Optional<BigInteger> low = lowerBound();
        Optional<BigInteger> otherHigh = other.upperBound();
        if (low.isPresent() && otherHigh.isPresent() && low.get().compareTo(otherHigh.get()) >= 0) {
            return true;
        }
        return kind == Kind.SYMBOL && other.kind == Kind.SYMBOL
                && constraints.contains(Constraint.geqVar(other.name));
    }

    /**
     * 返回附加了约束的新符号值。非符号值原样返回，约束已存在时也原样返回。
     */
    public SymbolicValue withConstraint(Constraint constraint) {
        if (kind != Kind.SYMBOL || constraints.contains(constraint)) {
            return this;
        }
        List<Constraint> extended = new ArrayList<>(constraints);
        extended.add(constraint);
        return symbol(name, extended);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SymbolicValue that)) {
            return false;
        }
        return kind == that.kind && Objects.equals(lo, that.lo) && Objects.equals(hi, that.hi)
                && Objects.equals(name, that.name) && constraints.equals(that.constraints);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case CONSTANT -> lo.toString();
            case RANGE -> "[" + (lo == null ? "-∞" : lo) + ", " + (hi == null ? "∞" : hi) + "]";
            case SYMBOL -> constraints.isEmpty() ? name : name + " " + constraints;
            case UNKNOWN -> "?";
        };
    }
}
