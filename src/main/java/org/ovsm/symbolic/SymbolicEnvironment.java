package org.ovsm.symbolic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.*;

/**
 * 证明器的符号环境：变量到抽象值的映射、数组大小表和路径条件栈。
 * 压入路径条件时会顺带收紧对应变量的抽象值，弹出时恢复压入前的值。
 * 每次证明都在 {@link #copy()} 出的私有副本上进行。
 * @author Ayalyt
 */
public final class SymbolicEnvironment {

    private static final Logger logger = LoggerFactory.getLogger(SymbolicEnvironment.class);

    private final Map<String, SymbolicValue> values;
    private final Map<String, BigInteger> arraySizes;
    private final Deque<Frame> pathConditions;

    /**
     * 路径条件栈帧：条件本身以及压入前变量的抽象值 (未定义时为 null)。
     */
    private static final class Frame {
        private final PathCondition condition;
        private final SymbolicValue previous;

        private Frame(PathCondition condition, SymbolicValue previous) {
            this.condition = condition;
            this.previous = previous;
        }
    }

    public SymbolicEnvironment() {
        this.values = new HashMap<>();
        this.arraySizes = new HashMap<>();
        this.pathConditions = new ArrayDeque<>();
    }

    private SymbolicEnvironment(SymbolicEnvironment other) {
        this.values = new HashMap<>(other.values);
        this.arraySizes = new HashMap<>(other.arraySizes);
        this.pathConditions = new ArrayDeque<>(other.pathConditions);
    }

    public SymbolicEnvironment copy() {
        return new SymbolicEnvironment(this);
    }

    public void define(String variable, SymbolicValue value) {
        Objects.requireNonNull(variable, "Variable cannot be null");
        Objects.requireNonNull(value, "Symbolic value cannot be null");
        values.put(variable, value);
    }

    public void defineArray(String array, BigInteger size) {
        Objects.requireNonNull(array, "Array name cannot be null");
        if (size == null || size.signum() < 0) {
            throw new IllegalArgumentException("Array size must be non-negative: " + size);
        }
        arraySizes.put(array, size);
    }

    public void defineArray(String array, long size) {
        defineArray(array, BigInteger.valueOf(size));
    }

    public SymbolicValue lookup(String variable) {
        return values.getOrDefault(variable, SymbolicValue.UNKNOWN);
    }

    public Optional<BigInteger> arraySize(String array) {
        return Optional.ofNullable(arraySizes.get(array));
    }

    public Map<String, BigInteger> getArraySizes() {
        return Collections.unmodifiableMap(arraySizes);
    }

    public Map<String, SymbolicValue> getValues() {
        return Collections.unmodifiableMap(values);
    }

    // --- 路径条件 ---

    public void pushPathCondition(PathCondition condition) {
        Objects.requireNonNull(condition, "Path condition cannot be null");
        String variable = condition.getVariable();
        pathConditions.push(new Frame(condition, values.get(variable)));
        SymbolicValue refined = refine(lookup(variable), condition.getConstraint());
        if (refined != SymbolicValue.UNKNOWN) {
            values.put(variable, refined);
        }
        logger.debug("压入路径条件: {}，{} 收紧为 {}", condition, variable, refined);
    }

    public PathCondition popPathCondition() {
        if (pathConditions.isEmpty()) {
            logger.error("路径条件栈为空，无法弹出");
            throw new IllegalStateException("Path condition stack is empty");
        }
        Frame frame = pathConditions.pop();
        String variable = frame.condition.getVariable();
        if (frame.previous == null) {
            values.remove(variable);
        } else {
            values.put(variable, frame.previous);
        }
        return frame.condition;
    }

    /**
     * 当前有效的路径条件，按压入顺序排列。
     */
    public List<PathCondition> getPathConditions() {
        List<PathCondition> result = new ArrayList<>();
        Iterator<Frame> it = pathConditions.descendingIterator();
        while (it.hasNext()) {
            result.add(it.next().condition);
        }
        return result;
    }

    public List<PathConstraint> constraintsOn(String variable) {
        List<PathConstraint> result = new ArrayList<>();
        for (Frame frame : pathConditions) {
            if (frame.condition.getVariable().equals(variable)) {
                result.add(frame.condition.getConstraint());
            }
        }
        return result;
    }

    private static SymbolicValue refine(SymbolicValue current, PathConstraint constraint) {
        BigInteger k = constraint.getValue();
        switch (current.getKind()) {
            case SYMBOL -> {
                return switch (constraint.getKind()) {
                    case IS_NON_ZERO -> current.withConstraint(Constraint.nonZero());
                    case GEQ -> current.withConstraint(Constraint.lowerBound(k));
                    case LT -> current.withConstraint(Constraint.upperBound(k.subtract(BigInteger.ONE)));
                    case EQ -> SymbolicValue.constant(k);
                    case GEQ_VAR -> current.withConstraint(Constraint.geqVar(constraint.getOther()));
                    case LT_VAR -> current.withConstraint(Constraint.ltVar(constraint.getOther()));
                    case NEQ -> k.signum() == 0 ? current.withConstraint(Constraint.nonZero()) : current;
                };
            }
            case RANGE -> {
                BigInteger lo = current.getLo();
                BigInteger hi = current.getHi();
                switch (constraint.getKind()) {
                    case GEQ -> lo = lo == null ? k : lo.max(k);
                    case LT -> hi = hi == null ? k.subtract(BigInteger.ONE) : hi.min(k.subtract(BigInteger.ONE));
                    case EQ -> {
                        lo = k;
                        hi = k;
                    }
                    default -> {
                        return current;
                    }
                }
                if (lo != null && hi != null && lo.compareTo(hi) > 0) {
                    // 路径不可行，保留原值
                    return current;
                }
                return SymbolicValue.range(lo, hi);
            }
            case UNKNOWN -> {
                return constraint.getKind() == PathConstraint.Kind.EQ ? SymbolicValue.constant(k) : current;
            }
            default -> {
                return current;
            }
        }
    }

    // --- 组合查询：环境值与路径条件一起考虑 ---

    public boolean isNonZero(String variable) {
        if (lookup(variable).excludesZero()) {
            return true;
        }
        return constraintsOn(variable).stream().anyMatch(PathConstraint::impliesNonZero);
    }

    /**
     * 变量已知的下界 (含)。
     */
    public Optional<BigInteger> lowerBound(String variable) {
        BigInteger best = lookup(variable).lowerBound().orElse(null);
        for (PathConstraint c : constraintsOn(variable)) {
            BigInteger candidate = switch (c.getKind()) {
                case GEQ, EQ -> c.getValue();
                default -> null;
            };
            if (candidate != null && (best == null || candidate.compareTo(best) > 0)) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * 变量已知的上界 (含)。
     */
    public Optional<BigInteger> upperBound(String variable) {
        BigInteger best = lookup(variable).upperBound().orElse(null);
        for (PathConstraint c : constraintsOn(variable)) {
            BigInteger candidate = switch (c.getKind()) {
                case LT -> c.getValue().subtract(BigInteger.ONE);
                case EQ -> c.getValue();
                default -> null;
            };
            if (candidate != null && (best == null || candidate.compareTo(best) < 0)) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * 是否可以确定 variable ≥ other。
     */
    public boolean isGeq(String variable, String other) {
        if (constraintsOn(variable).contains(PathConstraint.geqVar(other))) {
            return true;
        }
        if (lookup(variable).isDefinitelyGeq(lookup(other))) {
            return true;
        }
        Optional<BigInteger> low = lowerBound(variable);
        Optional<BigInteger> high = upperBound(other);
        return low.isPresent() && high.isPresent() && low.get().compareTo(high.get()) >= 0;
    }

    /**
     * 是否可以确定 variable < other。
     */
    public boolean isLt(String variable, String other) {
        if (constraintsOn(variable).contains(PathConstraint.ltVar(other))) {
            return true;
        }
        Optional<BigInteger> high = upperBound(variable);
        Optional<BigInteger> low = lowerBound(other);
        return high.isPresent() && low.isPresent() && high.get().compareTo(low.get()) < 0;
    }

    @Override
    public String toString() {
        return "SymbolicEnvironment{values=" + values + ", arrays=" + arraySizes
                + ", path=" + getPathConditions() + "}";
    }
}
