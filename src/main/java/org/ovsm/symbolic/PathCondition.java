package org.ovsm.symbolic;

import lombok.Getter;

import java.util.Objects;

/**
 * 当前分支上成立的一条事实：(变量, 约束)。变量以其公式渲染形式为键，例如 x 或 arr.size。
 */
@Getter
public final class PathCondition {

    private final String variable;
    private final PathConstraint constraint;

    private final int hashCode;

    private PathCondition(String variable, PathConstraint constraint) {
        this.variable = Objects.requireNonNull(variable, "Path condition variable cannot be null");
        this.constraint = Objects.requireNonNull(constraint, "Path constraint cannot be null");
        this.hashCode = Objects.hash(variable, constraint);
    }

    public static PathCondition of(String variable, PathConstraint constraint) {
        return new PathCondition(variable, constraint);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PathCondition that)) {
            return false;
        }
        return variable.equals(that.variable) && constraint.equals(that.constraint);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return variable + " " + constraint;
    }
}
