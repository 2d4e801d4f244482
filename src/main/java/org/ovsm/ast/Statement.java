package org.ovsm.ast;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 语句节点。每个语句可以携带源位置，{@link #at(int, int)} 返回带位置的副本。
 */
@Getter
public abstract class Statement {

    // 解析器未提供位置时为 null
    private final SourceSpan span;

    Statement(SourceSpan span) {
        this.span = span;
    }

    /**
     * 返回位于给定行列的副本。
     */
    public Statement at(int line, int column) {
        return withSpan(SourceSpan.of(line, column));
    }

    abstract Statement withSpan(SourceSpan span);

    public boolean hasSpan() {
        return span != null;
    }

    // --- 工厂方法 ---

    public static Assignment assign(String name, Expression value) {
        return new Assignment(null, name, value);
    }

    public static ConstantDef constant(String name, Expression value) {
        return new ConstantDef(null, name, value);
    }

    public static If ifThen(Expression condition, List<Statement> thenBranch) {
        return new If(null, condition, thenBranch, null);
    }

    public static If ifThenElse(Expression condition, List<Statement> thenBranch, List<Statement> elseBranch) {
        return new If(null, condition, thenBranch, elseBranch);
    }

    public static While whileLoop(Expression condition, Statement... body) {
        return new While(null, condition, Arrays.asList(body));
    }

    public static For forLoop(String variable, Expression iterable, Statement... body) {
        return new For(null, variable, iterable, Arrays.asList(body));
    }

    public static Guard guard(Expression condition, Statement... elseBody) {
        return new Guard(null, condition, Arrays.asList(elseBody));
    }

    public static Return returning(Expression value) {
        return new Return(null, value);
    }

    public static Try tryCatch(List<Statement> body, List<CatchClause> catchClauses) {
        return new Try(null, body, catchClauses);
    }

    public static Break breakLoop() {
        return new Break(null);
    }

    public static Continue continueLoop() {
        return new Continue(null);
    }

    public static ExpressionStatement expression(Expression expression) {
        return new ExpressionStatement(null, expression);
    }

    // --- 节点 ---

    @Getter
    public static final class Assignment extends Statement {
        private final String name;
        private final Expression value;

        private Assignment(SourceSpan span, String name, Expression value) {
            super(span);
            this.name = Objects.requireNonNull(name, "Assignment target cannot be null");
            this.value = Objects.requireNonNull(value, "Assignment value cannot be null");
        }

        @Override
        Statement withSpan(SourceSpan span) {
            return new Assignment(span, name, value);
        }
    }

    @Getter
    public static final class ConstantDef extends Statement {
        private final String name;
        private final Expression value;

        private ConstantDef(SourceSpan span, String name, Expression value) {
            super(span);
            this.name = Objects.requireNonNull(name, "Constant name cannot be null");
            this.value = Objects.requireNonNull(value, "Constant value cannot be null");
        }

        @Override
        Statement withSpan(SourceSpan span) {
            return new ConstantDef(span, name, value);
        }
    }

    @Getter
    public static final class If extends Statement {
        private final Expression condition;
        private final List<Statement> thenBranch;
        // 无 else 分支时为 null
        private final List<Statement> elseBranch;

        private If(SourceSpan span, Expression condition, List<Statement> thenBranch, List<Statement> elseBranch) {
            super(span);
            this.condition = Objects.requireNonNull(condition, "If condition cannot be null");
            this.thenBranch = List.copyOf(thenBranch);
            this.elseBranch = elseBranch == null ? null : List.copyOf(elseBranch);
        }

        public boolean hasElse() {
            return elseBranch != null;
        }

        @Override
        Statement withSpan(SourceSpan span) {
            return new If(span, condition, thenBranch, elseBranch);
        }
    }

    @Getter
    public static final class While extends Statement {
        private final Expression condition;
        private final List<Statement> body;

        private While(SourceSpan span, Expression condition, List<Statement> body) {
            super(span);
            this.condition = Objects.requireNonNull(condition, "While condition cannot be null");
            this.body = List.copyOf(body);
        }

        @Override
        Statement withSpan(SourceSpan span) {
            return new While(span, condition, body);
        }
    }

    @Getter
    public static final class For extends Statement {
        private final String variable;
        private final Expression iterable;
        private final List<Statement> body;

        private For(SourceSpan span, String variable, Expression iterable, List<Statement> body) {
            super(span);
            this.variable = Objects.requireNonNull(variable, "Loop variable cannot be null");
            this.iterable = Objects.requireNonNull(iterable, "Loop iterable cannot be null");
            this.body = List.copyOf(body);
        }

        @Override
        Statement withSpan(SourceSpan span) {
            return new For(span, variable, iterable, body);
        }
    }

    /**
     * guard 语句：条件不成立时执行 elseBody (通常以返回或报错结束)。
     */
    @Getter
    public static final class Guard extends Statement {
        private final Expression condition;
        private final List<Statement> elseBody;

        private Guard(SourceSpan span, Expression condition, List<Statement> elseBody) {
            super(span);
            this.condition = Objects.requireNonNull(condition, "Guard condition cannot be null");
            this.elseBody = List.copyOf(elseBody);
        }

        @Override
        Statement withSpan(SourceSpan span) {
            return new Guard(span, condition, elseBody);
        }
    }

    @Getter
    public static final class Return extends Statement {
        // 无返回值时为 null
        private final Expression value;

        private Return(SourceSpan span, Expression value) {
            super(span);
            this.value = value;
        }

        @Override
        Statement withSpan(SourceSpan span) {
            return new Return(span, value);
        }
    }

    @Getter
    public static final class Try extends Statement {
        private final List<Statement> body;
        private final List<CatchClause> catchClauses;

        private Try(SourceSpan span, List<Statement> body, List<CatchClause> catchClauses) {
            super(span);
            this.body = List.copyOf(body);
            this.catchClauses = List.copyOf(catchClauses);
        }

        @Override
        Statement withSpan(SourceSpan span) {
            return new Try(span, body, catchClauses);
        }
    }

    public static final class Break extends Statement {
        private Break(SourceSpan span) {
            super(span);
        }

        @Override
        Statement withSpan(SourceSpan span) {
            return new Break(span);
        }
    }

    public static final class Continue extends Statement {
        private Continue(SourceSpan span) {
            super(span);
        }

        @Override
        Statement withSpan(SourceSpan span) {
            return new Continue(span);
        }
    }

    @Getter
    public static final class ExpressionStatement extends Statement {
        private final Expression expression;

        private ExpressionStatement(SourceSpan span, Expression expression) {
            super(span);
            this.expression = Objects.requireNonNull(expression, "Expression cannot be null");
        }

        @Override
        Statement withSpan(SourceSpan span) {
            return new ExpressionStatement(span, expression);
        }
    }
}
