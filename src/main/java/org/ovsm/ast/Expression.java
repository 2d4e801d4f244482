package org.ovsm.ast;

import lombok.Getter;

import java.math.BigInteger;
import java.util.*;
import java.util.stream.Collectors;

/**
 * 表达式节点。由外部解析器构造，验证引擎只读不写。
 * 各具体节点为不可变的静态内部类，并提供静态工厂方法便于直接构造语法树。
 */
public abstract class Expression {

    Expression() {
    }

    // --- 工厂方法 ---

    public static IntLiteral integer(long value) {
        return new IntLiteral(BigInteger.valueOf(value));
    }

    public static IntLiteral integer(BigInteger value) {
        return new IntLiteral(value);
    }

    public static FloatLiteral floating(double value) {
        return new FloatLiteral(value);
    }

    public static StringLiteral string(String value) {
        return new StringLiteral(value);
    }

    public static BoolLiteral bool(boolean value) {
        return new BoolLiteral(value);
    }

    public static NullLiteral nil() {
        return NullLiteral.INSTANCE;
    }

    public static Variable variable(String name) {
        return new Variable(name);
    }

    public static ArrayLiteral array(Expression... elements) {
        return new ArrayLiteral(Arrays.asList(elements));
    }

    public static ArrayLiteral array(List<Expression> elements) {
        return new ArrayLiteral(elements);
    }

    public static ObjectLiteral object(Map<String, Expression> fields) {
        return new ObjectLiteral(fields);
    }

    public static Range range(Expression start, Expression end) {
        return new Range(start, end);
    }

    public static Binary binary(BinaryOp op, Expression left, Expression right) {
        return new Binary(op, left, right);
    }

    public static Unary unary(UnaryOp op, Expression operand) {
        return new Unary(op, operand);
    }

    public static Ternary ternary(Expression condition, Expression thenExpr, Expression elseExpr) {
        return new Ternary(condition, thenExpr, elseExpr);
    }

    /**
     * 工厂方法：以位置参数构造工具调用，例如 (set-lamports 0 x)。
     */
    public static ToolCall call(String name, Expression... args) {
        return new ToolCall(name, Arrays.stream(args).map(Argument::positional).toList());
    }

    public static ToolCall callWith(String name, List<Argument> args) {
        return new ToolCall(name, args);
    }

    public static Lambda lambda(List<String> params, Expression body) {
        return new Lambda(params, body);
    }

    public static FieldAccess field(Expression object, String field) {
        return new FieldAccess(object, field);
    }

    public static IndexAccess index(Expression array, Expression index) {
        return new IndexAccess(array, index);
    }

    public static Grouping group(Expression inner) {
        return new Grouping(inner);
    }

    public static TypeAnnotation annotate(Expression expr, Expression typeExpr) {
        return new TypeAnnotation(expr, typeExpr);
    }

    public static RefinedTypeExpr refined(String var, String baseType, Expression predicate) {
        return new RefinedTypeExpr(var, baseType, predicate);
    }

    // --- 节点 ---

    @Getter
    public static final class IntLiteral extends Expression {
        private final BigInteger value;

        private IntLiteral(BigInteger value) {
            this.value = Objects.requireNonNull(value, "Integer literal cannot be null");
        }

        public boolean isZero() {
            return value.signum() == 0;
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    @Getter
    public static final class FloatLiteral extends Expression {
        private final double value;

        private FloatLiteral(double value) {
            this.value = value;
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    @Getter
    public static final class StringLiteral extends Expression {
        private final String value;

        private StringLiteral(String value) {
            this.value = Objects.requireNonNull(value, "String literal cannot be null");
        }

        @Override
        public String toString() {
            return "\"" + value + "\"";
        }
    }

    @Getter
    public static final class BoolLiteral extends Expression {
        private final boolean value;

        private BoolLiteral(boolean value) {
            this.value = value;
        }

        @Override
        public String toString() {
            return value ? "true" : "false";
        }
    }

    public static final class NullLiteral extends Expression {
        private static final NullLiteral INSTANCE = new NullLiteral();

        private NullLiteral() {
        }

        @Override
        public String toString() {
            return "nil";
        }
    }

    @Getter
    public static final class Variable extends Expression {
        private final String name;

        private Variable(String name) {
            Objects.requireNonNull(name, "Variable name cannot be null");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Variable name cannot be empty");
            }
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    @Getter
    public static final class ArrayLiteral extends Expression {
        private final List<Expression> elements;

        private ArrayLiteral(List<Expression> elements) {
            this.elements = List.copyOf(elements);
        }

        public int size() {
            return elements.size();
        }

        @Override
        public String toString() {
            return elements.stream().map(Object::toString).collect(Collectors.joining(" ", "[", "]"));
        }
    }

    @Getter
    public static final class ObjectLiteral extends Expression {
        private final Map<String, Expression> fields;

        private ObjectLiteral(Map<String, Expression> fields) {
            this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public String toString() {
            return fields.entrySet().stream()
                    .map(e -> ":" + e.getKey() + " " + e.getValue())
                    .collect(Collectors.joining(" ", "{", "}"));
        }
    }

    /**
     * 半开区间 [start, end)。
     */
    @Getter
    public static final class Range extends Expression {
        private final Expression start;
        private final Expression end;

        private Range(Expression start, Expression end) {
            this.start = Objects.requireNonNull(start, "Range start cannot be null");
            this.end = Objects.requireNonNull(end, "Range end cannot be null");
        }

        @Override
        public String toString() {
            return "(range " + start + " " + end + ")";
        }
    }

    @Getter
    public static final class Binary extends Expression {
        private final BinaryOp op;
        private final Expression left;
        private final Expression right;

        private Binary(BinaryOp op, Expression left, Expression right) {
            this.op = Objects.requireNonNull(op, "BinaryOp cannot be null");
            this.left = Objects.requireNonNull(left, "Left operand cannot be null");
            this.right = Objects.requireNonNull(right, "Right operand cannot be null");
        }

        /**
         * 两个操作数是否都是整数字面量。
         */
        public boolean isStatic() {
            return left instanceof IntLiteral && right instanceof IntLiteral;
        }

        @Override
        public String toString() {
            return "(" + op.getSymbol() + " " + left + " " + right + ")";
        }
    }

    @Getter
    public static final class Unary extends Expression {
        private final UnaryOp op;
        private final Expression operand;

        private Unary(UnaryOp op, Expression operand) {
            this.op = Objects.requireNonNull(op, "UnaryOp cannot be null");
            this.operand = Objects.requireNonNull(operand, "Operand cannot be null");
        }

        @Override
        public String toString() {
            return "(" + (op == UnaryOp.NEG ? "-" : "not") + " " + operand + ")";
        }
    }

    @Getter
    public static final class Ternary extends Expression {
        private final Expression condition;
        private final Expression thenExpr;
        private final Expression elseExpr;

        private Ternary(Expression condition, Expression thenExpr, Expression elseExpr) {
            this.condition = Objects.requireNonNull(condition, "Condition cannot be null");
            this.thenExpr = Objects.requireNonNull(thenExpr, "Then branch cannot be null");
            this.elseExpr = Objects.requireNonNull(elseExpr, "Else branch cannot be null");
        }

        @Override
        public String toString() {
            return "(if " + condition + " " + thenExpr + " " + elseExpr + ")";
        }
    }

    @Getter
    public static final class ToolCall extends Expression {
        private final String name;
        private final List<Argument> args;

        private ToolCall(String name, List<Argument> args) {
            this.name = Objects.requireNonNull(name, "Tool name cannot be null");
            this.args = List.copyOf(args);
        }

        public int arity() {
            return args.size();
        }

        /**
         * 第 i 个实参的值，越界时返回 null。
         */
        public Expression arg(int i) {
            return i < args.size() ? args.get(i).getValue() : null;
        }

        public boolean hasArgs(int count) {
            return args.size() >= count;
        }

        @Override
        public String toString() {
            if (args.isEmpty()) {
                return "(" + name + ")";
            }
            return "(" + name + " " + args.stream().map(Object::toString).collect(Collectors.joining(" ")) + ")";
        }
    }

    @Getter
    public static final class Lambda extends Expression {
        private final List<String> params;
        private final Expression body;

        private Lambda(List<String> params, Expression body) {
            this.params = List.copyOf(params);
            this.body = Objects.requireNonNull(body, "Lambda body cannot be null");
        }

        @Override
        public String toString() {
            return "(lambda (" + String.join(" ", params) + ") " + body + ")";
        }
    }

    @Getter
    public static final class FieldAccess extends Expression {
        private final Expression object;
        private final String field;

        private FieldAccess(Expression object, String field) {
            this.object = Objects.requireNonNull(object, "Object cannot be null");
            this.field = Objects.requireNonNull(field, "Field cannot be null");
        }

        @Override
        public String toString() {
            return object + "." + field;
        }
    }

    @Getter
    public static final class IndexAccess extends Expression {
        private final Expression array;
        private final Expression index;

        private IndexAccess(Expression array, Expression index) {
            this.array = Objects.requireNonNull(array, "Array cannot be null");
            this.index = Objects.requireNonNull(index, "Index cannot be null");
        }

        @Override
        public String toString() {
            return array + "[" + index + "]";
        }
    }

    @Getter
    public static final class Grouping extends Expression {
        private final Expression inner;

        private Grouping(Expression inner) {
            this.inner = Objects.requireNonNull(inner, "Grouped expression cannot be null");
        }

        @Override
        public String toString() {
            return "(" + inner + ")";
        }
    }

    /**
     * 类型标注 (the type expr)。typeExpr 为 {@link RefinedTypeExpr} 时携带细化谓词。
     */
    @Getter
    public static final class TypeAnnotation extends Expression {
        private final Expression expr;
        private final Expression typeExpr;

        private TypeAnnotation(Expression expr, Expression typeExpr) {
            this.expr = Objects.requireNonNull(expr, "Annotated expression cannot be null");
            this.typeExpr = Objects.requireNonNull(typeExpr, "Type expression cannot be null");
        }

        @Override
        public String toString() {
            return "(: " + expr + " " + typeExpr + ")";
        }
    }

    /**
     * 细化类型 {var : baseType | predicate}。
     */
    @Getter
    public static final class RefinedTypeExpr extends Expression {
        private final String var;
        private final String baseType;
        private final Expression predicate;

        private RefinedTypeExpr(String var, String baseType, Expression predicate) {
            this.var = Objects.requireNonNull(var, "Refinement variable cannot be null");
            this.baseType = Objects.requireNonNull(baseType, "Base type cannot be null");
            this.predicate = Objects.requireNonNull(predicate, "Refinement predicate cannot be null");
        }

        @Override
        public String toString() {
            return "{" + var + " : " + baseType + " | " + predicate + "}";
        }
    }
}
