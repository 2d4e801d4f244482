package org.ovsm.expressions;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.ovsm.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.*;
import java.util.stream.Collectors;

/**
 * 验证条件中使用的结构化公式/项。生成器和证明器共享同一棵树，
 * 字符串形式 (≠ ≤ ∧ ¬ 等记号) 只用于导出与诊断。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class Formula implements ToZ3BoolExpr, ToZ3ArithExpr {

    private static final Logger logger = LoggerFactory.getLogger(Formula.class);

    /**
     * 节点种类。
     */
    public enum Kind {
        VAR,      // x
        INT,      // 42
        BOOL,     // true / false
        STR,      // "abc"
        NULL,     // none
        FALSUM,   // False
        OPAQUE,   // «expr»
        APP,      // (name a b)，源语言中的工具调用
        PRED,     // name(a, b)，验证条件中的事实谓词
        INDEX,    // a[i]
        FIELD,    // o.f
        ARITH,    // (l op r)
        NEG,      // (-x)
        CMP,      // (l ~ r)
        AND,
        OR,
        NOT,
        IMPLIES
    }

    public static final Formula FALSE = new Formula(Kind.FALSUM, null, null, false, null, null, List.of());
    public static final Formula TRUE = new Formula(Kind.BOOL, null, null, true, null, null, List.of());
    public static final Formula NONE = new Formula(Kind.NULL, null, null, false, null, null, List.of());
    public static final Formula OPAQUE = new Formula(Kind.OPAQUE, null, null, false, null, null, List.of());

    private final Kind kind;
    // VAR/APP/PRED/FIELD 的名字，STR 的内容
    private final String name;
    private final BigInteger value;
    private final boolean truth;
    private final RelationType relation;
    private final ArithOp op;
    private final List<Formula> args;

    private final int hashCode;

    private Formula(Kind kind, String name, BigInteger value, boolean truth,
                    RelationType relation, ArithOp op, List<Formula> args) {
        this.kind = Objects.requireNonNull(kind, "Formula kind cannot be null");
        this.name = name;
        this.value = value;
        this.truth = truth;
        this.relation = relation;
        this.op = op;
        for (Formula arg : Objects.requireNonNull(args, "Formula args cannot be null")) {
            Objects.requireNonNull(arg, "Formula argument cannot be null");
        }
        this.args = List.copyOf(args);
        this.hashCode = Objects.hash(kind, name, value, truth, relation, op, this.args);
    }

    // --- 工厂方法 ---

    public static Formula var(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Variable name cannot be empty");
        }
        return new Formula(Kind.VAR, name, null, false, null, null, List.of());
    }

    public static Formula constant(long value) {
        return constant(BigInteger.valueOf(value));
    }

    public static Formula constant(BigInteger value) {
        Objects.requireNonNull(value, "Constant value cannot be null");
        return new Formula(Kind.INT, null, value, false, null, null, List.of());
    }

    public static Formula bool(boolean value) {
        return value ? TRUE : new Formula(Kind.BOOL, null, null, false, null, null, List.of());
    }

    public static Formula str(String text) {
        Objects.requireNonNull(text, "String literal cannot be null");
        return new Formula(Kind.STR, text, null, false, null, null, List.of());
    }

    /**
     * 工厂方法：源语言工具调用，渲染为 (name a b)。
     */
    public static Formula app(String name, List<Formula> args) {
        Objects.requireNonNull(name, "Call name cannot be null");
        return new Formula(Kind.APP, name, null, false, null, null, args);
    }

    public static Formula app(String name, Formula... args) {
        return app(name, Arrays.asList(args));
    }

    /**
     * 工厂方法：事实谓词，渲染为 name(a, b)；无参数时只渲染名字。
     */
    public static Formula pred(String name, Formula... args) {
        Objects.requireNonNull(name, "Predicate name cannot be null");
        return new Formula(Kind.PRED, name, null, false, null, null, Arrays.asList(args));
    }

    public static Formula index(Formula base, Formula idx) {
        return new Formula(Kind.INDEX, null, null, false, null, null, List.of(base, idx));
    }

    /**
     * 工厂方法：按账户下标索引的事实表，例如 account_is_signer[0]。
     */
    public static Formula index(String table, long idx) {
        return index(var(table), constant(idx));
    }

    public static Formula field(Formula object, String field) {
        Objects.requireNonNull(field, "Field name cannot be null");
        return new Formula(Kind.FIELD, field, null, false, null, null, List.of(object));
    }

    public static Formula arith(ArithOp op, Formula left, Formula right) {
        Objects.requireNonNull(op, "ArithOp cannot be null");
        return new Formula(Kind.ARITH, null, null, false, null, op, List.of(left, right));
    }

    public static Formula neg(Formula operand) {
        return new Formula(Kind.NEG, null, null, false, null, null, List.of(operand));
    }

    public static Formula compare(Formula left, RelationType relation, Formula right) {
        Objects.requireNonNull(relation, "RelationType cannot be null");
        return new Formula(Kind.CMP, null, null, false, relation, null, List.of(left, right));
    }

    /**
     * 工厂方法：合取。嵌套的合取会被展平，单个元素直接返回。
     */
    public static Formula and(List<Formula> parts) {
        List<Formula> flat = new ArrayList<>();
        for (Formula part : parts) {
            if (part.kind == Kind.AND) {
                flat.addAll(part.args);
            } else {
                flat.add(part);
            }
        }
        if (flat.isEmpty()) {
            return TRUE;
        }
        if (flat.size() == 1) {
            return flat.get(0);
        }
        return new Formula(Kind.AND, null, null, false, null, null, flat);
    }

    public static Formula and(Formula... parts) {
        return and(Arrays.asList(parts));
    }

    public static Formula or(Formula left, Formula right) {
        return new Formula(Kind.OR, null, null, false, null, null, List.of(left, right));
    }

    public static Formula not(Formula operand) {
        return new Formula(Kind.NOT, null, null, false, null, null, List.of(operand));
    }

    public static Formula implies(Formula premise, Formula conclusion) {
        return new Formula(Kind.IMPLIES, null, null, false, null, null, List.of(premise, conclusion));
    }

    // --- 查询 ---

    public Formula left() {
        return args.get(0);
    }

    public Formula right() {
        return args.get(1);
    }

    public boolean isVariable() {
        return kind == Kind.VAR;
    }

    public boolean isLiteral() {
        return kind == Kind.INT || kind == Kind.BOOL || kind == Kind.STR || kind == Kind.NULL
                || (kind == Kind.NEG && args.get(0).kind == Kind.INT);
    }

    public boolean isTriviallyTrue() {
        return kind == Kind.BOOL && truth;
    }

    public boolean isTriviallyFalse() {
        return kind == Kind.FALSUM || (kind == Kind.BOOL && !truth);
    }

    /**
     * 是否是把某项与布尔字面量比较而得出该项为假的形式：p = false、false = p、p ≠ true、true ≠ p。
     */
    public boolean isFalseComparison() {
        if (kind != Kind.CMP) {
            return false;
        }
        Formula l = left();
        Formula r = right();
        return switch (relation) {
            case EQ -> r.isTriviallyFalse() || l.isTriviallyFalse();
            case NE -> r.isTriviallyTrue() || l.isTriviallyTrue();
            default -> false;
        };
    }

    /**
     * 若此项是整数字面量 (或字面量的取负)，返回其值。
     */
    public Optional<BigInteger> asInteger() {
        if (kind == Kind.INT) {
            return Optional.of(value);
        }
        if (kind == Kind.NEG) {
            return args.get(0).asInteger().map(BigInteger::negate);
        }
        return Optional.empty();
    }

    /**
     * 将合取拆分为各个合取项；非合取返回自身。
     */
    public List<Formula> conjuncts() {
        return kind == Kind.AND ? args : List.of(this);
    }

    /**
     * 此公式为真时一定为真的原子部分：展开合取，消去双重否定。
     * 其余的否定、析取和蕴含不给出确定的事实，直接跳过。
     */
    public List<Formula> positiveConjuncts() {
        List<Formula> result = new ArrayList<>();
        collectPositive(result);
        return result;
    }

    private void collectPositive(List<Formula> out) {
        switch (kind) {
            case AND -> args.forEach(arg -> arg.collectPositive(out));
            case NOT -> {
                if (args.get(0).kind == Kind.NOT) {
                    args.get(0).args.get(0).collectPositive(out);
                }
            }
            case OR, IMPLIES -> {
            }
            default -> out.add(this);
        }
    }

    /**
     * 取反。比较直接翻转关系，双重否定被消去。
     */
    public Formula negated() {
        return switch (kind) {
            case CMP -> compare(left(), relation.negate(), right());
            case NOT -> args.get(0);
            case FALSUM -> TRUE;
            case BOOL -> bool(!truth);
            default -> not(this);
        };
    }

    /**
     * 收集此公式中出现的所有标识符：变量名、调用名、谓词名、字段名。
     */
    public Set<String> symbols() {
        Set<String> result = new LinkedHashSet<>();
        collectSymbols(result);
        return result;
    }

    private void collectSymbols(Set<String> out) {
        switch (kind) {
            case VAR, APP, PRED, FIELD -> out.add(name);
            default -> {
            }
        }
        for (Formula arg : args) {
            arg.collectSymbols(out);
        }
    }

    /**
     * 判断是否有某个标识符包含给定关键字。
     */
    public boolean mentions(String keyword) {
        for (String symbol : symbols()) {
            if (symbol.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 判断变量 varName 是否作为变量出现在公式中。
     */
    public boolean mentionsVariable(String varName) {
        if (kind == Kind.VAR && name.equals(varName)) {
            return true;
        }
        for (Formula arg : args) {
            if (arg.mentionsVariable(varName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 将变量 varName 的所有出现替换为 replacement。
     */
    public Formula substitute(String varName, Formula replacement) {
        if (kind == Kind.VAR) {
            return name.equals(varName) ? replacement : this;
        }
        if (args.isEmpty()) {
            return this;
        }
        List<Formula> replaced = args.stream().map(a -> a.substitute(varName, replacement)).toList();
        if (replaced.equals(args)) {
            return this;
        }
        return new Formula(kind, name, value, truth, relation, op, replaced);
    }

    // --- 渲染 ---

    /**
     * 渲染为带外层括号的形式，例如 (y > 0)。假设列表使用此形式。
     */
    public String render() {
        return switch (kind) {
            case VAR -> name;
            case INT -> value.toString();
            case BOOL -> truth ? "true" : "false";
            case STR -> "\"" + name + "\"";
            case NULL -> "none";
            case FALSUM -> "False";
            case OPAQUE -> "«expr»";
            case APP -> args.isEmpty()
                    ? "(" + name + ")"
                    : "(" + name + " " + args.stream().map(Formula::render).collect(Collectors.joining(" ")) + ")";
            case PRED -> args.isEmpty()
                    ? name
                    : name + "(" + args.stream().map(Formula::renderBare).collect(Collectors.joining(", ")) + ")";
            case INDEX -> left().render() + "[" + right().renderBare() + "]";
            case FIELD -> args.get(0).render() + "." + name;
            case NEG -> "(-" + args.get(0).render() + ")";
            case NOT -> {
                String inner = args.get(0).render();
                yield inner.startsWith("(") ? "¬" + inner : "¬(" + inner + ")";
            }
            case ARITH, CMP, AND, OR, IMPLIES -> "(" + renderBare() + ")";
        };
    }

    /**
     * 渲染为不带外层括号的形式，例如 y ≠ 0。验证条件的待证性质使用此形式。
     */
    public String renderBare() {
        return switch (kind) {
            case ARITH -> left().render() + " " + op.getSymbol() + " " + right().render();
            case CMP -> left().render() + " " + relation.getLeanSymbol() + " " + right().render();
            case AND -> args.stream().map(Formula::render).collect(Collectors.joining(" ∧ "));
            case OR -> left().render() + " ∨ " + right().render();
            case IMPLIES -> left().render() + " → " + right().render();
            default -> render();
        };
    }

    // --- Z3 转换 ---

    /**
     * 是否能作为布尔公式翻译为 Z3 线性整数算术。
     */
    public boolean isZ3Translatable() {
        return switch (kind) {
            case BOOL, FALSUM -> true;
            case CMP -> left().isArithTranslatable() && right().isArithTranslatable();
            case AND, OR, NOT, IMPLIES -> args.stream().allMatch(Formula::isZ3Translatable);
            default -> false;
        };
    }

    /**
     * 是否能作为整数项翻译为 Z3。乘法要求至少一侧为常量，除法/取模要求除数为非零常量。
     */
    public boolean isArithTranslatable() {
        return switch (kind) {
            case VAR, INT -> true;
            case NEG -> args.get(0).isArithTranslatable();
            case FIELD -> ("size".equals(name) && args.get(0).kind == Kind.VAR)
                    || ("toNat".equals(name) && args.get(0).isArithTranslatable());
            case ARITH -> switch (op) {
                case ADD, SUB -> left().isArithTranslatable() && right().isArithTranslatable();
                case MUL -> left().isArithTranslatable() && right().isArithTranslatable()
                        && (left().asInteger().isPresent() || right().asInteger().isPresent());
                case DIV, MOD -> left().isArithTranslatable()
                        && right().asInteger().map(v -> v.signum() != 0).orElse(false);
                case POW -> false;
            };
            default -> false;
        };
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        return switch (kind) {
            case BOOL -> ctx.mkBool(truth);
            case FALSUM -> ctx.mkFalse();
            case CMP -> relation.toZ3(ctx, left().toZ3ArithExpr(ctx, varManager), right().toZ3ArithExpr(ctx, varManager));
            case AND -> ctx.mkAnd(args.stream().map(a -> a.toZ3BoolExpr(ctx, varManager)).toArray(BoolExpr[]::new));
            case OR -> ctx.mkOr(left().toZ3BoolExpr(ctx, varManager), right().toZ3BoolExpr(ctx, varManager));
            case NOT -> ctx.mkNot(args.get(0).toZ3BoolExpr(ctx, varManager));
            case IMPLIES -> ctx.mkImplies(left().toZ3BoolExpr(ctx, varManager), right().toZ3BoolExpr(ctx, varManager));
            default -> {
                logger.debug("Formula.toZ3BoolExpr: 无法翻译 {} 节点 {}", kind, this);
                throw new UnsupportedOperationException("Cannot translate to Z3 boolean: " + render());
            }
        };
    }

    @Override
    public ArithExpr toZ3ArithExpr(Context ctx, Z3VariableManager varManager) {
        return switch (kind) {
            case VAR -> varManager.getZ3Var(name);
            case INT -> ctx.mkInt(value.toString());
            case NEG -> ctx.mkUnaryMinus(args.get(0).toZ3ArithExpr(ctx, varManager));
            case FIELD -> {
                if ("size".equals(name)) {
                    yield varManager.getZ3Var(render());
                }
                if ("toNat".equals(name)) {
                    // toNat 把负数截断为 0
                    ArithExpr inner = args.get(0).toZ3ArithExpr(ctx, varManager);
                    yield (ArithExpr) ctx.mkITE(ctx.mkLt(inner, ctx.mkInt(0)), ctx.mkInt(0), inner);
                }
                throw new UnsupportedOperationException("Cannot translate field to Z3: " + render());
            }
            case ARITH -> {
                ArithExpr l = left().toZ3ArithExpr(ctx, varManager);
                ArithExpr r = right().toZ3ArithExpr(ctx, varManager);
                yield switch (op) {
                    case ADD -> ctx.mkAdd(l, r);
                    case SUB -> ctx.mkSub(l, r);
                    case MUL -> ctx.mkMul(l, r);
                    case DIV -> ctx.mkDiv(l, r);
                    case MOD -> ctx.mkMod(l, r);
                    case POW -> throw new UnsupportedOperationException("Cannot translate power to Z3: " + render());
                };
            }
            default -> {
                logger.debug("Formula.toZ3ArithExpr: 无法翻译 {} 节点 {}", kind, this);
                throw new UnsupportedOperationException("Cannot translate to Z3 term: " + render());
            }
        };
    }

    // --- Object 方法 ---
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Formula that = (Formula) o;
        return kind == that.kind
                && truth == that.truth
                && Objects.equals(name, that.name)
                && Objects.equals(value, that.value)
                && relation == that.relation
                && op == that.op
                && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return render();
    }
}
