package org.ovsm.generator;

import org.apache.commons.lang3.tuple.Pair;
import org.ovsm.ast.*;
import org.ovsm.core.VCCategory;
import org.ovsm.expressions.ArithOp;
import org.ovsm.expressions.ExpressionTranslator;
import org.ovsm.expressions.Formula;
import org.ovsm.expressions.RelationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.*;

/**
 * 验证条件生成器：一遍遍历语法树，在路径敏感的假设栈下为每个有风险的操作生成证明义务。
 * <p>
 * 每次 {@link #generate(Program, String)} 都新建一个 {@link AnalysisContext}，
 * 生成器实例本身不保存可变状态，可以在多个程序之间复用。语法树不会被修改。
 * @author Ayalyt
 */
public final class VCGenerator {

    private static final Logger logger = LoggerFactory.getLogger(VCGenerator.class);

    static final BigInteger U64_MAX = new BigInteger("18446744073709551615");

    private static final List<String> LOCAL_PREFIXES = List.of("local-", "temp-", "scratch-");
    private static final Set<String> INVARIANT_CALLS = Set.of("invariant", "@invariant");
    private static final Set<String> EXIT_CALLS = Set.of("error", "abort", "panic", "fail", "throw");
    private static final Set<String> SIGNER_QUERIES = Set.of("account-is-signer", "is-signer");
    private static final Set<String> WRITABLE_QUERIES = Set.of("account-is-writable", "is-writable");
    private static final Set<String> OWNER_CHECKS = Set.of("check-owner", "assert-owner");

    private final VerificationProperties properties;

    public VCGenerator(VerificationProperties properties) {
        this.properties = Objects.requireNonNull(properties, "Verification properties cannot be null");
    }

    public VCGenerator() {
        this(VerificationProperties.all());
    }

    public VerificationProperties getProperties() {
        return properties;
    }

    /**
     * 为整个程序生成验证条件。编号从 1 开始，同一输入重复生成得到相同的结果。
     */
    public GenerationResult generate(Program program, String sourceFile) {
        Objects.requireNonNull(program, "Program cannot be null");
        Run run = new Run(new AnalysisContext(sourceFile));
        run.visitBlock(program.getStatements());
        run.emitBalanceConservation();
        GenerationResult result = run.result();
        logger.info("{}: 生成 {} 条验证条件 (访问 {} 条语句)", sourceFile, result.size(), result.getTotalNodes());
        return result;
    }

    /**
     * 单次生成过程。所有可变状态都挂在这里，随 generate 调用结束而丢弃。
     */
    private final class Run {

        private final AnalysisContext ctx;
        private final ToolCallRules rules;
        private final Map<String, BigInteger> arraySizes = new LinkedHashMap<>();
        private final Map<String, BigInteger> constants = new LinkedHashMap<>();
        // 绑定了互相冲突的值的名字，不再参与学习
        private final Set<String> conflictingArrays = new HashSet<>();
        private final Set<String> conflictingConstants = new HashSet<>();

        private Run(AnalysisContext ctx) {
            this.ctx = ctx;
            this.rules = new ToolCallRules(ctx, properties);
        }

        private GenerationResult result() {
            return new GenerationResult(ctx.getVcs(), arraySizes, constants,
                    ctx.getTotalNodes(), ctx.getNodesWithVcs(), ctx.getUncovered());
        }

        // --- 语句 ---

        /**
         * 块结束时丢弃块内压入的假设 (guard、assume 与赋值事实)。
         */
        private void visitBlock(List<Statement> statements) {
            int mark = ctx.mark();
            for (Statement statement : statements) {
                visitStatement(statement);
            }
            ctx.restore(mark);
        }

        private void visitStatement(Statement statement) {
            ctx.countNode();
            SourceSpan previous = ctx.enterSpan(statement.getSpan());
            if (statement instanceof Statement.Assignment assignment) {
                visitAssignment(assignment);
            } else if (statement instanceof Statement.ConstantDef def) {
                visitExpression(def.getValue());
                ctx.invalidate(def.getName());
                ctx.getFacts().markInitialized(def.getName());
                learnArray(def.getName(), def.getValue());
                learn(constants, conflictingConstants, def.getName(), ToolCallRules.literal(def.getValue()).orElse(null));
            } else if (statement instanceof Statement.If ifStmt) {
                visitIf(ifStmt);
            } else if (statement instanceof Statement.While loop) {
                visitWhile(loop);
            } else if (statement instanceof Statement.For loop) {
                visitFor(loop);
            } else if (statement instanceof Statement.Guard guard) {
                visitGuard(guard);
            } else if (statement instanceof Statement.Return ret) {
                if (ret.getValue() != null) {
                    visitExpression(ret.getValue());
                }
            } else if (statement instanceof Statement.Try tryStmt) {
                visitTry(tryStmt);
            } else if (statement instanceof Statement.ExpressionStatement exprStmt) {
                visitExpression(exprStmt.getExpression());
            }
            // Break/Continue 没有操作数
            ctx.leaveSpan(previous);
        }

        private void visitAssignment(Statement.Assignment assignment) {
            String name = assignment.getName();
            Expression value = assignment.getValue();
            visitExpression(value);
            ctx.invalidate(name);
            ctx.getFacts().markInitialized(name);
            learnArray(name, value);
            learn(constants, conflictingConstants, name, null);
            Formula term = ExpressionTranslator.translate(value);
            if (term.isArithTranslatable() && !term.mentionsVariable(name)) {
                ctx.pushAssumption(Formula.compare(Formula.var(name), RelationType.EQ, term));
            }
        }

        private void visitIf(Statement.If ifStmt) {
            visitExpression(ifStmt.getCondition());
            Formula condition = ExpressionTranslator.translateCondition(ifStmt.getCondition());
            List<Statement> elseBranch = ifStmt.hasElse() ? ifStmt.getElseBranch() : List.of();

            PathFacts before = ctx.forkFacts();
            int mark = ctx.mark();
            assume(condition);
            visitBlock(ifStmt.getThenBranch());
            ctx.restore(mark);
            PathFacts thenFacts = ctx.getFacts();

            ctx.setFacts(before.copy());
            assume(negate(condition));
            visitBlock(elseBranch);
            ctx.restore(mark);
            PathFacts elseFacts = ctx.getFacts();

            boolean thenExits = exits(ifStmt.getThenBranch());
            boolean elseExits = exits(elseBranch);
            if (thenExits && !elseExits) {
                // 提前返回：后续代码只在 else 路径上执行
                ctx.setFacts(elseFacts);
                narrow(negate(condition), elseBranch);
            } else if (elseExits && !thenExits) {
                ctx.setFacts(thenFacts);
                narrow(condition, ifStmt.getThenBranch());
            } else {
                ctx.setFacts(thenFacts.join(elseFacts));
            }
        }

        /**
         * 在块剩余部分保留 fact，前提是存活分支没有改写 fact 提到的变量。
         */
        private void narrow(Formula fact, List<Statement> survivingBranch) {
            for (String variable : assignedVariables(survivingBranch)) {
                if (fact.mentionsVariable(variable)) {
                    return;
                }
            }
            assume(fact);
        }

        private void visitGuard(Statement.Guard guard) {
            visitExpression(guard.getCondition());
            Formula condition = ExpressionTranslator.translateCondition(guard.getCondition());

            PathFacts before = ctx.forkFacts();
            int mark = ctx.mark();
            assume(negate(condition));
            visitBlock(guard.getElseBody());
            ctx.restore(mark);
            PathFacts failureFacts = ctx.getFacts();
            ctx.setFacts(exits(guard.getElseBody()) ? before : before.join(failureFacts));

            // guard 成立的事实一直保留到当前块结束
            assume(condition);
        }

        private void visitWhile(Statement.While loop) {
            visitExpression(loop.getCondition());
            Formula condition = ExpressionTranslator.translateCondition(loop.getCondition());
            List<Formula> invariants = extractInvariants(loop.getBody());
            Set<String> assigned = assignedVariables(loop.getBody());

            for (Formula invariant : invariants) {
                ctx.emit(VCCategory.LOOP_INVARIANT,
                        String.format("Loop invariant '%s' must hold on entry", invariant.renderBare()),
                        Formula.implies(Formula.pred("entry"), invariant), "loop_entry");
            }
            assigned.forEach(ctx::invalidate);
            for (Formula invariant : invariants) {
                Formula next = isStable(invariant, assigned) ? invariant : Formula.pred("after_body", invariant);
                ctx.emit(VCCategory.LOOP_INVARIANT,
                        String.format("Loop invariant '%s' must be preserved by loop body", invariant.renderBare()),
                        Formula.implies(Formula.and(invariant, condition), next), "loop_preserve");
            }
            visitLoopBody(loop.getBody(), invariants, condition);
        }

        private void visitFor(Statement.For loop) {
            visitExpression(loop.getIterable());
            String variable = loop.getVariable();
            Formula loopVar = Formula.var(variable);
            List<Formula> invariants = extractInvariants(loop.getBody());
            Set<String> assigned = assignedVariables(loop.getBody());

            Formula bounds = null;
            if (loop.getIterable() instanceof Expression.Range range) {
                Formula start = ExpressionTranslator.translate(range.getStart());
                Formula end = ExpressionTranslator.translate(range.getEnd());
                bounds = Formula.and(Formula.compare(start, RelationType.LE, loopVar),
                        Formula.compare(loopVar, RelationType.LT, end));
                for (Formula invariant : invariants) {
                    ctx.emit(VCCategory.LOOP_INVARIANT,
                            String.format("For-loop invariant '%s' must hold on entry", invariant.renderBare()),
                            Formula.implies(Formula.compare(loopVar, RelationType.EQ, start), invariant),
                            "loop_entry");
                }
                assigned.forEach(ctx::invalidate);
                ctx.invalidate(variable);
                for (Formula invariant : invariants) {
                    Formula next = isStable(invariant, assigned)
                            ? invariant.substitute(variable, Formula.arith(ArithOp.ADD, loopVar, Formula.constant(1)))
                            : Formula.pred("after_body", invariant);
                    ctx.emit(VCCategory.LOOP_INVARIANT,
                            String.format("For-loop invariant '%s' must be preserved", invariant.renderBare()),
                            Formula.implies(Formula.and(bounds, invariant), next), "loop_preserve");
                }
            } else {
                for (Formula invariant : invariants) {
                    ctx.emit(VCCategory.LOOP_INVARIANT,
                            String.format("For-loop invariant '%s' must hold on entry", invariant.renderBare()),
                            Formula.implies(Formula.pred("entry"), invariant), "loop_entry");
                }
                assigned.forEach(ctx::invalidate);
                ctx.invalidate(variable);
                Set<String> changing = new HashSet<>(assigned);
                changing.add(variable);
                for (Formula invariant : invariants) {
                    Formula next = isStable(invariant, changing) ? invariant : Formula.pred("after_body", invariant);
                    ctx.emit(VCCategory.LOOP_INVARIANT,
                            String.format("For-loop invariant '%s' must be preserved", invariant.renderBare()),
                            Formula.implies(invariant, next), "loop_preserve");
                }
            }
            ctx.getFacts().markInitialized(variable);
            visitLoopBody(loop.getBody(), invariants, bounds);
        }

        /**
         * 循环体在不变式与循环条件下访问。循环体可能一次都不执行，所以出口处的事实与入口处汇合。
         * 循环体只访问一次，其中关闭的账户在下一次迭代会被再次关闭。
         */
        private void visitLoopBody(List<Statement> body, List<Formula> invariants, Formula condition) {
            PathFacts before = ctx.forkFacts();
            int mark = ctx.mark();
            invariants.forEach(ctx::pushAssumption);
            if (condition != null) {
                assume(condition);
            }
            visitBlock(body);
            for (BigInteger account : ctx.getFacts().closedSince(before)) {
                ctx.emit(VCCategory.DOUBLE_FREE,
                        String.format("Account %s may be closed again on a later loop iteration", account),
                        Formula.compare(Formula.index(Formula.var("account_closed"), Formula.constant(account)),
                                RelationType.EQ, Formula.bool(false)),
                        "double_free_check");
            }
            ctx.restore(mark);
            ctx.setFacts(before.join(ctx.getFacts()));
        }

        private void visitTry(Statement.Try tryStmt) {
            PathFacts before = ctx.forkFacts();
            visitBlock(tryStmt.getBody());
            PathFacts joined = ctx.getFacts();
            for (CatchClause clause : tryStmt.getCatchClauses()) {
                ctx.setFacts(before.copy());
                if (clause.getVariable() != null) {
                    ctx.getFacts().markInitialized(clause.getVariable());
                }
                visitBlock(clause.getBody());
                joined = joined.join(ctx.getFacts());
            }
            ctx.setFacts(joined);
        }

        // --- 表达式 ---

        private void visitExpression(Expression expr) {
            if (expr instanceof Expression.Binary bin) {
                visitArithmetic(bin.getOp(), bin.getLeft(), bin.getRight());
            } else if (expr instanceof Expression.Unary un) {
                visitExpression(un.getOperand());
            } else if (expr instanceof Expression.Variable v) {
                visitVariable(v.getName());
            } else if (expr instanceof Expression.ToolCall call) {
                visitCall(call);
            } else if (expr instanceof Expression.Ternary ternary) {
                visitTernary(ternary);
            } else if (expr instanceof Expression.IndexAccess access) {
                visitIndex(access);
            } else if (expr instanceof Expression.FieldAccess access) {
                int before = ctx.vcCount();
                Formula object = ExpressionTranslator.translate(access.getObject());
                ctx.emit(VCCategory.NULL_POINTER_CHECK,
                        String.format("Object '%s' must not be null before accessing field '%s'", object, access.getField()),
                        Formula.compare(object, RelationType.NE, Formula.NONE), "null_check");
                covered(before);
                visitExpression(access.getObject());
            } else if (expr instanceof Expression.TypeAnnotation annotation) {
                visitAnnotation(annotation);
            } else if (expr instanceof Expression.Grouping g) {
                visitExpression(g.getInner());
            } else if (expr instanceof Expression.ArrayLiteral array) {
                array.getElements().forEach(this::visitExpression);
            } else if (expr instanceof Expression.ObjectLiteral object) {
                object.getFields().values().forEach(this::visitExpression);
            } else if (expr instanceof Expression.Range range) {
                visitExpression(range.getStart());
                visitExpression(range.getEnd());
            } else if (expr instanceof Expression.Lambda lambda) {
                // lambda 体不在定义处执行，参数视为已初始化，体内的事实不外泄
                PathFacts before = ctx.forkFacts();
                lambda.getParams().forEach(ctx.getFacts()::markInitialized);
                visitExpression(lambda.getBody());
                ctx.setFacts(before);
            }
            // 字面量不产生验证条件
        }

        private void visitVariable(String name) {
            if (LOCAL_PREFIXES.stream().anyMatch(name::startsWith) && !ctx.getFacts().isInitialized(name)) {
                int before = ctx.vcCount();
                ctx.emit(VCCategory.UNINITIALIZED_MEMORY,
                        String.format("Variable '%s' may be used before initialization", name),
                        Formula.pred("initialized", Formula.var(name)), "initialization_check");
                covered(before);
            }
        }

        private void visitArithmetic(BinaryOp op, Expression left, Expression right) {
            int before = ctx.vcCount();
            switch (op) {
                case DIV, MOD -> division(op, left, right);
                case SUB -> underflow(left, right);
                case ADD, MUL -> overflow(op, left, right);
                default -> {
                }
            }
            covered(before);
            visitExpression(left);
            visitExpression(right);
        }

        private void division(BinaryOp op, Expression left, Expression right) {
            if (!properties.isDivisionSafety()) {
                ctx.recordUncovered(op.getSymbol(), "division_safety disabled");
                return;
            }
            Optional<BigInteger> divisor = ToolCallRules.literal(right);
            if (divisor.isPresent() && divisor.get().signum() == 0) {
                ctx.emit(VCCategory.DIVISION_SAFETY, "Division by literal zero is always unsafe!",
                        Formula.FALSE, "exact absurd rfl (by decide)");
                return;
            }
            if (left instanceof Expression.IntLiteral && divisor.isPresent()) {
                return;
            }
            Formula d = ExpressionTranslator.translate(right);
            ctx.emit(VCCategory.DIVISION_SAFETY, String.format("Division by '%s' must be non-zero", d),
                    Formula.compare(d, RelationType.NE, Formula.constant(0)),
                    divisor.isPresent() ? "decide" : "ovsm_div_safe");
            if (divisor.isEmpty()) {
                Formula l = ExpressionTranslator.translate(left);
                ctx.emit(VCCategory.ARITHMETIC_PRECISION,
                        String.format("Integer division %s/%s truncates - consider if precision loss is acceptable", l, d),
                        Formula.pred("precision_acceptable", l, d), "precision_check");
            }
        }

        private void underflow(Expression left, Expression right) {
            if (isStatic(left, right)) {
                return;
            }
            boolean relevant = BalanceHeuristics.isBalanceOperation(left, right)
                    || properties.isStrictArithmetic() || properties.isBalanceSafety();
            if (!relevant) {
                return;
            }
            if (!properties.isUnderflowCheck()) {
                ctx.recordUncovered("-", "underflow_check disabled");
                return;
            }
            Formula l = ExpressionTranslator.translate(left);
            Formula r = ExpressionTranslator.translate(right);
            ctx.emit(VCCategory.ARITHMETIC_UNDERFLOW, String.format("Subtraction '%s' - '%s' must not underflow", l, r),
                    Formula.compare(Formula.field(l, "toNat"), RelationType.GE, Formula.field(r, "toNat")),
                    "ovsm_sub_safe");
        }

        private void overflow(BinaryOp op, Expression left, Expression right) {
            if (isStatic(left, right)) {
                return;
            }
            if (!BalanceHeuristics.isBalanceOperation(left, right) && !properties.isStrictArithmetic()) {
                return;
            }
            if (!properties.isOverflowCheck()) {
                ctx.recordUncovered(op.getSymbol(), "overflow_check disabled");
                return;
            }
            Formula l = ExpressionTranslator.translate(left);
            Formula r = ExpressionTranslator.translate(right);
            boolean add = op == BinaryOp.ADD;
            ctx.emit(VCCategory.ARITHMETIC_OVERFLOW,
                    String.format(add ? "Addition '%s' + '%s' must not overflow u64"
                            : "Multiplication '%s' * '%s' must not overflow u64", l, r),
                    Formula.compare(Formula.arith(add ? ArithOp.ADD : ArithOp.MUL, l, r), RelationType.LE,
                            Formula.constant(U64_MAX)),
                    add ? "ovsm_add_safe" : "ovsm_mul_safe");
        }

        private void visitIndex(Expression.IndexAccess access) {
            int before = ctx.vcCount();
            Formula array = ExpressionTranslator.translate(access.getArray());
            Formula index = ExpressionTranslator.translate(access.getIndex());
            ctx.emit(VCCategory.NULL_POINTER_CHECK,
                    String.format("Array '%s' must not be null before indexing", array),
                    Formula.compare(array, RelationType.NE, Formula.NONE), "null_check");
            if (properties.isArrayBounds()) {
                ctx.emit(VCCategory.ARRAY_BOUNDS,
                        String.format("Array index '%s' must be within bounds of '%s'", index, array),
                        Formula.compare(index, RelationType.LT, Formula.field(array, "size")), "ovsm_in_bounds");
            } else {
                ctx.recordUncovered("index", "array_bounds disabled");
            }
            covered(before);
            visitExpression(access.getArray());
            visitExpression(access.getIndex());
        }

        private void visitAnnotation(Expression.TypeAnnotation annotation) {
            visitExpression(annotation.getExpr());
            if (!(annotation.getTypeExpr() instanceof Expression.RefinedTypeExpr refined)) {
                return;
            }
            if (!properties.isRefinementTypes()) {
                ctx.recordUncovered("refinement", "refinement_types disabled");
                return;
            }
            int before = ctx.vcCount();
            Formula value = ExpressionTranslator.translate(annotation.getExpr());
            Formula predicate = ExpressionTranslator.translateCondition(refined.getPredicate())
                    .substitute(refined.getVar(), value);
            ctx.emit(VCCategory.REFINEMENT_TYPE,
                    "Value must satisfy refinement predicate: " + predicate.renderBare(),
                    predicate, "ovsm_refine_literal");
            covered(before);
        }

        private void visitTernary(Expression.Ternary ternary) {
            visitExpression(ternary.getCondition());
            Formula condition = ExpressionTranslator.translateCondition(ternary.getCondition());
            PathFacts before = ctx.forkFacts();
            int mark = ctx.mark();
            assume(condition);
            visitExpression(ternary.getThenExpr());
            ctx.restore(mark);
            PathFacts thenFacts = ctx.getFacts();
            ctx.setFacts(before.copy());
            assume(negate(condition));
            visitExpression(ternary.getElseExpr());
            ctx.restore(mark);
            ctx.setFacts(thenFacts.join(ctx.getFacts()));
        }

        private void visitCall(Expression.ToolCall call) {
            String name = call.getName();
            if ("assume".equals(name)) {
                // 运行时无操作，只把实参作为事实交给证明器
                if (call.hasArgs(1)) {
                    assume(ExpressionTranslator.translateCondition(call.arg(0)));
                }
                return;
            }
            if (INVARIANT_CALLS.contains(name)) {
                return;
            }
            BinaryOp operator = arithmeticOperator(name);
            if (operator != null && call.arity() == 2) {
                visitArithmetic(operator, call.arg(0), call.arg(1));
                return;
            }

            boolean invoke = ToolCallRules.isInvokeLike(name);
            if (invoke) {
                ctx.enterCpi();
            }
            int before = ctx.vcCount();
            rules.apply(call);
            covered(before);

            String callee = "funcall".equals(name) || "apply".equals(name) ? ToolCallRules.calleeName(call) : null;
            if (callee != null) {
                ctx.pushCall(callee);
            }
            for (Argument arg : call.getArgs()) {
                visitExpression(arg.getValue());
            }
            if (callee != null) {
                ctx.popCall();
            }
            if (invoke) {
                ctx.exitCpi();
            }
        }

        // --- 余额守恒 ---

        private void emitBalanceConservation() {
            List<Pair<BigInteger, Formula>> deltas = ctx.getLamportDeltas();
            if (deltas.isEmpty()) {
                return;
            }
            if (!properties.isBalanceSafety()) {
                ctx.recordUncovered("set-lamports", "balance_safety disabled");
                return;
            }
            Formula sum = null;
            for (Pair<BigInteger, Formula> delta : deltas) {
                Formula change = Formula.arith(ArithOp.SUB, delta.getRight(),
                        ToolCallRules.table("lamports_before", delta.getLeft()));
                sum = sum == null ? change : Formula.arith(ArithOp.ADD, sum, change);
            }
            ctx.emit(VCCategory.BALANCE_CONSERVATION, "Total lamports must be conserved (no minting/burning)",
                    Formula.compare(sum, RelationType.EQ, Formula.constant(0)), "balance_conservation");
            ctx.countCovered();
        }

        // --- 辅助方法 ---

        /**
         * 压入一条假设，并从其中肯定出现的账户查询里学习路径事实。
         */
        private void assume(Formula condition) {
            ctx.pushAssumption(condition);
            for (Formula fact : condition.positiveConjuncts()) {
                learnFact(fact);
            }
        }

        private void learnFact(Formula fact) {
            PathFacts facts = ctx.getFacts();
            if (fact.getKind() == Formula.Kind.APP && !fact.getArgs().isEmpty()) {
                Optional<BigInteger> account = fact.getArgs().get(0).asInteger();
                if (account.isEmpty()) {
                    return;
                }
                if (SIGNER_QUERIES.contains(fact.getName())) {
                    facts.markSigner(account.get());
                } else if (WRITABLE_QUERIES.contains(fact.getName())) {
                    facts.markWritable(account.get());
                } else if (OWNER_CHECKS.contains(fact.getName())) {
                    facts.markOwner(account.get());
                }
                return;
            }
            if (fact.getKind() == Formula.Kind.CMP && fact.getRelation() == RelationType.EQ) {
                learnOwner(fact.left());
                learnOwner(fact.right());
                if (fact.right().isTriviallyTrue()) {
                    learnFact(fact.left());
                    learnTable(fact.left());
                }
            }
        }

        private void learnOwner(Formula side) {
            if (side.getKind() == Formula.Kind.APP && "account-owner".equals(side.getName()) && !side.getArgs().isEmpty()) {
                side.getArgs().get(0).asInteger().ifPresent(ctx.getFacts()::markOwner);
            }
        }

        private void learnTable(Formula side) {
            if (side.getKind() != Formula.Kind.INDEX || !side.left().isVariable()) {
                return;
            }
            Optional<BigInteger> account = side.right().asInteger();
            if (account.isEmpty()) {
                return;
            }
            switch (side.left().getName()) {
                case "account_is_signer" -> ctx.getFacts().markSigner(account.get());
                case "account_is_writable" -> ctx.getFacts().markWritable(account.get());
                default -> {
                }
            }
        }

        private void covered(int vcCountBefore) {
            if (ctx.vcCount() > vcCountBefore) {
                ctx.countCovered();
            }
        }

        private void learnArray(String name, Expression value) {
            BigInteger size = value instanceof Expression.ArrayLiteral array ? BigInteger.valueOf(array.size()) : null;
            learn(arraySizes, conflictingArrays, name, size);
        }

        /**
         * 一个名字只有在所有绑定都给出同一个值时才记入表中。
         */
        private void learn(Map<String, BigInteger> table, Set<String> conflicts, String name, BigInteger value) {
            if (conflicts.contains(name)) {
                return;
            }
            if (value == null) {
                table.remove(name);
                conflicts.add(name);
                return;
            }
            BigInteger previous = table.putIfAbsent(name, value);
            if (previous != null && !previous.equals(value)) {
                logger.debug("{} 绑定了不同的值 {} 与 {}，不再作为已知量", name, previous, value);
                table.remove(name);
                conflicts.add(name);
            }
        }
    }

    // --- 无状态的辅助函数 ---

    private static Formula negate(Formula condition) {
        return condition.getKind() == Formula.Kind.NOT ? condition.getArgs().get(0) : Formula.not(condition);
    }

    private static boolean isStatic(Expression left, Expression right) {
        return left instanceof Expression.IntLiteral && right instanceof Expression.IntLiteral;
    }

    private static BinaryOp arithmeticOperator(String name) {
        return switch (name) {
            case "+" -> BinaryOp.ADD;
            case "-" -> BinaryOp.SUB;
            case "*" -> BinaryOp.MUL;
            case "/" -> BinaryOp.DIV;
            case "%", "mod" -> BinaryOp.MOD;
            default -> null;
        };
    }

    /**
     * 分支是否一定以返回、跳出或报错结束。
     */
    static boolean exits(List<Statement> block) {
        if (block.isEmpty()) {
            return false;
        }
        Statement last = block.get(block.size() - 1);
        if (last instanceof Statement.Return || last instanceof Statement.Break || last instanceof Statement.Continue) {
            return true;
        }
        if (last instanceof Statement.ExpressionStatement exprStmt
                && exprStmt.getExpression() instanceof Expression.ToolCall call) {
            return EXIT_CALLS.contains(call.getName());
        }
        if (last instanceof Statement.If ifStmt && ifStmt.hasElse()) {
            return exits(ifStmt.getThenBranch()) && exits(ifStmt.getElseBranch());
        }
        return false;
    }

    /**
     * 循环体中 (invariant e) 或 (@invariant e) 标注的不变式。
     */
    static List<Formula> extractInvariants(List<Statement> body) {
        List<Formula> invariants = new ArrayList<>();
        for (Statement statement : body) {
            if (statement instanceof Statement.ExpressionStatement exprStmt
                    && exprStmt.getExpression() instanceof Expression.ToolCall call
                    && INVARIANT_CALLS.contains(call.getName()) && call.hasArgs(1)) {
                invariants.add(ExpressionTranslator.translateCondition(call.arg(0)));
            }
        }
        return invariants;
    }

    /**
     * 块内 (含嵌套块) 被赋值的所有名字。
     */
    static Set<String> assignedVariables(List<Statement> block) {
        Set<String> names = new LinkedHashSet<>();
        collectAssigned(block, names);
        return names;
    }

    private static void collectAssigned(List<Statement> block, Set<String> out) {
        for (Statement statement : block) {
            if (statement instanceof Statement.Assignment assignment) {
                out.add(assignment.getName());
            } else if (statement instanceof Statement.ConstantDef def) {
                out.add(def.getName());
            } else if (statement instanceof Statement.If ifStmt) {
                collectAssigned(ifStmt.getThenBranch(), out);
                if (ifStmt.hasElse()) {
                    collectAssigned(ifStmt.getElseBranch(), out);
                }
            } else if (statement instanceof Statement.While loop) {
                collectAssigned(loop.getBody(), out);
            } else if (statement instanceof Statement.For loop) {
                out.add(loop.getVariable());
                collectAssigned(loop.getBody(), out);
            } else if (statement instanceof Statement.Guard guard) {
                collectAssigned(guard.getElseBody(), out);
            } else if (statement instanceof Statement.Try tryStmt) {
                collectAssigned(tryStmt.getBody(), out);
                for (CatchClause clause : tryStmt.getCatchClauses()) {
                    collectAssigned(clause.getBody(), out);
                }
            }
        }
    }

    /**
     * 不变式是否只依赖循环体不会改变的整数变量。调用、事实表和字段的值可能被循环体中的副作用改变。
     */
    static boolean isStable(Formula invariant, Set<String> changing) {
        return switch (invariant.getKind()) {
            case VAR -> !changing.contains(invariant.getName());
            case INT, BOOL, FALSUM, STR, NULL -> true;
            case FIELD -> "size".equals(invariant.getName()) && isStable(invariant.getArgs().get(0), changing);
            case NEG, ARITH, CMP, AND, OR, NOT, IMPLIES ->
                    invariant.getArgs().stream().allMatch(arg -> isStable(arg, changing));
            default -> false;
        };
    }
}
