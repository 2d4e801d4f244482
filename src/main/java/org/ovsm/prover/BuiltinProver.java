package org.ovsm.prover;

import com.microsoft.z3.Z3Exception;
import lombok.Getter;
import org.ovsm.core.ProofResult;
import org.ovsm.core.VCCategory;
import org.ovsm.core.VerificationCondition;
import org.ovsm.expressions.ArithOp;
import org.ovsm.expressions.Formula;
import org.ovsm.expressions.RelationType;
import org.ovsm.symbolic.PathCondition;
import org.ovsm.symbolic.SymbolicEnvironment;
import org.ovsm.symbolic.SymbolicValue;
import org.ovsm.symbolic.Z3Oracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 内置证明器：按类别分派的判定过程。
 * <p>
 * 每次证明都在基础环境的副本上进行，验证条件自带的假设只影响这一次证明，
 * 因此对同一条件重复调用得到相同结果。顺序为：字面量折叠，区间推理 (环境值与路径条件)，
 * 符号比较，最后是假设中的正面证据。算术类别在仍然 UNKNOWN 时可以交给 Z3 复核。
 * <p>
 * DISPROVED 只在性质确定为假时给出，例如两侧都是已知常量且比较不成立。
 * @author Ayalyt
 */
public final class BuiltinProver implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BuiltinProver.class);

    private static final Set<String> SIGNER_CALLS = Set.of("account-is-signer", "is-signer");
    private static final Set<String> WRITABLE_CALLS = Set.of("account-is-writable", "is-writable");
    private static final Set<String> OWNER_CALLS = Set.of("check-owner", "assert-owner");
    private static final Set<String> TOKEN_OWNER_CALLS = Set.of("check-token-account", "assert-token-account");
    private static final Set<String> DISCRIMINATOR_CALLS = Set.of("check-discriminator", "assert-account-type");
    private static final Set<String> SYSVAR_CALLS = Set.of("check-sysvar");
    private static final Set<String> MINT_AUTHORITY_CALLS = Set.of("check-mint-authority", "assert-mint-authority");
    private static final Set<String> SOME_CALLS = Set.of("is-some", "some?", "is_some");
    private static final Set<String> INITIALIZED_CALLS = Set.of("initialized", "is-initialized");

    @Getter
    private final SymbolicEnvironment environment;
    @Getter
    private boolean smtFallback;
    private int smtTimeoutMillis = 5000;
    private Z3Oracle oracle;
    private boolean oracleUnavailable;

    public BuiltinProver() {
        this.environment = new SymbolicEnvironment();
    }

    // --- 环境 ---

    public void define(String variable, SymbolicValue value) {
        environment.define(variable, value);
    }

    public void defineConstant(String variable, BigInteger value) {
        environment.define(variable, SymbolicValue.constant(value));
    }

    public void defineArray(String array, BigInteger size) {
        environment.defineArray(array, size);
    }

    public void defineArray(String array, long size) {
        environment.defineArray(array, size);
    }

    public void pushPathCondition(PathCondition condition) {
        environment.pushPathCondition(condition);
    }

    public PathCondition popPathCondition() {
        return environment.popPathCondition();
    }

    /**
     * 开启 Z3 复核。Z3 本地库不可用时记录警告并退回纯内置判定。
     */
    public void enableSmtFallback(int timeoutMillis) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("SMT timeout must be positive: " + timeoutMillis);
        }
        this.smtFallback = true;
        this.smtTimeoutMillis = timeoutMillis;
    }

    // --- 证明 ---

    public ProofResult prove(VerificationCondition vc) {
        Objects.requireNonNull(vc, "Verification condition cannot be null");
        SymbolicEnvironment env = environment.copy();
        for (PathCondition condition : AssumptionParser.parseAll(vc.getAssumptions())) {
            env.pushPathCondition(condition);
        }
        AssumptionEvidence evidence = new AssumptionEvidence(vc.getAssumptions());
        ProofResult result = dispatch(vc, env, evidence);
        if (result.isUnknown() && smtFallback && vc.getCategory().isArithmetic()) {
            result = checkWithSmt(vc, env, result);
        }
        logger.debug("{} [{}] {} → {}", vc.getId(), vc.getCategoryName(), vc.getPropertyText(), result);
        return result;
    }

    private ProofResult dispatch(VerificationCondition vc, SymbolicEnvironment env, AssumptionEvidence evidence) {
        Formula property = vc.getProperty();
        return switch (vc.getCategory()) {
            case DIVISION_SAFETY -> proveDivision(property, env, evidence);
            case ARRAY_BOUNDS -> proveBounds(property, env, evidence);
            case ARITHMETIC_UNDERFLOW -> proveUnderflow(property, env, evidence);
            case ARITHMETIC_OVERFLOW -> proveArithmetic(property, env, evidence, String.format(
                    "Cannot prove '%s' fits in u64 - add upper bounds for the operands", lhs(property)));
            case INTEGER_TRUNCATION -> proveArithmetic(property, env, evidence, String.format(
                    "Cannot prove value '%s' fits in the target width - add a range check before the narrow store",
                    lhs(property)));
            case ACCOUNT_REALLOC -> proveArithmetic(property, env, evidence,
                    "Cannot prove realloc size within limits (max 10MB) - add size bound assumption");
            case INSTRUCTION_DATA_BOUNDS -> proveArithmetic(property, env, evidence,
                    "Cannot prove instruction data access within bounds - "
                            + "add (assume (>= (instruction-data-len) N)) before reading");
            case ACCOUNT_DATA_BOUNDS -> proveArithmetic(property, env, evidence,
                    "Cannot prove account data bounds - add (assume (>= (account-data-len N) M)) for account N");
            case REFINEMENT_TYPE -> proveArithmetic(property, env, evidence, String.format(
                    "Cannot prove refinement predicate '%s' - add (assume ...) to establish the property",
                    property.renderBare()));
            case LOOP_INVARIANT -> proveLoopInvariant(property, env, evidence);
            case SIGNER_CHECK, CLOSE_AUTHORITY_CHECK -> proveSigner(vc, property, evidence);
            case WRITABILITY_CHECK -> account(property)
                    .filter(idx -> evidence.callsOn(idx, WRITABLE_CALLS) || evidence.holds(property))
                    .map(idx -> ProofResult.provedByAssumption("h_writable_check",
                            "account " + idx + " checked writable on this path"))
                    .orElseGet(() -> ProofResult.unknown("Account writability not verified - "
                            + "call (account-is-writable idx) and check result before writing"));
            case ACCOUNT_OWNER_CHECK -> proveOwner(property, evidence);
            case TOKEN_ACCOUNT_OWNER_CHECK -> proveTokenOwner(property, evidence);
            case DISCRIMINATOR_CHECK -> account(property)
                    .filter(idx -> evidence.holds(property) || evidence.callsOn(idx, DISCRIMINATOR_CALLS))
                    .map(idx -> ProofResult.provedByAssumption("h_discriminator",
                            "discriminator of account " + idx + " checked on this path"))
                    .orElseGet(() -> ProofResult.unknown("Account discriminator not verified - "
                            + "use (check-discriminator account expected_bytes) before accessing account data"));
            case SYSVAR_CHECK -> account(property)
                    .filter(idx -> evidence.holds(property) || evidence.callsOn(idx, SYSVAR_CALLS))
                    .map(idx -> ProofResult.provedByAssumption("h_sysvar",
                            "account " + idx + " checked against the sysvar id"))
                    .orElseGet(() -> ProofResult.unknown(
                            "Sysvar account not verified - ensure account pubkey matches expected sysvar"));
            case MINT_AUTHORITY_CHECK -> account(property)
                    .filter(mint -> evidence.holds(property) || evidence.callsOn(mint, MINT_AUTHORITY_CALLS))
                    .map(mint -> ProofResult.provedByAssumption("h_mint_authority",
                            "mint authority of mint " + mint + " checked on this path"))
                    .orElseGet(() -> ProofResult.unknown(
                            "Mint authority not verified - ensure mint_authority matches expected account"));
            case NULL_POINTER_CHECK -> proveNotNull(property, env, evidence);
            case UNINITIALIZED_MEMORY -> proveInitialized(property, evidence);
            case OPTION_UNWRAP -> provedIf(evidence.mentionsAny("is-some", "is_some", "some?") || hasNotNoneFact(evidence),
                    "h_not_null", "value checked to be present before unwrap",
                    "Unwrap may panic - check (is-some value) or compare against nil before unwrapping");
            case DOUBLE_FREE -> ProofResult.disproved(String.format(
                    "Account %s may be closed twice - ensure close is called only once per account",
                    account(property).map(BigInteger::toString).orElse("?")));
            case CPI_DEPTH_CHECK -> proveCpiDepth(property);
            case REENTRANCY_CHECK -> ProofResult.unknown("Nested CPI detected - review for reentrancy vulnerabilities");
            case PDA_SEED_CHECK -> ProofResult.provedByAssumption("h_solana_runtime",
                    "runtime check: the runtime rejects invalid PDA seeds");
            case RENT_EXEMPT_CHECK -> ProofResult.provedByAssumption("h_solana_runtime",
                    "runtime check: the runtime rejects non rent-exempt accounts");
            case BALANCE_CONSERVATION -> evidence.mentionsAny("balance_conserved", "lamports_conserved")
                    ? ProofResult.provedByAssumption("h_balance", "conservation asserted on this path")
                    : ProofResult.provedByAssumption("h_solana_runtime",
                    "runtime check: Solana runtime enforces lamport conservation");
            case FUNCTION_CALL_SAFETY -> provedIf(evidence.holds(property)
                            || evidence.mentionsAny("terminates", "safe_call"),
                    "h_terminates", "termination asserted on this path",
                    "Recursive function call detected - prove termination or add decreasing argument");
            case BUFFER_OVERFLOW_CHECK -> proveWithEvidence(property, env, evidence,
                    new String[]{"buffer_capacity", "buffer-capacity", "buffer_size", "buffer-size"}, "h_buffer",
                    "Buffer capacity not verified - ensure buffer has sufficient space for serialization");
            case BUFFER_UNDERRUN_CHECK -> proveWithEvidence(property, env, evidence,
                    new String[]{"buffer_len", "buffer-len"}, "h_buffer",
                    "Buffer length not verified - ensure buffer has sufficient data for deserialization");
            case ACCOUNT_CLOSE_DRAIN -> provedIf(evidence.holds(property)
                            || evidence.mentionsAny("close_destination", "drain_to"),
                    "h_close_destination", "close destination validated on this path",
                    "Account close must specify valid lamport destination - lamports would be lost");
            case BUMP_SEED_CANONICAL -> provedIf(evidence.mentionsAny("canonical_bump", "find-program-address",
                            "find_program_address"),
                    "h_canonical_bump", "bump comes from find-program-address",
                    "PDA bump should be canonical (from find_program_address) - hardcoded bumps can be exploited");
            case SIGNER_PRIVILEGE_ESCALATION -> provedIf(evidence.holds(property)
                            || evidence.mentionsAny("is_trusted_program", "trusted_program", "is-trusted"),
                    "h_trusted_program", "CPI target is trusted on this path",
                    "Signer seeds passed to potentially untrusted program - verify CPI target is trusted");
            case TYPE_CONFUSION -> provedIf(evidence.mentionsAny("check-discriminator", "assert-account-type",
                            "type_check", "deserialize_type"),
                    "h_type_check", "account type verified before deserialization",
                    "Deserialized type not verified - use check-discriminator to verify account type before deserialization");
            case INSTRUCTION_INTROSPECTION -> provedIf(evidence.mentionsAny("instructions_sysvar", "SYSVAR_INSTRUCTIONS"),
                    "h_sysvar_instructions", "Instructions sysvar verified on this path",
                    "Instruction introspection requires valid Instructions sysvar - verify sysvar account");
            case ORACLE_MANIPULATION -> provedIf(evidence.mentionsAny("oracle_fresh", "price_valid",
                            "staleness_check", "max_age", "oracle_data_fresh"),
                    "h_oracle_fresh", "oracle freshness checked on this path",
                    "Oracle data freshness not verified - add staleness check before using price");
            case TIMELOCK_BYPASS -> provedIf(evidence.mentionsAny("timelock", "delay_enforced"),
                    "h_timelock", "time restriction enforced on this path",
                    "Timelock constraint not verified - ensure time-based restrictions are enforced");
            case REENTRANCY_GUARD -> provedIf(evidence.mentionsAny("lock_held", "guard_active", "lock_acquired"),
                    "h_lock_held", "lock held on this path",
                    "Reentrancy guard not properly acquired - ensure lock is held before release");
            case ARITHMETIC_PRECISION -> heuristic(evidence, "h_precision",
                    "Division result may lose precision - multiply before dividing or check the remainder",
                    "precision_ok", "no_precision_loss", "precision_acceptable");
            case PDA_COLLISION -> heuristic(evidence, "h_unique_seeds",
                    "PDA seeds may collide with another derivation - include a unique discriminator seed",
                    "unique_seeds", "collision_free", "pda_seeds_unique");
            case FLASH_LOAN_DETECTION -> heuristic(evidence, "h_flash_loan",
                    "Multiple token transfers in one instruction - check for flash loan manipulation",
                    "flash_loan_safe", "no_flash_loan", "atomic_check", "reentrancy_guard");
            case FRONT_RUNNING -> heuristic(evidence, "h_front_running",
                    "Operation may be vulnerable to front-running - add slippage or deadline checks",
                    "slippage", "min_amount", "deadline", "front_running_safe");
            case ACCOUNT_DATA_MUTABILITY -> heuristic(evidence, "h_mutable_region",
                    "Write may modify immutable region - ensure offset is in mutable data area",
                    "mutable_region", "writable_region");
            case CUSTOM -> proveCustom(vc, property, evidence);
        };
    }

    // --- 算术类别 ---

    private ProofResult proveDivision(Formula property, SymbolicEnvironment env, AssumptionEvidence evidence) {
        if (property.getKind() == Formula.Kind.FALSUM) {
            return ProofResult.disproved("division by literal zero: divisor is 0");
        }
        if (property.getKind() == Formula.Kind.CMP) {
            ProofResult result = proveComparison(property, env, evidence);
            if (result != null) {
                return result;
            }
        }
        String divisor = lhs(property);
        return ProofResult.unknown(String.format("Cannot prove divisor '%s' is non-zero - "
                + "guard the division with (if (> %s 0) ...) or add (assume (!= %s 0))", divisor, divisor, divisor));
    }

    /**
     * idx < bound，bound 为 arr.size 或 num_accounts。除了上界还要求下标非负。
     */
    private ProofResult proveBounds(Formula property, SymbolicEnvironment env, AssumptionEvidence evidence) {
        if (property.getKind() != Formula.Kind.CMP) {
            return ProofResult.unknown("Unsupported bounds property: " + property.renderBare());
        }
        Formula index = property.left();
        Range indexRange = range(index, env);
        Range boundRange = range(property.right(), env);
        if (indexRange.isPoint() && indexRange.lo.signum() < 0) {
            return ProofResult.disproved(String.format("index %s is negative (out of bounds)", indexRange.lo));
        }
        if (indexRange.isPoint() && boundRange.isPoint() && indexRange.lo.compareTo(boundRange.lo) >= 0) {
            return ProofResult.disproved(String.format("index %s >= size %s (out of bounds)",
                    indexRange.lo, boundRange.lo));
        }
        ProofResult upper = proveComparison(property, env, evidence);
        if (upper != null && upper.isDisproved()) {
            return upper;
        }
        if (upper != null) {
            if (indexRange.lo != null && indexRange.lo.signum() >= 0) {
                return upper;
            }
            return ProofResult.unknown(String.format(
                    "Index '%s' may be negative - add (assume (>= %s 0))", index.render(), index.render()));
        }
        return ProofResult.unknown(String.format("Cannot prove index '%s' < '%s' - add a bounds check before access",
                index.render(), property.right().render()));
    }

    /**
     * l.toNat ≥ r.toNat。l ≥ r 蕴含该性质，因此也尝试去掉 toNat 后证明。
     */
    private ProofResult proveUnderflow(Formula property, SymbolicEnvironment env, AssumptionEvidence evidence) {
        if (property.getKind() != Formula.Kind.CMP) {
            return ProofResult.unknown("Unsupported underflow property: " + property.renderBare());
        }
        ProofResult result = proveComparison(property, env, evidence);
        if (result != null) {
            return result;
        }
        Formula left = stripToNat(property.left());
        Formula right = stripToNat(property.right());
        ProofResult inner = proveComparison(Formula.compare(left, RelationType.GE, right), env, evidence);
        if (inner != null && inner.isProved()) {
            return inner;
        }
        return ProofResult.unknown(String.format("Cannot prove '%s' >= '%s' - add (assume (>= %s %s)) "
                + "or check the balance before subtracting", left.render(), right.render(), left.render(), right.render()));
    }

    /**
     * 比较或比较的合取：逐项证明，任一项确定为假即为 DISPROVED。
     */
    private ProofResult proveArithmetic(Formula property, SymbolicEnvironment env, AssumptionEvidence evidence,
                                        String reason) {
        if (evidence.holds(property)) {
            return ProofResult.provedByAssumption("h_assume", "property assumed on this path");
        }
        List<ProofResult> parts = new ArrayList<>();
        for (Formula conjunct : property.conjuncts()) {
            if (conjunct.getKind() != Formula.Kind.CMP) {
                if (evidence.holds(conjunct)) {
                    parts.add(ProofResult.provedByAssumption("h_assume", conjunct.renderBare() + " assumed"));
                    continue;
                }
                return ProofResult.unknown(reason);
            }
            ProofResult part = proveComparison(conjunct, env, evidence);
            if (part == null) {
                return ProofResult.unknown(reason);
            }
            if (part.isDisproved()) {
                return part;
            }
            parts.add(part);
        }
        return parts.size() == 1 ? parts.get(0)
                : ProofResult.provedByOmega("all conjuncts of " + property.renderBare() + " hold");
    }

    /**
     * premise → conclusion。after_body(...) 表示结论依赖循环体修改过的状态，无法在此证明。
     */
    private ProofResult proveLoopInvariant(Formula property, SymbolicEnvironment env, AssumptionEvidence evidence) {
        String reason = "Loop invariant requires inductive proof - "
                + "add (invariant ...) annotation with proof or verify manually";
        if (property.getKind() != Formula.Kind.IMPLIES) {
            return ProofResult.unknown(reason);
        }
        Formula conclusion = property.right();
        if (conclusion.getKind() == Formula.Kind.PRED && "after_body".equals(conclusion.getName())) {
            return ProofResult.unknown(String.format("Loop invariant '%s' depends on state changed by the loop body - "
                    + "prove preservation manually", conclusion.getArgs().get(0).renderBare()));
        }
        List<Formula> premises = new ArrayList<>();
        for (Formula premise : property.left().positiveConjuncts()) {
            if (!(premise.getKind() == Formula.Kind.PRED && "entry".equals(premise.getName()))) {
                premises.add(premise);
            }
        }
        if (premises.contains(conclusion)) {
            return ProofResult.provedByAssumption("h_inv", "invariant is not affected by the loop body");
        }
        SymbolicEnvironment local = env.copy();
        for (Formula premise : premises) {
            AssumptionParser.parse(premise).forEach(local::pushPathCondition);
        }
        ProofResult result = proveArithmetic(conclusion, local, evidence.with(premises), reason);
        return result.isDisproved() && !premises.isEmpty() ? ProofResult.unknown(reason) : result;
    }

    // --- 比较引擎 ---

    /**
     * 判定单个比较。返回 null 表示内置过程无法判定。
     */
    private ProofResult proveComparison(Formula goal, SymbolicEnvironment env, AssumptionEvidence evidence) {
        Formula left = goal.left();
        Formula right = goal.right();
        RelationType relation = goal.getRelation();
        Optional<BigInteger> leftValue = fold(left);
        Optional<BigInteger> rightValue = fold(right);
        if (leftValue.isPresent() && rightValue.isPresent()) {
            return relation.test(leftValue.get(), rightValue.get())
                    ? ProofResult.provedByDecide(goal.renderBare() + " by computation")
                    : ProofResult.disproved(falsified(goal, leftValue.get(), rightValue.get()));
        }
        Range leftRange = range(left, env);
        Range rightRange = range(right, env);
        if (holds(relation, leftRange, rightRange)) {
            return ProofResult.provedByOmega(goal.renderBare() + " follows from known bounds");
        }
        if (leftRange.isPoint() && rightRange.isPoint() && !relation.test(leftRange.lo, rightRange.lo)) {
            return ProofResult.disproved(falsified(goal, leftRange.lo, rightRange.lo));
        }
        String leftKey = AssumptionParser.key(left);
        String rightKey = AssumptionParser.key(right);
        if (leftKey != null && rightKey != null && symbolic(relation, leftKey, rightKey, env)) {
            return ProofResult.provedByAssumption("h_path", goal.renderBare() + " follows from path conditions");
        }
        if (relation == RelationType.NE && leftKey != null && rightValue.map(v -> v.signum() == 0).orElse(false)
                && env.isNonZero(leftKey)) {
            return ProofResult.provedByAssumption("h_nonzero", leftKey + " is non-zero on this path");
        }
        if (evidence.holds(goal)) {
            return ProofResult.provedByAssumption("h_assume", goal.renderBare() + " assumed on this path");
        }
        return null;
    }

    private static boolean symbolic(RelationType relation, String left, String right, SymbolicEnvironment env) {
        return switch (relation) {
            case GE -> env.isGeq(left, right);
            case GT -> env.isLt(right, left);
            case LT -> env.isLt(left, right);
            case LE -> env.isGeq(right, left);
            case EQ -> env.isGeq(left, right) && env.isGeq(right, left);
            case NE -> env.isLt(left, right) || env.isLt(right, left);
        };
    }

    private static String falsified(Formula goal, BigInteger left, BigInteger right) {
        return String.format("%s is false: %s %s %s does not hold", goal.renderBare(), left,
                goal.getRelation().getLeanSymbol(), right);
    }

    /**
     * 只依赖字面量的常量折叠，不查询环境。
     */
    private static Optional<BigInteger> fold(Formula term) {
        return switch (term.getKind()) {
            case INT -> Optional.of(term.getValue());
            case NEG -> fold(term.getArgs().get(0)).map(BigInteger::negate);
            case ARITH -> {
                Optional<BigInteger> l = fold(term.left());
                Optional<BigInteger> r = fold(term.right());
                yield l.isPresent() && r.isPresent() ? term.getOp().apply(l.get(), r.get()) : Optional.empty();
            }
            case FIELD -> "toNat".equals(term.getName())
                    ? fold(term.getArgs().get(0)).map(v -> v.max(BigInteger.ZERO))
                    : Optional.empty();
            default -> Optional.empty();
        };
    }

    private static Range range(Formula term, SymbolicEnvironment env) {
        Optional<BigInteger> folded = fold(term);
        if (folded.isPresent()) {
            return Range.point(folded.get());
        }
        Range structural = switch (term.getKind()) {
            case VAR -> new Range(env.lowerBound(term.getName()).orElse(null),
                    env.upperBound(term.getName()).orElse(null));
            case NEG -> range(term.getArgs().get(0), env).negate();
            case FIELD -> fieldRange(term, env);
            case ARITH -> arithRange(term, env);
            default -> Range.TOP;
        };
        if (term.isVariable()) {
            return structural;
        }
        String key = term.render();
        return structural.intersect(new Range(env.lowerBound(key).orElse(null), env.upperBound(key).orElse(null)));
    }

    private static Range fieldRange(Formula term, SymbolicEnvironment env) {
        Formula object = term.getArgs().get(0);
        if ("size".equals(term.getName()) && object.isVariable()) {
            return env.arraySize(object.getName()).map(Range::point).orElse(Range.TOP);
        }
        if ("toNat".equals(term.getName())) {
            Range inner = range(object, env);
            BigInteger lo = inner.lo == null ? BigInteger.ZERO : inner.lo.max(BigInteger.ZERO);
            BigInteger hi = inner.hi == null ? null : inner.hi.max(BigInteger.ZERO);
            return new Range(lo, hi);
        }
        return Range.TOP;
    }

    private static Range arithRange(Formula term, SymbolicEnvironment env) {
        Range l = range(term.left(), env);
        Range r = range(term.right(), env);
        ArithOp op = term.getOp();
        return switch (op) {
            case ADD -> new Range(add(l.lo, r.lo), add(l.hi, r.hi));
            case SUB -> new Range(subtract(l.lo, r.hi), subtract(l.hi, r.lo));
            case MUL -> l.multiply(r);
            default -> Range.TOP;
        };
    }

    private static BigInteger add(BigInteger a, BigInteger b) {
        return a == null || b == null ? null : a.add(b);
    }

    private static BigInteger subtract(BigInteger a, BigInteger b) {
        return a == null || b == null ? null : a.subtract(b);
    }

    private static boolean holds(RelationType relation, Range l, Range r) {
        return switch (relation) {
            case LT -> l.hi != null && r.lo != null && l.hi.compareTo(r.lo) < 0;
            case LE -> l.hi != null && r.lo != null && l.hi.compareTo(r.lo) <= 0;
            case GT -> l.lo != null && r.hi != null && l.lo.compareTo(r.hi) > 0;
            case GE -> l.lo != null && r.hi != null && l.lo.compareTo(r.hi) >= 0;
            case EQ -> l.isPoint() && r.isPoint() && l.lo.equals(r.lo);
            case NE -> holds(RelationType.LT, l, r) || holds(RelationType.GT, l, r);
        };
    }

    /**
     * 闭区间，端点为 null 表示该方向无界。
     */
    private static final class Range {

        static final Range TOP = new Range(null, null);

        final BigInteger lo;
        final BigInteger hi;

        Range(BigInteger lo, BigInteger hi) {
            this.lo = lo;
            this.hi = hi;
        }

        static Range point(BigInteger value) {
            return new Range(value, value);
        }

        boolean isPoint() {
            return lo != null && lo.equals(hi);
        }

        boolean isBounded() {
            return lo != null && hi != null;
        }

        Range negate() {
            return new Range(hi == null ? null : hi.negate(), lo == null ? null : lo.negate());
        }

        Range intersect(Range other) {
            BigInteger newLo = lo == null ? other.lo : other.lo == null ? lo : lo.max(other.lo);
            BigInteger newHi = hi == null ? other.hi : other.hi == null ? hi : hi.min(other.hi);
            return new Range(newLo, newHi);
        }

        Range multiply(Range other) {
            if (isPoint() && other.isPoint()) {
                return point(lo.multiply(other.lo));
            }
            if (isPoint()) {
                return other.scale(lo);
            }
            if (other.isPoint()) {
                return scale(other.lo);
            }
            if (!isBounded() || !other.isBounded()) {
                return TOP;
            }
            List<BigInteger> products = List.of(lo.multiply(other.lo), lo.multiply(other.hi),
                    hi.multiply(other.lo), hi.multiply(other.hi));
            return new Range(products.stream().min(BigInteger::compareTo).orElseThrow(),
                    products.stream().max(BigInteger::compareTo).orElseThrow());
        }

        private Range scale(BigInteger factor) {
            if (factor.signum() == 0) {
                return point(BigInteger.ZERO);
            }
            BigInteger a = lo == null ? null : lo.multiply(factor);
            BigInteger b = hi == null ? null : hi.multiply(factor);
            return factor.signum() > 0 ? new Range(a, b) : new Range(b, a);
        }
    }

    // --- 协议类别 ---

    private ProofResult proveSigner(VerificationCondition vc, Formula property, AssumptionEvidence evidence) {
        Optional<BigInteger> idx = account(property);
        if (idx.isPresent() && (evidence.callsOn(idx.get(), SIGNER_CALLS) || evidence.holds(property))) {
            return ProofResult.provedByAssumption("h_signer_check", "account " + idx.get() + " checked signer on this path");
        }
        if (vc.getCategory() == VCCategory.CLOSE_AUTHORITY_CHECK) {
            return ProofResult.unknown("Close authority not verified - ensure close authority is signer");
        }
        return ProofResult.unknown("Signer not verified - ensure (account-is-signer N) is called before this operation");
    }

    private ProofResult proveOwner(Formula property, AssumptionEvidence evidence) {
        Optional<BigInteger> idx = account(property);
        if (idx.isPresent() && (evidence.holds(property)
                || evidence.queryEquals("account-owner", idx.get(), property.right())
                || evidence.callsOn(idx.get(), OWNER_CALLS))) {
            return ProofResult.provedByAssumption("h_owner_check", "owner of account " + idx.get() + " checked on this path");
        }
        return ProofResult.unknown("Account ownership not verified - "
                + "check (account-owner idx) = program_id before modifying account data");
    }

    private ProofResult proveTokenOwner(Formula property, AssumptionEvidence evidence) {
        Optional<BigInteger> idx = account(property);
        if (idx.isPresent() && (evidence.holds(property)
                || evidence.queryEquals("account-owner", idx.get(), property.right())
                || evidence.callsOn(idx.get(), TOKEN_OWNER_CALLS))) {
            return ProofResult.provedByAssumption("h_token_owner",
                    "account " + idx.get() + " checked to be owned by the token program");
        }
        return ProofResult.unknown("Token account ownership not verified - "
                + "check (account-owner idx) = TOKEN_PROGRAM_ID before token operations");
    }

    private ProofResult proveNotNull(Formula property, SymbolicEnvironment env, AssumptionEvidence evidence) {
        String reason = "Potential null pointer - add null check before dereferencing";
        if (property.getKind() != Formula.Kind.CMP) {
            return ProofResult.unknown(reason);
        }
        Formula subject = property.left();
        if (evidence.holds(property) || evidence.callsWith(subject, SOME_CALLS)) {
            return ProofResult.provedByAssumption("h_not_null", subject.render() + " checked non-null on this path");
        }
        if (subject.isVariable() && env.arraySize(subject.getName()).isPresent()) {
            return ProofResult.provedByAssumption("h_array_literal", subject.getName() + " is bound to an array literal");
        }
        return ProofResult.unknown(reason);
    }

    private ProofResult proveInitialized(Formula property, AssumptionEvidence evidence) {
        Formula subject = property.getArgs().isEmpty() ? null : property.getArgs().get(0);
        if (evidence.holds(property) || (subject != null && evidence.callsWith(subject, INITIALIZED_CALLS))) {
            return ProofResult.provedByAssumption("h_initialized", subject + " initialized on this path");
        }
        return ProofResult.unknown("Variable may be uninitialized - ensure it's assigned before use or mark as parameter");
    }

    private ProofResult proveCpiDepth(Formula property) {
        if (property.getKind() == Formula.Kind.CMP) {
            Optional<BigInteger> depth = fold(property.left());
            Optional<BigInteger> max = fold(property.right());
            if (depth.isPresent() && max.isPresent()) {
                return ProofResult.disproved(String.format("CPI depth %s exceeds the limit of %s", depth.get(), max.get()));
            }
        }
        return ProofResult.disproved("CPI depth exceeds the runtime limit");
    }

    private ProofResult proveCustom(VerificationCondition vc, Formula property, AssumptionEvidence evidence) {
        if (vc.isCustom("cpi_program")) {
            return provedIf(evidence.holds(property) || evidence.mentionsAny("expected_program"),
                    "h_cpi_program", "CPI target program checked on this path",
                    "CPI target program not verified - ensure program ID matches expected");
        }
        if (evidence.holds(property)) {
            return ProofResult.provedByAssumption("h_assume", "property assumed on this path");
        }
        return ProofResult.unknown("No decision procedure for category '" + vc.getCategoryName() + "'");
    }

    /**
     * 对缓冲区这类以谓词表示的量：先按比较证明，再看假设里是否直接给出了相关的量。
     */
    private ProofResult proveWithEvidence(Formula property, SymbolicEnvironment env, AssumptionEvidence evidence,
                                          String[] keywords, String hypothesis, String reason) {
        if (property.getKind() == Formula.Kind.CMP) {
            ProofResult result = proveComparison(property, env, evidence);
            if (result != null && result.isProved()) {
                return result;
            }
        }
        return provedIf(evidence.mentionsAny(keywords), hypothesis, "bound established on this path", reason);
    }

    private static ProofResult heuristic(AssumptionEvidence evidence, String hypothesis, String warning,
                                         String... keywords) {
        if (evidence.mentionsAny(keywords)) {
            return ProofResult.provedByAssumption(hypothesis, "explicitly asserted on this path");
        }
        return ProofResult.advisory(warning);
    }

    private static ProofResult provedIf(boolean established, String hypothesis, String explanation, String reason) {
        return established ? ProofResult.provedByAssumption(hypothesis, explanation) : ProofResult.unknown(reason);
    }

    private static boolean hasNotNoneFact(AssumptionEvidence evidence) {
        return evidence.getFacts().stream().anyMatch(f -> f.getKind() == Formula.Kind.CMP
                && f.getRelation() == RelationType.NE
                && (f.right().getKind() == Formula.Kind.NULL || f.left().getKind() == Formula.Kind.NULL));
    }

    /**
     * 从 table[N] = v 形式的性质中取出账户下标 N。
     */
    private static Optional<BigInteger> account(Formula property) {
        if (property.getKind() != Formula.Kind.CMP || property.left().getKind() != Formula.Kind.INDEX) {
            return Optional.empty();
        }
        return property.left().right().asInteger();
    }

    private static String lhs(Formula property) {
        return property.getKind() == Formula.Kind.CMP ? property.left().render() : property.render();
    }

    private static Formula stripToNat(Formula term) {
        return term.getKind() == Formula.Kind.FIELD && "toNat".equals(term.getName()) ? term.getArgs().get(0) : term;
    }

    // --- SMT 复核 ---

    private ProofResult checkWithSmt(VerificationCondition vc, SymbolicEnvironment env, ProofResult unknown) {
        Z3Oracle z3 = oracle();
        if (z3 == null) {
            return unknown;
        }
        List<Formula> assumptions = new ArrayList<>(vc.getAssumptions());
        Formula goal = vc.getProperty();
        if (goal.getKind() == Formula.Kind.IMPLIES) {
            assumptions.addAll(goal.left().conjuncts());
            goal = goal.right();
        }
        Z3Oracle.OracleResult verdict = z3.checkValidity(assumptions, goal, env);
        if (verdict == Z3Oracle.OracleResult.VALID) {
            return ProofResult.provedBySmt(goal.renderBare() + " is valid under the path assumptions (Z3)");
        }
        return unknown;
    }

    private Z3Oracle oracle() {
        if (oracle == null && !oracleUnavailable) {
            try {
                oracle = new Z3Oracle(smtTimeoutMillis);
            } catch (LinkageError | Z3Exception e) {
                logger.warn("Z3 不可用，关闭 SMT 复核: {}", e.getMessage());
                oracleUnavailable = true;
            }
        }
        return oracle;
    }

    @Override
    public void close() {
        if (oracle != null) {
            oracle.close();
            oracle = null;
        }
    }
}
