package org.ovsm.generator;

import org.ovsm.ast.Expression;
import org.ovsm.core.VCCategory;
import org.ovsm.expressions.ArithOp;
import org.ovsm.expressions.ExpressionTranslator;
import org.ovsm.expressions.Formula;
import org.ovsm.expressions.RelationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 工具调用的前置条件表：按被调用者的名字生成固定的一组验证条件。
 * 已在当前路径上建立的账户事实 (见 {@link PathFacts}) 会抑制对应的签名者/可写/所有者检查。
 * 实参的递归访问由 {@link VCGenerator} 负责，这里只处理调用本身。
 * @author Ayalyt
 */
final class ToolCallRules {

    private static final Logger logger = LoggerFactory.getLogger(ToolCallRules.class);

    static final BigInteger U8_MAX = BigInteger.valueOf(255);
    static final BigInteger U16_MAX = BigInteger.valueOf(65535);
    static final BigInteger U32_MAX = BigInteger.valueOf(4294967295L);
    static final BigInteger MAX_REALLOC = BigInteger.valueOf(10485760);
    static final int MAX_CPI_DEPTH = 4;
    // 账户数据前 8 字节为判别码/头部
    private static final BigInteger HEADER_SIZE = BigInteger.valueOf(8);

    private static final Set<String> INVOKE_CALLS = Set.of(
            "invoke", "invoke-signed", "cpi-call", "cpi-invoke", "cpi-invoke-signed");
    private static final Set<String> ACCOUNT_QUERIES = Set.of(
            "account-data-ptr", "account-lamports", "account-owner", "account-pubkey",
            "account-is-signer", "account-is-writable", "account-data-len", "account-executable");
    private static final Set<String> ORACLE_CALLS = Set.of(
            "get-price", "get-oracle-price", "read-price-feed", "get-pyth-price", "get-switchboard-price");
    private static final Set<String> TIMELOCK_CALLS = Set.of("check-timelock", "verify-timelock", "assert-timelock");
    private static final Set<String> LOCK_ACQUIRE = Set.of("acquire-lock", "with-lock", "enter-critical-section");
    private static final Set<String> LOCK_RELEASE = Set.of("release-lock", "exit-critical-section");
    private static final Set<String> UNWRAP_CALLS = Set.of("unwrap", "unwrap!", "expect", "force-unwrap");
    private static final Set<String> ORDERING_CALLS = Set.of("swap", "trade", "exchange", "liquidate");
    private static final Set<String> INTROSPECTION_CALLS = Set.of(
            "get-instruction", "get-instruction-data", "get-processed-sibling-instruction");
    private static final Set<String> TOKEN_FLOW_CALLS = Set.of(
            "spl-token-transfer", "spl-token-transfer-signed", "system-transfer");

    private final AnalysisContext ctx;
    private final VerificationProperties properties;

    ToolCallRules(AnalysisContext ctx, VerificationProperties properties) {
        this.ctx = ctx;
        this.properties = properties;
    }

    static boolean isInvokeLike(String name) {
        return INVOKE_CALLS.contains(name);
    }

    /**
     * 生成调用 call 本身要求的验证条件。
     */
    void apply(Expression.ToolCall call) {
        String name = call.getName();
        switch (name) {
            case "get", "nth", "elt", "aref" -> indexedAccess(call);
            case "mem-load" -> memLoad(call, 8, "Memory load at offset '%s' must be in bounds");
            case "mem-load1" -> memLoad(call, 1, "Memory load (1 byte) at offset '%s' must be in bounds");
            case "mem-load2" -> memLoad(call, 2, "Memory load (2 bytes) at offset '%s' must be in bounds");
            case "mem-load4" -> memLoad(call, 4, "Memory load (4 bytes) at offset '%s' must be in bounds");
            case "mem-store" -> memStore(call, 8, null);
            case "mem-store1" -> memStore(call, 1, U8_MAX);
            case "mem-store2" -> memStore(call, 2, U16_MAX);
            case "mem-store4" -> memStore(call, 4, U32_MAX);
            case "set-lamports" -> setLamports(call);
            case "spl-token-transfer" -> tokenTransfer(call);
            case "spl-token-transfer-signed" -> signedTokenTransfer(call);
            case "spl-token-mint-to" -> mintTo(call);
            case "spl-token-burn" -> burn(call);
            case "spl-close-account" -> splCloseAccount(call);
            case "spl-close-account-signed" -> signedCloseAccount(call);
            case "close-account" -> closeAccount(call);
            case "system-transfer" -> requireSigner(literal(call.arg(0)),
                    "Source account %s must be signer for system transfer");
            case "system-create-account" -> requireSigner(literal(call.arg(0)),
                    "Payer account %s must be signer for create account");
            case "system-allocate" -> requireSigner(literal(call.arg(0)), "Account %s must be signer for allocate");
            case "system-assign" -> requireSigner(literal(call.arg(0)), "Account %s must be signer for assign");
            case "borsh-serialize" -> borshSerialize(call);
            case "borsh-deserialize" -> borshDeserialize(call);
            case "realloc" -> realloc(call);
            case "find-program-address", "create-program-address" -> programAddress(call);
            case "check-discriminator" -> checkDiscriminator(call);
            case "assert-account-type" -> assertAccountType(call);
            case "check-sysvar" -> checkSysvar(call);
            case "funcall", "apply" -> recursiveCall(call);
            default -> {
                if (isInvokeLike(name)) {
                    invoke(call);
                }
            }
        }
        sysvarRead(call);
        accountQuery(call);
        heuristics(call);
    }

    // --- 数组与内存 ---

    private void indexedAccess(Expression.ToolCall call) {
        if (!call.hasArgs(2)) {
            return;
        }
        if (!properties.isArrayBounds()) {
            ctx.recordUncovered(call.getName(), "array_bounds disabled");
            return;
        }
        Formula array = translate(call.arg(0));
        Formula index = translate(call.arg(1));
        ctx.emit(VCCategory.ARRAY_BOUNDS,
                String.format("Index '%s' must be within bounds of '%s'", index, array),
                Formula.compare(index, RelationType.LT, Formula.field(array, "size")), "ovsm_in_bounds");
    }

    private void memLoad(Expression.ToolCall call, int width, String description) {
        if (!call.hasArgs(2)) {
            return;
        }
        if (!properties.isArrayBounds()) {
            ctx.recordUncovered(call.getName(), "array_bounds disabled");
            return;
        }
        Formula offset = translate(call.arg(1));
        ctx.emit(VCCategory.INSTRUCTION_DATA_BOUNDS, String.format(description, offset),
                Formula.compare(plus(offset, width), RelationType.LE, Formula.var("instruction_data_len")),
                "omega");
    }

    /**
     * (mem-storeN (account-data-ptr idx) offset value)
     */
    private void memStore(Expression.ToolCall call, int width, BigInteger valueMax) {
        if (!call.hasArgs(3)) {
            return;
        }
        String name = call.getName();
        String suffix = "mem-store".equals(name) ? "before mem-store" : "for " + name;
        Optional<BigInteger> account = dataPointerAccount(call.arg(0));
        if (account.isPresent()) {
            BigInteger idx = account.get();
            if (!ctx.getFacts().isWritable(idx)) {
                ctx.emit(VCCategory.WRITABILITY_CHECK,
                        "mem-store".equals(name)
                                ? String.format("Account %s must be verified writable before mem-store", idx)
                                : String.format("Account %s must be writable %s", idx, suffix),
                        isTrue("account_is_writable", idx), "by_assumption");
            }
            if (!ctx.getFacts().isOwner(idx)) {
                ctx.emit(VCCategory.ACCOUNT_OWNER_CHECK,
                        "mem-store".equals(name)
                                ? String.format("Program must own account %s before writing", idx)
                                : String.format("Program must own account %s %s", idx, suffix),
                        Formula.compare(table("account_owner", idx), RelationType.EQ, Formula.var("program_id")),
                        "by_assumption");
            }
        }
        Formula offset = translate(call.arg(1));
        Formula dataLength = account
                .map(idx -> Formula.app("account-data-len", Formula.constant(idx)))
                .orElse(Formula.var("account_data_len"));
        ctx.emit(VCCategory.ACCOUNT_DATA_BOUNDS,
                "mem-store".equals(name)
                        ? String.format("mem-store offset '%s' must be within account data bounds", offset)
                        : String.format("%s offset '%s' must be in bounds", name, offset),
                Formula.compare(plus(offset, width), RelationType.LE, dataLength), "omega");
        if (valueMax != null) {
            Formula value = translate(call.arg(2));
            ctx.emit(VCCategory.INTEGER_TRUNCATION,
                    String.format("Value '%s' must fit in u%d (0-%s) for %s", value, width * 8, valueMax, name),
                    Formula.compare(value, RelationType.LE, Formula.constant(valueMax)), "truncation_check");
        }
        Optional<BigInteger> literalOffset = literal(call.arg(1));
        if (literalOffset.isPresent() && literalOffset.get().compareTo(HEADER_SIZE) < 0) {
            ctx.emit(VCCategory.ACCOUNT_DATA_MUTABILITY,
                    String.format("Write to offset %s may modify immutable discriminator/header", literalOffset.get()),
                    Formula.pred("mutable_region", Formula.constant(literalOffset.get())), "mutability_check");
        }
    }

    private static Optional<BigInteger> dataPointerAccount(Expression target) {
        if (target instanceof Expression.ToolCall ptr && "account-data-ptr".equals(ptr.getName())) {
            return literal(ptr.arg(0));
        }
        return Optional.empty();
    }

    // --- 账户变更 ---

    private void setLamports(Expression.ToolCall call) {
        Optional<BigInteger> account = literal(call.arg(0));
        if (account.isEmpty()) {
            return;
        }
        BigInteger idx = account.get();
        requireSigner(account, "Account %s should be verified as signer before lamport change");
        if (!ctx.getFacts().isWritable(idx)) {
            ctx.emit(VCCategory.WRITABILITY_CHECK,
                    String.format("Account %s must be writable before set-lamports", idx),
                    isTrue("account_is_writable", idx), "by_assumption");
        }
        if (call.hasArgs(2)) {
            ctx.recordLamportDelta(idx, translate(call.arg(1)));
        }
    }

    private void tokenTransfer(Expression.ToolCall call) {
        // token_program, source, dest, authority, amount
        if (!call.hasArgs(5)) {
            return;
        }
        requireSigner(literal(call.arg(3)), "Authority account %s must be signer for token transfer");
        tokenOwner(call);
    }

    private void signedTokenTransfer(Expression.ToolCall call) {
        ctx.emit(VCCategory.PDA_SEED_CHECK, "PDA seeds for signed token transfer must be valid",
                Formula.pred("pda_seeds_valid"), "by_assumption");
        tokenOwner(call);
    }

    private void tokenOwner(Expression.ToolCall call) {
        literal(call.arg(1)).ifPresent(source -> ctx.emit(VCCategory.TOKEN_ACCOUNT_OWNER_CHECK,
                String.format("Source token account %s must be owned by SPL Token program", source),
                Formula.compare(table("account_owner", source), RelationType.EQ, Formula.var("TOKEN_PROGRAM_ID")),
                "token_owner_check"));
    }

    private void mintTo(Expression.ToolCall call) {
        // token_program, mint, dest, authority, amount
        if (!call.hasArgs(4)) {
            return;
        }
        Optional<BigInteger> authority = literal(call.arg(3));
        requireSigner(authority, "Mint authority account %s must be signer");
        Optional<BigInteger> mint = literal(call.arg(1));
        if (mint.isPresent() && authority.isPresent()) {
            ctx.emit(VCCategory.MINT_AUTHORITY_CHECK,
                    String.format("Account %s must be mint authority for mint %s", authority.get(), mint.get()),
                    Formula.compare(table("mint_authority", mint.get()), RelationType.EQ,
                            table("account_pubkey", authority.get())),
                    "mint_authority_check");
        }
    }

    private void burn(Expression.ToolCall call) {
        if (call.hasArgs(4)) {
            requireSigner(literal(call.arg(3)), "Burn authority account %s must be signer");
        }
    }

    private void splCloseAccount(Expression.ToolCall call) {
        if (!call.hasArgs(3)) {
            return;
        }
        literal(call.arg(2)).filter(idx -> !ctx.getFacts().isSigner(idx)).ifPresent(idx ->
                ctx.emit(VCCategory.CLOSE_AUTHORITY_CHECK,
                        String.format("Close authority account %s must be signer", idx),
                        isTrue("account_is_signer", idx), "by_assumption"));
    }

    private void signedCloseAccount(Expression.ToolCall call) {
        ctx.emit(VCCategory.PDA_SEED_CHECK, "PDA seeds for signed close must be valid",
                Formula.pred("pda_seeds_valid"), "by_assumption");
        literal(call.arg(1)).ifPresent(idx -> {
            if (ctx.getFacts().markClosed(idx)) {
                ctx.emit(VCCategory.DOUBLE_FREE, String.format("Account %s may be closed twice", idx),
                        isFalse("account_closed", idx), "double_free_check");
            }
        });
    }

    /**
     * (close-account idx [destination])
     */
    private void closeAccount(Expression.ToolCall call) {
        Optional<BigInteger> account = literal(call.arg(0));
        if (account.isEmpty()) {
            return;
        }
        BigInteger idx = account.get();
        requireSigner(account, "Close authority for account %s must be verified as signer");
        if (!ctx.getFacts().isWritable(idx)) {
            ctx.emit(VCCategory.WRITABILITY_CHECK, String.format("Account %s must be writable to close", idx),
                    isTrue("account_is_writable", idx), "by_assumption");
        }
        if (ctx.getFacts().markClosed(idx)) {
            ctx.emit(VCCategory.DOUBLE_FREE, String.format("Account %s may be closed twice (double-free)", idx),
                    isFalse("account_closed", idx), "double_free_check");
        }
        if (call.hasArgs(2)) {
            ctx.emit(VCCategory.ACCOUNT_CLOSE_DRAIN,
                    String.format("Lamports from closed account %s must drain to valid destination", idx),
                    Formula.pred("close_destination_valid", Formula.constant(idx), translate(call.arg(1))),
                    "close_drain_check");
        } else {
            ctx.emit(VCCategory.ACCOUNT_CLOSE_DRAIN,
                    String.format("Account %s close must specify lamport destination (lamports would be lost)", idx),
                    Formula.compare(Formula.var("close_has_destination"), RelationType.EQ, Formula.TRUE),
                    "close_drain_check");
        }
    }

    // --- 序列化与 realloc ---

    private void borshSerialize(Expression.ToolCall call) {
        if (!call.hasArgs(2)) {
            return;
        }
        Formula buffer = translate(call.arg(1));
        ctx.emit(VCCategory.BUFFER_OVERFLOW_CHECK,
                String.format("Buffer '%s' must have sufficient capacity for serialization", buffer),
                Formula.compare(Formula.pred("buffer_capacity", buffer), RelationType.GE,
                        Formula.var("serialized_size")), "buffer_check");
    }

    private void borshDeserialize(Expression.ToolCall call) {
        if (!call.hasArgs(1)) {
            return;
        }
        Formula buffer = translate(call.arg(0));
        ctx.emit(VCCategory.BUFFER_UNDERRUN_CHECK,
                String.format("Buffer '%s' must have sufficient data for deserialization", buffer),
                Formula.compare(Formula.pred("buffer_len", buffer), RelationType.GE,
                        Formula.var("expected_size")), "buffer_check");
        ctx.emit(VCCategory.TYPE_CONFUSION,
                String.format("Deserialized data from '%s' must match expected account type", buffer),
                Formula.pred("deserialize_type_matches", buffer), "type_check");
    }

    private void realloc(Expression.ToolCall call) {
        if (!call.hasArgs(2)) {
            return;
        }
        Formula account = translate(call.arg(0));
        Formula size = translate(call.arg(1));
        ctx.emit(VCCategory.ACCOUNT_REALLOC,
                String.format("Account realloc to size '%s' must be within limits (max 10MB)", size),
                Formula.and(Formula.compare(size, RelationType.LE, Formula.constant(MAX_REALLOC)),
                        Formula.compare(size, RelationType.GE, Formula.constant(0))),
                "realloc_check");
        ctx.emit(VCCategory.RENT_EXEMPT_CHECK,
                String.format("Account '%s' must maintain rent exemption after realloc to %s", account, size),
                Formula.compare(Formula.pred("lamports", account), RelationType.GE,
                        Formula.pred("rent_exempt_minimum", size)), "rent_check");
    }

    // --- CPI 与 PDA ---

    /**
     * 深度由 {@link VCGenerator} 在访问实参前递增，这里读到的是包含本次调用的静态嵌套深度。
     */
    private void invoke(Expression.ToolCall call) {
        int depth = ctx.getCpiDepth();
        if (depth > 1) {
            ctx.emit(VCCategory.REENTRANCY_CHECK, "Nested CPI call detected - potential reentrancy",
                    Formula.compare(Formula.var("cpi_depth"), RelationType.LE, Formula.constant(1)),
                    "manual_review");
        }
        if (call.hasArgs(1)) {
            Formula program = translate(call.arg(0));
            ctx.emitCustom("cpi_program",
                    String.format("CPI target program '%s' must be expected program", program),
                    Formula.compare(program, RelationType.EQ, Formula.var("expected_program_id")),
                    "by_assumption");
            if (call.getName().endsWith("-signed")) {
                ctx.emit(VCCategory.SIGNER_PRIVILEGE_ESCALATION,
                        String.format("Signer seeds passed to '%s' - ensure target program is trusted", program),
                        Formula.pred("is_trusted_program", program), "trust_check");
            }
        }
        if (depth > MAX_CPI_DEPTH) {
            logger.debug("CPI 嵌套深度 {} 超过上限 {}", depth, MAX_CPI_DEPTH);
            ctx.emit(VCCategory.CPI_DEPTH_CHECK,
                    String.format("CPI depth %d exceeds Solana limit of %d", depth, MAX_CPI_DEPTH),
                    Formula.compare(Formula.constant(depth), RelationType.LE, Formula.constant(MAX_CPI_DEPTH)),
                    "depth_check");
        }
    }

    private void programAddress(Expression.ToolCall call) {
        ctx.emit(VCCategory.PDA_SEED_CHECK, "PDA derivation must use correct seeds",
                Formula.pred("pda_seeds_valid"), "by_assumption");
        if ("create-program-address".equals(call.getName()) && call.hasArgs(2)
                && call.getArgs().stream().anyMatch(a -> a.getValue() instanceof Expression.IntLiteral)) {
            ctx.emit(VCCategory.BUMP_SEED_CANONICAL,
                    "PDA bump seed should be canonical (from find_program_address)",
                    Formula.pred("bump_is_canonical"), "bump_check");
        }
        if (call.hasArgs(1)) {
            Formula seeds = translate(call.arg(0));
            ctx.emit(VCCategory.PDA_COLLISION,
                    String.format("PDA seeds '%s' must be unique to prevent collisions", seeds),
                    Formula.pred("pda_seeds_unique", seeds), "collision_check");
        }
    }

    // --- 账户类型与系统变量 ---

    private void checkDiscriminator(Expression.ToolCall call) {
        Optional<BigInteger> account = literal(call.arg(0));
        if (account.isEmpty() || !call.hasArgs(2)) {
            return;
        }
        Formula discriminator = translate(call.arg(1));
        ctx.emit(VCCategory.DISCRIMINATOR_CHECK,
                String.format("Account %s must have discriminator '%s'", account.get(), discriminator),
                Formula.compare(table("account_discriminator", account.get()), RelationType.EQ, discriminator),
                "discriminator_check");
    }

    private void assertAccountType(Expression.ToolCall call) {
        Optional<BigInteger> account = literal(call.arg(0));
        if (account.isEmpty() || !call.hasArgs(2)) {
            return;
        }
        Formula type = translate(call.arg(1));
        ctx.emit(VCCategory.DISCRIMINATOR_CHECK,
                String.format("Account %s must be of type '%s'", account.get(), type),
                Formula.compare(table("account_type", account.get()), RelationType.EQ, type), "type_check");
    }

    private void sysvarRead(Expression.ToolCall call) {
        String sysvar = switch (call.getName()) {
            case "get-clock" -> "Clock";
            case "get-rent" -> "Rent";
            case "get-epoch-schedule" -> "EpochSchedule";
            case "get-fees" -> "Fees";
            case "get-recent-blockhashes" -> "RecentBlockhashes";
            case "get-stake-history" -> "StakeHistory";
            case "get-instructions" -> "Instructions";
            default -> null;
        };
        if (sysvar == null) {
            return;
        }
        literal(call.arg(0)).ifPresent(idx -> sysvarCheck(idx, sysvar,
                String.format("Account %s must be the %s sysvar", idx, sysvar)));
    }

    private void checkSysvar(Expression.ToolCall call) {
        Optional<BigInteger> account = literal(call.arg(0));
        if (account.isEmpty() || !call.hasArgs(2)) {
            return;
        }
        String sysvar = sysvarName(call.arg(1));
        sysvarCheck(account.get(), sysvar, String.format("Account %s must be sysvar '%s'", account.get(), sysvar));
    }

    private void sysvarCheck(BigInteger idx, String sysvar, String description) {
        String key = sysvar + "@" + idx;
        if (ctx.getFacts().isSysvarVerified(key)) {
            return;
        }
        ctx.emit(VCCategory.SYSVAR_CHECK, description,
                Formula.compare(table("account_pubkey", idx), RelationType.EQ,
                        Formula.var("SYSVAR_" + sysvar.toUpperCase(Locale.ROOT) + "_PUBKEY")),
                "sysvar_check");
        ctx.getFacts().markSysvar(key);
    }

    private static String sysvarName(Expression expr) {
        if (expr instanceof Expression.StringLiteral s) {
            return s.getValue();
        }
        if (expr instanceof Expression.Variable v) {
            return v.getName();
        }
        return expr.toString();
    }

    private void accountQuery(Expression.ToolCall call) {
        if (!ACCOUNT_QUERIES.contains(call.getName()) || !call.hasArgs(1)) {
            return;
        }
        if (!properties.isArrayBounds()) {
            ctx.recordUncovered(call.getName(), "array_bounds disabled");
            return;
        }
        Formula index = translate(call.arg(0));
        ctx.emit(VCCategory.ARRAY_BOUNDS,
                String.format("Account index '%s' must be valid (< num_accounts)", index),
                Formula.compare(index, RelationType.LT, Formula.var("num_accounts")), "omega");
    }

    private void recursiveCall(Expression.ToolCall call) {
        String function = calleeName(call);
        if (function != null && ctx.isOnCallStack(function)) {
            ctx.emit(VCCategory.FUNCTION_CALL_SAFETY,
                    String.format("Recursive call to '%s' - verify termination", function),
                    Formula.pred("terminates", Formula.var(function)), "termination_check");
        }
    }

    /**
     * funcall/apply 的目标函数名，不是名字时返回 null。
     */
    static String calleeName(Expression.ToolCall call) {
        Expression target = call.arg(0);
        if (target instanceof Expression.Variable v) {
            return v.getName();
        }
        if (target instanceof Expression.StringLiteral s && !s.getValue().isEmpty()) {
            return s.getValue();
        }
        return null;
    }

    // --- 启发式类别 ---

    private void heuristics(Expression.ToolCall call) {
        String name = call.getName();
        if (INTROSPECTION_CALLS.contains(name)) {
            ctx.emit(VCCategory.INSTRUCTION_INTROSPECTION, "Instruction introspection requires valid Instructions sysvar",
                    Formula.pred("instructions_sysvar_valid"), "sysvar_check");
        }
        if (TOKEN_FLOW_CALLS.contains(name) && ctx.recordTokenFlow() >= 2) {
            ctx.emit(VCCategory.FLASH_LOAN_DETECTION,
                    "Multiple token transfers detected - verify not vulnerable to flash loans",
                    Formula.pred("flash_loan_safe"), "flash_loan_check");
        }
        if (ORACLE_CALLS.contains(name)) {
            ctx.emit(VCCategory.ORACLE_MANIPULATION, "Oracle price data must be checked for staleness",
                    Formula.pred("oracle_data_fresh"), "oracle_check");
        }
        if (TIMELOCK_CALLS.contains(name)) {
            ctx.emit(VCCategory.TIMELOCK_BYPASS, "Timelock constraint must be enforced",
                    Formula.pred("timelock_enforced"), "timelock_check");
        }
        if (LOCK_ACQUIRE.contains(name)) {
            ctx.getFacts().setLockHeld(true);
        }
        if (LOCK_RELEASE.contains(name)) {
            if (!ctx.getFacts().isLockHeld()) {
                ctx.emit(VCCategory.REENTRANCY_GUARD, "Lock released without acquisition",
                        Formula.pred("lock_acquired_before_release"), "lock_check");
            }
            ctx.getFacts().setLockHeld(false);
        }
        if (UNWRAP_CALLS.contains(name)) {
            ctx.emit(VCCategory.OPTION_UNWRAP, "Unwrap may panic if value is None/Null",
                    Formula.pred("value_is_some"), "unwrap_check");
        }
        if (ORDERING_CALLS.contains(name)) {
            ctx.emit(VCCategory.FRONT_RUNNING, "Operation may be vulnerable to front-running/sandwich attacks",
                    Formula.pred("front_running_protected"), "ordering_check");
        }
    }

    // --- 辅助方法 ---

    private void requireSigner(Optional<BigInteger> account, String description) {
        account.filter(idx -> !ctx.getFacts().isSigner(idx)).ifPresent(idx ->
                ctx.emit(VCCategory.SIGNER_CHECK, String.format(description, idx),
                        isTrue("account_is_signer", idx), "by_assumption"));
    }

    static Optional<BigInteger> literal(Expression expr) {
        if (expr instanceof Expression.IntLiteral lit) {
            return Optional.of(lit.getValue());
        }
        return Optional.empty();
    }

    static Formula table(String table, BigInteger idx) {
        return Formula.index(Formula.var(table), Formula.constant(idx));
    }

    private static Formula isTrue(String table, BigInteger idx) {
        return Formula.compare(table(table, idx), RelationType.EQ, Formula.TRUE);
    }

    private static Formula isFalse(String table, BigInteger idx) {
        return Formula.compare(table(table, idx), RelationType.EQ, Formula.bool(false));
    }

    private static Formula plus(Formula term, int width) {
        return Formula.arith(ArithOp.ADD, term, Formula.constant(width));
    }

    private static Formula translate(Expression expr) {
        return ExpressionTranslator.translate(expr);
    }
}
