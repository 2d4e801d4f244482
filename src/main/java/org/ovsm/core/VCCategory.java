package org.ovsm.core;

import lombok.Getter;

/**
 * 验证条件的风险类别。类别决定生成哪些检查，也决定证明器用哪个过程处理。
 * {@link #CUSTOM} 是开放的扩展类别，具体名字保存在 {@link VerificationCondition#getCustomName()} 中。
 */
@Getter
public enum VCCategory {
    DIVISION_SAFETY("division_safety"),
    ARRAY_BOUNDS("array_bounds"),
    ARITHMETIC_OVERFLOW("overflow"),
    ARITHMETIC_UNDERFLOW("underflow"),
    REFINEMENT_TYPE("refinement"),
    BALANCE_CONSERVATION("balance"),
    SIGNER_CHECK("signer"),
    WRITABILITY_CHECK("writable"),
    INSTRUCTION_DATA_BOUNDS("instr_data"),
    ACCOUNT_OWNER_CHECK("account_owner"),
    PDA_SEED_CHECK("pda_seed"),
    RENT_EXEMPT_CHECK("rent_exempt"),
    REENTRANCY_CHECK("reentrancy"),
    INTEGER_TRUNCATION("truncation"),
    NULL_POINTER_CHECK("null_ptr"),
    UNINITIALIZED_MEMORY("uninit_mem"),
    DOUBLE_FREE("double_free"),
    ACCOUNT_DATA_BOUNDS("account_data"),
    LOOP_INVARIANT("loop_invariant"),
    DISCRIMINATOR_CHECK("discriminator"),
    SYSVAR_CHECK("sysvar"),
    FUNCTION_CALL_SAFETY("func_call"),
    TOKEN_ACCOUNT_OWNER_CHECK("token_account_owner"),
    MINT_AUTHORITY_CHECK("mint_authority"),
    BUFFER_OVERFLOW_CHECK("buffer_overflow"),
    BUFFER_UNDERRUN_CHECK("buffer_underrun"),
    CLOSE_AUTHORITY_CHECK("close_authority"),
    ACCOUNT_CLOSE_DRAIN("account_close_drain"),
    BUMP_SEED_CANONICAL("bump_canonical"),
    ACCOUNT_REALLOC("account_realloc"),
    CPI_DEPTH_CHECK("cpi_depth"),
    SIGNER_PRIVILEGE_ESCALATION("signer_escalation"),
    TYPE_CONFUSION("type_confusion"),
    ARITHMETIC_PRECISION("precision"),
    ACCOUNT_DATA_MUTABILITY("data_mutability"),
    PDA_COLLISION("pda_collision"),
    INSTRUCTION_INTROSPECTION("instr_introspection"),
    FLASH_LOAN_DETECTION("flash_loan"),
    ORACLE_MANIPULATION("oracle_manipulation"),
    FRONT_RUNNING("front_running"),
    TIMELOCK_BYPASS("timelock_bypass"),
    REENTRANCY_GUARD("reentrancy_guard"),
    OPTION_UNWRAP("option_unwrap"),
    CUSTOM("custom");

    private final String displayName;

    VCCategory(String displayName) {
        this.displayName = displayName;
    }

    /**
     * 性质是否落在线性整数算术片段内，可以交给 SMT 复核。
     */
    public boolean isArithmetic() {
        return switch (this) {
            case DIVISION_SAFETY, ARRAY_BOUNDS, ARITHMETIC_OVERFLOW, ARITHMETIC_UNDERFLOW,
                    INTEGER_TRUNCATION, ACCOUNT_REALLOC, REFINEMENT_TYPE,
                    INSTRUCTION_DATA_BOUNDS, ACCOUNT_DATA_BOUNDS, LOOP_INVARIANT -> true;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return displayName;
    }
}
