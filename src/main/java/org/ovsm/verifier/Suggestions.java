package org.ovsm.verifier;

import org.ovsm.core.VCCategory;

/**
 * 失败验证条件的修复建议。没有固定建议的类别返回 null。
 */
public final class Suggestions {

    private Suggestions() {
    }

    public static String forCategory(VCCategory category) {
        return switch (category) {
            case DIVISION_SAFETY ->
                    "Add a check before division: (if (= divisor 0) (error \"Division by zero\") (/ x divisor))";
            case ARRAY_BOUNDS ->
                    "Add a bounds check: (if (>= idx (len arr)) (error \"Index out of bounds\") (get arr idx))";
            case ARITHMETIC_UNDERFLOW ->
                    "Add a balance check: (if (< balance amount) (error \"Insufficient funds\") (- balance amount))";
            case ARITHMETIC_OVERFLOW -> "Consider using checked arithmetic or adding bounds checks";
            case REFINEMENT_TYPE -> "Ensure the value satisfies the refinement predicate";
            case BALANCE_CONSERVATION -> "Verify that total lamports are preserved in transfers";
            case SIGNER_CHECK, CLOSE_AUTHORITY_CHECK ->
                    "Verify the account signed the transaction: (if (not (account-is-signer idx)) (error \"Missing signature\") ...)";
            case WRITABILITY_CHECK ->
                    "Verify the account is writable: (if (not (account-is-writable idx)) (error \"Account not writable\") ...)";
            case ACCOUNT_OWNER_CHECK ->
                    "Check ownership before writing: (if (!= (account-owner idx) (program-id)) (error \"Wrong owner\") ...)";
            case DOUBLE_FREE -> "Close each account at most once on every path";
            case CPI_DEPTH_CHECK -> "Reduce nesting of cross-program invocations to at most 4 levels";
            default -> null;
        };
    }
}
