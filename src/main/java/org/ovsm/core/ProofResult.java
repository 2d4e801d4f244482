package org.ovsm.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 证明器对一条验证条件给出的结论。
 * <ul>
 *   <li>PROVED: 性质在所有执行上成立</li>
 *   <li>ADVISORY: 启发式类别，在没有反例证据时放行但附带警告，不等同于安全证明</li>
 *   <li>DISPROVED: 性质确定不成立，附带反例</li>
 *   <li>UNKNOWN: 证据不足，附带可操作的原因</li>
 * </ul>
 */
@Getter
public final class ProofResult {

    public enum Status {
        PROVED,
        ADVISORY,
        DISPROVED,
        UNKNOWN
    }

    /**
     * 得出结论的过程。
     */
    public enum Method {
        BUILTIN,
        Z3
    }

    private final Status status;
    private final Method method;
    // PROVED/ADVISORY 时为证明概要，DISPROVED 时为反例，UNKNOWN 时为原因
    private final String detail;
    private final String explanation;

    private ProofResult(Status status, Method method, String detail, String explanation) {
        this.status = Objects.requireNonNull(status, "Proof status cannot be null");
        this.method = Objects.requireNonNull(method, "Proof method cannot be null");
        this.detail = Objects.requireNonNull(detail, "Proof detail cannot be null");
        this.explanation = explanation == null ? "" : explanation;
    }

    public static ProofResult proved(String proof, String explanation) {
        return new ProofResult(Status.PROVED, Method.BUILTIN, proof, explanation);
    }

    public static ProofResult provedByDecide(String explanation) {
        return proved("decide", explanation);
    }

    public static ProofResult provedByOmega(String explanation) {
        return proved("omega", explanation);
    }

    public static ProofResult provedByAssumption(String hypothesis, String explanation) {
        return proved("exact " + hypothesis, explanation);
    }

    public static ProofResult provedBySmt(String explanation) {
        return new ProofResult(Status.PROVED, Method.Z3, "omega", explanation);
    }

    public static ProofResult advisory(String warning) {
        return new ProofResult(Status.ADVISORY, Method.BUILTIN, "advisory", warning);
    }

    public static ProofResult disproved(String counterexample) {
        return new ProofResult(Status.DISPROVED, Method.BUILTIN, counterexample, null);
    }

    public static ProofResult unknown(String reason) {
        return new ProofResult(Status.UNKNOWN, Method.BUILTIN, reason, null);
    }

    public boolean isProved() {
        return status == Status.PROVED;
    }

    /**
     * PROVED 或 ADVISORY：不阻止后续流程。
     */
    public boolean isDischarged() {
        return status == Status.PROVED || status == Status.ADVISORY;
    }

    public boolean isDisproved() {
        return status == Status.DISPROVED;
    }

    public boolean isUnknown() {
        return status == Status.UNKNOWN;
    }

    public String getProof() {
        return isDischarged() ? detail : null;
    }

    public String getCounterexample() {
        return status == Status.DISPROVED ? detail : null;
    }

    public String getReason() {
        return status == Status.UNKNOWN ? detail : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProofResult that)) {
            return false;
        }
        return status == that.status && method == that.method
                && detail.equals(that.detail) && explanation.equals(that.explanation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, method, detail, explanation);
    }

    @Override
    public String toString() {
        return switch (status) {
            case PROVED -> "Proved(" + detail + (explanation.isEmpty() ? "" : ": " + explanation) + ")";
            case ADVISORY -> "Advisory(" + explanation + ")";
            case DISPROVED -> "Disproved(" + detail + ")";
            case UNKNOWN -> "Unknown(" + detail + ")";
        };
    }
}
