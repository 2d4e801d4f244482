package org.ovsm.generator;

import lombok.Builder;
import lombok.Getter;

/**
 * 控制生成哪些算术/内存类验证条件的开关。
 * 账户与协议类检查 (签名者、可写、所有者等) 不受这些开关控制。
 */
@Getter
@Builder(toBuilder = true)
public final class VerificationProperties {

    private final boolean divisionSafety;
    private final boolean arrayBounds;
    private final boolean overflowCheck;
    private final boolean underflowCheck;
    private final boolean refinementTypes;
    private final boolean balanceSafety;
    // 开启后对所有算术生成溢出检查，而不仅是与余额相关的算术
    private final boolean strictArithmetic;

    /**
     * 除 strictArithmetic 外全部开启，算术检查只针对与余额相关的运算。
     */
    public static VerificationProperties all() {
        return builder()
                .divisionSafety(true)
                .arrayBounds(true)
                .overflowCheck(true)
                .underflowCheck(true)
                .refinementTypes(true)
                .balanceSafety(true)
                .strictArithmetic(false)
                .build();
    }

    public static VerificationProperties none() {
        return builder().build();
    }

    public static VerificationProperties criticalOnly() {
        return builder()
                .divisionSafety(true)
                .arrayBounds(true)
                .underflowCheck(true)
                .balanceSafety(true)
                .build();
    }

    public static VerificationProperties maximum() {
        return all().toBuilder().strictArithmetic(true).build();
    }

    /**
     * 按预设名取配置：all、none、critical (或 critical-only)、maximum。
     */
    public static VerificationProperties preset(String name) {
        return switch (name.trim().toLowerCase()) {
            case "all" -> all();
            case "none" -> none();
            case "critical", "critical-only", "critical_only" -> criticalOnly();
            case "maximum", "max" -> maximum();
            default -> throw new IllegalArgumentException("Unknown verification preset: " + name);
        };
    }

    @Override
    public String toString() {
        return "VerificationProperties{div=" + divisionSafety + ", bounds=" + arrayBounds
                + ", overflow=" + overflowCheck + ", underflow=" + underflowCheck
                + ", refinement=" + refinementTypes + ", balance=" + balanceSafety
                + ", strict=" + strictArithmetic + "}";
    }
}
