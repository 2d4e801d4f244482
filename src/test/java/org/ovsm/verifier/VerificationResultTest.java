package org.ovsm.verifier;

import org.ovsm.core.ProofResult;
import org.ovsm.core.SourceLocation;
import org.ovsm.core.VCCategory;
import org.ovsm.core.VerificationCondition;
import org.ovsm.expressions.Formula;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VerificationResultTest {

    private static VerificationCondition vc(String id, VCCategory category) {
        return VerificationCondition.of(id, category, "Check " + id, SourceLocation.of("a.ovsm", 1, 1),
                Formula.TRUE, List.of(), "simp");
    }

    @Test
    @DisplayName("按结论归类，ADVISORY 保留警告文本")
    void testBuilder() {
        VerificationResult result = VerificationResult.builder()
                .add(vc("vc_division_safety_1", VCCategory.DIVISION_SAFETY), ProofResult.provedByOmega("y > 0"))
                .add(vc("vc_precision_2", VCCategory.ARITHMETIC_PRECISION), ProofResult.advisory("may truncate"))
                .build(7);

        assertAll("Passed",
                () -> assertTrue(result.allProved()),
                () -> assertEquals("Check vc_division_safety_1 (y > 0)", result.getProved().get(0).getDescription()),
                () -> assertEquals("omega", result.getProved().get(0).getProof()),
                () -> assertEquals("may truncate", result.getAdvisory().get(0).getWarning()),
                () -> assertEquals("Verification PASSED: 1/2 conditions proved in 7ms (1 advisory)", result.summary())
        );
    }

    @Test
    @DisplayName("失败附带反例与修复建议")
    void testFailure() {
        VerificationResult result = VerificationResult.builder()
                .add(vc("vc_array_bounds_1", VCCategory.ARRAY_BOUNDS), ProofResult.disproved("index 5 >= size 3"))
                .add(vc("vc_signer_2", VCCategory.SIGNER_CHECK), ProofResult.unknown("no signer check"))
                .build(3);

        VerificationResult.FailedVC failed = result.getFailed().get(0);
        assertAll("Failed",
                () -> assertFalse(result.isSuccess()),
                () -> assertEquals("Counterexample: index 5 >= size 3", failed.getError()),
                () -> assertTrue(failed.getSuggestion().startsWith("Add a bounds check")),
                () -> assertEquals("no signer check", result.getUnknown().get(0).getReason()),
                () -> assertEquals("Verification FAILED: 0 proved, 1 failed, 1 unknown", result.summary()),
                () -> assertEquals(2, result.totalVcs())
        );
    }
}
