package org.ovsm.bridge;

import org.ovsm.core.ProofResult;
import org.ovsm.core.SourceLocation;
import org.ovsm.core.VCCategory;
import org.ovsm.core.VerificationCondition;
import org.ovsm.expressions.Formula;
import org.ovsm.expressions.RelationType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LeanCodeWriterTest {

    private final LeanCodeWriter writer = new LeanCodeWriter();

    private static final VerificationCondition DIVISION = VerificationCondition.of("vc_division_safety_1",
            VCCategory.DIVISION_SAFETY, "Division by zero check", SourceLocation.of("src/my-program.ovsm", 3, 5),
            Formula.compare(Formula.var("y"), RelationType.NE, Formula.constant(0)),
            List.of(Formula.compare(Formula.var("y"), RelationType.GT, Formula.constant(0))), "omega");

    private static final VerificationCondition SIGNER = VerificationCondition.of("vc_signer_2",
            VCCategory.SIGNER_CHECK, "Signer check", SourceLocation.of("src/my-program.ovsm", 7, 1),
            Formula.compare(Formula.index("account_is_signer", 0), RelationType.EQ, Formula.TRUE),
            List.of(), "simp");

    @Test
    @DisplayName("命名空间取自源文件名")
    void testNamespace() {
        assertAll("namespaceFor",
                () -> assertEquals("VC_my_program", LeanCodeWriter.namespaceFor("src/my-program.ovsm")),
                () -> assertEquals("VC_token_v2", LeanCodeWriter.namespaceFor("token.v2.ovsm")),
                () -> assertEquals("VC_Program", LeanCodeWriter.namespaceFor(""))
        );
    }

    @Test
    @DisplayName("每条验证条件生成一个 theorem，假设依次 intro")
    void testWrite() {
        String script = writer.write(List.of(DIVISION, SIGNER), "src/my-program.ovsm");

        assertAll("Script",
                () -> assertTrue(script.contains("import OVSM\n")),
                () -> assertTrue(script.contains("namespace VC_my_program\n")),
                () -> assertTrue(script.contains("theorem vc_division_safety_1 : (y > 0) → y ≠ 0 := by\n  intro _\n  omega\n")),
                () -> assertTrue(script.contains("theorem vc_signer_2 : account_is_signer[0] = true := by\n  simp\n")),
                () -> assertTrue(script.contains("-- Source: src/my-program.ovsm:3:5\n")),
                () -> assertTrue(script.endsWith("end VC_my_program\n"))
        );
    }

    @Test
    @DisplayName("按行号定位 theorem，按正文定位 id")
    void testLocateTheorem() {
        String script = writer.write(List.of(DIVISION, SIGNER), "src/my-program.ovsm");
        String[] lines = script.split("\n", -1);
        int signerLine = 0;
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].startsWith("theorem vc_signer_2")) {
                signerLine = i + 1;
            }
        }
        int line = signerLine;

        assertAll("theoremAt / mentionedId",
                () -> assertEquals(Optional.of("vc_signer_2"), LeanCodeWriter.theoremAt(script, line + 1)),
                () -> assertEquals(Optional.of("vc_division_safety_1"), LeanCodeWriter.theoremAt(script, line - 1)),
                () -> assertEquals(Optional.empty(), LeanCodeWriter.theoremAt(script, 1)),
                () -> assertEquals(Optional.of("vc_division_safety_1"),
                        LeanCodeWriter.mentionedId("unsolved goals in vc_division_safety_1")),
                () -> assertEquals(Optional.empty(), LeanCodeWriter.mentionedId("unknown identifier 'foo'"))
        );
    }

    @Test
    @DisplayName("导出脚本列出已解决的条件")
    void testWriteWithProofs() {
        String script = writer.writeWithProofs(List.of(DIVISION, SIGNER),
                List.of(ProofResult.proved("omega", "y > 0 implies y ≠ 0"), ProofResult.unknown("no evidence")),
                "src/my-program.ovsm");

        assertAll("Certificates block",
                () -> assertTrue(script.startsWith("/-!\n# OVSM Verification Certificates\n")),
                () -> assertTrue(script.contains("/-- vc_division_safety_1 proof: omega -/")),
                () -> assertFalse(script.contains("/-- vc_signer_2 proof")),
                () -> assertTrue(script.contains("theorem vc_signer_2"))
        );
    }

    @Test
    @DisplayName("证明结果数量不匹配时抛出异常")
    void testWriteWithProofs_SizeMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> writer.writeWithProofs(List.of(DIVISION), List.of(), "a.ovsm"));
    }
}
