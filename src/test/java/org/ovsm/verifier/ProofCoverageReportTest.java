package org.ovsm.verifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.ovsm.core.ProofResult;
import org.ovsm.core.SourceLocation;
import org.ovsm.core.VCCategory;
import org.ovsm.core.VerificationCondition;
import org.ovsm.expressions.Formula;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProofCoverageReportTest {

    private static final String SOURCE = String.join("\n",
            ";; transfer program",
            "(define amount 10)",
            "",
            "(/ total amount)",
            "(set-lamports 0 x)",
            "(set-lamports 1 y)",
            "");

    private static ProofCoverageReport report;

    private static VerificationCondition vc(String id, VCCategory category, int line) {
        return VerificationCondition.of(id, category, id, SourceLocation.of("transfer.ovsm", line, 1),
                Formula.TRUE, List.of(), "simp");
    }

    @BeforeAll
    static void setUp() {
        report = ProofCoverageReport.from(SOURCE, "transfer.ovsm",
                List.of(vc("vc_division_safety_1", VCCategory.DIVISION_SAFETY, 4),
                        vc("vc_precision_2", VCCategory.ARITHMETIC_PRECISION, 4),
                        vc("vc_signer_3", VCCategory.SIGNER_CHECK, 5),
                        vc("vc_signer_4", VCCategory.SIGNER_CHECK, 6),
                        vc("vc_writable_5", VCCategory.WRITABILITY_CHECK, 6)),
                List.of(ProofResult.provedByDecide("amount = 10"),
                        ProofResult.advisory("truncates"),
                        ProofResult.unknown("no signer check"),
                        ProofResult.provedByAssumption("h", "checked"),
                        ProofResult.proved("simp", "writable")));
    }

    @Test
    @DisplayName("行统计：注释与空行不计为代码，同一行有未证明条件时不算已证明")
    void testLineCounts() {
        assertAll("Lines",
                () -> assertEquals(6, report.getTotalLines()),
                () -> assertEquals(4, report.getCodeLines()),
                () -> assertEquals(Set.of(4, 6), report.getProvedLineSet()),
                () -> assertEquals(List.of(5), report.unprovedLinesList()),
                () -> assertEquals(1, report.getUncoveredLines()),
                () -> assertEquals(50.0, report.lineCoveragePercent(), 1e-9),
                () -> assertEquals(75.0, report.riskyCoveragePercent(), 1e-9),
                () -> assertEquals(80.0, report.vcProofRate(), 1e-9)
        );
    }

    @Test
    @DisplayName("按类别统计")
    void testCategories() {
        ProofCoverageReport.CategoryStats signer = report.getByCategory().get("signer");

        assertAll("By category",
                () -> assertEquals(4, report.getByCategory().size()),
                () -> assertEquals(2, signer.getCount()),
                () -> assertEquals(1, signer.getUnproved()),
                () -> assertEquals(50.0, signer.proofRate(), 1e-9),
                () -> assertTrue(report.categoryBreakdown().contains("✗ signer")),
                () -> assertTrue(report.categoryBreakdown().contains("✓ precision")),
                () -> assertTrue(report.summary().contains("• Total VCs:      5"))
        );
    }

    @Test
    @DisplayName("JSON 报告")
    void testToJson() throws Exception {
        JsonNode json = new ObjectMapper().readTree(report.toJson());

        assertAll("JSON",
                () -> assertEquals("transfer.ovsm", json.get("source_file").asText()),
                () -> assertEquals(4, json.get("code_lines").asInt()),
                () -> assertEquals(80.0, json.get("metrics").get("vc_proof_rate").asDouble(), 1e-9),
                () -> assertEquals(1, json.get("by_category").get("signer").get("unproved").asInt()),
                () -> assertEquals(5, json.get("unproved_line_numbers").get(0).asInt())
        );
    }

    @Test
    @DisplayName("空源代码与结果数量不匹配")
    void testEdgeCases() {
        ProofCoverageReport empty = ProofCoverageReport.from("", "empty.ovsm", List.of(), List.of());

        assertAll("Edge cases",
                () -> assertEquals(0, empty.getTotalLines()),
                () -> assertEquals(100.0, empty.lineCoveragePercent(), 1e-9),
                () -> assertThrows(IllegalArgumentException.class, () -> ProofCoverageReport.from(SOURCE,
                        "transfer.ovsm", List.of(vc("vc_signer_1", VCCategory.SIGNER_CHECK, 5)), List.of()))
        );
    }
}
