package org.ovsm.verifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;
import org.ovsm.core.ProofResult;
import org.ovsm.core.SourceLocation;
import org.ovsm.core.VCCategory;
import org.ovsm.core.VerificationCondition;
import org.ovsm.expressions.Formula;
import org.ovsm.expressions.RelationType;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProofCertificateTest {

    private static final Instant NOW = Instant.parse("2026-01-02T03:04:05Z");

    private static VerificationResult result;

    private static VerificationCondition vc(String id, VCCategory category, int line) {
        return VerificationCondition.of(id, category, "check " + id, SourceLocation.of("prog.ovsm", line, 1),
                Formula.compare(Formula.var("y"), RelationType.NE, Formula.constant(0)), List.of(), "omega");
    }

    @BeforeAll
    static void setUp() {
        result = VerificationResult.builder()
                .add(vc("vc_division_safety_1", VCCategory.DIVISION_SAFETY, 2), ProofResult.provedByOmega("y > 0"))
                .add(vc("vc_overflow_2", VCCategory.ARITHMETIC_OVERFLOW, 3), ProofResult.provedBySmt("z3"))
                .add(vc("vc_precision_3", VCCategory.ARITHMETIC_PRECISION, 4), ProofResult.advisory("truncates"))
                .add(vc("vc_signer_4", VCCategory.SIGNER_CHECK, 5), ProofResult.unknown("no signer check"))
                .build(12);
    }

    @Nested
    @DisplayName("计数 (Counts)")
    class CountTests {

        @Test
        @DisplayName("计数与通过率")
        void testCounts() {
            ProofCertificate certificate = ProofCertificate.of(result, "prog.ovsm", "abc", NOW);

            assertAll("Counts",
                    () -> assertEquals(4, certificate.getTotalVcs()),
                    () -> assertEquals(2, certificate.getProvedCount()),
                    () -> assertEquals(1, certificate.getAdvisoryCount()),
                    () -> assertEquals(0, certificate.getFailedCount()),
                    () -> assertEquals(1, certificate.getUnknownCount()),
                    () -> assertEquals(75.0, certificate.passRate(), 1e-9),
                    () -> assertTrue(certificate.isVerified()),
                    () -> assertEquals("2026-01-02T03:04:05Z", certificate.getTimestamp())
            );
        }

        @Test
        @DisplayName("存在失败时证书不成立")
        void testFailedCertificate() {
            VerificationResult failed = VerificationResult.builder()
                    .add(vc("vc_division_safety_1", VCCategory.DIVISION_SAFETY, 1), ProofResult.disproved("0 ≠ 0"))
                    .build(1);

            ProofCertificate certificate = ProofCertificate.of(failed, "prog.ovsm", "abc", NOW);

            assertAll("Failed",
                    () -> assertFalse(certificate.isVerified()),
                    () -> assertEquals(0.0, certificate.passRate(), 1e-9)
            );
        }
    }

    @Nested
    @DisplayName("JSON 与哈希 (JSON and hashing)")
    class JsonTests {

        @Test
        @DisplayName("JSON 使用 snake_case，proved 条目没有 reason")
        void testToJson() throws Exception {
            JsonNode json = new ObjectMapper().readTree(
                    ProofCertificate.of(result, "prog.ovsm", "abc", NOW).toJson());
            JsonNode vcs = json.get("vcs");

            assertAll("JSON",
                    () -> assertEquals("1.0", json.get("version").asText()),
                    () -> assertEquals("ovsm-builtin-v1", json.get("verifier").asText()),
                    () -> assertEquals("prog.ovsm", json.get("source_file").asText()),
                    () -> assertEquals(4, json.get("total_vcs").asInt()),
                    () -> assertEquals(12, json.get("verification_time_ms").asLong()),
                    () -> assertEquals(4, vcs.size()),
                    () -> assertEquals("proved", vcs.get(0).get("status").asText()),
                    () -> assertFalse(vcs.get(0).has("reason")),
                    () -> assertEquals("builtin_verifier", vcs.get(0).get("proof_method").asText()),
                    () -> assertEquals("z3_fallback", vcs.get(1).get("proof_method").asText()),
                    () -> assertEquals("advisory", vcs.get(2).get("status").asText()),
                    () -> assertEquals("truncates", vcs.get(2).get("reason").asText()),
                    () -> assertEquals("unknown", vcs.get(3).get("status").asText()),
                    () -> assertEquals("signer", vcs.get(3).get("category").asText()),
                    () -> assertEquals("prog.ovsm:5:1", vcs.get(3).get("location").asText()),
                    () -> assertFalse(json.has("verified"))
            );
        }

        @Test
        @DisplayName("SHA-256：空内容与无法读取的文件得到相同的哈希")
        void testHashing(@TempDir Path dir) throws Exception {
            String empty = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";
            Path source = dir.resolve("prog.ovsm");
            Files.writeString(source, "abc");

            assertAll("Hashes",
                    () -> assertEquals(empty, ProofCertificate.hashText("")),
                    () -> assertEquals(empty, ProofCertificate.hashSource(dir.resolve("missing.ovsm"))),
                    () -> assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                            ProofCertificate.hashSource(source))
            );
        }

        @Test
        @DisplayName("SHA-256 按文件字节计算，非法 UTF-8 不会被替换")
        void testHashing_InvalidUtf8(@TempDir Path dir) throws Exception {
            byte[] bytes = {(byte) 0xff, (byte) 0xfe, 'a'};
            Path source = dir.resolve("binary.ovsm");
            Files.write(source, bytes);

            String hash = ProofCertificate.hashSource(source);

            assertAll("Byte hash",
                    () -> assertEquals(Hashing.sha256().hashBytes(bytes).toString(), hash),
                    () -> assertNotEquals(ProofCertificate.hashText("\uFFFD\uFFFDa"), hash)
            );
        }

        @Test
        @DisplayName("写入 JSON 文件")
        void testToJsonFile(@TempDir Path dir) throws Exception {
            Path output = dir.resolve("cert.json");

            ProofCertificate.of(result, "prog.ovsm", "abc", NOW).toJsonFile(output);

            assertEquals("abc", new ObjectMapper().readTree(Files.readString(output)).get("source_hash").asText());
        }
    }
}
