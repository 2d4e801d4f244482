package org.ovsm.verifier;

import org.ovsm.ast.BinaryOp;
import org.ovsm.ast.Program;
import org.ovsm.ast.Statement;
import org.ovsm.bridge.LeanBridge;
import org.ovsm.bridge.LeanMessage;
import org.ovsm.bridge.LeanResult;
import org.ovsm.core.ProofResult;
import org.ovsm.core.VCCategory;
import org.ovsm.core.VerificationCondition;
import org.ovsm.generator.GenerationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.ovsm.ast.Expression.*;

class VerifierTest {

    /**
     * 不启动子进程的 Lean 替身：记录收到的脚本，按给定函数返回结果。
     */
    private static final class StubBridge extends LeanBridge {
        private final boolean available;
        private final Function<String, LeanResult> answer;
        private Path checkedFile;
        private String checkedScript;

        StubBridge(boolean available, Function<String, LeanResult> answer) {
            super("lean", "lake", null, 5);
            this.available = available;
            this.answer = answer;
        }

        @Override
        public synchronized boolean isAvailable() {
            return available;
        }

        @Override
        public LeanResult checkFile(Path file) {
            checkedFile = file;
            try {
                checkedScript = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
            return answer.apply(checkedScript);
        }
    }

    private static Statement stmt(org.ovsm.ast.Expression expression) {
        return Statement.expression(expression);
    }

    private static Program guardedDivision() {
        return Program.of(stmt(ternary(
                binary(BinaryOp.GT, variable("y"), integer(0)),
                binary(BinaryOp.DIV, variable("x"), variable("y")),
                integer(0))));
    }

    private static Program transfer() {
        return Program.of(
                stmt(call("set-lamports", integer(0), variable("new_from"))),
                stmt(call("set-lamports", integer(1), variable("new_to"))));
    }

    private static Verifier offline(VerificationOptions options) {
        return new Verifier(options, new StubBridge(false, script -> LeanResult.notAvailable("stub")));
    }

    @Nested
    @DisplayName("内置证明 (Builtin verification)")
    class BuiltinTests {

        @Test
        @DisplayName("有保护的除法全部证明，精度提示记为 ADVISORY")
        void testGuardedDivision_ShouldPass() {
            VerificationResult result = offline(VerificationOptions.defaults()).verify(guardedDivision(), "div.ovsm");

            assertAll("Guarded division",
                    () -> assertTrue(result.isSuccess()),
                    () -> assertTrue(result.allProved()),
                    () -> assertEquals(1, result.getProved().size()),
                    () -> assertEquals(1, result.getAdvisory().size()),
                    () -> assertTrue(result.summary().startsWith("Verification PASSED: 1/2 conditions proved in")),
                    () -> assertTrue(result.summary().endsWith("(1 advisory)")),
                    () -> assertNotNull(result.getCoverage()),
                    () -> assertNull(result.getLeanFile())
            );
        }

        @Test
        @DisplayName("没有签名检查的 set-lamports 得到 UNKNOWN 而不是失败")
        void testUncheckedSigners_ShouldBeUnknown() {
            VerificationResult result = offline(VerificationOptions.defaults()).verify(transfer(), "transfer.ovsm");

            long signers = result.getUnknown().stream()
                    .filter(vc -> vc.getCategory() == VCCategory.SIGNER_CHECK).count();
            assertAll("Unchecked signers",
                    () -> assertTrue(result.isSuccess()),
                    () -> assertFalse(result.allProved()),
                    () -> assertEquals(2, signers),
                    () -> assertTrue(result.summary().startsWith("Verification FAILED:"))
            );
        }

        @Test
        @DisplayName("要求验证通过时，字面量零除抛出 VerificationException")
        void testVerifyOrThrow() {
            Program program = Program.of(stmt(binary(BinaryOp.DIV, variable("x"), integer(0))));
            Verifier strict = offline(VerificationOptions.builder().requireVerification(true).build());
            Verifier lenient = offline(VerificationOptions.defaults());

            VerificationException e = assertThrows(VerificationException.class,
                    () -> strict.verifyOrThrow(program, "zero.ovsm"));
            VerificationResult result = lenient.verifyOrThrow(program, "zero.ovsm");

            assertAll("verifyOrThrow",
                    () -> assertTrue(e.getMessage().contains("vc_division_safety_1")),
                    () -> assertEquals(1, result.getFailed().size()),
                    () -> assertTrue(result.getFailed().get(0).getError().startsWith("Counterexample: ")),
                    () -> assertNotNull(result.getFailed().get(0).getSuggestion())
            );
        }

        @Test
        @DisplayName("大小为 10 的数组访问 arr[15]：生成空值与边界条件，边界条件被反驳")
        void testOutOfBoundsAccess_ShouldFail() {
            List<org.ovsm.ast.Expression> elements = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                elements.add(integer(i));
            }
            Program program = Program.of(
                    Statement.constant("arr", array(elements)),
                    stmt(index(variable("arr"), integer(15))));

            VerificationResult result = offline(VerificationOptions.defaults()).verifyBuiltin(program, "arr.ovsm");
            List<VerificationCondition> vcs = offline(VerificationOptions.defaults())
                    .generate(program, "arr.ovsm").getVcs();

            assertAll("arr[15]",
                    () -> assertTrue(vcs.stream().anyMatch(vc -> vc.getCategory() == VCCategory.NULL_POINTER_CHECK)),
                    () -> assertEquals(1, result.getFailed().size()),
                    () -> assertEquals(VCCategory.ARRAY_BOUNDS, result.getFailed().get(0).getCategory()),
                    () -> assertTrue(result.getFailed().get(0).getError().contains("15")),
                    () -> assertTrue(result.getFailed().get(0).getError().contains("10"))
            );
        }

        @Test
        @DisplayName("空程序抛出 VerificationException")
        void testNullProgram() {
            assertThrows(VerificationException.class,
                    () -> offline(VerificationOptions.defaults()).verifyBuiltin(null, "none.ovsm"));
        }
    }

    @Nested
    @DisplayName("缓存 (Caching)")
    class CacheTests {

        @Test
        @DisplayName("开启缓存时同一程序只生成一次")
        void testCacheEnabled() {
            Verifier verifier = offline(VerificationOptions.defaults());
            Program program = guardedDivision();

            GenerationResult first = verifier.generate(program, "div.ovsm");

            assertAll("Cache",
                    () -> assertSame(first, verifier.generate(program, "div.ovsm")),
                    () -> assertNotSame(first, verifier.generate(program, "other.ovsm"))
            );
        }

        @Test
        @DisplayName("关闭缓存时每次重新生成")
        void testCacheDisabled() {
            Verifier verifier = offline(VerificationOptions.builder().enableCache(false).build());
            Program program = guardedDivision();

            assertNotSame(verifier.generate(program, "div.ovsm"), verifier.generate(program, "div.ovsm"));
        }
    }

    @Nested
    @DisplayName("Lean 检查 (Lean checking)")
    class LeanTests {

        @Test
        @DisplayName("Lean 的错误按 id 归属到对应的验证条件，其余视为已证明")
        void testErrorsAttributedById(@TempDir Path dir) {
            VerificationOptions options = VerificationOptions.builder().outputDir(dir).build();
            Program program = transfer();
            List<VerificationCondition> signers = new Verifier(options).generate(program, "transfer.ovsm").getVcs()
                    .stream().filter(vc -> vc.getCategory() == VCCategory.SIGNER_CHECK).toList();
            String failing = signers.get(1).getId();
            StubBridge bridge = new StubBridge(true, script -> LeanResult.errors(List.of(
                    LeanMessage.of("transfer_vc.lean", 1, 0, LeanMessage.Severity.ERROR, "unsolved goals in " + failing),
                    LeanMessage.of("transfer_vc.lean", 2, 0, LeanMessage.Severity.WARNING, "unused variable"))));

            VerificationResult result = new Verifier(options, bridge).verify(program, "transfer.ovsm");

            assertAll("Lean errors",
                    () -> assertEquals(dir.resolve("transfer_vc.lean"), bridge.checkedFile),
                    () -> assertTrue(bridge.checkedScript.contains("theorem " + failing + " :")),
                    () -> assertFalse(Files.exists(bridge.checkedFile), "Generated script is removed"),
                    () -> assertEquals(1, result.getFailed().size()),
                    () -> assertEquals(failing, result.getFailed().get(0).getId()),
                    () -> assertTrue(result.getUnknown().isEmpty()),
                    () -> assertEquals(result.totalVcs() - 1, result.getProved().size())
            );
        }

        @Test
        @DisplayName("保留生成的脚本时结果带有脚本路径")
        void testKeepGenerated(@TempDir Path dir) {
            VerificationOptions options = VerificationOptions.builder().outputDir(dir).keepGenerated(true).build();
            StubBridge bridge = new StubBridge(true, script -> LeanResult.success());

            VerificationResult result = new Verifier(options, bridge).verify(transfer(), "programs/transfer.ovsm");

            assertAll("Lean success",
                    () -> assertTrue(result.allProved()),
                    () -> assertEquals(dir.resolve("transfer_vc.lean"), result.getLeanFile()),
                    () -> assertTrue(Files.exists(result.getLeanFile()))
            );
        }

        @Test
        @DisplayName("超时只使内置证明器未决定的验证条件变为 UNKNOWN")
        void testTimeout(@TempDir Path dir) {
            VerificationOptions options = VerificationOptions.builder().outputDir(dir).build();
            StubBridge bridge = new StubBridge(true, script -> LeanResult.timeout());
            VerificationResult builtin = offline(options).verifyBuiltin(transfer(), "transfer.ovsm");

            VerificationResult result = new Verifier(options, bridge).verify(transfer(), "transfer.ovsm");

            assertAll("Timeout",
                    () -> assertNotNull(bridge.checkedFile),
                    () -> assertTrue(result.isSuccess()),
                    () -> assertEquals(builtin.getUnknown().size(), result.getUnknown().size()),
                    () -> assertEquals(builtin.getProved().size(), result.getProved().size()),
                    () -> assertTrue(result.getUnknown().stream()
                            .allMatch(vc -> vc.getReason().equals("Verification timed out")))
            );
        }

        @Test
        @DisplayName("超时不会抹掉内置证明器反驳的条件 (Disproved survives a Lean timeout)")
        void testTimeout_ShouldKeepBuiltinFailures(@TempDir Path dir) {
            Program program = Program.of(
                    stmt(binary(BinaryOp.DIV, variable("x"), integer(0))),
                    stmt(binary(BinaryOp.DIV, variable("x"), variable("y"))));
            VerificationOptions options = VerificationOptions.builder()
                    .outputDir(dir).requireVerification(true).build();
            StubBridge bridge = new StubBridge(true, script -> LeanResult.timeout());
            Verifier verifier = new Verifier(options, bridge);

            VerificationResult result = verifier.verify(program, "zero.ovsm");

            assertAll("Timeout with failures",
                    () -> assertNotNull(bridge.checkedFile),
                    () -> assertFalse(result.isSuccess()),
                    () -> assertEquals(1, result.getFailed().size()),
                    () -> assertEquals("vc_division_safety_1", result.getFailed().get(0).getId()),
                    () -> assertTrue(result.getFailed().get(0).getError().startsWith("Counterexample: ")),
                    () -> assertTrue(result.getUnknown().stream()
                            .anyMatch(vc -> vc.getCategory() == VCCategory.DIVISION_SAFETY)),
                    () -> assertThrows(VerificationException.class, () -> verifier.verifyOrThrow(program, "zero.ovsm"))
            );
        }

        @Test
        @DisplayName("Lean 检查通过也不会推翻内置证明器的反驳")
        void testLeanSuccess_ShouldKeepBuiltinFailures(@TempDir Path dir) {
            Program program = Program.of(
                    stmt(binary(BinaryOp.DIV, variable("x"), integer(0))),
                    stmt(binary(BinaryOp.DIV, variable("x"), variable("y"))));
            VerificationOptions options = VerificationOptions.builder().outputDir(dir).build();

            VerificationResult result = new Verifier(options, new StubBridge(true, script -> LeanResult.success()))
                    .verify(program, "zero.ovsm");

            assertAll("Lean success with failures",
                    () -> assertEquals(1, result.getFailed().size()),
                    () -> assertTrue(result.getUnknown().isEmpty()),
                    () -> assertEquals(result.totalVcs() - 1, result.getProved().size())
            );
        }

        @Test
        @DisplayName("无法归属的错误使所有验证条件变为 UNKNOWN，按行号可以归属")
        void testFromLean_Attribution() {
            List<VerificationCondition> vcs = new Verifier().generate(guardedDivision(), "div.ovsm").getVcs();
            String script = "namespace VC_div\n\ntheorem " + vcs.get(0).getId() + " : y ≠ 0 := by\n  omega\n";

            List<ProofResult> undecided = Collections.nCopies(vcs.size(), ProofResult.unknown("not decided"));

            VerificationResult unattributed = Verifier.fromLean(vcs, undecided, script,
                    LeanResult.errors(List.of(LeanMessage.generic("unknown package 'OVSM'")))).build(0);
            VerificationResult byLine = Verifier.fromLean(vcs, undecided, script, LeanResult.errors(List.of(
                    LeanMessage.of("div_vc.lean", 4, 2, LeanMessage.Severity.ERROR, "omega could not prove the goal"))))
                    .build(0);
            VerificationResult missing = Verifier.fromLean(vcs, undecided, script, LeanResult.notAvailable("no lean"))
                    .build(0);

            assertAll("fromLean",
                    () -> assertEquals(vcs.size(), unattributed.getUnknown().size()),
                    () -> assertTrue(unattributed.getUnknown().get(0).getReason()
                            .startsWith("Lean reported an error outside any condition: ")),
                    () -> assertEquals(vcs.get(0).getId(), byLine.getFailed().get(0).getId()),
                    () -> assertEquals("omega could not prove the goal", byLine.getFailed().get(0).getError()),
                    () -> assertEquals("Lean 4 not available: no lean", missing.getUnknown().get(0).getReason()),
                    () -> assertThrows(IllegalArgumentException.class,
                            () -> Verifier.fromLean(vcs, List.of(), script, LeanResult.success()))
            );
        }
    }

    @Nested
    @DisplayName("导出 (Export)")
    class ExportTests {

        @Test
        @DisplayName("导出证明脚本并创建父目录")
        void testExportProofs(@TempDir Path dir) throws IOException {
            Path output = dir.resolve("proofs").resolve("div.lean");

            offline(VerificationOptions.defaults()).exportProofs(guardedDivision(), "div.ovsm", output);

            String script = Files.readString(output, StandardCharsets.UTF_8);
            assertAll("Exported script",
                    () -> assertTrue(script.startsWith("/-!\n# OVSM Verification Certificates")),
                    () -> assertTrue(script.contains("/-- vc_division_safety_1 proof: ")),
                    () -> assertTrue(script.contains("namespace VC_div"))
            );
        }

        @Test
        @DisplayName("证书的源文件哈希取自文件内容")
        void testExportCertificate(@TempDir Path dir) throws IOException {
            Path source = dir.resolve("div.ovsm");
            String content = "(if (> y 0) (/ x y) 0)\n";
            Files.writeString(source, content, StandardCharsets.UTF_8);

            ProofCertificate certificate = offline(VerificationOptions.defaults())
                    .exportCertificate(guardedDivision(), source.toString());

            assertAll("Certificate",
                    () -> assertEquals(ProofCertificate.hashText(content), certificate.getSourceHash()),
                    () -> assertEquals(2, certificate.getTotalVcs()),
                    () -> assertEquals(1, certificate.getProvedCount()),
                    () -> assertEquals(1, certificate.getAdvisoryCount()),
                    () -> assertTrue(certificate.isVerified())
            );
        }

        @Test
        @DisplayName("覆盖报告统计未证明的源代码行")
        void testCoverageReport() {
            Program program = Program.of(
                    Statement.assign("a", integer(1)).at(2, 1),
                    stmt(binary(BinaryOp.DIV, variable("a"), variable("b"))).at(3, 1));
            String source = ";; divide\n(define a 1)\n(/ a b)\n";

            ProofCoverageReport report = offline(VerificationOptions.defaults())
                    .coverageReport(program, "cov.ovsm", source);

            assertAll("Coverage report",
                    () -> assertEquals(3, report.getTotalLines()),
                    () -> assertEquals(2, report.getCodeLines()),
                    () -> assertEquals(List.of(3), report.unprovedLinesList()),
                    () -> assertEquals(2, report.getTotalVcs()),
                    () -> assertEquals(1, report.getProvedVcs())
            );
        }
    }
}
