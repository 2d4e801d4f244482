package org.ovsm.bridge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LeanBridgeTest {

    @Nested
    @DisplayName("诊断解析 (Diagnostics)")
    class DiagnosticTests {

        @Test
        @DisplayName("解析 file:line:col: severity: message 形式的输出")
        void testParseStructuredOutput() {
            String output = "/tmp/prog_vc.lean:5:2: error: type mismatch\n"
                    + "  more detail\n"
                    + "/tmp/prog_vc.lean:9:0: warning: unused variable `h`\n";

            List<LeanMessage> messages = LeanBridge.parseDiagnostics(output);

            assertAll("Two diagnostics",
                    () -> assertEquals(2, messages.size()),
                    () -> assertEquals(5, messages.get(0).getLine()),
                    () -> assertEquals(2, messages.get(0).getColumn()),
                    () -> assertEquals(LeanMessage.Severity.ERROR, messages.get(0).getSeverity()),
                    () -> assertEquals("type mismatch", messages.get(0).getMessage()),
                    () -> assertEquals(LeanMessage.Severity.WARNING, messages.get(1).getSeverity()),
                    () -> assertEquals(1, LeanResult.errors(messages).getErrors().size())
            );
        }

        @Test
        @DisplayName("无结构的输出整体作为一条错误，空输出没有诊断")
        void testParseUnstructuredOutput() {
            List<LeanMessage> messages = LeanBridge.parseDiagnostics("  unknown package 'OVSM'  \n");

            assertAll("Generic error",
                    () -> assertEquals(List.of(LeanMessage.generic("unknown package 'OVSM'")), messages),
                    () -> assertTrue(messages.get(0).isError()),
                    () -> assertTrue(LeanBridge.parseDiagnostics("").isEmpty())
            );
        }

        @Test
        @DisplayName("位置超出 int 范围时整行作为无位置的错误")
        void testParseOversizedPosition() {
            String output = "/tmp/prog_vc.lean:99999999999999999999:0: error: deep recursion\n"
                    + "/tmp/prog_vc.lean:3:4: error: unsolved goals\n";

            List<LeanMessage> messages = assertDoesNotThrow(() -> LeanBridge.parseDiagnostics(output));

            assertAll("Oversized line number",
                    () -> assertEquals(2, messages.size()),
                    () -> assertEquals(LeanMessage.generic(
                            "/tmp/prog_vc.lean:99999999999999999999:0: error: deep recursion"), messages.get(0)),
                    () -> assertEquals(0, messages.get(0).getLine()),
                    () -> assertEquals(3, messages.get(1).getLine()),
                    () -> assertEquals(2, LeanResult.errors(messages).getErrors().size())
            );
        }
    }

    @Nested
    @DisplayName("外部工具缺失 (Missing tool)")
    class AvailabilityTests {

        @Test
        @DisplayName("找不到 lean 时不可用，检查结果为 NOT_AVAILABLE")
        void testMissingExecutable(@TempDir Path dir) {
            LeanBridge bridge = new LeanBridge("ovsm-no-such-lean-binary", "lake", null, 5);

            LeanResult result = bridge.checkFile(dir.resolve("missing_vc.lean"));

            assertAll("Not available",
                    () -> assertFalse(bridge.isAvailable()),
                    () -> assertTrue(bridge.version().isEmpty()),
                    () -> assertEquals(LeanResult.Kind.NOT_AVAILABLE, result.getKind()),
                    () -> assertFalse(result.isSuccess())
            );
        }

        @Test
        @DisplayName("构造参数校验")
        void testInvalidArguments() {
            assertAll("Constructor",
                    () -> assertThrows(IllegalArgumentException.class, () -> new LeanBridge(" ", "lake", null, 5)),
                    () -> assertThrows(IllegalArgumentException.class, () -> new LeanBridge("lean", "lake", null, 0))
            );
        }
    }
}
