package org.ovsm.bridge;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lean 4 外部证明器的子进程封装。
 * <p>
 * 所有失败 (可执行文件不存在、I/O 错误、超时) 都降级为 {@link LeanResult}，不抛出异常。
 */
public class LeanBridge {

    private static final Logger logger = LoggerFactory.getLogger(LeanBridge.class);

    private static final Pattern DIAGNOSTIC =
            Pattern.compile("^(.+):(\\d+):(\\d+):\\s*(error|warning|info):\\s*(.+)$", Pattern.MULTILINE);
    private static final int VERSION_CHECK_TIMEOUT_SECONDS = 10;

    private final String leanCommand;
    private final String lakeCommand;
    // 可能为 null：不使用配套证明库
    private final Path libraryPath;
    private final int timeoutSeconds;

    private Boolean available;

    public LeanBridge(String leanCommand, String lakeCommand, Path libraryPath, int timeoutSeconds) {
        if (StringUtils.isBlank(leanCommand)) {
            throw new IllegalArgumentException("Lean command cannot be blank");
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeoutSeconds);
        }
        this.leanCommand = leanCommand;
        this.lakeCommand = StringUtils.defaultIfBlank(lakeCommand, "lake");
        this.libraryPath = libraryPath;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * lean --version 能否正常执行。结果缓存。
     */
    public synchronized boolean isAvailable() {
        if (available == null) {
            available = version().isPresent();
            if (!available) {
                logger.warn("Lean 不可用 ({})，外部验证将被跳过", leanCommand);
            }
        }
        return available;
    }

    public Optional<String> version() {
        try {
            ProcessOutput out = run(List.of(leanCommand, "--version"), null, null, VERSION_CHECK_TIMEOUT_SECONDS);
            if (out.finished && out.exitCode == 0) {
                return Optional.of(out.text.trim());
            }
        } catch (IOException e) {
            logger.debug("执行 {} --version 失败: {}", leanCommand, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return Optional.empty();
    }

    /**
     * 检查一个 .lean 文件。
     */
    public LeanResult checkFile(Path file) {
        if (!isAvailable()) {
            return LeanResult.notAvailable("Lean 4 is not installed or not in PATH");
        }
        ensureLibraryBuilt();
        List<String> command = List.of(leanCommand, file.toString());
        try {
            ProcessOutput out = run(command, null, Map.of("LEAN_PATH", leanPath()), timeoutSeconds);
            if (!out.finished) {
                logger.warn("Lean 检查 {} 超过 {} 秒，已终止", file, timeoutSeconds);
                return LeanResult.timeout();
            }
            if (out.exitCode == 0) {
                logger.info("Lean 检查通过: {}", file);
                return LeanResult.success();
            }
            List<LeanMessage> messages = parseDiagnostics(out.text);
            logger.info("Lean 检查 {} 返回 {} 条诊断", file, messages.size());
            return LeanResult.errors(messages);
        } catch (IOException e) {
            logger.warn("运行 Lean 失败: {}", e.getMessage());
            return LeanResult.notAvailable("Failed to run Lean: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LeanResult.notAvailable("Interrupted while waiting for Lean");
        }
    }

    /**
     * 配套库是 lake 工程且尚未构建 (没有 .lake 目录) 时执行 lake build。失败只记录警告。
     */
    void ensureLibraryBuilt() {
        if (libraryPath == null || !Files.isDirectory(libraryPath)) {
            return;
        }
        if (!Files.exists(libraryPath.resolve("lakefile.lean")) || Files.exists(libraryPath.resolve(".lake"))) {
            return;
        }
        logger.info("构建 Lean 配套库: {}", libraryPath);
        try {
            ProcessOutput out = run(List.of(lakeCommand, "build"), libraryPath, null, timeoutSeconds);
            if (!out.finished || out.exitCode != 0) {
                logger.warn("构建 Lean 配套库失败: {}", StringUtils.abbreviate(out.text.trim(), 500));
            }
        } catch (IOException e) {
            logger.warn("运行 lake build 失败: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * LEAN_PATH：配套库目录及其 .lake/build/lib。
     */
    String leanPath() {
        List<String> paths = new ArrayList<>();
        if (libraryPath != null && Files.exists(libraryPath)) {
            paths.add(libraryPath.toString());
            Path buildLib = libraryPath.resolve(".lake").resolve("build").resolve("lib");
            if (Files.exists(buildLib)) {
                paths.add(buildLib.toString());
            }
        }
        return StringUtils.join(paths, File.pathSeparator);
    }

    /**
     * 解析 file:line:col: severity: message 形式的诊断。没有任何结构化诊断但输出非空时，
     * 整段输出作为一条错误。
     */
    public static List<LeanMessage> parseDiagnostics(String output) {
        List<LeanMessage> messages = new ArrayList<>();
        Matcher m = DIAGNOSTIC.matcher(output);
        while (m.find()) {
            try {
                messages.add(LeanMessage.of(m.group(1), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)),
                        LeanMessage.Severity.parse(m.group(4)), m.group(5).trim()));
            } catch (NumberFormatException e) {
                // 位置超出 int 范围，整行作为无位置的错误
                logger.debug("无法解析诊断位置: {}", m.group());
                messages.add(LeanMessage.generic(m.group().trim()));
            }
        }
        if (messages.isEmpty() && StringUtils.isNotBlank(output)) {
            messages.add(LeanMessage.generic(output.trim()));
        }
        return messages;
    }

    private static ProcessOutput run(List<String> command, Path directory, Map<String, String> env,
                                     int timeoutSeconds) throws IOException, InterruptedException {
        Path log = Files.createTempFile("ovsm-lean", ".log");
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.redirectErrorStream(true);
            builder.redirectOutput(log.toFile());
            if (directory != null) {
                builder.directory(directory.toFile());
            }
            if (env != null) {
                builder.environment().putAll(env);
            }
            Process child = builder.start();
            try {
                boolean finished = child.waitFor(timeoutSeconds, TimeUnit.SECONDS);
                int exitCode = finished ? child.exitValue() : -1;
                return new ProcessOutput(finished, exitCode, new String(Files.readAllBytes(log), StandardCharsets.UTF_8));
            } finally {
                // 确保子进程被销毁
                child.destroyForcibly();
            }
        } finally {
            Files.deleteIfExists(log);
        }
    }

    private static final class ProcessOutput {
        final boolean finished;
        final int exitCode;
        final String text;

        ProcessOutput(boolean finished, int exitCode, String text) {
            this.finished = finished;
            this.exitCode = exitCode;
            this.text = text;
        }
    }
}
