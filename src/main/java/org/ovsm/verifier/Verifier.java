package org.ovsm.verifier;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.apache.commons.lang3.StringUtils;
import org.ovsm.ast.Program;
import org.ovsm.bridge.LeanBridge;
import org.ovsm.bridge.LeanCodeWriter;
import org.ovsm.bridge.LeanMessage;
import org.ovsm.bridge.LeanResult;
import org.ovsm.core.ProofResult;
import org.ovsm.core.VerificationCondition;
import org.ovsm.generator.GenerationResult;
import org.ovsm.generator.VCGenerator;
import org.ovsm.prover.BuiltinProver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 验证门面：生成验证条件，先用内置证明器判定，必要时交给外部 Lean 检查。
 * <p>
 * 外部工具缺失或超时只会让结论降级为 UNKNOWN，不会抛出异常。
 * @author Ayalyt
 */
public class Verifier {

    private static final Logger logger = LoggerFactory.getLogger(Verifier.class);

    private final VerificationOptions options;
    private final VCGenerator generator;
    private final LeanBridge bridge;
    private final LeanCodeWriter writer = new LeanCodeWriter();
    // 以程序对象的身份为键，程序被回收后条目随之失效
    private final Cache<Program, Map<String, GenerationResult>> cache =
            CacheBuilder.newBuilder().weakKeys().maximumSize(256).build();

    public Verifier(VerificationOptions options) {
        this(options, new LeanBridge(options.getLeanPath(), options.getLakePath(), options.getLeanLibraryPath(),
                options.getTimeoutSeconds()));
    }

    public Verifier() {
        this(VerificationOptions.defaults());
    }

    Verifier(VerificationOptions options, LeanBridge bridge) {
        this.options = Objects.requireNonNull(options, "Verification options cannot be null");
        this.bridge = Objects.requireNonNull(bridge, "Lean bridge cannot be null");
        this.generator = new VCGenerator(options.getProperties());
    }

    public VerificationOptions getOptions() {
        return options;
    }

    public boolean isAvailable() {
        return bridge.isAvailable();
    }

    public Optional<String> leanVersion() {
        return bridge.version();
    }

    /**
     * 生成验证条件。开启缓存时同一程序对象与源文件只生成一次。
     */
    public GenerationResult generate(Program program, String sourceFile) {
        if (program == null) {
            throw new VerificationException("Program cannot be null");
        }
        String file = Objects.toString(sourceFile, "");
        if (!options.isEnableCache()) {
            return generator.generate(program, file);
        }
        Map<String, GenerationResult> perFile = cache.asMap()
                .computeIfAbsent(program, p -> new ConcurrentHashMap<>());
        GenerationResult cached = perFile.get(file);
        if (cached != null) {
            logger.debug("{}: 使用缓存的验证条件", file);
            return cached;
        }
        GenerationResult generated = generator.generate(program, file);
        perFile.put(file, generated);
        return generated;
    }

    /**
     * 只使用内置证明器。
     */
    public VerificationResult verifyBuiltin(Program program, String sourceFile) {
        long start = System.currentTimeMillis();
        GenerationResult generation = generate(program, sourceFile);
        VerificationResult result = fromBuiltin(generation, proveAll(generation), start);
        logger.info("{}: {}", sourceFile, result.summary());
        return result;
    }

    /**
     * 内置证明器未能全部证明且 Lean 可用时，写出证明脚本交给 Lean 检查。
     * 内置证明器已经反驳的验证条件无论 Lean 的结论如何都保持失败。
     */
    public VerificationResult verify(Program program, String sourceFile) {
        long start = System.currentTimeMillis();
        GenerationResult generation = generate(program, sourceFile);
        List<ProofResult> proofs = proveAll(generation);
        VerificationResult builtin = fromBuiltin(generation, proofs, start);
        logger.info("{}: {}", sourceFile, builtin.summary());
        if (builtin.allProved() || !bridge.isAvailable()) {
            return builtin;
        }
        String script = writer.write(generation.getVcs(), sourceFile);
        Path file = writeScript(sourceFile, script);
        try {
            LeanResult lean = bridge.checkFile(file);
            VerificationResult result = fromLean(generation.getVcs(), proofs, script, lean)
                    .build(System.currentTimeMillis() - start);
            logger.info("{}: Lean 检查结果 {}，{}", sourceFile, lean.getKind(), result.summary());
            return result.with(options.isKeepGenerated() ? file : null, VerificationCoverage.from(generation));
        } finally {
            if (!options.isKeepGenerated()) {
                try {
                    Files.deleteIfExists(file);
                } catch (IOException e) {
                    logger.warn("无法删除临时证明脚本 {}: {}", file, e.getMessage());
                }
            }
        }
    }

    /**
     * 与 {@link #verify} 相同，但在 requireVerification 开启且存在失败的验证条件时抛出异常。
     */
    public VerificationResult verifyOrThrow(Program program, String sourceFile) {
        VerificationResult result = verify(program, sourceFile);
        if (options.isRequireVerification() && !result.isSuccess()) {
            VerificationResult.FailedVC first = result.getFailed().get(0);
            throw new VerificationException(String.format("%s: %d verification condition(s) failed, first: %s %s",
                    sourceFile, result.getFailed().size(), first.getId(), first.getError()));
        }
        return result;
    }

    /**
     * 导出附带证明概要的 Lean 脚本。
     */
    public void exportProofs(Program program, String sourceFile, Path output) {
        GenerationResult generation = generate(program, sourceFile);
        String script = writer.writeWithProofs(generation.getVcs(), proveAll(generation), sourceFile);
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, script, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new VerificationException("Failed to write proofs to " + output, e);
        }
        logger.info("证明脚本已导出到 {}", output);
    }

    /**
     * 以内置证明器的结论构造证书，源文件哈希取自 sourceFile 指向的文件。
     */
    public ProofCertificate exportCertificate(Program program, String sourceFile) {
        VerificationResult result = verifyBuiltin(program, sourceFile);
        return ProofCertificate.of(result, sourceFile, ProofCertificate.hashSource(Path.of(sourceFile)));
    }

    public ProofCoverageReport coverageReport(Program program, String sourceFile, String sourceText) {
        GenerationResult generation = generate(program, sourceFile);
        return ProofCoverageReport.from(sourceText, sourceFile, generation.getVcs(), proveAll(generation));
    }

    private List<ProofResult> proveAll(GenerationResult generation) {
        try (BuiltinProver prover = newProver(generation)) {
            List<ProofResult> results = new ArrayList<>(generation.size());
            for (VerificationCondition vc : generation.getVcs()) {
                results.add(prover.prove(vc));
            }
            return results;
        }
    }

    private static VerificationResult fromBuiltin(GenerationResult generation, List<ProofResult> proofs, long start) {
        VerificationResult.Builder builder = VerificationResult.builder();
        for (int i = 0; i < proofs.size(); i++) {
            builder.add(generation.getVcs().get(i), proofs.get(i));
        }
        return builder.build(System.currentTimeMillis() - start)
                .with(null, VerificationCoverage.from(generation));
    }

    private BuiltinProver newProver(GenerationResult generation) {
        BuiltinProver prover = new BuiltinProver();
        for (Map.Entry<String, BigInteger> e : generation.getArraySizes().entrySet()) {
            prover.defineArray(e.getKey(), e.getValue());
        }
        for (Map.Entry<String, BigInteger> e : generation.getConstants().entrySet()) {
            prover.defineConstant(e.getKey(), e.getValue());
        }
        if (options.isSmtFallback()) {
            prover.enableSmtFallback(options.getSmtTimeoutMillis());
        }
        return prover;
    }

    private Path writeScript(String sourceFile, String script) {
        String name = StringUtils.substringAfterLast("/" + Objects.toString(sourceFile, "").replace('\\', '/'), "/");
        String stem = StringUtils.defaultIfBlank(StringUtils.substringBeforeLast(name, "."), "program");
        Path file = options.getOutputDir().resolve(stem + "_vc.lean");
        try {
            Files.createDirectories(options.getOutputDir());
            Files.writeString(file, script, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new VerificationException("Failed to write proof script to " + file, e);
        }
        return file;
    }

    /**
     * 把 Lean 的结论映射回每条验证条件。错误诊断按 id 或行号归属到具体的 theorem。
     * 内置证明器反驳的条件保持失败；超时、Lean 不可用或错误无法归属时，
     * 内置证明器已有结论的条件保留原结论，其余变为 UNKNOWN。
     */
    static VerificationResult.Builder fromLean(List<VerificationCondition> vcs, List<ProofResult> builtin,
                                               String script, LeanResult lean) {
        if (vcs.size() != builtin.size()) {
            throw new IllegalArgumentException("Expected " + vcs.size() + " builtin results, got " + builtin.size());
        }
        VerificationResult.Builder builder = VerificationResult.builder();
        switch (lean.getKind()) {
            case SUCCESS -> {
                for (int i = 0; i < vcs.size(); i++) {
                    addChecked(builder, vcs.get(i), builtin.get(i), null);
                }
            }
            case TIMEOUT -> undecided(builder, vcs, builtin, lean.getReason());
            case NOT_AVAILABLE -> undecided(builder, vcs, builtin, "Lean 4 not available: " + lean.getReason());
            case ERRORS -> {
                Map<String, String> failures = new LinkedHashMap<>();
                for (LeanMessage message : lean.getErrors()) {
                    Optional<String> id = LeanCodeWriter.mentionedId(message.getMessage());
                    if (id.isEmpty() && message.getLine() > 0) {
                        id = LeanCodeWriter.theoremAt(script, message.getLine());
                    }
                    id.ifPresent(vcId -> failures.putIfAbsent(vcId, message.getMessage()));
                }
                if (failures.isEmpty()) {
                    String first = lean.getErrors().isEmpty() ? "unknown error" : lean.getErrors().get(0).getMessage();
                    undecided(builder, vcs, builtin, "Lean reported an error outside any condition: " + first);
                } else {
                    for (int i = 0; i < vcs.size(); i++) {
                        addChecked(builder, vcs.get(i), builtin.get(i), failures.get(vcs.get(i).getId()));
                    }
                }
            }
        }
        return builder;
    }

    private static void addChecked(VerificationResult.Builder builder, VerificationCondition vc,
                                   ProofResult builtin, String error) {
        if (builtin.isDisproved()) {
            builder.add(vc, builtin);
        } else if (error != null) {
            builder.fail(vc, error);
        } else {
            builder.add(vc, ProofResult.proved(vc.getTactic(), "checked by Lean"));
        }
    }

    private static void undecided(VerificationResult.Builder builder, List<VerificationCondition> vcs,
                                  List<ProofResult> builtin, String reason) {
        for (int i = 0; i < vcs.size(); i++) {
            if (builtin.get(i).isUnknown()) {
                builder.unknown(vcs.get(i), reason);
            } else {
                builder.add(vcs.get(i), builtin.get(i));
            }
        }
    }
}
