package org.ovsm.verifier;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.hash.Hashing;
import lombok.Getter;
import org.ovsm.core.ProofResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 供审计使用的证明证书，与进程内的 {@link VerificationResult} 解耦，序列化为 snake_case 的 JSON。
 * @author Ayalyt
 */
@Getter
@JsonPropertyOrder({"version", "source_file", "source_hash", "timestamp", "verifier", "total_vcs",
        "proved_count", "advisory_count", "failed_count", "unknown_count", "verification_time_ms", "vcs"})
public final class ProofCertificate {

    private static final Logger logger = LoggerFactory.getLogger(ProofCertificate.class);

    public static final String VERSION = "1.0";
    public static final String VERIFIER = "ovsm-builtin-v1";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final String version;
    private final String sourceFile;
    private final String sourceHash;
    private final String timestamp;
    private final String verifier;
    private final int totalVcs;
    private final int provedCount;
    private final int advisoryCount;
    private final int failedCount;
    private final int unknownCount;
    private final long verificationTimeMs;
    private final List<Entry> vcs;

    /**
     * 单条验证条件的记录。status 取 proved/advisory/failed/unknown，reason 仅在非 proved 时出现。
     */
    @Getter
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"id", "category", "description", "location", "status", "reason", "proof_method"})
    public static final class Entry {
        private final String id;
        private final String category;
        private final String description;
        private final String location;
        private final String status;
        private final String reason;
        private final String proofMethod;

        private Entry(VerificationResult.Summary summary, String status, String reason, String proofMethod) {
            this.id = summary.getId();
            this.category = summary.getCategoryName();
            this.description = summary.getDescription();
            this.location = summary.getLocation() == null ? null : summary.getLocation().toString();
            this.status = status;
            this.reason = reason;
            this.proofMethod = proofMethod;
        }
    }

    private ProofCertificate(String sourceFile, String sourceHash, Instant timestamp, VerificationResult result) {
        this.version = VERSION;
        this.sourceFile = Objects.requireNonNull(sourceFile, "Source file cannot be null");
        this.sourceHash = sourceHash;
        this.timestamp = timestamp.toString();
        this.verifier = VERIFIER;
        this.totalVcs = result.totalVcs();
        this.provedCount = result.getProved().size();
        this.advisoryCount = result.getAdvisory().size();
        this.failedCount = result.getFailed().size();
        this.unknownCount = result.getUnknown().size();
        this.verificationTimeMs = result.getTimeMs();
        List<Entry> entries = new ArrayList<>();
        for (VerificationResult.ProvedVC vc : result.getProved()) {
            entries.add(new Entry(vc, "proved", null, methodName(vc.getMethod())));
        }
        for (VerificationResult.AdvisoryVC vc : result.getAdvisory()) {
            entries.add(new Entry(vc, "advisory", vc.getWarning(), methodName(ProofResult.Method.BUILTIN)));
        }
        for (VerificationResult.FailedVC vc : result.getFailed()) {
            entries.add(new Entry(vc, "failed", vc.getError(), methodName(ProofResult.Method.BUILTIN)));
        }
        for (VerificationResult.UnknownVC vc : result.getUnknown()) {
            entries.add(new Entry(vc, "unknown", vc.getReason(), methodName(ProofResult.Method.BUILTIN)));
        }
        this.vcs = List.copyOf(entries);
    }

    /**
     * 以当前时间和给定的源文件哈希构造证书。
     */
    public static ProofCertificate of(VerificationResult result, String sourceFile, String sourceHash) {
        return of(result, sourceFile, sourceHash, Instant.now());
    }

    public static ProofCertificate of(VerificationResult result, String sourceFile, String sourceHash,
                                      Instant timestamp) {
        Objects.requireNonNull(result, "Verification result cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        return new ProofCertificate(sourceFile, Objects.requireNonNull(sourceHash, "Source hash cannot be null"),
                timestamp, result);
    }

    /**
     * 源文件字节的 SHA-256 (小写十六进制)。文件无法读取时按空内容计算。
     */
    public static String hashSource(Path source) {
        byte[] content = new byte[0];
        try {
            content = Files.readAllBytes(source);
        } catch (IOException e) {
            logger.warn("无法读取源文件 {}，按空内容计算哈希: {}", source, e.getMessage());
        }
        return Hashing.sha256().hashBytes(content).toString();
    }

    public static String hashText(String content) {
        return Hashing.sha256().hashString(content, StandardCharsets.UTF_8).toString();
    }

    private static String methodName(ProofResult.Method method) {
        return switch (method) {
            case BUILTIN -> "builtin_verifier";
            case Z3 -> "z3_fallback";
        };
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new VerificationException("Failed to serialize certificate: " + e.getOriginalMessage(), e);
        }
    }

    public void toJsonFile(Path path) {
        String json = toJson();
        try {
            Files.writeString(path, json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new VerificationException("Failed to write certificate: " + path, e);
        }
        logger.info("证明证书已写入 {}", path);
    }

    @JsonIgnore
    public boolean isVerified() {
        return failedCount == 0;
    }

    /**
     * 已证明与 ADVISORY 的验证条件所占百分比。
     */
    public double passRate() {
        return totalVcs == 0 ? 100.0 : (provedCount + advisoryCount) * 100.0 / totalVcs;
    }

    @Override
    public String toString() {
        return "ProofCertificate{" + sourceFile + ", proved=" + provedCount + "/" + totalVcs
                + ", failed=" + failedCount + ", unknown=" + unknownCount + "}";
    }
}
