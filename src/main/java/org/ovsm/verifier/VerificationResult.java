package org.ovsm.verifier;

import lombok.Getter;
import org.ovsm.core.ProofResult;
import org.ovsm.core.SourceLocation;
import org.ovsm.core.VCCategory;
import org.ovsm.core.VerificationCondition;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 一次验证的结果，按结论分为四组。
 * success 表示没有失败的验证条件；UNKNOWN 不算失败，但也不算证明。
 * @author Ayalyt
 */
@Getter
public final class VerificationResult {

    private final List<ProvedVC> proved;
    private final List<AdvisoryVC> advisory;
    private final List<FailedVC> failed;
    private final List<UnknownVC> unknown;
    private final long timeMs;
    // 保留的外部证明脚本，可能为 null
    private final Path leanFile;
    // 可能为 null
    private final VerificationCoverage coverage;

    private VerificationResult(List<ProvedVC> proved, List<AdvisoryVC> advisory, List<FailedVC> failed,
                               List<UnknownVC> unknown, long timeMs, Path leanFile, VerificationCoverage coverage) {
        this.proved = List.copyOf(proved);
        this.advisory = List.copyOf(advisory);
        this.failed = List.copyOf(failed);
        this.unknown = List.copyOf(unknown);
        this.timeMs = timeMs;
        this.leanFile = leanFile;
        this.coverage = coverage;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isSuccess() {
        return failed.isEmpty();
    }

    public boolean allProved() {
        return failed.isEmpty() && unknown.isEmpty();
    }

    public int totalVcs() {
        return proved.size() + advisory.size() + failed.size() + unknown.size();
    }

    public String summary() {
        if (allProved()) {
            String text = String.format("Verification PASSED: %d/%d conditions proved in %dms",
                    proved.size(), totalVcs(), timeMs);
            return advisory.isEmpty() ? text : text + " (" + advisory.size() + " advisory)";
        }
        return String.format("Verification FAILED: %d proved, %d failed, %d unknown",
                proved.size(), failed.size(), unknown.size());
    }

    /**
     * 附加外部脚本路径和覆盖统计后的副本。
     */
    public VerificationResult with(Path leanFile, VerificationCoverage coverage) {
        return new VerificationResult(proved, advisory, failed, unknown, timeMs, leanFile, coverage);
    }

    @Override
    public String toString() {
        return summary();
    }

    /**
     * 四种结论共有的部分。
     */
    @Getter
    public abstract static class Summary {
        private final String id;
        private final VCCategory category;
        private final String categoryName;
        private final String description;
        // 可能为 null
        private final SourceLocation location;

        Summary(VerificationCondition vc, String description) {
            this.id = vc.getId();
            this.category = vc.getCategory();
            this.categoryName = vc.getCategoryName();
            this.description = Objects.requireNonNull(description, "Description cannot be null");
            this.location = vc.getLocation();
        }

        @Override
        public String toString() {
            return id + " [" + categoryName + "] " + description;
        }
    }

    @Getter
    public static final class ProvedVC extends Summary {
        private final String proof;
        private final ProofResult.Method method;

        ProvedVC(VerificationCondition vc, ProofResult result) {
            super(vc, result.getExplanation().isEmpty()
                    ? vc.getDescription()
                    : vc.getDescription() + " (" + result.getExplanation() + ")");
            this.proof = result.getProof();
            this.method = result.getMethod();
        }
    }

    @Getter
    public static final class AdvisoryVC extends Summary {
        private final String warning;

        AdvisoryVC(VerificationCondition vc, String warning) {
            super(vc, vc.getDescription());
            this.warning = warning;
        }
    }

    @Getter
    public static final class FailedVC extends Summary {
        private final String error;
        // 可能为 null
        private final String suggestion;

        FailedVC(VerificationCondition vc, String error) {
            super(vc, vc.getDescription());
            this.error = error;
            this.suggestion = Suggestions.forCategory(vc.getCategory());
        }
    }

    @Getter
    public static final class UnknownVC extends Summary {
        private final String reason;

        UnknownVC(VerificationCondition vc, String reason) {
            super(vc, vc.getDescription());
            this.reason = reason;
        }
    }

    /**
     * 按证明结论逐条归类。
     */
    public static final class Builder {
        private final List<ProvedVC> proved = new ArrayList<>();
        private final List<AdvisoryVC> advisory = new ArrayList<>();
        private final List<FailedVC> failed = new ArrayList<>();
        private final List<UnknownVC> unknown = new ArrayList<>();

        private Builder() {
        }

        public Builder add(VerificationCondition vc, ProofResult result) {
            switch (result.getStatus()) {
                case PROVED -> proved.add(new ProvedVC(vc, result));
                case ADVISORY -> advisory.add(new AdvisoryVC(vc, result.getExplanation()));
                case DISPROVED -> failed.add(new FailedVC(vc, "Counterexample: " + result.getCounterexample()));
                case UNKNOWN -> unknown.add(new UnknownVC(vc, result.getReason()));
            }
            return this;
        }

        public Builder fail(VerificationCondition vc, String error) {
            failed.add(new FailedVC(vc, error));
            return this;
        }

        public Builder unknown(VerificationCondition vc, String reason) {
            unknown.add(new UnknownVC(vc, reason));
            return this;
        }

        public VerificationResult build(long timeMs) {
            return new VerificationResult(proved, advisory, failed, unknown, timeMs, null, null);
        }
    }
}
