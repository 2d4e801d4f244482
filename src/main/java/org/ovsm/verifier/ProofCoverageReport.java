package org.ovsm.verifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.ovsm.core.ProofResult;
import org.ovsm.core.VerificationCondition;

import java.util.*;

/**
 * 按源代码行统计的证明覆盖报告。
 * <p>
 * 一行只要有一条未被证明的验证条件就算作 unproved；只有全部验证条件都已证明 (或 ADVISORY) 的行才算 proved。
 * 注释行以 ";;" 开头，不计入代码行。
 */
@Getter
public final class ProofCoverageReport {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String sourceFile;
    private final int totalLines;
    private final int codeLines;
    private final int provedLines;
    private final int unprovedLines;
    private final int uncoveredLines;
    private final Set<Integer> provedLineSet;
    private final Set<Integer> unprovedLineSet;
    private final Map<String, CategoryStats> byCategory;
    private final int totalVcs;
    private final int provedVcs;

    /**
     * 单个类别的统计。
     */
    @Getter
    public static final class CategoryStats {
        private int count;
        private int proved;
        private int unproved;
        private final Set<Integer> lines = new TreeSet<>();

        private void record(boolean discharged, Integer line) {
            count++;
            if (discharged) {
                proved++;
            } else {
                unproved++;
            }
            if (line != null) {
                lines.add(line);
            }
        }

        public double proofRate() {
            return count == 0 ? 100.0 : proved * 100.0 / count;
        }
    }

    private ProofCoverageReport(String sourceFile, int totalLines, int codeLines, Set<Integer> provedLineSet,
                                Set<Integer> unprovedLineSet, int uncoveredLines,
                                Map<String, CategoryStats> byCategory, int totalVcs, int provedVcs) {
        this.sourceFile = sourceFile;
        this.totalLines = totalLines;
        this.codeLines = codeLines;
        this.provedLineSet = Collections.unmodifiableSet(provedLineSet);
        this.unprovedLineSet = Collections.unmodifiableSet(unprovedLineSet);
        this.provedLines = provedLineSet.size();
        this.unprovedLines = unprovedLineSet.size();
        this.uncoveredLines = uncoveredLines;
        this.byCategory = Collections.unmodifiableMap(byCategory);
        this.totalVcs = totalVcs;
        this.provedVcs = provedVcs;
    }

    /**
     * 由源代码文本、验证条件以及对应的证明结果 (与 vcs 一一对应) 构造报告。
     */
    public static ProofCoverageReport from(String source, String sourceFile, List<VerificationCondition> vcs,
                                           List<ProofResult> results) {
        Objects.requireNonNull(source, "Source text cannot be null");
        if (vcs.size() != results.size()) {
            throw new IllegalArgumentException("Expected " + vcs.size() + " proof results, got " + results.size());
        }
        String[] lines = source.isEmpty() ? new String[0] : source.split("\\R", -1);
        int totalLines = lines.length;
        // 末尾换行不产生额外的一行
        if (totalLines > 0 && lines[totalLines - 1].isEmpty()) {
            totalLines--;
        }
        int codeLines = 0;
        for (int i = 0; i < totalLines; i++) {
            String trimmed = lines[i].trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith(";;")) {
                codeLines++;
            }
        }

        Set<Integer> proved = new TreeSet<>();
        Set<Integer> unproved = new TreeSet<>();
        Map<String, CategoryStats> byCategory = new TreeMap<>();
        int provedVcs = 0;
        for (int i = 0; i < vcs.size(); i++) {
            VerificationCondition vc = vcs.get(i);
            boolean discharged = results.get(i).isDischarged();
            Integer line = vc.getLocation() == null ? null : vc.getLocation().getLine();
            byCategory.computeIfAbsent(vc.getCategoryName(), k -> new CategoryStats()).record(discharged, line);
            if (discharged) {
                provedVcs++;
            }
            if (line != null) {
                (discharged ? proved : unproved).add(line);
            }
        }
        Set<Integer> touched = new HashSet<>(proved);
        touched.addAll(unproved);
        proved.removeAll(unproved);
        int uncovered = Math.max(0, codeLines - touched.size());
        return new ProofCoverageReport(sourceFile, totalLines, codeLines, proved, unproved, uncovered,
                byCategory, vcs.size(), provedVcs);
    }

    public double lineCoveragePercent() {
        return codeLines == 0 ? 100.0 : provedLines * 100.0 / codeLines;
    }

    public double vcProofRate() {
        return totalVcs == 0 ? 100.0 : provedVcs * 100.0 / totalVcs;
    }

    /**
     * 有验证条件的行 (无论是否证明) 占代码行的比例。
     */
    public double riskyCoveragePercent() {
        return codeLines == 0 ? 100.0 : (provedLines + unprovedLines) * 100.0 / codeLines;
    }

    public List<Integer> unprovedLinesList() {
        return new ArrayList<>(unprovedLineSet);
    }

    public String summary() {
        int riskyOps = byCategory.values().stream().mapToInt(CategoryStats::getCount).sum();
        return "Proof Coverage Report for " + sourceFile + "\n"
                + StringUtils.repeat('═', 40) + "\n"
                + String.format(Locale.ROOT, "Source:           %d lines (%d code, %d comments/blank)%n",
                totalLines, codeLines, totalLines - codeLines)
                + "\n"
                + "Verification Conditions:\n"
                + String.format(Locale.ROOT, "• Total VCs:      %d%n", totalVcs)
                + String.format(Locale.ROOT, "• Proved:         %d (%.1f%%)%n", provedVcs, vcProofRate())
                + String.format(Locale.ROOT, "• Unproved:       %d%n", totalVcs - provedVcs)
                + "\n"
                + String.format(Locale.ROOT, "Categories Checked: %d%n", byCategory.size())
                + String.format(Locale.ROOT, "Total Risky Ops:    %d%n", riskyOps);
    }

    /**
     * 按验证条件数量降序排列的类别表，全部证明的类别标 ✓。
     */
    public String categoryBreakdown() {
        String rule = StringUtils.repeat('─', 49) + "\n";
        StringBuilder sb = new StringBuilder("VCs by Category:\n").append(rule);
        List<Map.Entry<String, CategoryStats>> entries = new ArrayList<>(byCategory.entrySet());
        entries.sort(Comparator.comparingInt((Map.Entry<String, CategoryStats> e) -> e.getValue().getCount())
                .reversed());
        for (Map.Entry<String, CategoryStats> e : entries) {
            CategoryStats stats = e.getValue();
            sb.append(String.format(Locale.ROOT, "  %s %-28s %3d/%3d (%5.1f%%)%n",
                    stats.getUnproved() == 0 ? "✓" : "✗", e.getKey(), stats.getProved(), stats.getCount(),
                    stats.proofRate()));
        }
        return sb.append(rule).toString();
    }

    public String toJson() {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("source_file", sourceFile);
        root.put("total_lines", totalLines);
        root.put("code_lines", codeLines);
        root.put("proved_lines", provedLines);
        root.put("unproved_lines", unprovedLines);
        root.put("uncovered_lines", uncoveredLines);
        root.put("total_vcs", totalVcs);
        root.put("proved_vcs", provedVcs);
        ObjectNode metrics = root.putObject("metrics");
        metrics.put("line_coverage_percent", lineCoveragePercent());
        metrics.put("vc_proof_rate", vcProofRate());
        metrics.put("risky_coverage_percent", riskyCoveragePercent());
        ObjectNode categories = root.putObject("by_category");
        byCategory.forEach((name, stats) -> {
            ObjectNode node = categories.putObject(name);
            node.put("count", stats.getCount());
            node.put("proved", stats.getProved());
            node.put("unproved", stats.getUnproved());
            node.put("lines", stats.getLines().size());
        });
        ArrayNode lines = root.putArray("unproved_line_numbers");
        for (int line : unprovedLineSet) {
            lines.add(line);
        }
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new VerificationException("Failed to serialize coverage report", e);
        }
    }

    @Override
    public String toString() {
        return summary();
    }
}
