package org.ovsm.bridge;

import org.apache.commons.lang3.StringUtils;
import org.ovsm.core.ProofResult;
import org.ovsm.core.SourceLocation;
import org.ovsm.core.VerificationCondition;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 把验证条件写成 Lean 4 证明脚本：每条验证条件一个 theorem，假设作为前提依次 intro。
 * @author Ayalyt
 */
public final class LeanCodeWriter {

    private static final Pattern THEOREM = Pattern.compile("^theorem\\s+(\\S+)\\s+:");
    private static final Pattern VC_ID = Pattern.compile("vc_\\w+?_\\d+");

    /**
     * 源文件名去掉目录和扩展名，再把 '-' '.' ' ' 换成 '_'。
     */
    public static String namespaceFor(String sourceFile) {
        String stem = "Program";
        if (StringUtils.isNotBlank(sourceFile)) {
            Path fileName = Path.of(sourceFile).getFileName();
            if (fileName != null) {
                stem = StringUtils.substringBeforeLast(fileName.toString(), ".");
            }
        }
        if (stem.isEmpty()) {
            stem = "Program";
        }
        return "VC_" + StringUtils.replaceChars(stem, "-. ", "___");
    }

    public String write(List<VerificationCondition> vcs, String sourceFile) {
        String namespace = namespaceFor(sourceFile);
        StringBuilder sb = new StringBuilder();
        sb.append("/-\n");
        sb.append("  Auto-generated verification conditions for: ").append(sourceFile).append('\n');
        sb.append("  Generated by OVSM compiler - DO NOT EDIT\n");
        sb.append("-/\n\n");
        sb.append("import OVSM\n");
        sb.append("open OVSM OVSM.Tactics\n\n");
        sb.append("namespace ").append(namespace).append("\n\n");
        for (VerificationCondition vc : vcs) {
            appendTheorem(sb, vc);
        }
        sb.append("end ").append(namespace).append('\n');
        return sb.toString();
    }

    /**
     * 导出用的脚本：在普通脚本前附加一段文档注释，列出内置证明器已解决的条件及其证明概要。
     */
    public String writeWithProofs(List<VerificationCondition> vcs, List<ProofResult> results, String sourceFile) {
        if (vcs.size() != results.size()) {
            throw new IllegalArgumentException("Expected one proof result per VC, got "
                    + results.size() + " for " + vcs.size());
        }
        StringBuilder sb = new StringBuilder();
        sb.append("/-!\n# OVSM Verification Certificates\n\nGenerated from: ").append(sourceFile).append("\n\n");
        for (int i = 0; i < vcs.size(); i++) {
            ProofResult result = results.get(i);
            if (!result.isDischarged()) {
                continue;
            }
            sb.append("/-- ").append(vcs.get(i).getId()).append(" proof: ").append(result.getProof()).append(" -/\n");
            sb.append("/-- Explanation: ").append(result.getExplanation()).append(" -/\n\n");
        }
        sb.append("-/\n\n");
        sb.append(write(vcs, sourceFile));
        return sb.toString();
    }

    private static void appendTheorem(StringBuilder sb, VerificationCondition vc) {
        sb.append("-- ").append(vc.getDescription()).append('\n');
        SourceLocation location = vc.getLocation();
        if (location != null) {
            sb.append("-- Source: ").append(location).append('\n');
        }
        List<String> assumptions = vc.getAssumptionTexts();
        sb.append("theorem ").append(vc.getId()).append(" : ");
        if (assumptions.isEmpty()) {
            sb.append(vc.getPropertyText()).append(" := by\n");
        } else {
            sb.append(String.join(" → ", assumptions)).append(" → ").append(vc.getPropertyText()).append(" := by\n");
            sb.append("  intro").append(StringUtils.repeat(" _", assumptions.size())).append('\n');
        }
        sb.append("  ").append(vc.getTactic()).append("\n\n");
    }

    /**
     * 脚本第 line 行 (从 1 开始) 所属的 theorem 名，即该行及之前最近的一个 theorem 声明。
     */
    public static Optional<String> theoremAt(String script, int line) {
        String[] lines = script.split("\n", -1);
        for (int i = Math.min(line, lines.length) - 1; i >= 0; i--) {
            Matcher m = THEOREM.matcher(lines[i]);
            if (m.find()) {
                return Optional.of(m.group(1));
            }
            if (lines[i].startsWith("end ") || lines[i].startsWith("namespace ")) {
                break;
            }
        }
        return Optional.empty();
    }

    /**
     * 诊断正文中直接提到的验证条件 id。
     */
    public static Optional<String> mentionedId(String message) {
        Matcher m = VC_ID.matcher(message);
        return m.find() ? Optional.of(m.group()) : Optional.empty();
    }
}
