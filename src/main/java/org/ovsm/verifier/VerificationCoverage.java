package org.ovsm.verifier;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.ovsm.core.VerificationCondition;
import org.ovsm.generator.GenerationResult;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * 风险操作覆盖统计：生成了验证条件的节点数对比总的风险操作数，
 * 未覆盖的操作记录 (操作, 原因)。
 */
@Getter
public final class VerificationCoverage {

    private final int totalOperations;
    private final int coveredOperations;
    private final Map<String, Integer> byCategory;
    private final List<Pair<String, String>> uncovered;

    private VerificationCoverage(int totalOperations, int coveredOperations, Map<String, Integer> byCategory,
                                 List<Pair<String, String>> uncovered) {
        this.totalOperations = totalOperations;
        this.coveredOperations = coveredOperations;
        this.byCategory = Collections.unmodifiableMap(new TreeMap<>(byCategory));
        this.uncovered = List.copyOf(uncovered);
    }

    public static VerificationCoverage from(GenerationResult generation) {
        Map<String, Integer> byCategory = new TreeMap<>();
        for (VerificationCondition vc : generation.getVcs()) {
            byCategory.merge(vc.getCategoryName(), 1, Integer::sum);
        }
        int covered = generation.getNodesWithVcs();
        return new VerificationCoverage(covered + generation.getUncovered().size(), covered, byCategory,
                generation.getUncovered());
    }

    public double percentage() {
        if (totalOperations == 0) {
            return 100.0;
        }
        return coveredOperations * 100.0 / totalOperations;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Coverage %d/%d (%.1f%%), uncovered=%s", coveredOperations, totalOperations,
                percentage(), uncovered);
    }
}
