package org.ovsm.generator;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.ovsm.core.VerificationCondition;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * 一次生成的产物：验证条件列表、从源代码中学到的数组大小与整数常量，以及覆盖计数。
 */
@Getter
public final class GenerationResult {

    private final List<VerificationCondition> vcs;
    private final Map<String, BigInteger> arraySizes;
    private final Map<String, BigInteger> constants;
    private final int totalNodes;
    private final int nodesWithVcs;
    // (操作, 未覆盖原因)
    private final List<Pair<String, String>> uncovered;

    GenerationResult(List<VerificationCondition> vcs, Map<String, BigInteger> arraySizes,
                     Map<String, BigInteger> constants, int totalNodes, int nodesWithVcs,
                     List<Pair<String, String>> uncovered) {
        this.vcs = List.copyOf(vcs);
        this.arraySizes = Map.copyOf(arraySizes);
        this.constants = Map.copyOf(constants);
        this.totalNodes = totalNodes;
        this.nodesWithVcs = nodesWithVcs;
        this.uncovered = List.copyOf(uncovered);
    }

    public int size() {
        return vcs.size();
    }

    @Override
    public String toString() {
        return "GenerationResult{vcs=" + vcs.size() + ", arrays=" + arraySizes + ", constants=" + constants
                + ", nodes=" + nodesWithVcs + "/" + totalNodes + ", uncovered=" + uncovered.size() + "}";
    }
}
