package org.ovsm.symbolic;

import org.ovsm.expressions.ArithOp;
import org.ovsm.expressions.Formula;
import org.ovsm.expressions.RelationType;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * 需要 Z3 本地库；加载失败时跳过。
 */
class Z3OracleTest {

    private static Z3Oracle oracle;

    @BeforeAll
    static void setUp() {
        try {
            oracle = new Z3Oracle(2000);
        } catch (LinkageError | RuntimeException e) {
            oracle = null;
        }
    }

    @AfterAll
    static void tearDown() {
        if (oracle != null) {
            oracle.close();
        }
    }

    private static Formula cmp(Formula left, RelationType relation, long right) {
        return Formula.compare(left, relation, Formula.constant(right));
    }

    @Test
    @DisplayName("x > 0 ∧ y > 0 蕴含 x + y > 1")
    void testValidImplication() {
        assumeTrue(oracle != null, "Z3 native library not available");
        Formula x = Formula.var("x");
        Formula y = Formula.var("y");

        Z3Oracle.OracleResult result = oracle.checkValidity(
                List.of(Formula.and(cmp(x, RelationType.GT, 0), cmp(y, RelationType.GT, 0))),
                cmp(Formula.arith(ArithOp.ADD, x, y), RelationType.GT, 1),
                new SymbolicEnvironment());

        assertEquals(Z3Oracle.OracleResult.VALID, result);
    }

    @Test
    @DisplayName("没有假设时 x ≠ 0 可以被反驳")
    void testRefutableGoal() {
        assumeTrue(oracle != null, "Z3 native library not available");

        Z3Oracle.OracleResult result = oracle.checkValidity(List.of(),
                cmp(Formula.var("x"), RelationType.NE, 0), new SymbolicEnvironment());

        assertEquals(Z3Oracle.OracleResult.REFUTABLE, result);
    }

    @Test
    @DisplayName("环境中的数组大小参与判定")
    void testArraySizeFromEnvironment() {
        assumeTrue(oracle != null, "Z3 native library not available");
        SymbolicEnvironment env = new SymbolicEnvironment();
        env.defineArray("arr", 10);
        Formula i = Formula.var("i");

        Z3Oracle.OracleResult result = oracle.checkValidity(
                List.of(cmp(i, RelationType.LT, 10)),
                Formula.compare(i, RelationType.LT, Formula.field(Formula.var("arr"), "size")),
                env);

        assertEquals(Z3Oracle.OracleResult.VALID, result);
    }

    @Test
    @DisplayName("无法翻译的目标返回 UNKNOWN")
    void testUntranslatableGoal() {
        assumeTrue(oracle != null, "Z3 native library not available");

        assertEquals(Z3Oracle.OracleResult.UNKNOWN,
                oracle.checkValidity(List.of(), Formula.pred("precision_acceptable"), new SymbolicEnvironment()));
    }
}
