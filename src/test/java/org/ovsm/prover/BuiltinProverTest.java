package org.ovsm.prover;

import org.ovsm.core.ProofResult;
import org.ovsm.core.SourceLocation;
import org.ovsm.core.VCCategory;
import org.ovsm.core.VerificationCondition;
import org.ovsm.expressions.ArithOp;
import org.ovsm.expressions.Formula;
import org.ovsm.expressions.RelationType;
import org.ovsm.symbolic.PathCondition;
import org.ovsm.symbolic.PathConstraint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinProverTest {

    private BuiltinProver prover;

    @BeforeEach
    void setUp() {
        prover = new BuiltinProver();
    }

    @AfterEach
    void tearDown() {
        prover.close();
    }

    private static VerificationCondition vc(VCCategory category, Formula property, Formula... assumptions) {
        return VerificationCondition.of("vc_test_1", category, "test condition",
                SourceLocation.of("test.ovsm", 1, 1), property, List.of(assumptions), "omega");
    }

    private static Formula cmp(Formula left, RelationType relation, Formula right) {
        return Formula.compare(left, relation, right);
    }

    private static Formula num(long value) {
        return Formula.constant(value);
    }

    private static Formula var(String name) {
        return Formula.var(name);
    }

    private static Formula signer(long account) {
        return cmp(Formula.index("account_is_signer", account), RelationType.EQ, Formula.TRUE);
    }

    @Nested
    @DisplayName("除法安全 (Division safety)")
    class DivisionTests {

        @Test
        @DisplayName("常量除数 5 ≠ 0 应被证明")
        void testLiteralNonZeroDivisor_ShouldBeProved() {
            ProofResult result = prover.prove(vc(VCCategory.DIVISION_SAFETY, cmp(num(5), RelationType.NE, num(0))));

            assertAll("5 ≠ 0",
                    () -> assertEquals(ProofResult.Status.PROVED, result.getStatus()),
                    () -> assertEquals("decide", result.getProof(), "Constant goals are closed by computation"),
                    () -> assertEquals(ProofResult.Method.BUILTIN, result.getMethod())
            );
        }

        @Test
        @DisplayName("常量除数 0 ≠ 0 应被否证")
        void testLiteralZeroDivisor_ShouldBeDisproved() {
            ProofResult result = prover.prove(vc(VCCategory.DIVISION_SAFETY, cmp(num(0), RelationType.NE, num(0))));

            assertAll("0 ≠ 0",
                    () -> assertTrue(result.isDisproved()),
                    () -> assertTrue(result.getCounterexample().contains("0 ≠ 0"),
                            "Counterexample should restate the failing comparison: " + result.getCounterexample())
            );
        }

        @Test
        @DisplayName("字面量零除 (False) 应被否证")
        void testDivisionByLiteralZero_ShouldBeDisproved() {
            ProofResult result = prover.prove(vc(VCCategory.DIVISION_SAFETY, Formula.FALSE));

            assertAll("x / 0",
                    () -> assertTrue(result.isDisproved()),
                    () -> assertEquals("division by literal zero: divisor is 0", result.getCounterexample())
            );
        }

        @Test
        @DisplayName("压入 x ≥ 1 后 x ≠ 0 成立，弹出后无法判定")
        void testPathCondition_PushAndPop() {
            VerificationCondition goal = vc(VCCategory.DIVISION_SAFETY, cmp(var("x"), RelationType.NE, num(0)));

            prover.pushPathCondition(PathCondition.of("x", PathConstraint.geq(1)));
            ProofResult withCondition = prover.prove(goal);
            prover.popPathCondition();
            ProofResult withoutCondition = prover.prove(goal);

            assertAll("Path condition scoping",
                    () -> assertTrue(withCondition.isProved(), "x ≥ 1 implies x ≠ 0"),
                    () -> assertTrue(withoutCondition.isUnknown(), "Nothing is known about x after pop"),
                    () -> assertTrue(withoutCondition.getReason().contains("'x'"),
                            "Reason should name the divisor: " + withoutCondition.getReason())
            );
        }

        @Test
        @DisplayName("验证条件自带的假设 (y > 0) 应被使用")
        void testAssumptionInsideCondition_ShouldBeUsed() {
            ProofResult result = prover.prove(vc(VCCategory.DIVISION_SAFETY,
                    cmp(var("y"), RelationType.NE, num(0)),
                    cmp(var("y"), RelationType.GT, num(0))));

            assertTrue(result.isProved());
        }

        @Test
        @DisplayName("被否定的析取只给出上界，不能排除零")
        void testNegatedDisjunction_ShouldNotProve() {
            Formula assumption = Formula.not(Formula.or(cmp(var("y"), RelationType.GT, num(0)), var("flag")));
            ProofResult result = prover.prove(vc(VCCategory.DIVISION_SAFETY,
                    cmp(var("y"), RelationType.NE, num(0)), assumption));

            assertTrue(result.isUnknown(), "¬(y > 0 ∨ flag) says y ≤ 0, which does not exclude zero");
        }

        @Test
        @DisplayName("已定义的常量除数应被证明")
        void testConstantFromEnvironment_ShouldBeProved() {
            prover.defineConstant("FEE_DENOMINATOR", java.math.BigInteger.valueOf(10_000));

            ProofResult result = prover.prove(vc(VCCategory.DIVISION_SAFETY,
                    cmp(var("FEE_DENOMINATOR"), RelationType.NE, num(0))));

            assertTrue(result.isProved());
        }
    }

    @Nested
    @DisplayName("数组边界 (Array bounds)")
    class BoundsTests {

        @Test
        @DisplayName("下标 15 越过大小为 10 的数组应被否证")
        void testIndexPastEnd_ShouldBeDisproved() {
            prover.defineArray("arr", 10);

            ProofResult result = prover.prove(vc(VCCategory.ARRAY_BOUNDS,
                    cmp(num(15), RelationType.LT, Formula.field(var("arr"), "size"))));

            assertAll("15 < arr.size",
                    () -> assertTrue(result.isDisproved()),
                    () -> assertTrue(result.getCounterexample().contains("15"), result.getCounterexample()),
                    () -> assertTrue(result.getCounterexample().contains("10"), result.getCounterexample())
            );
        }

        @Test
        @DisplayName("下标 3 在大小为 10 的数组内应被证明")
        void testIndexInside_ShouldBeProved() {
            prover.defineArray("arr", 10);

            ProofResult result = prover.prove(vc(VCCategory.ARRAY_BOUNDS,
                    cmp(num(3), RelationType.LT, Formula.field(var("arr"), "size"))));

            assertTrue(result.isProved());
        }

        @Test
        @DisplayName("负下标应被否证")
        void testNegativeIndex_ShouldBeDisproved() {
            prover.defineArray("arr", 10);

            ProofResult result = prover.prove(vc(VCCategory.ARRAY_BOUNDS,
                    cmp(Formula.neg(num(1)), RelationType.LT, Formula.field(var("arr"), "size"))));

            assertAll("-1 < arr.size",
                    () -> assertTrue(result.isDisproved()),
                    () -> assertEquals("index -1 is negative (out of bounds)", result.getCounterexample())
            );
        }

        @Test
        @DisplayName("只有上界而没有下界的变量下标无法判定")
        void testIndexWithoutLowerBound_ShouldBeUnknown() {
            prover.defineArray("arr", 10);

            ProofResult result = prover.prove(vc(VCCategory.ARRAY_BOUNDS,
                    cmp(var("i"), RelationType.LT, Formula.field(var("arr"), "size")),
                    cmp(var("i"), RelationType.LT, num(10))));

            assertAll("i < 10 without i ≥ 0",
                    () -> assertTrue(result.isUnknown()),
                    () -> assertTrue(result.getReason().contains("negative"), result.getReason())
            );
        }

        @Test
        @DisplayName("0 ≤ i < 10 时访问大小为 10 的数组应被证明")
        void testBoundedIndex_ShouldBeProved() {
            prover.defineArray("arr", 10);

            ProofResult result = prover.prove(vc(VCCategory.ARRAY_BOUNDS,
                    cmp(var("i"), RelationType.LT, Formula.field(var("arr"), "size")),
                    Formula.and(cmp(var("i"), RelationType.GE, num(0)), cmp(var("i"), RelationType.LT, num(10)))));

            assertTrue(result.isProved());
        }
    }

    @Nested
    @DisplayName("减法下溢 (Underflow)")
    class UnderflowTests {

        @Test
        @DisplayName("字面量 5 - 10 应被否证")
        void testLiteralUnderflow_ShouldBeDisproved() {
            ProofResult result = prover.prove(vc(VCCategory.ARITHMETIC_UNDERFLOW,
                    cmp(Formula.field(num(5), "toNat"), RelationType.GE, Formula.field(num(10), "toNat"))));

            assertAll("5 - 10",
                    () -> assertTrue(result.isDisproved()),
                    () -> assertTrue(result.getCounterexample().contains("5 ≥ 10"), result.getCounterexample())
            );
        }

        @Test
        @DisplayName("balance ≥ amount 的假设应证明无下溢")
        void testBalanceCheck_ShouldProve() {
            ProofResult result = prover.prove(vc(VCCategory.ARITHMETIC_UNDERFLOW,
                    cmp(Formula.field(var("balance"), "toNat"), RelationType.GE, Formula.field(var("amount"), "toNat")),
                    cmp(var("balance"), RelationType.GE, var("amount"))));

            assertTrue(result.isProved());
        }

        @Test
        @DisplayName("没有余额检查时无法判定")
        void testNoCheck_ShouldBeUnknown() {
            ProofResult result = prover.prove(vc(VCCategory.ARITHMETIC_UNDERFLOW,
                    cmp(Formula.field(var("balance"), "toNat"), RelationType.GE, Formula.field(var("amount"), "toNat"))));

            assertTrue(result.isUnknown());
        }
    }

    @Nested
    @DisplayName("溢出与循环不变式 (Overflow and loop invariants)")
    class ArithmeticTests {

        @Test
        @DisplayName("有上界的加法不会溢出")
        void testBoundedAddition_ShouldBeProved() {
            Formula sum = Formula.arith(ArithOp.ADD, var("a"), var("b"));
            ProofResult result = prover.prove(vc(VCCategory.ARITHMETIC_OVERFLOW,
                    cmp(sum, RelationType.LE, num(1_000_000)),
                    cmp(var("a"), RelationType.LT, num(1000)), cmp(var("a"), RelationType.GE, num(0)),
                    cmp(var("b"), RelationType.LT, num(1000)), cmp(var("b"), RelationType.GE, num(0))));

            assertTrue(result.isProved());
        }

        @Test
        @DisplayName("循环体未改变的不变式直接成立")
        void testStableInvariant_ShouldBeProved() {
            Formula invariant = cmp(var("limit"), RelationType.GT, num(0));
            Formula property = Formula.implies(Formula.and(invariant, cmp(var("i"), RelationType.LT, var("limit"))),
                    invariant);

            ProofResult result = prover.prove(vc(VCCategory.LOOP_INVARIANT, property));

            assertTrue(result.isProved());
        }

        @Test
        @DisplayName("依赖循环体状态的不变式无法判定")
        void testAfterBodyInvariant_ShouldBeUnknown() {
            Formula invariant = cmp(var("sum"), RelationType.GE, num(0));
            Formula property = Formula.implies(invariant, Formula.pred("after_body", invariant));

            ProofResult result = prover.prove(vc(VCCategory.LOOP_INVARIANT, property));

            assertAll("after_body",
                    () -> assertTrue(result.isUnknown()),
                    () -> assertTrue(result.getReason().contains("sum ≥ 0"), result.getReason())
            );
        }
    }

    @Nested
    @DisplayName("账户协议检查 (Account protocol checks)")
    class ProtocolTests {

        @Test
        @DisplayName("没有签名检查时签名者条件无法判定")
        void testSignerWithoutEvidence_ShouldBeUnknown() {
            ProofResult result = prover.prove(vc(VCCategory.SIGNER_CHECK, signer(0)));

            assertTrue(result.isUnknown());
        }

        @Test
        @DisplayName("同一账户的签名查询应证明签名者条件")
        void testSignerQueryOnSameAccount_ShouldBeProved() {
            Formula check = Formula.app("account-is-signer", num(0));

            ProofResult result = prover.prove(vc(VCCategory.SIGNER_CHECK, signer(0), check));

            assertTrue(result.isProved());
        }

        @Test
        @DisplayName("其他账户的签名查询不能作为证据")
        void testSignerQueryOnOtherAccount_ShouldBeUnknown() {
            Formula check = Formula.app("account-is-signer", num(1));

            ProofResult result = prover.prove(vc(VCCategory.SIGNER_CHECK, signer(0), check));

            assertTrue(result.isUnknown());
        }

        @Test
        @DisplayName("被否定的签名查询不能作为证据")
        void testNegatedSignerQuery_ShouldBeUnknown() {
            Formula check = Formula.not(Formula.app("account-is-signer", num(0)));

            ProofResult result = prover.prove(vc(VCCategory.SIGNER_CHECK, signer(0), check));

            assertTrue(result.isUnknown());
        }

        @Test
        @DisplayName("检查结果与 false 比较的分支不能证明 unwrap 安全 (failed check is not evidence)")
        void testUnwrapAfterFailedCheck_ShouldBeUnknown() {
            Formula isSome = Formula.app("is-some", var("v"));

            ProofResult failed = prover.prove(vc(VCCategory.OPTION_UNWRAP, Formula.pred("value_is_some"),
                    cmp(isSome, RelationType.EQ, Formula.bool(false))));
            ProofResult flipped = prover.prove(vc(VCCategory.OPTION_UNWRAP, Formula.pred("value_is_some"),
                    cmp(Formula.bool(false), RelationType.EQ, isSome)));
            ProofResult notTrue = prover.prove(vc(VCCategory.OPTION_UNWRAP, Formula.pred("value_is_some"),
                    cmp(isSome, RelationType.NE, Formula.TRUE)));
            ProofResult passed = prover.prove(vc(VCCategory.OPTION_UNWRAP, Formula.pred("value_is_some"),
                    cmp(isSome, RelationType.EQ, Formula.TRUE)));

            assertAll("Unwrap evidence",
                    () -> assertTrue(failed.isUnknown(), failed.toString()),
                    () -> assertTrue(flipped.isUnknown(), flipped.toString()),
                    () -> assertTrue(notTrue.isUnknown(), notTrue.toString()),
                    () -> assertTrue(passed.isProved(), passed.toString())
            );
        }

        @Test
        @DisplayName("预言机新鲜度为 false 时价格读取不能被证明")
        void testOracleNotFresh_ShouldBeUnknown() {
            ProofResult stale = prover.prove(vc(VCCategory.ORACLE_MANIPULATION, Formula.pred("oracle_data_fresh"),
                    cmp(var("oracle_data_fresh"), RelationType.EQ, Formula.bool(false))));
            ProofResult fresh = prover.prove(vc(VCCategory.ORACLE_MANIPULATION, Formula.pred("oracle_data_fresh"),
                    cmp(var("oracle_data_fresh"), RelationType.EQ, Formula.TRUE)));

            assertAll("Oracle evidence",
                    () -> assertTrue(stale.isUnknown(), stale.toString()),
                    () -> assertTrue(fresh.isProved(), fresh.toString()),
                    () -> assertEquals("exact h_oracle_fresh", fresh.getProof())
            );
        }

        @Test
        @DisplayName("与 false 比较的签名查询不能作为签名证据")
        void testSignerQueryComparedToFalse_ShouldBeUnknown() {
            Formula check = cmp(Formula.app("account-is-signer", num(0)), RelationType.EQ, Formula.bool(false));

            ProofResult result = prover.prove(vc(VCCategory.SIGNER_CHECK, signer(0), check));

            assertTrue(result.isUnknown());
        }

        @Test
        @DisplayName("重复关闭账户应被否证")
        void testDoubleFree_ShouldBeDisproved() {
            Formula property = cmp(Formula.index("account_closed", 2), RelationType.EQ, Formula.bool(false));

            ProofResult result = prover.prove(vc(VCCategory.DOUBLE_FREE, property));

            assertAll("Double close",
                    () -> assertTrue(result.isDisproved()),
                    () -> assertTrue(result.getCounterexample().startsWith("Account 2 may be closed twice"),
                            result.getCounterexample())
            );
        }

        @Test
        @DisplayName("启发式类别在没有证据时给出 ADVISORY")
        void testHeuristicCategory_ShouldBeAdvisory() {
            ProofResult result = prover.prove(vc(VCCategory.FRONT_RUNNING, Formula.pred("front_running_safe")));

            assertAll("Advisory",
                    () -> assertEquals(ProofResult.Status.ADVISORY, result.getStatus()),
                    () -> assertTrue(result.isDischarged()),
                    () -> assertFalse(result.isProved())
            );
        }
    }
}
