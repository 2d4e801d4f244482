package org.ovsm.expressions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FormulaTest {

    private static final Formula X = Formula.var("x");
    private static final Formula Y = Formula.var("y");

    private static Formula gt(Formula left, long right) {
        return Formula.compare(left, RelationType.GT, Formula.constant(right));
    }

    @Nested
    @DisplayName("渲染 (Rendering)")
    class RenderTests {

        @Test
        @DisplayName("比较带括号渲染与不带括号渲染")
        void testCompareRendering() {
            Formula f = Formula.compare(Y, RelationType.NE, Formula.constant(0));
            assertAll("y ≠ 0",
                    () -> assertEquals("(y ≠ 0)", f.render()),
                    () -> assertEquals("y ≠ 0", f.renderBare())
            );
        }

        @Test
        @DisplayName("否定、调用与账户事实表")
        void testCompoundRendering() {
            assertAll("Compound terms",
                    () -> assertEquals("¬(d = 0)",
                            Formula.not(Formula.compare(Formula.var("d"), RelationType.EQ, Formula.constant(0))).render()),
                    () -> assertEquals("¬(flag)", Formula.not(Formula.var("flag")).render()),
                    () -> assertEquals("(instruction-data-len)", Formula.app("instruction-data-len").render()),
                    () -> assertEquals("(get-balance 0)", Formula.app("get-balance", Formula.constant(0)).render()),
                    () -> assertEquals("account_is_signer[0] = true",
                            Formula.compare(Formula.index("account_is_signer", 0), RelationType.EQ, Formula.TRUE)
                                    .renderBare()),
                    () -> assertEquals("arr.size", Formula.field(Formula.var("arr"), "size").render())
            );
        }

        @Test
        @DisplayName("蕴含与合取")
        void testLogicalRendering() {
            Formula entry = Formula.implies(Formula.pred("entry"),
                    Formula.compare(Formula.var("i"), RelationType.GE, Formula.constant(0)));
            Formula both = Formula.and(gt(X, 0), gt(Y, 0));
            assertAll("Logical connectives",
                    () -> assertEquals("entry → (i ≥ 0)", entry.renderBare()),
                    () -> assertEquals("(x > 0) ∧ (y > 0)", both.renderBare()),
                    () -> assertEquals("(x + 1)",
                            Formula.arith(ArithOp.ADD, X, Formula.constant(1)).render())
            );
        }
    }

    @Nested
    @DisplayName("结构操作 (Structural operations)")
    class StructureTests {

        @Test
        @DisplayName("合取被展平，单项直接返回，空合取为 True")
        void testAndFlattening() {
            Formula nested = Formula.and(Formula.and(gt(X, 0), gt(Y, 0)), gt(X, 5));
            assertAll("Formula.and",
                    () -> assertEquals(3, nested.conjuncts().size()),
                    () -> assertEquals(gt(X, 0), Formula.and(gt(X, 0))),
                    () -> assertEquals(Formula.TRUE, Formula.and(List.of()))
            );
        }

        @Test
        @DisplayName("只有确定成立的原子部分进入 positiveConjuncts")
        void testPositiveConjuncts() {
            Formula f = Formula.and(gt(X, 0),
                    Formula.not(Formula.not(gt(Y, 0))),
                    Formula.not(gt(X, 10)),
                    Formula.or(gt(X, 1), gt(Y, 1)));

            assertEquals(List.of(gt(X, 0), gt(Y, 0)), f.positiveConjuncts());
        }

        @Test
        @DisplayName("比较取反时翻转关系，双重否定被消去")
        void testNegated() {
            assertAll("negated",
                    () -> assertEquals(Formula.compare(X, RelationType.LE, Formula.constant(0)), gt(X, 0).negated()),
                    () -> assertEquals(gt(X, 0), Formula.not(gt(X, 0)).negated()),
                    () -> assertEquals(Formula.TRUE, Formula.FALSE.negated()),
                    () -> assertEquals(Formula.Kind.NOT, Formula.var("flag").negated().getKind())
            );
        }

        @Test
        @DisplayName("替换变量并收集标识符")
        void testSubstituteAndSymbols() {
            Formula f = Formula.compare(Formula.arith(ArithOp.ADD, X, Y), RelationType.LT, Formula.constant(10));
            Formula replaced = f.substitute("x", Formula.constant(3));

            assertAll("substitute / symbols",
                    () -> assertEquals("(3 + y) < 10", replaced.renderBare()),
                    () -> assertFalse(replaced.mentionsVariable("x")),
                    () -> assertSame(f, f.substitute("z", Formula.constant(1))),
                    () -> assertEquals(Set.of("x", "y"), f.symbols()),
                    () -> assertTrue(Formula.app("get-balance", X).mentions("balance"))
            );
        }

        @Test
        @DisplayName("字面量取负后仍可读取整数值")
        void testAsInteger() {
            assertAll("asInteger",
                    () -> assertEquals(Optional.of(BigInteger.valueOf(-4)), Formula.neg(Formula.constant(4)).asInteger()),
                    () -> assertTrue(Formula.neg(Formula.constant(4)).isLiteral()),
                    () -> assertTrue(X.asInteger().isEmpty())
            );
        }
    }

    @Nested
    @DisplayName("Z3 可翻译性 (Z3 translatability)")
    class TranslatabilityTests {

        @Test
        @DisplayName("线性算术可翻译，非线性与除以变量不可翻译")
        void testArithTranslatable() {
            assertAll("isArithTranslatable",
                    () -> assertTrue(Formula.arith(ArithOp.MUL, Formula.constant(2), X).isArithTranslatable()),
                    () -> assertFalse(Formula.arith(ArithOp.MUL, X, Y).isArithTranslatable()),
                    () -> assertTrue(Formula.arith(ArithOp.DIV, X, Formula.constant(4)).isArithTranslatable()),
                    () -> assertFalse(Formula.arith(ArithOp.DIV, X, Formula.constant(0)).isArithTranslatable()),
                    () -> assertFalse(Formula.arith(ArithOp.DIV, X, Y).isArithTranslatable()),
                    () -> assertTrue(Formula.field(Formula.var("arr"), "size").isArithTranslatable()),
                    () -> assertFalse(Formula.app("get-balance", X).isArithTranslatable())
            );
        }

        @Test
        @DisplayName("布尔结构要求每个分量都可翻译")
        void testZ3Translatable() {
            assertAll("isZ3Translatable",
                    () -> assertTrue(Formula.and(gt(X, 0), Formula.not(gt(Y, 3))).isZ3Translatable()),
                    () -> assertFalse(Formula.and(gt(X, 0), Formula.pred("precision_acceptable")).isZ3Translatable()),
                    () -> assertTrue(Formula.FALSE.isZ3Translatable())
            );
        }
    }
}
