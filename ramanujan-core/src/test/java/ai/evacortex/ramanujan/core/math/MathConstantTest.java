/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.math;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MathConstantTest {

    private static final MathContext MC = new MathContext(40);
    private static final BigDecimal EPS = new BigDecimal("1e-38");

    private static void assertClose(String expected, BigDecimal actual) {
        assertTrue(new BigDecimal(expected).subtract(actual).abs().compareTo(EPS) < 0,
                "expected " + expected + " got " + actual);
    }

    @Test
    void testValues_toFortyDigits() {
        assertClose("3.141592653589793238462643383279502884197", MathConstant.PI.value(MC));
        assertClose("2.718281828459045235360287471352662497757", MathConstant.E.value(MC));
        assertClose("0.6931471805599453094172321214581765680755", MathConstant.LN2.value(MC));
        assertClose("1.644934066848226436472415166646025189219", MathConstant.ZETA2.value(MC));
        assertClose("1.202056903159594285399738161511449990765", MathConstant.ZETA3.value(MC));
    }

    @Test
    void testParseList_acceptsCommaSeparatedKeys() {
        assertEquals(List.of(MathConstant.ZETA3, MathConstant.PI), MathConstant.parseList("zeta3, PI"));
        assertEquals(MathConstant.LN2, MathConstant.fromKey("ln2"));
        assertThrows(IllegalArgumentException.class, () -> MathConstant.fromKey("catalan"));
        assertThrows(IllegalArgumentException.class, () -> MathConstant.parseList(" , "));
    }
}
