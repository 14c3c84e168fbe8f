/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.refine;

import ai.evacortex.ramanujan.core.enumeration.CoefficientPair;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

import static org.junit.jupiter.api.Assertions.*;

class DepthDoublingEvaluatorTest {

    @Test
    void testEvaluate_silverRatio() {
        // 2 + 1/(2 + 1/(2 + ...)) = 1 + sqrt(2)
        DepthDoublingEvaluator evaluator = new DepthDoublingEvaluator(100, 400, 40);

        GcfEvaluator.Evaluation e = evaluator.evaluate(new CoefficientPair(new long[]{2}, new long[]{1})).orElseThrow();

        BigDecimal sqrt2 = new BigDecimal(BigInteger.TWO.multiply(BigInteger.TEN.pow(100)).sqrt()).movePointLeft(50);
        BigDecimal expected = BigDecimal.ONE.add(sqrt2);
        assertTrue(e.value().subtract(expected).abs().compareTo(new BigDecimal("1e-38")) < 0, "got " + e.value());
        assertEquals(40, e.precision());
    }

    @Test
    void testEvaluate_fourOverPi() {
        // 1 + 1/(3 + 4/(5 + 9/(7 + ...))) = 4/pi
        DepthDoublingEvaluator evaluator = new DepthDoublingEvaluator(200, 800, 50);

        GcfEvaluator.Evaluation e = evaluator.evaluate(new CoefficientPair(new long[]{2, 1}, new long[]{1, 0, 0}))
                .orElseThrow();

        assertTrue(e.value().toPlainString().startsWith("1.27323954473516268615107010698"), "got " + e.value());
        assertEquals(50, e.precision());
    }

    @Test
    void testEvaluate_precisionReflectsSlowConvergence() {
        // a(n) = 1, b(n) = 1 converges like 0.38^n: depth 8 vs 16 agree to only a few digits
        DepthDoublingEvaluator evaluator = new DepthDoublingEvaluator(8, 16, 40);

        GcfEvaluator.Evaluation e = evaluator.evaluate(new CoefficientPair(new long[]{1}, new long[]{1})).orElseThrow();

        assertTrue(e.precision() > 0 && e.precision() < 10, "precision " + e.precision());
        assertEquals(0, e.value().round(new MathContext(3)).compareTo(new BigDecimal("1.62")));
    }

    @Test
    void testEvaluate_emptyWhenDenominatorVanishes() {
        // a(n) = 0, b(n) = 1: q alternates 0, 1, 0, ...
        DepthDoublingEvaluator evaluator = new DepthDoublingEvaluator(3, 3, 20);

        assertTrue(evaluator.evaluate(new CoefficientPair(new long[]{0}, new long[]{1})).isEmpty());
    }

    @Test
    void testConstructor_validatesDepths() {
        assertThrows(IllegalArgumentException.class, () -> new DepthDoublingEvaluator(0, 10, 20));
        assertThrows(IllegalArgumentException.class, () -> new DepthDoublingEvaluator(10, 5, 20));
        assertEquals(60, new DepthDoublingEvaluator().workingDigits());
    }
}
