/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.refine;

import ai.evacortex.ramanujan.core.engine.GcfRecurrence;
import ai.evacortex.ramanujan.core.enumeration.CoefficientPair;
import ai.evacortex.ramanujan.core.math.CompactPolynomial;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;

/**
 * Evaluates a fraction at {@code initialDepth}, then keeps doubling the depth until two successive
 * values agree to the working digits or {@code maxDepth} is reached. The achieved precision is read
 * off the last difference: {@code -floor(log10 |v(2d) - v(d)|) - 1}, capped at the working digits.
 * Values carry a few guard digits beyond that cap.
 */
public class DepthDoublingEvaluator implements GcfEvaluator {

    public static final int DEFAULT_INITIAL_DEPTH = 500;
    public static final int DEFAULT_MAX_DEPTH = 16_000;
    public static final int DEFAULT_DIGITS = 60;

    private static final int GUARD_DIGITS = 10;

    private final int initialDepth;
    private final int maxDepth;
    private final int digits;
    private final MathContext work;

    public DepthDoublingEvaluator() {
        this(DEFAULT_INITIAL_DEPTH, DEFAULT_MAX_DEPTH, DEFAULT_DIGITS);
    }

    public DepthDoublingEvaluator(int initialDepth, int maxDepth, int digits) {
        if (initialDepth <= 0) throw new IllegalArgumentException("initialDepth must be > 0");
        if (maxDepth < initialDepth) throw new IllegalArgumentException("maxDepth must be >= initialDepth");
        if (digits <= 0) throw new IllegalArgumentException("digits must be > 0");
        this.initialDepth = initialDepth;
        this.maxDepth = maxDepth;
        this.digits = digits;
        this.work = new MathContext(digits + GUARD_DIGITS);
    }

    @Override
    public int workingDigits() {
        return digits;
    }

    @Override
    public Optional<Evaluation> evaluate(CoefficientPair pair) {
        long[] an = pair.an();
        long[] bn = pair.bn();
        GcfRecurrence recurrence = GcfRecurrence.seed(CompactPolynomial.evaluate(an, 0));

        int depth = advance(recurrence, an, bn, 0, initialDepth);
        Optional<BigDecimal> previous = recurrence.value(work);
        int precision = 0;
        while (depth < maxDepth) {
            int next = (int) Math.min(2L * depth, maxDepth);
            depth = advance(recurrence, an, bn, depth, next);
            Optional<BigDecimal> current = recurrence.value(work);
            if (previous.isPresent() && current.isPresent()) {
                precision = agreement(previous.get(), current.get());
                if (precision >= digits) break;
            } else {
                precision = 0;
            }
            previous = current;
        }
        int achieved = precision;
        return recurrence.value(work).map(v -> new Evaluation(v, achieved));
    }

    /* steps n = from+1 .. to; returns to */
    private static int advance(GcfRecurrence recurrence, long[] an, long[] bn, int from, int to) {
        for (int n = from + 1; n <= to; n++) {
            recurrence.step(CompactPolynomial.evaluate(an, n), CompactPolynomial.evaluate(bn, n));
        }
        return to;
    }

    private int agreement(BigDecimal a, BigDecimal b) {
        BigDecimal diff = a.subtract(b, work).abs();
        if (diff.signum() == 0) return digits;
        int magnitude = diff.precision() - diff.scale() - 1;
        return Math.max(0, Math.min(digits, -magnitude - 1));
    }
}
