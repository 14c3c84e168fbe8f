/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.engine;

/**
 * Tuning knobs for the burst-sampled FR test.
 */
public record FrOptions(
        int burstNumber,                // steps between two log-gcd samples
        int minIters,                   // no sample before this step
        double convergenceThreshold,    // sample gap that counts as converged
        int digits                      // significant digits of the estimates
) {
    public static final int DEFAULT_BURST_NUMBER = 200;
    public static final int DEFAULT_MIN_ITERS = 1;
    public static final double DEFAULT_CONVERGENCE_THRESHOLD = 0.1;
    public static final int DEFAULT_DIGITS = 30;

    public FrOptions {
        if (burstNumber <= 0) throw new IllegalArgumentException("burstNumber must be > 0");
        if (minIters < 0) throw new IllegalArgumentException("minIters must be >= 0");
        if (!(convergenceThreshold > 0)) throw new IllegalArgumentException("convergenceThreshold must be > 0");
        if (digits <= 0) throw new IllegalArgumentException("digits must be > 0");
    }

    public static FrOptions defaultOptions() {
        return new FrOptions(DEFAULT_BURST_NUMBER, DEFAULT_MIN_ITERS, DEFAULT_CONVERGENCE_THRESHOLD, DEFAULT_DIGITS);
    }

    public int firstSampleStep() {
        return Math.max(burstNumber, minIters);
    }
}
