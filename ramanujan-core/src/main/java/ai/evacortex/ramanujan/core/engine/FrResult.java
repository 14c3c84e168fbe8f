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
 * Outcome of one FR test: the verdict and the step (0-based pair index) it was reached at.
 */
public record FrResult(boolean hasFr, int step) {

    public static FrResult noFr(int step) {
        return new FrResult(false, step);
    }

    public static FrResult fr(int step) {
        return new FrResult(true, step);
    }
}
