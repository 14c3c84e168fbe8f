/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.enumeration;

import ai.evacortex.ramanujan.core.sharding.AxisRange;

import java.util.List;

/**
 * Lexicographic walk over the Cartesian product of axis ranges; the last axis turns fastest.
 */
final class TupleOdometer {

    private TupleOdometer() {}

    /**
     * @return the tuple following {@code current}, or {@code null} once every axis has wrapped
     */
    static long[] next(List<AxisRange> axes, long[] current) {
        long[] next = current.clone();
        for (int i = axes.size() - 1; i >= 0; i--) {
            AxisRange axis = axes.get(i);
            if (next[i] < axis.hi()) {
                next[i]++;
                return next;
            }
            next[i] = axis.lo();
        }
        return null;
    }
}
