/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.sharding;

import ai.evacortex.ramanujan.core.exceptions.InvalidDomainException;

/**
 * Inclusive integer interval {@code [lo .. hi]} of values a single polynomial coefficient may take.
 */
public record AxisRange(long lo, long hi) {

    public AxisRange {
        if (lo > hi) {
            throw new InvalidDomainException("Empty coefficient range: [" + lo + " .. " + hi + "]");
        }
    }

    public long size() {
        return Math.subtractExact(hi, lo) + 1;
    }

    public boolean contains(long value) {
        return value >= lo && value <= hi;
    }

    public boolean overlaps(AxisRange other) {
        return this.lo <= other.hi && other.lo <= this.hi;
    }

    @Override
    public String toString() {
        return "[" + lo + ", " + hi + "]";
    }
}
