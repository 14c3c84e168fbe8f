/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.enumeration;

import ai.evacortex.ramanujan.core.sharding.Series;

import java.util.Arrays;

/**
 * Position of a {@link DomainEnumerator}: the pair it will emit next (both {@code null} once
 * exhausted) and how many pairs it has emitted so far.
 */
public record EnumerationCursor(Series primary, long[] primaryTuple, long[] secondaryTuple, long itemsPassed) {

    public boolean exhausted() {
        return primaryTuple == null;
    }

    @Override
    public String toString() {
        return "EnumerationCursor{primary=" + primary
                + ", primaryTuple=" + Arrays.toString(primaryTuple)
                + ", secondaryTuple=" + Arrays.toString(secondaryTuple)
                + ", itemsPassed=" + itemsPassed + "}";
    }
}
