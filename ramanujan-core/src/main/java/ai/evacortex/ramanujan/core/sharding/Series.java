/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.sharding;

/**
 * The two coefficient sequences of a continued fraction.
 * - A: partial denominators a(n)
 * - B: partial numerators b(n)
 */
public enum Series {
    A,
    B;

    public Series other() {
        return this == A ? B : A;
    }

    public static Series parse(String value) {
        return switch (value.trim().toLowerCase()) {
            case "a" -> A;
            case "b" -> B;
            default -> throw new IllegalArgumentException("Unknown series: " + value);
        };
    }
}
