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

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Computes the limit of a continued fraction to high precision.
 */
public interface GcfEvaluator {

    /**
     * @param value     the limit estimate, possibly carrying more digits than {@code precision}
     * @param precision significant decimal digits believed correct
     */
    record Evaluation(BigDecimal value, int precision) {}

    /**
     * @return the evaluation, or empty when the convergent denominator vanishes at the evaluated depth
     */
    Optional<Evaluation> evaluate(CoefficientPair pair);

    /** Upper bound of the precision {@link #evaluate} reports. */
    int workingDigits();
}
