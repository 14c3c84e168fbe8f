/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.engine;

import java.math.BigInteger;

/**
 * {@code FrDetector} decides whether a generalized continued fraction
 * <pre>
 *     a0 + b1 / (a1 + b2 / (a2 + b3 / (a3 + ...)))
 * </pre>
 * shows <em>Factorial Reduction</em>: the gcd of the convergent numerator {@code p_n} and
 * denominator {@code q_n} grows super-exponentially.
 *
 * <p>The test is a heuristic on a bounded prefix of the term streams, not a proof. Implementations
 * drive the recurrence
 * <pre>
 *     p_n = a_n · p_(n-1) + b_n · p_(n-2)
 *     q_n = a_n · q_(n-1) + b_n · q_(n-2)
 * </pre>
 * in unbounded integers and must be deterministic: identical streams give identical results.</p>
 *
 * <p>{@code bnTerms} is aligned with {@code anTerms}; its first element {@code b0} has no role in
 * the fraction and is ignored. Iteration stops at the shorter stream.</p>
 *
 * @see BurstFrDetector
 * @see FrOptions
 */
public interface FrDetector {

    /**
     * @param anTerms  {@code a0, a1, a2, ...}
     * @param bnTerms  {@code b0, b1, b2, ...}
     * @param anDegree compact degree of the {@code a} polynomial
     * @return verdict with the 0-based step over the pairs {@code (a1, b1), (a2, b2), ...} at which
     *         it was reached; {@code 0} for an empty stream
     */
    FrResult check(Iterable<BigInteger> anTerms, Iterable<BigInteger> bnTerms, int anDegree);
}
