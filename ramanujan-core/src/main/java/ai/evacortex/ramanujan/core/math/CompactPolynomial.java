/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.math;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Integer polynomials in compact (Horner) form: {@code c[0]} is the highest-degree coefficient,
 * {@code P(n) = (...(c[0]·n + c[1])·n + ...)·n + c[k]}.
 */
public final class CompactPolynomial {

    private CompactPolynomial() {}

    public static BigInteger evaluate(long[] coefficients, long n) {
        BigInteger x = BigInteger.valueOf(n);
        BigInteger acc = BigInteger.ZERO;
        for (long c : coefficients) {
            acc = acc.multiply(x).add(BigInteger.valueOf(c));
        }
        return acc;
    }

    /** Terms {@code P(0) .. P(count - 1)}. */
    public static List<BigInteger> series(long[] coefficients, int count) {
        if (count < 0) throw new IllegalArgumentException("count must be >= 0");
        List<BigInteger> terms = new ArrayList<>(count);
        for (int n = 0; n < count; n++) {
            terms.add(evaluate(coefficients, n));
        }
        return Collections.unmodifiableList(terms);
    }

    /**
     * Degree after skipping leading zero coefficients. The zero polynomial reports 0.
     */
    public static int degree(long[] coefficients) {
        int deg = coefficients.length - 1;
        for (long c : coefficients) {
            if (c != 0) return deg;
            deg--;
        }
        return 0;
    }
}
