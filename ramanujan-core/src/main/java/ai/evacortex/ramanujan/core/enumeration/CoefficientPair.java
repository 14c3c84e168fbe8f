/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.enumeration;

import ai.evacortex.ramanujan.core.math.CompactPolynomial;

import java.util.Arrays;
import java.util.Objects;

/**
 * One coordinate of the search: the compact coefficients of {@code a(n)} and {@code b(n)}.
 */
public record CoefficientPair(long[] an, long[] bn) {

    public CoefficientPair {
        Objects.requireNonNull(an, "an must not be null");
        Objects.requireNonNull(bn, "bn must not be null");
        an = an.clone();
        bn = bn.clone();
    }

    public int anDegree() {
        return CompactPolynomial.degree(an);
    }

    public int bnDegree() {
        return CompactPolynomial.degree(bn);
    }

    @Override
    public long[] an() {
        return an.clone();
    }

    @Override
    public long[] bn() {
        return bn.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CoefficientPair that)) return false;
        return Arrays.equals(an, that.an) && Arrays.equals(bn, that.bn);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(an) + Arrays.hashCode(bn);
    }

    @Override
    public String toString() {
        return "an=" + Arrays.toString(an) + " bn=" + Arrays.toString(bn);
    }
}
