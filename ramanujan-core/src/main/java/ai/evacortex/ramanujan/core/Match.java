/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core;

import ai.evacortex.ramanujan.core.enumeration.CoefficientPair;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Objects;

/**
 * Coefficient pair whose continued fraction passed the Factorial Reduction test.
 * Carries no numeric value yet.
 */
public record Match(@JsonProperty("an") long[] an, @JsonProperty("bn") long[] bn) {

    @JsonCreator
    public Match {
        Objects.requireNonNull(an, "an must not be null");
        Objects.requireNonNull(bn, "bn must not be null");
        an = an.clone();
        bn = bn.clone();
    }

    public static Match of(CoefficientPair pair) {
        return new Match(pair.an(), pair.bn());
    }

    public CoefficientPair pair() {
        return new CoefficientPair(an, bn);
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
        if (!(o instanceof Match that)) return false;
        return Arrays.equals(an, that.an) && Arrays.equals(bn, that.bn);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(an) + Arrays.hashCode(bn);
    }

    @Override
    public String toString() {
        return "Match{an=" + Arrays.toString(an) + ", bn=" + Arrays.toString(bn) + "}";
    }
}
