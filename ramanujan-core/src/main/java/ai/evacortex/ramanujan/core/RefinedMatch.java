/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Arrays;
import java.util.Objects;

/**
 * A {@link Match} evaluated to high precision and tested against one constant.
 *
 * <p>{@code numerator} and {@code denominator} hold the reduced relation
 * {@code value = (n0 + n1·c + n2·c²) / (d0 + d1·c + d2·c²)} in ascending powers of the constant,
 * or are both {@code null} when no relation was found at the achieved precision.</p>
 */
public record RefinedMatch(long[] an,
                           long[] bn,
                           @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal value,
                           String constant,
                           long[] numerator,
                           long[] denominator,
                           int precision) {

    public RefinedMatch {
        Objects.requireNonNull(an, "an must not be null");
        Objects.requireNonNull(bn, "bn must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if ((numerator == null) != (denominator == null)) {
            throw new IllegalArgumentException("numerator and denominator must both be present or both absent");
        }
        an = an.clone();
        bn = bn.clone();
        numerator = numerator == null ? null : numerator.clone();
        denominator = denominator == null ? null : denominator.clone();
    }

    public static RefinedMatch withoutRelation(Match match, BigDecimal value, String constant, int precision) {
        return new RefinedMatch(match.an(), match.bn(), value, constant, null, null, precision);
    }

    @JsonIgnore
    public boolean hasRelation() {
        return numerator != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RefinedMatch that)) return false;
        return precision == that.precision
                && Arrays.equals(an, that.an)
                && Arrays.equals(bn, that.bn)
                && value.compareTo(that.value) == 0
                && Objects.equals(constant, that.constant)
                && Arrays.equals(numerator, that.numerator)
                && Arrays.equals(denominator, that.denominator);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(constant, precision, value.stripTrailingZeros());
        h = 31 * h + Arrays.hashCode(an);
        h = 31 * h + Arrays.hashCode(bn);
        h = 31 * h + Arrays.hashCode(numerator);
        return 31 * h + Arrays.hashCode(denominator);
    }

    @Override
    public String toString() {
        return "RefinedMatch{an=" + Arrays.toString(an)
                + ", bn=" + Arrays.toString(bn)
                + ", value=" + value.round(new MathContext(30)).toPlainString()
                + ", constant=" + constant
                + ", numerator=" + Arrays.toString(numerator)
                + ", denominator=" + Arrays.toString(denominator)
                + ", precision=" + precision + "}";
    }
}
