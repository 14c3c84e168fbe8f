/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.storage;

import ai.evacortex.ramanujan.core.sharding.CoefficientDomain;
import ai.evacortex.ramanujan.core.sharding.Series;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Objects;

/**
 * Last visited coordinate of a nested enumeration, one coefficient tuple per series.
 * Persisted as {@code {"a": [...], "b": [...]}}.
 */
public record Checkpoint(@JsonProperty("a") long[] a, @JsonProperty("b") long[] b) {

    @JsonCreator
    public Checkpoint {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");
        a = a.clone();
        b = b.clone();
    }

    public static Checkpoint origin(CoefficientDomain domain) {
        return new Checkpoint(domain.origin(Series.A), domain.origin(Series.B));
    }

    public long[] tuple(Series series) {
        return (series == Series.A ? a : b).clone();
    }

    public boolean fitsInside(CoefficientDomain domain) {
        return domain.contains(Series.A, a) && domain.contains(Series.B, b);
    }

    @Override
    public long[] a() {
        return a.clone();
    }

    @Override
    public long[] b() {
        return b.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Checkpoint that)) return false;
        return Arrays.equals(a, that.a) && Arrays.equals(b, that.b);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(a) + Arrays.hashCode(b);
    }

    @Override
    public String toString() {
        return "Checkpoint{a=" + Arrays.toString(a) + ", b=" + Arrays.toString(b) + "}";
    }
}
