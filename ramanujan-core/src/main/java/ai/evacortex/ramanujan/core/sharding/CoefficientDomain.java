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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code CoefficientDomain} describes the rectangular lattice of coefficient tuples searched for
 * a pair of compact polynomials {@code a(n)} and {@code b(n)}.
 *
 * <p>Each series owns one {@link AxisRange} per coefficient. Coefficients are kept in Horner
 * order: index 0 is the highest-degree coefficient and the last index is the constant term, so the
 * lead coefficient of {@code a(n)} lives on axis {@code A[0]}.</p>
 *
 * <p>Instances are immutable. Sub-domains are produced with {@link #withAxisRange(Series, int, AxisRange)},
 * which builds a new domain and recomputes every derived value instead of patching a copy.</p>
 */
public final class CoefficientDomain {

    private final List<AxisRange> aAxes;
    private final List<AxisRange> bAxes;
    private final BigInteger aLength;
    private final BigInteger bLength;

    public CoefficientDomain(List<AxisRange> aAxes, List<AxisRange> bAxes) {
        Objects.requireNonNull(aAxes, "aAxes must not be null");
        Objects.requireNonNull(bAxes, "bAxes must not be null");
        if (aAxes.isEmpty() || bAxes.isEmpty()) {
            throw new InvalidDomainException("each series needs at least one coefficient axis");
        }
        this.aAxes = List.copyOf(aAxes);
        this.bAxes = List.copyOf(bAxes);
        this.aLength = lengthOf(this.aAxes);
        this.bLength = lengthOf(this.bAxes);
    }

    /**
     * Builds a domain where every coefficient of a series shares the same range.
     *
     * <p>If {@code leadCoefficientPositive} is set and the lead {@code a} axis reaches positive values
     * while also admitting {@code lo <= 0}, the axis is clamped to start at 1.</p>
     */
    public static CoefficientDomain of(int aDegree, AxisRange aRange,
                                       int bDegree, AxisRange bRange,
                                       boolean leadCoefficientPositive) {
        if (aDegree < 0 || bDegree < 0) {
            throw new InvalidDomainException("degrees must be non-negative: a=" + aDegree + ", b=" + bDegree);
        }
        List<AxisRange> a = new ArrayList<>(Collections.nCopies(aDegree + 1, aRange));
        List<AxisRange> b = new ArrayList<>(Collections.nCopies(bDegree + 1, bRange));

        AxisRange lead = a.get(0);
        if (leadCoefficientPositive && lead.lo() <= 0 && lead.hi() >= 1) {
            a.set(0, new AxisRange(1, lead.hi()));
        }
        return new CoefficientDomain(a, b);
    }

    public CoefficientDomain withAxisRange(Series series, int index, AxisRange range) {
        Objects.requireNonNull(range, "range must not be null");
        List<AxisRange> a = new ArrayList<>(aAxes);
        List<AxisRange> b = new ArrayList<>(bAxes);
        List<AxisRange> target = series == Series.A ? a : b;
        if (index < 0 || index >= target.size()) {
            throw new InvalidDomainException("axis index out of bounds: " + series + "[" + index + "]");
        }
        target.set(index, range);
        return new CoefficientDomain(a, b);
    }

    public List<AxisRange> axisRanges(Series series) {
        return series == Series.A ? aAxes : bAxes;
    }

    public int degree(Series series) {
        return axisRanges(series).size() - 1;
    }

    public BigInteger size(Series series) {
        return series == Series.A ? aLength : bLength;
    }

    public BigInteger totalSize() {
        return aLength.multiply(bLength);
    }

    /**
     * Materializes the explicit value list of every axis. Callers must keep the domain enumerable.
     */
    public List<List<Long>> expand(Series series) {
        List<AxisRange> axes = axisRanges(series);
        List<List<Long>> expanded = new ArrayList<>(axes.size());
        for (AxisRange axis : axes) {
            List<Long> values = new ArrayList<>();
            for (long v = axis.lo(); v <= axis.hi(); v++) {
                values.add(v);
                if (v == Long.MAX_VALUE) break;
            }
            expanded.add(Collections.unmodifiableList(values));
        }
        return Collections.unmodifiableList(expanded);
    }

    /** First value of every axis, the place a fresh enumeration starts from. */
    public long[] origin(Series series) {
        List<AxisRange> axes = axisRanges(series);
        long[] origin = new long[axes.size()];
        for (int i = 0; i < origin.length; i++) {
            origin[i] = axes.get(i).lo();
        }
        return origin;
    }

    public boolean contains(Series series, long[] tuple) {
        List<AxisRange> axes = axisRanges(series);
        if (tuple == null || tuple.length != axes.size()) return false;
        for (int i = 0; i < tuple.length; i++) {
            if (!axes.get(i).contains(tuple[i])) return false;
        }
        return true;
    }

    /** Canonical text of both axis sets, {@code [[lo, hi], ...];[[lo, hi], ...]}. */
    public String describeRanges() {
        return aAxes + ";" + bAxes;
    }

    private static BigInteger lengthOf(List<AxisRange> axes) {
        BigInteger size = BigInteger.ONE;
        for (AxisRange axis : axes) {
            Objects.requireNonNull(axis, "axis range must not be null");
            size = size.multiply(BigInteger.valueOf(axis.size()));
        }
        return size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CoefficientDomain that)) return false;
        return aAxes.equals(that.aAxes) && bAxes.equals(that.bAxes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aAxes, bAxes);
    }

    @Override
    public String toString() {
        return "CoefficientDomain{a=" + aAxes + ", b=" + bAxes + ", size=" + totalSize() + "}";
    }
}
