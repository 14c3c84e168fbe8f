/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.sharding;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Partitions a {@link CoefficientDomain} into disjoint sub-domains for independent workers.
 *
 * <p>The widest axis across both series is cut into contiguous, near-equal slices. When more
 * workers are requested than that axis has values, every slice is split again recursively with
 * its share of the worker count. A domain with fewer pairs than workers yields one sub-domain per
 * pair.</p>
 */
public final class DomainSplitter {

    private DomainSplitter() {}

    public record AxisInfo(Series series, int index, AxisRange range) {
        public long size() {
            return range.size();
        }
    }

    public static List<CoefficientDomain> split(CoefficientDomain domain, int workers) {
        Objects.requireNonNull(domain, "domain must not be null");
        if (workers <= 0) {
            throw new IllegalArgumentException("Worker count must be > 0");
        }

        AxisInfo widest = widestAxis(domain);
        if (widest.size() == 1) {
            // a single pair cannot be split further
            return List.of(domain);
        }
        int slices = (int) Math.min(workers, widest.size());

        List<CoefficientDomain> subDomains = new ArrayList<>(slices);
        for (AxisRange slice : sliceRange(widest.range(), slices)) {
            subDomains.add(domain.withAxisRange(widest.series(), widest.index(), slice));
        }

        if (widest.size() < workers) {
            List<Long> shares = nearEqualSizes(workers, subDomains.size());
            List<CoefficientDomain> finer = new ArrayList<>(workers);
            for (int i = 0; i < subDomains.size(); i++) {
                finer.addAll(split(subDomains.get(i), Math.toIntExact(shares.get(i))));
            }
            return finer;
        }
        return subDomains;
    }

    public static List<AxisInfo> describeAxes(CoefficientDomain domain) {
        List<AxisInfo> axes = new ArrayList<>();
        for (Series series : Series.values()) {
            List<AxisRange> ranges = domain.axisRanges(series);
            for (int i = 0; i < ranges.size(); i++) {
                axes.add(new AxisInfo(series, i, ranges.get(i)));
            }
        }
        return axes;
    }

    static AxisInfo widestAxis(CoefficientDomain domain) {
        AxisInfo widest = null;
        for (AxisInfo axis : describeAxes(domain)) {
            if (widest == null || axis.size() > widest.size()) {
                widest = axis;
            }
        }
        return widest;
    }

    /** Cuts {@code range} into {@code parts} contiguous slices, larger slices first. */
    static List<AxisRange> sliceRange(AxisRange range, int parts) {
        List<Long> sizes = nearEqualSizes(range.size(), parts);
        List<AxisRange> slices = new ArrayList<>(parts);
        long lo = range.lo();
        for (long size : sizes) {
            long hi = lo + size - 1;
            slices.add(new AxisRange(lo, hi));
            lo = hi + 1;
        }
        return slices;
    }

    static List<Long> nearEqualSizes(long total, int parts) {
        long base = total / parts;
        long extra = total % parts;
        List<Long> sizes = new ArrayList<>(parts);
        for (int i = 0; i < parts; i++) {
            sizes.add(base + (i < extra ? 1 : 0));
        }
        return sizes;
    }
}
