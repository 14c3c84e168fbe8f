/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.sharding;

import ai.evacortex.ramanujan.core.DomainTestUtils;
import ai.evacortex.ramanujan.core.storage.HashingUtil;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DomainSplitterTest {

    private static final CoefficientDomain EXAMPLE =
            CoefficientDomain.of(1, new AxisRange(-3, 3), 0, new AxisRange(-5, 5), true);

    @Test
    void testSplit_sizesSumToOriginal() {
        List<CoefficientDomain> parts = DomainSplitter.split(EXAMPLE, 4);

        assertEquals(4, parts.size());
        BigInteger sum = parts.stream().map(CoefficientDomain::totalSize).reduce(BigInteger.ZERO, BigInteger::add);
        assertEquals(BigInteger.valueOf(3 * 7 * 11), sum);
    }

    @Test
    void testSplit_cutsWidestAxisIntoNearEqualSlices() {
        List<CoefficientDomain> parts = DomainSplitter.split(EXAMPLE, 4);

        assertEquals(new AxisRange(-5, -3), parts.get(0).axisRanges(Series.B).get(0));
        assertEquals(new AxisRange(-2, 0), parts.get(1).axisRanges(Series.B).get(0));
        assertEquals(new AxisRange(1, 3), parts.get(2).axisRanges(Series.B).get(0));
        assertEquals(new AxisRange(4, 5), parts.get(3).axisRanges(Series.B).get(0));
        for (int i = 1; i < parts.size(); i++) {
            assertFalse(parts.get(i - 1).axisRanges(Series.B).get(0).overlaps(parts.get(i).axisRanges(Series.B).get(0)));
        }
        for (CoefficientDomain part : parts) {
            assertEquals(EXAMPLE.axisRanges(Series.A), part.axisRanges(Series.A));
        }
    }

    @Test
    void testSplit_isDisjointAndCoversParent() {
        for (int workers : new int[]{1, 2, 3, 4, 7, 11, 12, 30}) {
            List<CoefficientDomain> parts = DomainSplitter.split(EXAMPLE, workers);
            Set<String> union = new HashSet<>();
            int count = 0;
            for (CoefficientDomain part : parts) {
                Set<String> pairs = DomainTestUtils.allPairs(part);
                count += pairs.size();
                union.addAll(pairs);
            }
            assertEquals(count, union.size(), "Sub-domains must not overlap for N=" + workers);
            assertEquals(DomainTestUtils.allPairs(EXAMPLE), union, "Union must equal parent for N=" + workers);
        }
    }

    @Test
    void testSplit_recursesWhenWorkersExceedWidestAxis() {
        List<CoefficientDomain> parts = DomainSplitter.split(EXAMPLE, 30);

        assertEquals(30, parts.size());
        Set<String> identities = new HashSet<>();
        for (CoefficientDomain part : parts) {
            identities.add(HashingUtil.domainIdentity(part));
        }
        assertEquals(30, identities.size(), "Every sub-domain needs its own checkpoint identity");
    }

    @Test
    void testSplit_tinyDomainYieldsOneSubDomainPerPair() {
        CoefficientDomain tiny = CoefficientDomain.of(0, new AxisRange(1, 2), 0, new AxisRange(0, 1), false);
        List<CoefficientDomain> parts = DomainSplitter.split(tiny, 10);

        assertEquals(4, parts.size());
        for (CoefficientDomain part : parts) {
            assertEquals(BigInteger.ONE, part.totalSize());
        }
    }

    @Test
    void testSplit_rejectsNonPositiveWorkerCount() {
        assertThrows(IllegalArgumentException.class, () -> DomainSplitter.split(EXAMPLE, 0));
    }

    @Test
    void testNearEqualSizes_putsLargerSlicesFirst() {
        assertEquals(List.of(3L, 3L, 3L, 2L), DomainSplitter.nearEqualSizes(11, 4));
        assertEquals(List.of(1L, 1L), DomainSplitter.nearEqualSizes(2, 2));
    }
}
