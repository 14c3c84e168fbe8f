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
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoefficientDomainTest {

    @Test
    void testFactory_clampsLeadAxisToPositive() {
        CoefficientDomain domain = CoefficientDomain.of(1, new AxisRange(-3, 3), 0, new AxisRange(-5, 5), true);

        assertEquals(List.of(new AxisRange(1, 3), new AxisRange(-3, 3)), domain.axisRanges(Series.A));
        assertEquals(List.of(new AxisRange(-5, 5)), domain.axisRanges(Series.B));
        assertEquals(BigInteger.valueOf(21), domain.size(Series.A));
        assertEquals(BigInteger.valueOf(11), domain.size(Series.B));
        assertEquals(BigInteger.valueOf(231), domain.totalSize());
        assertEquals(1, domain.degree(Series.A));
        assertEquals(0, domain.degree(Series.B));
    }

    @Test
    void testFactory_leavesNonPositiveLeadAxisAlone() {
        CoefficientDomain domain = CoefficientDomain.of(1, new AxisRange(-3, 0), 0, new AxisRange(1, 1), true);
        assertEquals(new AxisRange(-3, 0), domain.axisRanges(Series.A).get(0), "Clamping must not empty the axis");

        CoefficientDomain unclamped = CoefficientDomain.of(1, new AxisRange(-3, 3), 0, new AxisRange(1, 1), false);
        assertEquals(new AxisRange(-3, 3), unclamped.axisRanges(Series.A).get(0));
    }

    @Test
    void testEmptyAxis_isRejected() {
        assertThrows(InvalidDomainException.class, () -> new AxisRange(2, 1));
        assertThrows(InvalidDomainException.class, () -> new CoefficientDomain(List.of(), List.of(new AxisRange(0, 1))));
        assertThrows(InvalidDomainException.class,
                () -> CoefficientDomain.of(-1, new AxisRange(0, 1), 0, new AxisRange(0, 1), true));
    }

    @Test
    void testWithAxisRange_rebuildsDerivedSizesAndKeepsOriginal() {
        CoefficientDomain domain = CoefficientDomain.of(1, new AxisRange(-3, 3), 0, new AxisRange(-5, 5), true);
        CoefficientDomain narrowed = domain.withAxisRange(Series.B, 0, new AxisRange(0, 1));

        assertEquals(BigInteger.valueOf(42), narrowed.totalSize());
        assertEquals(BigInteger.valueOf(231), domain.totalSize(), "Parent must be untouched");
        assertNotEquals(domain, narrowed);
        assertThrows(InvalidDomainException.class, () -> domain.withAxisRange(Series.A, 2, new AxisRange(0, 0)));
    }

    @Test
    void testExpandOriginAndContains() {
        CoefficientDomain domain = CoefficientDomain.of(1, new AxisRange(-1, 1), 0, new AxisRange(2, 3), true);

        assertEquals(List.of(List.of(1L), List.of(-1L, 0L, 1L)), domain.expand(Series.A));
        assertEquals(List.of(List.of(2L, 3L)), domain.expand(Series.B));
        assertArrayEquals(new long[]{1, -1}, domain.origin(Series.A));
        assertArrayEquals(new long[]{2}, domain.origin(Series.B));

        assertTrue(domain.contains(Series.A, new long[]{1, 0}));
        assertFalse(domain.contains(Series.A, new long[]{0, 0}), "Lead axis was clamped");
        assertFalse(domain.contains(Series.A, new long[]{1}), "Tuple length must match");
        assertFalse(domain.contains(Series.B, null));
    }

    @Test
    void testDescribeRanges_isCanonical() {
        CoefficientDomain domain = CoefficientDomain.of(1, new AxisRange(-3, 3), 0, new AxisRange(-5, 5), true);
        assertEquals("[[1, 3], [-3, 3]];[[-5, 5]]", domain.describeRanges());

        CoefficientDomain same = new CoefficientDomain(
                List.of(new AxisRange(1, 3), new AxisRange(-3, 3)), List.of(new AxisRange(-5, 5)));
        assertEquals(domain, same);
        assertEquals(domain.hashCode(), same.hashCode());
    }
}
