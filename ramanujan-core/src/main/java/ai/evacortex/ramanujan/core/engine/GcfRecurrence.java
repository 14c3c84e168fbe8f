/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.engine;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Optional;

/**
 * Convergent numerator/denominator pair of a continued fraction, advanced one term at a time.
 * Not thread-safe.
 */
public final class GcfRecurrence {

    private BigInteger p;
    private BigInteger q = BigInteger.ONE;
    private BigInteger prevP = BigInteger.ONE;
    private BigInteger prevQ = BigInteger.ZERO;

    private GcfRecurrence(BigInteger a0) {
        this.p = a0;
    }

    public static GcfRecurrence seed(BigInteger a0) {
        return new GcfRecurrence(a0);
    }

    public void step(BigInteger a, BigInteger b) {
        BigInteger nextQ = a.multiply(q).add(b.multiply(prevQ));
        BigInteger nextP = a.multiply(p).add(b.multiply(prevP));
        prevQ = q;
        prevP = p;
        q = nextQ;
        p = nextP;
    }

    public BigInteger p() {
        return p;
    }

    public BigInteger q() {
        return q;
    }

    public BigInteger gcd() {
        return p.gcd(q);
    }

    /** {@code p / q}, empty while the denominator is zero. */
    public Optional<BigDecimal> value(MathContext mc) {
        if (q.signum() == 0) return Optional.empty();
        return Optional.of(new BigDecimal(p).divide(new BigDecimal(q), mc));
    }
}
