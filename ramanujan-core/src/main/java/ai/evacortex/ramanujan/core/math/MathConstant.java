/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.math;

import ch.obermuhlner.math.big.BigDecimalMath;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

/**
 * Target constants the relation search can test a continued fraction's value against.
 */
public enum MathConstant {

    PI("pi") {
        @Override
        public BigDecimal value(MathContext mc) {
            return BigDecimalMath.pi(mc);
        }
    },
    E("e") {
        @Override
        public BigDecimal value(MathContext mc) {
            return BigDecimalMath.e(mc);
        }
    },
    LN2("ln2") {
        @Override
        public BigDecimal value(MathContext mc) {
            return BigDecimalMath.log(BigDecimal.valueOf(2), mc);
        }
    },
    ZETA2("zeta2") {
        @Override
        public BigDecimal value(MathContext mc) {
            MathContext work = new MathContext(mc.getPrecision() + 5);
            BigDecimal pi = BigDecimalMath.pi(work);
            return pi.multiply(pi, work).divide(BigDecimal.valueOf(6), mc);
        }
    },
    ZETA3("zeta3") {
        @Override
        public BigDecimal value(MathContext mc) {
            return apery(mc);
        }
    };

    private final String key;

    MathConstant(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public abstract BigDecimal value(MathContext mc);

    public static MathConstant fromKey(String key) {
        String k = key.trim().toLowerCase();
        for (MathConstant c : values()) {
            if (c.key.equals(k)) return c;
        }
        throw new IllegalArgumentException("Unknown constant: " + key);
    }

    /** Comma separated keys, e.g. {@code "zeta3,pi"}. */
    public static List<MathConstant> parseList(String keys) {
        List<MathConstant> constants = new ArrayList<>();
        for (String k : keys.split(",")) {
            if (!k.isBlank()) constants.add(fromKey(k));
        }
        if (constants.isEmpty()) {
            throw new IllegalArgumentException("At least one constant required");
        }
        return List.copyOf(constants);
    }

    /*
     * zeta(3) = 5/2 · sum_{k>=1} (-1)^(k+1) / (k^3 · C(2k, k))
     * each term is roughly a quarter of the previous one
     */
    private static BigDecimal apery(MathContext mc) {
        MathContext work = new MathContext(mc.getPrecision() + 10);
        BigDecimal epsilon = BigDecimal.ONE.movePointLeft(mc.getPrecision() + 5);
        BigDecimal sum = BigDecimal.ZERO;
        BigInteger central = BigInteger.ONE;
        for (long k = 1; ; k++) {
            central = central.multiply(BigInteger.valueOf(2 * k))
                    .multiply(BigInteger.valueOf(2 * k - 1))
                    .divide(BigInteger.valueOf(k * k));
            BigInteger denominator = central.multiply(BigInteger.valueOf(k).pow(3));
            BigDecimal term = BigDecimal.ONE.divide(new BigDecimal(denominator), work);
            sum = (k % 2 == 1) ? sum.add(term, work) : sum.subtract(term, work);
            if (term.compareTo(epsilon) < 0) break;
        }
        return sum.multiply(BigDecimal.valueOf(5), work).divide(BigDecimal.valueOf(2), mc);
    }
}
