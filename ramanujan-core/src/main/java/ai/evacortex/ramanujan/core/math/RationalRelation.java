/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.math;

import ai.evacortex.ramanujan.core.exceptions.RelationSearchException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * {@code v = numerator(c) / denominator(c)} with integer polynomials in ascending powers of the
 * constant {@code c}.
 *
 * <p>The canonical form has no common polynomial factor, no common integer content, and a
 * denominator whose highest nonzero coefficient is positive.</p>
 */
public record RationalRelation(long[] numerator, long[] denominator) {

    public static final int GROUP_SIZE = 3;

    public RationalRelation {
        numerator = numerator.clone();
        denominator = denominator.clone();
    }

    /**
     * Reduces a relation vector {@code (r0, r1, r2, r3, r4, r5)} for
     * {@code r0 + r1·c + r2·c² − v·(r3 + r4·c + r5·c²) = 0}.
     */
    public static RationalRelation reduce(long[] relation) {
        if (relation.length != 2 * GROUP_SIZE) {
            throw new RelationSearchException("relation must have " + 2 * GROUP_SIZE
                    + " entries, got " + relation.length);
        }
        List<BigInteger> num = trim(toPoly(Arrays.copyOfRange(relation, 0, GROUP_SIZE)));
        List<BigInteger> den = trim(toPoly(Arrays.copyOfRange(relation, GROUP_SIZE, 2 * GROUP_SIZE)));

        if (den.isEmpty()) {
            return new RationalRelation(toArray(primitive(num)), new long[GROUP_SIZE]);
        }
        if (!num.isEmpty()) {
            List<BigInteger> g = gcd(num, den);
            if (g.size() > 1) {
                num = divideExact(num, g);
                den = divideExact(den, g);
            }
        }
        BigInteger c = content(den).gcd(content(num));
        num = scale(num, c);
        den = scale(den, c);
        if (den.get(den.size() - 1).signum() < 0) {
            num = negate(num);
            den = negate(den);
        }
        return new RationalRelation(toArray(num), toArray(den));
    }

    public long[] numerator() {
        return numerator.clone();
    }

    public long[] denominator() {
        return denominator.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RationalRelation that)) return false;
        return Arrays.equals(numerator, that.numerator) && Arrays.equals(denominator, that.denominator);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(numerator) + Arrays.hashCode(denominator);
    }

    @Override
    public String toString() {
        return Arrays.toString(numerator) + " / " + Arrays.toString(denominator);
    }

    /* polynomials below: ascending coefficient lists, trimmed so the last entry is nonzero */

    private static List<BigInteger> gcd(List<BigInteger> a, List<BigInteger> b) {
        List<BigInteger> x = a.size() >= b.size() ? primitive(a) : primitive(b);
        List<BigInteger> y = a.size() >= b.size() ? primitive(b) : primitive(a);
        while (!y.isEmpty()) {
            List<BigInteger> r = pseudoRemainder(x, y);
            x = y;
            y = r.isEmpty() ? r : primitive(r);
        }
        return primitive(x);
    }

    private static List<BigInteger> pseudoRemainder(List<BigInteger> a, List<BigInteger> b) {
        List<BigInteger> r = new ArrayList<>(a);
        int db = b.size() - 1;
        BigInteger lead = b.get(db);
        while (!r.isEmpty() && r.size() - 1 >= db) {
            int shift = r.size() - 1 - db;
            BigInteger top = r.get(r.size() - 1);
            List<BigInteger> next = new ArrayList<>(r.size());
            for (int i = 0; i < r.size(); i++) {
                BigInteger v = r.get(i).multiply(lead);
                if (i >= shift) v = v.subtract(top.multiply(b.get(i - shift)));
                next.add(v);
            }
            r = trim(next);
        }
        return r;
    }

    private static List<BigInteger> divideExact(List<BigInteger> a, List<BigInteger> g) {
        List<BigInteger> r = new ArrayList<>(a);
        int dg = g.size() - 1;
        BigInteger[] q = new BigInteger[a.size() - dg];
        Arrays.fill(q, BigInteger.ZERO);
        while (!r.isEmpty() && r.size() - 1 >= dg) {
            int shift = r.size() - 1 - dg;
            BigInteger[] qr = r.get(r.size() - 1).divideAndRemainder(g.get(dg));
            if (qr[1].signum() != 0) {
                throw new RelationSearchException("non-exact polynomial division");
            }
            q[shift] = qr[0];
            for (int i = 0; i <= dg; i++) {
                r.set(i + shift, r.get(i + shift).subtract(qr[0].multiply(g.get(i))));
            }
            r = trim(r);
        }
        if (!r.isEmpty()) {
            throw new RelationSearchException("non-exact polynomial division");
        }
        return trim(new ArrayList<>(Arrays.asList(q)));
    }

    private static BigInteger content(List<BigInteger> p) {
        BigInteger c = BigInteger.ZERO;
        for (BigInteger v : p) c = c.gcd(v);
        return c;
    }

    private static List<BigInteger> primitive(List<BigInteger> p) {
        if (p.isEmpty()) return p;
        List<BigInteger> r = scale(p, content(p));
        return r.get(r.size() - 1).signum() < 0 ? negate(r) : r;
    }

    private static List<BigInteger> scale(List<BigInteger> p, BigInteger divisor) {
        if (divisor.signum() == 0 || divisor.equals(BigInteger.ONE)) return p;
        List<BigInteger> r = new ArrayList<>(p.size());
        for (BigInteger v : p) r.add(v.divide(divisor));
        return r;
    }

    private static List<BigInteger> negate(List<BigInteger> p) {
        List<BigInteger> r = new ArrayList<>(p.size());
        for (BigInteger v : p) r.add(v.negate());
        return r;
    }

    private static List<BigInteger> trim(List<BigInteger> p) {
        int end = p.size();
        while (end > 0 && p.get(end - 1).signum() == 0) end--;
        return new ArrayList<>(p.subList(0, end));
    }

    private static List<BigInteger> toPoly(long[] coefficients) {
        List<BigInteger> p = new ArrayList<>(coefficients.length);
        for (long c : coefficients) p.add(BigInteger.valueOf(c));
        return p;
    }

    private static long[] toArray(List<BigInteger> p) {
        long[] out = new long[GROUP_SIZE];
        for (int i = 0; i < p.size(); i++) out[i] = p.get(i).longValueExact();
        return out;
    }
}
