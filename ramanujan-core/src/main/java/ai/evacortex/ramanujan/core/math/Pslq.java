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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * PSLQ integer relation detection (Ferguson–Bailey) in binary fixed-point arithmetic.
 *
 * <p>Given reals {@code x1..xn}, looks for integers {@code c1..cn}, not all zero and each below
 * {@code maxCoeff} in absolute value, with {@code |c1·x1 + ... + cn·xn| < tolerance}. Every
 * quantity is a {@link BigInteger} scaled by {@code 2^prec}; shifts and divisions round toward
 * negative infinity.</p>
 */
public final class Pslq {

    private static final int EXTRA_BITS = 60;
    private static final int MIN_BITS = 53;

    private Pslq() {}

    public static Optional<long[]> findRelation(List<BigDecimal> values,
                                                BigDecimal tolerance,
                                                int digits,
                                                long maxCoeff,
                                                int maxSteps) {
        int n = values.size();
        if (n < 2) {
            throw new RelationSearchException("at least two values are required, got " + n);
        }
        int prec = bitsForDigits(digits);
        if (prec < MIN_BITS) {
            throw new RelationSearchException("working precision too low: " + digits + " digits");
        }
        prec += EXTRA_BITS;

        BigInteger tol = toFixed(tolerance, prec);
        if (tol.signum() <= 0) {
            throw new RelationSearchException("tolerance " + tolerance + " is not positive at working precision");
        }

        BigInteger[] x = new BigInteger[n + 1];
        BigInteger minx = null;
        for (int k = 1; k <= n; k++) {
            x[k] = toFixed(values.get(k - 1), prec);
            BigInteger abs = x[k].abs();
            if (minx == null || abs.compareTo(minx) < 0) minx = abs;
        }
        if (minx.signum() == 0) {
            throw new RelationSearchException("vector must not contain zeros");
        }
        if (minx.compareTo(tol.divide(BigInteger.valueOf(100))) < 0) {
            return Optional.empty();
        }

        BigInteger one = BigInteger.ONE.shiftLeft(prec);
        BigInteger g = sqrtFixed(BigInteger.valueOf(4).shiftLeft(prec).divide(BigInteger.valueOf(3)), prec);

        BigInteger[][] a = new BigInteger[n + 1][n + 1];
        BigInteger[][] b = new BigInteger[n + 1][n + 1];
        BigInteger[][] h = new BigInteger[n + 1][n + 1];
        for (int i = 1; i <= n; i++) {
            for (int j = 1; j <= n; j++) {
                a[i][j] = i == j ? one : BigInteger.ZERO;
                b[i][j] = i == j ? one : BigInteger.ZERO;
                h[i][j] = BigInteger.ZERO;
            }
        }

        BigInteger[] s = new BigInteger[n + 1];
        for (int k = 1; k <= n; k++) {
            BigInteger t = BigInteger.ZERO;
            for (int j = k; j <= n; j++) {
                t = t.add(x[j].multiply(x[j]).shiftRight(prec));
            }
            s[k] = sqrtFixed(t, prec);
        }
        BigInteger t0 = s[1];
        BigInteger[] y = new BigInteger[n + 1];
        for (int k = 1; k <= n; k++) {
            y[k] = floorDiv(x[k].shiftLeft(prec), t0);
            s[k] = floorDiv(s[k].shiftLeft(prec), t0);
        }

        for (int i = 1; i <= n; i++) {
            if (i <= n - 1) {
                h[i][i] = s[i].signum() != 0 ? floorDiv(s[i + 1].shiftLeft(prec), s[i]) : BigInteger.ZERO;
            }
            for (int j = 1; j < i; j++) {
                BigInteger sjj1 = s[j].multiply(s[j + 1]);
                h[i][j] = sjj1.signum() != 0
                        ? floorDiv(y[i].negate().multiply(y[j]).shiftLeft(prec), sjj1)
                        : BigInteger.ZERO;
            }
        }

        for (int i = 2; i <= n; i++) {
            for (int j = i - 1; j >= 1; j--) {
                if (h[j][j].signum() == 0) continue;
                BigInteger t = roundFixed(floorDiv(h[i][j].shiftLeft(prec), h[j][j]), prec);
                reduce(i, j, t, n, prec, y, a, b, h);
            }
        }

        for (int rep = 0; rep < maxSteps; rep++) {
            int m = -1;
            BigInteger szmax = BigInteger.ONE.negate();
            for (int i = 1; i < n; i++) {
                BigInteger sz = g.pow(i).multiply(h[i][i].abs()).shiftRight(prec * (i - 1));
                if (sz.compareTo(szmax) > 0) {
                    m = i;
                    szmax = sz;
                }
            }

            swap(y, m, m + 1);
            for (int i = 1; i <= n; i++) {
                swap(h, m, i, m + 1, i);
                swap(a, m, i, m + 1, i);
                swap(b, i, m, i, m + 1);
            }

            if (m <= n - 2) {
                BigInteger norm = sqrtFixed(h[m][m].pow(2).add(h[m][m + 1].pow(2)).shiftRight(prec), prec);
                if (norm.signum() == 0) break;
                BigInteger t1 = floorDiv(h[m][m].shiftLeft(prec), norm);
                BigInteger t2 = floorDiv(h[m][m + 1].shiftLeft(prec), norm);
                for (int i = m; i <= n; i++) {
                    BigInteger t3 = h[i][m];
                    BigInteger t4 = h[i][m + 1];
                    h[i][m] = t1.multiply(t3).add(t2.multiply(t4)).shiftRight(prec);
                    h[i][m + 1] = t2.negate().multiply(t3).add(t1.multiply(t4)).shiftRight(prec);
                }
            }

            for (int i = m + 1; i <= n; i++) {
                for (int j = Math.min(i - 1, m + 1); j >= 1; j--) {
                    if (h[j][j].signum() == 0) break;
                    BigInteger t = roundFixed(floorDiv(h[i][j].shiftLeft(prec), h[j][j]), prec);
                    reduce(i, j, t, n, prec, y, a, b, h);
                }
            }

            for (int i = 1; i <= n; i++) {
                if (y[i].abs().compareTo(tol) < 0) {
                    long[] vec = new long[n];
                    boolean small = true;
                    for (int j = 1; j <= n; j++) {
                        BigInteger c = roundFixed(b[j][i], prec).shiftRight(prec);
                        if (c.abs().compareTo(BigInteger.valueOf(maxCoeff)) >= 0) {
                            small = false;
                            break;
                        }
                        vec[j - 1] = c.longValueExact();
                    }
                    if (small) return Optional.of(vec);
                }
            }

            BigInteger recnorm = BigInteger.ZERO;
            for (int i = 1; i <= n; i++) {
                for (int j = 1; j <= n; j++) {
                    recnorm = recnorm.max(h[i][j].abs());
                }
            }
            if (recnorm.signum() == 0) break;
            BigInteger bound = BigInteger.ONE.shiftLeft(2 * prec).divide(recnorm).shiftRight(prec)
                    .divide(BigInteger.valueOf(100));
            if (bound.compareTo(BigInteger.valueOf(maxCoeff)) >= 0) break;
        }
        return Optional.empty();
    }

    public static int bitsForDigits(int digits) {
        return (int) Math.ceil(digits * (Math.log(10) / Math.log(2)));
    }

    private static void reduce(int i, int j, BigInteger t, int n, int prec,
                               BigInteger[] y, BigInteger[][] a, BigInteger[][] b, BigInteger[][] h) {
        y[j] = y[j].add(t.multiply(y[i]).shiftRight(prec));
        for (int k = 1; k <= j; k++) {
            h[i][k] = h[i][k].subtract(t.multiply(h[j][k]).shiftRight(prec));
        }
        for (int k = 1; k <= n; k++) {
            a[i][k] = a[i][k].subtract(t.multiply(a[j][k]).shiftRight(prec));
            b[k][j] = b[k][j].add(t.multiply(b[k][i]).shiftRight(prec));
        }
    }

    static BigInteger toFixed(BigDecimal value, int prec) {
        return value.multiply(new BigDecimal(BigInteger.ONE.shiftLeft(prec)))
                .setScale(0, RoundingMode.HALF_EVEN)
                .toBigInteger();
    }

    static BigInteger sqrtFixed(BigInteger x, int prec) {
        return x.shiftLeft(prec).sqrt();
    }

    static BigInteger roundFixed(BigInteger x, int prec) {
        return x.add(BigInteger.ONE.shiftLeft(prec - 1)).shiftRight(prec).shiftLeft(prec);
    }

    static BigInteger floorDiv(BigInteger a, BigInteger b) {
        BigInteger[] qr = a.divideAndRemainder(b);
        if (qr[1].signum() != 0 && qr[1].signum() != b.signum()) {
            return qr[0].subtract(BigInteger.ONE);
        }
        return qr[0];
    }

    private static void swap(BigInteger[] v, int i, int j) {
        BigInteger tmp = v[i];
        v[i] = v[j];
        v[j] = tmp;
    }

    private static void swap(BigInteger[][] m, int i1, int j1, int i2, int j2) {
        BigInteger tmp = m[i1][j1];
        m[i1][j1] = m[i2][j2];
        m[i2][j2] = tmp;
    }
}
