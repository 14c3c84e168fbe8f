/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.engine;

import ch.obermuhlner.math.big.BigDecimalMath;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Burst-sampled FR test.
 *
 * <p>Every {@code burstNumber} steps, starting at step {@code max(burstNumber, minIters)}, the
 * estimate
 * <pre>
 *     s = ln(gcd(p, q)) / i + degA · (1 − ln i)
 * </pre>
 * is sampled. For a fraction with FR the estimate settles; otherwise it drifts. With three or more
 * samples a gap {@code |s[-2] − s[-1]|} wider than the one before it rejects the candidate. With two
 * or more samples a gap under the convergence threshold accepts it.</p>
 *
 * <p>Stateless; one instance can be shared by workers.</p>
 */
public class BurstFrDetector implements FrDetector {

    private final FrOptions options;
    private final MathContext mc;
    private final BigDecimal threshold;

    public BurstFrDetector() {
        this(FrOptions.defaultOptions());
    }

    public BurstFrDetector(FrOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.mc = new MathContext(options.digits());
        this.threshold = BigDecimal.valueOf(options.convergenceThreshold());
    }

    public FrOptions options() {
        return options;
    }

    @Override
    public FrResult check(Iterable<BigInteger> anTerms, Iterable<BigInteger> bnTerms, int anDegree) {
        Iterator<BigInteger> an = anTerms.iterator();
        Iterator<BigInteger> bn = bnTerms.iterator();
        if (!an.hasNext() || !bn.hasNext()) {
            return FrResult.noFr(0);
        }
        GcfRecurrence recurrence = GcfRecurrence.seed(an.next());
        bn.next();

        List<BigDecimal> samples = new ArrayList<>();
        int nextSample = options.firstSampleStep();
        int i = -1;
        while (an.hasNext() && bn.hasNext()) {
            i++;
            BigInteger a = an.next();
            BigInteger b = bn.next();
            if (b.signum() == 0) {
                return FrResult.noFr(i);
            }
            recurrence.step(a, b);
            if (i != nextSample) continue;
            nextSample += options.burstNumber();

            BigInteger gcd = recurrence.gcd();
            if (gcd.signum() == 0) {
                // p = q = 0: the fraction collapsed, the estimate has no value
                return FrResult.noFr(i);
            }
            samples.add(estimate(gcd, i, anDegree));

            int n = samples.size();
            if (n >= 3) {
                BigDecimal last = samples.get(n - 2).subtract(samples.get(n - 1)).abs();
                BigDecimal before = samples.get(n - 2).subtract(samples.get(n - 3)).abs();
                if (last.compareTo(before) > 0) {
                    return FrResult.noFr(i);
                }
            }
            if (n >= 2 && samples.get(n - 2).subtract(samples.get(n - 1)).abs().compareTo(threshold) < 0) {
                return FrResult.fr(i);
            }
        }
        return FrResult.noFr(Math.max(i, 0));
    }

    BigDecimal estimate(BigInteger gcd, int step, int anDegree) {
        BigDecimal logGcd = BigDecimalMath.log(new BigDecimal(gcd), mc);
        BigDecimal logStep = BigDecimalMath.log(BigDecimal.valueOf(step), mc);
        BigDecimal rate = logGcd.divide(BigDecimal.valueOf(step), mc);
        BigDecimal correction = BigDecimal.valueOf(anDegree).multiply(BigDecimal.ONE.subtract(logStep, mc), mc);
        return rate.add(correction, mc);
    }
}
