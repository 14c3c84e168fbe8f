/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.refine;

import ai.evacortex.ramanujan.core.Match;
import ai.evacortex.ramanujan.core.RefinedMatch;
import ai.evacortex.ramanujan.core.math.MathConstant;
import ai.evacortex.ramanujan.core.math.Pslq;
import ai.evacortex.ramanujan.core.math.RationalRelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Second stage of the search: evaluates every FR match to high precision and looks for
 * {@code v = (r0 + r1·c + r2·c²) / (r3 + r4·c + r5·c²)} against each target constant {@code c}.
 *
 * <p>A missing relation is a regular outcome and yields a {@link RefinedMatch} without one. A failure
 * inside the relation search is contained to its (match, constant) pair: it is logged and skipped.</p>
 */
public class RelationSearch {

    private static final Logger log = LoggerFactory.getLogger(RelationSearch.class);

    public static final long DEFAULT_MAX_COEFF = 1000;
    public static final int DEFAULT_MAX_STEPS = 100;

    private static final int GUARD_DIGITS = 10;

    private final GcfEvaluator evaluator;
    private final List<MathConstant> constants;
    private final long maxCoeff;
    private final int maxSteps;

    public RelationSearch(GcfEvaluator evaluator, List<MathConstant> constants) {
        this(evaluator, constants, DEFAULT_MAX_COEFF, DEFAULT_MAX_STEPS);
    }

    public RelationSearch(GcfEvaluator evaluator, List<MathConstant> constants, long maxCoeff, int maxSteps) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        if (constants == null || constants.isEmpty()) {
            throw new IllegalArgumentException("At least one constant required");
        }
        this.constants = List.copyOf(constants);
        this.maxCoeff = maxCoeff;
        this.maxSteps = maxSteps;
    }

    public List<RefinedMatch> refine(Collection<Match> matches) {
        List<RefinedMatch> refined = new ArrayList<>();
        for (Match match : matches) {
            Optional<GcfEvaluator.Evaluation> evaluation = evaluator.evaluate(match.pair());
            if (evaluation.isEmpty()) {
                log.warn("Skipping {}: fraction has no value at evaluated depth", match);
                continue;
            }
            GcfEvaluator.Evaluation e = evaluation.get();
            log.info("{} = {} ({} digits)", match, e.value().round(new MathContext(30)), e.precision());
            for (MathConstant constant : constants) {
                try {
                    RefinedMatch result = relate(match, e, constant);
                    if (result.hasRelation()) {
                        log.info("Relation for {} with {}: {} / {}", match, constant.key(),
                                Arrays.toString(result.numerator()), Arrays.toString(result.denominator()));
                    }
                    refined.add(result);
                } catch (RuntimeException ex) {
                    log.warn("Relation search failed for an={} bn={} value={} constant={}: {}",
                            Arrays.toString(match.an()), Arrays.toString(match.bn()),
                            e.value().round(new MathContext(30)), constant.key(), ex.getMessage());
                }
            }
        }
        return refined;
    }

    /**
     * Runs PSLQ on {@code [1, c, c², −v, −c·v, −c²·v]} with tolerance {@code 10^(1 − precision)}.
     */
    public RefinedMatch relate(Match match, GcfEvaluator.Evaluation evaluation, MathConstant constant) {
        int digits = evaluator.workingDigits() + GUARD_DIGITS;
        MathContext mc = new MathContext(digits);
        BigDecimal v = evaluation.value();
        BigDecimal reported = v.round(new MathContext(evaluator.workingDigits()));
        BigDecimal c = constant.value(mc);
        BigDecimal c2 = c.multiply(c, mc);

        List<BigDecimal> vector = List.of(
                BigDecimal.ONE,
                c,
                c2,
                v.negate(),
                c.multiply(v, mc).negate(),
                c2.multiply(v, mc).negate());
        BigDecimal tolerance = BigDecimal.ONE.scaleByPowerOfTen(1 - evaluation.precision());

        Optional<long[]> relation = Pslq.findRelation(vector, tolerance, digits, maxCoeff, maxSteps);
        if (relation.isEmpty()) {
            return RefinedMatch.withoutRelation(match, reported, constant.key(), evaluation.precision());
        }
        RationalRelation reduced = RationalRelation.reduce(relation.get());
        return new RefinedMatch(match.an(), match.bn(), reported, constant.key(),
                reduced.numerator(), reduced.denominator(), evaluation.precision());
    }
}
