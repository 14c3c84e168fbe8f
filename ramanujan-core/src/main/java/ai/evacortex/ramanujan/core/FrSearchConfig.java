/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core;

import ai.evacortex.ramanujan.core.engine.FrOptions;
import ai.evacortex.ramanujan.core.enumeration.DomainEnumerator;
import ai.evacortex.ramanujan.core.math.MathConstant;
import ai.evacortex.ramanujan.core.refine.DepthDoublingEvaluator;
import ai.evacortex.ramanujan.core.refine.RelationSearch;
import ai.evacortex.ramanujan.core.sharding.Series;

import java.nio.file.Path;
import java.util.List;

/**
 * Settings of one search run. {@link #fromSystemProperties()} reads {@code ramanujan.*} JVM
 * properties, falling back to {@link #defaults()} for anything unset.
 */
public record FrSearchConfig(
        Path checkpointDir,
        String checkpointPrefix,
        int checkpointDumpSize,
        FrOptions frOptions,
        int firstEnumerationDepth,
        Series primarySeries,
        int refineDigits,
        int refineInitialDepth,
        int refineMaxDepth,
        List<MathConstant> constants,
        long pslqMaxCoeff,
        int pslqMaxSteps,
        Path resultsDir
) {
    public static final int DEFAULT_FIRST_ENUMERATION_DEPTH = 1000;

    public FrSearchConfig {
        if (firstEnumerationDepth < 1) {
            throw new IllegalArgumentException("firstEnumerationDepth must be >= 1");
        }
        constants = List.copyOf(constants);
    }

    public static FrSearchConfig defaults() {
        return new FrSearchConfig(
                Path.of("checkpoints"),
                "",
                DomainEnumerator.DEFAULT_CHECKPOINT_DUMP_SIZE,
                FrOptions.defaultOptions(),
                DEFAULT_FIRST_ENUMERATION_DEPTH,
                Series.A,
                DepthDoublingEvaluator.DEFAULT_DIGITS,
                DepthDoublingEvaluator.DEFAULT_INITIAL_DEPTH,
                DepthDoublingEvaluator.DEFAULT_MAX_DEPTH,
                List.of(MathConstant.ZETA3),
                RelationSearch.DEFAULT_MAX_COEFF,
                RelationSearch.DEFAULT_MAX_STEPS,
                Path.of("results"));
    }

    public static FrSearchConfig fromSystemProperties() {
        FrSearchConfig d = defaults();
        FrOptions fr = new FrOptions(
                Integer.getInteger("ramanujan.fr.burstNumber", d.frOptions().burstNumber()),
                Integer.getInteger("ramanujan.fr.minIters", d.frOptions().minIters()),
                Double.parseDouble(System.getProperty("ramanujan.fr.convergenceThreshold",
                        String.valueOf(d.frOptions().convergenceThreshold()))),
                Integer.getInteger("ramanujan.fr.digits", d.frOptions().digits()));
        return new FrSearchConfig(
                Path.of(System.getProperty("ramanujan.checkpoint.dir", d.checkpointDir().toString())),
                System.getProperty("ramanujan.checkpoint.prefix", d.checkpointPrefix()),
                Integer.getInteger("ramanujan.checkpoint.dumpSize", d.checkpointDumpSize()),
                fr,
                Integer.getInteger("ramanujan.fr.maxDepth", d.firstEnumerationDepth()),
                Series.parse(System.getProperty("ramanujan.primarySeries", "a")),
                Integer.getInteger("ramanujan.refine.digits", d.refineDigits()),
                Integer.getInteger("ramanujan.refine.initialDepth", d.refineInitialDepth()),
                Integer.getInteger("ramanujan.refine.maxDepth", d.refineMaxDepth()),
                MathConstant.parseList(System.getProperty("ramanujan.constants", "zeta3")),
                Long.getLong("ramanujan.pslq.maxCoeff", d.pslqMaxCoeff()),
                Integer.getInteger("ramanujan.pslq.maxSteps", d.pslqMaxSteps()),
                Path.of(System.getProperty("ramanujan.results.dir", d.resultsDir().toString())));
    }

    public FrSearchConfig withCheckpointDir(Path dir) {
        return new FrSearchConfig(dir, checkpointPrefix, checkpointDumpSize, frOptions, firstEnumerationDepth,
                primarySeries, refineDigits, refineInitialDepth, refineMaxDepth, constants, pslqMaxCoeff,
                pslqMaxSteps, resultsDir);
    }

    public FrSearchConfig withResultsDir(Path dir) {
        return new FrSearchConfig(checkpointDir, checkpointPrefix, checkpointDumpSize, frOptions,
                firstEnumerationDepth, primarySeries, refineDigits, refineInitialDepth, refineMaxDepth, constants,
                pslqMaxCoeff, pslqMaxSteps, dir);
    }

    public FrSearchConfig withConstants(List<MathConstant> list) {
        return new FrSearchConfig(checkpointDir, checkpointPrefix, checkpointDumpSize, frOptions,
                firstEnumerationDepth, primarySeries, refineDigits, refineInitialDepth, refineMaxDepth, list,
                pslqMaxCoeff, pslqMaxSteps, resultsDir);
    }

    public FrSearchConfig withRefineDepths(int initialDepth, int maxDepth, int digits) {
        return new FrSearchConfig(checkpointDir, checkpointPrefix, checkpointDumpSize, frOptions,
                firstEnumerationDepth, primarySeries, digits, initialDepth, maxDepth, constants,
                pslqMaxCoeff, pslqMaxSteps, resultsDir);
    }
}
