/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core;

import ai.evacortex.ramanujan.core.sharding.CoefficientDomain;

import java.util.Collection;
import java.util.List;

/**
 * {@code GcfSearch} defines the two-stage search for generalized continued fractions
 * <pre>
 *     a(0) + b(1) / (a(1) + b(2) / (a(2) + ...))
 * </pre>
 * with integer polynomial coefficients drawn from a {@link CoefficientDomain}.
 *
 * <p>The first stage walks every {@code (a, b)} coefficient pair of the domain and keeps those whose
 * convergents show Factorial Reduction. The walk is checkpointed, so an interrupted run resumes at
 * the coordinate it stopped at; the coordinate itself is tested again and the match store absorbs
 * the duplicate.</p>
 *
 * <p>The second stage evaluates every match to high precision and looks for a rational function of
 * degree at most two in a target constant that equals the value. A match without such a relation is
 * still reported.</p>
 *
 * <p>Each stage is deterministic for a given domain and configuration.</p>
 *
 * @see Match
 * @see RefinedMatch
 * @see FrSearchConfig
 */
public interface GcfSearch {

    /**
     * Runs the FR test over every coefficient pair of the domain, resuming from its checkpoint.
     *
     * @param domain the coefficient domain to enumerate
     * @return the matches found by this call, in enumeration order, without duplicates
     * @throws ai.evacortex.ramanujan.core.exceptions.CheckpointWriteException if a checkpoint cannot be written
     * @throws ai.evacortex.ramanujan.core.exceptions.MatchStoreException      if a match cannot be persisted
     */
    List<Match> firstEnumeration(CoefficientDomain domain);

    /**
     * Evaluates matches to high precision and searches for a relation with every configured constant.
     * Matches that cannot be evaluated, and relation searches that fail, are logged and skipped.
     *
     * @param matches FR matches, typically the content of the match store
     * @return one entry per evaluated (match, constant) pair
     */
    List<RefinedMatch> improvePrecision(Collection<Match> matches);

    /**
     * {@link #firstEnumeration} followed by {@link #improvePrecision} over every stored match,
     * including those of earlier runs.
     */
    List<RefinedMatch> search(CoefficientDomain domain);

    /**
     * Splits the domain into {@code workers} disjoint sub-domains, runs the first stage of each on its
     * own thread with its own checkpoint, then refines the merged matches.
     *
     * @throws IllegalArgumentException if {@code workers < 1}
     * @throws IllegalStateException    if a worker fails or the run is interrupted
     */
    List<RefinedMatch> searchParallel(CoefficientDomain domain, int workers);
}
