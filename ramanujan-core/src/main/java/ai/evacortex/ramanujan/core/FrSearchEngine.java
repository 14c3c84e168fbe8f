/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core;

import ai.evacortex.ramanujan.core.engine.BurstFrDetector;
import ai.evacortex.ramanujan.core.engine.FrDetector;
import ai.evacortex.ramanujan.core.engine.FrResult;
import ai.evacortex.ramanujan.core.enumeration.CoefficientPair;
import ai.evacortex.ramanujan.core.enumeration.DomainEnumerator;
import ai.evacortex.ramanujan.core.enumeration.SeriesTermCache;
import ai.evacortex.ramanujan.core.refine.DepthDoublingEvaluator;
import ai.evacortex.ramanujan.core.refine.GcfEvaluator;
import ai.evacortex.ramanujan.core.refine.RelationSearch;
import ai.evacortex.ramanujan.core.sharding.CoefficientDomain;
import ai.evacortex.ramanujan.core.sharding.DomainSplitter;
import ai.evacortex.ramanujan.core.storage.CheckpointStore;
import ai.evacortex.ramanujan.core.storage.MatchStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default {@link GcfSearch}: a checkpointed {@link DomainEnumerator} feeding an {@link FrDetector},
 * a write-through {@link MatchStore}, and a {@link RelationSearch} over a {@link GcfEvaluator}.
 *
 * <p>Matches go to {@code matches.json} and refined results to {@code refined-results.json}
 * in the results directory.</p>
 */
public class FrSearchEngine implements GcfSearch {

    private static final Logger log = LoggerFactory.getLogger(FrSearchEngine.class);

    public static final String MATCHES_FILE = "matches.json";
    public static final String REFINED_FILE = "refined-results.json";

    private static final long TERM_CACHE_SIZE = 10_000;

    private final FrSearchConfig config;
    private final FrDetector detector;
    private final RelationSearch relationSearch;
    private final CheckpointStore checkpoints;
    private final MatchStore matches;
    private final SeriesTermCache termCache;

    public FrSearchEngine(FrSearchConfig config) {
        this(config,
                new BurstFrDetector(config.frOptions()),
                new DepthDoublingEvaluator(config.refineInitialDepth(), config.refineMaxDepth(), config.refineDigits()));
    }

    public FrSearchEngine(FrSearchConfig config, FrDetector detector, GcfEvaluator evaluator) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        this.relationSearch = new RelationSearch(evaluator, config.constants(),
                config.pslqMaxCoeff(), config.pslqMaxSteps());
        this.checkpoints = new CheckpointStore(config.checkpointDir(), config.checkpointPrefix());
        this.matches = MatchStore.loadOrCreate(config.resultsDir().resolve(MATCHES_FILE));
        this.termCache = new SeriesTermCache(TERM_CACHE_SIZE);
    }

    @Override
    public List<Match> firstEnumeration(CoefficientDomain domain) {
        log.info("First enumeration over {} ({} pairs)", domain, domain.totalSize());
        DomainEnumerator enumerator = new DomainEnumerator(domain, checkpoints,
                config.primarySeries(), config.checkpointDumpSize());
        int depth = config.firstEnumerationDepth();
        Set<Match> found = new LinkedHashSet<>();
        long tested = 0;
        while (enumerator.hasNext()) {
            CoefficientPair pair = enumerator.next();
            tested++;
            List<BigInteger> anTerms = termCache.terms(pair.an(), depth);
            List<BigInteger> bnTerms = termCache.terms(pair.bn(), depth);
            FrResult result = detector.check(anTerms, bnTerms, pair.anDegree());
            if (!result.hasFr()) continue;

            Match match = Match.of(pair);
            if (!found.add(match)) continue;
            if (matches.add(match)) {
                log.info("Found GCF with FR at step {}: {}", result.step(), pair);
            } else {
                log.debug("Already stored: {}", pair);
            }
        }
        log.info("Tested {} pairs in {}, {} with FR", tested, domain, found.size());
        return new ArrayList<>(found);
    }

    @Override
    public List<RefinedMatch> improvePrecision(Collection<Match> candidates) {
        log.info("Refining {} matches against {}", candidates.size(), config.constants());
        List<RefinedMatch> refined = relationSearch.refine(candidates);
        matches.writeRefined(REFINED_FILE, refined);
        return refined;
    }

    @Override
    public List<RefinedMatch> search(CoefficientDomain domain) {
        firstEnumeration(domain);
        return improvePrecision(matches.snapshot());
    }

    @Override
    public List<RefinedMatch> searchParallel(CoefficientDomain domain, int workers) {
        List<CoefficientDomain> parts = DomainSplitter.split(domain, workers);
        log.info("Split {} into {} sub-domains", domain, parts.size());

        AtomicInteger threadIds = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(workers, parts.size()), r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("fr-worker-" + threadIds.incrementAndGet());
            return t;
        });
        try {
            List<Future<List<Match>>> futures = new ArrayList<>(parts.size());
            for (CoefficientDomain part : parts) {
                futures.add(executor.submit(() -> firstEnumeration(part)));
            }
            for (Future<List<Match>> future : futures) {
                future.get();
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new IllegalStateException("Worker failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for workers", e);
        } finally {
            shutdown(executor);
        }
        return improvePrecision(matches.snapshot());
    }

    public MatchStore matchStore() {
        return matches;
    }

    public CheckpointStore checkpointStore() {
        return checkpoints;
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Workers did not stop within 30s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
