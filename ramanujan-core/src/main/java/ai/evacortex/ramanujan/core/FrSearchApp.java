/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core;

import ai.evacortex.ramanujan.core.sharding.AxisRange;
import ai.evacortex.ramanujan.core.sharding.CoefficientDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Command-line entry point. The domain and the run are described by system properties, e.g.
 * <pre>
 *   java -Dramanujan.a.degree=3 -Dramanujan.a.range=-40,40 \
 *        -Dramanujan.b.degree=6 -Dramanujan.b.range=-1,1 \
 *        -Dramanujan.workers=8 -Dramanujan.constants=zeta3 \
 *        ai.evacortex.ramanujan.core.FrSearchApp
 * </pre>
 */
public final class FrSearchApp {

    private static final Logger log = LoggerFactory.getLogger(FrSearchApp.class);

    private FrSearchApp() {}

    public static void main(String[] args) {
        CoefficientDomain domain = CoefficientDomain.of(
                Integer.getInteger("ramanujan.a.degree", 2),
                parseRange(System.getProperty("ramanujan.a.range", "-5,5")),
                Integer.getInteger("ramanujan.b.degree", 2),
                parseRange(System.getProperty("ramanujan.b.range", "-5,5")),
                Boolean.parseBoolean(System.getProperty("ramanujan.a.leadPositive", "true")));
        int workers = Integer.getInteger("ramanujan.workers", Runtime.getRuntime().availableProcessors());

        FrSearchConfig config = FrSearchConfig.fromSystemProperties();
        FrSearchEngine engine = new FrSearchEngine(config);
        List<RefinedMatch> results = workers > 1
                ? engine.searchParallel(domain, workers)
                : engine.search(domain);

        long withRelation = results.stream().filter(RefinedMatch::hasRelation).count();
        log.info("Done: {} refined results, {} with a relation, written to {}",
                results.size(), withRelation, config.resultsDir().resolve(FrSearchEngine.REFINED_FILE));
    }

    /** {@code "lo,hi"} */
    static AxisRange parseRange(String value) {
        String[] parts = value.split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Range must be 'lo,hi': " + value);
        }
        return new AxisRange(Long.parseLong(parts[0].trim()), Long.parseLong(parts[1].trim()));
    }
}
