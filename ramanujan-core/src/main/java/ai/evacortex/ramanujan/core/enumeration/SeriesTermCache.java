/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.enumeration;

import ai.evacortex.ramanujan.core.math.CompactPolynomial;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

/**
 * Memoizes series terms per coefficient tuple and depth.
 *
 * <p>Under the nested enumeration the primary tuple stays fixed for a whole inner loop, so its
 * terms are computed once and served from here for every secondary tuple.</p>
 */
public class SeriesTermCache {

    /* key = (coefficients, depth); the list form gives value equality */
    private record Key(List<Long> coefficients, int depth) {}

    private final LoadingCache<Key, List<BigInteger>> cache;

    public SeriesTermCache(long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build(k -> CompactPolynomial.series(toArray(k.coefficients()), k.depth()));
    }

    public List<BigInteger> terms(long[] coefficients, int depth) {
        return cache.get(new Key(Arrays.stream(coefficients).boxed().toList(), depth));
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    private static long[] toArray(List<Long> coefficients) {
        return coefficients.stream().mapToLong(Long::longValue).toArray();
    }
}
