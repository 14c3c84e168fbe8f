/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.enumeration;

import ai.evacortex.ramanujan.core.sharding.AxisRange;
import ai.evacortex.ramanujan.core.sharding.CoefficientDomain;
import ai.evacortex.ramanujan.core.sharding.Series;
import ai.evacortex.ramanujan.core.storage.Checkpoint;
import ai.evacortex.ramanujan.core.storage.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Resumable nested-loop walk over {@code primary × secondary} coefficient tuples of a domain.
 *
 * <p>The enumerator starts at the pair stored in the domain's checkpoint (or at the origin) and
 * re-emits that pair first: work under a checkpointed coordinate may have been cut short, so it
 * is redone rather than skipped. Every {@code checkpointDumpSize} emitted pairs the coordinate
 * about to be emitted is persisted. Once the consumer asks for more after the last pair, the
 * checkpoint is deleted, so a later run over the same domain starts fresh.</p>
 *
 * <p>Not thread-safe. Each worker owns its own enumerator over its own sub-domain.</p>
 */
public class DomainEnumerator implements Iterator<CoefficientPair> {

    private static final Logger log = LoggerFactory.getLogger(DomainEnumerator.class);

    public static final int DEFAULT_CHECKPOINT_DUMP_SIZE = 5_000;

    private final CoefficientDomain domain;
    private final CheckpointStore checkpoints;
    private final Series primary;
    private final int checkpointDumpSize;
    private final List<AxisRange> primaryAxes;
    private final List<AxisRange> secondaryAxes;

    private long[] primaryCursor;
    private long[] secondaryCursor;
    private long itemsPassed;
    private boolean completed;

    public DomainEnumerator(CoefficientDomain domain, CheckpointStore checkpoints, Series primary) {
        this(domain, checkpoints, primary, DEFAULT_CHECKPOINT_DUMP_SIZE);
    }

    public DomainEnumerator(CoefficientDomain domain,
                            CheckpointStore checkpoints,
                            Series primary,
                            int checkpointDumpSize) {
        this.domain = Objects.requireNonNull(domain, "domain must not be null");
        this.checkpoints = Objects.requireNonNull(checkpoints, "checkpoints must not be null");
        this.primary = Objects.requireNonNull(primary, "primary must not be null");
        if (checkpointDumpSize <= 0) {
            throw new IllegalArgumentException("checkpointDumpSize must be > 0");
        }
        this.checkpointDumpSize = checkpointDumpSize;
        this.primaryAxes = domain.axisRanges(primary);
        this.secondaryAxes = domain.axisRanges(primary.other());

        Checkpoint start = checkpoints.load(domain);
        this.primaryCursor = start.tuple(primary);
        this.secondaryCursor = start.tuple(primary.other());
    }

    @Override
    public boolean hasNext() {
        if (primaryCursor != null) return true;
        if (!completed) {
            completed = true;
            checkpoints.delete(domain);
            log.info("Finished enumerating {} ({} pairs this run)", domain, itemsPassed);
        }
        return false;
    }

    @Override
    public CoefficientPair next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Domain exhausted: " + domain);
        }
        if (itemsPassed > 0 && itemsPassed % checkpointDumpSize == 0) {
            saveCheckpoint();
        }
        CoefficientPair pair = currentPair();
        itemsPassed++;
        advance();
        return pair;
    }

    public EnumerationCursor cursor() {
        return new EnumerationCursor(primary,
                primaryCursor == null ? null : primaryCursor.clone(),
                secondaryCursor == null ? null : secondaryCursor.clone(),
                itemsPassed);
    }

    public CoefficientDomain domain() {
        return domain;
    }

    public Series primary() {
        return primary;
    }

    private void advance() {
        long[] nextSecondary = TupleOdometer.next(secondaryAxes, secondaryCursor);
        if (nextSecondary != null) {
            secondaryCursor = nextSecondary;
            return;
        }
        long[] nextPrimary = TupleOdometer.next(primaryAxes, primaryCursor);
        if (nextPrimary == null) {
            primaryCursor = null;
            secondaryCursor = null;
            return;
        }
        primaryCursor = nextPrimary;
        secondaryCursor = domain.origin(primary.other());
    }

    private CoefficientPair currentPair() {
        return primary == Series.A
                ? new CoefficientPair(primaryCursor, secondaryCursor)
                : new CoefficientPair(secondaryCursor, primaryCursor);
    }

    private void saveCheckpoint() {
        CoefficientPair pair = currentPair();
        checkpoints.save(domain, pair.an(), pair.bn());
    }
}
