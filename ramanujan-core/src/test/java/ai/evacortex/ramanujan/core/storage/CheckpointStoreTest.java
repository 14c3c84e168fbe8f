/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.storage;

import ai.evacortex.ramanujan.core.enumeration.DomainEnumerator;
import ai.evacortex.ramanujan.core.exceptions.CheckpointWriteException;
import ai.evacortex.ramanujan.core.sharding.AxisRange;
import ai.evacortex.ramanujan.core.sharding.CoefficientDomain;
import ai.evacortex.ramanujan.core.sharding.Series;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointStoreTest {

    private static final CoefficientDomain DOMAIN =
            CoefficientDomain.of(1, new AxisRange(-3, 3), 2, new AxisRange(-2, 2), true);

    @TempDir
    Path dir;

    @Test
    void testLoad_withoutFileReturnsOrigin() {
        CheckpointStore store = new CheckpointStore(dir, "");
        Checkpoint checkpoint = store.load(DOMAIN);

        assertArrayEquals(new long[]{1, -3}, checkpoint.a());
        assertArrayEquals(new long[]{-2, -2, -2}, checkpoint.b());
    }

    @Test
    void testSaveThenLoad_reproducesCoordinate() {
        CheckpointStore store = new CheckpointStore(dir, "run-");
        store.save(DOMAIN, new long[]{2, 0}, new long[]{1, -1, 2});

        Path file = store.fileFor(DOMAIN);
        assertTrue(Files.exists(file));
        assertTrue(file.getFileName().toString().startsWith("run-"));
        assertEquals("run-" + store.identity(DOMAIN) + ".json", file.getFileName().toString());

        Checkpoint loaded = store.load(DOMAIN);
        assertEquals(new Checkpoint(new long[]{2, 0}, new long[]{1, -1, 2}), loaded);
        assertEquals(loaded, store.load(DOMAIN), "Loading must not consume the checkpoint");
    }

    @Test
    void testSave_overwritesPreviousCheckpoint() {
        CheckpointStore store = new CheckpointStore(dir, "");
        store.save(DOMAIN, new long[]{3, 3}, new long[]{2, 2, 2});
        store.save(DOMAIN, new long[]{1, 0}, new long[]{0, 0, 0});

        assertArrayEquals(new long[]{1, 0}, store.load(DOMAIN).tuple(Series.A));
    }

    @Test
    void testDelete_isIdempotent() {
        CheckpointStore store = new CheckpointStore(dir, "");
        assertDoesNotThrow(() -> store.delete(DOMAIN));

        store.save(DOMAIN, new long[]{2, 0}, new long[]{0, 0, 0});
        store.delete(DOMAIN);
        assertFalse(Files.exists(store.fileFor(DOMAIN)));
        assertDoesNotThrow(() -> store.delete(DOMAIN));
    }

    @Test
    void testCorruptFile_isQuarantinedAndOriginReturned() throws Exception {
        CheckpointStore store = new CheckpointStore(dir, "");
        Path file = store.fileFor(DOMAIN);
        Files.writeString(file, "{\"a\": [1, ");

        Checkpoint checkpoint = store.load(DOMAIN);

        assertEquals(Checkpoint.origin(DOMAIN), checkpoint);
        assertFalse(Files.exists(file));
        Path quarantined = file.resolveSibling(file.getFileName() + CheckpointStore.CORRUPTED_SUFFIX);
        assertTrue(Files.exists(quarantined), "Corrupt file must be kept aside");
        assertEquals("{\"a\": [1, ", Files.readString(quarantined));
    }

    @Test
    void testForeignCoordinate_isQuarantined() throws Exception {
        CheckpointStore store = new CheckpointStore(dir, "");
        Path file = store.fileFor(DOMAIN);
        Files.writeString(file, "{\"a\": [9, 9], \"b\": [0, 0, 0]}");

        assertEquals(Checkpoint.origin(DOMAIN), store.load(DOMAIN));
        assertTrue(Files.exists(file.resolveSibling(file.getFileName() + CheckpointStore.CORRUPTED_SUFFIX)));
    }

    @Test
    void testSubDomains_useDistinctFiles() {
        CheckpointStore store = new CheckpointStore(dir, "");
        CoefficientDomain left = DOMAIN.withAxisRange(Series.A, 1, new AxisRange(-3, 0));
        CoefficientDomain right = DOMAIN.withAxisRange(Series.A, 1, new AxisRange(1, 3));

        assertNotEquals(store.fileFor(left), store.fileFor(right));
        assertEquals(32, store.identity(left).length());
    }

    @Test
    void testRepeatedCorruption_keepsEveryQuarantinedFile() throws Exception {
        CheckpointStore store = new CheckpointStore(dir, "");
        Path file = store.fileFor(DOMAIN);
        Path first = file.resolveSibling(file.getFileName() + CheckpointStore.CORRUPTED_SUFFIX);
        Path second = file.resolveSibling(file.getFileName() + CheckpointStore.CORRUPTED_SUFFIX + ".1");

        Files.writeString(file, "first-corrupt");
        assertEquals(Checkpoint.origin(DOMAIN), store.load(DOMAIN));
        Files.writeString(file, "second-corrupt");
        assertEquals(Checkpoint.origin(DOMAIN), store.load(DOMAIN));

        assertEquals("first-corrupt", Files.readString(first), "Earlier quarantined file must survive");
        assertEquals("second-corrupt", Files.readString(second));
        assertFalse(Files.exists(file));
    }

    @Test
    void testSave_unwritableDirectoryThrows() throws Exception {
        Path notADirectory = Files.writeString(dir.resolve("blocker"), "plain file");
        CheckpointStore store = new CheckpointStore(notADirectory, "");

        assertThrows(CheckpointWriteException.class,
                () -> store.save(DOMAIN, new long[]{1, 0}, new long[]{0, 0, 0}));
    }

    @Test
    void testEnumerator_propagatesWriteFailureOnDump() throws Exception {
        Path notADirectory = Files.writeString(dir.resolve("blocker"), "plain file");
        CheckpointStore store = new CheckpointStore(notADirectory, "");
        DomainEnumerator enumerator = new DomainEnumerator(DOMAIN, store, Series.A, 2);

        assertDoesNotThrow(enumerator::next);
        assertDoesNotThrow(enumerator::next);
        assertThrows(CheckpointWriteException.class, enumerator::next,
                "Third pair is preceded by a checkpoint dump that cannot be written");
    }
}
