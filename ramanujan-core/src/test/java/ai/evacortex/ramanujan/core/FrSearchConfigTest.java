/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core;

import ai.evacortex.ramanujan.core.math.MathConstant;
import ai.evacortex.ramanujan.core.sharding.Series;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FrSearchConfigTest {

    private static final List<String> PROPERTIES = List.of(
            "ramanujan.checkpoint.dir", "ramanujan.fr.burstNumber", "ramanujan.fr.convergenceThreshold",
            "ramanujan.primarySeries", "ramanujan.constants", "ramanujan.pslq.maxCoeff");

    @AfterEach
    void clearProperties() {
        PROPERTIES.forEach(System::clearProperty);
    }

    @Test
    void testDefaults() {
        FrSearchConfig config = FrSearchConfig.defaults();

        assertEquals(Path.of("checkpoints"), config.checkpointDir());
        assertEquals(5000, config.checkpointDumpSize());
        assertEquals(200, config.frOptions().burstNumber());
        assertEquals(1, config.frOptions().minIters());
        assertEquals(0.1, config.frOptions().convergenceThreshold());
        assertEquals(30, config.frOptions().digits());
        assertEquals(1000, config.firstEnumerationDepth());
        assertEquals(Series.A, config.primarySeries());
        assertEquals(List.of(MathConstant.ZETA3), config.constants());
        assertEquals(1000, config.pslqMaxCoeff());
        assertEquals(100, config.pslqMaxSteps());
    }

    @Test
    void testFromSystemProperties_overridesDefaults() {
        System.setProperty("ramanujan.checkpoint.dir", "/tmp/cp");
        System.setProperty("ramanujan.fr.burstNumber", "50");
        System.setProperty("ramanujan.fr.convergenceThreshold", "0.05");
        System.setProperty("ramanujan.primarySeries", "b");
        System.setProperty("ramanujan.constants", "pi,zeta3");
        System.setProperty("ramanujan.pslq.maxCoeff", "500");

        FrSearchConfig config = FrSearchConfig.fromSystemProperties();

        assertEquals(Path.of("/tmp/cp"), config.checkpointDir());
        assertEquals(50, config.frOptions().burstNumber());
        assertEquals(0.05, config.frOptions().convergenceThreshold());
        assertEquals(Series.B, config.primarySeries());
        assertEquals(List.of(MathConstant.PI, MathConstant.ZETA3), config.constants());
        assertEquals(500, config.pslqMaxCoeff());
        assertEquals(Path.of("results"), config.resultsDir());
    }

    @Test
    void testParseRange() {
        assertEquals(-3, FrSearchApp.parseRange("-3, 3").lo());
        assertThrows(IllegalArgumentException.class, () -> FrSearchApp.parseRange("1"));
    }
}
