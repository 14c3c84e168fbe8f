/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.storage;

import ai.evacortex.ramanujan.core.exceptions.CheckpointWriteException;
import ai.evacortex.ramanujan.core.sharding.CoefficientDomain;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * File-backed store of enumeration checkpoints, one JSON file per domain shape.
 *
 * <p>The file name is derived from {@link HashingUtil#domainIdentity(CoefficientDomain)}, so
 * workers enumerating disjoint sub-domains never touch the same file. A file that cannot be
 * parsed, or that names a coordinate outside the domain, is moved aside with a
 * {@code .corrupted} suffix and the enumeration restarts from the domain origin. Earlier
 * quarantined files are kept; later ones get a numeric suffix ({@code .corrupted.1}, ...).</p>
 */
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);
    static final String CORRUPTED_SUFFIX = ".corrupted";

    private final Path directory;
    private final String namePrefix;
    private final ObjectMapper mapper;

    public CheckpointStore(Path directory, String namePrefix) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.namePrefix = namePrefix == null ? "" : namePrefix;
        this.mapper = new ObjectMapper();
    }

    public String identity(CoefficientDomain domain) {
        return HashingUtil.domainIdentity(domain);
    }

    public Path fileFor(CoefficientDomain domain) {
        return directory.resolve(namePrefix + identity(domain) + ".json");
    }

    public Checkpoint load(CoefficientDomain domain) {
        Path file = fileFor(domain);
        if (!Files.exists(file)) {
            return Checkpoint.origin(domain);
        }
        try (InputStream in = Files.newInputStream(file)) {
            Checkpoint checkpoint = mapper.readValue(in, Checkpoint.class);
            if (!checkpoint.fitsInside(domain)) {
                throw new IOException("checkpoint " + checkpoint + " lies outside " + domain);
            }
            log.info("Resuming {} from {}", file.getFileName(), checkpoint);
            return checkpoint;
        } catch (IOException | RuntimeException e) {
            log.warn("Checkpoint file {} could not be loaded: {}", file, e.getMessage());
            quarantine(file);
            return Checkpoint.origin(domain);
        }
    }

    public void save(CoefficientDomain domain, long[] a, long[] b) {
        Path file = fileFor(domain);
        Checkpoint checkpoint = new Checkpoint(a, b);
        try {
            Files.createDirectories(directory);
            try (OutputStream out = Files.newOutputStream(file, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                mapper.writeValue(out, checkpoint);
            }
            log.debug("Checkpoint {} -> {}", checkpoint, file.getFileName());
        } catch (IOException e) {
            throw new CheckpointWriteException("Failed to write checkpoint " + file, e);
        }
    }

    public void delete(CoefficientDomain domain) {
        Path file = fileFor(domain);
        try {
            Files.delete(file);
            log.debug("Deleted checkpoint {}", file.getFileName());
        } catch (NoSuchFileException e) {
            log.debug("No checkpoint to delete at {}", file.getFileName());
        } catch (IOException e) {
            throw new CheckpointWriteException("Failed to delete checkpoint " + file, e);
        }
    }

    private void quarantine(Path file) {
        String base = file.getFileName().toString() + CORRUPTED_SUFFIX;
        Path target = file.resolveSibling(base);
        for (int n = 1; Files.exists(target); n++) {
            target = file.resolveSibling(base + "." + n);
        }
        try {
            Files.move(file, target);
            log.warn("Moved checkpoint to {}", target);
        } catch (IOException e) {
            throw new CheckpointWriteException("Failed to quarantine corrupted checkpoint " + file, e);
        }
    }
}
