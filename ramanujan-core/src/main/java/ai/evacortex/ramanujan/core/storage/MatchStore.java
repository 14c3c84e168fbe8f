/*
 * Ramanujan FR Search — GCF Enumeration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ramanujan.core.storage;

import ai.evacortex.ramanujan.core.Match;
import ai.evacortex.ramanujan.core.RefinedMatch;
import ai.evacortex.ramanujan.core.exceptions.MatchStoreException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Write-through JSON store of FR matches keyed by the xxHash of their coefficient pair.
 *
 * <p>A resumed enumeration re-yields the coordinate it was checkpointed at, so the same match may
 * be reported twice. Adding a match whose key is already present is a no-op.</p>
 */
public class MatchStore {

    private final Path matchFile;
    private final Map<String, Match> store;
    private final ObjectMapper mapper;
    private final ReentrantReadWriteLock rwLock;

    public static MatchStore loadOrCreate(Path path) {
        MatchStore matchStore = new MatchStore(path);
        if (Files.exists(path)) {
            try (InputStream in = Files.newInputStream(path)) {
                TypeReference<LinkedHashMap<String, Match>> typeRef = new TypeReference<>() {};
                Map<String, Match> loaded = matchStore.mapper.readValue(in, typeRef);
                matchStore.store.putAll(loaded);
            } catch (IOException e) {
                throw new MatchStoreException("Failed to load match store " + path, e);
            }
        }
        return matchStore;
    }

    private MatchStore(Path matchFile) {
        this.matchFile = matchFile;
        this.mapper = new ObjectMapper();
        this.store = new LinkedHashMap<>();
        this.rwLock = new ReentrantReadWriteLock();
    }

    public static String keyOf(Match match) {
        return String.format("%016x", HashingUtil.pairKey(match.an(), match.bn()));
    }

    /**
     * @return {@code true} if the match was new, {@code false} if it was already stored
     */
    public boolean add(Match match) {
        String key = keyOf(match);
        rwLock.writeLock().lock();
        try {
            Match existing = store.get(key);
            if (existing != null) {
                if (!existing.equals(match)) {
                    throw new MatchStoreException("Content key collision " + key + ": " + existing + " vs " + match);
                }
                return false;
            }
            store.put(key, match);
            flush();
            return true;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    public boolean contains(Match match) {
        rwLock.readLock().lock();
        try {
            return store.containsKey(keyOf(match));
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public int size() {
        rwLock.readLock().lock();
        try {
            return store.size();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public List<Match> snapshot() {
        rwLock.readLock().lock();
        try {
            return new ArrayList<>(store.values());
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public void flush() {
        rwLock.writeLock().lock();
        try {
            write(matchFile, store);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /** Writes refined results next to the match file. */
    public Path writeRefined(String fileName, List<RefinedMatch> refined) {
        Path target = matchFile.resolveSibling(fileName);
        write(target, refined);
        return target;
    }

    private void write(Path target, Object value) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, value);
            }
        } catch (IOException e) {
            throw new MatchStoreException("Failed to write " + target, e);
        }
    }
}
