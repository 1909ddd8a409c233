package com.disease.coding.catalog;

import com.disease.coding.core.model.CatalogEntry;
import com.disease.coding.core.model.CodeEntry;
import com.disease.coding.core.model.CodeEntryUpdate;
import com.disease.coding.validation.InputSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of {@link DiseaseCatalog}.
 * Keeps the seed's insertion order. Contents are lost when the process exits.
 *
 * <p>A read/write lock guards the map. Entries are immutable records, so an update
 * replaces the whole entry under the write lock.</p>
 */
public class InMemoryDiseaseCatalog implements DiseaseCatalog {
    private static final Logger log = LoggerFactory.getLogger(InMemoryDiseaseCatalog.class);

    private final Map<String, CodeEntry> entries = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemoryDiseaseCatalog() {
        this(Map.of());
    }

    public InMemoryDiseaseCatalog(Map<String, CodeEntry> seed) {
        Objects.requireNonNull(seed, "seed is required");
        seed.forEach((name, entry) -> {
            InputSanitizer.validateDiseaseName(name);
            entries.put(name, Objects.requireNonNull(entry, "entry is required for " + name));
        });
        log.info("InMemoryDiseaseCatalog initialized with {} entries", entries.size());
    }

    public InMemoryDiseaseCatalog(CatalogSeed seed) {
        this(seed.entries());
    }

    @Override
    public Optional<CodeEntry> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> names() {
        lock.readLock().lock();
        try {
            return List.copyOf(entries.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<CatalogEntry> entries() {
        lock.readLock().lock();
        try {
            List<CatalogEntry> snapshot = new ArrayList<>(entries.size());
            entries.forEach((name, entry) -> snapshot.add(new CatalogEntry(name, entry)));
            return List.copyOf(snapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public CodeEntry update(String name, CodeEntryUpdate update) {
        Objects.requireNonNull(update, "update is required");
        if (name == null || name.isBlank()) {
            throw new DiseaseNotFoundException(name);
        }

        lock.writeLock().lock();
        try {
            CodeEntry current = entries.get(name);
            if (current == null) {
                throw new DiseaseNotFoundException(name);
            }
            if (update.isEmpty()) {
                log.debug("Empty update for '{}', entry unchanged", name);
                return current;
            }
            CodeEntry updated = update.applyTo(current);
            entries.put(name, updated);
            log.info("Updated disease '{}': {} -> {}", name, current, updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public CodeEntry delete(String name) {
        if (name == null || name.isBlank()) {
            throw new DiseaseNotFoundException(name);
        }

        lock.writeLock().lock();
        try {
            CodeEntry removed = entries.remove(name);
            if (removed == null) {
                throw new DiseaseNotFoundException(name);
            }
            log.info("Deleted disease '{}'", name);
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
