/*
 * StimulusScramble — Perceptual Stimulus Scrambler
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.scramble.core.metadata;

import ai.evacortex.scramble.core.exceptions.CorruptRecordException;
import ai.evacortex.scramble.core.util.HashingUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * JSON file of {@link ScrambleRecord}s keyed by source id. Every mutation is flushed.
 */
public class ScrambleRecordStore {

    private final Path recordFile;
    private final Map<String, ScrambleRecord> store;
    private final ObjectMapper mapper;
    private final ReentrantReadWriteLock rwLock;

    public static ScrambleRecordStore loadOrCreate(Path path) {
        ScrambleRecordStore recordStore = new ScrambleRecordStore(path);
        if (Files.exists(path)) {
            try (InputStream in = Files.newInputStream(path)) {
                TypeReference<Map<String, ScrambleRecord>> typeRef = new TypeReference<>() {};
                Map<String, ScrambleRecord> loaded = recordStore.mapper.readValue(in, typeRef);
                recordStore.store.putAll(loaded);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load scramble records from " + path, e);
            }
        }
        return recordStore;
    }

    private ScrambleRecordStore(Path recordFile) {
        this.recordFile = recordFile;
        this.mapper = new ObjectMapper();
        this.store = new HashMap<>();
        this.rwLock = new ReentrantReadWriteLock();
    }

    public void put(ScrambleRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        HashingUtil.parseAndValidateMd5(record.sourceId());
        rwLock.writeLock().lock();
        try {
            store.put(record.sourceId(), record);
            flush();
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    public void remove(String sourceId) {
        rwLock.writeLock().lock();
        try {
            store.remove(sourceId);
            flush();
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * @return the record, or {@code null} if none is stored under {@code sourceId}
     * @throws CorruptRecordException if the stored shift vector no longer matches its checksum
     */
    public ScrambleRecord get(String sourceId) {
        rwLock.readLock().lock();
        try {
            ScrambleRecord record = store.get(sourceId);
            if (record != null && record.phase() != null && (record.phase().shifts() == null
                    || HashingUtil.checksum(record.phase().shifts()) != record.phase().checksum())) {
                throw new CorruptRecordException(sourceId);
            }
            return record;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public boolean contains(String sourceId) {
        rwLock.readLock().lock();
        try {
            return store.containsKey(sourceId);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public void flush() {
        rwLock.writeLock().lock();
        try {
            Path parent = recordFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(recordFile, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, store);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to flush scramble records", e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    public Set<String> getAllIds() {
        rwLock.readLock().lock();
        try {
            return new HashSet<>(store.keySet());
        } finally {
            rwLock.readLock().unlock();
        }
    }
}
