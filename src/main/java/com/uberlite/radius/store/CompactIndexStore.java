package com.uberlite.radius.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uberlite.radius.config.RadiusSearchConfig;
import com.uberlite.radius.config.RadiusSearchConfigurationException;
import com.uberlite.radius.grid.GeoDistance;
import com.uberlite.radius.index.CompactRange;
import com.uberlite.radius.query.RadiusSearch;
import com.uberlite.radius.query.RangeFilter;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RocksDB store that answers radius queries with nothing but ordered key scans.
 *
 * Key spaces:
 *   'I' | compactIndex (8 bytes, big-endian) | entityId  →  StoredLocation JSON
 *   'E' | entityId                                      →  compactIndex (8 bytes)
 *
 * Compact indexes are non-negative, so big-endian byte order matches numeric
 * order and each {@link CompactRange} maps to one seek plus a forward scan.
 * The 'E' entries let a moving entity drop its previous index key.
 */
public class CompactIndexStore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CompactIndexStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final byte INDEX_PREFIX = 'I';
    private static final byte ENTITY_PREFIX = 'E';
    private static final int INDEX_KEY_HEADER = 1 + Long.BYTES;

    private final Options options;
    private final RocksDB rocksDB;
    private final RadiusSearch search;
    private final int indexResolution;

    public CompactIndexStore(String dbPath, RadiusSearch search, RadiusSearchConfig config)
            throws RocksDBException {
        if (config.indexResolution() < search.finestQueryResolution()) {
            throw new RadiusSearchConfigurationException(
                "Index resolution " + config.indexResolution()
                    + " is coarser than the finest query resolution " + search.finestQueryResolution());
        }
        RocksDB.loadLibrary();

        this.options = new Options()
            .setCreateIfMissing(true)
            .setCompressionType(CompressionType.LZ4_COMPRESSION);
        this.rocksDB = RocksDB.open(options, dbPath);
        this.search = search;
        this.indexResolution = config.indexResolution();

        log.info("CompactIndexStore opened at {} (index resolution {})", dbPath, indexResolution);
    }

    public void put(StoredLocation location) throws RocksDBException {
        long compact = search.compactIndexOf(location.lat(), location.lon(), indexResolution);
        byte[] entityKey = entityKey(location.entityId());

        try (WriteBatch batch = new WriteBatch(); WriteOptions writeOptions = new WriteOptions()) {
            byte[] previous = rocksDB.get(entityKey);
            if (previous != null) {
                batch.delete(indexKey(ByteBuffer.wrap(previous).getLong(), location.entityId()));
            }
            batch.put(indexKey(compact, location.entityId()), serialize(location));
            batch.put(entityKey, ByteBuffer.allocate(Long.BYTES).putLong(compact).array());
            rocksDB.write(writeOptions, batch);
        }
    }

    public boolean remove(String entityId) throws RocksDBException {
        byte[] entityKey = entityKey(entityId);
        byte[] previous = rocksDB.get(entityKey);
        if (previous == null) {
            return false;
        }
        try (WriteBatch batch = new WriteBatch(); WriteOptions writeOptions = new WriteOptions()) {
            batch.delete(indexKey(ByteBuffer.wrap(previous).getLong(), entityId));
            batch.delete(entityKey);
            rocksDB.write(writeOptions, batch);
        }
        return true;
    }

    /** Every stored entity whose compact index matches the filter. */
    public List<StoredLocation> findCandidates(RangeFilter filter) {
        var candidates = new ArrayList<StoredLocation>();
        int keysScanned = 0;

        try (RocksIterator iter = rocksDB.newIterator()) {
            for (CompactRange range : filter.ranges()) {
                iter.seek(indexKeyPrefix(range.lowerBound()));

                while (iter.isValid()) {
                    byte[] key = iter.key();
                    if (key[0] != INDEX_PREFIX) break;
                    long compact = ByteBuffer.wrap(key, 1, Long.BYTES).getLong();
                    if (compact > range.upperBound()) break;

                    keysScanned++;
                    candidates.add(deserialize(iter.value()));
                    iter.next();
                }
            }
        }

        log.debug("Scanned {} keys across {} ranges", keysScanned, filter.ranges().size());
        return candidates;
    }

    /** Candidates refined by exact great-circle distance. */
    public List<StoredLocation> findWithinRadius(double lat, double lon, double radiusMeters) {
        long startTime = System.nanoTime();

        RangeFilter filter = search.buildRadiusPredicate(lat, lon, radiusMeters);
        List<StoredLocation> candidates = findCandidates(filter);

        var hits = new ArrayList<StoredLocation>();
        for (StoredLocation candidate : candidates) {
            if (GeoDistance.meters(lat, lon, candidate.lat(), candidate.lon()) <= radiusMeters) {
                hits.add(candidate);
            }
        }

        long elapsedMicros = (System.nanoTime() - startTime) / 1_000;
        log.debug("Found {} of {} candidates within {}m in {}us",
            hits.size(), candidates.size(), radiusMeters, elapsedMicros);
        return hits;
    }

    private static byte[] indexKeyPrefix(long compact) {
        return ByteBuffer.allocate(INDEX_KEY_HEADER)
            .put(INDEX_PREFIX)
            .putLong(compact)
            .array();
    }

    private static byte[] indexKey(long compact, String entityId) {
        byte[] id = entityId.getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(INDEX_KEY_HEADER + id.length)
            .put(INDEX_PREFIX)
            .putLong(compact)
            .put(id)
            .array();
    }

    private static byte[] entityKey(String entityId) {
        byte[] id = entityId.getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(1 + id.length)
            .put(ENTITY_PREFIX)
            .put(id)
            .array();
    }

    private static byte[] serialize(StoredLocation location) {
        try {
            return MAPPER.writeValueAsBytes(location);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize: " + location, e);
        }
    }

    private static StoredLocation deserialize(byte[] value) {
        try {
            return MAPPER.readValue(value, StoredLocation.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to deserialize stored location", e);
        }
    }

    @Override
    public void close() {
        rocksDB.close();
        options.close();
    }
}
