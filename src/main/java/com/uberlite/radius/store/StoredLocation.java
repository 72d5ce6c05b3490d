package com.uberlite.radius.store;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-located entity held by {@link CompactIndexStore}.
 *
 * @param entityId unique entity identifier
 * @param lat latitude in degrees
 * @param lon longitude in degrees
 * @param timestamp last update time (milliseconds since epoch)
 */
public record StoredLocation(
    @JsonProperty("entity_id") String entityId,
    @JsonProperty("lat") double lat,
    @JsonProperty("lon") double lon,
    @JsonProperty("timestamp") long timestamp
) {
    public StoredLocation {
        if (entityId == null || entityId.isEmpty()) {
            throw new IllegalArgumentException("entityId must not be empty");
        }
    }

    public static StoredLocation of(String entityId, double lat, double lon) {
        return new StoredLocation(entityId, lat, lon, System.currentTimeMillis());
    }
}
