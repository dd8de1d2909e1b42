package com.skybrief.core.model;

import java.time.ZoneOffset;
import java.util.Optional;

public record GeoLocation(double latitude, double longitude, Double elevationMeters, ZoneOffset zoneOffset) {
    public GeoLocation {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("latitude must be within [-90, 90]: " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("longitude must be within [-180, 180]: " + longitude);
        }
        if (elevationMeters != null && (elevationMeters.isNaN() || elevationMeters.isInfinite())) {
            throw new IllegalArgumentException("elevation must be a finite number: " + elevationMeters);
        }
    }

    public static GeoLocation of(double latitude, double longitude) {
        return new GeoLocation(latitude, longitude, null, null);
    }

    public Optional<ZoneOffset> offset() {
        return Optional.ofNullable(zoneOffset);
    }

    // Without an explicit offset the nautical zone of the longitude is used, so calendar days never
    // depend on the zone an instant happened to be written in.
    public ZoneOffset localOffset() {
        return zoneOffset == null ? ZoneOffset.ofHours((int) Math.round(longitude / 15.0)) : zoneOffset;
    }
}
