package com.openwash.capacity.domain.model;

import com.openwash.common.exception.InvalidInputException;

/**
 * WGS84 point. Distances use the haversine formula on a spherical earth.
 */
public record GeoLocation(double latitude, double longitude) {

    private static final double EARTH_RADIUS_KM = 6371.0;

    public GeoLocation {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new InvalidInputException("Latitude must be between -90 and 90, got " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new InvalidInputException("Longitude must be between -180 and 180, got " + longitude);
        }
    }

    public double distanceKmTo(GeoLocation other) {
        double dLat = Math.toRadians(other.latitude - latitude);
        double dLng = Math.toRadians(other.longitude - longitude);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(latitude)) * Math.cos(Math.toRadians(other.latitude))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }
}
