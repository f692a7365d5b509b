package org.edsim.utils;

import org.edsim.model.GeoLocation;

public final class GeoUtils {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoUtils() {
    }

    /** Great-circle distance in kilometres. */
    public static double haversineKm(GeoLocation a, GeoLocation b) {
        double lat1 = Math.toRadians(a.getLatitude());
        double lat2 = Math.toRadians(b.getLatitude());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(b.getLongitude() - a.getLongitude());
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.min(1.0, Math.sqrt(h)));
    }

    /** Road travel minutes at the given speed, never below the floor. */
    public static double travelMinutes(GeoLocation from, GeoLocation to, double speedKmh, double floorMinutes) {
        double minutes = haversineKm(from, to) / speedKmh * 60.0;
        return Math.max(floorMinutes, minutes);
    }
}
