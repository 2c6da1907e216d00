package com.quakesieve.core.geo;

import com.quakesieve.core.model.Event;

/**
 * Great-circle distance on a spherical Earth.
 *
 * <p>
 * Uses the haversine formulation, which is well conditioned for the small
 * separations that dominate declustering. Longitude differences enter only
 * through {@code sin²(Δλ/2)}, so a pair straddling the antimeridian
 * (179.9° / −179.9°) resolves to the short way round, and the
 * {@code cos φ₁ · cos φ₂} factor shrinks longitude separations near the
 * poles.
 * </p>
 *
 * @since 1.0.0
 */
public final class GeodesicDistance {

    /** Mean Earth radius in kilometres. */
    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeodesicDistance() {
        // utility class — not instantiable
    }

    /**
     * Distance in km between two points given in decimal degrees.
     *
     * @param lat1 latitude of the first point
     * @param lon1 longitude of the first point
     * @param lat2 latitude of the second point
     * @param lon2 longitude of the second point
     * @return great-circle distance in kilometres, in {@code [0, π·R]}
     */
    public static double km(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lon2 - lon1);

        double sinHalfPhi = Math.sin(dPhi / 2);
        double sinHalfLambda = Math.sin(dLambda / 2);
        double a = sinHalfPhi * sinHalfPhi
                + Math.cos(phi1) * Math.cos(phi2) * sinHalfLambda * sinHalfLambda;
        // Rounding can push a a hair outside [0, 1] for antipodal points.
        a = Math.min(1.0, Math.max(0.0, a));

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Distance in km between the epicentres of two events.
     */
    public static double km(Event a, Event b) {
        return km(a.getLatitude(), a.getLongitude(), b.getLatitude(), b.getLongitude());
    }
}
