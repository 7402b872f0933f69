package com.geofencing.subscriptions.service;

import com.geofencing.subscriptions.dto.AreaRecord;
import com.geofencing.subscriptions.dto.PointRecord;

/**
 * Geodesic distance and circle containment.
 *
 * This is shared by the subscription monitor and the synchronous verification API,
 * so both paths classify a position the same way.
 *
 * Algorithm:
 * - Great-circle distance with the haversine formula on a sphere of radius 6,371,000 m
 * - A point is inside a circle when its distance to the center is at most the radius
 *   (the boundary counts as inside)
 */
public final class AreaMath {

    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    private AreaMath() {
    }

    /**
     * Great-circle distance in meters between two coordinates given in decimal degrees.
     */
    public static double distanceMeters(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double deltaPhi = Math.toRadians(lat2 - lat1);
        double deltaLambda = Math.toRadians(lon2 - lon1);

        double a = Math.sin(deltaPhi / 2) * Math.sin(deltaPhi / 2)
            + Math.cos(phi1) * Math.cos(phi2) * Math.sin(deltaLambda / 2) * Math.sin(deltaLambda / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_METERS * c;
    }

    public static double distanceMeters(PointRecord from, PointRecord to) {
        return distanceMeters(from.latitude(), from.longitude(), to.latitude(), to.longitude());
    }

    /**
     * @param point  Position to classify
     * @param circle Circle area with a complete center and a radius
     * @return true if the point lies within (or on) the circle
     */
    public static boolean isInside(PointRecord point, AreaRecord circle) {
        return distanceMeters(point, circle.center()) <= circle.radius();
    }
}
