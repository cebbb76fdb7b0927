package com.ruteberegner.distance.domain.service;

import com.ruteberegner.distance.domain.model.Coordinates;
import org.springframework.stereotype.Service;

/**
 * Domain service computing straight-line (geodesic) distances.
 *
 * Uses Vincenty's inverse formula on the WGS-84 ellipsoid. For nearly antipodal
 * points, where the iteration does not converge, the spherical haversine
 * distance is returned instead. Pure function: no I/O, no state.
 */
@Service
public class GeodesicDistanceCalculator {

    private static final double WGS84_SEMI_MAJOR_AXIS_METERS = 6_378_137.0d;
    private static final double WGS84_FLATTENING = 1.0d / 298.257223563d;
    private static final double WGS84_SEMI_MINOR_AXIS_METERS = (1.0d - WGS84_FLATTENING) * WGS84_SEMI_MAJOR_AXIS_METERS;
    private static final double EARTH_MEAN_RADIUS_METERS = 6_371_008.8d;

    private static final int MAX_ITERATIONS = 200;
    private static final double CONVERGENCE_THRESHOLD = 1e-12d;

    /**
     * Geodesic distance in kilometers. Zero for identical points.
     */
    public double distanceKm(Coordinates from, Coordinates to) {
        double meters = vincentyDistanceMeters(from.getLat(), from.getLng(), to.getLat(), to.getLng());
        if (Double.isNaN(meters)) {
            meters = greatCircleDistanceMeters(from.getLat(), from.getLng(), to.getLat(), to.getLng());
        }
        return meters / 1000.0d;
    }

    /**
     * Vincenty inverse solution. Returns NaN when the iteration fails to converge.
     */
    double vincentyDistanceMeters(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double a = WGS84_SEMI_MAJOR_AXIS_METERS;
        double b = WGS84_SEMI_MINOR_AXIS_METERS;
        double f = WGS84_FLATTENING;

        double deltaLon = Math.toRadians(lon2Deg - lon1Deg);
        double u1 = Math.atan((1.0d - f) * Math.tan(Math.toRadians(lat1Deg)));
        double u2 = Math.atan((1.0d - f) * Math.tan(Math.toRadians(lat2Deg)));
        double sinU1 = Math.sin(u1);
        double cosU1 = Math.cos(u1);
        double sinU2 = Math.sin(u2);
        double cosU2 = Math.cos(u2);

        double lambda = deltaLon;
        double sinSigma;
        double cosSigma;
        double sigma;
        double cosSqAlpha;
        double cos2SigmaM;

        int iterations = 0;
        double previousLambda;
        do {
            double sinLambda = Math.sin(lambda);
            double cosLambda = Math.cos(lambda);
            double crossTerm = cosU1 * sinU2 - sinU1 * cosU2 * cosLambda;
            sinSigma = Math.sqrt((cosU2 * sinLambda) * (cosU2 * sinLambda) + crossTerm * crossTerm);
            if (sinSigma == 0.0d) {
                return 0.0d;
            }
            cosSigma = sinU1 * sinU2 + cosU1 * cosU2 * cosLambda;
            sigma = Math.atan2(sinSigma, cosSigma);
            double sinAlpha = cosU1 * cosU2 * sinLambda / sinSigma;
            cosSqAlpha = 1.0d - sinAlpha * sinAlpha;
            // equatorial line: cosSqAlpha = 0
            cos2SigmaM = cosSqAlpha == 0.0d ? 0.0d : cosSigma - 2.0d * sinU1 * sinU2 / cosSqAlpha;
            double c = f / 16.0d * cosSqAlpha * (4.0d + f * (4.0d - 3.0d * cosSqAlpha));
            previousLambda = lambda;
            lambda = deltaLon + (1.0d - c) * f * sinAlpha
                    * (sigma + c * sinSigma * (cos2SigmaM + c * cosSigma * (-1.0d + 2.0d * cos2SigmaM * cos2SigmaM)));
        } while (Math.abs(lambda - previousLambda) > CONVERGENCE_THRESHOLD && ++iterations < MAX_ITERATIONS);

        if (iterations >= MAX_ITERATIONS) {
            return Double.NaN;
        }

        double uSq = cosSqAlpha * (a * a - b * b) / (b * b);
        double bigA = 1.0d + uSq / 16384.0d * (4096.0d + uSq * (-768.0d + uSq * (320.0d - 175.0d * uSq)));
        double bigB = uSq / 1024.0d * (256.0d + uSq * (-128.0d + uSq * (74.0d - 47.0d * uSq)));
        double deltaSigma = bigB * sinSigma * (cos2SigmaM + bigB / 4.0d
                * (cosSigma * (-1.0d + 2.0d * cos2SigmaM * cos2SigmaM)
                - bigB / 6.0d * cos2SigmaM * (-3.0d + 4.0d * sinSigma * sinSigma)
                * (-3.0d + 4.0d * cos2SigmaM * cos2SigmaM)));

        return b * bigA * (sigma - deltaSigma);
    }

    /**
     * Great-circle distance in meters using the haversine formulation on a mean-radius sphere.
     */
    double greatCircleDistanceMeters(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(lon2Deg - lon1Deg);

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double h = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double clamped = Math.min(1.0d, Math.max(0.0d, h));
        return EARTH_MEAN_RADIUS_METERS * 2.0d * Math.asin(Math.sqrt(clamped));
    }
}
