package io.github.jakubt4.astrolabe.service.ephemeris;

import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.util.Angles;
import io.github.jakubt4.astrolabe.util.JulianDay;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;

import java.util.EnumMap;
import java.util.Map;

/**
 * Geocentric planets from the JPL approximate Keplerian elements (Standish, valid 1800-2050).
 *
 * <p>Heliocentric positions of the planet and of the Earth-Moon barycentre are solved on
 * the J2000 ecliptic, differenced with one light-time iteration, then carried to the
 * mean equinox of date with the general precession in longitude.
 */
final class PlanetaryTheory {

    private static final double LIGHT_TIME_DAYS_PER_AU = 0.0057755183;
    private static final int KEPLER_ITERATIONS = 30;

    /**
     * a, ȧ, e, ė, I, İ, L, L̇, ϖ, ϖ̇, Ω, Ω̇ per Julian century.
     */
    private record Elements(double a, double aRate, double e, double eRate, double i, double iRate,
                            double l, double lRate, double perihelion, double perihelionRate,
                            double node, double nodeRate) {
    }

    private static final Elements EARTH_MOON_BARYCENTRE = new Elements(
            1.00000261, 0.00000562, 0.01671123, -0.00004392, -0.00001531, -0.01294668,
            100.46457166, 35999.37244981, 102.93768193, 0.32327364, 0.0, 0.0);

    private static final Map<Body, Elements> ELEMENTS = new EnumMap<>(Body.class);

    static {
        ELEMENTS.put(Body.MERCURY, new Elements(0.38709927, 0.00000037, 0.20563593, 0.00001906,
                7.00497902, -0.00594749, 252.25032350, 149472.67411175, 77.45779628, 0.16047689,
                48.33076593, -0.12534081));
        ELEMENTS.put(Body.VENUS, new Elements(0.72333566, 0.00000390, 0.00677672, -0.00004107,
                3.39467605, -0.00078890, 181.97909950, 58517.81538729, 131.60246718, 0.00268329,
                76.67984255, -0.27769418));
        ELEMENTS.put(Body.MARS, new Elements(1.52371034, 0.00001847, 0.09339410, 0.00007882,
                1.84969142, -0.00813131, -4.55343205, 19140.30268499, -23.94362959, 0.44441088,
                49.55953891, -0.29257343));
        ELEMENTS.put(Body.JUPITER, new Elements(5.20288700, -0.00011607, 0.04838624, -0.00013253,
                1.30439695, -0.00183714, 34.39644051, 3034.74612775, 14.72847983, 0.21252668,
                100.47390909, 0.20469106));
        ELEMENTS.put(Body.SATURN, new Elements(9.53667594, -0.00125060, 0.05386179, -0.00050991,
                2.48599187, 0.00193609, 49.95424423, 1222.49362201, 92.59887831, -0.41897216,
                113.66242448, -0.28867794));
        ELEMENTS.put(Body.URANUS, new Elements(19.18916464, -0.00196176, 0.04725744, -0.00004397,
                0.77263783, -0.00242939, 313.23810451, 428.48202785, 170.95427630, 0.40805281,
                74.01692503, 0.04240589));
        ELEMENTS.put(Body.NEPTUNE, new Elements(30.06992276, 0.00026291, 0.00859048, 0.00005105,
                1.77004347, 0.00035372, -55.12002969, 218.45945325, 44.96476227, -0.32241464,
                131.78422574, -0.00508664));
        ELEMENTS.put(Body.PLUTO, new Elements(39.48211675, -0.00031596, 0.24882730, 0.00005170,
                17.14001206, 0.00004818, 238.92903833, 145.20780515, 224.06891629, -0.04062942,
                110.30393684, -0.01183482));
    }

    private PlanetaryTheory() {
    }

    static boolean supports(final Body body) {
        return ELEMENTS.containsKey(body);
    }

    /**
     * Geometric-plus-light-time longitude and latitude referred to the mean equinox of date.
     */
    static EclipticCoordinates meanOfDate(final Body body, final double julianDayTt) {
        final var elements = ELEMENTS.get(body);
        if (elements == null) {
            throw new IllegalArgumentException("No Keplerian elements for " + body);
        }
        final var earth = heliocentric(EARTH_MOON_BARYCENTRE, julianDayTt);
        var lightTime = 0.0;
        var relative = Vector3D.ZERO;
        for (var i = 0; i < 2; i++) {
            relative = heliocentric(elements, julianDayTt - lightTime).subtract(earth);
            lightTime = LIGHT_TIME_DAYS_PER_AU * relative.getNorm();
        }
        final var t = JulianDay.centuries(julianDayTt);
        final var precession = (5029.0966 * t + 1.11113 * t * t) / 3600.0;
        final var longitude = FastMath.toDegrees(FastMath.atan2(relative.getY(), relative.getX()));
        final var latitude = FastMath.toDegrees(FastMath.asin(relative.getZ() / relative.getNorm()));
        return new EclipticCoordinates(Angles.normalize(longitude + precession), latitude, relative.getNorm());
    }

    private static Vector3D heliocentric(final Elements el, final double julianDayTt) {
        final var t = JulianDay.centuries(julianDayTt);
        final var a = el.a() + el.aRate() * t;
        final var e = el.e() + el.eRate() * t;
        final var inclination = el.i() + el.iRate() * t;
        final var meanLongitude = el.l() + el.lRate() * t;
        final var perihelion = el.perihelion() + el.perihelionRate() * t;
        final var node = el.node() + el.nodeRate() * t;

        final var meanAnomaly = FastMath.toRadians(Angles.signedDelta(0.0, meanLongitude - perihelion));
        final var eccentricAnomaly = solveKepler(meanAnomaly, e);

        final var xOrbit = a * (FastMath.cos(eccentricAnomaly) - e);
        final var yOrbit = a * FastMath.sqrt(1 - e * e) * FastMath.sin(eccentricAnomaly);

        final var argPeri = perihelion - node;
        final var cw = Angles.cosDeg(argPeri);
        final var sw = Angles.sinDeg(argPeri);
        final var cn = Angles.cosDeg(node);
        final var sn = Angles.sinDeg(node);
        final var ci = Angles.cosDeg(inclination);
        final var si = Angles.sinDeg(inclination);

        return new Vector3D(
                (cw * cn - sw * sn * ci) * xOrbit + (-sw * cn - cw * sn * ci) * yOrbit,
                (cw * sn + sw * cn * ci) * xOrbit + (-sw * sn + cw * cn * ci) * yOrbit,
                sw * si * xOrbit + cw * si * yOrbit);
    }

    private static double solveKepler(final double meanAnomaly, final double e) {
        var eccentricAnomaly = meanAnomaly + e * FastMath.sin(meanAnomaly);
        for (var i = 0; i < KEPLER_ITERATIONS; i++) {
            final var delta = (meanAnomaly - (eccentricAnomaly - e * FastMath.sin(eccentricAnomaly)))
                    / (1 - e * FastMath.cos(eccentricAnomaly));
            eccentricAnomaly += delta;
            if (FastMath.abs(delta) < 1e-12) {
                break;
            }
        }
        return eccentricAnomaly;
    }
}
