package io.github.jakubt4.astrolabe.service.ephemeris;

import io.github.jakubt4.astrolabe.error.EphemerisUnavailableException;
import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.util.Angles;
import io.github.jakubt4.astrolabe.util.JulianDay;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.orekit.bodies.CelestialBodyFactory;
import org.orekit.errors.OrekitException;
import org.orekit.frames.Frame;
import org.orekit.frames.FramesFactory;
import org.orekit.time.AbsoluteDate;
import org.orekit.utils.Constants;
import org.orekit.utils.IERSConventions;
import org.orekit.utils.PVCoordinatesProvider;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Ephemeris backed by Orekit's JPL-derived celestial bodies.
 *
 * <p>Positions are taken in an inertial frame with one light-time iteration, rotated into
 * the mean ecliptic of date and shifted by the nutation in longitude. Rahu and Ketu come
 * from the mean node, as in the analytic source. Requires {@code orekit-data.zip} with
 * DE ephemerides, registered by {@link io.github.jakubt4.astrolabe.config.OrekitConfig}.
 */
@Slf4j
public class OrekitEphemerisSource implements EphemerisSource {

    private static final double SECONDS_PER_DAY = 86_400.0;

    private final Map<Body, PVCoordinatesProvider> bodies;
    private final PVCoordinatesProvider observer;
    private final Frame inertialFrame;
    private final Frame eclipticFrame;

    public OrekitEphemerisSource(final Map<Body, PVCoordinatesProvider> bodies, final PVCoordinatesProvider observer,
                                 final Frame inertialFrame, final Frame eclipticFrame) {
        this.bodies = new EnumMap<>(Body.class);
        this.bodies.putAll(bodies);
        this.observer = observer;
        this.inertialFrame = inertialFrame;
        this.eclipticFrame = eclipticFrame;
    }

    /**
     * Source wired to the default Orekit data context.
     */
    public static OrekitEphemerisSource fromDefaultContext() {
        final var providers = new EnumMap<Body, PVCoordinatesProvider>(Body.class);
        providers.put(Body.SUN, CelestialBodyFactory.getSun());
        providers.put(Body.MOON, CelestialBodyFactory.getMoon());
        providers.put(Body.MERCURY, CelestialBodyFactory.getMercury());
        providers.put(Body.VENUS, CelestialBodyFactory.getVenus());
        providers.put(Body.MARS, CelestialBodyFactory.getMars());
        providers.put(Body.JUPITER, CelestialBodyFactory.getJupiter());
        providers.put(Body.SATURN, CelestialBodyFactory.getSaturn());
        providers.put(Body.URANUS, CelestialBodyFactory.getUranus());
        providers.put(Body.NEPTUNE, CelestialBodyFactory.getNeptune());
        providers.put(Body.PLUTO, CelestialBodyFactory.getPluto());
        return new OrekitEphemerisSource(providers, CelestialBodyFactory.getEarth(),
                FramesFactory.getICRF(), FramesFactory.getEcliptic(IERSConventions.IERS_2010));
    }

    @Override
    public Map<Body, EclipticCoordinates> positions(final Set<Body> requested, final double julianDayTt) {
        try {
            final var date = AbsoluteDate.J2000_EPOCH.shiftedBy((julianDayTt - JulianDay.J2000) * SECONDS_PER_DAY);
            final var nutation = Nutation.deltaPsi(julianDayTt);
            final var toEcliptic = inertialFrame.getStaticTransformTo(eclipticFrame, date);
            final var observerPosition = observer.getPVCoordinates(date, inertialFrame).getPosition();

            final var result = new EnumMap<Body, EclipticCoordinates>(Body.class);
            for (final var body : requested) {
                if (body.isNode()) {
                    final var node = LunarNode.meanAscending(julianDayTt) + (body == Body.KETU ? 180.0 : 0.0);
                    result.put(body, new EclipticCoordinates(Angles.normalize(node + nutation), 0.0, 0.0));
                    continue;
                }
                final var provider = bodies.get(body);
                if (provider == null) {
                    throw new EphemerisUnavailableException("Orekit source has no provider for " + body);
                }
                final var relative = toEcliptic.transformVector(lightTimeCorrected(provider, date, observerPosition));
                final var distanceAu = relative.getNorm() / Constants.IAU_2012_ASTRONOMICAL_UNIT;
                var longitude = FastMath.toDegrees(FastMath.atan2(relative.getY(), relative.getX())) + nutation;
                if (body == Body.SUN) {
                    longitude += SolarTheory.aberration(distanceAu);
                }
                final var latitude = FastMath.toDegrees(FastMath.asin(relative.getZ() / relative.getNorm()));
                result.put(body, new EclipticCoordinates(Angles.normalize(longitude), latitude, distanceAu));
            }
            return result;
        } catch (final OrekitException e) {
            log.warn("Orekit ephemeris failed at JD(TT) {}: {}", julianDayTt, e.getMessage());
            throw new EphemerisUnavailableException("Orekit ephemeris failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String name() {
        return "orekit";
    }

    private Vector3D lightTimeCorrected(final PVCoordinatesProvider provider, final AbsoluteDate date,
                                        final Vector3D observerPosition) {
        var relative = provider.getPVCoordinates(date, inertialFrame).getPosition().subtract(observerPosition);
        final var lightTime = relative.getNorm() / Constants.SPEED_OF_LIGHT;
        relative = provider.getPVCoordinates(date.shiftedBy(-lightTime), inertialFrame).getPosition()
                .subtract(observerPosition);
        return relative;
    }
}
