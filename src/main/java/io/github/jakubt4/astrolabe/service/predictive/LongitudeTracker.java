package io.github.jakubt4.astrolabe.service.predictive;

import io.github.jakubt4.astrolabe.error.NoConvergenceException;
import io.github.jakubt4.astrolabe.model.Ayanamsa;
import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.service.ephemeris.EphemerisGateway;
import io.github.jakubt4.astrolabe.util.Angles;
import org.hipparchus.analysis.solvers.AllowedSolution;
import org.hipparchus.analysis.solvers.BracketingNthOrderBrentSolver;
import org.hipparchus.exception.MathIllegalArgumentException;
import org.hipparchus.exception.MathIllegalStateException;
import org.hipparchus.util.FastMath;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Body longitudes in a chart's zodiac, plus Brent refinement of the instant a body
 * crosses a given longitude.
 */
final class LongitudeTracker {

    private static final int SOLVER_ORDER = 5;
    private static final double RELATIVE_ACCURACY = 1e-15;
    private static final double FUNCTION_ACCURACY = 1e-9;

    private final EphemerisGateway gateway;
    private final Ayanamsa ayanamsa;
    private final double absoluteAccuracyDays;

    /**
     * @param ayanamsa {@code null} for tropical longitudes
     */
    LongitudeTracker(final EphemerisGateway gateway, final Ayanamsa ayanamsa, final double absoluteAccuracyDays) {
        this.gateway = gateway;
        this.ayanamsa = ayanamsa;
        this.absoluteAccuracyDays = absoluteAccuracyDays;
    }

    double longitude(final Body body, final double julianDay) {
        return toZodiac(gateway.getLongitude(body, julianDay), julianDay);
    }

    Map<Body, Double> longitudes(final Collection<Body> bodies, final double julianDay) {
        final var result = new EnumMap<Body, Double>(Body.class);
        gateway.getLongitudes(bodies, julianDay).forEach((body, lon) -> result.put(body, toZodiac(lon, julianDay)));
        return result;
    }

    /**
     * Signed distance of the body from {@code target}, in [-180, 180).
     */
    double offset(final Body body, final double target, final double julianDay) {
        return Angles.signedDelta(target, longitude(body, julianDay));
    }

    /**
     * Instant in [{@code from}, {@code to}] where the body sits on {@code target}. The bracket must
     * contain a sign change of {@link #offset}.
     */
    double refineCrossing(final Body body, final double target, final double from, final double to,
                          final int maxEvaluations) {
        final var solver = new BracketingNthOrderBrentSolver(RELATIVE_ACCURACY, absoluteAccuracyDays,
                FUNCTION_ACCURACY, SOLVER_ORDER);
        try {
            return solver.solve(maxEvaluations, jd -> offset(body, target, jd), from, to, AllowedSolution.ANY_SIDE);
        } catch (final MathIllegalStateException | MathIllegalArgumentException e) {
            final var mid = (from + to) / 2;
            throw new NoConvergenceException(body + " crossing of " + target, solver.getEvaluations(),
                    FastMath.abs(offset(body, target, mid)), mid);
        }
    }

    /**
     * Instant in [{@code from}, {@code to}] where the body's motion changes sign. {@code halfWindow}
     * is the half-width of the central difference used for the speed.
     */
    double refineStation(final Body body, final double from, final double to, final double halfWindow,
                         final int maxEvaluations) {
        final var solver = new BracketingNthOrderBrentSolver(RELATIVE_ACCURACY, absoluteAccuracyDays,
                1e-12, SOLVER_ORDER);
        try {
            return solver.solve(maxEvaluations, jd -> speed(body, jd, halfWindow), from, to, AllowedSolution.ANY_SIDE);
        } catch (final MathIllegalStateException | MathIllegalArgumentException e) {
            final var mid = (from + to) / 2;
            throw new NoConvergenceException(body + " station", solver.getEvaluations(),
                    FastMath.abs(speed(body, mid, halfWindow)), mid);
        }
    }

    double speed(final Body body, final double julianDay, final double halfWindow) {
        return Angles.signedDelta(longitude(body, julianDay - halfWindow), longitude(body, julianDay + halfWindow))
                / (2 * halfWindow);
    }

    private double toZodiac(final double tropical, final double julianDay) {
        return ayanamsa == null ? tropical : Angles.normalize(tropical - ayanamsa.valueAt(julianDay));
    }
}
