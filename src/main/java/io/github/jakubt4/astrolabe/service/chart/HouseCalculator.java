package io.github.jakubt4.astrolabe.service.chart;

import io.github.jakubt4.astrolabe.config.AstrolabeProperties;
import io.github.jakubt4.astrolabe.error.InvalidLatitudeException;
import io.github.jakubt4.astrolabe.error.NoConvergenceException;
import io.github.jakubt4.astrolabe.model.HouseSystem;
import io.github.jakubt4.astrolabe.util.Angles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.analysis.UnivariateFunction;
import org.hipparchus.analysis.solvers.AllowedSolution;
import org.hipparchus.analysis.solvers.BracketingNthOrderBrentSolver;
import org.hipparchus.exception.MathIllegalArgumentException;
import org.hipparchus.exception.MathIllegalStateException;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.github.jakubt4.astrolabe.util.Angles.atan2Deg;
import static io.github.jakubt4.astrolabe.util.Angles.cosDeg;
import static io.github.jakubt4.astrolabe.util.Angles.sinDeg;
import static io.github.jakubt4.astrolabe.util.Angles.tanDeg;

/**
 * Ascendant, midheaven and house cusps from the sidereal time of the place.
 *
 * <p>Inputs are the right ascension of the meridian (RAMC), the geographic latitude and the
 * true obliquity, all in degrees. {@code offset} is subtracted from every tropical result
 * (the ayanamsa for sidereal charts, zero otherwise) before sign-based systems are laid out.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HouseCalculator {

    private static final double CONVERGENCE = 1e-10;
    private static final double RELATIVE_ACCURACY = 1e-15;
    private static final double FUNCTION_ACCURACY = 1e-12;
    private static final int SOLVER_ORDER = 5;

    private final AstrolabeProperties properties;

    public HouseCusps calculate(final HouseSystem system, final double ramc, final double latitude,
                                final double obliquity, final double offset) {
        final var ascendant = Angles.normalize(ascendant(ramc, latitude, obliquity) - offset);
        final var midheaven = Angles.normalize(midheaven(ramc, obliquity) - offset);

        final var cusps = switch (system) {
            case WHOLE_SIGN -> uniform(Angles.signIndex(ascendant) * Angles.SIGN_SPAN);
            case EQUAL -> uniform(ascendant);
            case PORPHYRY -> porphyry(ascendant, midheaven);
            case PLACIDUS -> placidus(ramc, latitude, obliquity, offset, ascendant, midheaven);
        };
        return new HouseCusps(cusps, ascendant, midheaven);
    }

    static double ascendant(final double ramc, final double latitude, final double obliquity) {
        return Angles.normalize(atan2Deg(cosDeg(ramc),
                -(sinDeg(ramc) * cosDeg(obliquity) + tanDeg(latitude) * sinDeg(obliquity))));
    }

    static double midheaven(final double ramc, final double obliquity) {
        return Angles.normalize(atan2Deg(sinDeg(ramc), cosDeg(ramc) * cosDeg(obliquity)));
    }

    private static List<Double> uniform(final double first) {
        final var cusps = new ArrayList<Double>(12);
        for (var i = 0; i < 12; i++) {
            cusps.add(Angles.normalize(first + i * Angles.SIGN_SPAN));
        }
        return cusps;
    }

    private static List<Double> porphyry(final double ascendant, final double midheaven) {
        final var upper = Angles.normalize(ascendant - midheaven);
        final var lower = 180.0 - upper;
        final var cusps = new double[12];
        cusps[0] = ascendant;
        cusps[1] = ascendant + lower / 3;
        cusps[2] = ascendant + 2 * lower / 3;
        cusps[9] = midheaven;
        cusps[10] = midheaven + upper / 3;
        cusps[11] = midheaven + 2 * upper / 3;
        return withOpposites(cusps);
    }

    /**
     * Semi-arc trisection: the right ascension of each cusp is the root of {@link #trisectionResidual}.
     */
    private List<Double> placidus(final double ramc, final double latitude, final double obliquity,
                                  final double offset, final double ascendant, final double midheaven) {
        final var limit = properties.chart().polarLatitudeLimit();
        if (FastMath.abs(latitude) > limit) {
            throw new InvalidLatitudeException(latitude, limit, HouseSystem.PLACIDUS.name());
        }
        final var cusps = new double[12];
        cusps[0] = ascendant;
        cusps[9] = midheaven;
        cusps[10] = placidusCusp(ramc, latitude, obliquity, 1.0 / 3.0, true) - offset;
        cusps[11] = placidusCusp(ramc, latitude, obliquity, 2.0 / 3.0, true) - offset;
        cusps[1] = placidusCusp(ramc, latitude, obliquity, 2.0 / 3.0, false) - offset;
        cusps[2] = placidusCusp(ramc, latitude, obliquity, 1.0 / 3.0, false) - offset;
        return withOpposites(cusps);
    }

    /**
     * The ascensional difference lies in [-90, 90], so the root is bracketed by the arc the
     * fraction of a semi-arc can span: [RAMC, RAMC + 180f] above the horizon and
     * [RAMC + 180 - 180f, RAMC + 180] below it.
     */
    private double placidusCusp(final double ramc, final double latitude, final double obliquity,
                                final double fraction, final boolean aboveHorizon) {
        final var maxEvaluations = properties.chart().placidusMaxIterations();
        final var from = aboveHorizon ? ramc : ramc + 180.0 - 180.0 * fraction;
        final var to = aboveHorizon ? ramc + 180.0 * fraction : ramc + 180.0;
        final UnivariateFunction residual =
                ra -> trisectionResidual(ra, ramc, latitude, obliquity, fraction, aboveHorizon);
        final var solver = new BracketingNthOrderBrentSolver(RELATIVE_ACCURACY, CONVERGENCE, FUNCTION_ACCURACY,
                SOLVER_ORDER);
        try {
            final var rightAscension = solver.solve(maxEvaluations, residual, from, to, AllowedSolution.ANY_SIDE);
            return eclipticLongitude(rightAscension, obliquity);
        } catch (final MathIllegalStateException | MathIllegalArgumentException e) {
            log.warn("Placidus cusp did not converge at latitude {} (RAMC {}): {}", latitude, ramc, e.getMessage());
            throw new NoConvergenceException("Placidus cusp", maxEvaluations,
                    FastMath.abs(residual.value((from + to) / 2)), Double.NaN);
        }
    }

    /**
     * Right ascension minus the trisection point of the semi-arc of the ecliptic point found at it.
     */
    private static double trisectionResidual(final double rightAscension, final double ramc, final double latitude,
                                             final double obliquity, final double fraction,
                                             final boolean aboveHorizon) {
        final var longitude = eclipticLongitude(rightAscension, obliquity);
        final var declination = Angles.asinDeg(sinDeg(obliquity) * sinDeg(longitude));
        final var ascensionalDifference = Angles.asinDeg(
                FastMath.max(-1.0, FastMath.min(1.0, tanDeg(latitude) * tanDeg(declination))));
        final var target = aboveHorizon
                ? ramc + fraction * (90.0 + ascensionalDifference)
                : ramc + 180.0 - fraction * (90.0 - ascensionalDifference);
        return rightAscension - target;
    }

    private static double eclipticLongitude(final double rightAscension, final double obliquity) {
        return Angles.normalize(atan2Deg(sinDeg(rightAscension), cosDeg(rightAscension) * cosDeg(obliquity)));
    }

    private static List<Double> withOpposites(final double[] cusps) {
        cusps[3] = cusps[9] + 180.0;
        cusps[4] = cusps[10] + 180.0;
        cusps[5] = cusps[11] + 180.0;
        cusps[6] = cusps[0] + 180.0;
        cusps[7] = cusps[1] + 180.0;
        cusps[8] = cusps[2] + 180.0;
        return Arrays.stream(cusps).map(Angles::normalize).boxed().toList();
    }
}
