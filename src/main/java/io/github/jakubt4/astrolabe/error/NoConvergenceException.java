package io.github.jakubt4.astrolabe.error;

import java.util.Locale;

/**
 * An iterative search ran out of its iteration budget or search span.
 */
public class NoConvergenceException extends AstrolabeException {

    private final int iterations;
    private final double residual;
    private final double lastJulianDay;

    public NoConvergenceException(final String what, final int iterations, final double residual,
                                  final double lastJulianDay) {
        super(String.format(Locale.ROOT, "%s did not converge after %d iterations (residual %.6f deg, last JD %.5f)",
                what, iterations, residual, lastJulianDay));
        this.iterations = iterations;
        this.residual = residual;
        this.lastJulianDay = lastJulianDay;
    }

    public int getIterations() {
        return iterations;
    }

    public double getResidual() {
        return residual;
    }

    public double getLastJulianDay() {
        return lastJulianDay;
    }

    @Override
    public String code() {
        return "NO_CONVERGENCE";
    }
}
