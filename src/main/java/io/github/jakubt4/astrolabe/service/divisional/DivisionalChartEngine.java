package io.github.jakubt4.astrolabe.service.divisional;

import io.github.jakubt4.astrolabe.config.AstrolabeProperties;
import io.github.jakubt4.astrolabe.model.Chart;
import io.github.jakubt4.astrolabe.model.ZodiacSign;
import io.github.jakubt4.astrolabe.util.Angles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives divisional (varga) charts from a base chart.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DivisionalChartEngine {

    private final AstrolabeProperties properties;

    /**
     * @throws io.github.jakubt4.astrolabe.error.UnsupportedParameterException for a factor outside the catalog
     */
    public DivisionalChart derive(final Chart chart, final int factor) {
        final var varga = Varga.ofFactor(factor);
        if (varga == Varga.D1) {
            return new DivisionalChart(1, varga.displayName(), chart.positions(), chart.ascendant(), chart.cusps());
        }
        final var positions = chart.positions().stream()
                .map(p -> p.withLongitude(project(varga, p.longitude())))
                .toList();
        final var ascendant = project(varga, chart.ascendant());
        final var cusps = new ArrayList<Double>(12);
        final var first = Angles.signIndex(ascendant) * Angles.SIGN_SPAN;
        for (var i = 0; i < 12; i++) {
            cusps.add(Angles.normalize(first + i * Angles.SIGN_SPAN));
        }
        log.debug("Derived {} ({}) with ascendant {}", varga, varga.displayName(), ascendant);
        return new DivisionalChart(factor, varga.displayName(), positions, ascendant, cusps);
    }

    /**
     * Every divisional chart in the configured catalog, keyed by factor.
     */
    public Map<Integer, DivisionalChart> deriveAll(final Chart chart) {
        final var result = new LinkedHashMap<Integer, DivisionalChart>();
        for (final var factor : properties.chart().divisionalFactors()) {
            result.put(factor, derive(chart, factor));
        }
        return Collections.unmodifiableMap(result);
    }

    public List<Integer> catalog() {
        return properties.chart().divisionalFactors();
    }

    /**
     * Longitude in the divisional chart: target sign plus the position inside the part,
     * stretched to a full sign.
     */
    static double project(final Varga varga, final double longitude) {
        final var sign = ZodiacSign.ofLongitude(longitude);
        final var degree = Angles.degreeInSign(longitude);
        if (varga == Varga.D30) {
            return trimsamsa(sign, degree);
        }
        final var scaled = degree * varga.factor() / Angles.SIGN_SPAN;
        final var part = (int) FastMath.min(FastMath.floor(scaled), varga.factor() - 1);
        final var target = varga.rule().target(sign, part);
        return Angles.normalize(target.startLongitude() + (scaled - part) * Angles.SIGN_SPAN);
    }

    private static double trimsamsa(final ZodiacSign sign, final double degree) {
        final var bounds = sign.isOdd() ? Varga.TRIMSAMSA_ODD_BOUNDS : Varga.TRIMSAMSA_EVEN_BOUNDS;
        final var signs = sign.isOdd() ? Varga.TRIMSAMSA_ODD_SIGNS : Varga.TRIMSAMSA_EVEN_SIGNS;
        for (var i = 0; i < signs.length; i++) {
            if (degree < bounds[i + 1]) {
                final var within = (degree - bounds[i]) / (bounds[i + 1] - bounds[i]);
                return Angles.normalize(signs[i].startLongitude() + within * Angles.SIGN_SPAN);
            }
        }
        return signs[signs.length - 1].startLongitude() + Angles.SIGN_SPAN - 1e-9;
    }
}
