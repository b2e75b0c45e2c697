package io.github.jakubt4.astrolabe.config;

import io.github.jakubt4.astrolabe.model.Ayanamsa;
import io.github.jakubt4.astrolabe.model.HouseSystem;
import io.github.jakubt4.astrolabe.model.ZodiacType;
import io.github.jakubt4.astrolabe.service.aspect.AspectType;
import io.github.jakubt4.astrolabe.service.aspect.OrbTable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Engine settings bound from {@code astrolabe.*}.
 *
 * <pre>{@code
 * astrolabe:
 *   chart:
 *     house-system: PLACIDUS
 *     zodiac: SIDEREAL
 *     ayanamsa: LAHIRI
 *   ephemeris:
 *     source: analytic      # or orekit
 *     orekit-data: orekit-data.zip
 *     min-year: 1900
 *     max-year: 2100
 *   aspects:
 *     orbs:
 *       conjunction: 8
 *     include-minors: false
 *   periods:
 *     depth: 3
 *   cache:
 *     natal-ttl: 24h
 *     dated-ttl: 1h
 * }</pre>
 *
 * <p>Every value is checked when the record is created, so a bad configuration stops the
 * application at startup.
 */
@ConfigurationProperties(prefix = "astrolabe")
public record AstrolabeProperties(
        @DefaultValue Charts chart,
        @DefaultValue Ephemeris ephemeris,
        @DefaultValue Aspects aspects,
        @DefaultValue Periods periods,
        @DefaultValue Search search,
        @DefaultValue Cache cache,
        @DefaultValue Dispatcher dispatcher) {

    public record Charts(
            @DefaultValue("PLACIDUS") HouseSystem houseSystem,
            @DefaultValue("SIDEREAL") ZodiacType zodiac,
            @DefaultValue("LAHIRI") Ayanamsa ayanamsa,
            @DefaultValue("66.5") double polarLatitudeLimit,
            @DefaultValue("50") int placidusMaxIterations,
            @DefaultValue({"1", "2", "3", "4", "7", "9", "10", "12", "16", "20", "24", "27", "30", "40", "45", "60"})
            List<Integer> divisionalFactors) {

        public Charts {
            if (polarLatitudeLimit <= 0 || polarLatitudeLimit >= 90) {
                throw new IllegalArgumentException("astrolabe.chart.polar-latitude-limit must be in (0, 90), got: "
                        + polarLatitudeLimit);
            }
            if (placidusMaxIterations <= 0) {
                throw new IllegalArgumentException("astrolabe.chart.placidus-max-iterations must be positive");
            }
            divisionalFactors = List.copyOf(divisionalFactors);
        }
    }

    public record Ephemeris(
            @DefaultValue("analytic") String source,
            @DefaultValue("1900") int minYear,
            @DefaultValue("2100") int maxYear,
            @DefaultValue("2") int maxAttempts,
            @DefaultValue("200") long backoffMillis,
            @DefaultValue("orekit-data.zip") String orekitData) {

        public Ephemeris {
            if (minYear > maxYear) {
                throw new IllegalArgumentException("astrolabe.ephemeris.min-year must not exceed max-year");
            }
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("astrolabe.ephemeris.max-attempts must be at least 1");
            }
        }
    }

    public record Aspects(
            Map<AspectType, Double> orbs,
            Map<String, Double> pointFactors,
            @DefaultValue("false") boolean includeMinors,
            @DefaultValue("3") int stelliumMinBodies,
            @DefaultValue("10") double stelliumArc,
            @DefaultValue("1.0") double progressionOrb) {

        public Aspects {
            orbs = orbs == null ? Map.of() : Map.copyOf(orbs);
            pointFactors = pointFactors == null ? Map.of() : Map.copyOf(pointFactors);
            if (stelliumMinBodies < 3) {
                throw new IllegalArgumentException("astrolabe.aspects.stellium-min-bodies must be at least 3");
            }
            if (stelliumArc <= 0 || stelliumArc > 30) {
                throw new IllegalArgumentException("astrolabe.aspects.stellium-arc must be in (0, 30]");
            }
            if (progressionOrb <= 0) {
                throw new IllegalArgumentException("astrolabe.aspects.progression-orb must be positive");
            }
            // fail fast on bad orbs or factors
            orbTable(orbs, pointFactors, includeMinors);
        }

        public OrbTable orbTable() {
            return orbTable(orbs, pointFactors, includeMinors);
        }

        private static OrbTable orbTable(final Map<AspectType, Double> orbs, final Map<String, Double> factors,
                                         final boolean minors) {
            return new OrbTable(orbs, factors, OrbTable.enabledSet(minors));
        }
    }

    public record Periods(@DefaultValue("3") int depth) {

        public Periods {
            if (depth < 3 || depth > 5) {
                throw new IllegalArgumentException("astrolabe.periods.depth must be between 3 and 5, got: " + depth);
            }
        }
    }

    public record Search(
            @DefaultValue("5000") int maxIterations,
            @DefaultValue("1.5") double spanFactor,
            @DefaultValue("0.0001") double refineToleranceDays) {

        public Search {
            if (maxIterations <= 0) {
                throw new IllegalArgumentException("astrolabe.search.max-iterations must be positive");
            }
            if (spanFactor < 1.0) {
                throw new IllegalArgumentException("astrolabe.search.span-factor must be at least 1");
            }
            if (refineToleranceDays <= 0 || refineToleranceDays > 0.0001) {
                throw new IllegalArgumentException("astrolabe.search.refine-tolerance-days must be in (0, 1e-4]");
            }
        }
    }

    public record Cache(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("10000") long maximumSize,
            @DefaultValue("24h") Duration natalTtl,
            @DefaultValue("1h") Duration datedTtl,
            @DefaultValue("false") boolean recordStats) {

        public Cache {
            if (maximumSize <= 0) {
                throw new IllegalArgumentException("astrolabe.cache.maximum-size must be positive");
            }
            if (natalTtl.isNegative() || natalTtl.isZero() || datedTtl.isNegative() || datedTtl.isZero()) {
                throw new IllegalArgumentException("astrolabe.cache TTLs must be positive");
            }
        }
    }

    public record Dispatcher(
            @DefaultValue("4") int poolSize,
            @DefaultValue("analysis-catalog.json") String catalogLocation) {

        public Dispatcher {
            if (poolSize <= 0) {
                throw new IllegalArgumentException("astrolabe.dispatcher.pool-size must be positive, got: " + poolSize);
            }
        }
    }
}
