package io.github.jakubt4.astrolabe;

import io.github.jakubt4.astrolabe.config.AstrolabeProperties;
import io.github.jakubt4.astrolabe.model.GeoLocation;
import io.github.jakubt4.astrolabe.model.Subject;
import io.github.jakubt4.astrolabe.service.aspect.AspectEngine;
import io.github.jakubt4.astrolabe.service.chart.ChartBuilder;
import io.github.jakubt4.astrolabe.service.chart.HouseCalculator;
import io.github.jakubt4.astrolabe.service.compatibility.CompatibilityEngine;
import io.github.jakubt4.astrolabe.service.compatibility.GunaMilanEngine;
import io.github.jakubt4.astrolabe.service.divisional.DivisionalChartEngine;
import io.github.jakubt4.astrolabe.service.dosha.DoshaEngine;
import io.github.jakubt4.astrolabe.service.ephemeris.AnalyticEphemerisSource;
import io.github.jakubt4.astrolabe.service.ephemeris.EphemerisGateway;
import io.github.jakubt4.astrolabe.service.ephemeris.EphemerisReader;
import io.github.jakubt4.astrolabe.service.ephemeris.EphemerisSource;
import io.github.jakubt4.astrolabe.service.period.PeriodEngine;
import io.github.jakubt4.astrolabe.service.predictive.PredictiveTimingEngine;
import io.github.jakubt4.astrolabe.service.strength.AshtakavargaEngine;
import io.github.jakubt4.astrolabe.service.strength.StrengthEngine;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * Engines wired by hand over the analytic ephemeris, with default settings.
 */
public final class TestContexts {

    public static final GeoLocation LONDON = GeoLocation.of(51.5074, -0.1278);
    public static final GeoLocation NEW_DELHI = GeoLocation.of(28.6139, 77.2090);

    /** 1990-06-15 12:00 UT in London. */
    public static final Subject SUBJECT = Subject.of("fixture",
            LocalDateTime.of(1990, 6, 15, 12, 0).toInstant(ZoneOffset.UTC), LONDON, ZoneOffset.UTC);

    /** 1985-11-02 06:30 IST in New Delhi. */
    public static final Subject PARTNER = Subject.of("partner",
            LocalDateTime.of(1985, 11, 2, 6, 30).toInstant(ZoneOffset.ofHoursMinutes(5, 30)), NEW_DELHI,
            ZoneOffset.ofHoursMinutes(5, 30));

    public final AstrolabeProperties properties;
    public final EphemerisGateway gateway;
    public final ChartBuilder chartBuilder;
    public final AspectEngine aspectEngine;
    public final DivisionalChartEngine divisionalChartEngine;
    public final StrengthEngine strengthEngine;
    public final AshtakavargaEngine ashtakavargaEngine;
    public final PeriodEngine periodEngine;
    public final PredictiveTimingEngine predictiveTimingEngine;
    public final CompatibilityEngine compatibilityEngine;
    public final GunaMilanEngine gunaMilanEngine;
    public final DoshaEngine doshaEngine;

    private TestContexts(final AstrolabeProperties properties, final EphemerisSource source) {
        this.properties = properties;
        this.gateway = new EphemerisGateway(new EphemerisReader(source), properties);
        this.chartBuilder = new ChartBuilder(gateway, new HouseCalculator(properties), properties);
        this.aspectEngine = new AspectEngine(properties);
        this.divisionalChartEngine = new DivisionalChartEngine(properties);
        this.strengthEngine = new StrengthEngine();
        this.ashtakavargaEngine = new AshtakavargaEngine();
        this.periodEngine = new PeriodEngine(gateway, properties);
        this.predictiveTimingEngine = new PredictiveTimingEngine(chartBuilder, gateway, aspectEngine, properties);
        this.compatibilityEngine = new CompatibilityEngine(aspectEngine, chartBuilder, properties);
        this.gunaMilanEngine = new GunaMilanEngine(properties);
        this.doshaEngine = new DoshaEngine(predictiveTimingEngine, gateway);
    }

    public static TestContexts standard() {
        return new TestContexts(properties(Map.of()), new AnalyticEphemerisSource());
    }

    public static TestContexts withSource(final EphemerisSource source) {
        return new TestContexts(properties(Map.of()), source);
    }

    public static TestContexts with(final Map<String, String> settings) {
        return new TestContexts(properties(settings), new AnalyticEphemerisSource());
    }

    /**
     * Binds {@code astrolabe.*} from the given keys, applying the declared defaults for the rest.
     */
    public static AstrolabeProperties properties(final Map<String, String> settings) {
        final var binder = new Binder(new MapConfigurationPropertySource(settings));
        return binder.bindOrCreate("astrolabe", AstrolabeProperties.class);
    }
}
