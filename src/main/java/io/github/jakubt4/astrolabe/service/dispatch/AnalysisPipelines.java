package io.github.jakubt4.astrolabe.service.dispatch;

import io.github.jakubt4.astrolabe.config.AstrolabeProperties;
import io.github.jakubt4.astrolabe.error.InputValidationException;
import io.github.jakubt4.astrolabe.error.UnsupportedParameterException;
import io.github.jakubt4.astrolabe.model.Ayanamsa;
import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.Chart;
import io.github.jakubt4.astrolabe.model.ChartPoint;
import io.github.jakubt4.astrolabe.model.HouseSystem;
import io.github.jakubt4.astrolabe.model.Subject;
import io.github.jakubt4.astrolabe.model.ZodiacSign;
import io.github.jakubt4.astrolabe.model.ZodiacType;
import io.github.jakubt4.astrolabe.service.aspect.Aspect;
import io.github.jakubt4.astrolabe.service.aspect.AspectEngine;
import io.github.jakubt4.astrolabe.service.aspect.AspectPattern;
import io.github.jakubt4.astrolabe.service.aspect.OrbTable;
import io.github.jakubt4.astrolabe.service.chart.ChartBuilder;
import io.github.jakubt4.astrolabe.service.chart.ChartOptions;
import io.github.jakubt4.astrolabe.service.compatibility.CompatibilityEngine;
import io.github.jakubt4.astrolabe.service.compatibility.GunaMilanEngine;
import io.github.jakubt4.astrolabe.service.compatibility.Koota;
import io.github.jakubt4.astrolabe.service.divisional.DivisionalChartEngine;
import io.github.jakubt4.astrolabe.service.dosha.DoshaEngine;
import io.github.jakubt4.astrolabe.service.dosha.KaalSarpResult;
import io.github.jakubt4.astrolabe.service.dosha.ManglikResult;
import io.github.jakubt4.astrolabe.service.period.Period;
import io.github.jakubt4.astrolabe.service.period.PeriodEngine;
import io.github.jakubt4.astrolabe.service.predictive.PredictiveTimingEngine;
import io.github.jakubt4.astrolabe.service.predictive.ProgressionTechnique;
import io.github.jakubt4.astrolabe.service.predictive.TransitScanOptions;
import io.github.jakubt4.astrolabe.service.strength.AshtakavargaEngine;
import io.github.jakubt4.astrolabe.service.strength.StrengthEngine;
import io.github.jakubt4.astrolabe.util.Angles;
import io.github.jakubt4.astrolabe.util.JulianDay;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

/**
 * Maps each {@link Pipeline} onto engine calls and a short narrative.
 *
 * <p>Recognised parameters: {@code houseSystem}, {@code zodiac}, {@code ayanamsa}, {@code factor},
 * {@code includeMinors}, {@code depth}, {@code level}, {@code count}, {@code technique}, {@code body},
 * {@code year}, {@code days}, {@code bodies}, {@code stepDays}. Vedic pipelines always use the
 * sidereal zodiac.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisPipelines {

    private final ChartBuilder chartBuilder;
    private final DivisionalChartEngine divisionalChartEngine;
    private final AspectEngine aspectEngine;
    private final StrengthEngine strengthEngine;
    private final AshtakavargaEngine ashtakavargaEngine;
    private final PeriodEngine periodEngine;
    private final PredictiveTimingEngine predictiveTimingEngine;
    private final CompatibilityEngine compatibilityEngine;
    private final GunaMilanEngine gunaMilanEngine;
    private final DoshaEngine doshaEngine;
    private final AstrolabeProperties properties;

    public record AspectsPayload(List<Aspect> aspects, List<AspectPattern> patterns) {
    }

    public record DoshaPayload(KaalSarpResult kaalSarp, ManglikResult manglik) {
    }

    PipelineOutput run(final AnalysisContext context) {
        final var pipeline = context.descriptor().pipeline();
        log.debug("Running pipeline {} for analysis [{}]", pipeline, context.descriptor().id());
        return switch (pipeline) {
            case BIRTH_CHART -> birthChart(context);
            case DIVISIONAL_CHART -> divisionalChart(context);
            case ASPECTS -> aspects(context);
            case STRENGTH -> strength(context);
            case ASHTAKAVARGA -> ashtakavarga(context);
            case NAKSHATRA -> nakshatra(context);
            case PERIOD_TREE -> periodTree(context);
            case CURRENT_PERIOD -> currentPeriod(context);
            case UPCOMING_PERIODS -> upcomingPeriods(context);
            case PROGRESSION -> progression(context);
            case RETURN_CHART -> returnChart(context);
            case TRANSIT_SCAN -> transitScan(context);
            case COMPATIBILITY -> compatibility(context);
            case GUNA_MILAN -> gunaMilan(context);
            case DOSHA -> dosha(context);
            case SADE_SATI -> sadeSati(context);
            case COMPREHENSIVE -> throw new IllegalStateException("Comprehensive analyses are run by the dispatcher");
        };
    }

    private PipelineOutput birthChart(final AnalysisContext context) {
        final var chart = natal(context, context.primary(), false);
        final var lines = new ArrayList<String>();
        lines.add("Ascendant in " + placement(chart.ascendant()));
        lines.add("Sun in " + placement(chart.position(Body.SUN).longitude()) + ", house " + chart.houseOf(Body.SUN));
        lines.add("Moon in " + placement(chart.position(Body.MOON).longitude()) + ", house "
                + chart.houseOf(Body.MOON));
        chart.positions().stream()
                .filter(p -> p.retrograde() && !p.body().isNode())
                .forEach(p -> lines.add(p.body().displayName() + " is retrograde"));
        return new PipelineOutput(chart, lines);
    }

    private PipelineOutput divisionalChart(final AnalysisContext context) {
        final var chart = natal(context, context.primary(), true);
        if ("all".equalsIgnoreCase(context.param("factor"))) {
            final var all = divisionalChartEngine.deriveAll(chart);
            return new PipelineOutput(all, List.of(all.size() + " divisional charts"));
        }
        final var divisional = divisionalChartEngine.derive(chart, context.intParam("factor", 9));
        return new PipelineOutput(divisional, List.of(divisional.name() + " ascendant in "
                + placement(divisional.ascendant())));
    }

    private PipelineOutput aspects(final AnalysisContext context) {
        final var chart = natal(context, context.primary(), false);
        final var configured = properties.aspects();
        final var orbTable = context.flag("includeMinors")
                ? new OrbTable(configured.orbs(), configured.pointFactors(), OrbTable.enabledSet(true))
                : configured.orbTable();
        final var aspects = aspectEngine.findAspects(chart.points(), orbTable);
        final var patterns = aspectEngine.findPatterns(chart.points(), aspects);
        final var lines = new ArrayList<String>();
        aspects.stream()
                .sorted(Comparator.comparingDouble(Aspect::exactness).reversed())
                .limit(5)
                .forEach(a -> lines.add(String.format(Locale.ROOT, "%s %s %s (orb %.2f)", a.first(),
                        a.type().name().toLowerCase(Locale.ROOT), a.second(), a.orb())));
        patterns.forEach(p -> lines.add(p.type() + ": " + String.join(", ", p.points())));
        return new PipelineOutput(new AspectsPayload(aspects, patterns), lines);
    }

    private PipelineOutput strength(final AnalysisContext context) {
        final var scores = strengthEngine.score(natal(context, context.primary(), true));
        final var lines = scores.values().stream()
                .sorted(Comparator.comparingDouble(s -> -s.points()))
                .map(s -> String.format(Locale.ROOT, "%s: %.0f points (%s)", s.body().displayName(), s.points(),
                        s.band()))
                .toList();
        return new PipelineOutput(scores, lines);
    }

    private PipelineOutput ashtakavarga(final AnalysisContext context) {
        final var result = ashtakavargaEngine.compute(natal(context, context.primary(), true));
        final var lines = new ArrayList<String>();
        lines.add("Sarvashtakavarga total " + result.total() + " bindus");
        result.bhinna().forEach((planet, bindus) -> lines.add(planet.displayName() + ": "
                + bindus.stream().mapToInt(Integer::intValue).sum() + " bindus"));
        lines.add("Strong houses: " + (result.strongHouses().isEmpty() ? "none" : result.strongHouses()));
        lines.add("Weak houses: " + (result.weakHouses().isEmpty() ? "none" : result.weakHouses()));
        return new PipelineOutput(result, lines);
    }

    private PipelineOutput nakshatra(final AnalysisContext context) {
        final var placements = doshaEngine.nakshatras(natal(context, context.primary(), true));
        final var lines = placements.stream()
                .filter(p -> Body.MOON.name().equals(p.point()) || ChartPoint.ASCENDANT.equals(p.point()))
                .map(p -> p.point() + " in " + p.nakshatra() + " pada " + p.pada() + ", lord "
                        + p.lord().displayName())
                .toList();
        return new PipelineOutput(placements, lines);
    }

    private PipelineOutput periodTree(final AnalysisContext context) {
        final var tree = periodEngine.buildTree(context.primary(), depth(context));
        return new PipelineOutput(tree, List.of(String.format(Locale.ROOT,
                "Born in %s; %s period balance %.2f years", tree.nakshatra(), tree.startingLord().displayName(),
                tree.balanceYears())));
    }

    private PipelineOutput currentPeriod(final AnalysisContext context) {
        final var tree = periodEngine.buildTree(context.primary(), depth(context));
        final var path = periodEngine.query(tree, context.asOfJd());
        final var lines = path.stream().map(AnalysisPipelines::describe).toList();
        return new PipelineOutput(path, lines);
    }

    private PipelineOutput upcomingPeriods(final AnalysisContext context) {
        final var depth = depth(context);
        final var level = context.intParam("level", 1);
        if (level < 1 || level > depth) {
            throw new InputValidationException("Parameter [level] must be between 1 and " + depth);
        }
        final var count = context.intParam("count", 5);
        if (count < 1) {
            throw new InputValidationException("Parameter [count] must be positive");
        }
        final var tree = periodEngine.buildTree(context.primary(), depth);
        final var upcoming = periodEngine.upcoming(tree, context.asOfJd(), level, count);
        return new PipelineOutput(upcoming, upcoming.stream().map(AnalysisPipelines::describe).toList());
    }

    private PipelineOutput progression(final AnalysisContext context) {
        final var technique = ProgressionTechnique.parse(context.param("technique", "SECONDARY"));
        final var natal = natal(context, context.primary(), false);
        final var progression = predictiveTimingEngine.progress(natal, context.asOfJd(), technique);
        final var lines = new ArrayList<String>();
        lines.add(String.format(Locale.ROOT, "%s progression at age %.2f, arc %.3f", technique,
                progression.ageYears(), progression.arc()));
        lines.add("Progressed Sun in " + placement(progression.chart().position(Body.SUN).longitude()));
        lines.add("Progressed Moon in " + placement(progression.chart().position(Body.MOON).longitude()));
        return new PipelineOutput(progression, lines);
    }

    private PipelineOutput returnChart(final AnalysisContext context) {
        final var body = body(context.param("body", "SUN"));
        final var year = context.intParam("year", context.asOf().getYear());
        final var natal = natal(context, context.primary(), false);
        final var result = predictiveTimingEngine.returnChart(natal, body, year);
        return new PipelineOutput(result, List.of(body.displayName() + " return at "
                + JulianDay.toInstant(result.julianDay()), "Return ascendant in " + placement(result.chart().ascendant())));
    }

    private PipelineOutput transitScan(final AnalysisContext context) {
        final var days = context.doubleParam("days", 30.0);
        if (!(days > 0)) {
            throw new InputValidationException("Parameter [days] must be positive");
        }
        final var bodiesParam = context.param("bodies");
        final var bodies = EnumSet.noneOf(Body.class);
        if (bodiesParam == null) {
            bodies.addAll(TransitScanOptions.DEFAULT_BODIES);
        } else {
            AnalysisCatalog.parts(bodiesParam).forEach(part -> bodies.add(body(part)));
            if (bodies.isEmpty()) {
                throw new InputValidationException("Parameter [bodies] must name at least one body");
            }
        }
        final var template = TransitScanOptions.forBodies(bodies);
        final var step = context.param("stepDays") == null ? null : context.doubleParam("stepDays", 1.0);
        if (step != null && !(step > 0)) {
            throw new InputValidationException("Parameter [stepDays] must be positive");
        }
        final var options = new TransitScanOptions(template.bodies(), template.aspects(), template.ingresses(),
                template.aspectEvents(), template.stations(), step);

        final var natal = natal(context, context.primary(), false);
        final var events = predictiveTimingEngine.transitScan(natal, context.asOfJd(), context.asOfJd() + days,
                options);
        final var lines = events.stream()
                .limit(10)
                .map(e -> String.format(Locale.ROOT, "%s %s %s %s", e.instant(), e.body().displayName(),
                        e.type(), e.aspect() == null ? nullToEmpty(e.target())
                                : e.aspect().name().toLowerCase(Locale.ROOT) + " " + e.target()).trim())
                .toList();
        return new PipelineOutput(events, lines);
    }

    private PipelineOutput compatibility(final AnalysisContext context) {
        final var first = natal(context, context.primary(), false);
        final var second = natal(context, context.secondary(), false);
        final var report = compatibilityEngine.compare(first, second);
        return new PipelineOutput(report, List.of(
                String.format(Locale.ROOT, "Compatibility score %.1f / 100", report.score()),
                String.format(Locale.ROOT, "Tension index %.1f / 100", report.tension()),
                report.matrix().aspects().size() + " cross aspects"));
    }

    private PipelineOutput gunaMilan(final AnalysisContext context) {
        final var match = gunaMilanEngine.match(natal(context, context.primary(), true),
                natal(context, context.secondary(), true));
        final var lines = new ArrayList<String>();
        lines.add(String.format(Locale.ROOT, "Guna milan %.1f / %.0f (%s)", match.total(), Koota.TOTAL,
                match.verdict()));
        lines.add(match.groomNakshatra() + " and " + match.brideNakshatra());
        if (match.nadiDosha()) {
            lines.add("Nadi dosha: both Moons share a nadi");
        }
        if (match.bhakootDosha()) {
            lines.add("Bhakoot dosha: Moon signs " + match.groomMoonSign() + " and " + match.brideMoonSign());
        }
        return new PipelineOutput(match, lines);
    }

    private PipelineOutput dosha(final AnalysisContext context) {
        final var chart = natal(context, context.primary(), true);
        final var kaalSarp = doshaEngine.kaalSarp(chart);
        final var manglik = doshaEngine.manglik(chart);
        final var lines = new ArrayList<String>();
        if (kaalSarp.present()) {
            lines.add((kaalSarp.ascending() ? "Kaal Sarp" : "Kaal Amrit") + " yoga of " + kaalSarp.type() + " type");
        } else {
            lines.add("No Kaal Sarp yoga");
        }
        if (manglik.present()) {
            lines.add("Manglik" + (manglik.cancelled() ? " (cancelled by Mars' own or exaltation sign)" : ""));
        } else {
            lines.add("Not Manglik");
        }
        return new PipelineOutput(new DoshaPayload(kaalSarp, manglik), lines);
    }

    private PipelineOutput sadeSati(final AnalysisContext context) {
        final var report = doshaEngine.sadeSati(natal(context, context.primary(), true), context.asOfJd());
        final var line = report.active()
                ? "Sade Sati active: " + report.current().phase() + " phase, Saturn in " + report.current().sign()
                : "Sade Sati not active";
        return new PipelineOutput(report, List.of("Moon sign " + report.moonSign(), line));
    }

    private Chart natal(final AnalysisContext context, final Subject subject, final boolean vedic) {
        return chartBuilder.build(subject, subject.julianDayUt(), options(context, vedic));
    }

    private ChartOptions options(final AnalysisContext context, final boolean vedic) {
        final var defaults = chartBuilder.defaultOptions();
        final var houseSystem = context.param("houseSystem") == null
                ? defaults.houseSystem() : HouseSystem.parse(context.param("houseSystem"));
        final var ayanamsa = context.param("ayanamsa") == null
                ? defaults.ayanamsa() : Ayanamsa.parse(context.param("ayanamsa"));
        final ZodiacType zodiac;
        if (vedic) {
            zodiac = ZodiacType.SIDEREAL;
        } else {
            zodiac = context.param("zodiac") == null ? defaults.zodiac() : ZodiacType.parse(context.param("zodiac"));
        }
        return zodiac == ZodiacType.SIDEREAL
                ? ChartOptions.sidereal(houseSystem, ayanamsa)
                : ChartOptions.tropical(houseSystem);
    }

    private int depth(final AnalysisContext context) {
        final var depth = context.intParam("depth", properties.periods().depth());
        if (depth < PeriodEngine.MIN_DEPTH || depth > PeriodEngine.MAX_DEPTH) {
            throw new InputValidationException("Parameter [depth] must be between " + PeriodEngine.MIN_DEPTH
                    + " and " + PeriodEngine.MAX_DEPTH);
        }
        return depth;
    }

    private static Body body(final String value) {
        try {
            return Body.parse(value.trim());
        } catch (final IllegalArgumentException e) {
            throw new UnsupportedParameterException("body", value);
        }
    }

    private static String describe(final Period period) {
        return String.format(Locale.ROOT, "Level %d %s: %s to %s", period.level(), period.lord().displayName(),
                JulianDay.toInstant(period.startJd()), JulianDay.toInstant(period.endJd()));
    }

    private static String placement(final double longitude) {
        return String.format(Locale.ROOT, "%s %.2f°", ZodiacSign.ofLongitude(longitude),
                Angles.degreeInSign(longitude));
    }

    private static String nullToEmpty(final String value) {
        return value == null ? "" : value;
    }
}
