package io.github.jakubt4.astrolabe.service.chart;

import io.github.jakubt4.astrolabe.model.Ayanamsa;
import io.github.jakubt4.astrolabe.model.Chart;
import io.github.jakubt4.astrolabe.model.HouseSystem;
import io.github.jakubt4.astrolabe.model.ZodiacType;

/**
 * How a chart is cast. {@code ayanamsa} is ignored for tropical charts.
 */
public record ChartOptions(HouseSystem houseSystem, ZodiacType zodiac, Ayanamsa ayanamsa) {

    public static ChartOptions of(final Chart chart) {
        return new ChartOptions(chart.houseSystem(), chart.zodiac(),
                chart.ayanamsa() == null ? Ayanamsa.LAHIRI : chart.ayanamsa());
    }

    public static ChartOptions tropical(final HouseSystem houseSystem) {
        return new ChartOptions(houseSystem, ZodiacType.TROPICAL, Ayanamsa.LAHIRI);
    }

    public static ChartOptions sidereal(final HouseSystem houseSystem, final Ayanamsa ayanamsa) {
        return new ChartOptions(houseSystem, ZodiacType.SIDEREAL, ayanamsa);
    }

    public ChartOptions withHouseSystem(final HouseSystem system) {
        return new ChartOptions(system, zodiac, ayanamsa);
    }
}
