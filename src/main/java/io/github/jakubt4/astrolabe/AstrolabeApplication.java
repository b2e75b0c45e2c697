package io.github.jakubt4.astrolabe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Astrolabe: astronomical and astrological computation engine.
 *
 * <p>Casts charts from birth data through an analytic (or Orekit) ephemeris and derives
 * houses, aspects, divisional charts, strength scores, Vimshottari periods, progressions,
 * returns, transit timing and compatibility. Analyses are reached through
 * {@code POST /api/analysis/{analysisId}}.
 *
 * @see io.github.jakubt4.astrolabe.service.dispatch.ServiceDispatcher
 * @see io.github.jakubt4.astrolabe.service.ephemeris.EphemerisGateway
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
public class AstrolabeApplication {

    public static void main(String[] args) {
        SpringApplication.run(AstrolabeApplication.class, args);
    }
}
