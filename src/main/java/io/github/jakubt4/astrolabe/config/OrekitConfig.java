package io.github.jakubt4.astrolabe.config;

import io.github.jakubt4.astrolabe.service.ephemeris.OrekitEphemerisSource;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.orekit.data.DataContext;
import org.orekit.data.ZipJarCrawler;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Switches the ephemeris to Orekit ({@code astrolabe.ephemeris.source=orekit}).
 *
 * <p>Registers the Orekit data archive (leap seconds, Earth orientation, JPL DE files) with
 * Orekit's {@link DataContext} before the source bean is created.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "astrolabe.ephemeris", name = "source", havingValue = "orekit")
@RequiredArgsConstructor
public class OrekitConfig {

    private final AstrolabeProperties properties;

    @PostConstruct
    public void init() {
        registerData(properties.ephemeris().orekitData());
    }

    @Bean
    public OrekitEphemerisSource orekitEphemerisSource() {
        return OrekitEphemerisSource.fromDefaultContext();
    }

    /**
     * Adds a classpath zip archive to the default data context.
     *
     * @throws IllegalStateException if the archive is not on the classpath
     */
    public static void registerData(final String resource) {
        final var orekitData = OrekitConfig.class.getClassLoader().getResource(resource);
        if (orekitData == null) {
            throw new IllegalStateException(resource + " not found on classpath");
        }
        final var crawler = new ZipJarCrawler(orekitData);
        DataContext.getDefault().getDataProvidersManager().addProvider(crawler);
        log.info("Orekit data loaded from classpath:{}", resource);
    }
}
