package io.github.jakubt4.astrolabe.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrekitConfigTest {

    @Test
    void missingDataArchiveFailsStartup() {
        assertThatThrownBy(() -> OrekitConfig.registerData("no-such-orekit-data.zip"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no-such-orekit-data.zip");
    }
}
