package com.kiln.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class KilnConfigTest {

    @Test
    void builder_defaultsMatchEnvironmentDefaults() {
        KilnConfig config = KilnConfig.builder().build();

        assertEquals(Paths.get("projects"), config.getProjectsDir());
        assertEquals(Paths.get("links"), config.getLinksDir());
        assertNull(config.getPolicyPath());
        assertNull(config.getProfile());
        assertFalse(config.isStrictArtifactId());
        assertFalse(config.isPluginsRequired());
        assertEquals(3, config.getShadowParityWindow());
    }

    @Test
    void builder_blankProfileMeansPolicyDefault() {
        KilnConfig config = KilnConfig.builder().profile("  ").build();
        assertNull(config.getProfile());

        assertEquals("isolation", KilnConfig.builder().profile(" isolation ").build().getProfile());
    }

    @Test
    void builder_nonPositiveParityWindowFallsBackToDefault() {
        assertEquals(3, KilnConfig.builder().shadowParityWindow(0).build().getShadowParityWindow());
        assertEquals(5, KilnConfig.builder().shadowParityWindow(5).build().getShadowParityWindow());
    }

    @Test
    void parseHelpers_acceptOneAndTrueAndIgnoreGarbage() {
        assertTrue(KilnConfig.parseBoolean("1", false));
        assertTrue(KilnConfig.parseBoolean("TRUE", false));
        assertFalse(KilnConfig.parseBoolean("yes", false));
        assertTrue(KilnConfig.parseBoolean(null, true));
        assertEquals(7, KilnConfig.parseInt("x7", 7));
        assertEquals(12, KilnConfig.parseInt(" 12 ", 7));
    }
}
