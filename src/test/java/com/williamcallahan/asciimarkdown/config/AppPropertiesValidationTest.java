package com.williamcallahan.asciimarkdown.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.asciimarkdown.service.markdown.RenderSettings;
import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Verifies app property validation for layout, input and cache settings.
 */
class AppPropertiesValidationTest {

    @Test
    void defaultsAreValid() {
        AppProperties appProperties = new AppProperties();

        assertDoesNotThrow(appProperties::validateConfiguration);
        RenderSettings settings = appProperties.getRender().toSettings();
        assertEquals(80, settings.maxColumn());
        assertTrue(settings.wrap());
        assertFalse(settings.debug());
    }

    @Test
    void rejectsNonPositiveMaxColumn() {
        AppProperties appProperties = new AppProperties();
        appProperties.getRender().setMaxColumn(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveInputLength() {
        AppProperties appProperties = new AppProperties();
        appProperties.getInput().setMaxLength(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNegativeCacheSize() {
        AppProperties appProperties = new AppProperties();
        appProperties.getCache().setMaxSize(-1);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsZeroCacheTtl() {
        AppProperties appProperties = new AppProperties();
        appProperties.getCache().setTtl(Duration.ZERO);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }
}
