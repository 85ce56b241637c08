package de.htwsaar.ministatic.server;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.htwsaar.ministatic.common.auth.SecurityConfig;
import de.htwsaar.ministatic.common.logging.LoggingConfig;
import de.htwsaar.ministatic.core.HandlerConfig;
import de.htwsaar.ministatic.core.RequestOptions;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.Import;

/**
 * Verifiziert Tracing-/Security-Import und die Property-Auswertung der Beans.
 */
class StaticServerAppWiringTest {

    private final StaticServerBeans beans = new StaticServerBeans();

    @Test
    void shouldImportSharedConfigs() {
        Import importAnnotation = StaticServerApp.class.getAnnotation(Import.class);
        assertNotNull(importAnnotation);
        assertArrayEquals(new Class<?>[] {LoggingConfig.class, SecurityConfig.class}, importAnnotation.value());
    }

    @Test
    void commaSeparatedRootsKeepOrder() {
        HandlerConfig config = beans.handlerConfig("/srv/a, /srv/b", 60_000L, true);

        assertEquals(List.of(Path.of("/srv/a"), Path.of("/srv/b")), config.roots());
        assertEquals(60_000L, config.maxAgeMillis());
        assertTrue(config.cacheEnabled());
    }

    @Test
    void emptyRootsFallBackToWorkingDirectory() {
        HandlerConfig config = beans.handlerConfig("", HandlerConfig.DEFAULT_MAX_AGE_MS, false);

        assertEquals(1, config.roots().size());
        assertFalse(config.cacheEnabled());
    }

    @Test
    void requestOptionsCarryPrefixAndNocache() {
        RequestOptions options = beans.requestOptions("site:", true);

        assertEquals("site:/a.css", options.cacheKey("/a.css"));
        assertTrue(options.nocache());
    }
}
