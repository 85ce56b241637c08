package de.htwsaar.ministatic.server;

import de.htwsaar.ministatic.core.HandlerConfig;
import de.htwsaar.ministatic.core.RequestOptions;
import de.htwsaar.ministatic.core.StaticFileHandler;
import de.htwsaar.ministatic.core.cache.CacheStore;
import de.htwsaar.ministatic.core.cache.InMemoryCacheStore;
import de.htwsaar.ministatic.core.mime.ContentTypeResolver;
import java.time.Clock;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Zentrale Spring-Verdrahtung des Static-Servers.
 *
 * <p>Schichtung: Controller → {@link StaticFileHandler} → Cache/Resolver/MIME</p>
 */
@Configuration
public class StaticServerBeans {

    private static final Logger log = LoggerFactory.getLogger(StaticServerBeans.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Unbegrenzter Response-Cache ohne TTL; Einträge verschwinden nur durch Invalidierung. */
    @Bean
    public CacheStore cacheStore() {
        return new InMemoryCacheStore();
    }

    @Bean
    public ContentTypeResolver contentTypeResolver() {
        return ContentTypeResolver.defaults();
    }

    /**
     * Handler-Konfiguration aus den Properties.
     *
     * @param roots        kommaseparierte Roots (leer = Arbeitsverzeichnis)
     * @param maxAgeMillis {@code max-age} in ms
     * @param cacheEnabled In-Memory-Cache an/aus
     * @return unveränderliche Konfiguration
     */
    @Bean
    public HandlerConfig handlerConfig(
            @Value("${ministatic.roots:}") String roots,
            @Value("${ministatic.max-age-ms:" + HandlerConfig.DEFAULT_MAX_AGE_MS + "}") long maxAgeMillis,
            @Value("${ministatic.cache.enabled:true}") boolean cacheEnabled) {

        HandlerConfig config = HandlerConfig.builder()
                .roots(Arrays.asList(StringUtils.commaDelimitedListToStringArray(roots)))
                .maxAge(Math.max(0, maxAgeMillis))
                .cache(cacheEnabled)
                .build();
        log.info("Serving {} (cache={}, maxAgeMs={})", config.roots(), config.cacheEnabled(), config.maxAgeMillis());
        return config;
    }

    /**
     * Optionen dieses Mount-Points; gelten für alle Requests des Servers.
     *
     * @param cachePrefix Präfix der Cache-Keys
     * @param nocache     erzwingt {@code no-cache}-Header
     * @return Request-Optionen
     */
    @Bean
    public RequestOptions requestOptions(
            @Value("${ministatic.cache-prefix:}") String cachePrefix,
            @Value("${ministatic.nocache:false}") boolean nocache) {
        return RequestOptions.defaults().withCachePrefix(cachePrefix).withNocache(nocache);
    }

    @Bean
    public StaticFileHandler staticFileHandler(
            HandlerConfig config, CacheStore cacheStore, ContentTypeResolver contentTypes, Clock clock) {
        return new StaticFileHandler(config, cacheStore, contentTypes, clock);
    }
}
