package com.helmsman.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.helmsman.core.catalog.CatalogLoadException;
import com.helmsman.core.catalog.PatternCatalog;
import com.helmsman.core.catalog.PatternCatalogLoader;
import com.helmsman.core.engine.IdGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.UUID;

/**
 * Wires the immutable pattern catalog and the id/clock collaborators of the
 * processing core.
 */
@Configuration
public class CoreConfig {

    @Bean
    public PatternCatalogLoader patternCatalogLoader(ObjectMapper objectMapper) {
        return new PatternCatalogLoader(objectMapper);
    }

    /**
     * Loads the catalog once at startup. A missing or malformed catalog aborts
     * the context rather than running with an empty rule set.
     */
    @Bean
    public PatternCatalog patternCatalog(PatternCatalogLoader loader,
                                         ProcessingProperties properties,
                                         ResourceLoader resourceLoader) {
        String location = properties.getCatalogLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CatalogLoadException("Pattern catalog not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return loader.load(in, location);
        } catch (IOException e) {
            throw new CatalogLoadException("Cannot open pattern catalog " + location, e);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public IdGenerator idGenerator() {
        return () -> UUID.randomUUID().toString();
    }
}
