package com.prism.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

/**
 * Loads the column catalog and source-view registry at startup.
 * The resulting {@link Catalog} is immutable and shared by every planner component.
 */
@Configuration
public class CatalogConfig {
    private static final Logger logger = LoggerFactory.getLogger(CatalogConfig.class);

    @Value("${prism.catalog.location:classpath:catalog/log-types.json}")
    private Resource catalogLocation;

    @Bean
    public Catalog catalog(ObjectMapper objectMapper) {
        Catalog catalog = new CatalogLoader(objectMapper).load(catalogLocation);
        new CatalogValidator().validate(catalog);
        logger.info("Catalog validated: {}", catalog.getLogTypes().stream().map(LogTypeCatalog::getId).toList());
        return catalog;
    }
}
