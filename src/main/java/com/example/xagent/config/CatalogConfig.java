package com.example.xagent.config;

import com.example.xagent.repository.DomainDefinitionRepository;
import com.example.xagent.service.HandlerCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CatalogConfig {

    /**
     * The process-wide handler catalog, scanned once before anything can ask it for a handler.
     */
    @Bean
    public HandlerCatalog handlerCatalog(DomainDefinitionRepository repository) {
        HandlerCatalog catalog = new HandlerCatalog(repository);
        catalog.scan();
        return catalog;
    }
}
