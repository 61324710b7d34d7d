package com.simpla.reconciliation;

import com.simpla.reconciliation.config.ReconciliationProperties;
import com.simpla.reconciliation.engine.ChapterOverride;
import com.simpla.reconciliation.engine.ChapterOverrideLoader;
import com.simpla.reconciliation.engine.ReconciliationEngine;
import com.simpla.reconciliation.processor.ReconciliationProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;

/**
 * Spring Boot Application for Reconciliation Guard REST API.
 * This provides an HTTP REST interface alongside the gRPC service.
 * Both use the same ReconciliationProcessor for business logic.
 */
@SpringBootApplication
@EnableConfigurationProperties(ReconciliationProperties.class)
public class ReconciliationApplication {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationApplication.class);

    @Bean
    public ReconciliationEngine reconciliationEngine(ReconciliationProperties properties, ResourceLoader resourceLoader)
            throws IOException {
        List<ChapterOverride> overrides = loadOverrides(resourceLoader.getResource(properties.getChapterOverridesLocation()));
        log.info("Reconciliation engine configured with policy {} and {} chapter overrides from {}",
                properties.getTargetConflictPolicy(), overrides.size(), properties.getChapterOverridesLocation());
        return new ReconciliationEngine(properties.getTargetConflictPolicy(), overrides);
    }

    /**
     * Configure ReconciliationProcessor as a singleton bean
     */
    @Bean
    public ReconciliationProcessor reconciliationProcessor(ReconciliationEngine engine) {
        return new ReconciliationProcessor(engine);
    }

    private static List<ChapterOverride> loadOverrides(Resource resource) throws IOException {
        if (!resource.exists()) {
            log.warn("Chapter overrides not found at {}, continuing without overrides", resource.getDescription());
            return Collections.emptyList();
        }
        try (InputStream in = resource.getInputStream()) {
            return ChapterOverrideLoader.load(in);
        }
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(ReconciliationApplication.class);
        // Ensure port 8092 is used
        app.setDefaultProperties(Collections.singletonMap("server.port", "8092"));
        app.run(args);
    }
}
