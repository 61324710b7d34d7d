package com.simpla.reconciliation.processor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.simpla.reconciliation.dto.ReconcileResponseDTO;
import com.simpla.reconciliation.engine.ChapterOverride;
import com.simpla.reconciliation.engine.ChapterOverrideLoader;
import com.simpla.reconciliation.engine.MalformedInputException;
import com.simpla.reconciliation.engine.ReconciliationEngine;
import com.simpla.reconciliation.engine.ReconciliationResult;
import com.simpla.reconciliation.engine.TargetConflictPolicy;
import com.simpla.reconciliation.model.DictamenOperation;
import com.simpla.reconciliation.model.Ley;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Paths;
import java.util.List;

/**
 * Core business logic for statute/dictamen reconciliation.
 * This class is transport-agnostic and can be used by gRPC, REST, or any other interface.
 */
public class ReconciliationProcessor {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationProcessor.class);

    private static final TypeReference<List<DictamenOperation>> OPERATIONS = new TypeReference<List<DictamenOperation>>() {
    };

    private final ReconciliationEngine engine;
    private final ObjectMapper objectMapper;

    /**
     * Builds the engine from the environment, for the standalone gRPC server.
     */
    public ReconciliationProcessor() {
        this(initializeEngine());
    }

    public ReconciliationProcessor(ReconciliationEngine engine) {
        this.engine = engine;
        this.objectMapper = initializeObjectMapper();

        log.info("ReconciliationProcessor initialized");
    }

    private static ReconciliationEngine initializeEngine() {
        TargetConflictPolicy policy = TargetConflictPolicy.valueOf(
                getEnvOrDefault("RECONCILIATION_CONFLICT_POLICY", TargetConflictPolicy.PREFER_EXPLICIT.name()));
        String overridesPath = getEnvOrDefault("RECONCILIATION_CHAPTER_OVERRIDES", null);

        try {
            List<ChapterOverride> overrides = overridesPath != null
                    ? ChapterOverrideLoader.load(Paths.get(overridesPath))
                    : ChapterOverrideLoader.loadDefault();
            log.info("Reconciliation engine configured with policy {} and {} chapter overrides", policy, overrides.size());
            return new ReconciliationEngine(policy, overrides);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load chapter overrides", e);
        }
    }

    private static ObjectMapper initializeObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());

        // Serialize dates as ISO strings instead of arrays
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    private static String getEnvOrDefault(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Reconcile the statute and dictamen carried by a request document
     */
    public ReconcileResponseDTO processReconcile(String jsonData) {
        log.info("Processing reconcile request with data length: {}", jsonData != null ? jsonData.length() : 0);

        try {
            ReconciliationResult result = reconcile(jsonData);
            String resultJson = objectMapper.writeValueAsString(result);

            String message = String.format("Ley %s reconciled: %d sustituciones, %d incorporaciones, %d derogaciones, %d operaciones omitidas",
                    result.getLey().getNumero(),
                    result.getMetadatos().getTotalSustituciones(),
                    result.getMetadatos().getTotalIncorporaciones(),
                    result.getMetadatos().getTotalDerogaciones(),
                    result.getMetadatos().getOperacionesOmitidas());

            return new ReconcileResponseDTO(true, message, resultJson);

        } catch (MalformedInputException e) {
            log.warn("Rejected reconcile request: {}", e.getMessage());
            return ReconcileResponseDTO.malformed(e.getMessage());
        } catch (Exception e) {
            log.error("Error reconciling ley", e);
            return new ReconcileResponseDTO(false, "Error reconciling ley: " + e.getMessage(), null);
        }
    }

    /**
     * Parses a {@code {"ley": ..., "dictamen": [...]}} document and runs the engine on it.
     */
    public ReconciliationResult reconcile(String jsonData) throws MalformedInputException {
        if (jsonData == null || jsonData.isBlank()) {
            throw new MalformedInputException("Invalid data format: empty request");
        }

        JsonNode rootNode;
        try {
            rootNode = objectMapper.readTree(jsonData);
        } catch (JsonProcessingException e) {
            throw new MalformedInputException("Invalid data format: " + e.getOriginalMessage());
        }

        JsonNode leyNode = rootNode.path("ley");
        if (!leyNode.isObject()) {
            throw new MalformedInputException("Invalid data format: 'ley' field not found");
        }
        JsonNode dictamenNode = rootNode.path("dictamen");
        if (!dictamenNode.isArray()) {
            throw new MalformedInputException("Invalid data format: 'dictamen' field not found");
        }

        Ley ley;
        List<DictamenOperation> dictamen;
        try {
            ley = objectMapper.treeToValue(leyNode, Ley.class);
            dictamen = objectMapper.convertValue(dictamenNode, OPERATIONS);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedInputException("Invalid data format: " + e.getMessage());
        }

        return engine.reconcile(ley, dictamen);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
