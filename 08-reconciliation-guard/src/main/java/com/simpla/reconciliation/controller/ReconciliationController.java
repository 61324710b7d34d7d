package com.simpla.reconciliation.controller;

import com.simpla.reconciliation.dto.ReconcileResponseDTO;
import com.simpla.reconciliation.processor.ReconciliationProcessor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API Controller for statute/dictamen reconciliation.
 * Delegates all business logic to ReconciliationProcessor.
 */
@RestController
@RequestMapping("/api/v1/reconciliation")
public class ReconciliationController {

    private final ReconciliationProcessor processor;

    public ReconciliationController(ReconciliationProcessor processor) {
        this.processor = processor;
    }

    /**
     * Reconcile a statute against a dictamen
     * POST /api/v1/reconciliation/reconcile
     *
     * Request body: {"ley": {...}, "dictamen": [...]}
     * Response: ReconcileResponseDTO with the reconciled view JSON
     */
    @PostMapping("/reconcile")
    public ResponseEntity<ReconcileResponseDTO> reconcile(@RequestBody String jsonData) {
        try {
            ReconcileResponseDTO response = processor.processReconcile(jsonData);

            if (response.isSuccess()) {
                return ResponseEntity.ok(response);
            } else if (response.isMalformedInput()) {
                return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
            } else {
                return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
            }
        } catch (Exception e) {
            ReconcileResponseDTO errorResponse = new ReconcileResponseDTO(
                false,
                "Error processing reconcile request: " + e.getMessage(),
                null
            );
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
        }
    }

    /**
     * Health check endpoint
     * GET /api/v1/reconciliation/health
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Reconciliation service is healthy");
    }
}
