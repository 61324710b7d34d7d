package com.simpla.reconciliation.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * DTO for reconcile operation response.
 * Transport-agnostic response that can be used by gRPC, REST, or any other interface.
 */
public class ReconcileResponseDTO {
    private final boolean success;
    private final String message;
    private final String resultJson;
    private final boolean malformedInput;

    public ReconcileResponseDTO(boolean success, String message, String resultJson) {
        this(success, message, resultJson, false);
    }

    private ReconcileResponseDTO(boolean success, String message, String resultJson, boolean malformedInput) {
        this.success = success;
        this.message = message;
        this.resultJson = resultJson;
        this.malformedInput = malformedInput;
    }

    public static ReconcileResponseDTO malformed(String message) {
        return new ReconcileResponseDTO(false, message, null, true);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    public String getResultJson() {
        return resultJson;
    }

    /**
     * True when the request was rejected because of its shape rather than a processing failure.
     */
    @JsonIgnore
    public boolean isMalformedInput() {
        return malformedInput;
    }
}
