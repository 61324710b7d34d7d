package com.simpla.reconciliation.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ArticleStatus {
    UNCHANGED("sin_cambios"),
    SUBSTITUTED("sustituido"),
    INCORPORATED("incorporado"),
    REPEALED("derogado");

    private final String estado;

    ArticleStatus(String estado) {
        this.estado = estado;
    }

    @JsonValue
    public String getEstado() {
        return estado;
    }
}
