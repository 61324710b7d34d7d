package com.simpla.reconciliation.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

public final class ReconciliationMetadata {
    private final int totalSustituciones;
    private final int totalIncorporaciones;
    private final int totalDerogaciones;
    private final int totalSinCambios;
    private final List<String> capitulosDerogados;
    private final int operacionesOmitidas;
    private final LocalDateTime generadoEn;

    public ReconciliationMetadata(int totalSustituciones, int totalIncorporaciones, int totalDerogaciones,
                                  int totalSinCambios, List<String> capitulosDerogados,
                                  int operacionesOmitidas, LocalDateTime generadoEn) {
        this.totalSustituciones = totalSustituciones;
        this.totalIncorporaciones = totalIncorporaciones;
        this.totalDerogaciones = totalDerogaciones;
        this.totalSinCambios = totalSinCambios;
        this.capitulosDerogados = Collections.unmodifiableList(capitulosDerogados);
        this.operacionesOmitidas = operacionesOmitidas;
        this.generadoEn = generadoEn;
    }

    @JsonProperty("total_sustituciones")
    public int getTotalSustituciones() {
        return totalSustituciones;
    }

    @JsonProperty("total_incorporaciones")
    public int getTotalIncorporaciones() {
        return totalIncorporaciones;
    }

    @JsonProperty("total_derogaciones")
    public int getTotalDerogaciones() {
        return totalDerogaciones;
    }

    @JsonProperty("total_sin_cambios")
    public int getTotalSinCambios() {
        return totalSinCambios;
    }

    @JsonProperty("capitulos_derogados")
    public List<String> getCapitulosDerogados() {
        return capitulosDerogados;
    }

    @JsonProperty("operaciones_omitidas")
    public int getOperacionesOmitidas() {
        return operacionesOmitidas;
    }

    @JsonProperty("generado_en")
    public LocalDateTime getGeneradoEn() {
        return generadoEn;
    }
}
