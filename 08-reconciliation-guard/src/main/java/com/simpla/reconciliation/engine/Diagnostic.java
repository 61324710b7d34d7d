package com.simpla.reconciliation.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-operation finding reported alongside a reconciliation result.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Diagnostic {
    private final DiagnosticType tipo;
    private final int indiceOperacion;
    private final String dictamenArticulo;
    private final String objetivo;
    private final String mensaje;

    public Diagnostic(DiagnosticType tipo, int indiceOperacion, String dictamenArticulo, String objetivo, String mensaje) {
        this.tipo = tipo;
        this.indiceOperacion = indiceOperacion;
        this.dictamenArticulo = dictamenArticulo;
        this.objetivo = objetivo;
        this.mensaje = mensaje;
    }

    @JsonProperty("tipo")
    public DiagnosticType getTipo() {
        return tipo;
    }

    /**
     * Position of the operation in the dictamen list (0-based).
     */
    @JsonProperty("indice_operacion")
    public int getIndiceOperacion() {
        return indiceOperacion;
    }

    @JsonProperty("dictamen_articulo")
    public String getDictamenArticulo() {
        return dictamenArticulo;
    }

    @JsonProperty("objetivo")
    public String getObjetivo() {
        return objetivo;
    }

    @JsonProperty("mensaje")
    public String getMensaje() {
        return mensaje;
    }

    @Override
    public String toString() {
        return tipo + " [op " + indiceOperacion + ", dictamen art. " + dictamenArticulo + "]: " + mensaje;
    }
}
