package com.simpla.reconciliation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

public final class ReconciledTitulo {
    private final String numero;
    private final String nombre;
    private final List<ReconciledArticle> articulos;
    private final List<ReconciledCapitulo> capitulos;

    public ReconciledTitulo(String numero, String nombre,
                            List<ReconciledArticle> articulos, List<ReconciledCapitulo> capitulos) {
        this.numero = numero;
        this.nombre = nombre;
        this.articulos = Collections.unmodifiableList(articulos);
        this.capitulos = Collections.unmodifiableList(capitulos);
    }

    @JsonProperty("numero")
    public String getNumero() {
        return numero;
    }

    @JsonProperty("nombre")
    public String getNombre() {
        return nombre;
    }

    @JsonProperty("articulos")
    public List<ReconciledArticle> getArticulos() {
        return articulos;
    }

    @JsonProperty("capitulos")
    public List<ReconciledCapitulo> getCapitulos() {
        return capitulos;
    }
}
