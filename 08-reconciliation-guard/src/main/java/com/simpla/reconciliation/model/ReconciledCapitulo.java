package com.simpla.reconciliation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ReconciledCapitulo {
    private final String numero;
    private final String nombre;
    private final ArticleStatus estado;
    private final List<ReconciledArticle> articulos;

    /**
     * @param estado {@link ArticleStatus#REPEALED} when the whole chapter was repealed, otherwise null
     */
    public ReconciledCapitulo(String numero, String nombre, ArticleStatus estado, List<ReconciledArticle> articulos) {
        this.numero = numero;
        this.nombre = nombre;
        this.estado = estado;
        this.articulos = Collections.unmodifiableList(articulos);
    }

    @JsonProperty("numero")
    public String getNumero() {
        return numero;
    }

    @JsonProperty("nombre")
    public String getNombre() {
        return nombre;
    }

    @JsonProperty("estado")
    public ArticleStatus getEstado() {
        return estado;
    }

    @JsonProperty("articulos")
    public List<ReconciledArticle> getArticulos() {
        return articulos;
    }
}
