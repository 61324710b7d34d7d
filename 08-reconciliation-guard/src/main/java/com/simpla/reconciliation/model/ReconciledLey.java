package com.simpla.reconciliation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Statute shell with every article annotated. Mirrors the shape of {@link Ley}.
 */
public final class ReconciledLey {
    private final String numero;
    private final String nombre;
    private final List<ReconciledTitulo> titulos;

    public ReconciledLey(String numero, String nombre, List<ReconciledTitulo> titulos) {
        this.numero = numero;
        this.nombre = nombre;
        this.titulos = Collections.unmodifiableList(titulos);
    }

    @JsonProperty("numero")
    public String getNumero() {
        return numero;
    }

    @JsonProperty("nombre")
    public String getNombre() {
        return nombre;
    }

    @JsonProperty("titulos")
    public List<ReconciledTitulo> getTitulos() {
        return titulos;
    }

    /**
     * Every reconciled article in rendering order: per título, direct articles first,
     * then each chapter.
     */
    @JsonIgnore
    public List<ReconciledArticle> allArticles() {
        List<ReconciledArticle> all = new ArrayList<>();
        for (ReconciledTitulo titulo : titulos) {
            all.addAll(titulo.getArticulos());
            for (ReconciledCapitulo capitulo : titulo.getCapitulos()) {
                all.addAll(capitulo.getArticulos());
            }
        }
        return all;
    }

    /**
     * Substitutions of this view exported as operations, in rendering order.
     */
    @JsonIgnore
    public List<DictamenOperation> substitutionsAsOperations() {
        List<DictamenOperation> operations = new ArrayList<>();
        for (ReconciledArticle article : allArticles()) {
            if (article.getEstado() == ArticleStatus.SUBSTITUTED) {
                operations.add(article.toOperation());
            }
        }
        return operations;
    }
}
