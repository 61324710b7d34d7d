package com.simpla.reconciliation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Article of the statute as loaded from the legal-information source.
 * {@code numero} may be blank or "S/N" for articles printed without a number.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Article {
    @JsonProperty("numero")
    private String numero;

    @JsonProperty("titulo")
    private String titulo;

    @JsonProperty("texto")
    private String texto;

    @JsonProperty("incisos")
    private List<Inciso> incisos = new ArrayList<>();

    public Article() {}

    public Article(String numero, String titulo, String texto) {
        this.numero = numero;
        this.titulo = titulo;
        this.texto = texto;
    }

    // Getters and setters
    public String getNumero() {
        return numero;
    }

    public void setNumero(String numero) {
        this.numero = numero;
    }

    public String getTitulo() {
        return titulo;
    }

    public void setTitulo(String titulo) {
        this.titulo = titulo;
    }

    public String getTexto() {
        return texto;
    }

    public void setTexto(String texto) {
        this.texto = texto;
    }

    public List<Inciso> getIncisos() {
        return incisos;
    }

    public void setIncisos(List<Inciso> incisos) {
        this.incisos = incisos != null ? incisos : new ArrayList<>();
    }

    public void addInciso(Inciso inciso) {
        if (this.incisos == null) {
            this.incisos = new ArrayList<>();
        }
        this.incisos.add(inciso);
    }
}
