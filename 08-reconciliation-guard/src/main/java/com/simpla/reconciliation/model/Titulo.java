package com.simpla.reconciliation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Top level grouping of a statute. Holds either direct articles or chapters
 * (some sources mix both, so both lists are kept).
 */
public class Titulo {
    @JsonProperty("numero")
    private String numero;

    @JsonProperty("nombre")
    private String nombre;

    @JsonProperty("articulos")
    private List<Article> articulos = new ArrayList<>();

    @JsonProperty("capitulos")
    private List<Capitulo> capitulos = new ArrayList<>();

    public Titulo() {}

    public Titulo(String numero, String nombre) {
        this.numero = numero;
        this.nombre = nombre;
    }

    // Getters and setters
    public String getNumero() {
        return numero;
    }

    public void setNumero(String numero) {
        this.numero = numero;
    }

    public String getNombre() {
        return nombre;
    }

    public void setNombre(String nombre) {
        this.nombre = nombre;
    }

    public List<Article> getArticulos() {
        return articulos;
    }

    public void setArticulos(List<Article> articulos) {
        this.articulos = articulos != null ? articulos : new ArrayList<>();
    }

    public void addArticulo(Article article) {
        if (this.articulos == null) {
            this.articulos = new ArrayList<>();
        }
        this.articulos.add(article);
    }

    public List<Capitulo> getCapitulos() {
        return capitulos;
    }

    public void setCapitulos(List<Capitulo> capitulos) {
        this.capitulos = capitulos != null ? capitulos : new ArrayList<>();
    }

    public void addCapitulo(Capitulo capitulo) {
        if (this.capitulos == null) {
            this.capitulos = new ArrayList<>();
        }
        this.capitulos.add(capitulo);
    }
}
