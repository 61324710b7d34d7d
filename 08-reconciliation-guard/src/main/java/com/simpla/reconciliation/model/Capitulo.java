package com.simpla.reconciliation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class Capitulo {
    @JsonProperty("numero")
    private String numero;

    @JsonProperty("nombre")
    private String nombre;

    @JsonProperty("articulos")
    private List<Article> articulos = new ArrayList<>();

    public Capitulo() {}

    public Capitulo(String numero, String nombre) {
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
}
