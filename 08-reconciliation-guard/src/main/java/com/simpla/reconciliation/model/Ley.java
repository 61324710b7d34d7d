package com.simpla.reconciliation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Statute currently in force, structured as Título → Capítulo → Artículo → Inciso.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Ley {
    @JsonProperty("numero")
    private String numero;

    @JsonProperty("nombre")
    private String nombre;

    @JsonProperty("titulos")
    private List<Titulo> titulos;

    public Ley() {}

    public Ley(String numero, String nombre) {
        this.numero = numero;
        this.nombre = nombre;
        this.titulos = new ArrayList<>();
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

    /**
     * May be null when the source document lacks the field; the processor rejects that.
     */
    public List<Titulo> getTitulos() {
        return titulos;
    }

    public void setTitulos(List<Titulo> titulos) {
        this.titulos = titulos;
    }

    public void addTitulo(Titulo titulo) {
        if (this.titulos == null) {
            this.titulos = new ArrayList<>();
        }
        this.titulos.add(titulo);
    }
}
