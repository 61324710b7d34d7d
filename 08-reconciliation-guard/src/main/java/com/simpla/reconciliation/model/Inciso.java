package com.simpla.reconciliation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public class Inciso {
    @JsonProperty("letra")
    private String letra;

    @JsonProperty("texto")
    private String texto;

    public Inciso() {}

    public Inciso(String letra, String texto) {
        this.letra = letra;
        this.texto = texto;
    }

    public String getLetra() {
        return letra;
    }

    public void setLetra(String letra) {
        this.letra = letra;
    }

    public String getTexto() {
        return texto;
    }

    public void setTexto(String texto) {
        this.texto = texto;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Inciso)) {
            return false;
        }
        Inciso inciso = (Inciso) o;
        return Objects.equals(letra, inciso.letra) && Objects.equals(texto, inciso.texto);
    }

    @Override
    public int hashCode() {
        return Objects.hash(letra, texto);
    }

    @Override
    public String toString() {
        return letra + ") " + texto;
    }
}
