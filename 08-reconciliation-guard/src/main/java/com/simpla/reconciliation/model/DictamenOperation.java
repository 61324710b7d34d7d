package com.simpla.reconciliation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One amendment detected in a dictamen by the extraction collaborator.
 * Read-only for the engine.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DictamenOperation {
    @JsonProperty("dictamen_articulo")
    private String dictamenArticulo;

    @JsonProperty("encabezado")
    private String encabezado;

    @JsonProperty("accion")
    private String accion;

    @JsonProperty("ley_numero")
    private String leyNumero;

    @JsonProperty("destino_articulo")
    private String destinoArticulo;

    @JsonProperty("destino_inciso")
    private String destinoInciso;

    // parent article when destino_inciso applies
    @JsonProperty("destino_articulo_padre")
    private String destinoArticuloPadre;

    @JsonProperty("destino_capitulo")
    private String destinoCapitulo;

    @JsonProperty("texto_nuevo")
    private String textoNuevo;

    public DictamenOperation() {}

    public DictamenOperation(String dictamenArticulo, String accion) {
        this.dictamenArticulo = dictamenArticulo;
        this.accion = accion;
    }

    /**
     * Parsed {@link #getAccion()}, or null when the verb is not supported.
     */
    @JsonIgnore
    public AmendmentAction getAction() {
        return AmendmentAction.fromVerb(accion);
    }

    // Getters and setters
    public String getDictamenArticulo() {
        return dictamenArticulo;
    }

    public void setDictamenArticulo(String dictamenArticulo) {
        this.dictamenArticulo = dictamenArticulo;
    }

    public String getEncabezado() {
        return encabezado;
    }

    public void setEncabezado(String encabezado) {
        this.encabezado = encabezado;
    }

    public String getAccion() {
        return accion;
    }

    public void setAccion(String accion) {
        this.accion = accion;
    }

    public String getLeyNumero() {
        return leyNumero;
    }

    public void setLeyNumero(String leyNumero) {
        this.leyNumero = leyNumero;
    }

    public String getDestinoArticulo() {
        return destinoArticulo;
    }

    public void setDestinoArticulo(String destinoArticulo) {
        this.destinoArticulo = destinoArticulo;
    }

    public String getDestinoInciso() {
        return destinoInciso;
    }

    public void setDestinoInciso(String destinoInciso) {
        this.destinoInciso = destinoInciso;
    }

    public String getDestinoArticuloPadre() {
        return destinoArticuloPadre;
    }

    public void setDestinoArticuloPadre(String destinoArticuloPadre) {
        this.destinoArticuloPadre = destinoArticuloPadre;
    }

    public String getDestinoCapitulo() {
        return destinoCapitulo;
    }

    public void setDestinoCapitulo(String destinoCapitulo) {
        this.destinoCapitulo = destinoCapitulo;
    }

    public String getTextoNuevo() {
        return textoNuevo;
    }

    public void setTextoNuevo(String textoNuevo) {
        this.textoNuevo = textoNuevo;
    }
}
