package com.simpla.reconciliation.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.simpla.reconciliation.model.Article;

import java.util.ArrayList;
import java.util.List;

/**
 * Manually supplied content of a chapter whose articles the statute source omits from
 * its structured form (typically chapters made only of unnumbered articles). Used only
 * when a chapter repeal cannot be enumerated from the statute itself. Each override
 * must say why it exists in {@code motivo}.
 */
public class ChapterOverride {
    @JsonProperty("capitulo")
    private String capitulo;

    @JsonProperty("titulo")
    private String titulo;

    @JsonProperty("nombre")
    private String nombre;

    @JsonProperty("motivo")
    private String motivo;

    @JsonProperty("articulos")
    private List<Article> articulos = new ArrayList<>();

    public ChapterOverride() {}

    public ChapterOverride(String capitulo, String titulo, String nombre, String motivo) {
        this.capitulo = capitulo;
        this.titulo = titulo;
        this.nombre = nombre;
        this.motivo = motivo;
    }

    public String getCapitulo() {
        return capitulo;
    }

    public void setCapitulo(String capitulo) {
        this.capitulo = capitulo;
    }

    /**
     * Número of the título the chapter belongs to; used when the chapter is absent from the statute.
     */
    public String getTitulo() {
        return titulo;
    }

    public void setTitulo(String titulo) {
        this.titulo = titulo;
    }

    public String getNombre() {
        return nombre;
    }

    public void setNombre(String nombre) {
        this.nombre = nombre;
    }

    public String getMotivo() {
        return motivo;
    }

    public void setMotivo(String motivo) {
        this.motivo = motivo;
    }

    /**
     * Literal texts of the chapter's articles in document order.
     */
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
