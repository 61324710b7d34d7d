package com.simpla.reconciliation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.simpla.reconciliation.identifier.ArticleIdentifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Article of the reconciled view: original content from the statute next to the
 * content proposed by the dictamen. Amended fields are only set when the status is
 * {@link ArticleStatus#SUBSTITUTED} or {@link ArticleStatus#INCORPORATED}.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ReconciledArticle {
    private final ArticleIdentifier identifier;
    private final String tituloOriginal;
    private final String textoOriginal;
    private final List<Inciso> incisosOriginales;
    private final String tituloNuevo;
    private final String textoNuevo;
    private final List<Inciso> incisosNuevos;
    private final ArticleStatus estado;
    private final String accion;
    private final List<String> dictamenArticulos;
    private final String tituloNumero;
    private final String capituloNumero;

    private ReconciledArticle(Builder builder) {
        this.identifier = builder.identifier;
        this.tituloOriginal = builder.tituloOriginal;
        this.textoOriginal = builder.textoOriginal;
        this.incisosOriginales = copy(builder.incisosOriginales);
        this.tituloNuevo = builder.tituloNuevo;
        this.textoNuevo = builder.textoNuevo;
        this.incisosNuevos = copy(builder.incisosNuevos);
        this.estado = builder.estado;
        this.accion = builder.accion;
        this.dictamenArticulos = Collections.unmodifiableList(new ArrayList<>(builder.dictamenArticulos));
        this.tituloNumero = builder.tituloNumero;
        this.capituloNumero = builder.capituloNumero;
    }

    private static List<Inciso> copy(List<Inciso> incisos) {
        if (incisos == null) {
            return Collections.emptyList();
        }
        List<Inciso> copies = new ArrayList<>();
        for (Inciso inciso : incisos) {
            copies.add(new Inciso(inciso.getLetra(), inciso.getTexto()));
        }
        return Collections.unmodifiableList(copies);
    }

    public static Builder builder(ArticleIdentifier identifier) {
        return new Builder(identifier);
    }

    /**
     * Rebuilds a substitute operation whose replacement text restates this article's
     * amended content, e.g. to feed a previous reconciliation back as a dictamen.
     */
    public DictamenOperation toOperation() {
        if (estado != ArticleStatus.SUBSTITUTED) {
            throw new IllegalStateException("Only substituted articles can be exported, " + getNumero() + " is " + estado.getEstado());
        }
        StringBuilder text = new StringBuilder("ARTÍCULO ").append(getNumero()).append("- ");
        if (tituloNuevo != null && !tituloNuevo.isBlank()) {
            text.append(tituloNuevo.endsWith(".") ? tituloNuevo : tituloNuevo + ".").append(' ');
        }
        if (textoNuevo != null) {
            text.append(textoNuevo);
        }
        for (Inciso inciso : incisosNuevos) {
            text.append('\n').append(inciso.getLetra()).append(") ").append(inciso.getTexto());
        }

        DictamenOperation operation = new DictamenOperation(
                dictamenArticulos.isEmpty() ? null : dictamenArticulos.get(dictamenArticulos.size() - 1),
                AmendmentAction.SUBSTITUTE.getVerb());
        operation.setDestinoArticulo(getNumero());
        operation.setTextoNuevo(text.toString());
        return operation;
    }

    @JsonIgnore
    public ArticleIdentifier getIdentifier() {
        return identifier;
    }

    @JsonProperty("numero")
    public String getNumero() {
        return identifier.label();
    }

    @JsonProperty("sintetico")
    public boolean isSintetico() {
        return identifier.isSynthetic();
    }

    @JsonProperty("titulo_original")
    public String getTituloOriginal() {
        return tituloOriginal;
    }

    @JsonProperty("texto_original")
    public String getTextoOriginal() {
        return textoOriginal;
    }

    @JsonProperty("incisos_originales")
    public List<Inciso> getIncisosOriginales() {
        return incisosOriginales;
    }

    @JsonProperty("titulo_nuevo")
    public String getTituloNuevo() {
        return tituloNuevo;
    }

    @JsonProperty("texto_nuevo")
    public String getTextoNuevo() {
        return textoNuevo;
    }

    @JsonProperty("incisos_nuevos")
    public List<Inciso> getIncisosNuevos() {
        return incisosNuevos;
    }

    @JsonProperty("estado")
    public ArticleStatus getEstado() {
        return estado;
    }

    @JsonProperty("accion")
    public String getAccion() {
        return accion;
    }

    @JsonProperty("dictamen_articulos")
    public List<String> getDictamenArticulos() {
        return dictamenArticulos;
    }

    @JsonProperty("titulo_numero")
    public String getTituloNumero() {
        return tituloNumero;
    }

    @JsonProperty("capitulo_numero")
    public String getCapituloNumero() {
        return capituloNumero;
    }

    @JsonIgnore
    public boolean hasAmendedContent() {
        return tituloNuevo != null || textoNuevo != null || !incisosNuevos.isEmpty();
    }

    public static final class Builder {
        private final ArticleIdentifier identifier;
        private String tituloOriginal;
        private String textoOriginal;
        private List<Inciso> incisosOriginales;
        private String tituloNuevo;
        private String textoNuevo;
        private List<Inciso> incisosNuevos;
        private ArticleStatus estado = ArticleStatus.UNCHANGED;
        private String accion;
        private final List<String> dictamenArticulos = new ArrayList<>();
        private String tituloNumero;
        private String capituloNumero;

        private Builder(ArticleIdentifier identifier) {
            if (identifier == null) {
                throw new IllegalArgumentException("Reconciled article needs an identifier");
            }
            this.identifier = identifier;
        }

        public Builder original(String titulo, String texto, List<Inciso> incisos) {
            this.tituloOriginal = titulo;
            this.textoOriginal = texto;
            this.incisosOriginales = incisos;
            return this;
        }

        public Builder amended(String titulo, String texto, List<Inciso> incisos) {
            this.tituloNuevo = titulo;
            this.textoNuevo = texto;
            this.incisosNuevos = incisos;
            return this;
        }

        public Builder estado(ArticleStatus estado) {
            this.estado = estado;
            return this;
        }

        public Builder accion(String accion) {
            this.accion = accion;
            return this;
        }

        public Builder dictamenArticulos(List<String> dictamenArticulos) {
            this.dictamenArticulos.clear();
            this.dictamenArticulos.addAll(dictamenArticulos);
            return this;
        }

        public Builder placement(String tituloNumero, String capituloNumero) {
            this.tituloNumero = tituloNumero;
            this.capituloNumero = capituloNumero;
            return this;
        }

        public ReconciledArticle build() {
            return new ReconciledArticle(this);
        }
    }
}
