package com.simpla.reconciliation.engine;

import com.simpla.reconciliation.model.Inciso;

import java.util.Collections;
import java.util.List;

/**
 * Replacement text of an operation split into its parts.
 */
public final class ParsedReplacement {
    private final String title;
    private final String body;
    private final List<Inciso> incisos;
    private final String firstLine;

    ParsedReplacement(String title, String body, List<Inciso> incisos, String firstLine) {
        this.title = title;
        this.body = body;
        this.incisos = Collections.unmodifiableList(incisos);
        this.firstLine = firstLine;
    }

    /**
     * Short heading ("Ámbito de aplicación."), null when the text has none.
     */
    public String getTitle() {
        return title;
    }

    public String getBody() {
        return body;
    }

    public List<Inciso> getIncisos() {
        return incisos;
    }

    /**
     * First line after the article prefix, used as display title of new articles.
     */
    public String getFirstLine() {
        return firstLine;
    }
}
