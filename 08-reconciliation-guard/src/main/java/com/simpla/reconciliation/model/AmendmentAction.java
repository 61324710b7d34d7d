package com.simpla.reconciliation.model;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Operations a dictamen can perform on an article.
 */
public enum AmendmentAction {
    SUBSTITUTE("sustitúyese", "sustituyese", "substitute"),
    INCORPORATE("incorpórase", "incorporase", "incorporate"),
    REPEAL("derógase", "derogase", "repeal");

    private final String verb;
    private final String[] aliases;

    AmendmentAction(String verb, String... aliases) {
        this.verb = verb;
        this.aliases = aliases;
    }

    /**
     * Spanish verb as printed in dictámenes.
     */
    public String getVerb() {
        return verb;
    }

    /**
     * Maps the {@code accion} field of an operation record to an action, ignoring case
     * and accents. Returns null for verbs outside the supported vocabulary
     * (modifícase, créase, ...).
     */
    public static AmendmentAction fromVerb(String accion) {
        if (accion == null || accion.isBlank()) {
            return null;
        }
        String normalized = stripAccents(accion.trim().toLowerCase(Locale.ROOT));
        for (AmendmentAction action : values()) {
            for (String alias : action.aliases) {
                if (alias.equals(normalized)) {
                    return action;
                }
            }
        }
        return null;
    }

    private static String stripAccents(String value) {
        return Normalizer.normalize(value, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
    }
}
