package com.simpla.reconciliation.engine;

/**
 * Which article number wins when an operation's explicit {@code destino_articulo}
 * disagrees with the number restated at the start of its replacement text.
 */
public enum TargetConflictPolicy {
    PREFER_EXPLICIT,
    PREFER_REPLACEMENT_TEXT
}
