package com.simpla.reconciliation.engine;

public enum DiagnosticType {
    /** No rule could determine which article or chapter the operation targets. */
    UNRESOLVED_TARGET(true),
    /** Chapter repeal against a chapter with no enumerable articles and no override. */
    UNRESOLVED_CHAPTER(true),
    /** Verb outside substitute / incorporate / repeal, or a non-repeal chapter operation. */
    UNSUPPORTED_ACTION(true),
    /** Substitution or repeal of an article the statute does not contain. */
    UNKNOWN_ARTICLE(true),
    /** Explicit target and replacement text disagree; the operation is still applied. */
    TARGET_MISMATCH(false),
    /** Article that cannot be attached to any título of the statute. */
    UNPLACED_ARTICLE(true);

    private final boolean skipsOperation;

    DiagnosticType(boolean skipsOperation) {
        this.skipsOperation = skipsOperation;
    }

    public boolean skipsOperation() {
        return skipsOperation;
    }
}
