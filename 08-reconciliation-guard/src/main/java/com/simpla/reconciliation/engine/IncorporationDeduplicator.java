package com.simpla.reconciliation.engine;

import com.simpla.reconciliation.identifier.ArticleIdentifier;

/**
 * Decides whether an incorporation adds a new article or restates one the statute
 * already has. The latter is merged like a substitution so the view never shows the
 * same article twice.
 */
public class IncorporationDeduplicator {

    /**
     * @return true when {@code target} matches no article of the statute exactly
     */
    public boolean isGenuinelyNew(ArticleIdentifier target, StatuteIndex index) {
        return !index.contains(target);
    }
}
