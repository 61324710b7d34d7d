package com.simpla.reconciliation.engine;

import com.simpla.reconciliation.identifier.ArticleIdentifier;
import com.simpla.reconciliation.model.Capitulo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Articles a chapter repeal applies to.
 */
public final class ChapterExpansion {

    public enum Outcome {
        /** Enumerated from the statute tree. */
        FROM_STATUTE,
        /** Enumerated from a manual chapter override. */
        FROM_OVERRIDE,
        /** Nothing to enumerate and no override. */
        UNRESOLVED,
        /** Override found, but neither its chapter nor its título exists in the statute. */
        UNPLACED
    }

    private final String chapter;
    private final Outcome outcome;
    private final List<Capitulo> chapters;
    private final List<ArticleIdentifier> identifiers;
    private final List<StatuteIndex.Entry> syntheticEntries;

    ChapterExpansion(String chapter, Outcome outcome, List<Capitulo> chapters,
                     List<ArticleIdentifier> identifiers, List<StatuteIndex.Entry> syntheticEntries) {
        this.chapter = chapter;
        this.outcome = outcome;
        this.chapters = Collections.unmodifiableList(new ArrayList<>(chapters));
        this.identifiers = Collections.unmodifiableList(new ArrayList<>(identifiers));
        this.syntheticEntries = Collections.unmodifiableList(new ArrayList<>(syntheticEntries));
    }

    static ChapterExpansion failed(String chapter, Outcome outcome) {
        return new ChapterExpansion(chapter, outcome, List.of(), List.of(), List.of());
    }

    public String getChapter() {
        return chapter;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isResolved() {
        return outcome == Outcome.FROM_STATUTE || outcome == Outcome.FROM_OVERRIDE;
    }

    /**
     * Repealed chapters; for an override of a chapter missing from the statute this is a new
     * chapter shell that the view appends to the override's título.
     */
    public List<Capitulo> getChapters() {
        return chapters;
    }

    /**
     * Identifiers in document order.
     */
    public List<ArticleIdentifier> getIdentifiers() {
        return identifiers;
    }

    /**
     * Entries built from an override; empty when the statute itself supplied the articles.
     */
    public List<StatuteIndex.Entry> getSyntheticEntries() {
        return syntheticEntries;
    }
}
