package com.simpla.reconciliation.engine;

import com.simpla.reconciliation.identifier.ArticleIdentifier;

/**
 * What an operation points at: an article (optionally one of its incisos) or a whole chapter.
 */
public final class ResolvedTarget {

    public enum Rule {
        CHAPTER_FIELD,
        EXPLICIT_FIELD,
        REPLACEMENT_TEXT,
        HEADER_INCORPORATION,
        HEADER_INCISO,
        HEADER_VERB,
        HEADER_CITATION
    }

    private final ArticleIdentifier article;
    private final String chapter;
    private final String inciso;
    private final Rule rule;
    private final ArticleIdentifier discarded;

    private ResolvedTarget(ArticleIdentifier article, String chapter, String inciso, Rule rule, ArticleIdentifier discarded) {
        this.article = article;
        this.chapter = chapter;
        this.inciso = inciso;
        this.rule = rule;
        this.discarded = discarded;
    }

    public static ResolvedTarget chapter(String chapter) {
        return new ResolvedTarget(null, chapter.trim(), null, Rule.CHAPTER_FIELD, null);
    }

    public static ResolvedTarget article(ArticleIdentifier article, String inciso, Rule rule) {
        return new ResolvedTarget(article, null, inciso, rule, null);
    }

    /**
     * Same target, remembering the conflicting candidate that lost.
     */
    ResolvedTarget withDiscarded(ArticleIdentifier other) {
        return new ResolvedTarget(article, chapter, inciso, rule, other);
    }

    public boolean isChapter() {
        return chapter != null;
    }

    public ArticleIdentifier getArticle() {
        return article;
    }

    public String getChapter() {
        return chapter;
    }

    /**
     * Lower-case inciso letter, or null when the whole article is targeted.
     */
    public String getInciso() {
        return inciso;
    }

    public Rule getRule() {
        return rule;
    }

    /**
     * Candidate article number rejected by the conflict policy, null when there was no conflict.
     */
    public ArticleIdentifier getDiscarded() {
        return discarded;
    }

    public String describe() {
        if (isChapter()) {
            return "capítulo " + chapter;
        }
        return inciso != null ? "artículo " + article.label() + " inciso " + inciso + ")" : "artículo " + article.label();
    }
}
