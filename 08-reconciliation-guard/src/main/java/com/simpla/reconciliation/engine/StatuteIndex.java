package com.simpla.reconciliation.engine;

import com.simpla.reconciliation.identifier.ArticleIdentifier;
import com.simpla.reconciliation.model.Article;
import com.simpla.reconciliation.model.Capitulo;
import com.simpla.reconciliation.model.Ley;
import com.simpla.reconciliation.model.Titulo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only view of a statute: every article in document order with its identifier
 * and the título / capítulo that owns it.
 * <p>
 * Articles printed without a number get a synthetic identifier scoped to their
 * container. A chapter's scope is its number ("VIII"); when two títulos reuse the same
 * chapter number the scope is qualified with the título ("III.VIII"). Direct articles
 * of a título use "TITULO_" plus the título number.
 */
public class StatuteIndex {

    public static final class Entry {
        private final ArticleIdentifier identifier;
        private final Article article;
        private final Titulo titulo;
        private final Capitulo capitulo;

        public Entry(ArticleIdentifier identifier, Article article, Titulo titulo, Capitulo capitulo) {
            this.identifier = identifier;
            this.article = article;
            this.titulo = titulo;
            this.capitulo = capitulo;
        }

        public ArticleIdentifier getIdentifier() {
            return identifier;
        }

        public Article getArticle() {
            return article;
        }

        public Titulo getTitulo() {
            return titulo;
        }

        /**
         * Owning chapter, null for direct articles of a título.
         */
        public Capitulo getCapitulo() {
            return capitulo;
        }
    }

    private final Ley ley;
    private final List<Entry> entries;
    private final Map<ArticleIdentifier, Entry> byIdentifier;
    private final Map<String, Integer> chapterNumberCounts;

    private StatuteIndex(Ley ley) {
        this.ley = ley;
        this.chapterNumberCounts = countChapterNumbers(ley);

        List<Entry> collected = new ArrayList<>();
        for (Titulo titulo : ley.getTitulos()) {
            addArticles(collected, titulo.getArticulos(), titulo, null);
            for (Capitulo capitulo : titulo.getCapitulos()) {
                addArticles(collected, capitulo.getArticulos(), titulo, capitulo);
            }
        }
        this.entries = Collections.unmodifiableList(collected);

        Map<ArticleIdentifier, Entry> index = new HashMap<>();
        for (Entry entry : collected) {
            index.putIfAbsent(entry.getIdentifier(), entry);
        }
        this.byIdentifier = index;
    }

    public static StatuteIndex of(Ley ley) {
        return new StatuteIndex(ley);
    }

    private void addArticles(List<Entry> target, List<Article> articles, Titulo titulo, Capitulo capitulo) {
        int position = 0;
        for (Article article : articles) {
            position++;
            ArticleIdentifier identifier = ArticleIdentifier.isUnnumbered(article.getNumero())
                    ? ArticleIdentifier.synthetic(scopeOf(titulo, capitulo), position)
                    : ArticleIdentifier.parse(article.getNumero());
            target.add(new Entry(identifier, article, titulo, capitulo));
        }
    }

    private static Map<String, Integer> countChapterNumbers(Ley ley) {
        Map<String, Integer> counts = new HashMap<>();
        for (Titulo titulo : ley.getTitulos()) {
            for (Capitulo capitulo : titulo.getCapitulos()) {
                counts.merge(normalize(capitulo.getNumero()), 1, Integer::sum);
            }
        }
        return counts;
    }

    /**
     * Scope used for synthetic identifiers of unnumbered articles in the given container.
     */
    public String scopeOf(Titulo titulo, Capitulo capitulo) {
        if (capitulo == null) {
            return "TITULO_" + normalize(titulo.getNumero());
        }
        String chapter = normalize(capitulo.getNumero());
        if (chapterNumberCounts.getOrDefault(chapter, 0) > 1) {
            return normalize(titulo.getNumero()) + "." + chapter;
        }
        return chapter;
    }

    public Ley getLey() {
        return ley;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    /**
     * Exact identifier lookup across every título and chapter; null when absent.
     */
    public Entry find(ArticleIdentifier identifier) {
        return byIdentifier.get(identifier);
    }

    public boolean contains(ArticleIdentifier identifier) {
        return byIdentifier.containsKey(identifier);
    }

    /**
     * Chapters whose number matches, ignoring case, keyed to their owning título.
     * More than one when several títulos reuse the same chapter number.
     */
    public Map<Capitulo, Titulo> findChapters(String numero) {
        Map<Capitulo, Titulo> matches = new LinkedHashMap<>();
        String target = normalize(numero);
        for (Titulo titulo : ley.getTitulos()) {
            for (Capitulo capitulo : titulo.getCapitulos()) {
                if (normalize(capitulo.getNumero()).equals(target)) {
                    matches.put(capitulo, titulo);
                }
            }
        }
        return matches;
    }

    /**
     * Título with the given number (ignoring case), or null.
     */
    public Titulo findTitulo(String numero) {
        String target = normalize(numero);
        for (Titulo titulo : ley.getTitulos()) {
            if (normalize(titulo.getNumero()).equals(target)) {
                return titulo;
            }
        }
        return null;
    }

    static String normalize(String numero) {
        return numero == null ? "" : numero.trim().toUpperCase(Locale.ROOT);
    }
}
