package com.simpla.reconciliation.engine;

import com.simpla.reconciliation.identifier.ArticleIdentifier;
import com.simpla.reconciliation.model.Article;
import com.simpla.reconciliation.model.Capitulo;
import com.simpla.reconciliation.model.Titulo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Enumerates the articles a chapter-level repeal removes.
 * <p>
 * Chapters are matched by number ignoring case. Numbered articles keep their identifier;
 * unnumbered ones get the synthetic identifier the {@link StatuteIndex} assigned from their
 * 1-based position. A chapter absent from the statute, or present with no articles, is
 * enumerated from its {@link ChapterOverride} if one was supplied, otherwise left unresolved.
 */
public class ChapterExpander {

    private final Map<String, ChapterOverride> overrides;

    public ChapterExpander() {
        this(Collections.emptyList());
    }

    public ChapterExpander(List<ChapterOverride> overrides) {
        Map<String, ChapterOverride> byChapter = new LinkedHashMap<>();
        for (ChapterOverride override : overrides) {
            byChapter.put(StatuteIndex.normalize(override.getCapitulo()), override);
        }
        this.overrides = Collections.unmodifiableMap(byChapter);
    }

    public ChapterExpansion expand(String chapter, StatuteIndex index) {
        Map<Capitulo, Titulo> matched = index.findChapters(chapter);

        List<ArticleIdentifier> identifiers = new ArrayList<>();
        for (StatuteIndex.Entry entry : index.getEntries()) {
            if (entry.getCapitulo() != null && matched.containsKey(entry.getCapitulo())) {
                identifiers.add(entry.getIdentifier());
            }
        }
        if (!identifiers.isEmpty()) {
            return new ChapterExpansion(chapter, ChapterExpansion.Outcome.FROM_STATUTE,
                    new ArrayList<>(matched.keySet()), identifiers, List.of());
        }

        ChapterOverride override = overrides.get(StatuteIndex.normalize(chapter));
        if (override == null) {
            return ChapterExpansion.failed(chapter, ChapterExpansion.Outcome.UNRESOLVED);
        }
        return fromOverride(chapter, override, matched, index);
    }

    private ChapterExpansion fromOverride(String chapter, ChapterOverride override,
                                          Map<Capitulo, Titulo> matched, StatuteIndex index) {
        Capitulo capitulo;
        Titulo titulo;
        if (!matched.isEmpty()) {
            Map.Entry<Capitulo, Titulo> first = matched.entrySet().iterator().next();
            capitulo = first.getKey();
            titulo = first.getValue();
        } else {
            titulo = index.findTitulo(override.getTitulo());
            if (titulo == null) {
                return ChapterExpansion.failed(chapter, ChapterExpansion.Outcome.UNPLACED);
            }
            capitulo = new Capitulo(override.getCapitulo(), override.getNombre());
        }

        String scope = matched.isEmpty()
                ? StatuteIndex.normalize(override.getCapitulo())
                : index.scopeOf(titulo, capitulo);

        List<ArticleIdentifier> identifiers = new ArrayList<>();
        List<StatuteIndex.Entry> entries = new ArrayList<>();
        int position = 0;
        for (Article article : override.getArticulos()) {
            position++;
            ArticleIdentifier identifier = ArticleIdentifier.synthetic(scope, position);
            identifiers.add(identifier);
            entries.add(new StatuteIndex.Entry(identifier, article, titulo, capitulo));
        }
        return new ChapterExpansion(chapter, ChapterExpansion.Outcome.FROM_OVERRIDE,
                List.of(capitulo), identifiers, entries);
    }
}
