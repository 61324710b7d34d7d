package com.simpla.reconciliation.engine;

import com.simpla.reconciliation.identifier.ArticleIdentifier;
import com.simpla.reconciliation.model.ArticleStatus;
import com.simpla.reconciliation.model.Capitulo;
import com.simpla.reconciliation.model.Ley;
import com.simpla.reconciliation.model.ReconciledArticle;
import com.simpla.reconciliation.model.ReconciledCapitulo;
import com.simpla.reconciliation.model.ReconciledLey;
import com.simpla.reconciliation.model.ReconciledTitulo;
import com.simpla.reconciliation.model.Titulo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds the statute's título / capítulo shell around the reconciled articles.
 * <p>
 * Títulos and chapters keep source order and are emitted even when they end up with no
 * articles. Inside each container articles follow {@link ArticleIdentifier} order, which
 * puts synthetic articles after their numbered peers. Chapters that only exist through a
 * chapter override are appended after the título's own chapters.
 */
public class ViewAssembler {

    private static final Comparator<ReconciledArticle> CANONICAL_ORDER =
            Comparator.comparing(ReconciledArticle::getIdentifier);

    /**
     * Where an article goes in the view.
     */
    public static final class Placement {
        private final Titulo titulo;
        private final Capitulo capitulo;

        public Placement(Titulo titulo, Capitulo capitulo) {
            this.titulo = titulo;
            this.capitulo = capitulo;
        }

        public Titulo getTitulo() {
            return titulo;
        }

        public Capitulo getCapitulo() {
            return capitulo;
        }
    }

    public static final class PlacedArticle {
        private final ReconciledArticle article;
        private final Placement placement;

        public PlacedArticle(ReconciledArticle article, Placement placement) {
            this.article = article;
            this.placement = placement;
        }

        public ReconciledArticle getArticle() {
            return article;
        }

        public Placement getPlacement() {
            return placement;
        }
    }

    /**
     * Container for a new article: the one holding its nearest preceding numbered article,
     * or the first article's container when it precedes them all, or the first título of a
     * statute without articles. Null only when the statute has no títulos.
     */
    public Placement placeIncorporation(ArticleIdentifier identifier, StatuteIndex index) {
        StatuteIndex.Entry predecessor = null;
        StatuteIndex.Entry firstNumbered = null;
        for (StatuteIndex.Entry entry : index.getEntries()) {
            ArticleIdentifier candidate = entry.getIdentifier();
            if (candidate.isSynthetic()) {
                continue;
            }
            if (firstNumbered == null) {
                firstNumbered = entry;
            }
            if (candidate.compareTo(identifier) < 0
                    && (predecessor == null || candidate.compareTo(predecessor.getIdentifier()) >= 0)) {
                predecessor = entry;
            }
        }

        StatuteIndex.Entry anchor = predecessor != null ? predecessor : firstNumbered;
        if (anchor != null) {
            return new Placement(anchor.getTitulo(), anchor.getCapitulo());
        }
        List<Titulo> titulos = index.getLey().getTitulos();
        return titulos.isEmpty() ? null : new Placement(titulos.get(0), null);
    }

    public ReconciledLey assemble(Ley ley, Collection<PlacedArticle> placed, Set<Capitulo> repealedChapters) {
        Map<Object, List<ReconciledArticle>> byContainer = new IdentityHashMap<>();
        Map<Titulo, List<Capitulo>> extraChapters = new IdentityHashMap<>();

        for (PlacedArticle item : placed) {
            Placement placement = item.getPlacement();
            Object container = placement.getCapitulo() != null ? placement.getCapitulo() : placement.getTitulo();
            byContainer.computeIfAbsent(container, k -> new ArrayList<>()).add(item.getArticle());

            Capitulo capitulo = placement.getCapitulo();
            if (capitulo != null && !containsSame(placement.getTitulo().getCapitulos(), capitulo)) {
                List<Capitulo> extras = extraChapters.computeIfAbsent(placement.getTitulo(), k -> new ArrayList<>());
                if (!containsSame(extras, capitulo)) {
                    extras.add(capitulo);
                }
            }
        }

        List<ReconciledTitulo> titulos = new ArrayList<>();
        for (Titulo titulo : ley.getTitulos()) {
            List<ReconciledCapitulo> capitulos = new ArrayList<>();
            for (Capitulo capitulo : titulo.getCapitulos()) {
                capitulos.add(chapter(capitulo, byContainer, repealedChapters));
            }
            for (Capitulo capitulo : extraChapters.getOrDefault(titulo, List.of())) {
                capitulos.add(chapter(capitulo, byContainer, repealedChapters));
            }
            titulos.add(new ReconciledTitulo(titulo.getNumero(), titulo.getNombre(),
                    sorted(byContainer.get(titulo)), capitulos));
        }
        return new ReconciledLey(ley.getNumero(), ley.getNombre(), titulos);
    }

    private ReconciledCapitulo chapter(Capitulo capitulo, Map<Object, List<ReconciledArticle>> byContainer,
                                       Set<Capitulo> repealedChapters) {
        ArticleStatus estado = repealedChapters.contains(capitulo) ? ArticleStatus.REPEALED : null;
        return new ReconciledCapitulo(capitulo.getNumero(), capitulo.getNombre(), estado,
                sorted(byContainer.get(capitulo)));
    }

    private static List<ReconciledArticle> sorted(List<ReconciledArticle> articles) {
        List<ReconciledArticle> result = articles != null ? new ArrayList<>(articles) : new ArrayList<>();
        // stable, so articles sharing an identifier keep document order
        result.sort(CANONICAL_ORDER);
        return result;
    }

    private static boolean containsSame(List<Capitulo> capitulos, Capitulo capitulo) {
        for (Capitulo candidate : capitulos) {
            if (candidate == capitulo) {
                return true;
            }
        }
        return false;
    }
}
