package com.simpla.reconciliation.engine;

import com.simpla.reconciliation.identifier.ArticleIdentifier;
import com.simpla.reconciliation.model.AmendmentAction;
import com.simpla.reconciliation.model.Article;
import com.simpla.reconciliation.model.ArticleStatus;
import com.simpla.reconciliation.model.Inciso;
import com.simpla.reconciliation.model.ReconciledArticle;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Folds the operations that apply to one article into its reconciled record.
 * <p>
 * Operations are applied in dictamen order and the last one wins for amended content.
 * A repeal (direct or through its chapter) is terminal: later operations are ignored and
 * earlier amended content is dropped, so a repealed article never carries replacement text.
 */
public class ReconciliationMerge {

    static final String CHAPTER_REPEAL_ACCION = AmendmentAction.REPEAL.getVerb() + " (capítulo completo)";

    private final ReplacementTextParser parser;

    public ReconciliationMerge() {
        this(new ReplacementTextParser());
    }

    public ReconciliationMerge(ReplacementTextParser parser) {
        this.parser = parser;
    }

    /**
     * @param identifier      article identity
     * @param base            statute article, null for an article introduced by incorporation
     * @param tituloNumero    owning título, for placement
     * @param capituloNumero  owning chapter, null for direct articles of a título
     * @param operations      operations targeting this identifier, in dictamen order
     * @param chapterRepealed whether a chapter repeal covers this article
     */
    public ReconciledArticle merge(ArticleIdentifier identifier, Article base, String tituloNumero, String capituloNumero,
                                   List<TargetedOperation> operations, boolean chapterRepealed) {
        Fold fold = new Fold(base);
        if (chapterRepealed) {
            fold.repealed = true;
            fold.accion = CHAPTER_REPEAL_ACCION;
        }

        for (TargetedOperation op : operations) {
            if (op.getOperation().getDictamenArticulo() != null) {
                fold.provenance.add(op.getOperation().getDictamenArticulo());
            }
            if (fold.repealed) {
                continue;
            }
            if (op.targetsInciso()) {
                applyToInciso(fold, op);
            } else {
                applyToArticle(fold, op);
            }
        }

        ReconciledArticle.Builder builder = ReconciledArticle.builder(identifier)
                .placement(tituloNumero, capituloNumero)
                .dictamenArticulos(fold.provenance)
                .accion(fold.accion);
        if (base != null) {
            builder.original(base.getTitulo(), base.getTexto(), base.getIncisos());
        }
        if (fold.repealed) {
            return builder.estado(ArticleStatus.REPEALED).build();
        }
        if (fold.status == ArticleStatus.UNCHANGED) {
            return builder.estado(ArticleStatus.UNCHANGED).build();
        }
        return builder.estado(fold.status)
                .amended(fold.title, fold.text, fold.incisos)
                .build();
    }

    private void applyToArticle(Fold fold, TargetedOperation op) {
        AmendmentAction action = op.getAction();
        fold.accion = op.getOperation().getAccion();
        if (action == AmendmentAction.REPEAL) {
            fold.repealed = true;
            return;
        }

        ParsedReplacement parsed = parser.parse(op.getOperation().getTextoNuevo());
        if (fold.base == null) {
            // only an incorporation brings an article into existence
            fold.status = ArticleStatus.INCORPORATED;
            fold.title = parsed.getTitle() != null ? parsed.getTitle() : parsed.getFirstLine();
        } else {
            fold.status = ArticleStatus.SUBSTITUTED;
            fold.title = parsed.getTitle();
        }
        fold.text = parsed.getBody();
        fold.incisos = new ArrayList<>(parsed.getIncisos());
    }

    private void applyToInciso(Fold fold, TargetedOperation op) {
        fold.accion = op.getOperation().getAccion();
        if (fold.status == ArticleStatus.UNCHANGED) {
            // inciso changes keep the rest of the article as it stands
            fold.status = fold.base == null ? ArticleStatus.INCORPORATED : ArticleStatus.SUBSTITUTED;
            if (fold.base != null) {
                fold.title = fold.base.getTitulo();
                fold.text = fold.base.getTexto();
                fold.incisos = copy(fold.base.getIncisos());
            }
        }

        String letter = op.getTarget().getInciso();
        int position = indexOf(fold.incisos, letter);
        if (op.getAction() == AmendmentAction.REPEAL) {
            if (position >= 0) {
                fold.incisos.remove(position);
            }
            return;
        }

        Inciso replacement = new Inciso(letter, parser.parseIncisoText(op.getOperation().getTextoNuevo()));
        if (position >= 0) {
            fold.incisos.set(position, replacement);
        } else {
            fold.incisos.add(replacement);
            fold.incisos.sort(Comparator.comparing(Inciso::getLetra, Comparator.nullsLast(Comparator.naturalOrder())));
        }
    }

    private static int indexOf(List<Inciso> incisos, String letter) {
        for (int i = 0; i < incisos.size(); i++) {
            if (letter.equalsIgnoreCase(incisos.get(i).getLetra())) {
                return i;
            }
        }
        return -1;
    }

    private static List<Inciso> copy(List<Inciso> incisos) {
        List<Inciso> copies = new ArrayList<>();
        if (incisos != null) {
            for (Inciso inciso : incisos) {
                copies.add(new Inciso(inciso.getLetra(), inciso.getTexto()));
            }
        }
        return copies;
    }

    /**
     * Working state of one merge; never escapes {@link #merge}.
     */
    private static final class Fold {
        private final Article base;
        private ArticleStatus status = ArticleStatus.UNCHANGED;
        private boolean repealed;
        private String title;
        private String text;
        private List<Inciso> incisos = new ArrayList<>();
        private String accion;
        private final List<String> provenance = new ArrayList<>();

        private Fold(Article base) {
            this.base = base;
        }
    }
}
