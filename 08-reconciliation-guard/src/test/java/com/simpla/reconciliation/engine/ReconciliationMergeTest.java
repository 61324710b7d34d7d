package com.simpla.reconciliation.engine;

import com.simpla.reconciliation.identifier.ArticleIdentifier;
import com.simpla.reconciliation.model.Article;
import com.simpla.reconciliation.model.ArticleStatus;
import com.simpla.reconciliation.model.DictamenOperation;
import com.simpla.reconciliation.model.Inciso;
import com.simpla.reconciliation.model.ReconciledArticle;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationMergeTest {

    private final ReconciliationMerge merge = new ReconciliationMerge();
    private final TargetResolver resolver = new TargetResolver();

    private List<TargetedOperation> targeted(DictamenOperation... operations) {
        List<TargetedOperation> result = new ArrayList<>();
        for (int i = 0; i < operations.length; i++) {
            result.add(new TargetedOperation(i, operations[i], operations[i].getAction(), resolver.resolve(operations[i])));
        }
        return result;
    }

    private static Article ambito() {
        Article article = new Article("2", "Ámbito de aplicación.", "La vigencia de esta ley no alcanza:");
        article.addInciso(new Inciso("a", "A los dependientes de la Administración Pública."));
        article.addInciso(new Inciso("c", "A los trabajadores agrarios."));
        return article;
    }

    @Test
    void untouchedArticleIsUnchangedWithoutAmendedContent() {
        ReconciledArticle result = merge.merge(ArticleIdentifier.parse("2"), ambito(), "I", null,
                Collections.emptyList(), false);

        assertEquals(ArticleStatus.UNCHANGED, result.getEstado());
        assertFalse(result.hasAmendedContent());
        assertEquals("La vigencia de esta ley no alcanza:", result.getTextoOriginal());
        assertEquals(2, result.getIncisosOriginales().size());
    }

    @Test
    void substitutionParsesReplacementText() {
        ReconciledArticle result = merge.merge(ArticleIdentifier.parse("2"), ambito(), "I", null,
                targeted(StatuteFixtures.substitute("ARTÍCULO 1", "2",
                        "ARTÍCULO 2°- Ámbito. Esta ley se aplica a todos los trabajadores.\na) Salvo los de casas particulares.")),
                false);

        assertEquals(ArticleStatus.SUBSTITUTED, result.getEstado());
        assertEquals("Ámbito.", result.getTituloNuevo());
        assertEquals("Esta ley se aplica a todos los trabajadores.", result.getTextoNuevo());
        assertEquals(List.of(new Inciso("a", "Salvo los de casas particulares.")), result.getIncisosNuevos());
        assertEquals(List.of("ARTÍCULO 1"), result.getDictamenArticulos());
        assertEquals("sustitúyese", result.getAccion());
    }

    @Test
    void repealIsTerminalButKeepsProvenance() {
        ReconciledArticle result = merge.merge(ArticleIdentifier.parse("2"), ambito(), "I", null,
                targeted(StatuteFixtures.repeal("ARTÍCULO 3", "2"),
                        StatuteFixtures.substitute("ARTÍCULO 4", "2", "ARTÍCULO 2°- Texto posterior.")),
                false);

        assertEquals(ArticleStatus.REPEALED, result.getEstado());
        assertNull(result.getTextoNuevo());
        assertEquals("derógase", result.getAccion());
        assertEquals(List.of("ARTÍCULO 3", "ARTÍCULO 4"), result.getDictamenArticulos());
    }

    @Test
    void repealAfterSubstitutionClearsAmendedContent() {
        ReconciledArticle result = merge.merge(ArticleIdentifier.parse("80 bis"), new Article("80 bis", "Certificado.", "Texto."),
                "II", "II",
                targeted(StatuteFixtures.substitute("ARTÍCULO 7", "80 bis", "ARTÍCULO 80 bis- Certificado. Nuevo texto."),
                        StatuteFixtures.repeal("ARTÍCULO 9", "80 bis")),
                false);

        assertEquals(ArticleStatus.REPEALED, result.getEstado());
        assertFalse(result.hasAmendedContent());
        assertEquals("Certificado.", result.getTituloOriginal());
    }

    @Test
    void chapterRepealWinsOverEverything() {
        ReconciledArticle result = merge.merge(ArticleIdentifier.parse("90"), new Article("90", null, "Texto."), "III", "VII",
                targeted(StatuteFixtures.substitute("ARTÍCULO 10", "90", "ARTÍCULO 90- Nuevo.")), true);

        assertEquals(ArticleStatus.REPEALED, result.getEstado());
        assertEquals(ReconciliationMerge.CHAPTER_REPEAL_ACCION, result.getAccion());
        assertEquals(List.of("ARTÍCULO 10"), result.getDictamenArticulos());
    }

    @Test
    void incorporationOfNewArticle() {
        ReconciledArticle result = merge.merge(ArticleIdentifier.parse("80 ter"), null, "II", "II",
                targeted(StatuteFixtures.incorporate("ARTÍCULO 8", "80 ter", "ARTÍCULO 80 ter- El empleador deberá capacitar.")),
                false);

        assertEquals(ArticleStatus.INCORPORATED, result.getEstado());
        assertEquals("El empleador deberá capacitar.", result.getTituloNuevo());
        assertEquals("El empleador deberá capacitar.", result.getTextoNuevo());
        assertNull(result.getTextoOriginal());
    }

    @Test
    void incisoOperationsEditACopyOfTheOriginal() {
        DictamenOperation replaceA = StatuteFixtures.substitute("ARTÍCULO 11", null, "a) A los funcionarios públicos.");
        replaceA.setDestinoArticuloPadre("2");
        replaceA.setDestinoInciso("a");
        DictamenOperation addB = StatuteFixtures.incorporate("ARTÍCULO 12", null, "b) A los trabajadores de casas particulares.");
        addB.setDestinoArticuloPadre("2");
        addB.setDestinoInciso("b");
        DictamenOperation dropC = StatuteFixtures.repeal("ARTÍCULO 13", null);
        dropC.setDestinoArticuloPadre("2");
        dropC.setDestinoInciso("c");

        Article base = ambito();
        ReconciledArticle result = merge.merge(ArticleIdentifier.parse("2"), base, "I", null,
                targeted(replaceA, addB, dropC), false);

        assertEquals(ArticleStatus.SUBSTITUTED, result.getEstado());
        assertEquals("Ámbito de aplicación.", result.getTituloNuevo());
        assertEquals(base.getTexto(), result.getTextoNuevo());
        assertEquals(Arrays.asList(
                new Inciso("a", "A los funcionarios públicos."),
                new Inciso("b", "A los trabajadores de casas particulares.")), result.getIncisosNuevos());
        assertEquals(2, base.getIncisos().size(), "statute article must not be mutated");
        assertEquals("A los dependientes de la Administración Pública.", result.getIncisosOriginales().get(0).getTexto());
    }
}
