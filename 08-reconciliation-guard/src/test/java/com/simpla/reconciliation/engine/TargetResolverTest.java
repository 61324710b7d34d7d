package com.simpla.reconciliation.engine;

import com.simpla.reconciliation.identifier.ArticleIdentifier;
import com.simpla.reconciliation.model.DictamenOperation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TargetResolverTest {

    private final TargetResolver resolver = new TargetResolver();

    private static DictamenOperation operation(String accion, String encabezado) {
        DictamenOperation op = new DictamenOperation("ARTÍCULO 21", accion);
        op.setEncabezado(encabezado);
        return op;
    }

    @Test
    void explicitTargetWins() {
        DictamenOperation op = operation("sustitúyese", "Sustitúyese el artículo 99 de la Ley 20.744");
        op.setDestinoArticulo("54");

        ResolvedTarget target = resolver.resolve(op);

        assertEquals(ArticleIdentifier.parse("54"), target.getArticle());
        assertEquals(ResolvedTarget.Rule.EXPLICIT_FIELD, target.getRule());
        assertNull(target.getDiscarded());
    }

    @Test
    void replacementTextNumberUsedWithoutExplicitTarget() {
        DictamenOperation op = operation("sustitúyese", "Sustitúyese el artículo 21 de la Ley 20.744");
        op.setTextoNuevo("\"ARTÍCULO 54°- Aplicación. Texto nuevo.\"");

        ResolvedTarget target = resolver.resolve(op);

        assertEquals(ArticleIdentifier.parse("54"), target.getArticle());
        assertEquals(ResolvedTarget.Rule.REPLACEMENT_TEXT, target.getRule());
    }

    @Test
    void disagreementKeepsExplicitAndRecordsDiscarded() {
        DictamenOperation op = operation("sustitúyese", null);
        op.setDestinoArticulo("54");
        op.setTextoNuevo("ARTÍCULO 55- Otro texto.");

        ResolvedTarget target = resolver.resolve(op);

        assertEquals(ArticleIdentifier.parse("54"), target.getArticle());
        assertEquals(ArticleIdentifier.parse("55"), target.getDiscarded());
    }

    @Test
    void disagreementCanPreferReplacementText() {
        TargetResolver textFirst = new TargetResolver(TargetConflictPolicy.PREFER_REPLACEMENT_TEXT);
        DictamenOperation op = operation("sustitúyese", null);
        op.setDestinoArticulo("54");
        op.setTextoNuevo("ARTÍCULO 55- Otro texto.");

        ResolvedTarget target = textFirst.resolve(op);

        assertEquals(ArticleIdentifier.parse("55"), target.getArticle());
        assertEquals(ArticleIdentifier.parse("54"), target.getDiscarded());
    }

    @Test
    void incorporationPhraseBeatsEarlierCitation() {
        DictamenOperation op = operation("incorpórase",
                "A continuación del artículo 80 bis de la Ley 20.744, incorpórase como artículo 80 ter el siguiente texto");

        ResolvedTarget target = resolver.resolve(op);

        assertEquals(ArticleIdentifier.parse("80 ter"), target.getArticle());
        assertEquals(ResolvedTarget.Rule.HEADER_INCORPORATION, target.getRule());
    }

    @Test
    void verbAnchoredCitationPreferredOverBareCitation() {
        DictamenOperation op = operation("derógase",
                "Conforme al artículo 3 de la presente, derógase el artículo 92 ter de la Ley 20.744");

        ResolvedTarget target = resolver.resolve(op);

        assertEquals(ArticleIdentifier.parse("92 ter"), target.getArticle());
        assertEquals(ResolvedTarget.Rule.HEADER_VERB, target.getRule());
    }

    @Test
    void bareCitationSkipsTheDictamenOwnHeader() {
        DictamenOperation op = operation("derógase", "ARTÍCULO 21°- Quedan sin efecto las disposiciones del artículo 80 de la Ley 20.744");

        ResolvedTarget target = resolver.resolve(op);

        assertEquals(ArticleIdentifier.parse("80"), target.getArticle());
        assertEquals(ResolvedTarget.Rule.HEADER_CITATION, target.getRule());
    }

    @Test
    void incisoFromFieldsAndFromHeader() {
        DictamenOperation byFields = operation("sustitúyese", null);
        byFields.setDestinoInciso("b)");
        byFields.setDestinoArticuloPadre("2");
        ResolvedTarget fromFields = resolver.resolve(byFields);
        assertEquals(ArticleIdentifier.parse("2"), fromFields.getArticle());
        assertEquals("b", fromFields.getInciso());

        DictamenOperation byHeader = operation("sustitúyese", "Sustitúyese el inciso C) del artículo 2 de la Ley 20.744");
        ResolvedTarget fromHeader = resolver.resolve(byHeader);
        assertEquals(ArticleIdentifier.parse("2"), fromHeader.getArticle());
        assertEquals("c", fromHeader.getInciso());
        assertEquals(ResolvedTarget.Rule.HEADER_INCISO, fromHeader.getRule());
    }

    @Test
    void chapterTargetComesFirst() {
        DictamenOperation op = operation("derógase", "Derógase el Capítulo VIII del Título III");
        op.setDestinoCapitulo("VIII");
        op.setDestinoArticulo("80");

        ResolvedTarget target = resolver.resolve(op);

        assertTrue(target.isChapter());
        assertEquals("VIII", target.getChapter());
        assertEquals("capítulo VIII", target.describe());
    }

    @Test
    void unresolvableOperationReturnsNull() {
        assertNull(resolver.resolve(operation("sustitúyese", "Modifícase el régimen de licencias")));
        assertNull(resolver.resolve(operation("sustitúyese", null)));
    }

    @Test
    void replacementTextNumberRequiresLeadingHeader() {
        assertEquals(ArticleIdentifier.parse("80 bis"), TargetResolver.fromReplacementText("“Artículo 80 bis - Texto.”"));
        assertNull(TargetResolver.fromReplacementText("Conforme al artículo 80- de la ley"));
        assertNull(TargetResolver.fromReplacementText(null));
    }
}
