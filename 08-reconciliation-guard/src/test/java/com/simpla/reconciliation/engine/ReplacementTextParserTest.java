package com.simpla.reconciliation.engine;

import com.simpla.reconciliation.model.Inciso;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class ReplacementTextParserTest {

    private final ReplacementTextParser parser = new ReplacementTextParser();

    @Test
    void splitsTitleBodyAndIncisos() {
        ParsedReplacement parsed = parser.parse("\"ARTÍCULO 2°- Ámbito de aplicación. La vigencia de esta ley no alcanza:\n"
                + "a) A los dependientes de la Administración Pública.\n"
                + "b) A los trabajadores agrarios,\n"
                + "salvo lo dispuesto en el régimen especial.\"");

        assertEquals("Ámbito de aplicación.", parsed.getTitle());
        assertEquals("La vigencia de esta ley no alcanza:", parsed.getBody());
        assertEquals(Arrays.asList(
                new Inciso("a", "A los dependientes de la Administración Pública."),
                new Inciso("b", "A los trabajadores agrarios,\nsalvo lo dispuesto en el régimen especial.")),
                parsed.getIncisos());
    }

    @Test
    void singleSentenceHasNoTitle() {
        ParsedReplacement parsed = parser.parse("ARTÍCULO 80 bis- El empleador entregará el certificado de trabajo.");

        assertNull(parsed.getTitle());
        assertEquals("El empleador entregará el certificado de trabajo.", parsed.getBody());
        assertEquals("El empleador entregará el certificado de trabajo.", parsed.getFirstLine());
        assertTrue(parsed.getIncisos().isEmpty());
    }

    @Test
    void longFirstSentenceIsNotATitle() {
        StringBuilder sentence = new StringBuilder("Las partes");
        while (sentence.length() <= ReplacementTextParser.MAX_TITLE_LENGTH) {
            sentence.append(" podrán convenir");
        }
        ParsedReplacement parsed = parser.parse(sentence + ". Segunda oración.");

        assertNull(parsed.getTitle());
        assertEquals(sentence + ". Segunda oración.", parsed.getBody());
    }

    @Test
    void keepsClosingQuoteOfAQuotedTerm() {
        assertEquals("El fondo se denomina \"FONDO\"",
                parser.parse("“ARTÍCULO 54- El fondo se denomina \"FONDO\"”").getBody());
        assertEquals("El fondo se denomina \"FONDO\"",
                parser.parse("ARTÍCULO 54- El fondo se denomina \"FONDO\"").getBody());
    }

    @Test
    void unpairedQuoteIsKept() {
        assertEquals("Texto citado”", parser.parseIncisoText("Texto citado”"));
        assertEquals("«Texto citado\"", parser.parseIncisoText("«Texto citado\""));
    }

    @Test
    void emptyReplacement() {
        ParsedReplacement parsed = parser.parse("  ");

        assertNull(parsed.getTitle());
        assertNull(parsed.getBody());
        assertTrue(parsed.getIncisos().isEmpty());
    }

    @Test
    void incisoTextDropsItsLetter() {
        assertEquals("A los trabajadores de casas particulares.", parser.parseIncisoText("“b) A los trabajadores de casas particulares.”"));
        assertEquals("Texto sin letra.", parser.parseIncisoText("Texto sin letra."));
        assertNull(parser.parseIncisoText(null));
    }
}
