package com.simpla.reconciliation.engine;

import com.simpla.reconciliation.model.AmendmentAction;
import com.simpla.reconciliation.model.Article;
import com.simpla.reconciliation.model.Capitulo;
import com.simpla.reconciliation.model.DictamenOperation;
import com.simpla.reconciliation.model.Inciso;
import com.simpla.reconciliation.model.Ley;
import com.simpla.reconciliation.model.Titulo;

/**
 * Small Ley de Contrato de Trabajo excerpt shared by the engine tests.
 * <pre>
 * TÍTULO I     arts. 1, 2
 * TÍTULO II    CAPÍTULO I: 21, 22    CAPÍTULO II: 54, 80, 80 bis
 * TÍTULO III   CAPÍTULO VII: 90      CAPÍTULO VIII: (no articles)
 * </pre>
 */
final class StatuteFixtures {

    private StatuteFixtures() {}

    static Ley lct() {
        Ley ley = new Ley("20744", "Ley de Contrato de Trabajo");

        Titulo generales = new Titulo("I", "Disposiciones generales");
        generales.addArticulo(article("1", "Fuentes de regulación.", "El contrato de trabajo y la relación de trabajo se rige por esta ley."));
        Article ambito = article("2", "Ámbito de aplicación.", "La vigencia de esta ley quedará condicionada a que la aplicación de sus disposiciones resulte compatible con la naturaleza de la actividad.");
        ambito.addInciso(new Inciso("a", "A los dependientes de la Administración Pública."));
        ambito.addInciso(new Inciso("b", "A los trabajadores del servicio doméstico."));
        ambito.addInciso(new Inciso("c", "A los trabajadores agrarios."));
        generales.addArticulo(ambito);
        ley.addTitulo(generales);

        Titulo contrato = new Titulo("II", "Del contrato de trabajo en general");
        Capitulo definicion = new Capitulo("I", "Del contrato y la relación de trabajo");
        definicion.addArticulo(article("21", "Contrato de trabajo.", "Habrá contrato de trabajo cuando una persona física se obligue a realizar actos."));
        definicion.addArticulo(article("22", "Relación de trabajo.", "Habrá relación de trabajo cuando una persona realice actos en favor de otra."));
        contrato.addCapitulo(definicion);
        Capitulo forma = new Capitulo("II", "De la forma y prueba del contrato");
        forma.addArticulo(article("54", "Aplicación a los empleadores.", "Las obligaciones de los artículos anteriores son aplicables a los empleadores."));
        forma.addArticulo(article("80", "Deber de observar las obligaciones frente a los organismos sindicales.", "La obligación de ingresar los fondos de seguridad social es contractual."));
        forma.addArticulo(article("80 bis", "Certificado de trabajo.", "El empleador entregará el certificado de trabajo."));
        contrato.addCapitulo(forma);
        ley.addTitulo(contrato);

        Titulo derechos = new Titulo("III", "De los derechos y obligaciones de las partes");
        Capitulo jornada = new Capitulo("VII", "De la jornada");
        jornada.addArticulo(article("90", "Indeterminación del plazo.", "El contrato de trabajo se entenderá celebrado por tiempo indeterminado."));
        derechos.addCapitulo(jornada);
        derechos.addCapitulo(new Capitulo("VIII", "DE LA FORMACIÓN PROFESIONAL"));
        ley.addTitulo(derechos);

        return ley;
    }

    static Article article(String numero, String titulo, String texto) {
        return new Article(numero, titulo, texto);
    }

    static DictamenOperation substitute(String dictamenArticulo, String destino, String textoNuevo) {
        DictamenOperation op = new DictamenOperation(dictamenArticulo, AmendmentAction.SUBSTITUTE.getVerb());
        op.setDestinoArticulo(destino);
        op.setTextoNuevo(textoNuevo);
        return op;
    }

    static DictamenOperation incorporate(String dictamenArticulo, String destino, String textoNuevo) {
        DictamenOperation op = new DictamenOperation(dictamenArticulo, AmendmentAction.INCORPORATE.getVerb());
        op.setDestinoArticulo(destino);
        op.setTextoNuevo(textoNuevo);
        return op;
    }

    static DictamenOperation repeal(String dictamenArticulo, String destino) {
        DictamenOperation op = new DictamenOperation(dictamenArticulo, AmendmentAction.REPEAL.getVerb());
        op.setDestinoArticulo(destino);
        return op;
    }

    static DictamenOperation repealChapter(String dictamenArticulo, String capitulo) {
        DictamenOperation op = new DictamenOperation(dictamenArticulo, AmendmentAction.REPEAL.getVerb());
        op.setDestinoCapitulo(capitulo);
        return op;
    }

    static ChapterOverride chapterVIIIOverride() {
        ChapterOverride override = new ChapterOverride("VIII", "III", "DE LA FORMACIÓN PROFESIONAL",
                "Artículos sin número ausentes de la versión estructurada");
        for (int i = 1; i <= 7; i++) {
            override.addArticulo(new Article(null, "", "Texto del artículo sin número " + i + "."));
        }
        return override;
    }
}
