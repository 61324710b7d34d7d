package com.simpla.reconciliation.engine;

import com.simpla.reconciliation.identifier.ArticleIdentifier;
import com.simpla.reconciliation.model.DictamenOperation;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Determines which article, inciso or chapter a dictamen operation targets.
 * <p>
 * Rules are tried in priority order and the first match wins:
 * <ol>
 *   <li>{@code destino_capitulo} (chapter-level operation)</li>
 *   <li>{@code destino_articulo}, or {@code destino_articulo_padre} when an inciso is targeted</li>
 *   <li>"ARTÍCULO N-" restated at the start of {@code texto_nuevo}</li>
 *   <li>the free-form {@code encabezado}: "incorpórase como artículo N", then "inciso x) del
 *       artículo N", then "sustitúyese el artículo N" (and the other verbs), then any bare
 *       "artículo N" after the dictamen's own header</li>
 * </ol>
 * The incorporation phrase must come before the bare citation because a header usually
 * cites the source article too.
 */
public class TargetResolver {

    private static final String NUMBER =
            "(\\d+(?:\\s*(?:" + ArticleIdentifier.SUFFIX_ALTERNATION + ")\\b)?)";
    private static final String ARTICULO = "art[íi]culo";
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    static final Pattern REPLACEMENT_HEADER = Pattern.compile(
            "^[\\s\"“«']*" + ARTICULO + "\\s+" + NUMBER + "\\s*[°º]?\\s*[-–—]", FLAGS);

    private static final Pattern DICTAMEN_HEADER = Pattern.compile(
            "^\\s*" + ARTICULO + "\\s+\\d+(?:\\s*(?:" + ArticleIdentifier.SUFFIX_ALTERNATION + ")\\b)?\\s*[°º]?\\s*[-–—]", FLAGS);

    private static final Pattern HEADER_INCORPORATION = Pattern.compile(
            "incorp[óo]rase\\s+como\\s+" + ARTICULO + "\\s+" + NUMBER, FLAGS);

    private static final Pattern HEADER_INCISO = Pattern.compile(
            "inciso\\s+([a-z])\\)\\s+del\\s+" + ARTICULO + "\\s+" + NUMBER, FLAGS);

    private static final Pattern HEADER_VERB = Pattern.compile(
            "(?:sustit[úu]yese|der[óo]gase|modif[íi]case|supr[íi]mese|reempl[áa]zase)\\s+el\\s+"
                    + ARTICULO + "\\s+" + NUMBER, FLAGS);

    private static final Pattern HEADER_CITATION = Pattern.compile(ARTICULO + "\\s+" + NUMBER, FLAGS);

    private final TargetConflictPolicy conflictPolicy;

    public TargetResolver() {
        this(TargetConflictPolicy.PREFER_EXPLICIT);
    }

    public TargetResolver(TargetConflictPolicy conflictPolicy) {
        this.conflictPolicy = conflictPolicy != null ? conflictPolicy : TargetConflictPolicy.PREFER_EXPLICIT;
    }

    public TargetConflictPolicy getConflictPolicy() {
        return conflictPolicy;
    }

    /**
     * @return the resolved target, or null when no rule applies
     */
    public ResolvedTarget resolve(DictamenOperation operation) {
        if (!isBlank(operation.getDestinoCapitulo())) {
            return ResolvedTarget.chapter(operation.getDestinoCapitulo());
        }

        String inciso = normalizeInciso(operation.getDestinoInciso());
        ArticleIdentifier fromText = fromReplacementText(operation.getTextoNuevo());
        ArticleIdentifier explicit = explicitTarget(operation, inciso);

        if (explicit != null) {
            // an inciso replacement never restates its parent article, so no conflict is possible there
            if (fromText != null && inciso == null && !fromText.equals(explicit)) {
                if (conflictPolicy == TargetConflictPolicy.PREFER_REPLACEMENT_TEXT) {
                    return ResolvedTarget.article(fromText, null, ResolvedTarget.Rule.REPLACEMENT_TEXT).withDiscarded(explicit);
                }
                return ResolvedTarget.article(explicit, null, ResolvedTarget.Rule.EXPLICIT_FIELD).withDiscarded(fromText);
            }
            return ResolvedTarget.article(explicit, inciso, ResolvedTarget.Rule.EXPLICIT_FIELD);
        }

        if (fromText != null && inciso == null) {
            return ResolvedTarget.article(fromText, null, ResolvedTarget.Rule.REPLACEMENT_TEXT);
        }

        return fromHeader(operation.getEncabezado(), inciso);
    }

    private ArticleIdentifier explicitTarget(DictamenOperation operation, String inciso) {
        if (!isBlank(operation.getDestinoArticulo())) {
            return ArticleIdentifier.parse(operation.getDestinoArticulo());
        }
        if (inciso != null && !isBlank(operation.getDestinoArticuloPadre())) {
            return ArticleIdentifier.parse(operation.getDestinoArticuloPadre());
        }
        return null;
    }

    /**
     * Article number restated at the start of a replacement text, or null.
     */
    public static ArticleIdentifier fromReplacementText(String textoNuevo) {
        if (isBlank(textoNuevo)) {
            return null;
        }
        Matcher matcher = REPLACEMENT_HEADER.matcher(textoNuevo);
        return matcher.find() ? ArticleIdentifier.parse(matcher.group(1)) : null;
    }

    private ResolvedTarget fromHeader(String encabezado, String inciso) {
        if (isBlank(encabezado)) {
            return null;
        }

        Matcher matcher = HEADER_INCORPORATION.matcher(encabezado);
        if (matcher.find()) {
            return ResolvedTarget.article(ArticleIdentifier.parse(matcher.group(1)), inciso, ResolvedTarget.Rule.HEADER_INCORPORATION);
        }

        matcher = HEADER_INCISO.matcher(encabezado);
        if (matcher.find()) {
            String letter = inciso != null ? inciso : matcher.group(1).toLowerCase(Locale.ROOT);
            return ResolvedTarget.article(ArticleIdentifier.parse(matcher.group(2)), letter, ResolvedTarget.Rule.HEADER_INCISO);
        }

        matcher = HEADER_VERB.matcher(encabezado);
        if (matcher.find()) {
            return ResolvedTarget.article(ArticleIdentifier.parse(matcher.group(1)), inciso, ResolvedTarget.Rule.HEADER_VERB);
        }

        // skip "ARTÍCULO 21°-" so the dictamen's own number is not taken for the target
        Matcher header = DICTAMEN_HEADER.matcher(encabezado);
        String tail = header.find() ? encabezado.substring(header.end()) : encabezado;
        matcher = HEADER_CITATION.matcher(tail);
        if (matcher.find()) {
            return ResolvedTarget.article(ArticleIdentifier.parse(matcher.group(1)), inciso, ResolvedTarget.Rule.HEADER_CITATION);
        }
        return null;
    }

    private static String normalizeInciso(String inciso) {
        if (isBlank(inciso)) {
            return null;
        }
        String letter = inciso.trim().replace(")", "").toLowerCase(Locale.ROOT);
        return letter.isEmpty() ? null : letter;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
