package com.simpla.reconciliation.engine;

import com.simpla.reconciliation.identifier.ArticleIdentifier;
import com.simpla.reconciliation.model.Inciso;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits the {@code texto_nuevo} of an operation into title, body and incisos.
 * <p>
 * "ARTÍCULO 2°- Ámbito de aplicación. La vigencia ...\na) ...\nb) ..." yields title
 * "Ámbito de aplicación.", body "La vigencia ..." and incisos a and b.
 */
public class ReplacementTextParser {

    /** Longest first sentence still considered a heading. */
    static final int MAX_TITLE_LENGTH = 100;

    private static final Pattern ARTICLE_PREFIX = Pattern.compile(
            "^art[íi]culo\\s+\\d+(?:\\s*(?:" + ArticleIdentifier.SUFFIX_ALTERNATION + ")\\b)?\\s*[°º]?\\s*[-–—]\\s*",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern INCISO_LINE = Pattern.compile("^\\s*([a-zA-Z])\\)\\s+(.*)$");

    private static final Pattern SENTENCE_END = Pattern.compile("\\.\\s+");

    private static final String OPENING_QUOTES = "\"“«'";
    private static final String CLOSING_QUOTES = "\"”»'";

    public ParsedReplacement parse(String textoNuevo) {
        if (textoNuevo == null || textoNuevo.isBlank()) {
            return new ParsedReplacement(null, null, new ArrayList<>(), null);
        }

        String text = unquote(textoNuevo.replace("\r\n", "\n").trim());
        Matcher prefix = ARTICLE_PREFIX.matcher(text);
        if (prefix.find()) {
            text = text.substring(prefix.end());
        }

        List<String> head = new ArrayList<>();
        List<Inciso> incisos = new ArrayList<>();
        StringBuilder current = null;
        String currentLetter = null;
        for (String line : text.split("\n", -1)) {
            Matcher incisoLine = INCISO_LINE.matcher(line);
            if (incisoLine.matches()) {
                if (current != null) {
                    incisos.add(new Inciso(currentLetter, current.toString().trim()));
                }
                currentLetter = incisoLine.group(1).toLowerCase(Locale.ROOT);
                current = new StringBuilder(incisoLine.group(2));
            } else if (current != null) {
                current.append('\n').append(line);
            } else {
                head.add(line);
            }
        }
        if (current != null) {
            incisos.add(new Inciso(currentLetter, current.toString().trim()));
        }

        String headText = String.join("\n", head).trim();
        if (headText.isEmpty()) {
            return new ParsedReplacement(null, null, incisos, null);
        }

        String firstLine = headText.split("\n", 2)[0].trim();
        Matcher sentenceEnd = SENTENCE_END.matcher(firstLine);
        if (sentenceEnd.find() && sentenceEnd.start() + 1 <= MAX_TITLE_LENGTH) {
            String title = firstLine.substring(0, sentenceEnd.start() + 1).trim();
            String body = headText.substring(sentenceEnd.end()).trim();
            return new ParsedReplacement(title, body.isEmpty() ? null : body, incisos, firstLine);
        }
        return new ParsedReplacement(null, headText, incisos, firstLine);
    }

    /**
     * Text of a single inciso replacement, without its "b) " letter prefix.
     */
    public String parseIncisoText(String textoNuevo) {
        if (textoNuevo == null) {
            return null;
        }
        String text = unquote(textoNuevo.replace("\r\n", "\n").trim());
        Matcher incisoLine = INCISO_LINE.matcher(text.split("\n", 2)[0]);
        if (incisoLine.matches()) {
            int letterEnd = text.indexOf(')') + 1;
            text = text.substring(letterEnd);
        }
        return text.trim();
    }

    /**
     * Removes one wrapping quote pair. Inner or unpaired quotes belong to the text.
     */
    private static String unquote(String text) {
        if (text.length() < 2) {
            return text;
        }
        int opening = OPENING_QUOTES.indexOf(text.charAt(0));
        if (opening < 0 || CLOSING_QUOTES.charAt(opening) != text.charAt(text.length() - 1)) {
            return text;
        }
        return text.substring(1, text.length() - 1).trim();
    }
}
