package com.simpla.reconciliation.identifier;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical identity of an article inside a reconciliation run.
 * <p>
 * Numbered articles are {@code base + suffix} ("80 bis"). Articles printed without a
 * number are given a synthetic identity made of the container they live in (usually a
 * chapter) and their 1-based position in it.
 * <p>
 * Ordering: numbered before synthetic; numbered by base then suffix rank; synthetic by
 * scope then positional index.
 */
public final class ArticleIdentifier implements Comparable<ArticleIdentifier> {

    /** Regex alternation of every suffix word. */
    public static final String SUFFIX_ALTERNATION =
            "bis|ter|quater|quinquies|sexies|septies|octies|nonies|decies";

    private static final Pattern LABEL_PATTERN = Pattern.compile(
            "^\\s*(\\d+)\\s*[°º]?\\s*(?:(" + SUFFIX_ALTERNATION + ")\\b)?.*$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final int base;
    private final OrdinalSuffix suffix;
    private final String syntheticScope;
    private final int positionalIndex;

    private ArticleIdentifier(int base, OrdinalSuffix suffix, String syntheticScope, int positionalIndex) {
        this.base = base;
        this.suffix = suffix;
        this.syntheticScope = syntheticScope;
        this.positionalIndex = positionalIndex;
    }

    public static ArticleIdentifier numbered(int base, OrdinalSuffix suffix) {
        if (base < 0) {
            throw new IllegalArgumentException("Article base must be non-negative: " + base);
        }
        return new ArticleIdentifier(base, suffix != null ? suffix : OrdinalSuffix.NONE, null, 0);
    }

    public static ArticleIdentifier synthetic(String scope, int positionalIndex) {
        if (scope == null || scope.isBlank()) {
            throw new IllegalArgumentException("Synthetic identifier needs a scope");
        }
        if (positionalIndex < 1) {
            throw new IllegalArgumentException("Positional index is 1-based: " + positionalIndex);
        }
        return new ArticleIdentifier(0, OrdinalSuffix.NONE, scope.trim().toUpperCase(Locale.ROOT), positionalIndex);
    }

    /**
     * Lenient parse of labels such as "54", "54°", "80 bis", "11BIS". Anything that does
     * not start with digits falls back to {@code 0} without suffix; this never throws.
     */
    public static ArticleIdentifier parse(String label) {
        if (label == null) {
            return numbered(0, OrdinalSuffix.NONE);
        }
        Matcher matcher = LABEL_PATTERN.matcher(label);
        if (!matcher.matches()) {
            return numbered(0, OrdinalSuffix.NONE);
        }
        int base;
        try {
            base = Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            // more digits than an int holds
            return numbered(0, OrdinalSuffix.NONE);
        }
        return numbered(base, OrdinalSuffix.fromWord(matcher.group(2)));
    }

    /**
     * True for labels the statute sources use for articles printed without a number.
     */
    public static boolean isUnnumbered(String label) {
        if (label == null) {
            return true;
        }
        String value = label.trim();
        return value.isEmpty()
                || value.equalsIgnoreCase("S/N")
                || value.equalsIgnoreCase("N/A")
                || value.equalsIgnoreCase("none")
                || value.equalsIgnoreCase("null");
    }

    public boolean isSynthetic() {
        return syntheticScope != null;
    }

    public int getBase() {
        return base;
    }

    public OrdinalSuffix getSuffix() {
        return suffix;
    }

    public String getSyntheticScope() {
        return syntheticScope;
    }

    public int getPositionalIndex() {
        return positionalIndex;
    }

    /**
     * Human readable label: "54", "80 bis", or "S/N 3 (VIII)" for synthetic identifiers.
     */
    public String label() {
        if (isSynthetic()) {
            return "S/N " + positionalIndex + " (" + syntheticScope + ")";
        }
        return suffix == OrdinalSuffix.NONE ? String.valueOf(base) : base + " " + suffix.getWord();
    }

    @Override
    public int compareTo(ArticleIdentifier other) {
        if (isSynthetic() != other.isSynthetic()) {
            return isSynthetic() ? 1 : -1;
        }
        if (isSynthetic()) {
            int byScope = syntheticScope.compareTo(other.syntheticScope);
            return byScope != 0 ? byScope : Integer.compare(positionalIndex, other.positionalIndex);
        }
        int byBase = Integer.compare(base, other.base);
        return byBase != 0 ? byBase : Integer.compare(suffix.rank(), other.suffix.rank());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ArticleIdentifier)) {
            return false;
        }
        ArticleIdentifier that = (ArticleIdentifier) o;
        return base == that.base
                && positionalIndex == that.positionalIndex
                && suffix == that.suffix
                && Objects.equals(syntheticScope, that.syntheticScope);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, suffix, syntheticScope, positionalIndex);
    }

    @Override
    public String toString() {
        return isSynthetic() ? "CAP_" + syntheticScope + "_ART_" + positionalIndex : label();
    }
}
