package com.simpla.reconciliation.engine;

import com.simpla.reconciliation.identifier.ArticleIdentifier;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IncorporationDeduplicatorTest {

    private final IncorporationDeduplicator deduplicator = new IncorporationDeduplicator();
    private final StatuteIndex index = StatuteIndex.of(StatuteFixtures.lct());

    @Test
    void existingNumberIsNotNew() {
        assertFalse(deduplicator.isGenuinelyNew(ArticleIdentifier.parse("80 bis"), index));
        assertFalse(deduplicator.isGenuinelyNew(ArticleIdentifier.parse("2"), index));
    }

    @Test
    void suffixMakesANewArticle() {
        assertTrue(deduplicator.isGenuinelyNew(ArticleIdentifier.parse("80 ter"), index));
        assertTrue(deduplicator.isGenuinelyNew(ArticleIdentifier.parse("54 bis"), index));
    }
}
