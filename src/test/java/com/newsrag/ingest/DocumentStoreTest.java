package com.newsrag.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.Test;

class DocumentStoreTest {

    @Test
    void shouldIgnoreDocumentsWithKnownContentHash() {
        DocumentStore store = new DocumentStore();

        assertTrue(store.add(document("Article A", "Business")));
        assertFalse(store.add(document("Article A", "Business")));
        assertFalse(store.add(document("  Article A\r\n", "Business")));

        assertEquals(1, store.size());
    }

    @Test
    void shouldReleaseContentHashOnRemoval() {
        DocumentStore store = new DocumentStore();
        Document document = document("Rates hold steady", "Economy");
        store.add(document);

        assertTrue(store.remove(document.id()).isPresent());
        assertTrue(store.idForContentHash(document.contentHash()).isEmpty());
        assertTrue(store.add(document));
    }

    @Test
    void shouldFilterByCategoryAndCopyIndependently() {
        DocumentStore store = new DocumentStore();
        store.add(document("Chip exports rise", "Technology"));
        store.add(document("New office lease signed", "RealEstate"));
        store.add(document("Cloud spending grows", "Technology"));

        DocumentStore copy = store.copy();
        copy.add(document("Quantum startup raises funds", "Technology"));

        assertEquals(2, store.byCategory("Technology").size());
        assertEquals(3, copy.byCategory("Technology").size());
        assertTrue(store.byCategory("Law").isEmpty());
    }

    @Test
    void shouldRejectIdCollisionWithDifferentContent() {
        DocumentStore store = new DocumentStore();
        store.add(new Document("doc-1", "first", "Business", null, "hash-1", Instant.EPOCH));

        assertThrows(IllegalStateException.class,
                () -> store.add(new Document("doc-1", "second", "Business", null, "hash-2", Instant.EPOCH)));
    }

    @Test
    void shouldDeriveStableIdsFromNormalizedContent() {
        String hash = ContentHasher.contentHash("Line one\r\nLine two  ");

        assertEquals(ContentHasher.contentHash("Line one\nLine two"), hash);
        assertEquals(64, hash.length());
        assertEquals("doc-" + hash.substring(0, 24), ContentHasher.documentId(hash));
    }

    static Document document(String text, String category) {
        String hash = ContentHasher.contentHash(text);
        return new Document(ContentHasher.documentId(hash), text.strip(), category, null, hash, Instant.EPOCH);
    }
}
