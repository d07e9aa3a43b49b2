package com.marketpool.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextHasherTest {

    @Test
    void testKnownDigest() {
        // sha256("abc")
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", TextHasher.hash("abc"));
    }

    @Test
    void testWhitespaceAroundTextDoesNotChangeTheHash() {
        assertEquals(TextHasher.hash("Will X happen?"), TextHasher.hash("  Will X happen?\n"));
        assertNotEquals(TextHasher.hash("Will X happen?"), TextHasher.hash("Will Y happen?"));
    }

    @Test
    void testCacheEntryUsesNormalizedText() {
        CacheEntry entry = CacheEntry.of("  hello ", new double[] {1.0, 2.0});

        assertEquals("hello", entry.getText());
        assertEquals(TextHasher.hash("hello"), entry.getTextHash());
        assertEquals(64, entry.getTextHash().length());
    }
}
