package com.glowup.backend.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PinHasherTest {

    @Test
    void hash_shouldMatchKnownSha256() {
        assertEquals("03ac674216f3e15c761ee1a5e255f067953623c8b388b4459e13f978d7c846f4",
                PinHasher.hash("1234"));
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                PinHasher.hash(""));
    }

    @Test
    void hash_shouldReturn64CharLowercaseHex() {
        String hash = PinHasher.hash("secret-pin");
        assertEquals(64, hash.length());
        assertTrue(hash.matches("[0-9a-f]+"));
    }

    @Test
    void matches_shouldAcceptOnlyExactPin() {
        String stored = PinHasher.hash("4321");
        assertTrue(PinHasher.matches("4321", stored));
        assertFalse(PinHasher.matches("4322", stored));
        assertFalse(PinHasher.matches("4321 ", stored));
    }

    @Test
    void matches_shouldRejectMissingPin() {
        String stored = PinHasher.hash("4321");
        assertFalse(PinHasher.matches(null, stored));
        assertFalse(PinHasher.matches("", stored));
    }
}
