package com.shvatov.eventstore.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SqlIdentifiersTest {
    @Test
    void testQuote() {
        assertEquals("[event_store]", SqlIdentifiers.quote("event_store"));
        assertEquals("[a]]b]", SqlIdentifiers.quote("a]b"));
        assertEquals("[dbo].[event_store]", SqlIdentifiers.qualify("dbo", "event_store"));
    }

    @Test
    void testRequireValid() {
        assertEquals("event_store", SqlIdentifiers.requireValid("event_store", "Table"));
        assertThrows(IllegalArgumentException.class, () -> SqlIdentifiers.requireValid("", "Table"));
        assertThrows(IllegalArgumentException.class, () -> SqlIdentifiers.requireValid("x".repeat(129), "Table"));
    }
}
