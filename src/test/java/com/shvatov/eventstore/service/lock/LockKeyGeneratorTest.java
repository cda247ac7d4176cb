package com.shvatov.eventstore.service.lock;

import com.shvatov.eventstore.model.LockKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.HashSet;
import java.util.zip.CRC32;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LockKeyGeneratorTest {
    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    @Test
    @DisplayName("same namespace always yields the same key")
    void testDeterministic() {
        final var first = LockKeyGenerator.generate("test", "test_schema");
        final var second = LockKeyGenerator.generate("test", "test_schema");

        assertEquals(first, second);
        assertEquals(first.resourceName(), second.resourceName());
    }

    @Test
    @DisplayName("key is the salted crc32 of schema and database joined with NUL")
    void testAlgorithm() {
        final var checksum = new CRC32();
        checksum.update("test_schema\u0000test".getBytes(StandardCharsets.UTF_8));
        final var expected = (checksum.getValue() * 1486364155L) % (1L << 32);

        final var key = LockKeyGenerator.generate("test", "test_schema");

        assertEquals(Long.toString(expected), key.resourceName());
        assertEquals((int) expected, key.value());
    }

    @Test
    @DisplayName("database name alone is hashed without separator")
    void testDatabaseOnly() {
        final var checksum = new CRC32();
        checksum.update("orders".getBytes(StandardCharsets.UTF_8));
        final var expected = (checksum.getValue() * LockKeyGenerator.SALT) & 0xFFFFFFFFL;

        assertEquals(Long.toString(expected), LockKeyGenerator.generate("orders").resourceName());
    }

    @Test
    @DisplayName("resource name is an unsigned 32-bit decimal")
    void testResourceNameRange() {
        for (int i = 0; i < 500; i++) {
            final var resourceName = LockKeyGenerator.generate("db_" + i, "schema_" + i).resourceName();
            final var value = Long.parseLong(resourceName);
            assertTrue(value >= 0 && value < (1L << 32), resourceName);
        }
    }

    @Test
    @DisplayName("swapping database and schema gives a different key")
    void testOrderMatters() {
        assertNotEquals(LockKeyGenerator.generate("a", "b"), LockKeyGenerator.generate("b", "a"));
    }

    @Test
    @DisplayName("pairs differing within a 4 byte window never collide")
    void testNoCollisionsWithinBurstWindow() {
        final var keys = new HashSet<LockKey>();
        var pairs = 0;
        for (final char x : ALPHABET.toCharArray()) {
            for (final char y : ALPHABET.toCharArray()) {
                for (final char z : ALPHABET.toCharArray()) {
                    keys.add(LockKeyGenerator.generate(z + "_main", "app_" + x + y));
                    pairs++;
                }
            }
        }
        assertEquals(pairs, keys.size());
    }

    @Test
    @DisplayName("realistic tenant namespaces get distinct keys")
    void testNoCollisionsForTenants() {
        final var keyToNamespace = new HashMap<LockKey, String>();
        for (int tenant = 0; tenant < 200; tenant++) {
            for (final var schema : new String[]{"dbo", "outbox", "billing", "orders", "audit"}) {
                final var namespace = "tenant_" + tenant + "/" + schema;
                final var previous = keyToNamespace.put(
                        LockKeyGenerator.generate("tenant_" + tenant, schema), namespace
                );
                assertNull(previous, () -> "collision between " + previous + " and " + namespace);
            }
        }
        assertEquals(1000, keyToNamespace.size());
    }

    @Test
    @DisplayName("null database name is rejected")
    void testNullDatabaseName() {
        assertThrows(NullPointerException.class, () -> LockKeyGenerator.generate(null, "dbo"));
    }
}
