package com.shvatov.eventstore.service.lock;

import com.shvatov.eventstore.model.LockKey;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.zip.CRC32;

/**
 * Derives advisory lock keys from namespace names.
 * <p>
 * The source string is {@code databaseName} alone, or {@code additionalNames} followed by
 * {@code databaseName}, joined with the NUL character. The key is the CRC-32 (IEEE) checksum of
 * the UTF-8 bytes of the source multiplied by {@value #SALT} modulo 2<sup>32</sup>. Sessions pass
 * the schema name as the only additional name, so the source is {@code schema + '\0' + database}.
 * The resulting unsigned 32-bit value, written in decimal, is the lock resource name.
 */
public final class LockKeyGenerator {
    static final long SALT = 1486364155L;
    private static final String SEPARATOR = "\u0000";
    private static final long UINT32_MASK = 0xFFFFFFFFL;

    private LockKeyGenerator() {
    }

    public static LockKey generate(final String databaseName, final String... additionalNames) {
        Objects.requireNonNull(databaseName, "databaseName");

        var source = databaseName;
        if (additionalNames.length > 0) {
            final var names = new ArrayList<>(List.of(additionalNames));
            names.add(databaseName);
            source = String.join(SEPARATOR, names);
        }

        final var checksum = new CRC32();
        checksum.update(source.getBytes(StandardCharsets.UTF_8));
        return new LockKey((int) ((checksum.getValue() * SALT) & UINT32_MASK));
    }
}
