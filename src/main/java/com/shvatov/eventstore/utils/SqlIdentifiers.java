package com.shvatov.eventstore.utils;

import java.util.Objects;

public class SqlIdentifiers {
    private static final int MAX_IDENTIFIER_LENGTH = 128;

    private SqlIdentifiers() {
    }

    public static String requireValid(final String identifier, final String kind) {
        if (Objects.isNull(identifier) || identifier.isBlank()) {
            throw new IllegalArgumentException("%s name must not be blank".formatted(kind));
        }
        if (identifier.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(
                    "%s name \"%s\" is longer than %s characters"
                            .formatted(kind, identifier, MAX_IDENTIFIER_LENGTH)
            );
        }
        return identifier;
    }

    public static String quote(final String identifier) {
        return "[" + identifier.replace("]", "]]") + "]";
    }

    public static String qualify(final String schemaName, final String objectName) {
        return quote(schemaName) + "." + quote(objectName);
    }
}
