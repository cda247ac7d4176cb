package com.shvatov.eventstore.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.stream.Collectors;

@Getter
@RequiredArgsConstructor
public enum EventStoreColumn {
    ID("id", "int identity(1,1) not null primary key"),
    DISPATCHED("dispatched", "bit not null default 0"),
    DISPATCHED_AT("dispatched_at", "datetime2 null"),
    PAYLOAD("payload", "varbinary(max) not null"),
    OPTIONS("options", "nvarchar(max) null"),
    HEADERS("headers", "nvarchar(max) null");

    public static final String DEFAULT_TABLE_NAME = "event_store";

    private final String columnName;
    private final String definition;

    public static String tableDefinition() {
        return Arrays.stream(values())
                .map(column -> column.columnName + " " + column.definition)
                .collect(Collectors.joining(",\n    ", "(\n    ", "\n)"));
    }
}
