package com.shvatov.eventstore.utils;

import org.springframework.jdbc.core.JdbcOperations;

import java.util.Objects;
import java.util.Optional;

public class JdbcTemplateUtils {
    private JdbcTemplateUtils() {
    }

    public static <L> Optional<L> querySingle(final JdbcOperations jdbcTemplate,
                                              final String sql,
                                              final Class<L> type) {
        return jdbcTemplate.queryForList(sql, type).stream()
                .filter(Objects::nonNull)
                .findFirst();
    }

    public static Optional<String> querySingleNonBlank(final JdbcOperations jdbcTemplate, final String sql) {
        return querySingle(jdbcTemplate, sql, String.class)
                .filter(value -> !value.isBlank());
    }
}
