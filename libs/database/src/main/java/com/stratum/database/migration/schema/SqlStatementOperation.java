package com.stratum.database.migration.schema;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A {@link SchemaOperation} backed by one SQL statement.
 *
 * <p>Without parameters the text is executed as a plain {@link Statement}, so a {@code ?} in it is
 * passed to the database untouched (PostgreSQL's jsonb operators, for instance).
 *
 * @param sql statement text, may contain {@code ?} placeholders when parameters are given
 * @param parameters values bound to the placeholders in order
 */
public record SqlStatementOperation(String sql, List<Object> parameters) implements SchemaOperation {

    public SqlStatementOperation {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("sql must not be null or blank");
        }
        // copied by hand: bound values may legitimately be null
        parameters = parameters == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public SqlStatementOperation(String sql) {
        this(sql, List.of());
    }

    @Override
    public void apply(Connection connection) throws SQLException {
        if (parameters.isEmpty()) {
            try (Statement statement = connection.createStatement()) {
                statement.execute(sql);
            }
            return;
        }
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < parameters.size(); i++) {
                statement.setObject(i + 1, parameters.get(i));
            }
            statement.execute();
        }
    }

    @Override
    public String description() {
        return sql;
    }
}
