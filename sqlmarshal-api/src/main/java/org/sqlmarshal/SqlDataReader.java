package org.sqlmarshal;

import java.sql.ResultSet;
import java.sql.SQLException;

/// Forward-only row cursor returned by [SqlCommand#executeReader()].
public final class SqlDataReader implements AutoCloseable {
    private final ResultSet resultSet;
    private final SqlCommand command;

    SqlDataReader(ResultSet resultSet, SqlCommand command) {
        this.resultSet = resultSet;
        this.command = command;
    }

    public boolean read() throws SQLException {
        return resultSet.next();
    }

    /// Value of the column at the zero-based `ordinal`, [DbNull#VALUE] for SQL NULL.
    public Object getValue(int ordinal) throws SQLException {
        var value = resultSet.getObject(ordinal + 1);
        return value == null || resultSet.wasNull() ? DbNull.VALUE : value;
    }

    /// Value of the column at the zero-based `ordinal` converted by the driver to `type`,
    /// [DbNull#VALUE] for SQL NULL.
    public Object getValue(int ordinal, Class<?> type) throws SQLException {
        var value = resultSet.getObject(ordinal + 1, type);
        return value == null || resultSet.wasNull() ? DbNull.VALUE : value;
    }

    public int getFieldCount() throws SQLException {
        return resultSet.getMetaData().getColumnCount();
    }

    /// Underlying result set, for handing the rows to a mapping library.
    public ResultSet resultSet() {
        return resultSet;
    }

    /// Closes the cursor and makes output parameter values available.
    @Override
    public void close() throws SQLException {
        resultSet.close();
        command.collectOutputs();
    }
}
