package org.sqlmarshal;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Single-use command executed against a JDBC [Connection] on behalf of generated code.
///
/// Parameters are referenced from the command text by name (`@client_id`) and bound to JDBC
/// positional placeholders at execution time. The connection is not closed by this command.
public final class SqlCommand implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SqlCommand.class);

    private final Connection connection;
    private final Map<String, SqlParameter> parameters = new LinkedHashMap<>();
    private final List<OutputSlot> outputs = new ArrayList<>();
    private String commandText = "";
    private CommandType commandType = CommandType.TEXT;
    private @Nullable PreparedStatement statement;
    private boolean outputsCollected;

    private record OutputSlot(SqlParameter parameter, int index) {}

    private SqlCommand(Connection connection) {
        this.connection = connection;
    }

    public static SqlCommand create(Connection connection) {
        return new SqlCommand(connection);
    }

    public SqlParameter createParameter() {
        return new SqlParameter();
    }

    public String getCommandText() {
        return commandText;
    }

    public void setCommandText(String commandText) {
        this.commandText = commandText;
    }

    public CommandType getCommandType() {
        return commandType;
    }

    public void setCommandType(CommandType commandType) {
        this.commandType = commandType;
    }

    public void addParameters(SqlParameter... added) {
        for (var parameter : added) {
            if (parameters.putIfAbsent(parameter.getName(), parameter) != null) {
                throw new SqlMarshalException("Duplicate parameter " + parameter.getName());
            }
        }
    }

    /// Executes the command and returns the first column of the first row, or [DbNull#VALUE]
    /// when there is no row or the value is SQL NULL.
    public Object executeScalar() throws SQLException {
        return scalar(null);
    }

    /// Same as [#executeScalar()], with the value converted by the driver to `type`.
    public Object executeScalar(Class<?> type) throws SQLException {
        return scalar(type);
    }

    /// Executes the command and returns the update count, `-1` when the command produced a result set.
    public int executeNonQuery() throws SQLException {
        var stmt = prepare();
        var count = stmt.execute() ? -1 : stmt.getUpdateCount();
        collectOutputs();
        return count;
    }

    /// Executes the command and returns a reader over its rows. Output parameters are available
    /// once the reader is closed.
    public SqlDataReader executeReader() throws SQLException {
        var stmt = prepare();
        return new SqlDataReader(stmt.executeQuery(), this);
    }

    @Override
    public void close() throws SQLException {
        if (statement != null) {
            statement.close();
        }
    }

    void collectOutputs() throws SQLException {
        if (outputsCollected || outputs.isEmpty()) {
            return;
        }
        var callable = (CallableStatement) statement;
        for (var slot : outputs) {
            var valueType = slot.parameter().getValueType();
            var value = valueType == null
                        ? callable.getObject(slot.index())
                        : callable.getObject(slot.index(), valueType);
            slot.parameter().setValue(value == null || callable.wasNull() ? DbNull.VALUE : value);
        }
        outputsCollected = true;
    }

    private Object scalar(@Nullable Class<?> type) throws SQLException {
        var stmt = prepare();
        Object result = DbNull.VALUE;

        if (stmt.execute()) {
            try (var resultSet = stmt.getResultSet()) {
                if (resultSet.next()) {
                    var value = type == null ? resultSet.getObject(1) : resultSet.getObject(1, type);
                    result = value == null || resultSet.wasNull() ? DbNull.VALUE : value;
                }
            }
        }
        collectOutputs();
        return result;
    }

    private PreparedStatement prepare() throws SQLException {
        if (statement != null) {
            throw new SqlMarshalException("Command has already been executed: " + commandText);
        }

        requireOutputTypes();
        var parsed = CommandText.commandText(commandText, commandType);
        var needsCall = commandType == CommandType.STORED_PROCEDURE || hasOutputParameters();

        log.debug("Executing {} as {}", commandText, parsed.sql());

        var stmt = needsCall
                   ? connection.prepareCall(parsed.sql())
                   : connection.prepareStatement(parsed.sql());
        statement = stmt;
        bind(stmt, parsed.references());
        return stmt;
    }

    private void bind(PreparedStatement stmt, List<CommandText.Reference> references) throws SQLException {
        var referenced = new ArrayList<String>();

        for (int i = 0; i < references.size(); i++) {
            var index = i + 1;
            var name = references.get(i).name();
            var parameter = parameters.get(name);

            if (parameter == null) {
                throw new SqlMarshalException("No parameter " + name + " bound for command: " + commandText);
            }

            if (parameter.getDirection().isInput()) {
                bindValue(stmt, index, parameter);
            }
            if (parameter.getDirection().isOutput() && !referenced.contains(name)) {
                registerOutput(stmt, index, parameter);
            }
            referenced.add(name);
        }

        for (var name : parameters.keySet()) {
            if (!referenced.contains(name)) {
                log.warn("Parameter {} is not referenced by command: {}", name, commandText);
            }
        }
    }

    private static void bindValue(PreparedStatement stmt, int index, SqlParameter parameter) throws SQLException {
        if (parameter.getValue() == DbNull.VALUE) {
            stmt.setNull(index, parameter.getSqlType());
        } else {
            stmt.setObject(index, parameter.getValue());
        }
    }

    private void requireOutputTypes() {
        for (var parameter : parameters.values()) {
            if (parameter.getDirection().isOutput() && !parameter.hasSqlType()) {
                throw new SqlMarshalException("Output parameter " + parameter.getName() + " has no SQL type");
            }
        }
    }

    private void registerOutput(PreparedStatement stmt, int index, SqlParameter parameter) throws SQLException {
        ((CallableStatement) stmt).registerOutParameter(index, parameter.getSqlType());
        outputs.add(new OutputSlot(parameter, index));
    }

    private boolean hasOutputParameters() {
        return parameters.values()
                         .stream()
                         .anyMatch(parameter -> parameter.getDirection().isOutput());
    }
}
