package org.sqlmarshal;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlCommandTest {
    private Connection connection;

    @BeforeEach
    void setUp() throws SQLException {
        connection = DriverManager.getConnection("jdbc:h2:mem:" + UUID.randomUUID());
        try (var stmt = connection.createStatement()) {
            stmt.execute("create table person (id int primary key, name varchar(50), age int)");
            stmt.execute("insert into person values (1, 'Ann', 31), (2, null, 40)");
        }
    }

    @AfterEach
    void tearDown() throws SQLException {
        connection.close();
    }

    @Test
    void executeScalar_bindsNamedParameters() throws SQLException {
        try (var command = SqlCommand.create(connection)) {
            var idParameter = command.createParameter();
            idParameter.setName("@person_id");
            idParameter.setValue(1);

            command.setCommandText("select name from person where id = @person_id");
            command.addParameters(idParameter);

            assertThat(command.executeScalar()).isEqualTo("Ann");
        }
    }

    @Test
    void executeScalar_returnsDbNull_forNullValueAndMissingRow() throws SQLException {
        try (var command = SqlCommand.create(connection)) {
            command.setCommandText("select name from person where id = 2");
            assertThat(command.executeScalar()).isSameAs(DbNull.VALUE);
        }
        try (var command = SqlCommand.create(connection)) {
            command.setCommandText("select name from person where id = 99");
            assertThat(command.executeScalar()).isSameAs(DbNull.VALUE);
        }
    }

    @Test
    void executeNonQuery_bindsDbNullAsSqlNull() throws SQLException {
        try (var command = SqlCommand.create(connection)) {
            var idParameter = command.createParameter();
            idParameter.setName("@id");
            idParameter.setValue(3);
            var nameParameter = command.createParameter();
            nameParameter.setName("@name");
            nameParameter.setSqlType(Types.VARCHAR);
            nameParameter.setValue(DbNull.VALUE);

            command.setCommandText("insert into person (id, name, age) values (@id, @name, 20)");
            command.addParameters(idParameter, nameParameter);

            assertThat(command.executeNonQuery()).isEqualTo(1);
        }
        try (var command = SqlCommand.create(connection)) {
            command.setCommandText("select count(*) from person where id = 3 and name is null");
            assertThat(command.executeScalar()).isEqualTo(1L);
        }
    }

    @Test
    void executeReader_readsRowsWithDbNullSentinel() throws SQLException {
        var names = new ArrayList<Object>();
        var ages = new ArrayList<Object>();

        try (var command = SqlCommand.create(connection)) {
            command.setCommandText("select name, age from person order by id");
            var reader = command.executeReader();

            assertThat(reader.getFieldCount()).isEqualTo(2);
            while (reader.read()) {
                names.add(reader.getValue(0));
                ages.add(reader.getValue(1));
            }
            reader.close();
        }

        assertThat(names).containsExactly("Ann", DbNull.VALUE);
        assertThat(ages).containsExactly(31, 40);
    }

    @Test
    void setValue_storesNullAsDbNull() throws SQLException {
        try (var command = SqlCommand.create(connection)) {
            var parameter = command.createParameter();
            parameter.setValue(null);

            assertThat(parameter.getValue()).isSameAs(DbNull.VALUE);
            assertThat(parameter.getDirection()).isEqualTo(ParameterDirection.INPUT);
            assertThat(parameter.hasSqlType()).isFalse();
        }
    }

    @Test
    void execute_failsOnUnboundReference() throws SQLException {
        try (var command = SqlCommand.create(connection)) {
            command.setCommandText("select name from person where id = @missing");

            assertThatThrownBy(command::executeScalar)
                .isInstanceOf(SqlMarshalException.class)
                .hasMessageContaining("@missing");
        }
    }

    @Test
    void execute_failsWhenCommandReused() throws SQLException {
        try (var command = SqlCommand.create(connection)) {
            command.setCommandText("select count(*) from person");
            command.executeScalar();

            assertThatThrownBy(command::executeScalar)
                .isInstanceOf(SqlMarshalException.class)
                .hasMessageContaining("already been executed");
        }
    }

    @Test
    void addParameters_rejectsDuplicateNames() throws SQLException {
        try (var command = SqlCommand.create(connection)) {
            var first = command.createParameter();
            first.setName("@id");
            var second = command.createParameter();
            second.setName("@id");

            assertThatThrownBy(() -> command.addParameters(first, second))
                .isInstanceOf(SqlMarshalException.class)
                .hasMessageContaining("@id");
        }
    }

    @Test
    void outputParameter_withoutSqlType_isRejected() throws SQLException {
        try (var command = SqlCommand.create(connection)) {
            var total = command.createParameter();
            total.setName("@total");
            total.setDirection(ParameterDirection.OUTPUT);

            command.setCommandText("sp_total @total OUTPUT");
            command.setCommandType(CommandType.STORED_PROCEDURE);
            command.addParameters(total);

            assertThatThrownBy(command::executeNonQuery)
                .isInstanceOf(SqlMarshalException.class)
                .hasMessageContaining("no SQL type");
        }
    }
}
