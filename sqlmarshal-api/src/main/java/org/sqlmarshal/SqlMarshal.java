package org.sqlmarshal;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Marks an abstract method whose body is generated by the SqlMarshal annotation processor.
///
/// The generated body executes either a named stored procedure or the command text supplied at call
/// time through a [RawSql] parameter, and materializes the result into the declared return type.
///
/// **Requirements:**
///
///   - The method must be `abstract`, non-static and non-private
///   - The enclosing type must be a top-level `abstract class`
///   - The enclosing class should declare a `java.sql.Connection` field or an `org.jooq.DSLContext` field
///
///
/// **Example:**
/// ```{@code
/// public abstract class Orders {
///     protected final Connection connection;
///
///     protected Orders(Connection connection) {
///         this.connection = connection;
///     }
///
///     @SqlMarshal("sp_total_orders")
///     public abstract int totalOrders(int clientId, Out<Integer> lastOrderId) throws SQLException;
///
///     @SqlMarshal
///     public abstract List<Order> find(@RawSql String sql, String status) throws SQLException;
/// }
/// }```
///
/// The processor emits `OrdersImpl extends Orders` in the same package.
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.METHOD)
public @interface SqlMarshal {
    /// Stored procedure name. Ignored when the method has a [RawSql] parameter.
    String value() default "";

    /// Simple name of the generated implementation class. Defaults to the enclosing class name
    /// followed by `Impl`.
    String outputName() default "";
}
