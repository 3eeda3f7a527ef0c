package org.sqlmarshal.processor.generator;

import org.sqlmarshal.processor.connection.ConnectionStrategy;
import org.sqlmarshal.processor.model.ProcedureBinding;

/// Emits the body of one generated method.
///
/// The body obtains a connection, creates a command, binds parameters, sets the command text, materializes
/// the result, copies output parameters back and returns. `SQLException` is wrapped unless the method
/// declares it.
final class ProcedureSynthesizer {
    private static final String SQL_COMMAND = "org.sqlmarshal.SqlCommand";
    private static final String SQL_EXCEPTION = "java.sql.SQLException";
    private static final String SQL_MARSHAL_EXCEPTION = "org.sqlmarshal.SqlMarshalException";

    private ProcedureSynthesizer() {}

    static void synthesize(CodeBuilder code, ProcedureBinding binding, SynthesisContext context) {
        var classification = context.classifier().classify(binding.returnType());
        var strategy = ResultMaterializer.strategyFor(classification, context.connection());
        var connection = context.connection();

        openConnection(code, connection);
        code.open("try (var command = " + context.imports().use(SQL_COMMAND) + ".create(connection))");
        ParameterBinder.bind(code, binding, context);
        CommandTextBuilder.build(code, binding, context);
        ResultMaterializer.materialize(code, classification, strategy, context);
        ParameterBinder.readBack(code, binding, context);
        ResultMaterializer.returnResult(code, classification, strategy, context);

        if (!binding.propagatesSqlException()) {
            code.next("catch (" + context.imports().use(SQL_EXCEPTION) + " e)");
            code.line("throw new " + context.imports().use(SQL_MARSHAL_EXCEPTION) + "("
                      + CodeBuilder.literal("Failed to execute " + binding.name()) + ", e);");
        }
        if (connection.requiresExplicitOpenClose()) {
            code.next("finally");
            code.line("connectionProvider.release(connection);");
        }
        code.close();
    }

    private static void openConnection(CodeBuilder code, ConnectionStrategy connection) {
        if (!connection.requiresExplicitOpenClose()) {
            code.line("var connection = this." + connection.fieldName() + ";");
            return;
        }
        code.line("var connectionProvider = this." + connection.fieldName() + ".configuration().connectionProvider();");
        code.line("var connection = connectionProvider.acquire();");
    }
}
