package org.sqlmarshal.processor.generator;

import org.sqlmarshal.processor.model.CommandSource;
import org.sqlmarshal.processor.model.ParameterSpec;
import org.sqlmarshal.processor.model.ProcedureBinding;

import java.util.List;
import java.util.stream.Collectors;

/// Emits the command text and command type assignment.
final class CommandTextBuilder {
    private static final String COMMAND_TYPE = "org.sqlmarshal.CommandType";

    private CommandTextBuilder() {}

    static void build(CodeBuilder code, ProcedureBinding binding, SynthesisContext context) {
        var bound = binding.boundParameters();
        var source = binding.commandSource();

        if (source instanceof CommandSource.RawText raw) {
            code.line("command.setCommandText(" + raw.parameterName() + ");");
        } else {
            var procedure = (CommandSource.NamedProcedure) source;
            code.line("var sqlQuery = " + CodeBuilder.literal(procedureText(procedure.name(), bound)) + ";");
            code.line("command.setCommandText(sqlQuery);");
            code.line("command.setCommandType(" + context.imports().use(COMMAND_TYPE) + ".STORED_PROCEDURE);");
        }
        if (!bound.isEmpty()) {
            code.line("command.addParameters(parameters);");
        }
        code.blank();
    }

    /// Procedure invocation text: `name @a, @b OUTPUT`.
    static String procedureText(String name, List<ParameterSpec> bound) {
        if (bound.isEmpty()) {
            return name;
        }
        return bound.stream()
                    .map(CommandTextBuilder::reference)
                    .collect(Collectors.joining(", ", name + " ", ""));
    }

    private static String reference(ParameterSpec parameter) {
        var externalName = NameMapper.externalName(parameter.internalName());
        return parameter.direction().isOutput() ? externalName + " OUTPUT" : externalName;
    }
}
