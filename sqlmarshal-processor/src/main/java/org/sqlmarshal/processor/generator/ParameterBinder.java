package org.sqlmarshal.processor.generator;

import org.sqlmarshal.processor.model.Direction;
import org.sqlmarshal.processor.model.ParameterSpec;
import org.sqlmarshal.processor.model.ProcedureBinding;
import org.sqlmarshal.processor.type.ScalarKind;
import org.sqlmarshal.processor.type.TypeClassifier;

/// Emits the parameter objects of a command and the read-back of output parameters.
final class ParameterBinder {
    private static final String SQL_PARAMETER = "org.sqlmarshal.SqlParameter";
    private static final String PARAMETER_DIRECTION = "org.sqlmarshal.ParameterDirection";
    private static final String SQL_TYPES = "java.sql.Types";

    private ParameterBinder() {}

    /// Binds every non-raw parameter in declaration order and collects them in `parameters`.
    static void bind(CodeBuilder code, ProcedureBinding binding, SynthesisContext context) {
        var bound = binding.boundParameters();
        for (var parameter : bound) {
            bindParameter(code, parameter, context);
            code.blank();
        }
        if (bound.isEmpty()) {
            return;
        }

        code.open("var parameters = new " + context.imports().use(SQL_PARAMETER) + "[]");
        bound.forEach(parameter -> code.line(parameter.parameterVariable() + ","));
        code.closeWith(";");
        code.blank();
    }

    /// Copies output values back into their holders.
    static void readBack(CodeBuilder code, ProcedureBinding binding, SynthesisContext context) {
        for (var parameter : binding.outputParameters()) {
            var value = context.fromDatabase(parameter.parameterVariable() + ".getValue()", parameter.declaredType());
            code.line(parameter.internalName() + ".set(" + value + ");");
        }
    }

    private static void bindParameter(CodeBuilder code, ParameterSpec parameter, SynthesisContext context) {
        var variable = parameter.parameterVariable();
        code.line("var " + variable + " = command.createParameter();");
        code.line(variable + ".setName(" + CodeBuilder.literal(NameMapper.externalName(parameter.internalName())) + ");");

        if (parameter.direction().isOutput()) {
            var jdbcType = ScalarKind.jdbcType(parameter.declaredType());
            var direction = parameter.direction() == Direction.IN_OUT ? "INPUT_OUTPUT" : "OUTPUT";
            code.line(variable + ".setSqlType(" + context.imports().use(SQL_TYPES) + "." + jdbcType + ");");
            code.line(variable + ".setValueType(" + context.valueClass(parameter.declaredType()) + ");");
            code.line(variable + ".setDirection(" + context.imports().use(PARAMETER_DIRECTION) + "." + direction + ");");
        }
        if (parameter.direction().isInput()) {
            code.line(variable + ".setValue(" + valueOf(parameter, context) + ");");
        }
    }

    private static String valueOf(ParameterSpec parameter, SynthesisContext context) {
        var name = parameter.internalName();
        var type = parameter.declaredType();
        if (parameter.direction() == Direction.IN_OUT) {
            var current = name + ".get()";
            return context.classifier().isNullable(type)
                   ? current + " == null ? " + context.dbNull() + " : " + current
                   : current;
        }

        if (type.is(TypeClassifier.OPTIONAL)) {
            return name + ".isPresent() ? " + name + ".get() : " + context.dbNull();
        }
        if (context.classifier().isNullable(type)) {
            return name + " == null ? " + context.dbNull() + " : " + name;
        }
        return name;
    }
}
