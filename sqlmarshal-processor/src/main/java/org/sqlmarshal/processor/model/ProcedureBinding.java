package org.sqlmarshal.processor.model;

import org.sqlmarshal.processor.DeclarationException;
import org.sqlmarshal.processor.type.ElementTypeDescriptor;
import org.sqlmarshal.processor.type.TypeDescriptor;

import javax.annotation.processing.ProcessingEnvironment;
import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.Element;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/// Normalized description of one `@SqlMarshal` method.
public record ProcedureBinding(String name,
                               Visibility visibility,
                               TypeDescriptor returnType,
                               List<ParameterSpec> parameters,
                               CommandSource commandSource,
                               List<TypeDescriptor> thrownTypes,
                               Optional<String> outputName) {
    public static final String SQL_MARSHAL_ANNOTATION = "org.sqlmarshal.SqlMarshal";
    public static final String RAW_SQL_ANNOTATION = "org.sqlmarshal.RawSql";
    public static final String OUT_TYPE = "org.sqlmarshal.Out";
    public static final String REF_TYPE = "org.sqlmarshal.Ref";

    private static final Set<String> SQL_EXCEPTION_HANDLERS = Set.of("java.sql.SQLException",
                                                                     "java.lang.Exception",
                                                                     "java.lang.Throwable");
    private static final Set<String> GENERATED_LOCALS = Set.of("connection",
                                                               "connectionProvider",
                                                               "command",
                                                               "parameters",
                                                               "sqlQuery",
                                                               "result",
                                                               "reader",
                                                               "item",
                                                               "e");
    private static final Pattern GENERATED_VALUE_LOCAL = Pattern.compile("^value[0-9]+$");

    public ProcedureBinding {
        parameters = List.copyOf(parameters);
        thrownTypes = List.copyOf(thrownTypes);
    }

    /// Extracts the binding of an annotated method.
    ///
    /// @throws DeclarationException when the method cannot be implemented by a generated subclass
    public static ProcedureBinding procedureBinding(ExecutableElement method, ProcessingEnvironment env) {
        var name = method.getSimpleName().toString();
        var modifiers = method.getModifiers();

        if (!modifiers.contains(Modifier.ABSTRACT)) {
            throw new DeclarationException("@SqlMarshal method '" + name + "' must be abstract");
        }
        if (modifiers.contains(Modifier.STATIC) || modifiers.contains(Modifier.PRIVATE)) {
            throw new DeclarationException("@SqlMarshal method '" + name + "' must not be static or private");
        }
        if (!method.getTypeParameters().isEmpty()) {
            throw new DeclarationException("@SqlMarshal method '" + name + "' must not declare type parameters");
        }

        var marker = findAnnotation(method, SQL_MARSHAL_ANNOTATION)
            .orElseThrow(() -> new DeclarationException("Method '" + name + "' is not annotated with @SqlMarshal"));
        var procedureName = stringValue(marker, "value", env);
        var outputName = stringValue(marker, "outputName", env);

        var parameters = extractParameters(method, env);
        var commandSource = commandSource(name, procedureName, parameters);
        var thrownTypes = method.getThrownTypes()
                                .stream()
                                .map(type -> (TypeDescriptor) ElementTypeDescriptor.of(type, env))
                                .toList();

        return new ProcedureBinding(name,
                                    Visibility.of(modifiers),
                                    ElementTypeDescriptor.returnTypeOf(method, env),
                                    parameters,
                                    commandSource,
                                    thrownTypes,
                                    outputName.isBlank() ? Optional.empty() : Optional.of(outputName.strip()));
    }

    /// Parameters bound to the command, in declaration order.
    public List<ParameterSpec> boundParameters() {
        return parameters.stream()
                         .filter(parameter -> !parameter.rawSql())
                         .toList();
    }

    /// Parameters read back after execution, in declaration order.
    public List<ParameterSpec> outputParameters() {
        return boundParameters().stream()
                                .filter(parameter -> parameter.direction().isOutput())
                                .toList();
    }

    /// Whether the method's `throws` clause lets `SQLException` propagate.
    public boolean propagatesSqlException() {
        return thrownTypes.stream()
                          .anyMatch(type -> SQL_EXCEPTION_HANDLERS.contains(type.qualifiedName()));
    }

    private static List<ParameterSpec> extractParameters(ExecutableElement method, ProcessingEnvironment env) {
        var methodName = method.getSimpleName().toString();
        var parameters = new ArrayList<ParameterSpec>();

        for (var parameter : method.getParameters()) {
            var spec = parameterSpec(parameter, env);
            requireFreeName(methodName, spec.internalName());
            parameters.add(spec);
        }

        var rawSqlCount = parameters.stream().filter(ParameterSpec::rawSql).count();
        if (rawSqlCount > 1) {
            throw new DeclarationException("@SqlMarshal method '" + methodName + "' has more than one @RawSql parameter");
        }
        return parameters;
    }

    private static ParameterSpec parameterSpec(VariableElement parameter, ProcessingEnvironment env) {
        var name = parameter.getSimpleName().toString();
        var type = ElementTypeDescriptor.of(parameter, env);

        if (findAnnotation(parameter, RAW_SQL_ANNOTATION).isPresent()) {
            if (!type.is("java.lang.String")) {
                throw new DeclarationException("@RawSql parameter '" + name + "' must be a String");
            }
            return ParameterSpec.rawSql(name, type);
        }
        if (type.is(OUT_TYPE) || type.is(REF_TYPE)) {
            var arguments = type.typeArguments();
            if (arguments.size() != 1) {
                throw new DeclarationException("Parameter '" + name + "' must declare the value type of "
                                               + type.simpleName());
            }
            var direction = type.is(OUT_TYPE) ? Direction.OUT : Direction.IN_OUT;
            return ParameterSpec.holder(name, arguments.get(0), type, direction);
        }
        return ParameterSpec.in(name, type);
    }

    private static void requireFreeName(String methodName, String parameterName) {
        if (GENERATED_LOCALS.contains(parameterName) || GENERATED_VALUE_LOCAL.matcher(parameterName).matches()) {
            throw new DeclarationException("Parameter '" + parameterName + "' of method '" + methodName
                                           + "' clashes with a local variable of the generated body");
        }
    }

    private static CommandSource commandSource(String methodName, String procedureName, List<ParameterSpec> parameters) {
        var rawSql = parameters.stream().filter(ParameterSpec::rawSql).findFirst();
        if (rawSql.isPresent()) {
            return new CommandSource.RawText(rawSql.get().internalName());
        }
        if (procedureName.isBlank()) {
            throw new DeclarationException("@SqlMarshal method '" + methodName
                                           + "' needs a procedure name or a @RawSql parameter");
        }
        return new CommandSource.NamedProcedure(procedureName.strip());
    }

    private static Optional<? extends AnnotationMirror> findAnnotation(Element element, String qualifiedName) {
        return element.getAnnotationMirrors()
                      .stream()
                      .filter(mirror -> isAnnotationType(mirror, qualifiedName))
                      .findFirst();
    }

    private static boolean isAnnotationType(AnnotationMirror mirror, String qualifiedName) {
        var annotationElement = (TypeElement) mirror.getAnnotationType().asElement();
        return annotationElement.getQualifiedName().contentEquals(qualifiedName);
    }

    private static String stringValue(AnnotationMirror mirror, String attribute, ProcessingEnvironment env) {
        for (var entry : env.getElementUtils().getElementValuesWithDefaults(mirror).entrySet()) {
            if (entry.getKey().getSimpleName().contentEquals(attribute)) {
                return String.valueOf(entry.getValue().getValue());
            }
        }
        return "";
    }
}
