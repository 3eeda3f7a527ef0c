package org.sqlmarshal.processor.generator;

import org.sqlmarshal.processor.DeclarationException;
import org.sqlmarshal.processor.connection.ConnectionStrategy;
import org.sqlmarshal.processor.type.MemberDescriptor;
import org.sqlmarshal.processor.type.PropertyDescriptor;
import org.sqlmarshal.processor.type.ScalarKind;
import org.sqlmarshal.processor.type.TypeClassification;
import org.sqlmarshal.processor.type.TypeDescriptor;
import org.sqlmarshal.processor.type.UnsupportedTypeException;

import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Turns the executed command into the declared return value.
///
/// Strategy selection:
///
///   - `void` result: non-query execution
///   - scalar result: first column of the first row
///   - entity or entity collection with a jOOQ context field: rows mapped by the context
///   - otherwise: rows mapped by a generated reader loop
final class ResultMaterializer {
    static final String TABLE_TYPE = "org.jooq.Table";
    private static final String OPTIONAL = "java.util.Optional";
    private static final String ARRAY_LIST = "java.util.ArrayList";

    enum Strategy {
        NON_QUERY,
        SCALAR,
        MANUAL,
        ORM
    }

    private ResultMaterializer() {}

    static Strategy strategyFor(TypeClassification classification, ConnectionStrategy connection) {
        return switch (classification.kind()) {
            case VOID -> Strategy.NON_QUERY;
            case SCALAR -> Strategy.SCALAR;
            case ENTITY -> connection.hasContext() ? Strategy.ORM : Strategy.MANUAL;
            case ENTITY_COLLECTION -> connection.hasContext() && !classification.hasScalarItems()
                                      ? Strategy.ORM
                                      : Strategy.MANUAL;
        };
    }

    /// Executes the command and leaves the value in `result`; readers are closed before returning.
    static void materialize(CodeBuilder code, TypeClassification classification, Strategy strategy, SynthesisContext context) {
        switch (strategy) {
            case NON_QUERY -> code.line("command.executeNonQuery();");
            case SCALAR -> code.line("var result = command.executeScalar("
                                     + context.valueClass(classification.underlyingType()) + ");");
            case MANUAL -> materializeManually(code, classification, context);
            case ORM -> materializeWithContext(code, classification, context);
        }
    }

    static void returnResult(CodeBuilder code, TypeClassification classification, Strategy strategy, SynthesisContext context) {
        var declared = classification.declaredType();
        switch (strategy) {
            case NON_QUERY -> {
                if (!declared.isVoid()) {
                    code.line("return null;");
                }
            }
            case SCALAR -> code.line("return " + scalarResult(classification, context) + ";");
            case MANUAL -> code.line(classification.optional() && !classification.isList()
                                     ? "return " + context.imports().use(OPTIONAL) + ".ofNullable(result);"
                                     : "return result;");
            case ORM -> code.line(declared.is(ARRAY_LIST)
                                  ? "return new " + context.imports().use(ARRAY_LIST) + "<>(result);"
                                  : "return result;");
        }
    }

    /// Expression reading the entity set of `itemType` from the context field.
    ///
    /// The set is the first `Table<R>` member of the context type whose record type is named after the
    /// entity, `Item` or `ItemRecord`; without one the pluralized entity name is assumed.
    static String entitySet(ConnectionStrategy.FoundContext connection, TypeDescriptor itemType) {
        var target = "this." + connection.fieldName();
        var contextType = connection.contextType();

        return Stream.concat(contextType.fields().stream(), contextType.accessors().stream())
                     .filter(member -> !member.isPrivate())
                     .filter(member -> isTableOf(member, itemType))
                     .findFirst()
                     .map(member -> member.readFrom(target))
                     .orElseGet(() -> target + "." + NameMapper.entitySetName(itemType.simpleName()));
    }

    private static boolean isTableOf(MemberDescriptor member, TypeDescriptor itemType) {
        var entityName = itemType.simpleName();
        return member.type()
                     .findSupertype(TABLE_TYPE)
                     .map(TypeDescriptor::typeArguments)
                     .filter(arguments -> arguments.size() == 1)
                     .map(arguments -> arguments.get(0).simpleName())
                     .filter(recordName -> recordName.equals(entityName) || recordName.equals(entityName + "Record"))
                     .isPresent();
    }

    private static String scalarResult(TypeClassification classification, SynthesisContext context) {
        var type = classification.underlyingType();
        if (!classification.optional()) {
            return context.fromDatabase("result", type);
        }
        var optional = context.imports().use(OPTIONAL);
        return "result == " + context.dbNull() + " ? " + optional + ".empty() : " + optional + ".of(("
               + context.imports().render(type) + ") result)";
    }

    private static void materializeManually(CodeBuilder code, TypeClassification classification, SynthesisContext context) {
        var itemType = classification.underlyingType();
        code.line("var reader = command.executeReader();");

        if (classification.isList()) {
            code.line("var result = new " + context.imports().use(ARRAY_LIST) + "<" + context.imports().render(itemType) + ">();");
            code.open("while (reader.read())");
            if (classification.hasScalarItems()) {
                code.line("var value0 = reader.getValue(0, " + context.valueClass(itemType) + ");");
                code.line("result.add(" + context.fromDatabase("value0", itemType) + ");");
            } else {
                readEntity(code, itemType, context);
                code.line("result.add(item);");
            }
            code.close();
        } else {
            code.line(context.imports().render(itemType) + " result = null;");
            code.open("if (reader.read())");
            readEntity(code, itemType, context);
            code.line("result = item;");
            code.close();
        }
        code.blank();
        code.line("reader.close();");
    }

    private static void readEntity(CodeBuilder code, TypeDescriptor itemType, SynthesisContext context) {
        var properties = itemType.properties();
        if (properties.isEmpty()) {
            throw new UnsupportedTypeException("Entity type " + itemType.qualifiedName() + " has no properties to map");
        }
        properties.forEach(property -> requireScalar(itemType, property));
        var itemName = context.imports().render(itemType);

        if (itemType.isRecord()) {
            properties.forEach(property -> code.line(readValue(property, context)));
            var arguments = properties.stream()
                                      .map(property -> context.fromDatabase(valueVariable(property), property.type()))
                                      .collect(Collectors.joining(", "));
            code.line("var item = new " + itemName + "(" + arguments + ");");
            return;
        }

        code.line("var item = new " + itemName + "();");
        for (var property : properties) {
            var value = context.fromDatabase(valueVariable(property), property.type());
            code.line(readValue(property, context));
            switch (property.access()) {
                case SETTER -> code.line("item." + property.setter().orElseThrow() + "(" + value + ");");
                case FIELD -> code.line("item." + property.name() + " = " + value + ";");
                case CONSTRUCTOR, NONE -> throw new DeclarationException("Property '" + property.name() + "' of "
                                                                         + itemType.simpleName()
                                                                         + " has no setter and is not assignable");
            }
        }
    }

    private static void requireScalar(TypeDescriptor itemType, PropertyDescriptor property) {
        if (!ScalarKind.of(property.type()).isSupported()) {
            throw new UnsupportedTypeException("No scalar mapping for property '" + property.name() + "' of "
                                               + itemType.simpleName() + " of type " + property.type().qualifiedName());
        }
    }

    private static String readValue(PropertyDescriptor property, SynthesisContext context) {
        return "var " + valueVariable(property) + " = reader.getValue(" + property.ordinal() + ", "
               + context.valueClass(property.type()) + ");";
    }

    private static String valueVariable(PropertyDescriptor property) {
        return "value" + property.ordinal();
    }

    private static void materializeWithContext(CodeBuilder code, TypeClassification classification, SynthesisContext context) {
        var connection = (ConnectionStrategy.FoundContext) context.connection();
        var itemType = classification.underlyingType();
        var receiver = "var result = this." + connection.fieldName();
        var indent = " ".repeat(receiver.length());

        code.line("var reader = command.executeReader();");
        code.line(receiver + ".fetch(reader.resultSet())");
        code.line(indent + ".into(" + entitySet(connection, itemType) + ")");
        if (classification.isList()) {
            code.line(indent + ".into(" + context.imports().use(itemType.qualifiedName()) + ".class);");
        } else {
            code.line(indent + ".into(" + context.imports().use(itemType.qualifiedName()) + ".class)");
            code.line(indent + ".stream()");
            code.line(indent + (classification.optional() ? ".findFirst();" : ".findFirst()"));
            if (!classification.optional()) {
                code.line(indent + ".orElse(null);");
            }
        }
        code.line("reader.close();");
    }
}
