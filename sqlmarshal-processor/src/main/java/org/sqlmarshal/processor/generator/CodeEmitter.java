package org.sqlmarshal.processor.generator;

import org.sqlmarshal.processor.connection.ConnectionStrategy;
import org.sqlmarshal.processor.model.ConstructorSpec;
import org.sqlmarshal.processor.model.EnclosingType;
import org.sqlmarshal.processor.model.ProcedureBinding;
import org.sqlmarshal.processor.model.Visibility;
import org.sqlmarshal.processor.type.TypeClassifier;
import org.sqlmarshal.processor.type.TypeDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/// Assembles the generated subclass of one enclosing class.
///
/// Generation is two-phase: members are rendered first while the [ImportTracker] collects the types they
/// use, then the unit is assembled with its package, sorted imports and class declaration. Identical inputs
/// produce identical text.
public final class CodeEmitter {
    public static final String GENERATOR_NAME = "org.sqlmarshal.processor.SqlMarshalProcessor";

    private static final List<String> HEADER = List.of("// Code generated by the SqlMarshal annotation processor.",
                                                       "// Changes may cause incorrect behavior and will be lost if the code is",
                                                       "// regenerated.");
    private static final String GENERATED = "javax.annotation.processing.Generated";
    private static final String NULL_MARKED = "org.jspecify.annotations.NullMarked";
    private static final List<String> STABLE_IMPORTS = List.of("java.sql.SQLException",
                                                               GENERATED,
                                                               NULL_MARKED,
                                                               "org.sqlmarshal.DbNull",
                                                               "org.sqlmarshal.SqlCommand",
                                                               "org.sqlmarshal.SqlParameter");
    private static final int LINE_LIMIT = 120;

    private final EnclosingType type;
    private final String implName;
    private final ImportTracker imports;
    private final SynthesisContext context;
    private final List<CodeBuilder> members = new ArrayList<>();

    public CodeEmitter(EnclosingType type, String implName, TypeClassifier classifier, ConnectionStrategy connection) {
        this.type = type;
        this.implName = implName;
        this.imports = new ImportTracker(type.packageName());
        this.context = new SynthesisContext(classifier, connection, imports);

        imports.reserve(type.simpleName());
        imports.reserve(implName);
        STABLE_IMPORTS.forEach(imports::use);
        type.constructors()
            .stream()
            .filter(constructor -> constructor.visibility() != Visibility.PRIVATE)
            .forEach(this::addConstructor);
    }

    /// Renders the override of one declaration. Nothing is added when synthesis fails.
    ///
    /// @throws org.sqlmarshal.processor.DeclarationException when the declaration cannot be implemented
    /// @throws org.sqlmarshal.processor.type.UnsupportedTypeException when a type has no mapping
    public void addProcedure(ProcedureBinding binding) {
        var code = new CodeBuilder(1);
        var parameters = binding.parameters()
                                .stream()
                                .map(parameter -> imports.renderAnnotated(parameter.signatureType()) + " "
                                                  + parameter.internalName())
                                .toList();

        code.line("@Override");
        openSignature(code,
                      binding.visibility().keyword() + imports.renderAnnotated(binding.returnType()) + " " + binding.name(),
                      parameters,
                      throwsClause(binding.thrownTypes()));
        ProcedureSynthesizer.synthesize(code, binding, context);
        code.close();
        members.add(code);
    }

    public GeneratedUnit emit() {
        var body = new CodeBuilder();
        body.line("@" + imports.use(GENERATED) + "(" + CodeBuilder.literal(GENERATOR_NAME) + ")");
        body.line("@" + imports.use(NULL_MARKED));
        body.open(classVisibility() + "final class " + implName + " extends " + type.simpleName());
        for (int i = 0; i < members.size(); i++) {
            if (i > 0) {
                body.blank();
            }
            body.append(members.get(i));
        }
        body.close();

        var unit = new CodeBuilder();
        HEADER.forEach(unit::line);
        if (!type.packageName().isEmpty()) {
            unit.line("package " + type.packageName() + ";");
            unit.blank();
        }
        imports.imports().forEach(qualifiedName -> unit.line("import " + qualifiedName + ";"));
        unit.blank();
        unit.append(body);

        return new GeneratedUnit(type.packageName(), implName, unit.build());
    }

    private void addConstructor(ConstructorSpec constructor) {
        var code = new CodeBuilder(1);
        var parameters = new ArrayList<String>();
        var names = constructor.parameters()
                               .stream()
                               .map(ConstructorSpec.Parameter::name)
                               .collect(Collectors.joining(", "));

        for (int i = 0; i < constructor.parameters().size(); i++) {
            var parameter = constructor.parameters().get(i);
            var isVarArgs = constructor.varArgs() && i == constructor.parameters().size() - 1;
            var typeText = isVarArgs
                           ? imports.render(parameter.type().typeArguments().get(0)) + "..."
                           : imports.renderAnnotated(parameter.type());
            parameters.add(typeText + " " + parameter.name());
        }

        openSignature(code, constructor.visibility().keyword() + implName, parameters, throwsClause(constructor.thrownTypes()));
        code.line("super(" + names + ");");
        code.close();
        members.add(code);
    }

    private String classVisibility() {
        return type.visibility() == Visibility.PUBLIC ? "public " : "";
    }

    private String throwsClause(List<TypeDescriptor> thrownTypes) {
        if (thrownTypes.isEmpty()) {
            return "";
        }
        return thrownTypes.stream()
                          .map(imports::render)
                          .collect(Collectors.joining(", ", " throws ", ""));
    }

    /// Opens a method or constructor block, aligning parameters one per line when the signature is too long.
    private static void openSignature(CodeBuilder code, String prefix, List<String> parameters, String suffix) {
        var single = prefix + "(" + String.join(", ", parameters) + ")" + suffix;
        if (parameters.size() < 2 || code.depth() * 4 + single.length() + 2 <= LINE_LIMIT) {
            code.open(single);
            return;
        }

        var align = " ".repeat(prefix.length() + 1);
        var last = parameters.size() - 1;
        code.line(prefix + "(" + parameters.get(0) + ",");
        for (int i = 1; i < last; i++) {
            code.line(align + parameters.get(i) + ",");
        }
        code.open(align + parameters.get(last) + ")" + suffix);
    }
}
