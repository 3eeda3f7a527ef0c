package org.sqlmarshal.processor;

import org.sqlmarshal.processor.connection.ConnectionStrategyResolver;
import org.sqlmarshal.processor.generator.CodeEmitter;
import org.sqlmarshal.processor.generator.GeneratedUnit;
import org.sqlmarshal.processor.model.ConstructorSpec;
import org.sqlmarshal.processor.model.EnclosingType;
import org.sqlmarshal.processor.model.ProcedureBinding;
import org.sqlmarshal.processor.model.Visibility;
import org.sqlmarshal.processor.type.ElementTypeDescriptor;
import org.sqlmarshal.processor.type.NullabilityMode;
import org.sqlmarshal.processor.type.TypeClassifier;
import org.sqlmarshal.processor.type.UnsupportedTypeException;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.ProcessingEnvironment;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.annotation.processing.SupportedOptions;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.NestingKind;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.ElementFilter;
import javax.tools.Diagnostic;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/// Generates `<Class>Impl` subclasses implementing the `@SqlMarshal` methods of abstract classes.
///
/// Options:
///
///   - `sqlmarshal.nullability`: `auto` (default), `annotated` or `oblivious`
///   - `sqlmarshal.implSuffix`: suffix of generated class names, `Impl` by default
@SupportedAnnotationTypes(ProcedureBinding.SQL_MARSHAL_ANNOTATION)
@SupportedOptions({SqlMarshalProcessor.NULLABILITY_OPTION, SqlMarshalProcessor.IMPL_SUFFIX_OPTION})
public class SqlMarshalProcessor extends AbstractProcessor {
    public static final String NULLABILITY_OPTION = "sqlmarshal.nullability";
    public static final String IMPL_SUFFIX_OPTION = "sqlmarshal.implSuffix";

    private static final String DEFAULT_IMPL_SUFFIX = "Impl";
    private static final String GENERATED_ANNOTATION = "javax.annotation.processing.Generated";
    private static final String NULL_MARKED = "org.jspecify.annotations.NullMarked";

    private Optional<NullabilityMode> configuredMode = Optional.empty();
    private String implSuffix = DEFAULT_IMPL_SUFFIX;

    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        var options = processingEnv.getOptions();
        try {
            configuredMode = NullabilityMode.fromOption(options.getOrDefault(NULLABILITY_OPTION, ""));
        } catch (IllegalArgumentException e) {
            error(e.getMessage());
        }

        var suffix = options.getOrDefault(IMPL_SUFFIX_OPTION, "").strip();
        implSuffix = suffix.isEmpty() ? DEFAULT_IMPL_SUFFIX : suffix;
    }

    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        if (annotations.isEmpty()) {
            return false;
        }

        var elements = processingEnv.getElementUtils();
        var marker = elements.getTypeElement(ProcedureBinding.SQL_MARSHAL_ANNOTATION);
        if (marker == null || elements.getTypeElement(GENERATED_ANNOTATION) == null) {
            error("Cannot resolve " + ProcedureBinding.SQL_MARSHAL_ANNOTATION + " or " + GENERATED_ANNOTATION
                        + ", SqlMarshal generation skipped");
            return false;
        }

        var methodsByType = new TreeMap<String, List<ExecutableElement>>();
        var types = new TreeMap<String, TypeElement>();

        for (var element : ElementFilter.methodsIn(roundEnv.getElementsAnnotatedWith(marker))) {
            if (!(element.getEnclosingElement() instanceof TypeElement enclosing)
                || enclosing.getNestingKind() != NestingKind.TOP_LEVEL) {
                continue;
            }
            var key = enclosing.getQualifiedName().toString();
            types.put(key, enclosing);
            methodsByType.computeIfAbsent(key, unused -> new ArrayList<>()).add(element);
        }

        for (var entry : methodsByType.entrySet()) {
            processType(types.get(entry.getKey()), inDeclarationOrder(types.get(entry.getKey()), entry.getValue()));
        }
        return true;
    }

    private void processType(TypeElement type, List<ExecutableElement> methods) {
        if (type.getKind() != ElementKind.CLASS || !type.getModifiers().contains(Modifier.ABSTRACT)) {
            methods.forEach(method -> error(method, "@SqlMarshal methods must be declared in an abstract class, "
                                                    + type.getSimpleName() + " is not one"));
            return;
        }
        if (!type.getTypeParameters().isEmpty()) {
            methods.forEach(method -> error(method, "@SqlMarshal methods cannot be declared in generic class "
                                                    + type.getSimpleName()));
            return;
        }

        var descriptor = ElementTypeDescriptor.of(type.asType(), processingEnv);
        var bindings = new LinkedHashMap<ExecutableElement, ProcedureBinding>();
        var failed = false;

        for (var method : methods) {
            try {
                bindings.put(method, ProcedureBinding.procedureBinding(method, processingEnv));
            } catch (DeclarationException e) {
                error(method, e.getMessage());
                failed = true;
            }
        }

        var outputNames = bindings.values()
                                  .stream()
                                  .flatMap(binding -> binding.outputName().stream())
                                  .distinct()
                                  .toList();
        if (outputNames.size() > 1) {
            error(type, "Conflicting @SqlMarshal output names in " + type.getSimpleName() + ": " + outputNames);
            return;
        }

        CodeEmitter emitter;
        try {
            var connection = ConnectionStrategyResolver.resolve(descriptor);
            var implName = outputNames.isEmpty() ? type.getSimpleName() + implSuffix : outputNames.get(0);
            emitter = new CodeEmitter(enclosingType(type), implName, new TypeClassifier(nullabilityMode(type)), connection);
        } catch (DeclarationException e) {
            error(type, e.getMessage());
            return;
        }

        for (var entry : bindings.entrySet()) {
            try {
                emitter.addProcedure(entry.getValue());
            } catch (DeclarationException | UnsupportedTypeException e) {
                error(entry.getKey(), e.getMessage());
                failed = true;
            }
        }
        if (!failed) {
            write(type, emitter.emit());
        }
    }

    private void write(TypeElement type, GeneratedUnit unit) {
        try {
            var file = processingEnv.getFiler().createSourceFile(unit.qualifiedName(), type);
            try (var writer = file.openWriter()) {
                writer.write(unit.source());
            }
            note(type, "Generated SqlMarshal implementation: " + unit.qualifiedName());
        } catch (IOException e) {
            error(type, "Failed to write " + unit.qualifiedName() + ": " + e.getMessage());
        }
    }

    private EnclosingType enclosingType(TypeElement type) {
        var packageName = processingEnv.getElementUtils()
                                       .getPackageOf(type)
                                       .getQualifiedName()
                                       .toString();
        var constructors = ElementFilter.constructorsIn(type.getEnclosedElements())
                                        .stream()
                                        .map(constructor -> ConstructorSpec.constructorSpec(constructor, processingEnv))
                                        .toList();
        return new EnclosingType(packageName, type.getSimpleName().toString(), Visibility.of(type.getModifiers()), constructors);
    }

    private NullabilityMode nullabilityMode(TypeElement type) {
        return configuredMode.orElseGet(() -> isNullMarked(type) || isNullMarked(processingEnv.getElementUtils().getPackageOf(type))
                                              ? NullabilityMode.ANNOTATED
                                              : NullabilityMode.OBLIVIOUS);
    }

    private static boolean isNullMarked(Element element) {
        return element.getAnnotationMirrors()
                      .stream()
                      .map(annotation -> (TypeElement) annotation.getAnnotationType().asElement())
                      .anyMatch(annotation -> annotation.getQualifiedName().contentEquals(NULL_MARKED));
    }

    private static List<ExecutableElement> inDeclarationOrder(TypeElement type, List<ExecutableElement> methods) {
        var enclosed = type.getEnclosedElements();
        var ordered = new ArrayList<>(methods);
        ordered.sort(Comparator.comparingInt(enclosed::indexOf));
        return ordered;
    }

    private void error(String message) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR, message);
    }

    private void error(Element element, String message) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR, message, element);
    }

    private void note(Element element, String message) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.NOTE, message, element);
    }
}
