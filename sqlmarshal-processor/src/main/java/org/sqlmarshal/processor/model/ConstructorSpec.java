package org.sqlmarshal.processor.model;

import org.sqlmarshal.processor.type.ElementTypeDescriptor;
import org.sqlmarshal.processor.type.TypeDescriptor;

import javax.annotation.processing.ProcessingEnvironment;
import javax.lang.model.element.ExecutableElement;
import java.util.List;

/// Constructor of the enclosing class, mirrored by the generated subclass.
public record ConstructorSpec(Visibility visibility,
                              List<Parameter> parameters,
                              boolean varArgs,
                              List<TypeDescriptor> thrownTypes) {
    public record Parameter(String name, TypeDescriptor type) {}

    public ConstructorSpec {
        parameters = List.copyOf(parameters);
        thrownTypes = List.copyOf(thrownTypes);
    }

    public static ConstructorSpec constructorSpec(ExecutableElement constructor, ProcessingEnvironment env) {
        var parameters = constructor.getParameters()
                                    .stream()
                                    .map(parameter -> new Parameter(parameter.getSimpleName().toString(),
                                                                    ElementTypeDescriptor.of(parameter, env)))
                                    .toList();
        var thrown = constructor.getThrownTypes()
                                .stream()
                                .map(type -> (TypeDescriptor) ElementTypeDescriptor.of(type, env))
                                .toList();
        return new ConstructorSpec(Visibility.of(constructor.getModifiers()), parameters, constructor.isVarArgs(), thrown);
    }
}
