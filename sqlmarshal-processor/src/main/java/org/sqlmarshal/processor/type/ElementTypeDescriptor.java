package org.sqlmarshal.processor.type;

import javax.annotation.processing.ProcessingEnvironment;
import javax.lang.model.element.AnnotationMirror;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.ArrayType;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.type.WildcardType;
import javax.lang.model.util.ElementFilter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/// [TypeDescriptor] over `javax.lang.model` type mirrors.
public final class ElementTypeDescriptor implements TypeDescriptor {
    private static final String NULLABLE = "Nullable";

    private final TypeMirror mirror;
    private final ProcessingEnvironment env;
    private final List<? extends AnnotationMirror> declarationAnnotations;

    private ElementTypeDescriptor(TypeMirror mirror,
                                  ProcessingEnvironment env,
                                  List<? extends AnnotationMirror> declarationAnnotations) {
        this.mirror = mirror;
        this.env = env;
        this.declarationAnnotations = declarationAnnotations;
    }

    public static ElementTypeDescriptor of(TypeMirror mirror, ProcessingEnvironment env) {
        return new ElementTypeDescriptor(mirror, env, List.of());
    }

    /// Type of a declaration; declaration annotations such as `@Nullable` on a field or parameter
    /// count as annotations of the type.
    public static ElementTypeDescriptor of(Element element, ProcessingEnvironment env) {
        return new ElementTypeDescriptor(element.asType(), env, element.getAnnotationMirrors());
    }

    /// Return type of a method, with the method's declaration annotations.
    public static ElementTypeDescriptor returnTypeOf(ExecutableElement method, ProcessingEnvironment env) {
        return new ElementTypeDescriptor(method.getReturnType(), env, method.getAnnotationMirrors());
    }

    public TypeMirror mirror() {
        return mirror;
    }

    @Override
    public Shape shape() {
        var kind = mirror.getKind();
        if (kind.isPrimitive()) {
            return Shape.PRIMITIVE;
        }
        return switch (kind) {
            case VOID -> Shape.VOID;
            case ARRAY -> Shape.ARRAY;
            case WILDCARD -> Shape.WILDCARD;
            case TYPEVAR -> Shape.TYPE_VARIABLE;
            default -> Shape.DECLARED;
        };
    }

    @Override
    public String qualifiedName() {
        var kind = mirror.getKind();
        if (kind.isPrimitive() || kind == TypeKind.VOID) {
            return kind.name().toLowerCase(Locale.ROOT);
        }
        return switch (kind) {
            case ARRAY -> component().qualifiedName() + "[]";
            case WILDCARD -> "?";
            case DECLARED -> typeElement().getQualifiedName().toString();
            default -> mirror.toString();
        };
    }

    @Override
    public String simpleName() {
        if (mirror.getKind() == TypeKind.DECLARED) {
            return typeElement().getSimpleName().toString();
        }
        if (mirror.getKind() == TypeKind.ARRAY) {
            return component().simpleName() + "[]";
        }
        return qualifiedName();
    }

    @Override
    public List<TypeDescriptor> typeArguments() {
        if (mirror instanceof DeclaredType declaredType) {
            return declaredType.getTypeArguments()
                               .stream()
                               .map(argument -> (TypeDescriptor) of(argument, env))
                               .toList();
        }
        if (mirror instanceof ArrayType) {
            return List.of(component());
        }
        if (mirror instanceof WildcardType wildcard) {
            if (wildcard.getExtendsBound() != null) {
                return List.of(of(wildcard.getExtendsBound(), env));
            }
            if (wildcard.getSuperBound() != null) {
                return List.of(of(wildcard.getSuperBound(), env));
            }
        }
        return List.of();
    }

    @Override
    public String wildcardKeyword() {
        if (mirror instanceof WildcardType wildcard) {
            if (wildcard.getExtendsBound() != null) {
                return "extends";
            }
            if (wildcard.getSuperBound() != null) {
                return "super";
            }
        }
        return "";
    }

    @Override
    public List<TypeDescriptor> supertypes() {
        if (mirror.getKind() != TypeKind.DECLARED) {
            return List.of();
        }
        return env.getTypeUtils()
                  .directSupertypes(mirror)
                  .stream()
                  .map(supertype -> (TypeDescriptor) of(supertype, env))
                  .toList();
    }

    @Override
    public List<MemberDescriptor> fields() {
        if (mirror.getKind() != TypeKind.DECLARED) {
            return List.of();
        }
        return ElementFilter.fieldsIn(typeElement().getEnclosedElements())
                            .stream()
                            .filter(field -> !field.getModifiers().contains(Modifier.STATIC))
                            .map(field -> MemberDescriptor.field(field.getSimpleName().toString(),
                                                                 of(field, env),
                                                                 field.getModifiers().contains(Modifier.PRIVATE)))
                            .toList();
    }

    @Override
    public List<MemberDescriptor> accessors() {
        if (mirror.getKind() != TypeKind.DECLARED) {
            return List.of();
        }
        return ElementFilter.methodsIn(typeElement().getEnclosedElements())
                            .stream()
                            .filter(method -> !method.getModifiers().contains(Modifier.STATIC))
                            .filter(method -> method.getParameters().isEmpty())
                            .filter(method -> method.getReturnType().getKind() != TypeKind.VOID)
                            .map(method -> MemberDescriptor.accessor(method.getSimpleName().toString(),
                                                                     returnTypeOf(method, env),
                                                                     method.getModifiers().contains(Modifier.PRIVATE)))
                            .toList();
    }

    @Override
    public List<PropertyDescriptor> properties() {
        if (mirror.getKind() != TypeKind.DECLARED) {
            return List.of();
        }
        var element = typeElement();
        var properties = new ArrayList<PropertyDescriptor>();

        if (element.getKind() == ElementKind.RECORD) {
            for (var component : element.getRecordComponents()) {
                properties.add(PropertyDescriptor.component(component.getSimpleName().toString(),
                                                            of(component, env),
                                                            properties.size()));
            }
            return properties;
        }

        var methods = ElementFilter.methodsIn(element.getEnclosedElements());
        for (var field : ElementFilter.fieldsIn(element.getEnclosedElements())) {
            if (field.getModifiers().contains(Modifier.STATIC)) {
                continue;
            }
            var name = field.getSimpleName().toString();
            var setterName = "set" + Character.toUpperCase(name.charAt(0)) + name.substring(1);
            var hasSetter = methods.stream()
                                   .anyMatch(method -> method.getSimpleName().contentEquals(setterName)
                                                       && method.getParameters().size() == 1
                                                       && !method.getModifiers().contains(Modifier.PRIVATE));
            var type = of(field, env);
            properties.add(hasSetter
                           ? PropertyDescriptor.setter(name, type, properties.size(), setterName)
                           : PropertyDescriptor.field(name, type, properties.size(),
                                                      field.getModifiers().contains(Modifier.PRIVATE)
                                                      || field.getModifiers().contains(Modifier.FINAL)));
        }
        return properties;
    }

    @Override
    public boolean isRecord() {
        return mirror.getKind() == TypeKind.DECLARED && typeElement().getKind() == ElementKind.RECORD;
    }

    @Override
    public Optional<String> nullableAnnotation() {
        return findNullable(mirror.getAnnotationMirrors()).or(() -> findNullable(declarationAnnotations));
    }

    @Override
    public String toString() {
        return mirror.toString();
    }

    private static Optional<String> findNullable(List<? extends AnnotationMirror> annotations) {
        return annotations.stream()
                          .map(annotation -> (TypeElement) annotation.getAnnotationType().asElement())
                          .filter(annotation -> annotation.getSimpleName().contentEquals(NULLABLE))
                          .map(annotation -> annotation.getQualifiedName().toString())
                          .findFirst();
    }

    private TypeElement typeElement() {
        return (TypeElement) ((DeclaredType) mirror).asElement();
    }

    private TypeDescriptor component() {
        return of(((ArrayType) mirror).getComponentType(), env);
    }
}
