package org.sqlmarshal.processor.type;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// In-memory [TypeDescriptor] for unit tests.
public final class SimpleTypeDescriptor implements TypeDescriptor {
    public static final String NULLABLE = "org.jspecify.annotations.Nullable";

    private final Shape shape;
    private final String qualifiedName;
    private final List<TypeDescriptor> typeArguments;
    private final String wildcardKeyword;
    private final List<TypeDescriptor> supertypes;
    private final List<MemberDescriptor> fields;
    private final List<MemberDescriptor> accessors;
    private final List<PropertyDescriptor> properties;
    private final boolean record;
    private final Optional<String> nullableAnnotation;

    private SimpleTypeDescriptor(Shape shape,
                                 String qualifiedName,
                                 List<TypeDescriptor> typeArguments,
                                 String wildcardKeyword,
                                 List<TypeDescriptor> supertypes,
                                 List<MemberDescriptor> fields,
                                 List<MemberDescriptor> accessors,
                                 List<PropertyDescriptor> properties,
                                 boolean record,
                                 Optional<String> nullableAnnotation) {
        this.shape = shape;
        this.qualifiedName = qualifiedName;
        this.typeArguments = List.copyOf(typeArguments);
        this.wildcardKeyword = wildcardKeyword;
        this.supertypes = List.copyOf(supertypes);
        this.fields = List.copyOf(fields);
        this.accessors = List.copyOf(accessors);
        this.properties = List.copyOf(properties);
        this.record = record;
        this.nullableAnnotation = nullableAnnotation;
    }

    public static SimpleTypeDescriptor primitive(String keyword) {
        return of(Shape.PRIMITIVE, keyword, List.of());
    }

    public static SimpleTypeDescriptor voidType() {
        return of(Shape.VOID, "void", List.of());
    }

    public static SimpleTypeDescriptor declared(String qualifiedName, TypeDescriptor... typeArguments) {
        return of(Shape.DECLARED, qualifiedName, List.of(typeArguments));
    }

    public static SimpleTypeDescriptor array(TypeDescriptor component) {
        return of(Shape.ARRAY, component.qualifiedName() + "[]", List.of(component));
    }

    public static SimpleTypeDescriptor wildcardExtends(TypeDescriptor bound) {
        return new SimpleTypeDescriptor(Shape.WILDCARD, "?", List.of(bound), "extends", List.of(), List.of(),
                                        List.of(), List.of(), false, Optional.empty());
    }

    public static SimpleTypeDescriptor string() {
        return declared("java.lang.String");
    }

    /// `java.util.List<item>` with its `Collection` and `Iterable` supertypes.
    public static SimpleTypeDescriptor list(TypeDescriptor item) {
        return collection("java.util.List", item);
    }

    /// Generic container `qualifiedName<item>` implementing `Collection<item>`.
    public static SimpleTypeDescriptor collection(String qualifiedName, TypeDescriptor item) {
        var iterable = declared("java.lang.Iterable", item);
        var collection = declared("java.util.Collection", item).withSupertypes(iterable);
        return qualifiedName.equals("java.util.Collection")
               ? collection
               : declared(qualifiedName, item).withSupertypes(collection);
    }

    public SimpleTypeDescriptor withSupertypes(TypeDescriptor... supertypes) {
        return new SimpleTypeDescriptor(shape, qualifiedName, typeArguments, wildcardKeyword, List.of(supertypes), fields,
                                        accessors, properties, record, nullableAnnotation);
    }

    public SimpleTypeDescriptor withFields(MemberDescriptor... fields) {
        return new SimpleTypeDescriptor(shape, qualifiedName, typeArguments, wildcardKeyword, supertypes, List.of(fields),
                                        accessors, properties, record, nullableAnnotation);
    }

    public SimpleTypeDescriptor withAccessors(MemberDescriptor... accessors) {
        return new SimpleTypeDescriptor(shape, qualifiedName, typeArguments, wildcardKeyword, supertypes, fields,
                                        List.of(accessors), properties, record, nullableAnnotation);
    }

    /// Bean-style properties assigned through `setX` methods, ordinals in argument order.
    public SimpleTypeDescriptor withSetterProperties(Object... namesAndTypes) {
        var list = new ArrayList<PropertyDescriptor>();
        for (int i = 0; i < namesAndTypes.length; i += 2) {
            var name = (String) namesAndTypes[i];
            var setter = "set" + Character.toUpperCase(name.charAt(0)) + name.substring(1);
            list.add(PropertyDescriptor.setter(name, (TypeDescriptor) namesAndTypes[i + 1], list.size(), setter));
        }
        return withProperties(list, false);
    }

    /// Record components, ordinals in argument order.
    public SimpleTypeDescriptor withComponents(Object... namesAndTypes) {
        var list = new ArrayList<PropertyDescriptor>();
        for (int i = 0; i < namesAndTypes.length; i += 2) {
            list.add(PropertyDescriptor.component((String) namesAndTypes[i], (TypeDescriptor) namesAndTypes[i + 1], list.size()));
        }
        return withProperties(list, true);
    }

    public SimpleTypeDescriptor withProperties(List<PropertyDescriptor> properties, boolean record) {
        return new SimpleTypeDescriptor(shape, qualifiedName, typeArguments, wildcardKeyword, supertypes, fields,
                                        accessors, properties, record, nullableAnnotation);
    }

    public SimpleTypeDescriptor nullable() {
        return new SimpleTypeDescriptor(shape, qualifiedName, typeArguments, wildcardKeyword, supertypes, fields,
                                        accessors, properties, record, Optional.of(NULLABLE));
    }

    @Override
    public Shape shape() {
        return shape;
    }

    @Override
    public String qualifiedName() {
        return qualifiedName;
    }

    @Override
    public String simpleName() {
        var lastDot = qualifiedName.lastIndexOf('.');
        return lastDot >= 0 ? qualifiedName.substring(lastDot + 1) : qualifiedName;
    }

    @Override
    public List<TypeDescriptor> typeArguments() {
        return typeArguments;
    }

    @Override
    public String wildcardKeyword() {
        return wildcardKeyword;
    }

    @Override
    public List<TypeDescriptor> supertypes() {
        return supertypes;
    }

    @Override
    public List<MemberDescriptor> fields() {
        return fields;
    }

    @Override
    public List<MemberDescriptor> accessors() {
        return accessors;
    }

    @Override
    public List<PropertyDescriptor> properties() {
        return properties;
    }

    @Override
    public boolean isRecord() {
        return record;
    }

    @Override
    public Optional<String> nullableAnnotation() {
        return nullableAnnotation;
    }

    @Override
    public String toString() {
        return qualifiedName;
    }

    private static SimpleTypeDescriptor of(Shape shape, String qualifiedName, List<TypeDescriptor> typeArguments) {
        return new SimpleTypeDescriptor(shape, qualifiedName, typeArguments, "", List.of(), List.of(), List.of(),
                                        List.of(), false, Optional.empty());
    }
}
