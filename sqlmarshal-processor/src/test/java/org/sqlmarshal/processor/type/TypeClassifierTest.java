package org.sqlmarshal.processor.type;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.sqlmarshal.processor.type.SimpleTypeDescriptor.collection;
import static org.sqlmarshal.processor.type.SimpleTypeDescriptor.declared;
import static org.sqlmarshal.processor.type.SimpleTypeDescriptor.list;
import static org.sqlmarshal.processor.type.SimpleTypeDescriptor.primitive;
import static org.sqlmarshal.processor.type.SimpleTypeDescriptor.string;
import static org.sqlmarshal.processor.type.SimpleTypeDescriptor.voidType;
import static org.sqlmarshal.processor.type.SimpleTypeDescriptor.wildcardExtends;

class TypeClassifierTest {
    private static final SimpleTypeDescriptor PERSON = declared("com.example.Person");

    private final TypeClassifier oblivious = new TypeClassifier(NullabilityMode.OBLIVIOUS);
    private final TypeClassifier annotated = new TypeClassifier(NullabilityMode.ANNOTATED);

    @Nested
    class ScalarTests {
        @Test
        void classify_primitiveInt_isNonNullableScalar() {
            var classification = oblivious.classify(primitive("int"));

            assertThat(classification.kind()).isEqualTo(TypeClassification.Kind.SCALAR);
            assertThat(classification.scalarKind()).isEqualTo(ScalarKind.INT32);
            assertThat(classification.nullable()).isFalse();
        }

        @Test
        void classify_string_isNullableOnlyWhenOblivious() {
            assertThat(oblivious.classify(string()).nullable()).isTrue();
            assertThat(annotated.classify(string()).nullable()).isFalse();
            assertThat(annotated.classify(string().nullable()).nullable()).isTrue();
        }

        @Test
        void classify_optionalInteger_unwrapsToNullableScalar() {
            var integer = declared("java.lang.Integer");
            var classification = annotated.classify(declared("java.util.Optional", integer));

            assertThat(classification.isScalar()).isTrue();
            assertThat(classification.optional()).isTrue();
            assertThat(classification.nullable()).isTrue();
            assertThat(classification.underlyingType()).isSameAs(integer);
        }

        @Test
        void classify_char_hasNoScalarMapping() {
            assertThatThrownBy(() -> oblivious.classify(primitive("char")))
                .isInstanceOf(UnsupportedTypeException.class)
                .hasMessageContaining("No scalar mapping for char");
        }
    }

    @Nested
    class CollectionTests {
        @Test
        void classify_listOfEntities_yieldsEntityCollection() {
            var classification = oblivious.classify(list(PERSON));

            assertThat(classification.kind()).isEqualTo(TypeClassification.Kind.ENTITY_COLLECTION);
            assertThat(classification.underlyingType()).isSameAs(PERSON);
            assertThat(classification.hasScalarItems()).isFalse();
            assertThat(classification.nullable()).isFalse();
        }

        @Test
        void classify_listOfStrings_hasScalarItems() {
            var classification = oblivious.classify(list(string()));

            assertThat(classification.isList()).isTrue();
            assertThat(classification.hasScalarItems()).isTrue();
            assertThat(classification.scalarKind()).isEqualTo(ScalarKind.TEXT);
        }

        @Test
        void classify_wildcardItem_usesItsBound() {
            var classification = oblivious.classify(list(wildcardExtends(PERSON)));

            assertThat(classification.underlyingType()).isSameAs(PERSON);
        }

        @Test
        void classify_iterableAndArrayList_areAccepted() {
            assertThat(oblivious.classify(declared("java.lang.Iterable", PERSON)).isList()).isTrue();
            assertThat(oblivious.classify(collection("java.util.ArrayList", PERSON)).isList()).isTrue();
        }

        @Test
        void classify_set_isRejected() {
            assertThatThrownBy(() -> oblivious.classify(collection("java.util.Set", PERSON)))
                .isInstanceOf(UnsupportedTypeException.class)
                .hasMessageContaining("Unsupported collection type java.util.Set");
        }

        @Test
        void classify_optionalList_isRejected() {
            assertThatThrownBy(() -> oblivious.classify(declared("java.util.Optional", list(PERSON))))
                .isInstanceOf(UnsupportedTypeException.class);
        }
    }

    @Nested
    class OtherKindTests {
        @Test
        void classify_voidAndBoxedVoid_yieldVoid() {
            assertThat(oblivious.classify(voidType()).kind()).isEqualTo(TypeClassification.Kind.VOID);
            assertThat(oblivious.classify(declared("java.lang.Void")).kind()).isEqualTo(TypeClassification.Kind.VOID);
        }

        @Test
        void classify_declaredNonScalar_isEntity() {
            var classification = annotated.classify(PERSON.nullable());

            assertThat(classification.kind()).isEqualTo(TypeClassification.Kind.ENTITY);
            assertThat(classification.nullable()).isTrue();
        }

        @Test
        void classify_isIdempotent() {
            var type = declared("java.util.Optional", PERSON);

            assertThat(oblivious.classify(type)).isEqualTo(oblivious.classify(type));
        }
    }

    @Nested
    class ModeTests {
        @Test
        void fromOption_parsesKnownModes() {
            assertThat(NullabilityMode.fromOption("annotated")).contains(NullabilityMode.ANNOTATED);
            assertThat(NullabilityMode.fromOption(" Oblivious ")).contains(NullabilityMode.OBLIVIOUS);
            assertThat(NullabilityMode.fromOption("auto")).isEmpty();
            assertThat(NullabilityMode.fromOption("")).isEmpty();
        }

        @Test
        void fromOption_rejectsUnknownMode() {
            assertThatThrownBy(() -> NullabilityMode.fromOption("strict"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("strict");
        }
    }
}
