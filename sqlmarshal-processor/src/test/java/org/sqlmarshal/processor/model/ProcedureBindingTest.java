package org.sqlmarshal.processor.model;

import org.junit.jupiter.api.Test;
import org.sqlmarshal.processor.type.TypeDescriptor;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.sqlmarshal.processor.type.SimpleTypeDescriptor.declared;
import static org.sqlmarshal.processor.type.SimpleTypeDescriptor.primitive;
import static org.sqlmarshal.processor.type.SimpleTypeDescriptor.string;
import static org.sqlmarshal.processor.type.SimpleTypeDescriptor.voidType;

class ProcedureBindingTest {
    private static final TypeDescriptor INTEGER = declared("java.lang.Integer");

    private static final List<ParameterSpec> PARAMETERS = List.of(
        ParameterSpec.rawSql("sql", string()),
        ParameterSpec.in("clientId", primitive("int")),
        ParameterSpec.holder("total", INTEGER, declared("org.sqlmarshal.Out", INTEGER), Direction.OUT),
        ParameterSpec.holder("note", string(), declared("org.sqlmarshal.Ref", string()), Direction.IN_OUT));

    @Test
    void boundParameters_excludeRawSql_inDeclarationOrder() {
        var binding = binding(List.of());

        assertThat(binding.boundParameters()).extracting(ParameterSpec::internalName)
                                             .containsExactly("clientId", "total", "note");
        assertThat(binding.outputParameters()).extracting(ParameterSpec::internalName)
                                              .containsExactly("total", "note");
    }

    @Test
    void propagatesSqlException_whenSqlExceptionOrSupertypeDeclared() {
        assertThat(binding(List.of()).propagatesSqlException()).isFalse();
        assertThat(binding(List.of(declared("java.io.IOException"))).propagatesSqlException()).isFalse();
        assertThat(binding(List.of(declared("java.sql.SQLException"))).propagatesSqlException()).isTrue();
        assertThat(binding(List.of(declared("java.lang.Exception"))).propagatesSqlException()).isTrue();
    }

    @Test
    void parameterSpec_holderKeepsValueAndSignatureTypes() {
        var total = PARAMETERS.get(2);

        assertThat(total.declaredType()).isSameAs(INTEGER);
        assertThat(total.signatureType().qualifiedName()).isEqualTo("org.sqlmarshal.Out");
        assertThat(total.direction().isInput()).isFalse();
        assertThat(total.parameterVariable()).isEqualTo("totalParameter");
    }

    private static ProcedureBinding binding(List<TypeDescriptor> thrownTypes) {
        return new ProcedureBinding("compute", Visibility.PUBLIC, voidType(), PARAMETERS,
                                    new CommandSource.RawText("sql"), thrownTypes, Optional.empty());
    }
}
