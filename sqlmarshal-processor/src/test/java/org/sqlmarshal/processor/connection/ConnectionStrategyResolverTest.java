package org.sqlmarshal.processor.connection;

import org.junit.jupiter.api.Test;
import org.sqlmarshal.processor.DeclarationException;
import org.sqlmarshal.processor.type.MemberDescriptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.sqlmarshal.processor.type.SimpleTypeDescriptor.declared;
import static org.sqlmarshal.processor.type.SimpleTypeDescriptor.string;

class ConnectionStrategyResolverTest {
    private static final MemberDescriptor NAME = MemberDescriptor.field("name", string(), true);

    @Test
    void resolve_prefersConnectionField_overContextField() {
        var repository = declared("com.example.Repository")
            .withFields(NAME,
                        MemberDescriptor.field("context", declared("org.jooq.DSLContext"), false),
                        MemberDescriptor.field("connection", declared("java.sql.Connection"), false));

        assertThat(ConnectionStrategyResolver.resolve(repository)).isEqualTo(new ConnectionStrategy.Found("connection"));
    }

    @Test
    void resolve_acceptsSubtypeOfConnection() {
        var pooled = declared("com.example.PooledConnection").withSupertypes(declared("java.sql.Connection"));
        var repository = declared("com.example.Repository").withFields(MemberDescriptor.field("pooled", pooled, false));

        var strategy = ConnectionStrategyResolver.resolve(repository);

        assertThat(strategy.fieldName()).isEqualTo("pooled");
        assertThat(strategy.requiresExplicitOpenClose()).isFalse();
    }

    @Test
    void resolve_findsContextField_withItsType() {
        var shopContext = declared("com.example.ShopContext").withSupertypes(declared("org.jooq.DSLContext"));
        var repository = declared("com.example.Repository").withFields(MemberDescriptor.field("db", shopContext, false));

        var strategy = ConnectionStrategyResolver.resolve(repository);

        assertThat(strategy).isEqualTo(new ConnectionStrategy.FoundContext("db", shopContext));
        assertThat(strategy.hasContext()).isTrue();
        assertThat(strategy.requiresExplicitOpenClose()).isTrue();
    }

    @Test
    void resolve_assumesDefaultContext_whenNoFieldMatches() {
        var strategy = ConnectionStrategyResolver.resolve(declared("com.example.Repository").withFields(NAME));

        assertThat(strategy).isEqualTo(new ConnectionStrategy.AssumedDefault("context"));
        assertThat(strategy.hasContext()).isFalse();
        assertThat(strategy.requiresExplicitOpenClose()).isTrue();
    }

    @Test
    void resolve_rejectsPrivateConnectionField() {
        var repository = declared("com.example.Repository")
            .withFields(MemberDescriptor.field("connection", declared("java.sql.Connection"), true));

        assertThatThrownBy(() -> ConnectionStrategyResolver.resolve(repository))
            .isInstanceOf(DeclarationException.class)
            .hasMessage("Field 'connection' of Repository is private and cannot be used by the generated subclass");
    }
}
