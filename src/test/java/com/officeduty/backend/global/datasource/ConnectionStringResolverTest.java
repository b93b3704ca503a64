package com.officeduty.backend.global.datasource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class ConnectionStringResolverTest {

    @Test
    void environmentVariableWinsOverLaterSources() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty(EnvironmentConnectionStringSource.VARIABLE, "postgresql://dev:pw@localhost/duties");
        ConnectionStringResolver resolver = new ConnectionStringResolver(List.of(
                new EnvironmentConnectionStringSource(environment),
                failingSource()));

        JdbcConnection connection = resolver.resolve();

        assertThat(connection.url()).isEqualTo("jdbc:postgresql://localhost/duties");
        assertThat(connection.username()).isEqualTo("dev");
    }

    @Test
    void fallsThroughToNextSourceWhenVariableIsBlank() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty(EnvironmentConnectionStringSource.VARIABLE, "  ");
        ConnectionStringResolver resolver = new ConnectionStringResolver(List.of(
                new EnvironmentConnectionStringSource(environment),
                fixedSource("postgresql://prod:pw@neon.example/duties?sslmode=require")));

        assertThat(resolver.resolve().url()).isEqualTo("jdbc:postgresql://neon.example/duties?sslmode=require");
    }

    @Test
    void failsNamingEverySourceTried() {
        ConnectionStringResolver resolver = new ConnectionStringResolver(List.of(
                new EnvironmentConnectionStringSource(new MockEnvironment()),
                fixedSource(null)));

        assertThatThrownBy(resolver::resolve)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("DATABASE_URL_DEV")
                .hasMessageContaining("fixed");
    }

    private static ConnectionStringSource fixedSource(String value) {
        return new ConnectionStringSource() {
            @Override
            public String name() {
                return "fixed";
            }

            @Override
            public Optional<String> connectionString() {
                return Optional.ofNullable(value);
            }
        };
    }

    private static ConnectionStringSource failingSource() {
        return new ConnectionStringSource() {
            @Override
            public String name() {
                return "unreachable";
            }

            @Override
            public Optional<String> connectionString() {
                throw new AssertionError("later sources must not be consulted");
            }
        };
    }
}
