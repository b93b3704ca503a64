package com.officeduty.backend.global.datasource;

import java.util.Optional;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Local development: the connection string is exported as {@code DATABASE_URL_DEV}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class EnvironmentConnectionStringSource implements ConnectionStringSource {

    static final String VARIABLE = "DATABASE_URL_DEV";

    private final Environment environment;

    public EnvironmentConnectionStringSource(Environment environment) {
        this.environment = environment;
    }

    @Override
    public String name() {
        return "environment variable " + VARIABLE;
    }

    @Override
    public Optional<String> connectionString() {
        String value = environment.getProperty(VARIABLE);
        return StringUtils.hasText(value) ? Optional.of(value.trim()) : Optional.empty();
    }
}
