package com.officeduty.backend.global.datasource;

import javax.sql.DataSource;

import com.zaxxer.hikari.HikariDataSource;

import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Builds the pooled {@link DataSource}. An explicit {@code spring.datasource.url} always wins;
 * without one the connection string is resolved once here from the registered
 * {@link ConnectionStringSource}s.
 */
@Configuration
public class DataSourceConfig {

    private static final String POSTGRES_DRIVER = "org.postgresql.Driver";

    @Bean
    @ConfigurationProperties("spring.datasource.hikari")
    public HikariDataSource dataSource(DataSourceProperties properties, ConnectionStringResolver resolver) {
        if (StringUtils.hasText(properties.getUrl())) {
            return properties.initializeDataSourceBuilder()
                    .type(HikariDataSource.class)
                    .build();
        }
        JdbcConnection connection = resolver.resolve();
        return DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .driverClassName(POSTGRES_DRIVER)
                .url(connection.url())
                .username(connection.username())
                .password(connection.password())
                .build();
    }
}
