package com.officeduty.backend.global.datasource;

import java.util.Optional;

/**
 * One place a database connection string can come from. Sources are consulted in
 * {@link org.springframework.core.annotation.Order} order and the first one that yields a value wins.
 */
public interface ConnectionStringSource {

    String name();

    Optional<String> connectionString();
}
