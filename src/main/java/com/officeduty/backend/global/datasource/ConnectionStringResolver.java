package com.officeduty.backend.global.datasource;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ConnectionStringResolver {

    private static final Logger log = LoggerFactory.getLogger(ConnectionStringResolver.class);

    private final List<ConnectionStringSource> sources;

    public ConnectionStringResolver(List<ConnectionStringSource> sources) {
        this.sources = List.copyOf(sources);
    }

    public JdbcConnection resolve() {
        for (ConnectionStringSource source : sources) {
            Optional<String> connectionString = source.connectionString();
            if (connectionString.isPresent()) {
                log.info("Using database connection from {}", source.name());
                return JdbcConnection.parse(connectionString.get());
            }
            log.debug("No database connection string in {}", source.name());
        }
        throw new IllegalStateException("No database connection string found; tried "
                + sources.stream().map(ConnectionStringSource::name).toList());
    }
}
