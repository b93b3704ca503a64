package com.officeduty.backend.global.datasource;

import java.io.IOException;
import java.util.Optional;

import com.google.cloud.ServiceOptions;
import com.google.cloud.secretmanager.v1.AccessSecretVersionResponse;
import com.google.cloud.secretmanager.v1.SecretManagerServiceClient;
import com.google.cloud.secretmanager.v1.SecretVersionName;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Production: the connection string lives in Google Secret Manager. The project defaults to the
 * one the runtime is deployed in (metadata server / {@code GOOGLE_CLOUD_PROJECT}).
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class SecretManagerConnectionStringSource implements ConnectionStringSource {

    private static final Logger log = LoggerFactory.getLogger(SecretManagerConnectionStringSource.class);
    private static final String LATEST_VERSION = "latest";

    private final String secretId;
    private final String configuredProjectId;
    private final ClientFactory clientFactory;

    @Autowired
    public SecretManagerConnectionStringSource(
            @Value("${office-duty.secrets.database-secret:neon-database-connection-string}") String secretId,
            @Value("${office-duty.secrets.project-id:}") String configuredProjectId
    ) {
        this(secretId, configuredProjectId, SecretManagerServiceClient::create);
    }

    SecretManagerConnectionStringSource(String secretId, String configuredProjectId, ClientFactory clientFactory) {
        this.secretId = secretId;
        this.configuredProjectId = configuredProjectId;
        this.clientFactory = clientFactory;
    }

    @Override
    public String name() {
        return "Secret Manager secret " + secretId;
    }

    @Override
    public Optional<String> connectionString() {
        SecretVersionName versionName = SecretVersionName.of(resolveProjectId(), secretId, LATEST_VERSION);
        log.info("Reading database connection string from {}", versionName);
        try (SecretManagerServiceClient client = clientFactory.create()) {
            AccessSecretVersionResponse response = client.accessSecretVersion(versionName);
            String secret = response.getPayload().getData().toStringUtf8();
            return StringUtils.hasText(secret) ? Optional.of(secret.trim()) : Optional.empty();
        } catch (IOException ex) {
            throw new IllegalStateException("Could not create Secret Manager client", ex);
        }
    }

    String resolveProjectId() {
        if (StringUtils.hasText(configuredProjectId)) {
            return configuredProjectId.trim();
        }
        String projectId = ServiceOptions.getDefaultProjectId();
        if (!StringUtils.hasText(projectId)) {
            throw new IllegalStateException(
                    "No Google Cloud project id: set office-duty.secrets.project-id or run inside a GCP project");
        }
        return projectId;
    }

    @FunctionalInterface
    interface ClientFactory {
        SecretManagerServiceClient create() throws IOException;
    }
}
