package com.officeduty.backend.global.datasource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;

import com.google.cloud.secretmanager.v1.AccessSecretVersionResponse;
import com.google.cloud.secretmanager.v1.SecretManagerServiceClient;
import com.google.cloud.secretmanager.v1.SecretPayload;
import com.google.cloud.secretmanager.v1.SecretVersionName;
import com.google.protobuf.ByteString;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SecretManagerConnectionStringSourceTest {

    private static final SecretVersionName VERSION =
            SecretVersionName.of("office-project", "neon-database-connection-string", "latest");

    @Mock
    private SecretManagerServiceClient client;

    @Test
    void readsLatestSecretVersionAndClosesClient() {
        when(client.accessSecretVersion(VERSION)).thenReturn(response("postgresql://prod:pw@neon.example/duties\n"));
        SecretManagerConnectionStringSource source = new SecretManagerConnectionStringSource(
                "neon-database-connection-string", "office-project", () -> client);

        assertThat(source.connectionString()).contains("postgresql://prod:pw@neon.example/duties");
        verify(client).close();
    }

    @Test
    void emptyPayloadMeansNoConnectionString() {
        when(client.accessSecretVersion(VERSION)).thenReturn(response(""));
        SecretManagerConnectionStringSource source = new SecretManagerConnectionStringSource(
                "neon-database-connection-string", "office-project", () -> client);

        assertThat(source.connectionString()).isEmpty();
    }

    @Test
    void clientCreationFailureIsReported() {
        SecretManagerConnectionStringSource source = new SecretManagerConnectionStringSource(
                "neon-database-connection-string", "office-project", () -> {
                    throw new IOException("no credentials");
                });

        assertThatThrownBy(source::connectionString)
                .isInstanceOf(IllegalStateException.class)
                .hasRootCauseMessage("no credentials");
    }

    @Test
    void configuredProjectIdIsTrimmed() {
        SecretManagerConnectionStringSource source = new SecretManagerConnectionStringSource(
                "neon-database-connection-string", " office-project ", () -> client);

        assertThat(source.resolveProjectId()).isEqualTo("office-project");
        assertThat(source.name()).contains("neon-database-connection-string");
    }

    private static AccessSecretVersionResponse response(String payload) {
        return AccessSecretVersionResponse.newBuilder()
                .setName(VERSION.toString())
                .setPayload(SecretPayload.newBuilder().setData(ByteString.copyFromUtf8(payload)))
                .build();
    }
}
