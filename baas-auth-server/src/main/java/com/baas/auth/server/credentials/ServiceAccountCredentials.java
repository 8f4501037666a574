package com.baas.auth.server.credentials;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Credentials read from a service account JSON key file.
 */
public final class ServiceAccountCredentials implements CredentialSource {

    private static final ObjectMapper MAPPER =
        new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    static final class ServiceAccountJson {
        @JsonProperty("client_email")
        String clientEmail;

        @JsonProperty("private_key")
        String privateKey;

        @JsonProperty("project_id")
        String projectId;
    }

    private final String clientEmail;
    private final String privateKey;
    private final String projectId;

    private ServiceAccountCredentials(ServiceAccountJson json) {
        this.clientEmail = blankToNull(json.clientEmail);
        this.privateKey = blankToNull(json.privateKey);
        this.projectId = blankToNull(json.projectId);
    }

    public static ServiceAccountCredentials fromJson(String json) throws IOException {
        ServiceAccountJson parsed = MAPPER.readValue(json, ServiceAccountJson.class);
        if (parsed == null) {
            throw new IOException("Service account JSON is empty");
        }
        return new ServiceAccountCredentials(parsed);
    }

    public static ServiceAccountCredentials fromFile(Path path) throws IOException {
        return fromJson(Files.readString(path));
    }

    public Optional<String> clientEmail() {
        return Optional.ofNullable(clientEmail);
    }

    @Override
    public Optional<SignerCredentials> signer() {
        if (clientEmail == null || privateKey == null) {
            return Optional.empty();
        }
        return Optional.of(new SignerCredentials(clientEmail, privateKey));
    }

    @Override
    public Optional<String> projectId() {
        return Optional.ofNullable(projectId);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
