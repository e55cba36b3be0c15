package io.netorca.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netorca.sdk.client.NetOrcaClient;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.net.URI;
import java.net.http.HttpClient;

/**
 * Creates {@link NetOrcaClient} instances sharing the application's HTTP client.
 */
@Singleton
public class NetOrcaClientFactory {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Inject
    public NetOrcaClientFactory(HttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public NetOrcaClient forEndpoint(URI baseUrl) {
        return new NetOrcaClient(baseUrl, httpClient, objectMapper);
    }
}
