package io.netorca.sdk.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netorca.sdk.client.auth.AuthClient;
import io.netorca.sdk.client.resources.ChangeInstanceRepository;
import io.netorca.sdk.client.resources.ChangeInstanceUpdater;
import io.netorca.sdk.client.resources.ServiceItemRepository;
import io.netorca.sdk.dto.ListResult;
import io.netorca.sdk.exception.AuthenticationException;
import io.netorca.sdk.exception.NetOrcaException;
import io.netorca.sdk.exception.NetworkException;
import io.netorca.sdk.exception.ServerException;
import io.netorca.sdk.workflow.CompletionWorkflow;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Client for one NetOrca instance.
 *
 * <p>Requests are sent once, without retry, using the injected
 * {@link HttpClient} and its timeouts. Authenticated calls carry
 * {@code Authorization: Token <token>}.
 *
 * <p>Example usage:
 * <pre>{@code
 * var client = new NetOrcaClient(URI.create("https://dev.netorca.io"), httpClient, objectMapper);
 * String token = client.auth().resolveToken(credential);
 *
 * var approved = client.changeInstances()
 *     .list(token, Optional.of(ChangeState.APPROVED), Optional.of("LoadBalancer"));
 *
 * var result = client.completionWorkflow()
 *     .completeApproved(token, "LoadBalancer", Map.of("ip", "10.0.0.1"));
 * }</pre>
 */
public class NetOrcaClient {

    private static final Logger LOG = Logger.getLogger(NetOrcaClient.class);

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final URI baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private AuthClient auth;
    private ChangeInstanceRepository changeInstances;
    private ServiceItemRepository serviceItems;
    private ChangeInstanceUpdater changeInstanceUpdater;
    private CompletionWorkflow completionWorkflow;

    public NetOrcaClient(URI baseUrl, HttpClient httpClient, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public NetOrcaClient(URI baseUrl, HttpClient httpClient) {
        this(baseUrl, httpClient, new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    /**
     * Get the authentication resource.
     */
    public AuthClient auth() {
        if (auth == null) {
            auth = new AuthClient(this);
        }
        return auth;
    }

    /**
     * Get the change instances resource.
     */
    public ChangeInstanceRepository changeInstances() {
        if (changeInstances == null) {
            changeInstances = new ChangeInstanceRepository(this);
        }
        return changeInstances;
    }

    /**
     * Get the service items resource.
     */
    public ServiceItemRepository serviceItems() {
        if (serviceItems == null) {
            serviceItems = new ServiceItemRepository(this);
        }
        return serviceItems;
    }

    /**
     * Get the change instance updater.
     */
    public ChangeInstanceUpdater changeInstanceUpdater() {
        if (changeInstanceUpdater == null) {
            changeInstanceUpdater = new ChangeInstanceUpdater(this);
        }
        return changeInstanceUpdater;
    }

    /**
     * Get the workflow completing approved changes.
     */
    public CompletionWorkflow completionWorkflow() {
        if (completionWorkflow == null) {
            completionWorkflow = new CompletionWorkflow(changeInstances(), changeInstanceUpdater());
        }
        return completionWorkflow;
    }

    /**
     * Make a request against a path relative to the base URL.
     *
     * @param token token for the Authorization header, or {@code null} for anonymous calls
     */
    public <T> T request(String method, String path, String token, Object body, TypeReference<T> responseType) {
        return send(method, resolve(path), token, body, responseType);
    }

    /**
     * Make a request returning a JSON object.
     */
    public Map<String, Object> requestObject(String method, String path, String token, Object body) {
        return request(method, path, token, body, JSON_OBJECT);
    }

    /**
     * Read a paginated list endpoint, following {@code next} links until exhausted.
     *
     * <p>A page reporting {@code count == 0} ends the listing without reading
     * its {@code results}. {@code next} links must stay on the base URL's origin,
     * since the token is sent with every page.
     */
    public <T> ListResult<T> list(String path, String token, Function<Map<String, Object>, T> mapper) {
        List<T> items = new ArrayList<>();
        Set<URI> visited = new HashSet<>();
        URI page = resolve(path);

        while (page != null) {
            if (!visited.add(page)) {
                throw new NetOrcaException("Pagination loop detected at " + page);
            }
            Map<String, Object> response = send("GET", page, token, null, JSON_OBJECT);
            if (response == null) {
                throw new NetOrcaException("Empty list response from " + page);
            }
            if (count(response) == 0) {
                break;
            }

            if (!(response.get("results") instanceof List<?> results)) {
                throw new NetOrcaException("Malformed list response from " + page);
            }
            for (Object result : results) {
                items.add(mapper.apply(asObject(result, page)));
            }

            page = nextPage(response);
        }

        LOG.debugf("Listed %d items from %s in %d page(s)", items.size(), path, (Object) visited.size());
        return ListResult.of(items);
    }

    private <T> T send(String method, URI uri, String token, Object body, TypeReference<T> responseType) {
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
            .uri(uri)
            .header("Accept", "application/json")
            .header("Content-Type", "application/json");

        if (token != null) {
            requestBuilder.header("Authorization", "Token " + token);
        }

        try {
            if (body != null) {
                String jsonBody = objectMapper.writeValueAsString(body);
                requestBuilder.method(method, HttpRequest.BodyPublishers.ofString(jsonBody));
            } else {
                requestBuilder.method(method, HttpRequest.BodyPublishers.noBody());
            }
        } catch (IOException e) {
            throw new NetOrcaException("Failed to serialize request body", e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            LOG.errorf("%s %s failed: %s", method, uri, e.getMessage());
            throw NetworkException.requestFailed(method, uri.toString(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw NetworkException.interrupted(method, uri.toString(), e);
        }

        LOG.debugf("%s %s returned %d", method, uri, response.statusCode());
        return handleResponse(method, uri, response, responseType);
    }

    private <T> T handleResponse(String method, URI uri, HttpResponse<String> response,
                                 TypeReference<T> responseType) {
        int status = response.statusCode();
        String body = response.body();

        if (status == 401 || status == 403) {
            throw AuthenticationException.tokenRejected(status);
        }

        if (status >= 400) {
            throw ServerException.fromResponse(method, uri.toString(), status, parseErrorBody(body));
        }

        if (body == null || body.isBlank()) {
            return null;
        }

        try {
            return objectMapper.readValue(body, responseType);
        } catch (IOException e) {
            throw new NetOrcaException("Failed to parse response", status, e, Map.of());
        }
    }

    private Map<String, Object> parseErrorBody(String body) {
        if (body == null || body.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(body, JSON_OBJECT);
        } catch (IOException e) {
            return Map.of("body", body);
        }
    }

    private URI nextPage(Map<String, Object> response) {
        Object next = response.get("next");
        if (!(next instanceof String link) || link.isBlank()) {
            return null;
        }
        URI uri = baseUrl.resolve(link);
        if (!sameOrigin(baseUrl, uri)) {
            throw new NetOrcaException("Refusing to follow next link off " + baseUrl + ": " + uri);
        }
        return uri;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asObject(Object result, URI page) {
        if (!(result instanceof Map<?, ?>)) {
            throw new NetOrcaException("Malformed list response from " + page);
        }
        return (Map<String, Object>) result;
    }

    private static boolean sameOrigin(URI expected, URI actual) {
        return expected.getScheme().equalsIgnoreCase(String.valueOf(actual.getScheme()))
            && expected.getHost().equalsIgnoreCase(String.valueOf(actual.getHost()))
            && port(expected) == port(actual);
    }

    private static int port(URI uri) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }

    private static int count(Map<String, Object> response) {
        Object count = response.get("count");
        return count instanceof Number n ? n.intValue() : -1;
    }

    /**
     * Resolve a path against the base URL. Absolute paths replace the base
     * URL's own path, so {@code /api-token-auth/} lands on the host root.
     */
    private URI resolve(String path) {
        return baseUrl.resolve(path);
    }

    public URI getBaseUrl() {
        return baseUrl;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
