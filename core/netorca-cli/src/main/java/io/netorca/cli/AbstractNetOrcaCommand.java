package io.netorca.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netorca.sdk.client.NetOrcaClient;
import io.netorca.sdk.client.auth.Credential;
import io.netorca.sdk.exception.NetOrcaException;
import io.netorca.sdk.exception.ValidationException;
import org.jboss.logging.Logger;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Base for commands talking to NetOrca.
 *
 * <p>Every parameter is validated before the first request. A token is
 * obtained once per invocation and handed to {@link #execute}. The result, or
 * the failure, is written to stdout as a JSON object.
 */
public abstract class AbstractNetOrcaCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(AbstractNetOrcaCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_INVALID = 2;

    @Mixin
    ConnectionOptions connection;

    @Spec
    CommandSpec spec;

    protected final NetOrcaClientFactory clients;
    protected final ObjectMapper objectMapper;

    protected AbstractNetOrcaCommand(NetOrcaClientFactory clients, ObjectMapper objectMapper) {
        this.clients = clients;
        this.objectMapper = objectMapper;
    }

    /**
     * Check command-specific parameters. Must not perform any I/O.
     */
    protected abstract void validate();

    /**
     * Run the command against NetOrca.
     *
     * @return the result object to print
     */
    protected abstract Map<String, Object> execute(NetOrcaClient client, String token);

    @Override
    public Integer call() {
        URI baseUrl;
        Credential credential;
        try {
            baseUrl = connection.baseUrl();
            credential = connection.credential();
            validate();
        } catch (ValidationException e) {
            LOG.errorf("Invalid parameters for %s: %s", spec.name(), e.getMessage());
            print(failure(e));
            return EXIT_INVALID;
        }

        try {
            NetOrcaClient client = clients.forEndpoint(baseUrl);
            String token = client.auth().resolveToken(credential);
            print(execute(client, token));
            return EXIT_OK;
        } catch (ValidationException e) {
            LOG.errorf("Invalid parameters for %s: %s", spec.name(), e.getMessage());
            print(failure(e));
            return EXIT_INVALID;
        } catch (NetOrcaException e) {
            LOG.errorf("%s failed: %s", spec.name(), e.getMessage());
            print(failure(e));
            return EXIT_FAILED;
        }
    }

    /**
     * Build the failure object for {@code e}. Subclasses may add fields.
     */
    protected Map<String, Object> failure(NetOrcaException e) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("failed", true);
        result.put("changed", false);
        result.put("msg", e.getMessage());
        e.status().ifPresent(status -> result.put("status", status));
        return result;
    }

    /**
     * Parse a JSON object supplied on the command line.
     *
     * @throws ValidationException if the value is not a JSON object
     */
    protected Map<String, Object> parseJsonObject(String field, String json) {
        try {
            Map<String, Object> value = objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
            if (value == null) {
                throw ValidationException.invalidField(field, field + " must be a JSON object");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw ValidationException.invalidField(field, field + " must be a JSON object: " + e.getOriginalMessage());
        }
    }

    protected static Map<String, Object> result(boolean changed, String message) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("changed", changed);
        result.put("message", message);
        return result;
    }

    private void print(Map<String, Object> result) {
        try {
            spec.commandLine().getOut().println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            spec.commandLine().getOut().flush();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render result", e);
        }
    }
}
