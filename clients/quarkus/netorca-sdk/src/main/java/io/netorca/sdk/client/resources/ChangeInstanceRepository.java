package io.netorca.sdk.client.resources;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netorca.sdk.client.NetOrcaClient;
import io.netorca.sdk.dto.ChangeInstance;
import io.netorca.sdk.dto.ListResult;
import io.netorca.sdk.enums.ChangeState;
import io.netorca.sdk.exception.NetOrcaException;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resource for reading change instances.
 */
public class ChangeInstanceRepository {

    static final String PATH = "/orcabase/change_instances/";

    private final NetOrcaClient client;

    public ChangeInstanceRepository(NetOrcaClient client) {
        this.client = client;
    }

    /**
     * List all change instances visible to the token.
     */
    public ListResult<ChangeInstance> list(String token) {
        return list(token, Optional.empty(), Optional.empty());
    }

    /**
     * List change instances.
     *
     * <p>The state filter is applied by NetOrca. The service name filter is
     * applied here, after every page has been read, so no matching entry is
     * lost to pagination.
     *
     * @param state       only instances in this state
     * @param serviceName only instances whose service item belongs to this service
     */
    public ListResult<ChangeInstance> list(String token, Optional<ChangeState> state, Optional<String> serviceName) {
        Map<String, String> filters = new LinkedHashMap<>();
        state.ifPresent(s -> filters.put("state", s.name()));

        String query = filters.isEmpty() ? "" : "?" + buildQuery(filters);
        var result = client.list(PATH + query, token, this::mapChangeInstance);

        if (serviceName.isPresent() && !serviceName.get().isEmpty()) {
            return ListResult.of(filterByService(result.items(), serviceName.get()));
        }
        return result;
    }

    /**
     * Keep the change instances whose service item belongs to {@code serviceName},
     * in their original order. Instances without a service item never match.
     */
    public static List<ChangeInstance> filterByService(List<ChangeInstance> changes, String serviceName) {
        return changes.stream()
            .filter(change -> change.serviceName().filter(serviceName::equals).isPresent())
            .toList();
    }

    private ChangeInstance mapChangeInstance(Map<String, Object> data) {
        return toChangeInstance(client.getObjectMapper(), data);
    }

    /**
     * Bind a change instance document, keeping the document itself alongside.
     */
    static ChangeInstance toChangeInstance(ObjectMapper objectMapper, Map<String, Object> data) {
        try {
            return objectMapper.convertValue(data, ChangeInstance.class).withDocument(data);
        } catch (IllegalArgumentException e) {
            throw new NetOrcaException("Malformed change instance: " + e.getMessage(), e);
        }
    }

    private String buildQuery(Map<String, String> params) {
        return params.entrySet().stream()
            .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .reduce((a, b) -> a + "&" + b)
            .orElse("");
    }
}
