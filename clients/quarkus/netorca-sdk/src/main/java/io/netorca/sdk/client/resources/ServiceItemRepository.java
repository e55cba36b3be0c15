package io.netorca.sdk.client.resources;

import io.netorca.sdk.client.NetOrcaClient;
import io.netorca.sdk.dto.ListResult;
import io.netorca.sdk.dto.ServiceItem;
import io.netorca.sdk.exception.NetOrcaException;
import io.netorca.sdk.exception.ValidationException;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Resource for reading service items.
 */
public class ServiceItemRepository {

    static final String PATH = "/orcabase/service_items/";

    private final NetOrcaClient client;

    public ServiceItemRepository(NetOrcaClient client) {
        this.client = client;
    }

    /**
     * List the service items of a service. Filtering is done by NetOrca.
     */
    public ListResult<ServiceItem> list(String token, String serviceName) {
        if (serviceName == null || serviceName.isBlank()) {
            throw ValidationException.invalidField("service_name", "Missing service_name");
        }
        String query = "?service_name=" + URLEncoder.encode(serviceName, StandardCharsets.UTF_8);
        return client.list(PATH + query, token, this::mapServiceItem);
    }

    private ServiceItem mapServiceItem(Map<String, Object> data) {
        try {
            return client.getObjectMapper().convertValue(data, ServiceItem.class).withDocument(data);
        } catch (IllegalArgumentException e) {
            throw new NetOrcaException("Malformed service item: " + e.getMessage(), e);
        }
    }
}
