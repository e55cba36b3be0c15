package io.netorca.sdk.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of a change instance as last reported by NetOrca.
 *
 * <p>The snapshot may be stale; {@link #state()} is only meaningful as the
 * server reported it.
 *
 * @param uuid         immutable identifier
 * @param state        lifecycle state name as reported by the server
 * @param serviceItem  the embedded service item, or {@code null} if absent
 * @param deployedItem opaque payload attached on completion, or {@code null}
 * @param description  opaque metadata
 * @param document     the JSON document as returned by NetOrca
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChangeInstance(
    String uuid,
    String state,
    @JsonProperty("service_item") ServiceItem serviceItem,
    @JsonProperty("deployed_item") Object deployedItem,
    Map<String, Object> description,
    Map<String, Object> document
) {

    public ChangeInstance {
        description = description != null ? description : Map.of();
        document = document != null ? document : Map.of();
    }

    /**
     * Attach the document this instance was bound from.
     */
    public ChangeInstance withDocument(Map<String, Object> document) {
        return new ChangeInstance(uuid, state, serviceItem, deployedItem, description,
            Collections.unmodifiableMap(new LinkedHashMap<>(document)));
    }

    /**
     * Name of the service that owns the embedded service item.
     */
    public Optional<String> serviceName() {
        return Optional.ofNullable(serviceItem).flatMap(ServiceItem::serviceName);
    }
}
