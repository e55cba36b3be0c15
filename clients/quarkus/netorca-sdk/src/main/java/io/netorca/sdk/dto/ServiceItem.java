package io.netorca.sdk.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * An item belonging to a named service.
 *
 * @param uuid     identifier, may be absent when embedded in a change instance
 * @param name     item name
 * @param service  the owning service, or {@code null} if absent
 * @param document the JSON document as returned by NetOrca; empty when embedded
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServiceItem(
    String uuid,
    String name,
    Service service,
    Map<String, Object> document
) {

    public ServiceItem {
        document = document != null ? document : Map.of();
    }

    public ServiceItem withDocument(Map<String, Object> document) {
        return new ServiceItem(uuid, name, service,
            Collections.unmodifiableMap(new LinkedHashMap<>(document)));
    }

    public Optional<String> serviceName() {
        return Optional.ofNullable(service).map(Service::name);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Service(String name) {
    }
}
