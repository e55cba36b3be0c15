package io.netorca.sdk.dto;

import io.netorca.sdk.enums.ChangeState;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fields to write to a change instance.
 *
 * <p>NetOrca expects a full document on update, so {@link #toBody()} wraps
 * these fields in an envelope carrying a fixed description. Descriptions held
 * by the caller are never forwarded.
 *
 * @param state        requested state
 * @param deployedItem payload to attach, or {@code null} to leave it out
 */
public record ChangeInstanceUpdate(
    ChangeState state,
    Object deployedItem
) {

    public static final Map<String, Object> PLACEHOLDER_DESCRIPTION = Map.of("test", "test");

    public ChangeInstanceUpdate {
        Objects.requireNonNull(state, "state");
    }

    public static ChangeInstanceUpdate toState(ChangeState state) {
        return new ChangeInstanceUpdate(state, null);
    }

    public static ChangeInstanceUpdate completed(Object deployedItem) {
        return new ChangeInstanceUpdate(ChangeState.COMPLETED, deployedItem);
    }

    public Map<String, Object> toBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("description", PLACEHOLDER_DESCRIPTION);
        body.put("state", state.name());
        if (deployedItem != null) {
            body.put("deployed_item", deployedItem);
        }
        return body;
    }
}
