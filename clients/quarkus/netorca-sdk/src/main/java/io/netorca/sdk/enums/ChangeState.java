package io.netorca.sdk.enums;

import io.netorca.sdk.exception.ValidationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Lifecycle state of a change instance.
 *
 * <p>Transition legality is enforced by NetOrca; the client only requests
 * transitions.
 */
public enum ChangeState {
    /** Submitted by a consumer, awaiting review */
    PENDING,

    /** Approved by the service owner, ready to deploy */
    APPROVED,

    /** Declined by the service owner */
    REJECTED,

    /** Deployed to the infrastructure */
    COMPLETED,

    /** Deployment failed */
    ERROR;

    /**
     * Parse a state name as sent by NetOrca. Names are case-sensitive.
     *
     * @throws ValidationException if the name is not a known state
     */
    public static ChangeState parse(String name) {
        for (ChangeState state : values()) {
            if (state.name().equals(name)) {
                return state;
            }
        }
        throw ValidationException.invalidField("state", name + " is not one of " + validNames());
    }

    public static String validNames() {
        return Arrays.stream(values())
            .map(Enum::name)
            .collect(Collectors.joining(", ", "[", "]"));
    }
}
