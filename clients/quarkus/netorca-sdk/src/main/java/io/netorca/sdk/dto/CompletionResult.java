package io.netorca.sdk.dto;

import java.util.List;

/**
 * Outcome of completing the approved changes of a service.
 *
 * @param count          number of change instances completed (or that would be, for a preview)
 * @param message        human readable summary
 * @param successful     true once every update went through
 * @param completedUuids identifiers in the order they were processed
 */
public record CompletionResult(
    int count,
    String message,
    boolean successful,
    List<String> completedUuids
) {

    public static CompletionResult completed(List<String> completedUuids) {
        return new CompletionResult(
            completedUuids.size(),
            "Completed " + completedUuids.size() + " changes",
            true,
            List.copyOf(completedUuids)
        );
    }

    public static CompletionResult preview(List<String> uuids) {
        return new CompletionResult(
            uuids.size(),
            "Would complete " + uuids.size() + " changes",
            true,
            List.copyOf(uuids)
        );
    }
}
