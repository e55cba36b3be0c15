package io.netorca.sdk.exception;

import java.util.List;

/**
 * Exception thrown when a batch completion stops at a failing update.
 *
 * <p>Instances completed before the failure stay completed. The original
 * failure is available as the cause.
 */
public class CompletionAbortedException extends NetOrcaException {

    private final String serviceName;
    private final String failedUuid;
    private final List<String> completedUuids;

    public CompletionAbortedException(String serviceName, String failedUuid,
                                      List<String> completedUuids, NetOrcaException cause) {
        super(
            "Completing changes for " + serviceName + " aborted at " + failedUuid
                + " after " + completedUuids.size() + " completed: " + cause.getMessage(),
            cause.getStatusCode(),
            cause,
            cause.getContext()
        );
        this.serviceName = serviceName;
        this.failedUuid = failedUuid;
        this.completedUuids = List.copyOf(completedUuids);
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getFailedUuid() {
        return failedUuid;
    }

    public List<String> getCompletedUuids() {
        return completedUuids;
    }

    public int getCompletedCount() {
        return completedUuids.size();
    }
}
