package io.netorca.sdk.workflow;

import io.netorca.sdk.client.resources.ChangeInstanceRepository;
import io.netorca.sdk.client.resources.ChangeInstanceUpdater;
import io.netorca.sdk.dto.ChangeInstance;
import io.netorca.sdk.dto.ChangeInstanceUpdate;
import io.netorca.sdk.dto.CompletionResult;
import io.netorca.sdk.enums.ChangeState;
import io.netorca.sdk.exception.CompletionAbortedException;
import io.netorca.sdk.exception.NetOrcaException;
import io.netorca.sdk.exception.ValidationException;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Completes every approved change instance of a service.
 *
 * <p>Updates run one at a time in the order NetOrca listed the instances.
 * The first failing update stops the batch; instances already completed stay
 * completed and are reported through {@link CompletionAbortedException}.
 */
public class CompletionWorkflow {

    private static final Logger LOG = Logger.getLogger(CompletionWorkflow.class);

    private final ChangeInstanceRepository repository;
    private final ChangeInstanceUpdater updater;

    public CompletionWorkflow(ChangeInstanceRepository repository, ChangeInstanceUpdater updater) {
        this.repository = repository;
        this.updater = updater;
    }

    /**
     * Set every approved change instance of {@code serviceName} to COMPLETED,
     * attaching the same {@code deployedItem} to each.
     *
     * @throws CompletionAbortedException if an update fails part way through
     */
    public CompletionResult completeApproved(String token, String serviceName, Object deployedItem) {
        List<ChangeInstance> approved = findApproved(token, serviceName);
        LOG.infof("Completing %d approved change(s) for %s", approved.size(), serviceName);

        List<String> completed = new ArrayList<>();
        for (ChangeInstance change : approved) {
            LOG.debugf("Completing change instance %s", change.uuid());
            try {
                updater.update(token, change.uuid(), ChangeInstanceUpdate.completed(deployedItem));
            } catch (NetOrcaException e) {
                LOG.errorf("Completing %s failed after %d completed: %s",
                    change.uuid(), completed.size(), e.getMessage());
                throw new CompletionAbortedException(serviceName, change.uuid(), completed, e);
            }
            completed.add(change.uuid());
        }

        return CompletionResult.completed(completed);
    }

    /**
     * List the change instances {@link #completeApproved} would complete,
     * without updating anything.
     */
    public CompletionResult preview(String token, String serviceName) {
        List<String> uuids = findApproved(token, serviceName).stream()
            .map(ChangeInstance::uuid)
            .toList();
        return CompletionResult.preview(uuids);
    }

    private List<ChangeInstance> findApproved(String token, String serviceName) {
        if (serviceName == null || serviceName.isBlank()) {
            throw ValidationException.invalidField("service_name", "Missing service_name");
        }
        return repository.list(token, Optional.of(ChangeState.APPROVED), Optional.of(serviceName)).items();
    }
}
