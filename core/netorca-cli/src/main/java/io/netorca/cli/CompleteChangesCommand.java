package io.netorca.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netorca.sdk.client.NetOrcaClient;
import io.netorca.sdk.dto.CompletionResult;
import io.netorca.sdk.exception.CompletionAbortedException;
import io.netorca.sdk.exception.NetOrcaException;
import io.netorca.sdk.exception.ValidationException;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Map;

@Command(name = "complete-changes", mixinStandardHelpOptions = true,
    description = "Set every APPROVED change instance of a service to COMPLETED")
public class CompleteChangesCommand extends AbstractNetOrcaCommand {

    private static final Logger LOG = Logger.getLogger(CompleteChangesCommand.class);

    @Option(names = "--service-name",
        description = "Service whose approved change instances are completed")
    String serviceName;

    @Option(names = {"-d", "--deployed-item"},
        description = "JSON object attached to every completed change instance")
    String deployedItem;

    @Option(names = "--dry-run", defaultValue = "false",
        description = "List the changes that would be completed without updating them (default: false)")
    boolean dryRun;

    private Map<String, Object> payload;

    @Inject
    public CompleteChangesCommand(NetOrcaClientFactory clients, ObjectMapper objectMapper) {
        super(clients, objectMapper);
    }

    @Override
    protected void validate() {
        if (serviceName == null || serviceName.isBlank()) {
            throw ValidationException.invalidField("service_name", "Missing service_name");
        }
        if (deployedItem == null || deployedItem.isBlank()) {
            throw ValidationException.invalidField("deployed_item", "Missing deployed_item");
        }
        payload = parseJsonObject("deployed_item", deployedItem);
    }

    @Override
    protected Map<String, Object> execute(NetOrcaClient client, String token) {
        var workflow = client.completionWorkflow();

        CompletionResult reply;
        if (dryRun) {
            LOG.info("DRY RUN: no change instance will be updated");
            reply = workflow.preview(token, serviceName);
        } else {
            reply = workflow.completeApproved(token, serviceName, payload);
        }
        LOG.info(reply.message());

        var result = result(!dryRun && reply.count() > 0, reply.message());
        result.put("count", reply.count());
        result.put("successful", reply.successful());
        result.put("change_instances", reply.completedUuids());
        return result;
    }

    @Override
    protected Map<String, Object> failure(NetOrcaException e) {
        var result = super.failure(e);
        if (e instanceof CompletionAbortedException aborted) {
            result.put("changed", aborted.getCompletedCount() > 0);
            result.put("count", aborted.getCompletedCount());
            result.put("change_instances", aborted.getCompletedUuids());
            result.put("failed_uuid", aborted.getFailedUuid());
        }
        return result;
    }
}
