package io.netorca.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netorca.sdk.client.NetOrcaClient;
import io.netorca.sdk.dto.ChangeInstanceUpdate;
import io.netorca.sdk.enums.ChangeState;
import io.netorca.sdk.exception.ValidationException;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Map;

@Command(name = "update-change", mixinStandardHelpOptions = true,
    description = "Update a single change instance")
public class UpdateChangeCommand extends AbstractNetOrcaCommand {

    private static final Logger LOG = Logger.getLogger(UpdateChangeCommand.class);

    @Option(names = "--uuid", description = "UUID of the change instance to update")
    String uuid;

    @Option(names = {"-s", "--state"}, description = "The state the change should be in")
    String state;

    @Option(names = {"-d", "--deployed-item"},
        description = "JSON object describing what was deployed, e.g. '{\"ip\": \"10.0.0.1\"}'")
    String deployedItem;

    private ChangeInstanceUpdate update;

    @Inject
    public UpdateChangeCommand(NetOrcaClientFactory clients, ObjectMapper objectMapper) {
        super(clients, objectMapper);
    }

    @Override
    protected void validate() {
        if (uuid == null || uuid.isBlank()) {
            throw ValidationException.invalidField("uuid", "Missing uuid");
        }
        if (state == null || state.isBlank()) {
            throw ValidationException.invalidField("state", "Missing state");
        }
        ChangeState parsedState = ChangeState.parse(state);
        Object payload = deployedItem == null || deployedItem.isBlank()
            ? null
            : parseJsonObject("deployed_item", deployedItem);
        update = new ChangeInstanceUpdate(parsedState, payload);
    }

    @Override
    protected Map<String, Object> execute(NetOrcaClient client, String token) {
        var updated = client.changeInstanceUpdater().update(token, uuid, update);
        LOG.infof("Updated change instance %s to %s", uuid, update.state());

        var result = result(true, "Updated " + uuid + " change item");
        result.put("change_instance", updated.document());
        return result;
    }
}
