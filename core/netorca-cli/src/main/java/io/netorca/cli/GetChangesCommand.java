package io.netorca.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netorca.sdk.client.NetOrcaClient;
import io.netorca.sdk.dto.ChangeInstance;
import io.netorca.sdk.enums.ChangeState;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Map;
import java.util.Optional;

@Command(name = "get-changes", mixinStandardHelpOptions = true,
    description = "Get the change instances of the team, in one state")
public class GetChangesCommand extends AbstractNetOrcaCommand {

    private static final Logger LOG = Logger.getLogger(GetChangesCommand.class);

    @Option(names = {"-s", "--state"}, defaultValue = "APPROVED",
        description = "One of PENDING, APPROVED, REJECTED, COMPLETED, ERROR (default: APPROVED)")
    String state;

    @Option(names = "--service-name",
        description = "Only return change instances of this service")
    String serviceName;

    private ChangeState parsedState;

    @Inject
    public GetChangesCommand(NetOrcaClientFactory clients, ObjectMapper objectMapper) {
        super(clients, objectMapper);
    }

    @Override
    protected void validate() {
        parsedState = ChangeState.parse(state);
    }

    @Override
    protected Map<String, Object> execute(NetOrcaClient client, String token) {
        var changes = client.changeInstances()
            .list(token, Optional.of(parsedState), Optional.ofNullable(serviceName))
            .items();
        LOG.debugf("Found %d %s change instance(s)", changes.size(), parsedState);

        var result = result(false, "Found " + changes.size() + " change items");
        result.put("change_instances", changes.stream().map(ChangeInstance::document).toList());
        return result;
    }
}
