package io.netorca.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netorca.sdk.client.NetOrcaClient;
import io.netorca.sdk.dto.ServiceItem;
import io.netorca.sdk.exception.ValidationException;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Map;

@Command(name = "get-service-items", mixinStandardHelpOptions = true,
    description = "Get the service items of a service, i.e. everything that should be deployed")
public class GetServiceItemsCommand extends AbstractNetOrcaCommand {

    @Option(names = "--service-name", description = "Name of the service")
    String serviceName;

    @Inject
    public GetServiceItemsCommand(NetOrcaClientFactory clients, ObjectMapper objectMapper) {
        super(clients, objectMapper);
    }

    @Override
    protected void validate() {
        if (serviceName == null || serviceName.isBlank()) {
            throw ValidationException.invalidField("service_name", "Missing service_name");
        }
    }

    @Override
    protected Map<String, Object> execute(NetOrcaClient client, String token) {
        var items = client.serviceItems().list(token, serviceName).items();

        var result = result(false, "Found " + items.size() + " service instances");
        result.put("service_items", items.stream().map(ServiceItem::document).toList());
        return result;
    }
}
