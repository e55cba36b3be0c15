package io.netorca.sdk.client.resources;

import io.netorca.sdk.client.NetOrcaClient;
import io.netorca.sdk.dto.ChangeInstance;
import io.netorca.sdk.dto.ChangeInstanceUpdate;
import io.netorca.sdk.exception.NetOrcaException;
import io.netorca.sdk.exception.ValidationException;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Writes state transitions to single change instances.
 *
 * <p>Updates replace the whole document and carry no version check, so the
 * last writer wins.
 */
public class ChangeInstanceUpdater {

    private static final Logger LOG = Logger.getLogger(ChangeInstanceUpdater.class);

    private final NetOrcaClient client;

    public ChangeInstanceUpdater(NetOrcaClient client) {
        this.client = client;
    }

    /**
     * Update a change instance.
     *
     * @return the instance as NetOrca returned it; {@link ChangeInstance#document()} is the verbatim response
     */
    public ChangeInstance update(String token, String uuid, ChangeInstanceUpdate update) {
        if (uuid == null || uuid.isBlank()) {
            throw ValidationException.invalidField("uuid", "Missing uuid");
        }

        LOG.debugf("Updating change instance %s to %s", uuid, update.state());
        Map<String, Object> response = client.requestObject(
            "PUT",
            ChangeInstanceRepository.PATH + uuid + "/",
            token,
            update.toBody()
        );

        if (response == null) {
            throw new NetOrcaException("Empty response updating change instance " + uuid);
        }
        return ChangeInstanceRepository.toChangeInstance(client.getObjectMapper(), response);
    }
}
