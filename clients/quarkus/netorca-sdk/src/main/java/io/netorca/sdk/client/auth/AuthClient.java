package io.netorca.sdk.client.auth;

import io.netorca.sdk.client.NetOrcaClient;
import io.netorca.sdk.exception.AuthenticationException;
import io.netorca.sdk.exception.ServerException;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Exchanges credentials for a NetOrca token.
 *
 * <p>Tokens are never cached; every call to {@link #login} is a round trip.
 */
public class AuthClient {

    private static final Logger LOG = Logger.getLogger(AuthClient.class);

    static final String PATH_LOGIN = "/api-token-auth/";

    private final NetOrcaClient client;

    public AuthClient(NetOrcaClient client) {
        this.client = client;
    }

    /**
     * Log in with a username and password.
     *
     * @return the token issued by NetOrca
     * @throws AuthenticationException if the login is rejected or no token is returned
     */
    public String login(String username, String password) {
        LOG.debugf("Logging in to %s as %s", client.getBaseUrl(), username);

        Map<String, Object> response;
        try {
            response = client.requestObject("POST", PATH_LOGIN, null,
                Map.of("username", username, "password", password));
        } catch (ServerException | AuthenticationException e) {
            throw AuthenticationException.loginRejected(e);
        }

        Object token = response != null ? response.get("token") : null;
        if (!(token instanceof String value) || value.isBlank()) {
            throw AuthenticationException.missingToken();
        }
        return value;
    }

    /**
     * Turn a credential into a token. An API key is used as is, without any
     * request; a username and password are exchanged through {@link #login}.
     */
    public String resolveToken(Credential credential) {
        if (credential instanceof Credential.ApiKey apiKey) {
            LOG.debug("API key provided, skipping login");
            return apiKey.key();
        }
        if (credential instanceof Credential.UserPass userPass) {
            LOG.debug("No API key provided, logging in");
            return login(userPass.username(), userPass.password());
        }
        throw new IllegalArgumentException("Unsupported credential: " + credential);
    }
}
