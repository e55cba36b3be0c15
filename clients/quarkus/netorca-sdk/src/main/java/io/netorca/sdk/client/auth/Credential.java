package io.netorca.sdk.client.auth;

import io.netorca.sdk.exception.ValidationException;

/**
 * Credentials accepted by NetOrca: a pre-issued API key, or a username and
 * password to exchange for a token.
 */
public sealed interface Credential permits Credential.ApiKey, Credential.UserPass {

    /**
     * Resolve the credential from optional inputs. A non-blank API key takes
     * precedence; otherwise both username and password are required.
     *
     * @throws ValidationException if neither form is complete
     */
    static Credential of(String apiKey, String username, String password) {
        if (apiKey != null && !apiKey.isBlank()) {
            return new ApiKey(apiKey);
        }
        if (username != null && !username.isBlank() && password != null && !password.isBlank()) {
            return new UserPass(username, password);
        }
        throw ValidationException.invalidField(
            "api_key",
            "If no api_key specified, username and password required"
        );
    }

    record ApiKey(String key) implements Credential {
        @Override
        public String toString() {
            return "ApiKey[****]";
        }
    }

    record UserPass(String username, String password) implements Credential {
        @Override
        public String toString() {
            return "UserPass[username=" + username + "]";
        }
    }
}
