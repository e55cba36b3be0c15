package io.netorca.cli;

import io.netorca.sdk.client.auth.Credential;
import io.netorca.sdk.support.BaseUrls;
import picocli.CommandLine.Option;

import java.net.URI;

/**
 * Options locating a NetOrca instance and the credentials to use against it.
 */
public class ConnectionOptions {

    @Option(names = {"-u", "--url"}, defaultValue = "${env:NETORCA_URL}",
        description = "Base URL for NetOrca (env: NETORCA_URL)")
    String url;

    @Option(names = {"-k", "--api-key"}, defaultValue = "${env:NETORCA_API_KEY}",
        description = "API key generated for the team. If not given, username and password are required (env: NETORCA_API_KEY)")
    String apiKey;

    @Option(names = "--username", defaultValue = "${env:NETORCA_USERNAME}",
        description = "Username of an account in the team (env: NETORCA_USERNAME)")
    String username;

    @Option(names = "--password", defaultValue = "${env:NETORCA_PASSWORD}",
        description = "Password of an account in the team (env: NETORCA_PASSWORD)")
    String password;

    URI baseUrl() {
        return BaseUrls.parse(url);
    }

    Credential credential() {
        return Credential.of(apiKey, username, password);
    }
}
