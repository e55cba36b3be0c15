package io.netorca.cli.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.net.http.HttpClient;

/**
 * Configuration for the NetOrca command line tools.
 *
 * <p>Configure in application.properties:
 * <pre>
 * netorca.http.connect-timeout=10
 * netorca.http.follow-redirects=NORMAL
 * </pre>
 */
@ConfigMapping(prefix = "netorca")
public interface NetOrcaConfig {

    /**
     * HTTP client configuration.
     */
    HttpConfig http();

    interface HttpConfig {
        /**
         * Connect timeout in seconds.
         */
        @WithName("connect-timeout")
        @WithDefault("10")
        int connectTimeout();

        /**
         * Redirect policy of the HTTP client.
         */
        @WithName("follow-redirects")
        @WithDefault("NORMAL")
        HttpClient.Redirect followRedirects();
    }
}
