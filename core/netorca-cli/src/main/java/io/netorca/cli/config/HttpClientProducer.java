package io.netorca.cli.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Produces the HTTP client shared by every NetOrca call in the process.
 */
@ApplicationScoped
public class HttpClientProducer {

    private static final Logger LOG = Logger.getLogger(HttpClientProducer.class);

    @Produces
    @Singleton
    public HttpClient httpClient(NetOrcaConfig config) {
        LOG.debugf("Creating HTTP client (connect timeout %ds, redirects %s)",
            config.http().connectTimeout(), config.http().followRedirects());
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(config.http().connectTimeout()))
            .followRedirects(config.http().followRedirects())
            .build();
    }
}
