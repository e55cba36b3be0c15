package io.netorca.sdk.support;

import io.netorca.sdk.exception.ValidationException;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Validation of NetOrca base URLs supplied by callers.
 */
public final class BaseUrls {

    private BaseUrls() {
    }

    /**
     * Parse a base URL, accepting only absolute http(s) URLs with a host.
     *
     * @throws ValidationException if the URL is missing or malformed
     */
    public static URI parse(String url) {
        if (url == null || url.isBlank()) {
            throw ValidationException.invalidField("url", "url is required");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw ValidationException.invalidField("url", url + " is not a valid url");
        }
        String scheme = uri.getScheme();
        if (scheme == null
            || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
            || uri.getHost() == null) {
            throw ValidationException.invalidField("url", url + " is not a valid url");
        }
        return uri;
    }
}
