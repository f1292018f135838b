package io.github.azauth;

import java.net.URI;

/**
 * Thrown when an outbound request targets an endpoint that is not on the allowlist,
 * so no bearer token may be attached to it.
 */
public class EndpointNotAllowedException extends AzureAuthException {

    private final URI endpoint;

    public EndpointNotAllowedException(URI endpoint) {
        super("endpoint '" + endpoint.getScheme() + "://" + endpoint.getRawAuthority()
                + "' is not allowed to receive Azure access tokens");
        this.endpoint = endpoint;
    }

    public URI getEndpoint() {
        return endpoint;
    }
}
