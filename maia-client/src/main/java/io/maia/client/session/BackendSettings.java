package io.maia.client.session;

import java.time.Duration;

/**
 * Where and how to reach the metrics backend for one invocation.
 *
 * @param prometheusUrl  direct Prometheus URL bypassing authentication, may be empty
 * @param maiaUrl        explicit Maia URL overriding the service catalog, may be empty
 * @param authType       value of {@code --os-auth-type}, may be empty
 * @param global         query the global backend region
 * @param federateUrl    alternative target for {@code /federate}, may be empty
 * @param requestTimeout per request timeout, zero for none
 */
public record BackendSettings(String prometheusUrl, String maiaUrl, String authType, boolean global,
                              String federateUrl, Duration requestTimeout) {

    public BackendSettings {
        prometheusUrl = prometheusUrl == null ? "" : prometheusUrl;
        maiaUrl = maiaUrl == null ? "" : maiaUrl;
        authType = authType == null ? "" : authType;
        federateUrl = federateUrl == null ? "" : federateUrl;
        requestTimeout = requestTimeout == null ? Duration.ZERO : requestTimeout;
    }
}
