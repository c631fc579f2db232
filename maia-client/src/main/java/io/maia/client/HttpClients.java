package io.maia.client;

import io.maia.common.config.MaiaConfig;
import io.maia.common.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;

/**
 * Builds the single {@link HttpClient} shared by the identity provider and the backend client.
 */
public final class HttpClients {

    private static final Logger log = LoggerFactory.getLogger(HttpClients.class);
    private static final String DISABLE_HOSTNAME_VERIFICATION = "jdk.internal.httpclient.disableHostnameVerification";

    private HttpClients() {
    }

    public static HttpClient create(MaiaConfig config) throws ConfigurationException {
        var builder = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()));

        var proxy = config.getProxy();
        if (!proxy.isBlank()) {
            builder.proxy(proxySelector(proxy));
        }

        if (config.isInsecure()) {
            // meant for debugging through intercepting proxies only
            log.warn("TLS certificate verification is disabled");
            System.setProperty(DISABLE_HOSTNAME_VERIFICATION, "true");
            builder.sslContext(trustAllContext());
        }
        return builder.build();
    }

    static ProxySelector proxySelector(String proxy) throws ConfigurationException {
        try {
            var uri = URI.create(proxy);
            if (uri.getHost() == null) {
                throw new ConfigurationException("could not set proxy: " + proxy);
            }
            int port = uri.getPort() > 0 ? uri.getPort() : ("https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80);
            return ProxySelector.of(new InetSocketAddress(uri.getHost(), port));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("could not set proxy: " + proxy, e);
        }
    }

    private static SSLContext trustAllContext() throws ConfigurationException {
        var trustAll = new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        };
        try {
            var context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[]{trustAll}, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new ConfigurationException("could not disable TLS verification: " + e.getMessage(), e);
        }
    }
}
