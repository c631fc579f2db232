package io.maia.client.prometheus;

import io.maia.common.Headers;
import io.maia.common.error.ConfigurationException;
import io.maia.common.error.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Thin client for the Prometheus HTTP API exposed by the Maia backend. Every call is a single
 * request; the caller owns the returned {@link BackendResponse} and must close it.
 */
public class PrometheusClient {

    private static final Logger logger = LoggerFactory.getLogger(PrometheusClient.class);

    public static final String QUERY_PATH = "/api/v1/query";
    public static final String QUERY_RANGE_PATH = "/api/v1/query_range";
    public static final String SERIES_PATH = "/api/v1/series";
    public static final String LABELS_PATH = "/api/v1/labels";
    public static final String FEDERATE_PATH = "/federate";
    public static final String MATCH = "match[]";

    private final HttpClient client;
    private final URI url;
    private final URI federateUrl;
    private final Map<String, String> customHeaders;
    private final Duration requestTimeout;

    /**
     * @param federateUrl where {@code /federate} calls go instead of {@code url}; blank for {@code url}
     * @param requestTimeout zero for no timeout
     */
    public PrometheusClient(HttpClient client, String url, Map<String, String> customHeaders,
                            String federateUrl, Duration requestTimeout) throws ConfigurationException {
        this.client = client;
        this.url = parseUrl(url);
        this.federateUrl = federateUrl == null || federateUrl.isBlank() ? this.url : parseUrl(federateUrl);
        this.customHeaders = new LinkedHashMap<>(customHeaders);
        this.requestTimeout = requestTimeout == null ? Duration.ZERO : requestTimeout;
    }

    public PrometheusClient(HttpClient client, String url, Map<String, String> customHeaders)
            throws ConfigurationException {
        this(client, url, customHeaders, null, Duration.ZERO);
    }

    public URI url() {
        return url;
    }

    public Map<String, String> customHeaders() {
        return Map.copyOf(customHeaders);
    }

    public BackendResponse query(String query, String time, String timeout, String accept)
            throws TransportException {
        var params = new TreeMap<String, Object>();
        params.put("query", query);
        params.put("time", time);
        params.put("timeout", timeout);
        return send("GET", buildUrl(QUERY_PATH, params), null, accept);
    }

    public BackendResponse queryRange(String query, String start, String end, String step, String timeout,
                                      String accept) throws TransportException {
        var params = new TreeMap<String, Object>();
        params.put("query", query);
        params.put("start", start);
        params.put("end", end);
        params.put("step", step);
        params.put("timeout", timeout);
        return send("GET", buildUrl(QUERY_RANGE_PATH, params), null, accept);
    }

    public BackendResponse series(List<String> match, String start, String end, String accept)
            throws TransportException {
        var params = new TreeMap<String, Object>();
        params.put(MATCH, match);
        params.put("start", start);
        params.put("end", end);
        return send("GET", buildUrl(SERIES_PATH, params), null, accept);
    }

    public BackendResponse labelValues(String name, String accept) throws TransportException {
        var path = "/api/v1/label/" + URLEncoder.encode(name, StandardCharsets.UTF_8) + "/values";
        return send("GET", buildUrl(path, Map.of()), null, accept);
    }

    public BackendResponse labels(String start, String end, List<String> match, String accept)
            throws TransportException {
        var params = new TreeMap<String, Object>();
        params.put("start", start);
        params.put("end", end);
        params.put(MATCH, match);
        return send("GET", buildUrl(LABELS_PATH, params), null, accept);
    }

    public BackendResponse federate(List<String> selectors, String accept) throws TransportException {
        return send("GET", buildUrl(FEDERATE_PATH, Map.of(MATCH, selectors)), null, accept);
    }

    /**
     * Forwards an arbitrary request to the backend, keeping only its method, path and body.
     */
    public BackendResponse delegate(String method, URI uri, byte[] body, String accept) throws TransportException {
        return send(method, mapUrl(uri), body, accept);
    }

    /**
     * Appends {@code path} to the base URL ({@link #FEDERATE_PATH} uses the federate URL) and encodes the
     * non-empty parameters in key order. Values are strings or lists of strings.
     */
    URI buildUrl(String path, Map<String, Object> params) {
        var base = FEDERATE_PATH.equals(path) ? federateUrl : url;
        var query = new StringBuilder();
        for (var entry : new TreeMap<>(params).entrySet()) {
            for (String value : values(entry.getValue())) {
                if (query.length() > 0) {
                    query.append('&');
                }
                query.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                        .append('=')
                        .append(URLEncoder.encode(value, StandardCharsets.UTF_8));
            }
        }
        var target = origin(base) + trimTrailingSlash(rawPath(base)) + path;
        return URI.create(query.length() == 0 ? target : target + "?" + query);
    }

    /**
     * Points {@code uri} at the backend: scheme, user info, host and port are replaced, the query is dropped.
     */
    URI mapUrl(URI uri) {
        return URI.create(origin(url) + rawPath(uri));
    }

    private BackendResponse send(String method, URI target, byte[] body, String accept) throws TransportException {
        var publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(body);
        var builder = HttpRequest.newBuilder()
                .uri(target)
                .method(method, publisher);
        customHeaders.forEach(builder::header);
        if (accept != null && !accept.isBlank()) {
            builder.header(Headers.HEADER_ACCEPT, accept);
        }
        if (!requestTimeout.isZero()) {
            builder.timeout(requestTimeout);
        }

        logger.debug("Forwarding request to API: {}", target);
        try {
            HttpResponse<InputStream> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
            return new BackendResponse(response);
        } catch (IOException e) {
            logger.debug("Request to {} failed", target, e);
            throw new TransportException("request to " + target + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("request to " + target + " was interrupted", e);
        }
    }

    static URI parseUrl(String value) throws ConfigurationException {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("invalid URL: " + value);
        }
        try {
            var uri = new URI(value);
            var scheme = uri.getScheme();
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                throw new ConfigurationException("invalid URL: " + value);
            }
            if (uri.getHost() == null || uri.getHost().isEmpty()) {
                throw new ConfigurationException("invalid URL: " + value);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new ConfigurationException("invalid URL: " + value, e);
        }
    }

    private static List<String> values(Object value) {
        var result = new ArrayList<String>();
        if (value instanceof String s) {
            if (!s.isEmpty()) {
                result.add(s);
            }
        } else if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        }
        return result;
    }

    private static String origin(URI uri) {
        var origin = new StringBuilder(uri.getScheme()).append("://");
        if (uri.getRawUserInfo() != null) {
            origin.append(uri.getRawUserInfo()).append('@');
        }
        origin.append(uri.getHost());
        if (uri.getPort() >= 0) {
            origin.append(':').append(uri.getPort());
        }
        return origin.toString();
    }

    private static String rawPath(URI uri) {
        return uri.getRawPath() == null ? "" : uri.getRawPath();
    }

    private static String trimTrailingSlash(String path) {
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
