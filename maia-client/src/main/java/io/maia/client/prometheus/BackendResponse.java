package io.maia.client.prometheus;

import io.maia.common.Headers;
import io.maia.common.error.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

/**
 * An open backend response. The body is read at most once and cached; {@link #close()} releases
 * the underlying stream whether or not the body was consumed.
 */
public final class BackendResponse implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BackendResponse.class);

    private final int statusCode;
    private final String contentType;
    private final InputStream body;
    private byte[] content;

    BackendResponse(HttpResponse<InputStream> response) {
        this(response.statusCode(),
                response.headers().firstValue(Headers.HEADER_CONTENT_TYPE).orElse(""),
                response.body());
    }

    public BackendResponse(int statusCode, String contentType, InputStream body) {
        this.statusCode = statusCode;
        this.contentType = contentType == null ? "" : contentType;
        this.body = body == null ? new ByteArrayInputStream(new byte[0]) : body;
    }

    public int statusCode() {
        return statusCode;
    }

    public String contentType() {
        return contentType;
    }

    /**
     * Reads the whole body on first use.
     */
    public byte[] readBody() throws IOException {
        if (content == null) {
            content = body.readAllBytes();
        }
        return content;
    }

    /**
     * Like {@link #readBody()}, reporting a read failure as {@link TransportException}.
     */
    public byte[] content() throws TransportException {
        try {
            return readBody();
        } catch (IOException e) {
            throw new TransportException("failed to read response body: " + e.getMessage(), e);
        }
    }

    public String contentAsString() throws TransportException {
        return new String(content(), StandardCharsets.UTF_8);
    }

    @Override
    public void close() {
        try {
            body.close();
        } catch (IOException e) {
            logger.warn("Failed to close backend response: {}", e.getMessage());
        }
    }
}
