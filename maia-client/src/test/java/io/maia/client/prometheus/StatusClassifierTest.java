package io.maia.client.prometheus;

import io.maia.common.error.BackendException;
import io.maia.common.error.BackendUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class StatusClassifierTest {

    private static BackendResponse response(int status, String body) {
        return new BackendResponse(status, "text/plain",
                new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("Should pass HTTP 200")
    void ok() {
        assertDoesNotThrow(() -> StatusClassifier.check(response(200, "{}"), true));
    }

    @ParameterizedTest(name = "global={0}, body=''{1}''")
    @CsvSource(value = {
            "true|global keystone not configured|global keystone backend unavailable: global keystone not configured",
            "false|service unavailable|server failed with status: 503 Service Unavailable (503)",
            "true||global keystone backend unavailable (HTTP 503)",
            "false||service unavailable (HTTP 503)"
    }, delimiter = '|')
    @DisplayName("Should only echo a 503 body for the global backend")
    void serviceUnavailable(boolean global, String body, String expected) {
        var e = assertThrows(BackendUnavailableException.class,
                () -> StatusClassifier.check(response(503, body == null ? "" : body), global));
        assertEquals(expected, e.getMessage());
        assertEquals(global, e.isGlobal());
        assertEquals(503, e.getStatusCode());
    }

    @Test
    @DisplayName("Should report a failed 503 body read with the global context")
    void unreadableBody() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("connection reset");
            }
        };
        var e = assertThrows(BackendUnavailableException.class,
                () -> StatusClassifier.check(new BackendResponse(503, "", broken), true));
        assertEquals("global keystone backend unavailable (HTTP 503) - failed to read response body: connection reset",
                e.getMessage());

        var local = assertThrows(BackendUnavailableException.class,
                () -> StatusClassifier.check(new BackendResponse(503, "", broken), false));
        assertTrue(local.getMessage().startsWith("service unavailable (HTTP 503) - failed to read response body"));
    }

    @Test
    @DisplayName("Should use the generic message for other statuses")
    void otherStatus() {
        var e = assertThrows(BackendException.class, () -> StatusClassifier.check(response(500, "internal error"), true));
        assertFalse(e instanceof BackendUnavailableException);
        assertEquals("server failed with status: 500 Internal Server Error (500)", e.getMessage());

        e = assertThrows(BackendException.class, () -> StatusClassifier.check(response(418, ""), false));
        assertEquals("server failed with status: 418 I'm a teapot (418)", e.getMessage());

        e = assertThrows(BackendException.class, () -> StatusClassifier.check(response(599, ""), false));
        assertEquals("server failed with status: 599 (599)", e.getMessage());
    }
}
