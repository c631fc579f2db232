package io.maia.common;

import java.util.Locale;

public class Headers {

    public static final String HEADER_ACCEPT = "Accept";
    public static final String HEADER_CONTENT_TYPE = "Content-Type";
    public static final String HEADER_AUTH_TOKEN = "X-Auth-Token";
    public static final String HEADER_SUBJECT_TOKEN = "X-Subject-Token";
    public static final String HEADER_GLOBAL_REGION = "X-Global-Region";

    public static final String JSON = "application/json";
    public static final String PLAIN_TEXT = "text/plain";

    private Headers() {
    }

    /**
     * Strips parameters such as {@code charset} and lower-cases the media type.
     * Returns an empty string for {@code null}.
     */
    public static String mediaType(String contentType) {
        if (contentType == null) {
            return "";
        }
        int semicolon = contentType.indexOf(';');
        var type = semicolon < 0 ? contentType : contentType.substring(0, semicolon);
        return type.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isJson(String contentType) {
        return JSON.equals(mediaType(contentType));
    }

    public static boolean isPlainText(String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith(PLAIN_TEXT);
    }
}
