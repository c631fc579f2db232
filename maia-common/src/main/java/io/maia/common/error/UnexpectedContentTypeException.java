package io.maia.common.error;

public class UnexpectedContentTypeException extends MaiaException {

    private final String contentType;

    public UnexpectedContentTypeException(String contentType) {
        super("unsupported response type from server: " + contentType);
        this.contentType = contentType;
    }

    public String getContentType() {
        return contentType;
    }
}
