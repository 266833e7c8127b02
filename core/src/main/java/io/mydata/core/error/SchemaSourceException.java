package io.mydata.core.error;

/**
 * Thrown when an external schema description cannot be read, has invalid structure, or does not
 * describe the requested kind. Carries the {@code source} (file or resource) that was consulted.
 */
public final class SchemaSourceException extends ResourceDeclarationException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public SchemaSourceException(String message, String kind, String source) {
        super(message, kind, null);
        this.source = source;
    }

    public SchemaSourceException(String message, Throwable cause, String kind, String source) {
        super(message, cause, kind, null);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
