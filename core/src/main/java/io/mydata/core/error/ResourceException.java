package io.mydata.core.error;

/**
 * Abstract base for all my-data exceptions. Never thrown directly; use the concrete subclasses
 * under {@link ResourceDeclarationException}, or {@link TypeCastException} and {@link
 * MarkupRenderException}.
 *
 * <p>Validation failures are not exceptions: they are reported as data through {@code
 * ValidationResult}.
 */
public abstract class ResourceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        DECLARATION,
        ASSIGNMENT,
        RENDERING
    }

    private final String kind;
    private final Phase phase;

    protected ResourceException(String message, String kind, Phase phase) {
        super(message);
        this.kind = kind;
        this.phase = phase;
    }

    protected ResourceException(String message, Throwable cause, String kind, Phase phase) {
        super(message, cause);
        this.kind = kind;
        this.phase = phase;
    }

    /** The resource kind that triggered the error, or {@code null} if not yet identified. */
    public String kind() {
        return kind;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
