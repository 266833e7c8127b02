package io.mydata.core.error;

/**
 * Thrown when a raw value cannot be coerced to an attribute's declared type. Propagates out of the
 * setter or constructor that triggered it; attributes assigned before the failing one keep their
 * new values.
 */
public final class TypeCastException extends ResourceException {

    private static final long serialVersionUID = 1L;

    private final String type;
    private final String attribute;
    private final String reason;

    public TypeCastException(String message, String type) {
        this(message, null, type);
    }

    public TypeCastException(String message, Throwable cause, String type) {
        super(message, cause, null, Phase.ASSIGNMENT);
        this.type = type;
        this.attribute = null;
        this.reason = message;
    }

    private TypeCastException(String kind, String attribute, TypeCastException origin) {
        super(
                "Cannot assign '" + attribute + "' on " + kind + ": " + origin.reason,
                origin.getCause() != null ? origin.getCause() : origin,
                kind,
                Phase.ASSIGNMENT);
        this.type = origin.type;
        this.attribute = attribute;
        this.reason = origin.reason;
    }

    /** The declared type tag the value was being cast to. */
    public String type() {
        return type;
    }

    /**
     * The attribute path being assigned, dot-separated through nested resources (e.g. {@code
     * items.qty}), or {@code null} if the caster was called directly.
     */
    public String attribute() {
        return attribute;
    }

    /** The caster's own description of the failure, without attribution. */
    public String reason() {
        return reason;
    }

    /**
     * Returns a copy of this exception attributed to the given kind and attribute. When this
     * exception is already attributed to a nested attribute, the paths are joined so the outermost
     * kind names the full route to the failing value.
     */
    public TypeCastException forAttribute(String kind, String attribute) {
        String path = this.attribute == null ? attribute : attribute + "." + this.attribute;
        return new TypeCastException(kind, path, this);
    }
}
