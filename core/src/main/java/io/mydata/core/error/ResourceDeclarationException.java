package io.mydata.core.error;

/**
 * Abstract parent for declaration-time errors. Thrown while a resource kind is being declared,
 * before any instance of it can exist. Carries the offending attribute name, when there is one.
 */
public abstract class ResourceDeclarationException extends ResourceException {

    private static final long serialVersionUID = 1L;

    private final String attribute;

    protected ResourceDeclarationException(String message, String kind, String attribute) {
        super(message, kind, Phase.DECLARATION);
        this.attribute = attribute;
    }

    protected ResourceDeclarationException(String message, Throwable cause, String kind, String attribute) {
        super(message, cause, kind, Phase.DECLARATION);
        this.attribute = attribute;
    }

    /** The attribute being declared, or {@code null} for kind-level errors. */
    public String attribute() {
        return attribute;
    }
}
