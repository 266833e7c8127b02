package io.mydata.core.error;

/** Thrown when a {@code resource} attribute names a kind that is not registered. */
public final class UnresolvedResourceException extends ResourceDeclarationException {

    private static final long serialVersionUID = 1L;

    public UnresolvedResourceException(String message, String kind, String attribute) {
        super(message, kind, attribute);
    }
}
