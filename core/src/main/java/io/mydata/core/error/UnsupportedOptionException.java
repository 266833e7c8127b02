package io.mydata.core.error;

/** Thrown when an attribute declaration carries option keys outside the supported set. */
public final class UnsupportedOptionException extends ResourceDeclarationException {

    private static final long serialVersionUID = 1L;

    public UnsupportedOptionException(String message, String kind, String attribute) {
        super(message, kind, attribute);
    }
}
