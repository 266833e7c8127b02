package io.mydata.core.error;

/** Thrown when an attribute is declared with a type the configured {@code TypeCaster} does not know. */
public final class UnknownAttributeTypeException extends ResourceDeclarationException {

    private static final long serialVersionUID = 1L;

    public UnknownAttributeTypeException(String message, String kind, String attribute) {
        super(message, kind, attribute);
    }
}
