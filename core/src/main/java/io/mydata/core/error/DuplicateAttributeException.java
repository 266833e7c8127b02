package io.mydata.core.error;

/** Thrown when the same attribute name is declared twice on one kind. */
public final class DuplicateAttributeException extends ResourceDeclarationException {

    private static final long serialVersionUID = 1L;

    public DuplicateAttributeException(String message, String kind, String attribute) {
        super(message, kind, attribute);
    }
}
