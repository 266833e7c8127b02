package io.mydata.core.error;

/** Thrown when a kind name is declared a second time in the same registry. */
public final class DuplicateKindException extends ResourceDeclarationException {

    private static final long serialVersionUID = 1L;

    public DuplicateKindException(String message, String kind) {
        super(message, kind, null);
    }
}
