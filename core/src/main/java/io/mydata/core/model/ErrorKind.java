package io.mydata.core.model;

/** Symbolic kind of a validation error. */
public enum ErrorKind {
    /** A required attribute is absent, blank, or an empty collection. */
    BLANK("can't be blank"),

    /** A nested resource failed its own validation. */
    INVALID_RESOURCE("is invalid"),

    /** Generic failure reported by a custom rule. */
    INVALID("is invalid");

    private final String defaultMessage;

    ErrorKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    /** Message used when a rule does not provide its own. */
    public String defaultMessage() {
        return defaultMessage;
    }
}
