package io.mydata.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A single validation failure attributed to an attribute.
 *
 * @param attribute the attribute the failure is keyed by
 * @param kind      symbolic error kind
 * @param message   human-readable detail, without the attribute name
 */
public record ValidationError(String attribute, ErrorKind kind, String message) {

    public ValidationError {
        Objects.requireNonNull(attribute, "attribute must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (message == null || message.isEmpty()) {
            message = kind.defaultMessage();
        }
    }

    /** The message prefixed with the humanized attribute name, e.g. {@code "Line item can't be blank"}. */
    public String fullMessage() {
        return humanize(attribute) + " " + message;
    }

    static String humanize(String attribute) {
        String text = attribute.replace('_', ' ').trim();
        if (text.isEmpty()) {
            return text;
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1).toLowerCase(Locale.ROOT);
    }
}
