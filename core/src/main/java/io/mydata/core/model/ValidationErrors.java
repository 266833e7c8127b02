package io.mydata.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered, immutable set of validation failures for one resource instance. Built fresh on every
 * validity check through {@link Builder}.
 */
public final class ValidationErrors {

    private static final ValidationErrors EMPTY = new ValidationErrors(List.of());

    private final List<ValidationError> errors;

    private ValidationErrors(List<ValidationError> errors) {
        this.errors = errors;
    }

    /** Returns an error set with no entries. */
    public static ValidationErrors empty() {
        return EMPTY;
    }

    /** Returns a fresh builder. */
    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }

    /** All entries in the order they were added. */
    public List<ValidationError> all() {
        return errors;
    }

    /** Entries keyed by the given attribute. */
    public List<ValidationError> details(String attribute) {
        return errors.stream().filter(e -> e.attribute().equals(attribute)).collect(Collectors.toUnmodifiableList());
    }

    /** Messages (without attribute prefix) keyed by the given attribute; empty if none. */
    public List<String> on(String attribute) {
        return errors.stream()
                .filter(e -> e.attribute().equals(attribute))
                .map(ValidationError::message)
                .collect(Collectors.toUnmodifiableList());
    }

    /** Returns {@code true} if at least one entry is keyed by the given attribute. */
    public boolean hasErrorsOn(String attribute) {
        return errors.stream().anyMatch(e -> e.attribute().equals(attribute));
    }

    /** Attribute names that carry at least one entry, in first-seen order. */
    public Set<String> attributes() {
        Set<String> names = new LinkedHashSet<>();
        errors.forEach(e -> names.add(e.attribute()));
        return Collections.unmodifiableSet(names);
    }

    /** Every entry rendered with its humanized attribute prefix. */
    public List<String> fullMessages() {
        return errors.stream().map(ValidationError::fullMessage).collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String toString() {
        return "ValidationErrors" + fullMessages();
    }

    /** Accumulates entries during one validity check. */
    public static final class Builder {

        private final List<ValidationError> errors = new ArrayList<>();

        Builder() {}

        /** Adds an entry with the kind's default message. */
        public Builder add(String attribute, ErrorKind kind) {
            return add(attribute, kind, null);
        }

        /** Adds an entry with an explicit message. */
        public Builder add(String attribute, ErrorKind kind, String message) {
            errors.add(new ValidationError(attribute, kind, message));
            return this;
        }

        public boolean isEmpty() {
            return errors.isEmpty();
        }

        public ValidationErrors build() {
            return errors.isEmpty() ? EMPTY : new ValidationErrors(List.copyOf(errors));
        }
    }
}
