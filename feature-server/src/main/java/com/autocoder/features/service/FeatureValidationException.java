package com.autocoder.features.service;

import java.util.List;

/**
 * Thrown by the bulk loader when an entry is malformed.
 *
 * Carries the index of the first offending entry and the fields that were
 * missing or invalid. Nothing from the batch is stored when this is thrown.
 */
public class FeatureValidationException extends RuntimeException {

    private final int index;
    private final List<String> invalidFields;

    public FeatureValidationException(int index, List<String> invalidFields) {
        super("Feature at index " + index + " missing or invalid required fields " + invalidFields
                + " (category, name, description, steps)");
        this.index         = index;
        this.invalidFields = List.copyOf(invalidFields);
    }

    public FeatureValidationException(String message) {
        super(message);
        this.index         = -1;
        this.invalidFields = List.of();
    }

    /** Index of the offending entry, or -1 when the batch as a whole is invalid. */
    public int getIndex()                  { return index; }
    public List<String> getInvalidFields() { return invalidFields; }
}
