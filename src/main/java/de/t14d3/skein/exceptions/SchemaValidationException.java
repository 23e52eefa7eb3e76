package de.t14d3.skein.exceptions;

import java.util.List;

/**
 * Raised when an object schema does not match its persisted table.
 * Carries every error found, not just the first one.
 */
public class SchemaValidationException extends SkeinException {
    private final String objectType;
    private final List<String> errors;

    public SchemaValidationException(String objectType, List<String> errors) {
        super(buildMessage(objectType, errors));
        this.objectType = objectType;
        this.errors = List.copyOf(errors);
    }

    public String getObjectType() {
        return objectType;
    }

    public List<String> getErrors() {
        return errors;
    }

    private static String buildMessage(String objectType, List<String> errors) {
        StringBuilder sb = new StringBuilder("Migration is required");
        if (objectType != null && !objectType.isEmpty()) {
            sb.append(" for object type '").append(objectType).append('\'');
        }
        sb.append(" due to the following errors:");
        for (String error : errors) {
            sb.append("\n- ").append(error);
        }
        return sb.toString();
    }
}
