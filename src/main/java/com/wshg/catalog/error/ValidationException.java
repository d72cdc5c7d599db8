package com.wshg.catalog.error;

/**
 * Resource or request failed structural validation. Never persisted.
 */
public class ValidationException extends CatalogException {

    public enum Reason {
        MISSING_FIELD,
        SCHEMA_MISMATCH,
        INVALID_VALUE
    }

    private final Reason reason;
    private final String field;

    public ValidationException(Reason reason, String field, String message) {
        super(ErrorKind.VALIDATION_FAILED, message);
        this.reason = reason;
        this.field = field;
        detail("reason", reason.name());
        detail("field", field);
    }

    public static ValidationException missingField(String field) {
        return new ValidationException(Reason.MISSING_FIELD, field, field + " is required");
    }

    public static ValidationException schemaMismatch(String field, String provider, String type) {
        return new ValidationException(Reason.SCHEMA_MISMATCH, field,
                "data." + field + " is required by schema " + provider + "/" + type);
    }

    public static ValidationException invalidValue(String field, String message) {
        return new ValidationException(Reason.INVALID_VALUE, field, message);
    }

    public Reason getReason() {
        return reason;
    }

    public String getField() {
        return field;
    }
}
