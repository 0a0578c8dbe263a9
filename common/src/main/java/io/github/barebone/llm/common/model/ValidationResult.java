package io.github.barebone.llm.common.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of validating a backend configuration.
 * Errors make the configuration unusable; warnings are advisory.
 */
public final class ValidationResult {

    private final List<FieldError> errors;
    private final List<String> warnings;

    private ValidationResult(List<FieldError> errors, List<String> warnings) {
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<FieldError> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * Returns true if any error concerns the given field.
     */
    public boolean hasErrorFor(String field) {
        return errors.stream().anyMatch(e -> e.getField().equals(field));
    }

    public static ValidationResult valid() {
        return new ValidationResult(Collections.emptyList(), Collections.emptyList());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult{valid}" : "ValidationResult{errors=" + errors + '}';
    }

    public static class Builder {
        private final List<FieldError> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        public Builder addError(String field, String message) {
            errors.add(new FieldError(field, message));
            return this;
        }

        public Builder addWarning(String field, String message) {
            warnings.add(field + ": " + message);
            return this;
        }

        public ValidationResult build() {
            return new ValidationResult(errors, warnings);
        }
    }

    /**
     * A single validation error bound to a configuration field.
     */
    public static class FieldError {
        private final String field;
        private final String message;

        public FieldError(String field, String message) {
            this.field = field;
            this.message = message;
        }

        public String getField() {
            return field;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return field + ": " + message;
        }
    }
}
