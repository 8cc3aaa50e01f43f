package hbnb.listing.domain;

import hbnb.listing.exception.ValidationException;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Field constraints applied by the entity setters. Every check throws
 * {@link ValidationException} on the first violation.
 */
public final class FieldValidator {

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");

    private FieldValidator() {
    }

    /**
     * Require a non-blank string no longer than {@code maxLength}
     */
    public static String requireText(String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, field + " is required and cannot be empty");
        }
        if (value.length() > maxLength) {
            throw new ValidationException(field, field + " must not exceed " + maxLength + " characters");
        }
        return value;
    }

    /**
     * Require a non-blank string of any length
     */
    public static String requireText(String field, String value) {
        return requireText(field, value, Integer.MAX_VALUE);
    }

    public static String requireEmail(String field, String value) {
        if (value == null || !EMAIL_PATTERN.matcher(value).matches()) {
            throw new ValidationException(field, "Invalid email format: " + value);
        }
        return value;
    }

    /**
     * Require a finite number within [min, max]
     */
    public static Double requireRange(String field, Double value, double min, double max) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            throw new ValidationException(field, field + " must be a number");
        }
        if (value < min || value > max) {
            throw new ValidationException(field, field + " must be between " + min + " and " + max);
        }
        return value;
    }

    public static BigDecimal requirePositive(String field, BigDecimal value) {
        if (value == null) {
            throw new ValidationException(field, field + " must be a number");
        }
        if (value.signum() <= 0) {
            throw new ValidationException(field, field + " must be a positive value");
        }
        return value;
    }

    public static Integer requireIntRange(String field, Integer value, int min, int max) {
        if (value == null) {
            throw new ValidationException(field, field + " must be an integer");
        }
        if (value < min || value > max) {
            throw new ValidationException(field, field + " must be between " + min + " and " + max);
        }
        return value;
    }

    public static String requireReference(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, field + " is required");
        }
        return value;
    }
}
