package hbnb.listing.exception;

import lombok.Getter;

/**
 * Field-level rule violation, raised before any state is committed
 */
@Getter
public class ValidationException extends BusinessException {

    /**
     * Name of the offending field
     */
    private final String field;

    public ValidationException(String field, String message) {
        super(ErrorKind.VALIDATION, message);
        this.field = field;
    }
}
