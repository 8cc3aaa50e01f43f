package hbnb.listing.exception;

/**
 * Exception thrown when a uniqueness constraint would be violated
 */
public class ConflictException extends BusinessException {
    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}
