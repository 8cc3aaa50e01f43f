package hbnb.listing.exception;

/**
 * Exception thrown when an identified caller may not act on the target entity
 */
public class ForbiddenActionException extends RuntimeException {
    public ForbiddenActionException(String message) {
        super(message);
    }
}
