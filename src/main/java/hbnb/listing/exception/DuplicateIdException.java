package hbnb.listing.exception;

/**
 * Exception thrown when a repository is asked to admit an id it already holds
 * or has retired
 */
public class DuplicateIdException extends IllegalStateException {
    public DuplicateIdException(String message) {
        super(message);
    }
}
