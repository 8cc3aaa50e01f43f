package hbnb.listing.exception;

/**
 * Exception thrown when an anonymous caller hits an endpoint that needs an identity
 */
public class UnauthenticatedException extends RuntimeException {
    public UnauthenticatedException(String message) {
        super(message);
    }
}
