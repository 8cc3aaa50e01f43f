package hbnb.listing.exception;

import lombok.Getter;

/**
 * Base class of every failure the listing facade reports to its callers
 */
@Getter
public abstract class BusinessException extends RuntimeException {

    private final ErrorKind kind;

    protected BusinessException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
