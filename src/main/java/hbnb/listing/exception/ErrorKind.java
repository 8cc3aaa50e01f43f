package hbnb.listing.exception;

/**
 * Kinds of business failure a facade call can report
 */
public enum ErrorKind {
    /**
     * A field value violates its constraint (HTTP 400)
     */
    VALIDATION,

    /**
     * A referenced id does not resolve to a live entity (HTTP 404)
     */
    NOT_FOUND,

    /**
     * A uniqueness constraint would be violated (HTTP 409)
     */
    CONFLICT
}
