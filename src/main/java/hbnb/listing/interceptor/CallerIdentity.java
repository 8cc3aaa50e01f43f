package hbnb.listing.interceptor;

import hbnb.listing.exception.ForbiddenActionException;
import hbnb.listing.exception.UnauthenticatedException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Already-verified identity of the caller of a request: anonymous, or a user id
 * with its administrator flag
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class CallerIdentity {

    /**
     * Request attribute under which the interceptor publishes the identity
     */
    public static final String REQUEST_ATTRIBUTE = "hbnb.listing.callerIdentity";

    private static final CallerIdentity ANONYMOUS = new CallerIdentity(null, false);

    private final String userId;

    private final boolean administrator;

    public static CallerIdentity anonymous() {
        return ANONYMOUS;
    }

    public static CallerIdentity of(String userId, boolean administrator) {
        return new CallerIdentity(Objects.requireNonNull(userId, "userId"), administrator);
    }

    public boolean isAnonymous() {
        return userId == null;
    }

    /**
     * @return the caller's user id
     * @throws UnauthenticatedException if the caller is anonymous
     */
    public String requireUserId() {
        if (isAnonymous()) {
            throw new UnauthenticatedException("Authentication required");
        }
        return userId;
    }

    /**
     * Allow the call only for the given user or an administrator
     */
    public void requireSelfOrAdministrator(String ownerUserId) {
        String callerId = requireUserId();
        if (!administrator && !callerId.equals(ownerUserId)) {
            throw new ForbiddenActionException("Unauthorized action");
        }
    }

    public void requireAdministrator() {
        requireUserId();
        if (!administrator) {
            throw new ForbiddenActionException("Admin privileges required");
        }
    }
}
