package hbnb.listing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Application settings bound from the {@code listing} namespace in application.yml.
 * <pre>
 * listing:
 *   identity-header: X-User-Id
 *   lock:
 *     enabled: true
 *     fair: true
 *   admin:
 *     enabled: true
 *     email: admin@hbnb.io
 *     password: change-me
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "listing")
public class ListingProperties {

    /**
     * Request header carrying the caller's user id, set by the upstream gateway
     * after it has verified the caller
     */
    private String identityHeader = "X-User-Id";

    private Lock lock = new Lock();

    private Admin admin = new Admin();

    @Data
    public static class Lock {
        /**
         * Serialize facade calls; disable only for single-threaded tools
         */
        private boolean enabled = true;

        /**
         * Grant the store lock in arrival order
         */
        private boolean fair = true;
    }

    /**
     * Default administrator seeded at startup
     */
    @Data
    public static class Admin {
        private boolean enabled = true;
        private String firstName = "Admin";
        private String lastName = "User";
        private String email = "admin@hbnb.io";
        private String password;
    }
}
