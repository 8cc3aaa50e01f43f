package hbnb.listing.domain;

import lombok.Getter;
import lombok.ToString;

/**
 * User entity representing a guest or host account
 */
@Getter
@ToString
public class User extends BaseEntity {

    public static final int NAME_MAX_LENGTH = 50;

    private String firstName;

    private String lastName;

    /**
     * Email address (unique across live users)
     */
    private String email;

    private boolean administrator;

    /**
     * BCrypt hash of the password, null when the account has no credentials
     */
    @ToString.Exclude
    private String passwordHash;

    public User(String firstName, String lastName, String email, boolean administrator) {
        setFirstName(firstName);
        setLastName(lastName);
        setEmail(email);
        setAdministrator(administrator);
    }

    private User(User source) {
        super(source);
        this.firstName = source.firstName;
        this.lastName = source.lastName;
        this.email = source.email;
        this.administrator = source.administrator;
        this.passwordHash = source.passwordHash;
    }

    /**
     * Detached copy, credentials included
     */
    public User copy() {
        return new User(this);
    }

    public void setFirstName(String firstName) {
        this.firstName = FieldValidator.requireText("firstName", firstName, NAME_MAX_LENGTH);
    }

    public void setLastName(String lastName) {
        this.lastName = FieldValidator.requireText("lastName", lastName, NAME_MAX_LENGTH);
    }

    public void setEmail(String email) {
        this.email = FieldValidator.requireEmail("email", email);
    }

    public void setAdministrator(boolean administrator) {
        this.administrator = administrator;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public boolean hasCredentials() {
        return passwordHash != null;
    }
}
