package hbnb.listing.testutil;

import hbnb.listing.service.command.UserCommand;

import java.util.UUID;

/**
 * Fluent builder for user commands
 * Every builder gets a unique email so tests can share one facade
 */
public class UserTestBuilder {
    private String firstName = "Jane";
    private String lastName = "Doe";
    private String email = "jane." + UUID.randomUUID().toString().substring(0, 8) + "@example.com";
    private boolean administrator = false;
    private String password;

    public static UserTestBuilder guest() {
        return new UserTestBuilder();
    }

    public static UserTestBuilder host() {
        return new UserTestBuilder().firstName("Henry").lastName("Host")
                .email("host." + UUID.randomUUID().toString().substring(0, 8) + "@example.com");
    }

    public static UserTestBuilder admin() {
        return new UserTestBuilder().firstName("Ada").lastName("Admin")
                .email("admin." + UUID.randomUUID().toString().substring(0, 8) + "@example.com")
                .administrator(true);
    }

    public UserTestBuilder firstName(String firstName) {
        this.firstName = firstName;
        return this;
    }

    public UserTestBuilder lastName(String lastName) {
        this.lastName = lastName;
        return this;
    }

    public UserTestBuilder email(String email) {
        this.email = email;
        return this;
    }

    public UserTestBuilder administrator(boolean administrator) {
        this.administrator = administrator;
        return this;
    }

    public UserTestBuilder password(String password) {
        this.password = password;
        return this;
    }

    public UserCommand build() {
        return UserCommand.builder()
                .firstName(firstName)
                .lastName(lastName)
                .email(email)
                .administrator(administrator)
                .password(password)
                .build();
    }
}
