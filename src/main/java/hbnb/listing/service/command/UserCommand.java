package hbnb.listing.service.command;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Complete set of mutable user fields for create and full-replace update
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserCommand {
    private String firstName;

    private String lastName;

    private String email;

    private boolean administrator;

    /**
     * Plain-text password; null keeps the stored credentials on update
     */
    @ToString.Exclude
    private String password;
}
