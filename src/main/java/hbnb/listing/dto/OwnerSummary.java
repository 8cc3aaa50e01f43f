package hbnb.listing.dto;

import hbnb.listing.domain.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Owner details embedded in an expanded place view
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OwnerSummary {
    private String id;
    private String firstName;
    private String lastName;
    private String email;

    public static OwnerSummary fromUser(User user) {
        return OwnerSummary.builder()
                .id(user.getId())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .email(user.getEmail())
                .build();
    }
}
