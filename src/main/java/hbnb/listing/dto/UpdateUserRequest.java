package hbnb.listing.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Update user request. Email and administrator flag are optional and keep their
 * current values when omitted; changing either requires administrator rights.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Update user request")
public class UpdateUserRequest {
    @NotBlank(message = "First name cannot be blank")
    @Size(max = 50, message = "First name must not exceed 50 characters")
    @Schema(description = "First name", example = "Jane")
    private String firstName;

    @NotBlank(message = "Last name cannot be blank")
    @Size(max = 50, message = "Last name must not exceed 50 characters")
    @Schema(description = "Last name", example = "Doe")
    private String lastName;

    @Email(message = "Invalid email format")
    @Schema(description = "Email address (administrators only)", example = "jane@example.com")
    private String email;

    @Schema(description = "Administrator flag (administrators only)", example = "false")
    private Boolean administrator;

    @Size(min = 8, max = 72, message = "Password must be between 8 and 72 characters")
    @Schema(description = "New password (optional)")
    @ToString.Exclude
    private String password;
}
