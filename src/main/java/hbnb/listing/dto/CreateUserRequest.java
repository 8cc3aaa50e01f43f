package hbnb.listing.dto;

import hbnb.listing.service.command.UserCommand;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Create user request")
public class CreateUserRequest {
    @NotBlank(message = "First name cannot be blank")
    @Size(max = 50, message = "First name must not exceed 50 characters")
    @Schema(description = "First name", example = "Jane")
    private String firstName;

    @NotBlank(message = "Last name cannot be blank")
    @Size(max = 50, message = "Last name must not exceed 50 characters")
    @Schema(description = "Last name", example = "Doe")
    private String lastName;

    @NotBlank(message = "Email cannot be blank")
    @Email(message = "Invalid email format")
    @Schema(description = "Email address", example = "jane@example.com")
    private String email;

    @Size(min = 8, max = 72, message = "Password must be between 8 and 72 characters")
    @Schema(description = "Password (optional)", example = "securePassword123")
    @ToString.Exclude
    private String password;

    /**
     * Self-registration never grants administrator rights
     */
    public UserCommand toCommand() {
        return UserCommand.builder()
                .firstName(firstName)
                .lastName(lastName)
                .email(email)
                .password(password)
                .administrator(false)
                .build();
    }
}
