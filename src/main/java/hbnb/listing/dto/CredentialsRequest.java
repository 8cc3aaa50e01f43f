package hbnb.listing.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Credentials check request")
public class CredentialsRequest {
    @NotBlank(message = "Email cannot be blank")
    @Schema(description = "Email address", example = "jane@example.com")
    private String email;

    @NotBlank(message = "Password cannot be blank")
    @ToString.Exclude
    private String password;
}
