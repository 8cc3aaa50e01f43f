package hbnb.listing.dto;

import hbnb.listing.service.command.AmenityCommand;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Create or update amenity request")
public class AmenityRequest {
    @NotBlank(message = "Amenity name cannot be blank")
    @Size(max = 50, message = "Amenity name must not exceed 50 characters")
    @Schema(description = "Amenity name", example = "Wi-Fi")
    private String name;

    public AmenityCommand toCommand() {
        return AmenityCommand.builder().name(name).build();
    }
}
