package hbnb.listing.dto;

import hbnb.listing.service.command.PlaceCommand;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Create or full-replace update place request. The owner is always the caller
 * on create and never changes on update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Create or update place request")
public class PlaceRequest {

    @NotBlank(message = "Title cannot be blank")
    @Size(max = 100, message = "Title must not exceed 100 characters")
    @Schema(description = "Title", example = "Cozy loft near the river", required = true)
    private String title;

    @Schema(description = "Description", example = "Two rooms, sunny balcony")
    private String description;

    @NotNull(message = "Price cannot be null")
    @DecimalMin(value = "0.0", inclusive = false, message = "Price must be a positive value")
    @Schema(description = "Price per night", example = "120.00", required = true)
    private BigDecimal price;

    @NotNull(message = "Latitude cannot be null")
    @DecimalMin(value = "-90.0", message = "Latitude must be between -90 and 90")
    @DecimalMax(value = "90.0", message = "Latitude must be between -90 and 90")
    @Schema(description = "Latitude", example = "48.8566", required = true)
    private Double latitude;

    @NotNull(message = "Longitude cannot be null")
    @DecimalMin(value = "-180.0", message = "Longitude must be between -180 and 180")
    @DecimalMax(value = "180.0", message = "Longitude must be between -180 and 180")
    @Schema(description = "Longitude", example = "2.3522", required = true)
    private Double longitude;

    @Builder.Default
    @Schema(description = "Amenity IDs")
    private List<String> amenities = new ArrayList<>();

    public PlaceCommand toCommand(String ownerId) {
        return PlaceCommand.builder()
                .title(title)
                .description(description)
                .price(price)
                .latitude(latitude)
                .longitude(longitude)
                .ownerId(ownerId)
                .amenityIds(amenities)
                .build();
    }
}
