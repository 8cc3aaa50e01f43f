package hbnb.listing.dto;

import hbnb.listing.domain.Amenity;
import hbnb.listing.domain.Place;
import hbnb.listing.domain.User;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Place response DTO with owner and amenities expanded
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Place response")
public class PlaceResponse {

    @Schema(description = "Place ID")
    private String id;

    @Schema(description = "Title", example = "Cozy loft near the river")
    private String title;

    @Schema(description = "Description")
    private String description;

    @Schema(description = "Price per night", example = "120.00")
    private BigDecimal price;

    @Schema(description = "Latitude", example = "48.8566")
    private Double latitude;

    @Schema(description = "Longitude", example = "2.3522")
    private Double longitude;

    @Schema(description = "Owner user ID")
    private String ownerId;

    @Schema(description = "Owner details")
    private OwnerSummary owner;

    @Schema(description = "Attached amenities")
    private List<AmenityResponse> amenities;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * Convert a Place with its resolved owner and amenities
     */
    public static PlaceResponse fromPlace(Place place, User owner, List<Amenity> amenities) {
        return PlaceResponse.builder()
                .id(place.getId())
                .title(place.getTitle())
                .description(place.getDescription())
                .price(place.getPrice())
                .latitude(place.getLatitude())
                .longitude(place.getLongitude())
                .ownerId(place.getOwnerId())
                .owner(owner != null ? OwnerSummary.fromUser(owner) : null)
                .amenities(amenities.stream().map(AmenityResponse::fromAmenity).toList())
                .createdAt(place.getCreatedAt())
                .updatedAt(place.getUpdatedAt())
                .build();
    }
}
