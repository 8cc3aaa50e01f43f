package hbnb.listing.service.command;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Complete set of place fields for create and full-replace update
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceCommand {
    private String title;

    private String description;

    private BigDecimal price;

    private Double latitude;

    private Double longitude;

    /**
     * Owning user id. Required on create; on update it must be null or the current owner.
     */
    private String ownerId;

    /**
     * Full amenity id list; null is treated as empty
     */
    @Builder.Default
    private List<String> amenityIds = new ArrayList<>();
}
