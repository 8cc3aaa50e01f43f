package hbnb.listing.service.command;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Review fields for create and update. On update only text and rating change;
 * userId and placeId must be null or match the stored references.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewCommand {
    private String text;

    private Integer rating;

    private String userId;

    private String placeId;
}
