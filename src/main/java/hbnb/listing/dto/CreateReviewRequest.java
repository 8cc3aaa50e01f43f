package hbnb.listing.dto;

import hbnb.listing.service.command.ReviewCommand;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Create review request; the author is the caller
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Create review request")
public class CreateReviewRequest {
    @NotBlank(message = "Review text cannot be blank")
    @Schema(description = "Review text", example = "Great stay", required = true)
    private String text;

    @NotNull(message = "Rating cannot be null")
    @Min(value = 1, message = "Rating must be between 1 and 5")
    @Max(value = 5, message = "Rating must be between 1 and 5")
    @Schema(description = "Rating (1-5)", example = "5", required = true)
    private Integer rating;

    @NotBlank(message = "Place ID cannot be blank")
    @Schema(description = "Reviewed place ID", required = true)
    private String placeId;

    public ReviewCommand toCommand(String userId) {
        return ReviewCommand.builder()
                .text(text)
                .rating(rating)
                .userId(userId)
                .placeId(placeId)
                .build();
    }
}
