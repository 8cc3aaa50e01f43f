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

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Update review request")
public class UpdateReviewRequest {
    @NotBlank(message = "Review text cannot be blank")
    @Schema(description = "Review text", example = "Even better the second time")
    private String text;

    @NotNull(message = "Rating cannot be null")
    @Min(value = 1, message = "Rating must be between 1 and 5")
    @Max(value = 5, message = "Rating must be between 1 and 5")
    @Schema(description = "Rating (1-5)", example = "4")
    private Integer rating;

    public ReviewCommand toCommand() {
        return ReviewCommand.builder().text(text).rating(rating).build();
    }
}
