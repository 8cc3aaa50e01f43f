package hbnb.listing.controller;

import hbnb.listing.domain.Review;
import hbnb.listing.dto.ApiResponse;
import hbnb.listing.dto.CreateReviewRequest;
import hbnb.listing.dto.ReviewResponse;
import hbnb.listing.dto.UpdateReviewRequest;
import hbnb.listing.interceptor.CallerIdentity;
import hbnb.listing.service.ListingFacade;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST Controller for Review management
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/reviews")
@Validated
@Tag(name = "Review Management", description = "APIs for review operations")
public class ReviewController {

    @Autowired
    private ListingFacade listingFacade;

    /**
     * Review a place as the caller
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create a review",
            description = "Authenticated; owners cannot review their own place, one review per place")
    public ApiResponse<ReviewResponse> createReview(
            @Valid @RequestBody CreateReviewRequest request,
            @Parameter(hidden = true) @RequestAttribute(CallerIdentity.REQUEST_ATTRIBUTE) CallerIdentity caller) {
        String userId = caller.requireUserId();
        log.info("Creating review: userId={}, placeId={}", userId, request.getPlaceId());
        Review review = listingFacade.submitGuestReview(request.toCommand(userId));
        return ApiResponse.created("Review created successfully", ReviewResponse.fromReview(review));
    }

    @GetMapping
    @Operation(summary = "List reviews")
    public ApiResponse<List<ReviewResponse>> listReviews() {
        return ApiResponse.success(listingFacade.listReviews().stream()
                .map(ReviewResponse::fromReview)
                .toList());
    }

    @GetMapping("/{reviewId}")
    @Operation(summary = "Get review by ID")
    public ApiResponse<ReviewResponse> getReview(
            @Parameter(description = "Review ID", required = true) @PathVariable String reviewId) {
        return ApiResponse.success(ReviewResponse.fromReview(listingFacade.getReview(reviewId)));
    }

    @PutMapping("/{reviewId}")
    @Operation(summary = "Update a review", description = "Author or administrator; text and rating only")
    public ApiResponse<ReviewResponse> updateReview(
            @Parameter(description = "Review ID", required = true) @PathVariable String reviewId,
            @Valid @RequestBody UpdateReviewRequest request,
            @Parameter(hidden = true) @RequestAttribute(CallerIdentity.REQUEST_ATTRIBUTE) CallerIdentity caller) {
        caller.requireUserId();
        Review updated = listingFacade.updateReview(reviewId, request.toCommand(),
                current -> caller.requireSelfOrAdministrator(current.getUserId()));
        return ApiResponse.success("Review updated successfully", ReviewResponse.fromReview(updated));
    }

    @DeleteMapping("/{reviewId}")
    @Operation(summary = "Delete a review", description = "Author or administrator")
    public ApiResponse<Void> deleteReview(
            @Parameter(description = "Review ID", required = true) @PathVariable String reviewId,
            @Parameter(hidden = true) @RequestAttribute(CallerIdentity.REQUEST_ATTRIBUTE) CallerIdentity caller) {
        caller.requireUserId();
        log.info("Deleting review: reviewId={}, by={}", reviewId, caller.getUserId());
        listingFacade.deleteReview(reviewId,
                current -> caller.requireSelfOrAdministrator(current.getUserId()));
        return ApiResponse.success("Review deleted successfully", null);
    }
}
