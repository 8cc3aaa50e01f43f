package hbnb.listing.controller;

import hbnb.listing.domain.Amenity;
import hbnb.listing.domain.Place;
import hbnb.listing.dto.ApiResponse;
import hbnb.listing.dto.PlaceRequest;
import hbnb.listing.dto.PlaceResponse;
import hbnb.listing.dto.ReviewResponse;
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
 * REST Controller for Place management
 * Place views expand the owner and the attached amenities
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/places")
@Validated
@Tag(name = "Place Management", description = "APIs for rental listings")
public class PlaceController {

    @Autowired
    private ListingFacade listingFacade;

    /**
     * Create a place owned by the caller
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create a place", description = "Authenticated; the caller becomes the owner")
    public ApiResponse<PlaceResponse> createPlace(
            @Valid @RequestBody PlaceRequest request,
            @Parameter(hidden = true) @RequestAttribute(CallerIdentity.REQUEST_ATTRIBUTE) CallerIdentity caller) {
        String ownerId = caller.requireUserId();
        log.info("Creating place: ownerId={}, title={}", ownerId, request.getTitle());
        Place place = listingFacade.createPlace(request.toCommand(ownerId));
        return ApiResponse.created("Place created successfully", toResponse(place));
    }

    @GetMapping
    @Operation(summary = "List places")
    public ApiResponse<List<PlaceResponse>> listPlaces() {
        return ApiResponse.success(listingFacade.listPlaces().stream()
                .map(this::toResponse)
                .toList());
    }

    @GetMapping("/{placeId}")
    @Operation(summary = "Get place by ID")
    public ApiResponse<PlaceResponse> getPlace(
            @Parameter(description = "Place ID", required = true) @PathVariable String placeId) {
        return ApiResponse.success(toResponse(listingFacade.getPlace(placeId)));
    }

    /**
     * Full-replace update of a place by its owner or an administrator
     */
    @PutMapping("/{placeId}")
    @Operation(summary = "Update a place", description = "Owner or administrator; the owner never changes")
    public ApiResponse<PlaceResponse> updatePlace(
            @Parameter(description = "Place ID", required = true) @PathVariable String placeId,
            @Valid @RequestBody PlaceRequest request,
            @Parameter(hidden = true) @RequestAttribute(CallerIdentity.REQUEST_ATTRIBUTE) CallerIdentity caller) {
        caller.requireUserId();
        log.info("Updating place: placeId={}, by={}", placeId, caller.getUserId());
        Place updated = listingFacade.updatePlace(placeId, request.toCommand(null),
                current -> caller.requireSelfOrAdministrator(current.getOwnerId()));
        return ApiResponse.success("Place updated successfully", toResponse(updated));
    }

    @PostMapping("/{placeId}/amenities/{amenityId}")
    @Operation(summary = "Attach an amenity to a place", description = "Owner or administrator")
    public ApiResponse<PlaceResponse> addAmenity(
            @Parameter(description = "Place ID", required = true) @PathVariable String placeId,
            @Parameter(description = "Amenity ID", required = true) @PathVariable String amenityId,
            @Parameter(hidden = true) @RequestAttribute(CallerIdentity.REQUEST_ATTRIBUTE) CallerIdentity caller) {
        caller.requireUserId();
        log.info("Attaching amenity: placeId={}, amenityId={}, by={}", placeId, amenityId, caller.getUserId());
        Place updated = listingFacade.addAmenityToPlace(placeId, amenityId,
                current -> caller.requireSelfOrAdministrator(current.getOwnerId()));
        return ApiResponse.success("Amenity added to place successfully", toResponse(updated));
    }

    @DeleteMapping("/{placeId}/amenities/{amenityId}")
    @Operation(summary = "Detach an amenity from a place", description = "Owner or administrator")
    public ApiResponse<PlaceResponse> removeAmenity(
            @Parameter(description = "Place ID", required = true) @PathVariable String placeId,
            @Parameter(description = "Amenity ID", required = true) @PathVariable String amenityId,
            @Parameter(hidden = true) @RequestAttribute(CallerIdentity.REQUEST_ATTRIBUTE) CallerIdentity caller) {
        caller.requireUserId();
        log.info("Detaching amenity: placeId={}, amenityId={}, by={}", placeId, amenityId, caller.getUserId());
        Place updated = listingFacade.removeAmenityFromPlace(placeId, amenityId,
                current -> caller.requireSelfOrAdministrator(current.getOwnerId()));
        return ApiResponse.success("Amenity removed from place successfully", toResponse(updated));
    }

    @GetMapping("/{placeId}/reviews")
    @Operation(summary = "List reviews of a place")
    public ApiResponse<List<ReviewResponse>> listPlaceReviews(
            @Parameter(description = "Place ID", required = true) @PathVariable String placeId) {
        return ApiResponse.success(listingFacade.listReviewsByPlace(placeId).stream()
                .map(ReviewResponse::fromReview)
                .toList());
    }

    private PlaceResponse toResponse(Place place) {
        List<Amenity> amenities = place.getAmenityIds().stream()
                .map(listingFacade::getAmenity)
                .toList();
        return PlaceResponse.fromPlace(place, listingFacade.findUser(place.getOwnerId()).orElse(null), amenities);
    }
}
