package hbnb.listing.controller;

import hbnb.listing.domain.Amenity;
import hbnb.listing.dto.AmenityRequest;
import hbnb.listing.dto.AmenityResponse;
import hbnb.listing.dto.ApiResponse;
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
 * REST Controller for Amenity management. Writes are administrator-only.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/amenities")
@Validated
@Tag(name = "Amenity Management", description = "APIs for amenity operations")
public class AmenityController {

    @Autowired
    private ListingFacade listingFacade;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create an amenity", description = "Administrator only")
    public ApiResponse<AmenityResponse> createAmenity(
            @Valid @RequestBody AmenityRequest request,
            @Parameter(hidden = true) @RequestAttribute(CallerIdentity.REQUEST_ATTRIBUTE) CallerIdentity caller) {
        caller.requireAdministrator();
        log.info("Creating amenity: name={}", request.getName());
        Amenity amenity = listingFacade.createAmenity(request.toCommand());
        return ApiResponse.created("Amenity created successfully", AmenityResponse.fromAmenity(amenity));
    }

    @GetMapping
    @Operation(summary = "List amenities")
    public ApiResponse<List<AmenityResponse>> listAmenities() {
        return ApiResponse.success(listingFacade.listAmenities().stream()
                .map(AmenityResponse::fromAmenity)
                .toList());
    }

    @GetMapping("/{amenityId}")
    @Operation(summary = "Get amenity by ID")
    public ApiResponse<AmenityResponse> getAmenity(
            @Parameter(description = "Amenity ID", required = true) @PathVariable String amenityId) {
        return ApiResponse.success(AmenityResponse.fromAmenity(listingFacade.getAmenity(amenityId)));
    }

    @PutMapping("/{amenityId}")
    @Operation(summary = "Update an amenity", description = "Administrator only")
    public ApiResponse<AmenityResponse> updateAmenity(
            @Parameter(description = "Amenity ID", required = true) @PathVariable String amenityId,
            @Valid @RequestBody AmenityRequest request,
            @Parameter(hidden = true) @RequestAttribute(CallerIdentity.REQUEST_ATTRIBUTE) CallerIdentity caller) {
        caller.requireAdministrator();
        log.info("Updating amenity: amenityId={}", amenityId);
        Amenity amenity = listingFacade.updateAmenity(amenityId, request.toCommand());
        return ApiResponse.success("Amenity updated successfully", AmenityResponse.fromAmenity(amenity));
    }
}
