package hbnb.listing.controller;

import hbnb.listing.dto.ApiResponse;
import hbnb.listing.dto.CredentialsRequest;
import hbnb.listing.dto.UserResponse;
import hbnb.listing.exception.UnauthenticatedException;
import hbnb.listing.service.ListingFacade;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

/**
 * Credentials check used by the gateway that issues tokens.
 * Token issuance itself happens outside this service.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/auth")
@Tag(name = "Authentication", description = "Credentials verification")
public class AuthController {

    @Autowired
    private ListingFacade listingFacade;

    @PostMapping("/verify")
    @Operation(summary = "Verify credentials", description = "Returns the user when email and password match")
    public ApiResponse<UserResponse> verify(@Valid @RequestBody CredentialsRequest request) {
        return listingFacade.verifyCredentials(request.getEmail(), request.getPassword())
                .map(user -> ApiResponse.success("Credentials verified", UserResponse.fromUser(user)))
                .orElseThrow(() -> {
                    log.warn("Credentials rejected: email={}", request.getEmail());
                    return new UnauthenticatedException("Invalid credentials");
                });
    }
}
