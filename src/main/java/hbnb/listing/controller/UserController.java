package hbnb.listing.controller;

import hbnb.listing.domain.User;
import hbnb.listing.dto.ApiResponse;
import hbnb.listing.dto.CreateUserRequest;
import hbnb.listing.dto.ReviewResponse;
import hbnb.listing.dto.UpdateUserRequest;
import hbnb.listing.dto.UserResponse;
import hbnb.listing.exception.ForbiddenActionException;
import hbnb.listing.interceptor.CallerIdentity;
import hbnb.listing.service.ListingFacade;
import hbnb.listing.service.command.UserCommand;
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
 * REST Controller for User management
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/users")
@Validated
@Tag(name = "User Management", description = "APIs for user operations")
public class UserController {

    @Autowired
    private ListingFacade listingFacade;

    /**
     * Register a new user
     *
     * @param request the create user request
     * @return API response with created user details
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Register a new user", description = "Public registration; email must be unused")
    public ApiResponse<UserResponse> createUser(@Valid @RequestBody CreateUserRequest request) {
        log.info("Creating user: email={}", request.getEmail());
        User user = listingFacade.createUser(request.toCommand());
        return ApiResponse.created("User created successfully", UserResponse.fromUser(user));
    }

    @GetMapping
    @Operation(summary = "List users")
    public ApiResponse<List<UserResponse>> listUsers() {
        List<UserResponse> users = listingFacade.listUsers().stream()
                .map(UserResponse::fromUser)
                .toList();
        return ApiResponse.success(users);
    }

    @GetMapping("/{userId}")
    @Operation(summary = "Get user by ID")
    public ApiResponse<UserResponse> getUser(
            @Parameter(description = "User ID", required = true) @PathVariable String userId) {
        log.debug("Getting user: userId={}", userId);
        return ApiResponse.success(UserResponse.fromUser(listingFacade.getUser(userId)));
    }

    /**
     * Update a user. Users may change their own names; email, password and
     * administrator flag changes need administrator rights.
     */
    @PutMapping("/{userId}")
    @Operation(summary = "Update user", description = "Self or administrator; email, password and admin flag are administrator-only")
    public ApiResponse<UserResponse> updateUser(
            @Parameter(description = "User ID", required = true) @PathVariable String userId,
            @Valid @RequestBody UpdateUserRequest request,
            @Parameter(hidden = true) @RequestAttribute(CallerIdentity.REQUEST_ATTRIBUTE) CallerIdentity caller) {
        caller.requireSelfOrAdministrator(userId);
        User current = listingFacade.getUser(userId);

        String email = request.getEmail() != null ? request.getEmail() : current.getEmail();
        boolean administrator = request.getAdministrator() != null
                ? request.getAdministrator() : current.isAdministrator();

        if (!caller.isAdministrator()) {
            boolean emailChanged = !email.equalsIgnoreCase(current.getEmail());
            boolean flagChanged = administrator != current.isAdministrator();
            if (emailChanged || flagChanged || request.getPassword() != null) {
                throw new ForbiddenActionException("You cannot modify email, password or administrator flag");
            }
        }

        UserCommand command = UserCommand.builder()
                .firstName(request.getFirstName())
                .lastName(request.getLastName())
                .email(email)
                .administrator(administrator)
                .password(request.getPassword())
                .build();

        log.info("Updating user: userId={}, by={}", userId, caller.getUserId());
        User updated = listingFacade.updateUser(userId, command);
        return ApiResponse.success("User updated successfully", UserResponse.fromUser(updated));
    }

    @GetMapping("/{userId}/reviews")
    @Operation(summary = "List reviews written by a user")
    public ApiResponse<List<ReviewResponse>> listUserReviews(@PathVariable String userId) {
        List<ReviewResponse> reviews = listingFacade.listReviewsByUser(userId).stream()
                .map(ReviewResponse::fromReview)
                .toList();
        return ApiResponse.success(reviews);
    }
}
