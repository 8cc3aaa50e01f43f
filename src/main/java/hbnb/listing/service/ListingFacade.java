package hbnb.listing.service;

import hbnb.listing.domain.Amenity;
import hbnb.listing.domain.FieldValidator;
import hbnb.listing.domain.Place;
import hbnb.listing.domain.Review;
import hbnb.listing.domain.User;
import hbnb.listing.exception.ConflictException;
import hbnb.listing.exception.EntityNotFoundException;
import hbnb.listing.exception.ValidationException;
import hbnb.listing.repository.InMemoryRepository;
import hbnb.listing.repository.Repository;
import hbnb.listing.service.command.AmenityCommand;
import hbnb.listing.service.command.PlaceCommand;
import hbnb.listing.service.command.ReviewCommand;
import hbnb.listing.service.command.UserCommand;
import hbnb.listing.service.lock.StoreLockService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Single entry point for listing business operations.
 * Owns one repository per entity kind, resolves cross-entity references before
 * any model is built, and runs every call under the store lock.
 * Returned entities are detached copies; changing one has no effect on the store.
 * Failures are reported only as ValidationException, EntityNotFoundException
 * or ConflictException.
 */
@Service
@Slf4j
public class ListingFacade {

    static final String USER = "User";
    static final String PLACE = "Place";
    static final String AMENITY = "Amenity";
    static final String REVIEW = "Review";

    /**
     * BCrypt only looks at the first 72 bytes
     */
    private static final int PASSWORD_MAX_LENGTH = 72;

    private final Repository<User> userRepository = new InMemoryRepository<>(USER, User::copy);
    private final Repository<Place> placeRepository = new InMemoryRepository<>(PLACE, Place::copy);
    private final Repository<Amenity> amenityRepository = new InMemoryRepository<>(AMENITY, Amenity::copy);
    private final Repository<Review> reviewRepository = new InMemoryRepository<>(REVIEW, Review::copy);

    private final BCryptPasswordEncoder passwordEncoder = new BCryptPasswordEncoder();

    private final StoreLockService lockService;

    private final MeterRegistry meterRegistry;

    @Autowired
    public ListingFacade(StoreLockService lockService, MeterRegistry meterRegistry) {
        this.lockService = lockService;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Standalone facade with its own lock and an in-memory meter registry
     */
    public ListingFacade() {
        this(new StoreLockService(), new SimpleMeterRegistry());
    }

    // ============= USERS =============

    /**
     * Create a new user
     *
     * @throws ConflictException if the email belongs to a live user
     */
    public User createUser(UserCommand command) {
        return lockService.executeWithWriteLock("createUser", () -> {
            ensureEmailAvailable(command.getEmail(), null);

            User user = new User(command.getFirstName(), command.getLastName(),
                    command.getEmail(), command.isAdministrator());
            if (command.getPassword() != null) {
                user.setPasswordHash(hashPassword(command.getPassword()));
            }

            userRepository.add(user);
            recordMutation(USER, "create");
            log.info("User created: userId={}, email={}, administrator={}",
                    user.getId(), user.getEmail(), user.isAdministrator());
            return user;
        });
    }

    /**
     * Get user by ID
     *
     * @throws EntityNotFoundException if no such user
     */
    public User getUser(String userId) {
        return lockService.executeWithReadLock("getUser", () -> requireUser(userId));
    }

    /**
     * Find user by ID without failing, for identity resolution and expanded views
     */
    public Optional<User> findUser(String userId) {
        return lockService.executeWithReadLock("findUser", () -> userRepository.get(userId));
    }

    public Optional<User> findUserByEmail(String email) {
        return lockService.executeWithReadLock("findUserByEmail", () -> lookupByEmail(email));
    }

    public List<User> listUsers() {
        return lockService.executeWithReadLock("listUsers", userRepository::list);
    }

    /**
     * Full-replace update of a user's names, email and administrator flag.
     * A null password keeps the stored credentials.
     *
     * @throws ConflictException if the new email belongs to another user
     */
    public User updateUser(String userId, UserCommand command) {
        return lockService.executeWithWriteLock("updateUser", () -> {
            requireUser(userId);
            ensureEmailAvailable(command.getEmail(), userId);

            User candidate = new User(command.getFirstName(), command.getLastName(),
                    command.getEmail(), command.isAdministrator());
            String newHash = command.getPassword() != null ? hashPassword(command.getPassword()) : null;

            User updated = userRepository.update(userId, user -> {
                user.setFirstName(candidate.getFirstName());
                user.setLastName(candidate.getLastName());
                user.setEmail(candidate.getEmail());
                user.setAdministrator(candidate.isAdministrator());
                if (newHash != null) {
                    user.setPasswordHash(newHash);
                }
            });
            recordMutation(USER, "update");
            log.info("User updated: userId={}", userId);
            return updated;
        });
    }

    /**
     * Grant administrator rights to the user with the given email
     *
     * @throws EntityNotFoundException if no user has that email
     */
    public User promoteToAdministrator(String email) {
        return lockService.executeWithWriteLock("promoteToAdministrator", () -> {
            User user = lookupByEmail(email)
                    .orElseThrow(() -> new EntityNotFoundException(USER, email));
            if (user.isAdministrator()) {
                return user;
            }
            User promoted = userRepository.update(user.getId(), u -> u.setAdministrator(true));
            recordMutation(USER, "promote");
            log.info("User promoted to administrator: userId={}", promoted.getId());
            return promoted;
        });
    }

    /**
     * Check an email/password pair
     *
     * @return the user when the password matches its stored hash, empty otherwise
     */
    public Optional<User> verifyCredentials(String email, String password) {
        return lockService.executeWithReadLock("verifyCredentials", () -> lookupByEmail(email)
                .filter(User::hasCredentials)
                .filter(user -> password != null && passwordEncoder.matches(password, user.getPasswordHash())));
    }

    // ============= AMENITIES =============

    public Amenity createAmenity(AmenityCommand command) {
        return lockService.executeWithWriteLock("createAmenity", () -> {
            Amenity amenity = amenityRepository.add(new Amenity(command.getName()));
            recordMutation(AMENITY, "create");
            log.info("Amenity created: amenityId={}, name={}", amenity.getId(), amenity.getName());
            return amenity;
        });
    }

    public Amenity getAmenity(String amenityId) {
        return lockService.executeWithReadLock("getAmenity", () -> requireAmenity(amenityId));
    }

    public List<Amenity> listAmenities() {
        return lockService.executeWithReadLock("listAmenities", amenityRepository::list);
    }

    public Amenity updateAmenity(String amenityId, AmenityCommand command) {
        return lockService.executeWithWriteLock("updateAmenity", () -> {
            requireAmenity(amenityId);
            Amenity candidate = new Amenity(command.getName());

            Amenity updated = amenityRepository.update(amenityId, a -> a.setName(candidate.getName()));
            recordMutation(AMENITY, "update");
            log.info("Amenity updated: amenityId={}", amenityId);
            return updated;
        });
    }

    // ============= PLACES =============

    /**
     * Create a new place owned by an existing user
     *
     * @throws EntityNotFoundException if the owner or any amenity does not exist
     */
    public Place createPlace(PlaceCommand command) {
        return lockService.executeWithWriteLock("createPlace", () -> {
            User owner = requireUser(FieldValidator.requireReference("ownerId", command.getOwnerId()));
            List<String> amenityIds = resolveAmenities(command.getAmenityIds());

            Place place = new Place(command.getTitle(), command.getDescription(), command.getPrice(),
                    command.getLatitude(), command.getLongitude(), owner.getId());
            place.replaceAmenities(amenityIds);

            placeRepository.add(place);
            recordMutation(PLACE, "create");
            log.info("Place created: placeId={}, ownerId={}, price={}, amenities={}",
                    place.getId(), owner.getId(), place.getPrice(), amenityIds.size());
            return place;
        });
    }

    public Place getPlace(String placeId) {
        return lockService.executeWithReadLock("getPlace", () -> requirePlace(placeId));
    }

    public Optional<Place> findPlace(String placeId) {
        return lockService.executeWithReadLock("findPlace", () -> placeRepository.get(placeId));
    }

    public List<Place> listPlaces() {
        return lockService.executeWithReadLock("listPlaces", placeRepository::list);
    }

    /**
     * List places owned by a user
     *
     * @throws EntityNotFoundException if the user does not exist
     */
    public List<Place> listPlacesByOwner(String ownerId) {
        return lockService.executeWithReadLock("listPlacesByOwner", () -> {
            requireUser(ownerId);
            return placeRepository.findAll(place -> place.getOwnerId().equals(ownerId));
        });
    }

    /**
     * Full-replace update of a place. The owner cannot change; amenities are
     * re-resolved. Nothing is written unless every check passes.
     */
    public Place updatePlace(String placeId, PlaceCommand command) {
        return updatePlace(placeId, command, place -> { });
    }

    /**
     * Full-replace update of a place, guarded by a caller-supplied check.
     * The precondition sees the current place under the same write lock as
     * the update; whatever it throws aborts the call before anything changes.
     */
    public Place updatePlace(String placeId, PlaceCommand command, Consumer<? super Place> precondition) {
        return lockService.executeWithWriteLock("updatePlace", () -> {
            Place current = requirePlace(placeId);
            precondition.accept(current);
            ensureUnchanged("ownerId", command.getOwnerId(), current.getOwnerId(), "Place owner cannot be changed");
            List<String> amenityIds = resolveAmenities(command.getAmenityIds());

            Place candidate = new Place(command.getTitle(), command.getDescription(), command.getPrice(),
                    command.getLatitude(), command.getLongitude(), current.getOwnerId());
            candidate.replaceAmenities(amenityIds);

            Place updated = placeRepository.update(placeId, place -> {
                place.setTitle(candidate.getTitle());
                place.setDescription(candidate.getDescription());
                place.setPrice(candidate.getPrice());
                place.setLatitude(candidate.getLatitude());
                place.setLongitude(candidate.getLongitude());
                place.replaceAmenities(candidate.getAmenityIds());
            });
            recordMutation(PLACE, "update");
            log.info("Place updated: placeId={}", placeId);
            return updated;
        });
    }

    /**
     * Attach an existing amenity to a place
     *
     * @throws EntityNotFoundException if the place or the amenity does not exist
     * @throws ValidationException if the amenity is already attached
     */
    public Place addAmenityToPlace(String placeId, String amenityId, Consumer<? super Place> precondition) {
        return lockService.executeWithWriteLock("addAmenityToPlace", () -> {
            Place current = requirePlace(placeId);
            precondition.accept(current);
            Amenity amenity = requireAmenity(amenityId);
            if (current.hasAmenity(amenity.getId())) {
                throw new ValidationException("amenities", "Amenity already attached to this place: " + amenityId);
            }

            Place updated = placeRepository.update(placeId, place -> place.addAmenity(amenity.getId()));
            recordMutation(PLACE, "addAmenity");
            log.info("Amenity attached: placeId={}, amenityId={}", placeId, amenityId);
            return updated;
        });
    }

    /**
     * Detach an amenity from a place
     *
     * @throws EntityNotFoundException if the place or the amenity does not exist
     * @throws ValidationException if the amenity is not attached
     */
    public Place removeAmenityFromPlace(String placeId, String amenityId, Consumer<? super Place> precondition) {
        return lockService.executeWithWriteLock("removeAmenityFromPlace", () -> {
            Place current = requirePlace(placeId);
            precondition.accept(current);
            Amenity amenity = requireAmenity(amenityId);
            if (!current.hasAmenity(amenity.getId())) {
                throw new ValidationException("amenities", "Amenity not attached to this place: " + amenityId);
            }

            Place updated = placeRepository.update(placeId, place -> place.removeAmenity(amenity.getId()));
            recordMutation(PLACE, "removeAmenity");
            log.info("Amenity detached: placeId={}, amenityId={}", placeId, amenityId);
            return updated;
        });
    }

    // ============= REVIEWS =============

    /**
     * Create a review of an existing place by an existing user
     *
     * @throws EntityNotFoundException if the user or the place does not exist
     */
    public Review createReview(ReviewCommand command) {
        return lockService.executeWithWriteLock("createReview", () -> {
            User user = requireUser(FieldValidator.requireReference("userId", command.getUserId()));
            Place place = requirePlace(FieldValidator.requireReference("placeId", command.getPlaceId()));

            Review review = new Review(command.getText(), command.getRating(), user.getId(), place.getId());

            reviewRepository.add(review);
            recordMutation(REVIEW, "create");
            log.info("Review created: reviewId={}, userId={}, placeId={}, rating={}",
                    review.getId(), user.getId(), place.getId(), review.getRating());
            return review;
        });
    }

    /**
     * Create a review on behalf of a guest: hosts may not review their own
     * place and a user reviews a place at most once. The checks and the insert
     * run under one lock acquisition.
     *
     * @throws ValidationException if the user owns the place
     * @throws ConflictException if the user already reviewed the place
     */
    public Review submitGuestReview(ReviewCommand command) {
        return lockService.executeWithWriteLock("submitGuestReview", () -> {
            String userId = requireUser(FieldValidator.requireReference("userId", command.getUserId())).getId();
            Place place = requirePlace(FieldValidator.requireReference("placeId", command.getPlaceId()));

            if (place.getOwnerId().equals(userId)) {
                throw new ValidationException("placeId", "You cannot review your own place");
            }
            if (lookupReview(userId, place.getId()).isPresent()) {
                throw new ConflictException("You have already reviewed this place: " + place.getId());
            }
            return createReview(command);
        });
    }

    public Review getReview(String reviewId) {
        return lockService.executeWithReadLock("getReview", () -> requireReview(reviewId));
    }

    public List<Review> listReviews() {
        return lockService.executeWithReadLock("listReviews", reviewRepository::list);
    }

    /**
     * List reviews of a place
     *
     * @throws EntityNotFoundException if the place does not exist
     */
    public List<Review> listReviewsByPlace(String placeId) {
        return lockService.executeWithReadLock("listReviewsByPlace", () -> {
            requirePlace(placeId);
            return reviewRepository.findAll(review -> review.getPlaceId().equals(placeId));
        });
    }

    /**
     * List reviews written by a user
     *
     * @throws EntityNotFoundException if the user does not exist
     */
    public List<Review> listReviewsByUser(String userId) {
        return lockService.executeWithReadLock("listReviewsByUser", () -> {
            requireUser(userId);
            return reviewRepository.findAll(review -> review.getUserId().equals(userId));
        });
    }

    Optional<Review> findReviewByUserAndPlace(String userId, String placeId) {
        return lockService.executeWithReadLock("findReviewByUserAndPlace", () -> lookupReview(userId, placeId));
    }

    /**
     * Update text and rating of a review. Author and place are immutable.
     */
    public Review updateReview(String reviewId, ReviewCommand command) {
        return updateReview(reviewId, command, review -> { });
    }

    /**
     * Update a review after the precondition accepted its current state,
     * both under one write lock
     */
    public Review updateReview(String reviewId, ReviewCommand command, Consumer<? super Review> precondition) {
        return lockService.executeWithWriteLock("updateReview", () -> {
            Review current = requireReview(reviewId);
            precondition.accept(current);
            ensureUnchanged("userId", command.getUserId(), current.getUserId(), "Review author cannot be changed");
            ensureUnchanged("placeId", command.getPlaceId(), current.getPlaceId(), "Reviewed place cannot be changed");

            Review candidate = new Review(command.getText(), command.getRating(),
                    current.getUserId(), current.getPlaceId());

            Review updated = reviewRepository.update(reviewId, review -> {
                review.setText(candidate.getText());
                review.setRating(candidate.getRating());
            });
            recordMutation(REVIEW, "update");
            log.info("Review updated: reviewId={}, rating={}", reviewId, updated.getRating());
            return updated;
        });
    }

    /**
     * Delete a review
     *
     * @throws EntityNotFoundException if the review does not exist
     */
    public void deleteReview(String reviewId) {
        deleteReview(reviewId, review -> { });
    }

    /**
     * Delete a review after the precondition accepted it, both under one write lock
     */
    public void deleteReview(String reviewId, Consumer<? super Review> precondition) {
        lockService.executeWithWriteLock("deleteReview", () -> {
            precondition.accept(requireReview(reviewId));
            reviewRepository.delete(reviewId);
            recordMutation(REVIEW, "delete");
            log.info("Review deleted: reviewId={}", reviewId);
            return null;
        });
    }

    // ============= REFERENCE RESOLUTION =============

    private User requireUser(String userId) {
        return userRepository.get(userId).orElseThrow(() -> new EntityNotFoundException(USER, userId));
    }

    private Place requirePlace(String placeId) {
        return placeRepository.get(placeId).orElseThrow(() -> new EntityNotFoundException(PLACE, placeId));
    }

    private Amenity requireAmenity(String amenityId) {
        return amenityRepository.get(amenityId).orElseThrow(() -> new EntityNotFoundException(AMENITY, amenityId));
    }

    private Review requireReview(String reviewId) {
        return reviewRepository.get(reviewId).orElseThrow(() -> new EntityNotFoundException(REVIEW, reviewId));
    }

    /**
     * Resolve every amenity id, failing on the first one that does not exist
     */
    private List<String> resolveAmenities(List<String> amenityIds) {
        List<String> resolved = new ArrayList<>();
        if (amenityIds == null) {
            return resolved;
        }
        for (String amenityId : amenityIds) {
            resolved.add(requireAmenity(amenityId).getId());
        }
        return resolved;
    }

    private Optional<Review> lookupReview(String userId, String placeId) {
        return reviewRepository.findFirst(
                review -> review.getUserId().equals(userId) && review.getPlaceId().equals(placeId));
    }

    private Optional<User> lookupByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return userRepository.findFirst(user -> user.getEmail().equalsIgnoreCase(email));
    }

    private void ensureEmailAvailable(String email, String ownerUserId) {
        lookupByEmail(email)
                .filter(existing -> !existing.getId().equals(ownerUserId))
                .ifPresent(existing -> {
                    throw new ConflictException("Email already registered: " + email);
                });
    }

    private static void ensureUnchanged(String field, String requested, String current, String message) {
        if (requested != null && !Objects.equals(requested, current)) {
            throw new ValidationException(field, message);
        }
    }

    private String hashPassword(String password) {
        return passwordEncoder.encode(FieldValidator.requireText("password", password, PASSWORD_MAX_LENGTH));
    }

    private void recordMutation(String entity, String operation) {
        meterRegistry.counter("listing.entity.mutations", "entity", entity, "operation", operation).increment();
    }
}
