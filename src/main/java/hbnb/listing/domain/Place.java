package hbnb.listing.domain;

import hbnb.listing.exception.ValidationException;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Place entity representing a rental listing
 */
@Getter
@ToString
public class Place extends BaseEntity {

    public static final int TITLE_MAX_LENGTH = 100;

    private String title;

    /**
     * Free-form description, empty string when none was given
     */
    private String description;

    /**
     * Price per night (must be positive)
     */
    private BigDecimal price;

    /**
     * Latitude (-90.0 to 90.0)
     */
    private Double latitude;

    /**
     * Longitude (-180.0 to 180.0)
     */
    private Double longitude;

    /**
     * Owning user id, fixed at construction
     */
    private final String ownerId;

    /**
     * Referenced amenity ids in insertion order
     */
    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> amenityIds = new LinkedHashSet<>();

    public Place(String title, String description, BigDecimal price,
                 Double latitude, Double longitude, String ownerId) {
        setTitle(title);
        setDescription(description);
        setPrice(price);
        setLatitude(latitude);
        setLongitude(longitude);
        this.ownerId = FieldValidator.requireReference("ownerId", ownerId);
    }

    private Place(Place source) {
        super(source);
        this.title = source.title;
        this.description = source.description;
        this.price = source.price;
        this.latitude = source.latitude;
        this.longitude = source.longitude;
        this.ownerId = source.ownerId;
        this.amenityIds.addAll(source.amenityIds);
    }

    /**
     * Detached copy with its own amenity set
     */
    public Place copy() {
        return new Place(this);
    }

    public void setTitle(String title) {
        this.title = FieldValidator.requireText("title", title, TITLE_MAX_LENGTH);
    }

    public void setDescription(String description) {
        this.description = description != null ? description : "";
    }

    public void setPrice(BigDecimal price) {
        this.price = FieldValidator.requirePositive("price", price);
    }

    public void setLatitude(Double latitude) {
        this.latitude = FieldValidator.requireRange("latitude", latitude, -90.0, 90.0);
    }

    public void setLongitude(Double longitude) {
        this.longitude = FieldValidator.requireRange("longitude", longitude, -180.0, 180.0);
    }

    /**
     * Get the referenced amenity ids
     *
     * @return immutable copy in insertion order
     */
    public List<String> getAmenityIds() {
        return List.copyOf(amenityIds);
    }

    public boolean hasAmenity(String amenityId) {
        return amenityIds.contains(amenityId);
    }

    /**
     * Attach an amenity
     *
     * @throws ValidationException if the amenity is already attached
     */
    public void addAmenity(String amenityId) {
        FieldValidator.requireReference("amenities", amenityId);
        if (amenityIds.contains(amenityId)) {
            throw new ValidationException("amenities", "Amenity already attached to this place: " + amenityId);
        }
        amenityIds.add(amenityId);
    }

    /**
     * Detach an amenity
     *
     * @throws ValidationException if the amenity is not attached
     */
    public void removeAmenity(String amenityId) {
        if (!amenityIds.remove(amenityId)) {
            throw new ValidationException("amenities", "Amenity not attached to this place: " + amenityId);
        }
    }

    /**
     * Replace the whole amenity set. The new set is checked for blanks and
     * duplicates before the current one is touched.
     */
    public void replaceAmenities(Collection<String> newAmenityIds) {
        Set<String> candidate = new LinkedHashSet<>();
        if (newAmenityIds != null) {
            for (String amenityId : newAmenityIds) {
                FieldValidator.requireReference("amenities", amenityId);
                if (!candidate.add(amenityId)) {
                    throw new ValidationException("amenities", "Duplicate amenity id: " + amenityId);
                }
            }
        }
        amenityIds.clear();
        amenityIds.addAll(candidate);
    }
}
