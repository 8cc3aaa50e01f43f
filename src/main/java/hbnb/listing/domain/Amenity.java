package hbnb.listing.domain;

import lombok.Getter;
import lombok.ToString;

/**
 * Amenity entity (Wi-Fi, parking, ...). Places reference amenities but do not own them.
 */
@Getter
@ToString
public class Amenity extends BaseEntity {

    public static final int NAME_MAX_LENGTH = 50;

    private String name;

    public Amenity(String name) {
        setName(name);
    }

    private Amenity(Amenity source) {
        super(source);
        this.name = source.name;
    }

    public Amenity copy() {
        return new Amenity(this);
    }

    public void setName(String name) {
        this.name = FieldValidator.requireText("name", name, NAME_MAX_LENGTH);
    }
}
