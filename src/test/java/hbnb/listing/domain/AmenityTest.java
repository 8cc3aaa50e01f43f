package hbnb.listing.domain;

import hbnb.listing.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class AmenityTest {

    @Test
    void validatesName() {
        assertThat(new Amenity("Wi-Fi").getName()).isEqualTo("Wi-Fi");
        assertThatThrownBy(() -> new Amenity("")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new Amenity("a".repeat(51))).isInstanceOf(ValidationException.class);
    }

    @Test
    void assignsIdOnlyOnce() {
        Amenity amenity = new Amenity("Parking");

        String first = amenity.assignIdIfAbsent();

        assertThat(first).isNotBlank();
        assertThat(amenity.assignIdIfAbsent()).isEqualTo(first);
    }
}
