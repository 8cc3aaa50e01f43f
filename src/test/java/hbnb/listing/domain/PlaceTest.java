package hbnb.listing.domain;

import hbnb.listing.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PlaceTest {

    private Place place() {
        return new Place("Loft", null, new BigDecimal("99.90"), 10.0, 20.0, "owner-1");
    }

    @Test
    void nullDescriptionIsStoredAsEmpty() {
        assertThat(place().getDescription()).isEmpty();
    }

    @Test
    void rejectsNonPositivePrice() {
        assertThatThrownBy(() -> new Place("Loft", "", BigDecimal.ZERO, 0.0, 0.0, "owner-1"))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("price");
        assertThatThrownBy(() -> new Place("Loft", "", new BigDecimal("-1"), 0.0, 0.0, "owner-1"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new Place("Loft", "", null, 0.0, 0.0, "owner-1"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("number");
    }

    @Test
    void coordinateBoundsAreInclusive() {
        assertThatCode(() -> new Place("Pole", "", BigDecimal.ONE, 90.0, -180.0, "owner-1"))
                .doesNotThrowAnyException();
        assertThatCode(() -> new Place("Pole", "", BigDecimal.ONE, -90.0, 180.0, "owner-1"))
                .doesNotThrowAnyException();
    }

    @Test
    void rejectsCoordinatesOutOfRange() {
        assertThatThrownBy(() -> new Place("Loft", "", BigDecimal.ONE, 90.01, 0.0, "owner-1"))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("latitude");
        assertThatThrownBy(() -> new Place("Loft", "", BigDecimal.ONE, 0.0, -180.5, "owner-1"))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("longitude");
        assertThatThrownBy(() -> new Place("Loft", "", BigDecimal.ONE, Double.NaN, 0.0, "owner-1"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectsTitleOverOneHundredCharacters() {
        assertThatThrownBy(() -> new Place("t".repeat(101), "", BigDecimal.ONE, 0.0, 0.0, "owner-1"))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("title");
    }

    @Test
    void requiresOwner() {
        assertThatThrownBy(() -> new Place("Loft", "", BigDecimal.ONE, 0.0, 0.0, " "))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("ownerId");
    }

    @Test
    void addAmenityRejectsDuplicates() {
        Place place = place();
        place.addAmenity("wifi");

        assertThatThrownBy(() -> place.addAmenity("wifi")).isInstanceOf(ValidationException.class);
        assertThat(place.getAmenityIds()).containsExactly("wifi");
    }

    @Test
    void removeAmenityRejectsUnknownId() {
        Place place = place();
        place.addAmenity("wifi");
        place.removeAmenity("wifi");

        assertThat(place.getAmenityIds()).isEmpty();
        assertThatThrownBy(() -> place.removeAmenity("wifi")).isInstanceOf(ValidationException.class);
    }

    @Test
    void replaceAmenitiesIsAllOrNothing() {
        Place place = place();
        place.replaceAmenities(List.of("wifi", "parking"));

        assertThatThrownBy(() -> place.replaceAmenities(List.of("pool", "pool")))
                .isInstanceOf(ValidationException.class);
        assertThat(place.getAmenityIds()).containsExactly("wifi", "parking");
    }

    @Test
    void amenityListIsReadOnly() {
        Place place = place();
        place.addAmenity("wifi");

        assertThatThrownBy(() -> place.getAmenityIds().add("pool"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
