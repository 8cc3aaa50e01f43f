package hbnb.listing.repository;

import hbnb.listing.domain.Amenity;
import hbnb.listing.exception.DuplicateIdException;
import hbnb.listing.exception.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InMemoryRepositoryTest {

    private InMemoryRepository<Amenity> repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryRepository<>("Amenity", Amenity::copy);
    }

    @Test
    @DisplayName("add assigns an id and list keeps insertion order")
    void testAddAndListInInsertionOrder() {
        Amenity wifi = repository.add(new Amenity("Wi-Fi"));
        Amenity pool = repository.add(new Amenity("Pool"));
        Amenity parking = repository.add(new Amenity("Parking"));

        assertThat(wifi.getId()).isNotBlank();
        assertThat(repository.list()).containsExactly(wifi, pool, parking);
        assertThat(repository.count()).isEqualTo(3);
        assertThat(repository.exists(pool.getId())).isTrue();
    }

    @Test
    @DisplayName("list returns a snapshot unaffected by later writes")
    void testListIsSnapshot() {
        repository.add(new Amenity("Wi-Fi"));
        List<Amenity> snapshot = repository.list();

        repository.add(new Amenity("Pool"));

        assertThat(snapshot).hasSize(1);
        assertThat(repository.list()).hasSize(2);
    }

    @Test
    @DisplayName("get of unknown or null id is empty")
    void testGetMissing() {
        assertThat(repository.get("missing")).isEmpty();
        assertThat(repository.get(null)).isEmpty();
        assertThat(repository.exists(null)).isFalse();
    }

    @Test
    @DisplayName("adding the same entity twice is rejected")
    void testDuplicateAdd() {
        Amenity wifi = repository.add(new Amenity("Wi-Fi"));

        assertThatThrownBy(() -> repository.add(wifi))
                .isInstanceOf(DuplicateIdException.class)
                .hasMessageContaining(wifi.getId());
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("update applies changes and refreshes updatedAt")
    void testUpdate() throws InterruptedException {
        Amenity wifi = repository.add(new Amenity("Wi-Fi"));
        Thread.sleep(5);

        Amenity updated = repository.update(wifi.getId(), a -> a.setName("Fast Wi-Fi"));

        assertThat(updated.getName()).isEqualTo("Fast Wi-Fi");
        assertThat(updated.getUpdatedAt()).isAfter(updated.getCreatedAt());
        assertThat(repository.get(wifi.getId())).contains(updated);
    }

    @Test
    @DisplayName("update of unknown id fails without calling the change function")
    void testUpdateMissing() {
        assertThatThrownBy(() -> repository.update("missing", a -> fail("must not run")))
                .isInstanceOf(EntityNotFoundException.class)
                .hasMessage("Amenity not found: missing");
    }

    @Test
    @DisplayName("delete removes the entity and retires its id")
    void testDeleteRetiresId() {
        Amenity wifi = repository.add(new Amenity("Wi-Fi"));

        repository.delete(wifi.getId());

        assertThat(repository.get(wifi.getId())).isEmpty();
        assertThatThrownBy(() -> repository.delete(wifi.getId()))
                .isInstanceOf(EntityNotFoundException.class);
        assertThatThrownBy(() -> repository.add(wifi))
                .isInstanceOf(DuplicateIdException.class);
    }

    @Test
    @DisplayName("entities handed out are detached from the stored ones")
    void testReadsAreDetached() {
        Amenity wifi = new Amenity("Wi-Fi");
        repository.add(wifi);

        wifi.setName("Changed after add");
        repository.get(wifi.getId()).orElseThrow().setName("Changed after get");
        repository.list().get(0).setName("Changed after list");
        repository.findFirst(a -> true).orElseThrow().setName("Changed after find");
        repository.update(wifi.getId(), a -> { }).setName("Changed after update");

        assertThat(repository.get(wifi.getId()).orElseThrow().getName()).isEqualTo("Wi-Fi");
    }

    @Test
    @DisplayName("findFirst and findAll filter live entities in order")
    void testFind() {
        repository.add(new Amenity("Pool"));
        Amenity wifi = repository.add(new Amenity("Wi-Fi"));
        Amenity wifi6 = repository.add(new Amenity("Wi-Fi 6"));

        assertThat(repository.findFirst(a -> a.getName().startsWith("Wi"))).contains(wifi);
        assertThat(repository.findAll(a -> a.getName().startsWith("Wi"))).containsExactly(wifi, wifi6);
        assertThat(repository.findFirst(a -> a.getName().equals("Sauna"))).isEmpty();
    }
}
