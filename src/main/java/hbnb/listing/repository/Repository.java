package hbnb.listing.repository;

import hbnb.listing.domain.BaseEntity;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Keyed store for one entity kind. Knows nothing about relationships between kinds.
 *
 * @param <T> entity type
 */
public interface Repository<T extends BaseEntity> {
    /**
     * Store a copy of an entity, assigning an id to the given instance if it has none
     *
     * @return the given entity, now carrying its id
     * @throws hbnb.listing.exception.DuplicateIdException if the id is live or retired
     */
    T add(T entity);

    /**
     * Find entity by id
     */
    Optional<T> get(String id);

    /**
     * Snapshot of all stored entities in insertion order
     */
    List<T> list();

    /**
     * Apply changes to the stored entity and refresh its update timestamp
     *
     * @return a copy of the updated entity
     * @throws hbnb.listing.exception.EntityNotFoundException if the id is absent
     */
    T update(String id, Consumer<T> changes);

    /**
     * Remove an entity; its id is never admitted again
     *
     * @throws hbnb.listing.exception.EntityNotFoundException if the id is absent
     */
    void delete(String id);

    /**
     * First entity matching the predicate, in insertion order
     */
    Optional<T> findFirst(Predicate<? super T> predicate);

    /**
     * All entities matching the predicate, in insertion order
     */
    List<T> findAll(Predicate<? super T> predicate);

    boolean exists(String id);

    int count();
}
