package hbnb.listing.repository;

import hbnb.listing.domain.BaseEntity;
import hbnb.listing.exception.DuplicateIdException;
import hbnb.listing.exception.EntityNotFoundException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Process-memory repository backed by an insertion-ordered map.
 * Stored instances never leave the repository: every read returns a detached
 * copy, so changes made by a caller do not reach the store until they go
 * through {@link #update}.
 * Not thread-safe on its own; callers serialize access (see StoreLockService).
 *
 * @param <T> entity type
 */
@Slf4j
public class InMemoryRepository<T extends BaseEntity> implements Repository<T> {

    /**
     * Entity type name used in log lines and not-found messages
     */
    @Getter
    private final String entityType;

    private final Map<String, T> entities = new LinkedHashMap<>();

    private final Set<String> retiredIds = new HashSet<>();

    private final UnaryOperator<T> copier;

    /**
     * @param entityType name used in log lines and not-found messages
     * @param copier produces a detached copy of an entity
     */
    public InMemoryRepository(String entityType, UnaryOperator<T> copier) {
        this.entityType = entityType;
        this.copier = copier;
    }

    @Override
    public T add(T entity) {
        String id = entity.assignIdIfAbsent();
        if (entities.containsKey(id) || retiredIds.contains(id)) {
            throw new DuplicateIdException(entityType + " id already used: " + id);
        }
        entities.put(id, copier.apply(entity));
        log.debug("{} stored: id={}", entityType, id);
        return entity;
    }

    @Override
    public Optional<T> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entities.get(id)).map(copier);
    }

    @Override
    public List<T> list() {
        return entities.values().stream().map(copier).toList();
    }

    @Override
    public T update(String id, Consumer<T> changes) {
        T stored = id != null ? entities.get(id) : null;
        if (stored == null) {
            throw new EntityNotFoundException(entityType, id);
        }
        changes.accept(stored);
        stored.touch();
        log.debug("{} updated: id={}", entityType, id);
        return copier.apply(stored);
    }

    @Override
    public void delete(String id) {
        if (id == null || entities.remove(id) == null) {
            throw new EntityNotFoundException(entityType, id);
        }
        retiredIds.add(id);
        log.debug("{} deleted: id={}", entityType, id);
    }

    @Override
    public Optional<T> findFirst(Predicate<? super T> predicate) {
        return entities.values().stream().filter(predicate).findFirst().map(copier);
    }

    @Override
    public List<T> findAll(Predicate<? super T> predicate) {
        return entities.values().stream().filter(predicate).map(copier).toList();
    }

    @Override
    public boolean exists(String id) {
        return id != null && entities.containsKey(id);
    }

    @Override
    public int count() {
        return entities.size();
    }
}
