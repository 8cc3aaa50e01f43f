package hbnb.listing.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Identity and timestamps shared by every listing entity.
 * Two entities are equal when they carry the same id.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public abstract class BaseEntity {
    /**
     * Opaque identifier, assigned once when the entity is admitted to a repository
     */
    @EqualsAndHashCode.Include
    private String id;

    /**
     * Timestamp when the entity was created
     */
    private LocalDateTime createdAt;

    /**
     * Timestamp of the last successful mutation
     */
    private LocalDateTime updatedAt;

    protected BaseEntity() {
        LocalDateTime now = LocalDateTime.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    /**
     * Copy identity and timestamps from another instance
     */
    protected BaseEntity(BaseEntity source) {
        this.id = source.id;
        this.createdAt = source.createdAt;
        this.updatedAt = source.updatedAt;
    }

    /**
     * Assign a fresh random id unless one is already set
     *
     * @return the entity id
     */
    public String assignIdIfAbsent() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        return id;
    }

    /**
     * Refresh the update timestamp
     */
    public void touch() {
        updatedAt = LocalDateTime.now();
    }
}
